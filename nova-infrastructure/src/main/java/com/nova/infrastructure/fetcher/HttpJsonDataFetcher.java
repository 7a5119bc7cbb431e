package com.nova.infrastructure.fetcher;

import com.nova.domain.cache.adapter.gateway.IDataFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * 通过 HTTP GET 拉取 JSON 的领域数据源。
 * <p>
 * URL 模板可包含 {date} 占位符（yyyy-MM-dd，取自注入时钟）；非 2xx 与 IO 异常直接抛出，由缓存决定是否回退。
 * 超时由 RestClient 的请求工厂配置。
 * </p>
 */
@Slf4j
public class HttpJsonDataFetcher implements IDataFetcher {

    private final String name;
    private final RestClient restClient;
    private final String urlTemplate;
    private final Clock clock;

    public HttpJsonDataFetcher(String name, RestClient restClient, String urlTemplate, Clock clock) {
        this.name = name;
        this.restClient = restClient;
        this.urlTemplate = urlTemplate;
        this.clock = clock;
    }

    @Override
    public Object fetch() {
        String date = LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE);
        log.debug("Fetching domain data. source={}, url={}", name, urlTemplate);
        return restClient.get()
                .uri(urlTemplate, Map.of("date", date))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(Object.class);
    }
}
