package com.nova.trigger.job;

import com.nova.domain.cache.service.FreshnessCacheDomainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 缓存清理作业：删除过期超过保留期的条目，默认关闭。
 */
@Slf4j
@Component
public class CacheMaintenanceJob {

    private final FreshnessCacheDomainService freshnessCacheDomainService;
    private final Clock clock;
    private final boolean enabled;
    private final Duration retention;

    public CacheMaintenanceJob(FreshnessCacheDomainService freshnessCacheDomainService,
                               Clock clock,
                               @Value("${nova.cache.maintenance.enabled:false}") boolean enabled,
                               @Value("${nova.cache.maintenance.retention:7d}") Duration retention) {
        this.freshnessCacheDomainService = freshnessCacheDomainService;
        this.clock = clock;
        this.enabled = enabled;
        this.retention = retention == null || retention.isNegative() ? Duration.ZERO : retention;
    }

    @Scheduled(
            fixedDelayString = "${nova.cache.maintenance.interval-ms:3600000}",
            scheduler = "daemonScheduler"
    )
    public void purgeExpired() {
        if (!enabled) {
            return;
        }
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(retention);
        int removed = freshnessCacheDomainService.purgeExpiredBefore(cutoff);
        log.info("Cache maintenance finished. cutoff={}, removed={}", cutoff, removed);
    }
}
