package com.nova.infrastructure.source;

import com.nova.domain.context.adapter.repository.IDomainSourceRegistry;
import com.nova.domain.context.model.valobj.DomainSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存中的领域数据源注册表，保持注册顺序，同名后注册者覆盖。
 */
@Slf4j
public class DomainSourceRegistryImpl implements IDomainSourceRegistry {

    private final Map<String, DomainSource> sources = new LinkedHashMap<>();

    public DomainSourceRegistryImpl(List<DomainSource> sources) {
        if (sources != null) {
            sources.forEach(this::register);
        }
    }

    public synchronized void register(DomainSource source) {
        if (source == null || source.getName() == null) {
            throw new IllegalArgumentException("Domain source name cannot be null");
        }
        DomainSource previous = sources.put(source.getName(), source);
        if (previous != null) {
            log.warn("Domain source replaced. name={}", source.getName());
        } else {
            log.info("Registered domain source. name={}, intent={}, ttl={}",
                    source.getName(), source.getIntent(), source.getTtl());
        }
    }

    @Override
    public synchronized List<DomainSource> listSources() {
        return Collections.unmodifiableList(new ArrayList<>(sources.values()));
    }
}
