package com.nova.domain.context.adapter.repository;

import com.nova.domain.context.model.valobj.DomainSource;

import java.util.List;

/**
 * 领域数据源注册表，按声明顺序返回已启用的数据源。
 */
public interface IDomainSourceRegistry {

    List<DomainSource> listSources();
}
