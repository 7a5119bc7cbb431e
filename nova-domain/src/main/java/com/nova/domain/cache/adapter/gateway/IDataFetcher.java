package com.nova.domain.cache.adapter.gateway;

/**
 * 领域数据拉取端口：无参调用，返回可序列化的数据，失败时抛出异常。
 * <p>
 * 超时由实现方负责，缓存对超时与错误一视同仁。
 * </p>
 */
@FunctionalInterface
public interface IDataFetcher {

    Object fetch() throws Exception;
}
