package com.nova.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * 公共线程池承载补全调用，调用方通过 Future 超时等待。
 * </p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "commonThreadPoolExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "commonThreadPoolExecutor")
    public ThreadPoolExecutor threadPoolExecutor(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("nova-common-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
                coreSize,
                Math.max(properties.getMaxPoolSize(), coreSize),
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                threadFactory,
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
