package com.anime.tracker.catalogue.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class CatalogueConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fixed pool the freshness coordinator runs crawls on, so crawls never hold a
     * database transaction or a request thread past their timeout. At most
     * {@code queueCapacity} crawls wait for a thread; further submissions are rejected.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService crawlExecutor(@Value("${app.crawler.threads:4}") int threads,
                                         @Value("${app.crawler.queue-capacity:64}") int queueCapacity) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "crawl-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        int poolSize = Math.max(1, threads);
        return new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)), factory, new ThreadPoolExecutor.AbortPolicy());
    }
}
