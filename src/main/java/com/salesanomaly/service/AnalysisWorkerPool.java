package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Fixed pool shared by batch enrichment and per-anomaly attribution. Tasks submitted here must not
 * submit further tasks to the same pool.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisWorkerPool {

    private final AnalysisConfig config;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()));
        log.info("Analysis worker pool started | threads={}", config.getWorkerThreads());
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    /**
     * Runs every task on the pool and returns their results in submission order. The first task
     * failure is rethrown once all tasks have settled.
     */
    public <T> List<T> invokeAll(List<Supplier<T>> tasks) {
        List<CompletableFuture<T>> futures = new ArrayList<>(tasks.size());
        for (Supplier<T> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(task, executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw ex;
        }
        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> future : futures) {
            results.add(future.join());
        }
        return results;
    }
}
