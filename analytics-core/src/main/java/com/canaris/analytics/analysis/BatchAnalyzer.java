package com.canaris.analytics.analysis;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Analyzes many assets, one unit of work per asset, with at most
 * {@code concurrency} assets in flight. A failure on one asset becomes a
 * failed result for that asset and never aborts the batch.
 */
@Slf4j
public class BatchAnalyzer implements AutoCloseable {

    private final AssetAnalyzer analyzer;
    private final ExecutorService executor;

    public BatchAnalyzer(AssetAnalyzer analyzer, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be positive, got " + concurrency);
        }
        this.analyzer = analyzer;
        this.executor = Executors.newFixedThreadPool(concurrency, namedThreads("asset-analysis"));
    }

    public BatchAnalysisResult analyze(List<String> assetIds, AnalysisRequest request) {
        log.info("Starting batch analysis of {} assets", assetIds.size());
        List<CompletableFuture<AssetAnalysisResult>> futures = new ArrayList<>(assetIds.size());
        for (String assetId : assetIds) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> analyzer.analyze(assetId, request), executor)
                    .exceptionally(e -> {
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        log.warn("Analysis of asset {} failed: {}", assetId, cause.getMessage());
                        return AssetAnalysisResult.failed(assetId, cause.getMessage());
                    }));
        }

        BatchAnalysisResult.BatchAnalysisResultBuilder batch = BatchAnalysisResult.builder();
        int ok = 0;
        int failed = 0;
        int anomalies = 0;
        for (CompletableFuture<AssetAnalysisResult> future : futures) {
            AssetAnalysisResult result = future.join();
            batch.result(result);
            if (result.isSuccess()) {
                ok++;
                anomalies += result.getFindings().size();
            } else {
                failed++;
            }
        }
        log.info("Batch analysis finished: {} succeeded, {} failed, {} anomalies", ok, failed, anomalies);
        return batch.totalAssets(assetIds.size())
                .successful(ok)
                .failed(failed)
                .totalAnomalies(anomalies)
                .build();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Daemon threads named {@code prefix-1}, {@code prefix-2}, ... */
    public static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
