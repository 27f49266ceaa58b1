package org.carball.tempo;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.tempo.analyzer.IndexAdvisor;
import org.carball.tempo.analyzer.NoPerformanceDataException;
import org.carball.tempo.analyzer.PerformanceAnalyzer;
import org.carball.tempo.cache.CacheStore;
import org.carball.tempo.cache.InMemoryCacheStore;
import org.carball.tempo.cache.ResultCache;
import org.carball.tempo.config.OptimizerConfig;
import org.carball.tempo.executor.BackgroundTasks;
import org.carball.tempo.executor.QueryExecutor;
import org.carball.tempo.executor.QueryOptions;
import org.carball.tempo.executor.QueryWork;
import org.carball.tempo.metrics.MetricStore;
import org.carball.tempo.model.analysis.HealthReport;
import org.carball.tempo.model.analysis.OptimizationPlan;
import org.carball.tempo.model.analysis.PerformanceReport;
import org.carball.tempo.model.analysis.QueryAnalysis;
import org.carball.tempo.rules.OptimizationRuleEngine;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the metric store, result cache, rule engine, executor and analyzer together and owns the
 * maintenance schedule (sample pruning and cache sweeping). Close it to stop background threads.
 */
@Slf4j
@Getter
public class QueryOptimizer implements AutoCloseable {

    private final OptimizerConfig config;
    private final MetricStore metricStore;
    private final ResultCache resultCache;
    private final OptimizationRuleEngine ruleEngine;
    private final QueryExecutor executor;
    private final PerformanceAnalyzer analyzer;

    @Getter(lombok.AccessLevel.NONE)
    private final BackgroundTasks backgroundTasks;
    @Getter(lombok.AccessLevel.NONE)
    private final ScheduledExecutorService maintenance;

    public QueryOptimizer(OptimizerConfig config) {
        this(config, new InMemoryCacheStore(), Clock.systemUTC(), true);
    }

    /**
     * @param scheduleMaintenance false leaves pruning and sweeping to explicit calls
     */
    public QueryOptimizer(OptimizerConfig config, CacheStore cacheStore, Clock clock, boolean scheduleMaintenance) {
        this.config = config;
        this.metricStore = new MetricStore(config.getMaxSamplesPerQuery(), clock);
        this.resultCache = new ResultCache(cacheStore, clock);
        this.ruleEngine = new OptimizationRuleEngine();
        this.backgroundTasks = new BackgroundTasks(config.getBackgroundThreads());
        this.executor = new QueryExecutor(metricStore, resultCache, backgroundTasks, config, clock);
        this.analyzer = new PerformanceAnalyzer(metricStore, ruleEngine, new IndexAdvisor(), config, clock);

        if (scheduleMaintenance) {
            this.maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "tempo-maintenance");
                thread.setDaemon(true);
                return thread;
            });
            scheduleMaintenance();
        } else {
            this.maintenance = null;
        }

        log.info("Query optimizer initialized: {}", config.getConfigurationSummary());
    }

    public <T> T execute(String queryId, String rawQueryText, QueryWork<T> work) throws Exception {
        return executor.run(queryId, rawQueryText, work);
    }

    public <T> T execute(String queryId, String rawQueryText, QueryWork<T> work, QueryOptions options) throws Exception {
        return executor.run(queryId, rawQueryText, work, options);
    }

    public CompletableFuture<Void> warm(String queryId, String rawQueryText, QueryWork<?> work, QueryOptions options) {
        return executor.warm(queryId, rawQueryText, work, options);
    }

    public int invalidate(Collection<String> tags) {
        return executor.invalidate(tags);
    }

    public QueryAnalysis analyze(String queryId) throws NoPerformanceDataException {
        return analyzer.analyze(queryId);
    }

    public PerformanceReport globalReport() {
        return analyzer.globalReport();
    }

    public HealthReport healthCheck() {
        return analyzer.healthCheck();
    }

    public OptimizationPlan applyAutomaticOptimizations() {
        return analyzer.applyAutomaticOptimizations();
    }

    /**
     * Runs one prune and one sweep immediately.
     */
    public void runMaintenance() {
        int pruned = metricStore.prune(Duration.ofMillis(config.getSampleRetentionMs()));
        int swept = resultCache.sweepExpired();
        log.debug("Maintenance pass: pruned {} samples, swept {} cache entries", pruned, swept);
    }

    public boolean awaitBackgroundWork(Duration timeout) throws InterruptedException {
        return backgroundTasks.awaitIdle(timeout);
    }

    @Override
    public void close() {
        if (maintenance != null) {
            maintenance.shutdownNow();
        }
        backgroundTasks.close();
        log.info("Query optimizer shut down");
    }

    private void scheduleMaintenance() {
        long pruneInterval = config.getMetricsPruneIntervalMs();
        long sweepInterval = config.getCacheSweepIntervalMs();
        Duration retention = Duration.ofMillis(config.getSampleRetentionMs());

        maintenance.scheduleAtFixedRate(() -> {
            try {
                metricStore.prune(retention);
            } catch (RuntimeException e) {
                log.warn("Metric pruning failed: {}", e.getMessage());
            }
        }, pruneInterval, pruneInterval, TimeUnit.MILLISECONDS);

        maintenance.scheduleAtFixedRate(() -> {
            try {
                resultCache.sweepExpired();
            } catch (RuntimeException e) {
                log.warn("Cache sweep failed: {}", e.getMessage());
            }
        }, sweepInterval, sweepInterval, TimeUnit.MILLISECONDS);

        log.debug("Scheduled maintenance: prune every {}ms, sweep every {}ms", pruneInterval, sweepInterval);
    }
}
