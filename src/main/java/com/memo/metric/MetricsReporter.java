package com.memo.metric;

import com.memo.config.MemoProperties;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Metrik kayıt defterindeki önbellek sayaçlarını ve hesaplama sürelerini belirli
 * aralıklarla log'a yazan servistir. Vert.x periyodik zamanlayıcısı üzerinde
 * çalışır, yazma işini worker thread'e bırakır ve kapatıldığında zamanlayıcıyı
 * iptal eder. Aralık 0 veya negatifse hiç başlatılmaz.
 */
@Startup
@Singleton
public class MetricsReporter implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(MetricsReporter.class);

    private final MetricsRegistry registry;
    private final long intervalSeconds;
    private final Vertx vertx;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private long timerId = -1L;

    @Inject
    public MetricsReporter(MetricsRegistry registry, MemoProperties properties, Vertx vertx) {
        this(registry, properties.metrics().reportIntervalSeconds(), vertx);
    }

    public MetricsReporter(MetricsRegistry registry, long intervalSeconds, Vertx vertx) {
        this.registry = registry;
        this.intervalSeconds = intervalSeconds;
        this.vertx = vertx;
    }

    @PostConstruct
    void init() {
        start(intervalSeconds);
    }

    public synchronized void start(long intervalSeconds) {
        if (intervalSeconds <= 0 || !running.compareAndSet(false, true)) {
            return;
        }
        long periodMillis = TimeUnit.SECONDS.toMillis(intervalSeconds);
        timerId = vertx.setPeriodic(periodMillis, id ->
                vertx.executeBlocking(promise -> {
                    dump();
                    promise.complete();
                })
        );
    }

    public boolean isRunning() {
        return running.get();
    }

    void dump() {
        if (registry.counters().isEmpty() && registry.timers().isEmpty()) {
            return;
        }
        registry.counterValues().forEach((name, value) ->
                LOG.infof("counter %s = %d", name, value)
        );
        registry.timers().values().forEach(timer -> {
            var sample = timer.snapshot();
            LOG.infof("timer %s count=%d avg=%.2fµs p50=%.2fµs p95=%.2fµs min=%.2fµs max=%.2fµs",
                    sample.name(),
                    sample.count(),
                    sample.avgNs() / 1_000.0,
                    sample.p50Ns() / 1_000.0,
                    sample.p95Ns() / 1_000.0,
                    sample.minNs() / 1_000.0,
                    sample.maxNs() / 1_000.0
            );
        });
    }

    @PreDestroy
    void shutdown() {
        close();
    }

    @Override
    public synchronized void close() {
        running.set(false);
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }
    }
}
