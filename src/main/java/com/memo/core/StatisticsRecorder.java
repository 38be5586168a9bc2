package com.memo.core;

import com.memo.core.model.CacheInfo;
import com.memo.core.model.CacheSettings;
import com.memo.metric.Counter;
import com.memo.metric.MetricsRegistry;
import com.memo.metric.Timer;

/**
 * İsabet/ıskalama sayaçlarını tutar ve anlık boyutu depodan okuyarak
 * {@link CacheInfo} üretir. Sayaçlar {@link #reset()} ile sıfırlanana kadar
 * yalnızca artar. Bir {@link MetricsRegistry} verilmişse aynı olaylar orada
 * süreç boyu birikimli olarak da sayılır; sıfırlama ortak sayaçları etkilemez.
 */
final class StatisticsRecorder
{
    private final CacheSettings settings;
    private final boolean customKey;
    private final CacheStore<?> store;

    private final Counter hits = new Counter("hits");
    private final Counter misses = new Counter("misses");
    private final Counter sharedHits, sharedMisses, sharedBypasses, sharedEvictions;
    private final Timer computeTimer;

    StatisticsRecorder(String name, CacheSettings settings, boolean customKey, CacheStore<?> store, MetricsRegistry metrics)
    {
        this.settings = settings;
        this.customKey = customKey;
        this.store = store;
        if (metrics != null) {
            this.sharedHits = metrics.counter(MetricsRegistry.name(name, "hits"));
            this.sharedMisses = metrics.counter(MetricsRegistry.name(name, "misses"));
            this.sharedBypasses = metrics.counter(MetricsRegistry.name(name, "bypasses"));
            this.sharedEvictions = metrics.counter(MetricsRegistry.name(name, "evictions"));
            this.computeTimer = metrics.timer(MetricsRegistry.name(name, "compute"));
        } else {
            this.sharedHits = this.sharedMisses = this.sharedBypasses = this.sharedEvictions = null;
            this.computeTimer = null;
        }
    }

    void recordHit()
    {
        hits.inc();
        if (sharedHits != null) sharedHits.inc();
    }

    void recordMiss()
    {
        misses.inc();
        if (sharedMisses != null) sharedMisses.inc();
    }

    void recordBypass()
    {
        if (sharedBypasses != null) sharedBypasses.inc();
    }

    void recordEviction()
    {
        if (sharedEvictions != null) sharedEvictions.inc();
    }

    void recordComputation(long durationNs)
    {
        if (computeTimer != null) computeTimer.record(durationNs);
    }

    void reset()
    {
        hits.reset();
        misses.reset();
    }

    CacheInfo snapshot()
    {
        return new CacheInfo(
                hits.get(),
                misses.get(),
                store.size(),
                settings.maxSize(),
                settings.bounded() ? settings.algorithm() : null,
                settings.ttl(),
                settings.threadSafe(),
                customKey);
    }
}
