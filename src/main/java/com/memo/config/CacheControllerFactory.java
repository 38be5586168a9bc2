package com.memo.config;

import com.memo.core.CacheController;
import com.memo.core.EvictionAlgorithm;
import com.memo.core.model.CacheSettings;
import com.memo.metric.MetricsRegistry;

import java.util.Objects;

/**
 * Yapılandırmadaki varsayılanlarla her çağrıda yeni bir {@link CacheController}
 * üretir. Üretilen önbellekler fabrikada tutulmaz; her hesaplama kendi
 * örneğine sahip olur ve yalnızca metrik kayıt defterini paylaşır.
 */
public class CacheControllerFactory
{
    private final CacheSettings defaults;
    private final MetricsRegistry metrics;

    public CacheControllerFactory(CacheSettings defaults, MetricsRegistry metrics)
    {
        this.defaults = Objects.requireNonNull(defaults);
        this.metrics = metrics;
    }

    public static CacheSettings settingsFrom(MemoProperties.Cache cache)
    {
        return new CacheSettings(
                cache.maxSize().orElse(null),
                EvictionAlgorithm.fromConfig(cache.algorithm()),
                cache.ttl().orElse(null),
                cache.threadSafe());
    }

    public CacheSettings defaults() { return defaults; }

    /** Varsayılanlarla doldurulmuş, istenirse değiştirilebilen builder. */
    public <V> CacheController.Builder<V> builder(String name)
    {
        return CacheController.<V>builder()
                .name(name)
                .settings(defaults)
                .metrics(metrics);
    }

    public <V> CacheController<V> create(String name)
    {
        return this.<V>builder(name).build();
    }
}
