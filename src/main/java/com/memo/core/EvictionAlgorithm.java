package com.memo.core;

import java.util.Locale;

/**
 * Kapasite dolduğunda hangi girdinin tahliye edileceğini belirleyen algoritmalar.
 */
public enum EvictionAlgorithm
{
    LRU {
        @Override
        <V> CacheStore<V> create(int capacity)
        {
            return new LruCacheStore<>(capacity);
        }
    },
    LFU {
        @Override
        <V> CacheStore<V> create(int capacity)
        {
            return new LfuCacheStore<>(capacity);
        }
    },
    FIFO {
        @Override
        <V> CacheStore<V> create(int capacity)
        {
            return new FifoCacheStore<>(capacity);
        }
    };

    abstract <V> CacheStore<V> create(int capacity);

    public static EvictionAlgorithm fromConfig(String value)
    {
        if (value == null || value.isBlank()) return LRU;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return EvictionAlgorithm.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new CacheConfigurationException("Unknown eviction algorithm: " + value, ex);
        }
    }
}
