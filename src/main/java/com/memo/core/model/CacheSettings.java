package com.memo.core.model;

import com.memo.core.CacheConfigurationException;
import com.memo.core.EvictionAlgorithm;

import java.time.Duration;

/**
 * Bir önbellek örneğinin kurulum anında doğrulanmış yapılandırmasıdır.
 *
 * @param maxSize   {@code null}: sınırsız
 * @param ttl       {@code null}: süre dolumu yok
 * @param algorithm yalnızca {@code maxSize} verildiğinde etkilidir
 */
public record CacheSettings(Integer maxSize, EvictionAlgorithm algorithm, Duration ttl, boolean threadSafe)
{
    public static final EvictionAlgorithm DEFAULT_ALGORITHM = EvictionAlgorithm.LRU;

    public CacheSettings
    {
        if (maxSize != null && maxSize <= 0) {
            throw new CacheConfigurationException("max_size must be a positive integer, got " + maxSize);
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new CacheConfigurationException("ttl must be a positive duration, got " + ttl);
        }
        if (algorithm == null) {
            algorithm = DEFAULT_ALGORITHM;
        }
    }

    public static CacheSettings unbounded() { return new CacheSettings(null, DEFAULT_ALGORITHM, null, true); }

    public boolean bounded() { return maxSize != null; }

    public boolean expiring() { return ttl != null; }
}
