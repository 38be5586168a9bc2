package com.memo.core.model;

import com.memo.core.EvictionAlgorithm;

import java.time.Duration;

/**
 * Önbelleğin anlık istatistiklerini taşıyan değişmez kayıttır.
 *
 * @param maxSize   sınırsız önbellekte {@code null}
 * @param algorithm sınırsız önbellekte {@code null}; tahliye yalnızca kapasite varken anlamlıdır
 * @param ttl       süre sınırı yoksa {@code null}
 * @param customKey anahtarlar kullanıcı tanımlı bir {@code KeyMaker} ile üretiliyorsa true
 */
public record CacheInfo(long hits,
                        long misses,
                        int currentSize,
                        Integer maxSize,
                        EvictionAlgorithm algorithm,
                        Duration ttl,
                        boolean threadSafe,
                        boolean customKey)
{
    public boolean bounded() { return maxSize != null; }

    public long requests() { return hits + misses; }

    public double hitRatio()
    {
        long total = requests();
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
