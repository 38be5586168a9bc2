package com.memo.core;

import com.memo.core.model.CallArguments;

/**
 * Depoda tutulan tek bir sonuç. Aynı zamanda politikaların çift yönlü bağlı
 * listelerinin düğümüdür; bağlantı alanları yalnızca sahibi olan depo
 * tarafından değiştirilir.
 */
final class CacheEntry<V>
{
    static final long NO_EXPIRY = Long.MIN_VALUE;

    private final CacheKey key;
    private final CallArguments arguments;
    private final long sequence;
    private V value;
    private long frequency = 1;
    private long expiresAtNanos = NO_EXPIRY;

    CacheEntry<V> prev;
    CacheEntry<V> next;
    LfuCacheStore.FrequencyBucket<V> bucket;

    // ExpiringCacheStore'un bitiş sırası listesi; politikanın bağlantılarından ayrıdır
    CacheEntry<V> olderByExpiry;
    CacheEntry<V> newerByExpiry;
    boolean queuedForExpiry;

    CacheEntry(CacheKey key, CallArguments arguments, V value, long sequence)
    {
        this.key = key;
        this.arguments = arguments;
        this.value = value;
        this.sequence = sequence;
    }

    CacheKey key() { return key; }
    CallArguments arguments() { return arguments; }
    V value() { return value; }
    void value(V value) { this.value = value; }

    /** Ekleme sırası; depo içinde tekildir ve artarak ilerler. */
    long sequence() { return sequence; }

    long frequency() { return frequency; }
    void recordAccess() { frequency++; }

    void expiresAt(long nanos) { this.expiresAtNanos = nanos; }
    long expiresAtNanos() { return expiresAtNanos; }

    boolean expired(long nowNanos)
    {
        return expiresAtNanos != NO_EXPIRY && nowNanos - expiresAtNanos >= 0;
    }
}
