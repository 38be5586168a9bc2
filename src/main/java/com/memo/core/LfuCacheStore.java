package com.memo.core;

import java.util.function.Consumer;

/**
 * En az sıklıkla kullanılanı tahliye eden depo.
 * <p>
 * Girdiler frekans kovalarında tutulur. Kovalar frekansa göre artan sırada
 * birbirine bağlıdır ve {@code lowest} her zaman en düşük frekanslı kovayı
 * gösterir. Bir kova içinde sıra, girdinin o frekansa ulaştığı sıradır;
 * eşitlikte kovaya ilk giren tahliye edilir. Yeni girdiler frekans 1 kovasına
 * eklenme sırasıyla girdiğinden bu, hiç erişilmemiş girdiler için ekleme
 * sırasıdır. Erişilmiş girdilerde ise ilk eklenen değil, o frekansa ilk
 * ulaşan önce gider: 1, 2 eklenip önce 2 sonra 1 okunursa sıradaki kurban 2'dir.
 */
final class LfuCacheStore<V> extends AbstractCacheStore<V>
{
    static final class FrequencyBucket<V>
    {
        final long frequency;
        final EntryList<V> entries = new EntryList<>();
        FrequencyBucket<V> prev;
        FrequencyBucket<V> next;

        FrequencyBucket(long frequency)
        {
            this.frequency = frequency;
        }
    }

    private FrequencyBucket<V> lowest;

    LfuCacheStore(int capacity)
    {
        super(capacity);
    }

    @Override
    void link(CacheEntry<V> entry)
    {
        if (lowest == null || lowest.frequency != entry.frequency()) {
            FrequencyBucket<V> bucket = new FrequencyBucket<>(entry.frequency());
            bucket.next = lowest;
            if (lowest != null) lowest.prev = bucket;
            lowest = bucket;
        }
        lowest.entries.addLast(entry);
        entry.bucket = lowest;
    }

    @Override
    void onAccess(CacheEntry<V> entry)
    {
        FrequencyBucket<V> current = entry.bucket;
        FrequencyBucket<V> target = current.next;
        if (target == null || target.frequency != entry.frequency()) {
            target = new FrequencyBucket<>(entry.frequency());
            target.prev = current;
            target.next = current.next;
            if (current.next != null) current.next.prev = target;
            current.next = target;
        }
        current.entries.remove(entry);
        target.entries.addLast(entry);
        entry.bucket = target;
        if (current.entries.isEmpty()) dropBucket(current);
    }

    @Override
    void unlink(CacheEntry<V> entry)
    {
        FrequencyBucket<V> bucket = entry.bucket;
        bucket.entries.remove(entry);
        entry.bucket = null;
        if (bucket.entries.isEmpty()) dropBucket(bucket);
    }

    @Override
    CacheEntry<V> victim()
    {
        return lowest == null ? null : lowest.entries.first();
    }

    @Override
    void unlinkAll()
    {
        for (FrequencyBucket<V> b = lowest; b != null; b = b.next) b.entries.clear();
        lowest = null;
    }

    @Override
    public void forEach(Consumer<CacheEntry<V>> action)
    {
        for (FrequencyBucket<V> b = lowest; b != null; b = b.next) b.entries.forEach(action);
    }

    long lowestFrequency()
    {
        return lowest == null ? 0 : lowest.frequency;
    }

    private void dropBucket(FrequencyBucket<V> bucket)
    {
        if (bucket.prev != null) bucket.prev.next = bucket.next;
        else lowest = bucket.next;
        if (bucket.next != null) bucket.next.prev = bucket.prev;
        bucket.prev = null;
        bucket.next = null;
    }
}
