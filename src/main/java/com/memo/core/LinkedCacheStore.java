package com.memo.core;

import java.util.function.Consumer;

/**
 * Tek bir bağlı liste üzerinde çalışan depo. {@code accessOrder} true ise
 * isabet alan girdi listenin sonuna taşınır (LRU); false ise ekleme sırası
 * korunur (FIFO). Kurban her zaman listenin başıdır.
 */
abstract class LinkedCacheStore<V> extends AbstractCacheStore<V>
{
    private final EntryList<V> order = new EntryList<>();
    private final boolean accessOrder;

    LinkedCacheStore(Integer capacity, boolean accessOrder)
    {
        super(capacity);
        this.accessOrder = accessOrder;
    }

    @Override
    void link(CacheEntry<V> entry) { order.addLast(entry); }

    @Override
    void unlink(CacheEntry<V> entry) { order.remove(entry); }

    @Override
    void onAccess(CacheEntry<V> entry)
    {
        if (accessOrder) order.moveToLast(entry);
    }

    @Override
    CacheEntry<V> victim() { return order.first(); }

    @Override
    void unlinkAll() { order.clear(); }

    @Override
    public void forEach(Consumer<CacheEntry<V>> action) { order.forEach(action); }
}
