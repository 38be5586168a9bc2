package com.memo.core;

import java.util.function.Consumer;

/**
 * {@link CacheEntry} düğümlerinden oluşan çift yönlü bağlı liste. Baş en eski,
 * kuyruk en yeni düğümdür. Tüm işlemler O(1)'dir.
 */
final class EntryList<V>
{
    private CacheEntry<V> head;
    private CacheEntry<V> tail;
    private int size;

    void addLast(CacheEntry<V> entry)
    {
        entry.prev = tail;
        entry.next = null;
        if (tail != null) tail.next = entry;
        else head = entry;
        tail = entry;
        size++;
    }

    void remove(CacheEntry<V> entry)
    {
        if (entry.prev != null) entry.prev.next = entry.next;
        else head = entry.next;
        if (entry.next != null) entry.next.prev = entry.prev;
        else tail = entry.prev;
        entry.prev = null;
        entry.next = null;
        size--;
    }

    void moveToLast(CacheEntry<V> entry)
    {
        if (entry == tail) return;
        remove(entry);
        addLast(entry);
    }

    CacheEntry<V> first() { return head; }

    boolean isEmpty() { return size == 0; }

    void forEach(Consumer<CacheEntry<V>> action)
    {
        for (CacheEntry<V> e = head; e != null; e = e.next) action.accept(e);
    }

    void clear()
    {
        CacheEntry<V> e = head;
        while (e != null) {
            CacheEntry<V> next = e.next;
            e.prev = null;
            e.next = null;
            e = next;
        }
        head = tail = null;
        size = 0;
    }
}
