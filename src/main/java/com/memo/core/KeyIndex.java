package com.memo.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Anahtardan girdiye indeks. Hash'lenebilir anahtarlar {@link HashMap}
 * üzerinde, yapısal anahtarlar ise sırayla taranan bir listede tutulur; yapısal
 * bir arama kayıtlı yapısal girdi sayısı kadar karşılaştırma yapar.
 */
final class KeyIndex<V>
{
    private final Map<CacheKey, CacheEntry<V>> hashed = new HashMap<>();
    private final List<CacheEntry<V>> structural = new ArrayList<>();

    CacheEntry<V> get(CacheKey key)
    {
        if (key.hashable()) return hashed.get(key);
        for (CacheEntry<V> entry : structural) {
            if (entry.key().equals(key)) return entry;
        }
        return null;
    }

    void put(CacheEntry<V> entry)
    {
        if (entry.key().hashable()) hashed.put(entry.key(), entry);
        else structural.add(entry);
    }

    CacheEntry<V> remove(CacheKey key)
    {
        if (key.hashable()) return hashed.remove(key);
        Iterator<CacheEntry<V>> it = structural.iterator();
        while (it.hasNext()) {
            CacheEntry<V> entry = it.next();
            if (entry.key().equals(key)) {
                it.remove();
                return entry;
            }
        }
        return null;
    }

    int size() { return hashed.size() + structural.size(); }

    void clear()
    {
        hashed.clear();
        structural.clear();
    }
}
