package com.memo.core;

import com.memo.core.model.CallArguments;

import java.util.function.Consumer;

/**
 * Tahliye politikası uygulayan depo sözleşmesi. Uygulamalar thread-safe
 * değildir; eşzamanlı kullanım {@link ConcurrencyGuard} ile korunur.
 */
interface CacheStore<V>
{
    /** Girdiyi döndürür ve politikanın erişim bilgisini (sıra/frekans) günceller. */
    CacheEntry<V> get(CacheKey key);

    /** Erişim bilgisine dokunmadan girdiyi döndürür. */
    CacheEntry<V> peek(CacheKey key);

    /**
     * Değeri saklar. Anahtar yeniyse ve depo doluysa önce tam olarak bir girdi
     * tahliye edilir.
     *
     * @return tahliye edilen girdi, yoksa {@code null}
     */
    CacheEntry<V> put(CacheKey key, CallArguments arguments, V value);

    CacheEntry<V> remove(CacheKey key);

    default boolean contains(CacheKey key)
    {
        return peek(key) != null;
    }

    int size();

    /** {@code null}: sınırsız. */
    Integer maxSize();

    default boolean isFull()
    {
        Integer max = maxSize();
        return max != null && size() >= max;
    }

    void clear();

    /** Girdileri tahliye sırasıyla (ilk kurban önce) gezer. */
    void forEach(Consumer<CacheEntry<V>> action);
}
