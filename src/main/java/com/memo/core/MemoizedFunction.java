package com.memo.core;

import com.memo.core.model.CallArguments;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Tek argümanlı bir fonksiyonu bir {@link CacheController} üzerine kuran ince
 * sarmalayıcı. Orijinal fonksiyona ve önbelleğe erişim sağlar.
 */
public final class MemoizedFunction<T, R> implements Function<T, R>
{
    private final Function<? super T, ? extends R> original;
    private final CacheController<R> cache;

    private MemoizedFunction(Function<? super T, ? extends R> original, CacheController<R> cache)
    {
        this.original = Objects.requireNonNull(original);
        this.cache = Objects.requireNonNull(cache);
    }

    public static <T, R> MemoizedFunction<T, R> of(CacheController<R> cache, Function<? super T, ? extends R> original)
    {
        return new MemoizedFunction<>(original, cache);
    }

    @Override
    public R apply(T argument)
    {
        CallArguments arguments = new CallArguments(Collections.singletonList(argument), Map.of());
        return cache.fetchOrCompute(arguments, () -> original.apply(argument));
    }

    public Function<? super T, ? extends R> original() { return original; }

    public CacheController<R> cache() { return cache; }
}
