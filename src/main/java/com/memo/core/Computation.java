package com.memo.core;

/**
 * Önbelleğe alınan hesaplama. Fırlattığı hata çağırana değiştirilmeden iletilir.
 */
@FunctionalInterface
public interface Computation<V, X extends Throwable>
{
    V compute() throws X;
}
