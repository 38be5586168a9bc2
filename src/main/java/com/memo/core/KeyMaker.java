package com.memo.core;

import com.memo.core.model.CallArguments;

/**
 * Çağrı imzasından kullanıcı tanımlı bir kimlik üretir. Dönen nesne varsayılan
 * anahtar üretimiyle aynı tip duyarlı kurallardan geçirilir. Üreticinin
 * fırlattığı çalışma zamanı hatası çağırana ulaşmaz; çağrı önbelleği atlayarak
 * hesaplanır.
 */
@FunctionalInterface
public interface KeyMaker
{
    Object makeKey(CallArguments arguments);
}
