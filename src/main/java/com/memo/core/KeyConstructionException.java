package com.memo.core;

/**
 * Argümanlardan biri ne hash üretebildiğinde ne de eşitlik karşılaştırmasını
 * desteklediğinde ya da özel anahtar üreticisi hata fırlattığında anahtar
 * üretimini durduran hatadır. {@link CacheController}
 * bu hatayı yakalar ve çağrıyı önbelleği atlayarak doğrudan hesaplar.
 */
public class KeyConstructionException extends Exception
{
    public KeyConstructionException(String message)
    {
        super(message);
    }

    public KeyConstructionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
