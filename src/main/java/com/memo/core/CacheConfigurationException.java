package com.memo.core;

/**
 * Önbellek kurulurken geçersiz bir yapılandırma değeri (pozitif olmayan kapasite,
 * pozitif olmayan TTL ya da tanınmayan tahliye algoritması) verildiğinde fırlatılır.
 */
public class CacheConfigurationException extends IllegalArgumentException
{
    public CacheConfigurationException(String message)
    {
        super(message);
    }

    public CacheConfigurationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
