package com.memo.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Uygulama yapılandırma değerlerini tip güvenli şekilde okumak için kullanılan
 * konfigürasyon arayüzüdür. {@code application.properties} içindeki "memo"
 * önekiyle başlayan değerler; yeni oluşturulan önbelleklerin varsayılan
 * kapasite, algoritma, TTL ve eşzamanlılık ayarları ile metrik raporlama
 * sıklığını belirler.
 */
@ConfigMapping(prefix = "memo")
public interface MemoProperties
{
    Metrics metrics();
    Cache cache();

    interface Metrics {
        /** 0 veya negatif: raporlama kapalı. */
        @WithDefault("5")
        long reportIntervalSeconds();
    }

    interface Cache {
        /** Boş: sınırsız. */
        Optional<Integer> maxSize();

        @WithDefault("LRU")
        String algorithm();

        /** Boş: süre dolumu yok. */
        Optional<Duration> ttl();

        @WithDefault("true")
        boolean threadSafe();
    }
}
