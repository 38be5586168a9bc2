package com.memo.metric;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sayaç ve zamanlayıcıları thread-safe koleksiyonlarda tutan ortak kayıt yapısıdır.
 * Metrikler ilk talep edildiğinde oluşturulur; aynı isimle istenen metrik aynı
 * nesneyi döndürür. Önbellek metrikleri {@code memo.<önbellek>.<metrik>}
 * biçiminde adlandırılır.
 */
public final class MetricsRegistry {
    public static final String PREFIX = "memo";

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public static String name(String cache, String metric) { return PREFIX + "." + cache + "." + metric; }

    public Counter counter(String name) { return counters.computeIfAbsent(name, Counter::new); }
    public Timer timer(String name) { return timers.computeIfAbsent(name, Timer::new); }

    public Map<String, Counter> counters(){ return counters; }
    public Map<String, Timer> timers(){ return timers; }

    /** İsme göre sıralı, o anki sayaç değerleri. */
    public SortedMap<String, Long> counterValues() {
        SortedMap<String, Long> values = new TreeMap<>();
        counters.forEach((name, counter) -> values.put(name, counter.get()));
        return values;
    }
}
