package com.memo.core;

import com.memo.core.model.CacheInfo;
import com.memo.core.model.CacheSettings;
import com.memo.core.model.CallArguments;
import com.memo.metric.MetricsRegistry;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import java.util.function.LongSupplier;

/**
 * Tek bir hesaplamaya bağlı önbellek örneği. Anahtar üretimi, tahliye
 * politikası, TTL, eşzamanlılık koruması ve istatistikleri tek bir
 * "bul ya da hesapla" işleminde birleştirir.
 * <p>
 * Anahtar üretilemeyen çağrılar önbelleği atlar ve ne isabet ne ıskalama
 * sayılır. Hata fırlatan hesaplamalar saklanmaz ve sayaçlara yansımaz.
 * {@link #clear()} girdilerle birlikte isabet/ıskalama sayaçlarını da sıfırlar.
 *
 * @param <V> hesaplamanın sonuç tipi
 */
public final class CacheController<V>
{
    private static final Logger LOG = Logger.getLogger(CacheController.class);
    private static final AtomicInteger ANONYMOUS = new AtomicInteger();

    private final String name;
    private final CacheSettings settings;
    private final KeyBuilder keyBuilder;
    private final CacheStore<V> store;
    private final ConcurrencyGuard guard;
    private final StatisticsRecorder statistics;

    private CacheController(String name, CacheSettings settings, KeyBuilder keyBuilder,
                            CacheStore<V> store, ConcurrencyGuard guard, MetricsRegistry metrics)
    {
        this.name = name;
        this.settings = settings;
        this.keyBuilder = keyBuilder;
        this.store = store;
        this.guard = guard;
        this.statistics = new StatisticsRecorder(name, settings, keyBuilder.customKey(), store, metrics);
    }

    public static <V> Builder<V> builder() { return new Builder<>(); }

    /**
     * Önbelleğin kapasite, algoritma, TTL ve eşzamanlılık ayarlarını toplayan
     * akıcı yapılandırma sınıfıdır. Değerler {@link #build()} sırasında doğrulanır.
     */
    public static final class Builder<V>
    {
        private String name;
        private Integer maxSize;
        private EvictionAlgorithm algorithm = CacheSettings.DEFAULT_ALGORITHM;
        private Duration ttl;
        private boolean threadSafe = true;
        private KeyMaker keyMaker;
        private MetricsRegistry metrics;
        private LongSupplier ticker = System::nanoTime;

        private Builder() {}

        public Builder<V> name(String n){ this.name = n; return this; }
        public Builder<V> maxSize(Integer m){ this.maxSize = m; return this; }
        public Builder<V> algorithm(EvictionAlgorithm a){ this.algorithm = a; return this; }
        public Builder<V> algorithm(String a){ this.algorithm = EvictionAlgorithm.fromConfig(a); return this; }
        public Builder<V> ttl(Duration t){ this.ttl = t; return this; }
        public Builder<V> threadSafe(boolean t){ this.threadSafe = t; return this; }
        public Builder<V> keyMaker(KeyMaker k){ this.keyMaker = k; return this; }
        public Builder<V> metrics(MetricsRegistry m){ this.metrics = m; return this; }
        public Builder<V> ticker(LongSupplier t){ this.ticker = Objects.requireNonNull(t); return this; }

        public Builder<V> settings(CacheSettings s)
        {
            this.maxSize = s.maxSize();
            this.algorithm = s.algorithm();
            this.ttl = s.ttl();
            this.threadSafe = s.threadSafe();
            return this;
        }

        public CacheController<V> build()
        {
            CacheSettings settings = new CacheSettings(maxSize, algorithm, ttl, threadSafe);
            CacheStore<V> store = settings.bounded()
                    ? settings.algorithm().create(settings.maxSize())
                    : FifoCacheStore.unbounded();
            if (settings.expiring()) {
                store = new ExpiringCacheStore<>(store, settings.ttl(), ticker);
            }
            String resolvedName = name == null || name.isBlank() ? "cache-" + ANONYMOUS.incrementAndGet() : name;
            return new CacheController<>(resolvedName, settings, KeyBuilder.using(keyMaker), store,
                    ConcurrencyGuard.forThreadSafety(settings.threadSafe()), metrics);
        }
    }

    public String name() { return name; }

    public CacheSettings settings() { return settings; }

    /**
     * Bu imza için saklı sonucu döndürür; yoksa hesaplar, saklar ve döndürür.
     * Thread-safe modda arama, hesaplama, ekleme ve sayaç güncellemesi tek bir
     * kritik bölgede yapılır, dolayısıyla bir anahtar için hesaplama en fazla
     * bir kez çalışır.
     *
     * @throws X hesaplamanın fırlattığı hata, değiştirilmeden
     */
    public <X extends Throwable> V fetchOrCompute(CallArguments arguments, Computation<? extends V, X> computation) throws X
    {
        Objects.requireNonNull(computation, "computation");
        CacheKey key;
        try {
            key = keyBuilder.build(arguments);
        } catch (KeyConstructionException ex) {
            LOG.debugf("Cache %s bypassed: %s", name, ex.getMessage());
            statistics.recordBypass();
            return computation.compute();
        }
        return guard.execute(() -> {
            CacheEntry<V> entry = store.get(key);
            if (entry != null) {
                statistics.recordHit();
                return entry.value();
            }
            long t0 = System.nanoTime();
            V value = computation.compute();
            statistics.recordComputation(System.nanoTime() - t0);
            CacheEntry<V> evicted = store.put(key, arguments, value);
            if (evicted != null) {
                statistics.recordEviction();
                LOG.tracef("Cache %s evicted %s", name, evicted.key());
            }
            statistics.recordMiss();
            return value;
        });
    }

    /** Tüm girdileri siler ve isabet/ıskalama sayaçlarını sıfırlar. */
    public void clear()
    {
        guard.run(() -> {
            store.clear();
            statistics.reset();
        });
        LOG.debugf("Cache %s cleared", name);
    }

    public CacheInfo info()
    {
        return guard.execute(statistics::snapshot);
    }

    /** Bu imzanın üreteceği anahtar; önbellek durumunu değiştirmez. */
    public CacheKey makeKey(CallArguments arguments) throws KeyConstructionException
    {
        return keyBuilder.build(arguments);
    }

    public boolean isEmpty()
    {
        return guard.execute(() -> store.size() == 0);
    }

    public boolean isFull()
    {
        return guard.execute(store::isFull);
    }

    /** Bu imza için canlı bir girdi var mı; erişim bilgisini güncellemez. */
    public boolean containsArguments(CallArguments arguments)
    {
        CacheKey key;
        try {
            key = keyBuilder.build(arguments);
        } catch (KeyConstructionException ex) {
            return false;
        }
        return guard.execute(() -> store.contains(key));
    }

    public boolean containsResult(Object result)
    {
        for (V value : results()) {
            if (Objects.equals(value, result)) return true;
        }
        return false;
    }

    /**
     * Canlı girdileri tahliye sırasıyla gezer. Girdiler kilit altında
     * kopyalanır, tüketici kilit dışında çağrılır.
     */
    public void forEach(BiConsumer<CallArguments, ? super V> consumer)
    {
        Objects.requireNonNull(consumer);
        for (Map.Entry<CallArguments, V> item : items()) {
            consumer.accept(item.getKey(), item.getValue());
        }
    }

    public List<CallArguments> arguments()
    {
        List<CallArguments> out = new ArrayList<>();
        for (Map.Entry<CallArguments, V> item : items()) out.add(item.getKey());
        return out;
    }

    public List<V> results()
    {
        List<V> out = new ArrayList<>();
        for (Map.Entry<CallArguments, V> item : items()) out.add(item.getValue());
        return out;
    }

    public List<Map.Entry<CallArguments, V>> items()
    {
        return guard.execute(() -> {
            List<Map.Entry<CallArguments, V>> out = new ArrayList<>();
            store.forEach(entry -> out.add(new AbstractMap.SimpleImmutableEntry<>(entry.arguments(), entry.value())));
            return out;
        });
    }

    /**
     * Koşulu sağlayan girdileri siler. Silmeler tahliye sayılmaz.
     *
     * @return silinen girdi sayısı
     */
    public int removeIf(BiPredicate<CallArguments, ? super V> predicate)
    {
        Objects.requireNonNull(predicate);
        int removed = guard.execute(() -> {
            List<CacheKey> matches = new ArrayList<>();
            store.forEach(entry -> {
                if (predicate.test(entry.arguments(), entry.value())) matches.add(entry.key());
            });
            for (CacheKey key : matches) store.remove(key);
            return matches.size();
        });
        if (removed > 0) {
            LOG.debugf("Cache %s removed %d entries by predicate", name, removed);
        }
        return removed;
    }

    @Override
    public String toString()
    {
        return "CacheController[" + name + ", " + settings + "]";
    }
}
