package com.memo.config;

import com.memo.metric.MetricsRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * CDI tarafından yönetilen bu yapılandırma sınıfı, ortak metrik kayıt defterini
 * ve önbellek fabrikasını üretir. Varsayılan önbellek ayarları
 * {@link MemoProperties} üzerinden okunur ve uygulama açılırken doğrulanır;
 * geçersiz bir değer uygulamanın başlamasını engeller.
 */
@ApplicationScoped
public class AppConfig {

    private static final Logger LOG = Logger.getLogger(AppConfig.class);

    private final MemoProperties properties;

    @Inject
    public AppConfig(MemoProperties properties) {
        this.properties = properties;
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry() {
        return new MetricsRegistry();
    }

    @Produces
    @Singleton
    public CacheControllerFactory cacheControllerFactory(MetricsRegistry metrics) {
        var defaults = CacheControllerFactory.settingsFrom(properties.cache());
        LOG.debugf("Cache defaults: %s", defaults);
        return new CacheControllerFactory(defaults, metrics);
    }
}
