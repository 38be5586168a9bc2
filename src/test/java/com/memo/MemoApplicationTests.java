package com.memo;

import com.memo.config.CacheControllerFactory;
import com.memo.config.MemoProperties;
import com.memo.core.CacheController;
import com.memo.core.model.CallArguments;
import com.memo.metric.MetricsRegistry;
import com.memo.metric.MetricsReporter;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class MemoApplicationTests {

    @Inject
    CacheControllerFactory factory;

    @Inject
    MetricsRegistry metrics;

    @Inject
    MetricsReporter reporter;

    @Inject
    MemoProperties properties;

    @Nested
    class ContainerWiring {
        /**
         * Quarkus DI konteyneri AppConfig tarafından üretilen fabrika ve metrik kayıt defterini sağlar.
         * Fabrikadan alınan önbelleğin sayaçlarının ortak kayıt defterine yazıldığını doğrularız.
         */
        @Test
        void factoryControllersReportIntoSharedRegistry() {
            CacheController<Integer> cache = factory.create("wiring");
            cache.fetchOrCompute(CallArguments.of(2), () -> 4);
            cache.fetchOrCompute(CallArguments.of(2), () -> 4);
            assertEquals(1, metrics.counter("memo.wiring.hits").get());
            assertEquals(1, metrics.counter("memo.wiring.misses").get());
        }

        /**
         * application.properties değerleri varsayılan olarak sınırsız, süresiz ve thread-safe önbellek tanımlar.
         */
        @Test
        void defaultsComeFromApplicationProperties() {
            assertTrue(properties.cache().maxSize().isEmpty());
            assertTrue(factory.defaults().threadSafe());
            assertFalse(factory.defaults().bounded());
        }
    }

    @Nested
    class Lifecycle {
        /**
         * MetricsReporter @Startup olduğu için açılışta çalışmaya başlar; close ile durur ve yeniden başlatılabilir.
         */
        @Test
        void metricsReporterStopsAndRestarts() {
            assertTrue(reporter.isRunning());
            reporter.close();
            assertFalse(reporter.isRunning());
            reporter.start(properties.metrics().reportIntervalSeconds());
            assertTrue(reporter.isRunning());
        }
    }
}
