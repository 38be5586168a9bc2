package com.memo.metric;

import io.vertx.core.Vertx;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsComponentsTest
{
    @Nested
    class CounterBehavior
    {
        // Bu test sayaç artışının, toplamanın ve sıfırlamanın değeri doğru güncellediğini doğrular.
        @Test
        void counter_handles_increment_add_and_reset()
        {
            Counter counter = new Counter("hits");
            counter.inc();
            counter.add(4);
            assertEquals(5, counter.get());
            assertEquals(5, counter.reset());
            assertEquals(0, counter.get());
            assertEquals("hits", counter.name());
        }
    }

    @Nested
    class TimerBehavior
    {
        // Bu test süre kayıtlarının istatistiklere yansıtıldığını gösterir.
        @Test
        void timer_aggregates_durations_into_statistics()
        {
            Timer timer = new Timer("compute", 128);
            timer.record(1_000);
            timer.record(2_000);
            Timer.Sample sample = timer.snapshot();
            assertEquals("compute", sample.name());
            assertEquals(2, sample.count());
            assertEquals(3_000, sample.totalNs());
            assertEquals(1_000, sample.minNs());
            assertEquals(2_000, sample.maxNs());
            assertEquals(1_500.0, sample.avgNs());
            assertTrue(sample.p50Ns() >= 1_000 && sample.p95Ns() <= 2_000);
        }

        // Bu test hiç kayıt yokken örneğin sıfırlarla döndüğünü doğrular.
        @Test
        void empty_timer_reports_zeroes()
        {
            Timer.Sample sample = new Timer("idle").snapshot();
            assertEquals(0, sample.count());
            assertEquals(0, sample.minNs());
            assertEquals(0, sample.maxNs());
            assertEquals(0, sample.p95Ns());
        }
    }

    @Nested
    class RegistryBehavior
    {
        // Bu test aynı isim için aynı sayaç ve zamanlayıcının döndüğünü doğrular.
        @Test
        void registry_reuses_components_with_same_name()
        {
            MetricsRegistry registry = new MetricsRegistry();
            Counter first = registry.counter(MetricsRegistry.name("fib", "hits"));
            Counter second = registry.counter("memo.fib.hits");
            assertSame(first, second);
            assertSame(registry.timer("memo.fib.compute"), registry.timer("memo.fib.compute"));
        }

        // Bu test sayaç değerlerinin isme göre sıralı döndüğünü gösterir.
        @Test
        void counter_values_are_sorted_by_name()
        {
            MetricsRegistry registry = new MetricsRegistry();
            registry.counter("memo.b.hits").add(2);
            registry.counter("memo.a.hits").inc();
            assertEquals(java.util.List.of("memo.a.hits", "memo.b.hits"), java.util.List.copyOf(registry.counterValues().keySet()));
            assertEquals(2L, registry.counterValues().get("memo.b.hits"));
        }
    }

    @Nested
    class ReporterBehavior
    {
        // Bu test geçerli aralıkla başlatılan raporlama görevinin çalıştığını ve kapatılabildiğini doğrular.
        @Test
        void reporter_runs_with_valid_interval()
        {
            MetricsRegistry registry = new MetricsRegistry();
            registry.counter("memo.test.hits").inc();
            Vertx vertx = Vertx.vertx();
            try
            {
                MetricsReporter reporter = new MetricsReporter(registry, 1, vertx);
                reporter.start(1);
                assertTrue(reporter.isRunning());
                reporter.dump();
                reporter.close();
                assertFalse(reporter.isRunning());
            }
            finally
            {
                vertx.close().toCompletionStage().toCompletableFuture().join();
            }
        }

        // Bu test geçersiz aralıkta raporlayıcının başlamadığını gösterir.
        @Test
        void reporter_ignores_invalid_interval()
        {
            Vertx vertx = Vertx.vertx();
            try
            {
                MetricsReporter reporter = new MetricsReporter(new MetricsRegistry(), 0, vertx);
                reporter.start(0);
                assertFalse(reporter.isRunning());
            }
            finally
            {
                vertx.close().toCompletionStage().toCompletableFuture().join();
            }
        }
    }
}
