package com.memo.core;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/** Testlerde zamanı elle ilerletmek için nanosaniye sayacı. */
final class ManualTicker implements LongSupplier
{
    private final AtomicLong nanos = new AtomicLong(1_000_000L);

    @Override
    public long getAsLong() { return nanos.get(); }

    void advance(Duration duration) { nanos.addAndGet(duration.toNanos()); }
}
