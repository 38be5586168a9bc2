package com.memo.metric;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Olayları saymak için atomik sayaç tutan metrik bileşenidir. Artış, toplama ve
 * sıfırlama operasyonları thread-safe şekilde gerçekleştirilir.
 */
public final class Counter
{
    private final String name;
    private final AtomicLong value = new AtomicLong();
    public Counter(String name) { this.name = name; }
    public void inc() { value.incrementAndGet(); }
    public void add(long delta) { value.addAndGet(delta); }
    public long get() { return value.get(); }
    /** @return sıfırlamadan önceki değer */
    public long reset() { return value.getAndSet(0); }
    public String name() { return name; }
}
