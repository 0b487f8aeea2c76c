package io.github.linekv;

import com.google.inject.Singleton;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 从1开始单调递增，线程安全。
 *
 * @author zy
 */
@Singleton
public class LongSequence implements Sequence<Long> {
    private final AtomicLong atomicLong = new AtomicLong(1);

    @Override
    public Long next() {
        return atomicLong.getAndIncrement();
    }
}
