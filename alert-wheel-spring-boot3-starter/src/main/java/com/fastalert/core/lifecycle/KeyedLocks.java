package com.fastalert.core.lifecycle;

import com.google.common.util.concurrent.Striped;

import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * 按 key 分段加锁, 同一 key 串行, 不同 key 大概率并行
 * 段内为 ReentrantLock, 升级触发路径可重入
 */
public class KeyedLocks {

    private final Striped<Lock> striped;

    public KeyedLocks() {
        this(256);
    }

    public KeyedLocks(int stripes) {
        this.striped = Striped.lock(stripes);
    }

    public <T> T withLock(String key, Supplier<T> action) {
        Lock lock = striped.get(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }
}
