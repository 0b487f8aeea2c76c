package io.github.linekv.kv;

import com.google.common.base.Preconditions;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 基于{@link HashMap}的内存存储。
 * 整个map由一把读写锁保护：读操作之间可以并发，写操作排斥所有读写。
 *
 * @author zy
 */
@Singleton
public class MemoryKeyValueStore implements KeyValueStore {
    private static final Logger logger = LoggerFactory.getLogger(MemoryKeyValueStore.class);
    private static final String QUOTE = "\"";

    private final Map<String, String> data = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void set(String key, String value) throws InvalidValueException {
        Preconditions.checkNotNull(key);
        Preconditions.checkNotNull(value);
        if (!isValidValue(value)) {
            throw new InvalidValueException();
        }
        lock.writeLock().lock();
        try {
            data.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<String> get(String key) {
        Preconditions.checkNotNull(key);
        lock.readLock().lock();
        try {
            return Optional.ofNullable(data.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        Preconditions.checkNotNull(key);
        lock.writeLock().lock();
        try {
            return data.remove(key) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long increment(String key, long by) throws NotAnIntegerException, IncrementOverflowException {
        Preconditions.checkNotNull(key);
        lock.writeLock().lock();
        try {
            String current = data.get(key);
            long n = current == null ? 0L : parse(key, current);
            long result;
            try {
                result = Math.addExact(n, by);
            } catch (ArithmeticException e) {
                throw new IncrementOverflowException();
            }
            data.put(key, Long.toString(result));
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return data.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private long parse(String key, String value) throws NotAnIntegerException {
        Optional<Long> n = Numbers.parseLong(value);
        if (!n.isPresent()) {
            logger.debug("value of key {} is not an integer: {}", key, value);
            throw new NotAnIntegerException();
        }
        return n.get();
    }

    /**
     * 包含空格的值必须以双引号开头并以双引号结尾，不含空格的值可以不加引号。
     *
     * @param value 待写入的值
     * @return 是否合法
     */
    static boolean isValidValue(String value) {
        if (value.contains(" ")) {
            return value.startsWith(QUOTE) && value.endsWith(QUOTE);
        }
        return true;
    }
}
