package io.github.linekv.kv;

import java.util.Optional;

/**
 * 进程内共享的kv存储，所有连接共用同一个实例。
 * 每个方法调用都是原子的，不同key上的多个调用之间没有隔离保证。
 *
 * @author zy
 */
public interface KeyValueStore {
    /**
     * 写入，覆盖旧值。
     *
     * @param key   key
     * @param value 值，包含空格时必须以双引号开头和结尾
     * @throws InvalidValueException 值没有通过校验，存储不变
     */
    void set(String key, String value) throws InvalidValueException;

    Optional<String> get(String key);

    /**
     * @param key key
     * @return key存在并被删除时返回true
     */
    boolean delete(String key);

    /**
     * 把key当前的值按64位有符号十进制整数加上by，key不存在时按0处理。
     * 读取、解析、相加、写回整体是原子的。
     *
     * @param key key
     * @param by  增量，可以为负数
     * @return 相加后的值
     * @throws NotAnIntegerException       当前值不是整数，存储不变
     * @throws IncrementOverflowException 结果溢出，存储不变
     */
    long increment(String key, long by) throws NotAnIntegerException, IncrementOverflowException;

    int size();
}
