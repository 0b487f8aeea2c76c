package io.github.linekv.kv;

/**
 * kv存储操作失败。异常信息即返回给客户端的应答文本。
 *
 * @author zy
 */
public class KeyValueException extends Exception {
    private static final long serialVersionUID = -3180459362158377516L;

    public KeyValueException(String message) {
        super(message);
    }
}
