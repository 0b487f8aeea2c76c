package io.github.linekv.command;

import lombok.Getter;
import lombok.ToString;

/**
 * 单个连接的会话状态，只被该连接的处理链访问。
 *
 * @author zy
 */
@ToString
public class Session {
    @Getter
    private final String remote;
    // 当前打开的事务id，没有事务时为null
    @Getter
    private Long transactionId;

    public Session(String remote) {
        this.remote = remote;
    }

    public boolean inTransaction() {
        return transactionId != null;
    }

    void begin(long id) {
        this.transactionId = id;
    }

    Long end() {
        Long id = transactionId;
        transactionId = null;
        return id;
    }
}
