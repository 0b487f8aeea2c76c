package io.github.linekv.command;

import lombok.Getter;

import java.util.Optional;

/**
 * @author zy
 */
public enum CommandType {
    SET(true),
    GET(true),
    DELETE(true),
    INCR(true),
    INCRBY(true),
    MULTI(false),
    EXEC(false),
    DISCONNECT(false);

    /**
     * 事务中是否进入队列，等到EXEC时再执行
     */
    @Getter
    private final boolean queueable;

    CommandType(boolean queueable) {
        this.queueable = queueable;
    }

    /**
     * @param name 已转换为大写的命令名
     * @return 命令类型，未知命令返回empty
     */
    static Optional<CommandType> of(String name) {
        for (CommandType type : values()) {
            if (type.name().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
