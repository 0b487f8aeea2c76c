package io.github.linekv.command;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.github.linekv.kv.KeyValueException;
import io.github.linekv.kv.KeyValueStore;
import io.github.linekv.kv.Numbers;
import io.github.linekv.line.LineArray;
import io.github.linekv.line.LineData;
import io.github.linekv.line.LineString;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 解析客户端发送的一行命令，按会话的事务状态决定直接执行、进入事务队列还是执行事务。
 * <p>
 * 会话没有事务时，数据命令直接在{@link KeyValueStore}上执行；
 * MULTI之后数据命令只进入队列并返回QUEUED，EXEC时按入队顺序逐条解析执行，每条命令一行应答。
 * 队列中某条命令失败不会影响后面的命令，也不会回滚前面的命令。
 * EXEC中的每条命令各自获取存储的锁，其他连接的写入可能穿插在同一事务的两条命令之间。
 * </p>
 *
 * @author zy
 */
@Singleton
public class CommandDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String NO_TRANSACTION = "ERR No transaction in progress";
    static final String INVALID_INCREMENT = "ERR invalid increment";
    static final String EMPTY_TRANSACTION = "(empty array)";

    private final KeyValueStore store;
    private final TransactionManager transactionManager;

    @Inject
    public CommandDispatcher(@NonNull KeyValueStore store, @NonNull TransactionManager transactionManager) {
        this.store = store;
        this.transactionManager = transactionManager;
    }

    /**
     * 处理一行命令。
     *
     * @param session 当前连接的会话
     * @param line    不含换行符的一行
     * @return 应答及是否关闭连接
     */
    public DispatchResult dispatch(@NonNull Session session, @NonNull String line) {
        CommandLine cmd = CommandLine.parse(line);
        if (cmd.isEmpty()) {
            return DispatchResult.none();
        }

        Optional<CommandType> type = cmd.type();
        if (!type.isPresent()) {
            return DispatchResult.reply(unknown(cmd));
        }

        switch (type.get()) {
            case MULTI:
                transactionManager.begin(session);
                return DispatchResult.reply(LineString.ok());
            case EXEC:
                return DispatchResult.reply(exec(session));
            case DISCONNECT:
                transactionManager.discard(session);
                logger.debug("{} disconnect", session.getRemote());
                return DispatchResult.close();
            default:
                if (session.inTransaction()) {
                    transactionManager.queue(session, cmd.getRaw());
                    return DispatchResult.reply(LineString.queued());
                }
                return DispatchResult.reply(execute(cmd));
        }
    }

    private LineData exec(Session session) {
        Optional<Transaction> tx = transactionManager.detach(session);
        if (!tx.isPresent()) {
            return LineString.with(NO_TRANSACTION);
        }

        List<String> commands = tx.get().getCommands();
        logger.debug("exec transaction {} of {}, {} commands", tx.get().getId(), session.getRemote(),
                commands.size());
        if (commands.isEmpty()) {
            return LineString.with(EMPTY_TRANSACTION);
        }

        List<LineData> replies = new ArrayList<>(commands.size());
        for (String queued : commands) {
            replies.add(execute(CommandLine.parse(queued)));
        }
        return LineArray.with(replies);
    }

    /**
     * 在存储上执行一条数据命令。
     *
     * @param cmd 命令
     * @return 一行应答
     */
    LineData execute(CommandLine cmd) {
        Optional<CommandType> type = cmd.type();
        if (!type.isPresent() || !type.get().isQueueable()) {
            return unknown(cmd);
        }

        try {
            switch (type.get()) {
                case SET:
                    if (cmd.argc() < 2) {
                        return LineString.with("Usage: SET <key> <value>");
                    }
                    store.set(cmd.arg(0), cmd.joinFrom(1));
                    return LineString.ok();
                case GET:
                    if (cmd.argc() < 1) {
                        return LineString.with("Usage: GET <key>");
                    }
                    return store.get(cmd.arg(0)).map(LineString::quoted).orElse(LineString.nil());
                case DELETE:
                    if (cmd.argc() < 1) {
                        return LineString.with("Usage: DELETE <key>");
                    }
                    return LineString.integer(store.delete(cmd.arg(0)) ? 1 : 0);
                case INCR:
                    if (cmd.argc() < 1) {
                        return LineString.with("Usage: INCR <key>");
                    }
                    store.increment(cmd.arg(0), 1);
                    return LineString.ok();
                case INCRBY:
                    if (cmd.argc() < 2) {
                        return LineString.with("Usage: INCRBY <key> <increment>");
                    }
                    Optional<Long> by = Numbers.parseLong(cmd.arg(1));
                    if (!by.isPresent()) {
                        return LineString.with(INVALID_INCREMENT);
                    }
                    store.increment(cmd.arg(0), by.get());
                    // 应答是增量本身，不是累加后的值
                    return LineString.integer(by.get());
                default:
                    return unknown(cmd);
            }
        } catch (KeyValueException e) {
            return LineString.with(e.getMessage());
        }
    }

    private static LineString unknown(CommandLine cmd) {
        return LineString.with("Unknown command: " + cmd.getName());
    }
}
