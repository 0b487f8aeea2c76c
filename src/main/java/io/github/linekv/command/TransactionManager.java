package io.github.linekv.command;

import com.google.common.base.Preconditions;
import com.google.common.collect.MapMaker;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.github.linekv.Sequence;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentMap;

/**
 * 事务表，所有连接共享。每次从空闲状态执行MULTI都会从{@link Sequence}分配新的事务id，
 * 不同连接的事务不会互相覆盖。
 * <ul>
 * <li>MULTI：没有事务时登记新事务；已有事务时在同一个id下清空队列。</li>
 * <li>EXEC：先把事务从表中摘除，再由调用者逐条执行，同一事务不能被执行两次。</li>
 * <li>连接断开：丢弃未执行的事务。</li>
 * </ul>
 *
 * @author zy
 */
@Singleton
public class TransactionManager {
    private static final Logger logger = LoggerFactory.getLogger(TransactionManager.class);

    private final ConcurrentMap<Long, Transaction> transactions = new MapMaker().makeMap();
    private final Sequence<Long> sequence;

    @Inject
    public TransactionManager(@NonNull Sequence<Long> sequence) {
        this.sequence = sequence;
    }

    /**
     * 为会话打开事务，已经打开时清空队列。
     *
     * @param session 会话
     * @return 事务id
     */
    public long begin(Session session) {
        Long id = session.getTransactionId();
        if (id != null) {
            Transaction tx = transactions.get(id);
            if (tx != null) {
                tx.reset();
                logger.debug("transaction {} of {} restarted", id, session.getRemote());
                return id;
            }
        }
        long next = sequence.next();
        Transaction previous = transactions.putIfAbsent(next, new Transaction(next));
        Preconditions.checkState(previous == null, "duplicate transaction id: " + next);
        session.begin(next);
        logger.debug("transaction {} of {} started", next, session.getRemote());
        return next;
    }

    /**
     * 把原始命令行追加到会话当前事务的队列。
     *
     * @param session 会话
     * @param line    原始命令行
     * @throws IllegalStateException 会话没有打开事务
     */
    public void queue(Session session, String line) {
        Preconditions.checkState(session.inTransaction(), "no transaction in progress");
        Transaction tx = transactions.get(session.getTransactionId());
        Preconditions.checkState(tx != null, "transaction " + session.getTransactionId() + " not found");
        tx.queue(line);
    }

    /**
     * 结束会话的事务，并把事务从表中摘除。
     *
     * @param session 会话
     * @return 被摘除的事务，会话没有事务时返回empty
     */
    public Optional<Transaction> detach(Session session) {
        Long id = session.end();
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(transactions.remove(id));
    }

    /**
     * 丢弃会话的事务，队列中的命令不会执行。
     *
     * @param session 会话
     */
    public void discard(Session session) {
        detach(session).ifPresent(tx ->
                logger.debug("transaction {} of {} discarded with {} queued commands",
                        tx.getId(), session.getRemote(), tx.size()));
    }

    public boolean contains(long id) {
        return transactions.containsKey(id);
    }

    public int size() {
        return transactions.size();
    }
}
