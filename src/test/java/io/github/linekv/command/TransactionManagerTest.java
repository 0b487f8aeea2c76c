package io.github.linekv.command;

import io.github.linekv.LongSequence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author zy
 */
class TransactionManagerTest {
    private TransactionManager transactionManager;
    private Session session;

    @BeforeEach
    void beforeEach() {
        transactionManager = new TransactionManager(new LongSequence());
        session = new Session("test");
    }

    @Test
    void beginAndQueue() {
        long id = transactionManager.begin(session);
        assertTrue(session.inTransaction());
        assertEquals(Long.valueOf(id), session.getTransactionId());

        transactionManager.queue(session, "SET a 1");
        transactionManager.queue(session, "GET a");

        Optional<Transaction> tx = transactionManager.detach(session);
        assertTrue(tx.isPresent());
        assertEquals(id, tx.get().getId());
        assertEquals(Arrays.asList("SET a 1", "GET a"), tx.get().getCommands());
        assertFalse(session.inTransaction());
        assertFalse(transactionManager.contains(id));
    }

    @Test
    void detachTwice() {
        transactionManager.begin(session);
        assertTrue(transactionManager.detach(session).isPresent());
        assertFalse(transactionManager.detach(session).isPresent());
    }

    @Test
    void beginAgainResetsQueueUnderSameId() {
        long id = transactionManager.begin(session);
        transactionManager.queue(session, "INCR c");

        assertEquals(id, transactionManager.begin(session));
        assertEquals(1, transactionManager.size());
        assertEquals(Collections.emptyList(), transactionManager.detach(session).get().getCommands());
    }

    @Test
    void newIdAfterExec() {
        long first = transactionManager.begin(session);
        transactionManager.detach(session);
        long second = transactionManager.begin(session);
        assertNotEquals(first, second);
    }

    @Test
    void sessionsDoNotAlias() {
        Session other = new Session("other");
        long a = transactionManager.begin(session);
        long b = transactionManager.begin(other);
        assertNotEquals(a, b);

        transactionManager.queue(session, "SET a 1");
        transactionManager.queue(other, "SET b 2");

        assertEquals(Collections.singletonList("SET b 2"), transactionManager.detach(other).get().getCommands());
        assertEquals(Collections.singletonList("SET a 1"), transactionManager.detach(session).get().getCommands());
    }

    @Test
    void concurrentSessionsGetUniqueIds() {
        Set<Long> ids = ConcurrentHashMap.newKeySet();
        IntStream.range(0, 500).parallel()
                .forEach(i -> ids.add(transactionManager.begin(new Session("s" + i))));
        assertEquals(500, ids.size());
        assertEquals(500, transactionManager.size());
    }

    @Test
    void discard() {
        long id = transactionManager.begin(session);
        transactionManager.queue(session, "SET a 1");
        transactionManager.discard(session);

        assertFalse(session.inTransaction());
        assertFalse(transactionManager.contains(id));
        assertEquals(0, transactionManager.size());
    }

    @Test
    void discardWithoutTransaction() {
        transactionManager.discard(session);
        assertEquals(0, transactionManager.size());
    }

    @Test
    void queueWithoutTransaction() {
        assertThrows(IllegalStateException.class, () -> transactionManager.queue(session, "GET a"));
    }
}
