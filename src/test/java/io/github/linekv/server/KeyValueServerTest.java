package io.github.linekv.server;

import com.google.common.base.Strings;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.github.linekv.LineKvModule;
import io.github.linekv.ServerConfig;
import io.github.linekv.command.TransactionManager;
import io.github.linekv.kv.KeyValueStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author zy
 */
@Timeout(30)
class KeyValueServerTest {
    private static KeyValueServer server;
    private static KeyValueStore store;
    private static TransactionManager transactionManager;
    private static InetSocketAddress address;
    private LineClient client;

    @BeforeAll
    static void beforeAll() throws IOException {
        ServerConfig config = ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .threads(4)
                .bufferSize(2048)
                .maxLineLength(1024)
                .build();
        Injector injector = Guice.createInjector(new LineKvModule(config));
        server = injector.getInstance(KeyValueServer.class);
        store = injector.getInstance(KeyValueStore.class);
        transactionManager = injector.getInstance(TransactionManager.class);
        server.start();
        address = server.getSocketAddress();
    }

    @AfterAll
    static void afterAll() throws IOException {
        server.shutdown();
        assertFalse(server.isStarted());
    }

    @BeforeEach
    void beforeEach() throws IOException {
        client = new LineClient(address);
    }

    @AfterEach
    void afterEach() throws IOException {
        client.close();
    }

    @Test
    void startTwice() {
        assertThrows(IllegalStateException.class, () -> server.start());
    }

    @Test
    void bindFailureReleasesThreads() throws Exception {
        ServerConfig taken = ServerConfig.builder()
                .host(address.getHostString())
                .port(address.getPort())
                .threads(2)
                .build();
        KeyValueServer other = Guice.createInjector(new LineKvModule(taken)).getInstance(KeyValueServer.class);
        assertThrows(IOException.class, other::start);
        assertFalse(other.isStarted());
        assertTrue(other.getChannelGroup().awaitTermination(5, TimeUnit.SECONDS));
        // 原服务不受影响
        assertEquals("(nil)", client.call("GET bind_failure"));
    }

    @Test
    void setAndGet() throws IOException {
        assertEquals("OK", client.call("SET k1 v1"));
        assertEquals("\"v1\"", client.call("GET k1"));
        assertEquals("(integer) 1", client.call("DELETE k1"));
        assertEquals("(nil)", client.call("GET k1"));
    }

    @Test
    void transactionScenario() throws IOException {
        assertEquals("OK", client.call("MULTI"));
        assertEquals("QUEUED", client.call("SET tx_a \"1 2\""));
        assertEquals("QUEUED", client.call("GET tx_a"));

        client.send("EXEC");
        assertEquals("OK", client.receive());
        assertEquals("\"\\\"1 2\\\"\"", client.receive());

        assertEquals("\"\\\"1 2\\\"\"", client.call("GET tx_a"));
        assertEquals(Optional.of("\"1 2\""), store.get("tx_a"));
    }

    @Test
    void execWithoutMulti() throws IOException {
        assertEquals("ERR No transaction in progress", client.call("EXEC"));
    }

    @Test
    void unknownCommand() throws IOException {
        int size = store.size();
        assertEquals("Unknown command: FOO", client.call("foo"));
        assertEquals(size, store.size());
    }

    @Test
    void blankLineHasNoReply() throws IOException {
        client.send("");
        client.send("   ");
        assertEquals("(nil)", client.call("GET blank_none"));
    }

    @Test
    void pipelinedLines() throws IOException {
        client.sendRaw("SET pipe 1\nINCR pipe\nINCRBY pipe 10\nGET pipe\n");
        assertEquals("OK", client.receive());
        assertEquals("OK", client.receive());
        assertEquals("(integer) 10", client.receive());
        assertEquals("\"12\"", client.receive());
    }

    @Test
    void lineSplitAcrossWrites() throws Exception {
        client.sendRaw("SET split ");
        TimeUnit.MILLISECONDS.sleep(50);
        client.sendRaw("value\r\n");
        assertEquals("OK", client.receive());
        assertEquals("\"value\"", client.call("GET split"));
    }

    @Test
    void disconnect() throws IOException {
        client.sendRaw("SET before_disconnect 1\nDISCONNECT\nSET after_disconnect 1\n");
        assertEquals("OK", client.receive());
        assertNull(client.receive());

        try (LineClient other = new LineClient(address)) {
            assertEquals("\"1\"", other.call("GET before_disconnect"));
            assertEquals("(nil)", other.call("GET after_disconnect"));
        }
    }

    @Test
    void disconnectDiscardsTransaction() throws IOException {
        client.call("MULTI");
        client.call("SET discarded 1");
        client.send("DISCONNECT");
        assertNull(client.receive());

        try (LineClient other = new LineClient(address)) {
            assertEquals("(nil)", other.call("GET discarded"));
        }
    }

    @Test
    void peerCloseDiscardsTransaction() throws Exception {
        LineClient c = new LineClient(address);
        assertEquals("OK", c.call("MULTI"));
        assertEquals("QUEUED", c.call("SET closed_tx 1"));
        assertTrue(transactionManager.size() > 0);
        c.close();

        long deadline = System.currentTimeMillis() + 5000;
        while (transactionManager.size() > 0 && System.currentTimeMillis() < deadline) {
            TimeUnit.MILLISECONDS.sleep(10);
        }
        assertEquals(0, transactionManager.size());
        assertFalse(store.get("closed_tx").isPresent());
    }

    @Test
    void transactionsOfTwoConnections() throws IOException {
        try (LineClient other = new LineClient(address)) {
            assertEquals("OK", client.call("MULTI"));
            assertEquals("OK", other.call("MULTI"));
            assertEquals("QUEUED", client.call("SET two_a 1"));
            assertEquals("QUEUED", other.call("SET two_b 2"));

            assertEquals("OK", other.call("EXEC"));
            assertFalse(store.get("two_a").isPresent());
            assertEquals("OK", client.call("EXEC"));

            assertEquals("\"1\"", other.call("GET two_a"));
            assertEquals("\"2\"", client.call("GET two_b"));
        }
    }

    @Test
    void lineTooLongClosesConnection() throws IOException {
        client.sendRaw("SET long " + Strings.repeat("x", 1091));
        String reply;
        try {
            reply = client.receive();
        } catch (IOException e) {
            // 服务端关闭时可能还有未读数据，客户端收到reset
            reply = null;
        }
        assertNull(reply);
    }

    @Test
    void linesBeforeTooLongLineAreAnswered() throws IOException {
        // 超长部分在最后，服务端读完全部数据后才关闭
        client.sendRaw("SET before_long 1\nGET before_long\n" + Strings.repeat("y", 1030));
        List<String> replies = new ArrayList<>();
        String reply;
        while ((reply = client.receive()) != null) {
            replies.add(reply);
        }
        assertEquals(Arrays.asList("OK", "\"1\""), replies);
        assertEquals(Optional.of("1"), store.get("before_long"));
    }

    @Test
    void concurrentIncrements() throws Exception {
        int clients = 8;
        int times = 100;
        ExecutorService executorService = Executors.newFixedThreadPool(clients);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < clients; i++) {
                futures.add(executorService.submit(() -> {
                    try (LineClient c = new LineClient(address)) {
                        for (int n = 0; n < times; n++) {
                            assertEquals("OK", c.call("INCR concurrent_counter"));
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(20, TimeUnit.SECONDS);
            }
        } finally {
            executorService.shutdownNow();
        }
        assertEquals("\"" + clients * times + "\"", client.call("GET concurrent_counter"));
    }
}
