package io.github.linekv;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.github.linekv.server.KeyValueServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * 启动入口。配置见{@link ServerConfig}，例如：
 * <pre>
 * java -Dlinekv.port=4544 -Dlinekv.threads=20 io.github.linekv.Application
 * </pre>
 *
 * @author zy
 */
public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) throws Exception {
        ServerConfig config = ServerConfig.fromSystemProperties();
        logger.info("starting with {}", config);

        KeyValueServer server = createServer(config);
        server.start();
        logger.info("kv server started, address: {}", server.getSocketAddress());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("server process exit.");
            try {
                server.shutdown();
            } catch (IOException e) {
                logger.error("kv server shutdown failed.", e);
            }
        }));
    }

    public static KeyValueServer createServer(ServerConfig config) {
        Injector injector = Guice.createInjector(new LineKvModule(config));
        return injector.getInstance(KeyValueServer.class);
    }
}
