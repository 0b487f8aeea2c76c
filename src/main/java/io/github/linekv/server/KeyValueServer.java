package io.github.linekv.server;

import com.google.inject.Inject;
import io.github.linekv.ServerConfig;
import io.github.linekv.command.CommandDispatcher;
import io.github.linekv.command.DispatchResult;
import io.github.linekv.command.Session;
import io.github.linekv.command.TransactionManager;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.AsynchronousChannelGroup;
import java.nio.channels.AsynchronousServerSocketChannel;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 使用java nio监听指定端口，使用{@link LineReadHandler}按行读取请求后，
 * 交给{@link CommandDispatcher}处理，再使用{@link LineWriteHandler}返回响应。
 * 每个连接有自己的{@link Session}，连接关闭时丢弃未执行的事务。
 *
 * @author zy
 */
public class KeyValueServer {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueServer.class);
    private final ServerConfig config;
    private final CommandDispatcher dispatcher;
    private final TransactionManager transactionManager;
    private volatile boolean started = false;
    // 服务socket channel
    private AsynchronousServerSocketChannel serverSocketChannel;
    // 处理线程池
    private AsynchronousChannelGroup channelGroup;

    @Inject
    public KeyValueServer(@NonNull ServerConfig config,
                          @NonNull CommandDispatcher dispatcher,
                          @NonNull TransactionManager transactionManager) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.transactionManager = transactionManager;
    }

    /**
     * 启动服务
     *
     * @throws IOException 绑定端口失败
     */
    public synchronized void start() throws IOException {
        if (started) {
            throw new IllegalStateException("kv server already started");
        }
        LineReadHandler readHandler = new LineReadHandler() {
            @Override
            protected DispatchResult process(ConnectionAttachment attachment, String line) {
                return dispatcher.dispatch(attachment.getSession(), line);
            }

            @Override
            protected void closed(ConnectionAttachment attachment) {
                transactionManager.discard(attachment.getSession());
                logger.debug("connection {} closed.", attachment.getSession().getRemote());
            }
        };
        LineWriteHandler writeHandler = new LineWriteHandler();

        channelGroup = AsynchronousChannelGroup.withFixedThreadPool(config.getThreads(), Executors.defaultThreadFactory());
        try {
            serverSocketChannel = AsynchronousServerSocketChannel.open(channelGroup);
            serverSocketChannel.bind(config.getSocketAddress());
        } catch (IOException | RuntimeException e) {
            logger.error("kv server bind {} failed.", config.getSocketAddress(), e);
            // 通道随线程组一起关闭
            channelGroup.shutdownNow();
            throw e;
        }
        serverSocketChannel.accept(this, new CompletionHandler<AsynchronousSocketChannel, Object>() {
            @Override
            public void completed(AsynchronousSocketChannel channel, Object attachment) {
                if (serverSocketChannel.isOpen()) {
                    serverSocketChannel.accept(attachment, this);
                }

                Session session = new Session(remoteOf(channel));
                ConnectionAttachment connection = new ConnectionAttachment(channel, session,
                        config.getBufferSize(), config.getMaxLineLength(), readHandler, writeHandler);
                logger.debug("connection {} accepted.", session.getRemote());
                connection.read();
            }

            @Override
            public void failed(Throwable exc, Object attachment) {
                if (serverSocketChannel.isOpen()) {
                    logger.error("kv server accept failed.", exc);
                }
            }
        });
        started = true;
        logger.info("kv server listening on {}", getSocketAddress());
    }

    /**
     * @return 实际监听的地址，端口配置为0时返回系统分配的端口
     */
    public InetSocketAddress getSocketAddress() throws IOException {
        return (InetSocketAddress) serverSocketChannel.getLocalAddress();
    }

    public boolean isStarted() {
        return started;
    }

    AsynchronousChannelGroup getChannelGroup() {
        return channelGroup;
    }

    /**
     * 关闭服务，已建立的连接也会被关闭。
     *
     * @throws IOException 关闭异常
     */
    public synchronized void shutdown() throws IOException {
        if (!started) {
            return;
        }
        serverSocketChannel.close();
        channelGroup.shutdownNow();
        try {
            if (!channelGroup.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("kv server channel group not terminated in 5 seconds.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        started = false;
        logger.info("kv server shutdown.");
    }

    private static String remoteOf(AsynchronousSocketChannel channel) {
        try {
            SocketAddress address = channel.getRemoteAddress();
            return String.valueOf(address);
        } catch (IOException e) {
            logger.debug("get remote address failed.", e);
            return "unknown";
        }
    }
}
