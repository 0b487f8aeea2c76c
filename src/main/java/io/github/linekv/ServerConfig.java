package io.github.linekv;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.github.linekv.line.LineDecoder;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.net.InetSocketAddress;
import java.util.Properties;

/**
 * 服务配置，从系统属性读取，例如{@code -Dlinekv.port=4544}。
 *
 * @author zy
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class ServerConfig {
    static final String HOST = "linekv.host";
    static final String PORT = "linekv.port";
    static final String THREADS = "linekv.threads";
    static final String BUFFER_SIZE = "linekv.bufferSize";
    static final String MAX_LINE_LENGTH = "linekv.maxLineLength";

    // 监听地址
    @Builder.Default
    private String host = "0.0.0.0";
    // 监听端口
    @Builder.Default
    private int port = 4544;
    // channel group线程数
    @Builder.Default
    private int threads = 20;
    // 每次读取的缓冲区大小
    @Builder.Default
    private int bufferSize = 512;
    // 最大行长度，超过后关闭连接
    @Builder.Default
    private int maxLineLength = LineDecoder.DEFAULT_MAX_LINE_LENGTH;

    public InetSocketAddress getSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    public static ServerConfig fromSystemProperties() {
        return from(System.getProperties());
    }

    /**
     * 没有配置的属性使用默认值。
     *
     * @param props 属性
     * @return 配置
     * @throws IllegalArgumentException 属性值不合法
     */
    public static ServerConfig from(Properties props) {
        ServerConfigBuilder builder = ServerConfig.builder();
        String prop = props.getProperty(HOST);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.host(prop);
        }
        prop = props.getProperty(PORT);
        if (!Strings.isNullOrEmpty(prop)) {
            int port = parseInt(PORT, prop);
            Preconditions.checkArgument(port >= 0 && port <= 65535, "%s out of range: %s", PORT, port);
            builder.port(port);
        }
        prop = props.getProperty(THREADS);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.threads(positive(THREADS, prop));
        }
        prop = props.getProperty(BUFFER_SIZE);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.bufferSize(positive(BUFFER_SIZE, prop));
        }
        prop = props.getProperty(MAX_LINE_LENGTH);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.maxLineLength(positive(MAX_LINE_LENGTH, prop));
        }
        return builder.build();
    }

    private static int positive(String name, String value) {
        int n = parseInt(name, value);
        Preconditions.checkArgument(n > 0, "%s must be positive: %s", name, n);
        return n;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }
}
