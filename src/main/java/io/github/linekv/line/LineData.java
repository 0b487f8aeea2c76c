package io.github.linekv.line;

/**
 * 写回客户端的应答数据，每一行都以'\n'结尾。
 *
 * @author zy
 */
public interface LineData {
    byte[] toBytes();
}
