package io.github.linekv.kv;

/**
 * 包含空格的值没有使用双引号包裹。
 *
 * @author zy
 */
public class InvalidValueException extends KeyValueException {
    private static final long serialVersionUID = 5517460224373021489L;

    public InvalidValueException() {
        super("ERR syntax error: Value should be enclosed in quotes");
    }
}
