package io.github.linekv.kv;

/**
 * @author zy
 */
public class NotAnIntegerException extends KeyValueException {
    private static final long serialVersionUID = 2306611297005862235L;

    public NotAnIntegerException() {
        super("ERR value is not an integer");
    }
}
