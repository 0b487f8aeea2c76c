package io.github.linekv.kv;

/**
 * @author zy
 */
public class IncrementOverflowException extends KeyValueException {
    private static final long serialVersionUID = -8867017419502256671L;

    public IncrementOverflowException() {
        super("ERR increment or decrement would overflow");
    }
}
