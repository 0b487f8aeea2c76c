package io.github.linekv.line;

import java.io.IOException;

/**
 * @author zy
 */
public class LineTooLongException extends IOException {
    private static final long serialVersionUID = 4020337460751396513L;

    public LineTooLongException(int length, int max) {
        super("line length " + length + " exceeds max " + max);
    }
}
