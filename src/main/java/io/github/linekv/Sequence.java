package io.github.linekv;

/**
 * @author zy
 */
public interface Sequence<T extends Comparable<T>> {
    T next();
}
