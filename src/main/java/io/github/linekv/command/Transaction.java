package io.github.linekv.command;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * MULTI打开的事务：id加上按接收顺序排队的原始命令行。
 *
 * @author zy
 */
public class Transaction {
    @Getter
    private final long id;
    private final List<String> commands = new ArrayList<>();

    Transaction(long id) {
        this.id = id;
    }

    synchronized void queue(String line) {
        commands.add(line);
    }

    synchronized void reset() {
        commands.clear();
    }

    public synchronized List<String> getCommands() {
        return new ArrayList<>(commands);
    }

    public synchronized int size() {
        return commands.size();
    }
}
