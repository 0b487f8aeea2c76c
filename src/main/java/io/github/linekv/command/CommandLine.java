package io.github.linekv.command;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 一行命令按空白切分后的结果：大写的命令名和其余的位置参数。
 *
 * @author zy
 */
@EqualsAndHashCode
@ToString
public class CommandLine {
    private static final CommandLine EMPTY = new CommandLine("", "", Collections.emptyList());

    @Getter
    private final String raw;
    @Getter
    private final String name;
    @Getter
    private final List<String> args;

    private CommandLine(String raw, String name, List<String> args) {
        this.raw = raw;
        this.name = name;
        this.args = args;
    }

    /**
     * @param line 客户端发送的一行，不含换行符
     * @return 解析结果，空行返回{@link #isEmpty() empty}命令
     */
    public static CommandLine parse(String line) {
        Preconditions.checkNotNull(line);
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return EMPTY;
        }
        String[] parts = trimmed.split("\\s+");
        return new CommandLine(trimmed, parts[0].toUpperCase(Locale.ROOT),
                Collections.unmodifiableList(Arrays.asList(parts).subList(1, parts.length)));
    }

    public boolean isEmpty() {
        return name.isEmpty();
    }

    public Optional<CommandType> type() {
        return CommandType.of(name);
    }

    public int argc() {
        return args.size();
    }

    public String arg(int i) {
        return args.get(i);
    }

    /**
     * 从第{@code from}个参数开始，用单个空格拼接剩余参数。
     *
     * @param from 起始参数下标
     * @return 拼接结果
     */
    public String joinFrom(int from) {
        return String.join(" ", args.subList(from, args.size()));
    }
}
