package io.github.linekv.line;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 按顺序拼接的多行应答。空数组不产生任何字节，用于不需要应答的请求。
 *
 * @author zy
 */
@EqualsAndHashCode
@ToString
public class LineArray implements LineData {
    private static final LineArray EMPTY = new LineArray(Collections.emptyList());

    @Getter
    private final List<LineData> datas;

    private LineArray(List<LineData> datas) {
        this.datas = datas;
    }

    public static LineArray with(@NonNull List<? extends LineData> datas) {
        return new LineArray(Collections.unmodifiableList(new ArrayList<>(datas)));
    }

    public static LineArray with(LineData... datas) {
        return with(Arrays.asList(datas));
    }

    public static LineArray empty() {
        return EMPTY;
    }

    public int size() {
        return datas.size();
    }

    public boolean isEmpty() {
        return datas.isEmpty();
    }

    @Override
    public byte[] toBytes() {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        for (LineData data : datas) {
            os.writeBytes(data.toBytes());
        }
        return os.toByteArray();
    }
}
