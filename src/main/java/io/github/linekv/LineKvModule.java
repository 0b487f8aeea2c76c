package io.github.linekv;

import com.google.inject.AbstractModule;
import com.google.inject.TypeLiteral;
import io.github.linekv.kv.KeyValueStore;
import io.github.linekv.kv.MemoryKeyValueStore;
import lombok.NonNull;

/**
 * @author zy
 */
public class LineKvModule extends AbstractModule {
    private final ServerConfig config;

    public LineKvModule(@NonNull ServerConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(ServerConfig.class).toInstance(config);

        bind(KeyValueStore.class).to(MemoryKeyValueStore.class);

        bind(new TypeLiteral<Sequence<Long>>() {
        }).to(LongSequence.class);
    }
}
