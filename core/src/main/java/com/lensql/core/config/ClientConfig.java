package com.lensql.core.config;

import com.lensql.core.ValueConverter;

import java.util.HashMap;
import java.util.Map;

/**
 * Runtime settings of a query client.
 *
 * @param threads                size of the executor that runs {@code exec()} futures
 * @param converters             converters for opaque column types, keyed by declared type name
 * @param registerTableFetchers  whether every entity gets a table-backed relation fetcher by default
 */
public record ClientConfig(
        int threads,
        Map<String, ValueConverter> converters,
        boolean registerTableFetchers
) {
    public static Builder builder() {
        return new Builder();
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public static class Builder {
        private int threads = 4;
        private final Map<String, ValueConverter> converters = new HashMap<>();
        private boolean registerTableFetchers = true;

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder converter(String declaredType, ValueConverter converter) {
            this.converters.put(declaredType, converter);
            return this;
        }

        public Builder converters(Map<String, ValueConverter> converters) {
            this.converters.putAll(converters);
            return this;
        }

        public Builder registerTableFetchers(boolean registerTableFetchers) {
            this.registerTableFetchers = registerTableFetchers;
            return this;
        }

        public ClientConfig build() {
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be >= 1");
            }
            return new ClientConfig(threads, Map.copyOf(converters), registerTableFetchers);
        }
    }
}
