package me.bechberger.cdecl.writer;

import java.util.Objects;

/**
 * How list items are separated
 */
public sealed interface ListType {

    /** Separator between items, e.g. {@code a, b} */
    record Join(String separator) implements ListType {
        public Join {
            Objects.requireNonNull(separator);
        }
    }

    static ListType join(String separator) {
        return new Join(separator);
    }
}
