package me.bechberger.cdecl.ir;

import java.util.Objects;

/**
 * Global variable that is declared {@code extern}
 */
public record Global(String name, Type type) {
    public Global {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
    }
}
