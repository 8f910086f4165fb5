package me.bechberger.cdecl.config;

import org.jetbrains.annotations.Nullable;

/**
 * @param nonNullAttribute annotation placed after pointers that are never null, e.g. {@code _Nonnull}
 */
public record PointerConfig(@Nullable String nonNullAttribute) {
    public static final PointerConfig DEFAULT = new PointerConfig(null);
}
