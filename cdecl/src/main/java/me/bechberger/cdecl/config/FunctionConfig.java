package me.bechberger.cdecl.config;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * @param prefix  text in front of every function prototype, e.g. {@code WASM_EXPORT}
 * @param postfix text between the closing parenthesis and the semicolon
 * @param args    argument layout
 */
public record FunctionConfig(@Nullable String prefix, @Nullable String postfix, Layout args) {
    public static final FunctionConfig DEFAULT = new FunctionConfig(null, null, Layout.AUTO);

    public FunctionConfig {
        Objects.requireNonNull(args);
    }

    public FunctionConfig withArgs(Layout args) {
        return new FunctionConfig(prefix, postfix, args);
    }
}
