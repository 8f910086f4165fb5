package me.bechberger.cdecl.config;

import java.util.Objects;

/**
 * Settings that influence how declarations are written
 *
 * @param language   target language, decides e.g. whether empty argument lists are written as {@code (void)}
 * @param style      struct definition style (C only)
 * @param pointer    pointer annotations
 * @param function   function prototype settings
 * @param lineLength maximum line length that the automatic layout aims for
 * @param tabWidth   spaces per indentation level
 */
public record Config(Language language, Style style, PointerConfig pointer, FunctionConfig function,
                     int lineLength, int tabWidth) {

    public static final Config DEFAULT = new Config(Language.CXX, Style.BOTH, PointerConfig.DEFAULT,
            FunctionConfig.DEFAULT, 100, 2);

    public Config {
        Objects.requireNonNull(language);
        Objects.requireNonNull(style);
        Objects.requireNonNull(pointer);
        Objects.requireNonNull(function);
        if (lineLength <= 0 || tabWidth < 0) {
            throw new IllegalArgumentException("Invalid line length " + lineLength + " or tab width " + tabWidth);
        }
    }

    public Config withLanguage(Language language) {
        return new Config(language, style, pointer, function, lineLength, tabWidth);
    }

    public Config withStyle(Style style) {
        return new Config(language, style, pointer, function, lineLength, tabWidth);
    }

    public Config withPointer(PointerConfig pointer) {
        return new Config(language, style, pointer, function, lineLength, tabWidth);
    }

    public Config withNonNullAttribute(String attribute) {
        return withPointer(new PointerConfig(attribute));
    }

    public Config withFunction(FunctionConfig function) {
        return new Config(language, style, pointer, function, lineLength, tabWidth);
    }

    public Config withLineLength(int lineLength) {
        return new Config(language, style, pointer, function, lineLength, tabWidth);
    }

    public Config withTabWidth(int tabWidth) {
        return new Config(language, style, pointer, function, lineLength, tabWidth);
    }
}
