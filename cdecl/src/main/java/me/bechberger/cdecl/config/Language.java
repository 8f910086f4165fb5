package me.bechberger.cdecl.config;

import java.util.Locale;

/**
 * Target language of the generated declarations
 */
public enum Language {
    C("c"), CXX("c++");

    private final String name;

    Language(String name) {
        this.name = name;
    }

    /**
     * Parse {@code c}, {@code c++} or {@code cxx}, ignoring the case
     *
     * @throws IllegalArgumentException for every other value
     */
    public static Language parse(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "c" -> C;
            case "c++", "cxx", "cpp" -> CXX;
            default -> throw new IllegalArgumentException("Unknown language: " + value);
        };
    }

    @Override
    public String toString() {
        return name;
    }
}
