package me.bechberger.cdecl.config;

/**
 * How struct definitions are emitted in C
 */
public enum Style {
    /** {@code typedef struct Foo {...} Foo;} */
    BOTH,
    /** {@code struct Foo {...};} */
    TAG,
    /** {@code typedef struct {...} Foo;} */
    TYPE;

    public boolean generateTag() {
        return this == BOTH || this == TAG;
    }

    public boolean generateTypedef() {
        return this == BOTH || this == TYPE;
    }
}
