package me.bechberger.cdecl.ir;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Struct definition with named fields in declaration order
 */
public record Struct(String name, List<Field> fields) {

    public record Field(String name, Type type) {
        public Field {
            Objects.requireNonNull(name);
            Objects.requireNonNull(type);
        }
    }

    public Struct {
        Objects.requireNonNull(name);
        fields = List.copyOf(fields);
    }

    public static Struct struct(String name, Field... fields) {
        return new Struct(name, Arrays.asList(fields));
    }

    public static Field field(String name, Type type) {
        return new Field(name, type);
    }
}
