package me.bechberger.cdecl.ir;

import me.bechberger.cdecl.config.Config;
import me.bechberger.cdecl.decl.CDeclarations;
import me.bechberger.cdecl.writer.Source;
import me.bechberger.cdecl.writer.SourceWriter;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Composed type, as handed over by the name and generics resolution.
 * <p>
 * Every path from the root ends in exactly one terminal, a {@link PrimitiveType} or a {@link PathType}.
 * <p>
 * Example: <pre>{@code
 *  ptr(array(primitive("int"), "4"))
 *  // is written as
 *  int (*x)[4]
 * }</pre>
 */
public sealed interface Type extends Source {

    /**
     * Writes this type as a bare type name, as used for generic arguments
     */
    @Override
    default void write(SourceWriter out, Config config) {
        CDeclarations.writeType(out, this, config);
    }

    /**
     * {@code int, char, void, ...}
     */
    record PrimitiveType(String name) implements Type {
        public PrimitiveType {
            Objects.requireNonNull(name);
        }
    }

    /**
     * Named type with optional generic arguments and an optional tag keyword
     * <p>
     * Example: {@code struct Foo} or {@code Vec<int>}
     */
    record PathType(String name, List<Type> generics, @Nullable DeclarationType tag) implements Type {
        public PathType {
            Objects.requireNonNull(name);
            generics = List.copyOf(generics);
        }

        public PathType(String name) {
            this(name, List.of(), null);
        }
    }

    /**
     * Pointer or reference
     *
     * @param pointee    pointed to type
     * @param isConst    whether the pointee is const, the pointer itself gets its constness from its own pointer
     * @param isNullable whether the pointer may be null
     * @param isRef      C++ reference instead of pointer
     */
    record PtrType(Type pointee, boolean isConst, boolean isNullable, boolean isRef) implements Type {
        public PtrType {
            Objects.requireNonNull(pointee);
        }
    }

    /**
     * Fixed size array, the length is emitted verbatim
     */
    record ArrayType(Type element, String length) implements Type {
        public ArrayType {
            Objects.requireNonNull(element);
            Objects.requireNonNull(length);
        }
    }

    /**
     * Pointer to a function
     */
    record FuncPtrType(Type returnType, List<Argument> args) implements Type {
        public FuncPtrType {
            Objects.requireNonNull(returnType);
            args = List.copyOf(args);
        }
    }

    /**
     * Function or function pointer argument, the name is optional
     */
    record Argument(@Nullable String name, Type type) {
        public Argument {
            Objects.requireNonNull(type);
        }
    }

    static PrimitiveType primitive(String name) {
        return new PrimitiveType(name);
    }

    static PrimitiveType _void() {
        return new PrimitiveType("void");
    }

    static PathType path(String name, Type... generics) {
        return new PathType(name, Arrays.asList(generics), null);
    }

    static PathType tagged(DeclarationType tag, String name) {
        return new PathType(name, List.of(), tag);
    }

    /**
     * Nullable mutable pointer
     */
    static PtrType ptr(Type pointee) {
        return new PtrType(pointee, false, true, false);
    }

    /**
     * Nullable pointer to const
     */
    static PtrType constPtr(Type pointee) {
        return new PtrType(pointee, true, true, false);
    }

    static PtrType nonNullPtr(Type pointee) {
        return new PtrType(pointee, false, false, false);
    }

    static PtrType ref(Type pointee) {
        return new PtrType(pointee, false, false, true);
    }

    static PtrType constRef(Type pointee) {
        return new PtrType(pointee, true, false, true);
    }

    static ArrayType array(Type element, String length) {
        return new ArrayType(element, length);
    }

    static FuncPtrType funcPtr(Type returnType, Argument... args) {
        return new FuncPtrType(returnType, Arrays.asList(args));
    }

    static Argument arg(@Nullable String name, Type type) {
        return new Argument(name, type);
    }

    static Argument arg(Type type) {
        return new Argument(null, type);
    }
}
