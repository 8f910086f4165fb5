package me.bechberger.cdecl.decl;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Declarator operator that composes with a base type and an optional identifier,
 * see section 6.7.6 of the C standard
 */
public sealed interface CDeclarator {

    /**
     * Does an array or function declarator following this one have to be parenthesized?
     */
    boolean isPtr();

    /**
     * {@code *}, {@code *const} or {@code &}
     */
    record Ptr(boolean isConst, boolean isNullable, boolean isRef) implements CDeclarator {
        @Override
        public boolean isPtr() {
            return true;
        }
    }

    /**
     * {@code [length]}
     */
    record Array(String length) implements CDeclarator {
        public Array {
            Objects.requireNonNull(length);
        }

        @Override
        public boolean isPtr() {
            return false;
        }
    }

    /**
     * {@code (params)}
     *
     * @param layoutVertical one parameter per line
     */
    record Func(List<Parameter> params, boolean layoutVertical) implements CDeclarator {
        public Func {
            params = List.copyOf(params);
        }

        @Override
        public boolean isPtr() {
            return true;
        }
    }

    /**
     * Function parameter with its own, independent declaration
     */
    record Parameter(@Nullable String name, CDecl decl) {
        public Parameter {
            Objects.requireNonNull(decl);
        }
    }
}
