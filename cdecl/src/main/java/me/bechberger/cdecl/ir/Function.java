package me.bechberger.cdecl.ir;

import me.bechberger.cdecl.ir.Type.Argument;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Function with a name, its arguments and return type
 */
public record Function(String name, List<Argument> args, Type returnType) {
    public Function {
        Objects.requireNonNull(name);
        Objects.requireNonNull(returnType);
        args = List.copyOf(args);
    }

    public static Function function(String name, Type returnType, Argument... args) {
        return new Function(name, Arrays.asList(args), returnType);
    }
}
