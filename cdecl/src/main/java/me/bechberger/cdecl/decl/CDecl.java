package me.bechberger.cdecl.decl;

import me.bechberger.cdecl.config.Config;
import me.bechberger.cdecl.config.Language;
import me.bechberger.cdecl.decl.CDeclarator.Array;
import me.bechberger.cdecl.decl.CDeclarator.Func;
import me.bechberger.cdecl.decl.CDeclarator.Parameter;
import me.bechberger.cdecl.decl.CDeclarator.Ptr;
import me.bechberger.cdecl.ir.DeclarationType;
import me.bechberger.cdecl.ir.Function;
import me.bechberger.cdecl.ir.Type;
import me.bechberger.cdecl.ir.Type.Argument;
import me.bechberger.cdecl.ir.Type.ArrayType;
import me.bechberger.cdecl.ir.Type.FuncPtrType;
import me.bechberger.cdecl.ir.Type.PathType;
import me.bechberger.cdecl.ir.Type.PrimitiveType;
import me.bechberger.cdecl.ir.Type.PtrType;
import me.bechberger.cdecl.writer.ListType;
import me.bechberger.cdecl.writer.SourceWriter;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * A type split into its type specifier and a flat list of declarators,
 * see section 6.7 of the C standard
 * <p>
 * The declarators are ordered from the outermost (closest to the identifier) to the innermost
 * (closest to the type specifier). {@code int (*x)[4]} has the declarators {@code [*, [4]]},
 * {@code int *x[4]} has {@code [[4], *]}.
 *
 * @param specifier   terminal type
 * @param declarators declarators, outermost first
 */
public record CDecl(TypeSpecifier specifier, List<CDeclarator> declarators) {

    /**
     * Terminal part of a declaration, like {@code const struct Foo} or {@code Vec<int>}
     */
    public record TypeSpecifier(boolean isConst, String name, List<Type> generics, @Nullable DeclarationType tag) {
        public TypeSpecifier {
            Objects.requireNonNull(name);
            generics = List.copyOf(generics);
        }
    }

    public CDecl {
        Objects.requireNonNull(specifier);
        declarators = List.copyOf(declarators);
    }

    public static CDecl fromType(Type type) {
        return fromType(type, false);
    }

    /**
     * @param isConst whether the outermost level is const, e.g. a const pointer
     */
    public static CDecl fromType(Type type, boolean isConst) {
        Objects.requireNonNull(type);
        List<CDeclarator> declarators = new ArrayList<>();
        var specifier = buildType(type, isConst, declarators);
        return new CDecl(specifier, declarators);
    }

    public static CDecl fromFunc(Function function, boolean layoutVertical) {
        Objects.requireNonNull(function);
        List<CDeclarator> declarators = new ArrayList<>();
        declarators.add(new Func(buildParameters(function.args()), layoutVertical));
        var specifier = buildType(function.returnType(), false, declarators);
        return new CDecl(specifier, declarators);
    }

    private static List<Parameter> buildParameters(List<Argument> args) {
        return args.stream().map(arg -> new Parameter(arg.name(), fromType(arg.type()))).toList();
    }

    /**
     * Appends the declarators of the type and returns its terminal
     *
     * @param isConst constness of the value described by {@code type}, the const of a pointer type
     *                applies to its pointee
     */
    private static TypeSpecifier buildType(Type type, boolean isConst, List<CDeclarator> declarators) {
        if (type instanceof PrimitiveType primitive) {
            return new TypeSpecifier(isConst, primitive.name(), List.of(), null);
        }
        if (type instanceof PathType path) {
            return new TypeSpecifier(isConst, path.name(), path.generics(), path.tag());
        }
        if (type instanceof PtrType ptr) {
            declarators.add(new Ptr(isConst, ptr.isNullable(), ptr.isRef()));
            return buildType(ptr.pointee(), ptr.isConst(), declarators);
        }
        if (type instanceof ArrayType array) {
            declarators.add(new Array(array.length()));
            return buildType(array.element(), isConst, declarators);
        }
        if (type instanceof FuncPtrType funcPtr) {
            var params = buildParameters(funcPtr.args());
            declarators.add(new Ptr(false, true, false));
            declarators.add(new Func(params, false));
            return buildType(funcPtr.returnType(), false, declarators);
        }
        throw new AssertionError("Unknown type " + type);
    }

    /**
     * Write the declaration
     *
     * @param ident declared name, {@code null} for a bare type
     */
    public void write(SourceWriter out, @Nullable String ident, Config config) {
        writeSpecifier(out, config);

        // a space between the type and the declarators
        if (ident != null) {
            out.write(" ");
        }

        writeLeftDeclarators(out, config);

        if (ident != null) {
            out.write(ident);
        }

        writeRightDeclarators(out, config);
    }

    private void writeSpecifier(SourceWriter out, Config config) {
        if (specifier.isConst()) {
            out.write("const ");
        }
        if (specifier.tag() != null) {
            out.write(specifier.tag().keyword() + " ");
        }
        out.write(specifier.name());
        if (!specifier.generics().isEmpty()) {
            out.write("<");
            out.writeHorizontalSourceList(specifier.generics(), ListType.join(", "), config);
            out.write(">");
        }
    }

    /**
     * Prefix operators, innermost to outermost
     */
    private void writeLeftDeclarators(SourceWriter out, Config config) {
        ListIterator<CDeclarator> iterator = declarators.listIterator(declarators.size());
        while (iterator.hasPrevious()) {
            var declarator = iterator.previous();
            boolean nextIsPointer = iterator.hasPrevious() && declarators.get(iterator.previousIndex()).isPtr();
            if (declarator instanceof Ptr ptr) {
                out.write(ptr.isRef() ? "&" : "*");
                if (ptr.isConst()) {
                    out.write("const ");
                } else if (!ptr.isNullable() && !ptr.isRef() && config.pointer().nonNullAttribute() != null) {
                    out.write(config.pointer().nonNullAttribute() + " ");
                }
            } else if (nextIsPointer) {
                // arrays and functions bind tighter than pointers
                out.write("(");
            }
        }
    }

    /**
     * Postfix operators, outermost to innermost
     */
    private void writeRightDeclarators(SourceWriter out, Config config) {
        boolean lastWasPointer = false;
        for (CDeclarator declarator : declarators) {
            if (declarator instanceof Ptr) {
                lastWasPointer = true;
            } else if (declarator instanceof Array array) {
                if (lastWasPointer) {
                    out.write(")");
                }
                out.write("[" + array.length() + "]");
                lastWasPointer = false;
            } else if (declarator instanceof Func func) {
                if (lastWasPointer) {
                    out.write(")");
                }
                writeParameters(out, func, config);
                lastWasPointer = true;
            }
        }
    }

    private static void writeParameters(SourceWriter out, Func func, Config config) {
        out.write("(");
        if (func.params().isEmpty() && config.language() == Language.C) {
            out.write("void");
        }
        if (func.layoutVertical()) {
            out.pushSetSpaces(out.lineLengthForAlign());
            for (int i = 0; i < func.params().size(); i++) {
                if (i != 0) {
                    out.write(",");
                    out.newLine();
                }
                var param = func.params().get(i);
                param.decl().write(out, param.name(), config);
            }
            out.popTab();
        } else {
            for (int i = 0; i < func.params().size(); i++) {
                if (i != 0) {
                    out.write(", ");
                }
                var param = func.params().get(i);
                param.decl().write(out, param.name(), config);
            }
        }
        out.write(")");
    }
}
