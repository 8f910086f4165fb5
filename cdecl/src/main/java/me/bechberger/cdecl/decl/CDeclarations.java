package me.bechberger.cdecl.decl;

import me.bechberger.cdecl.config.Config;
import me.bechberger.cdecl.ir.Function;
import me.bechberger.cdecl.ir.Type;
import me.bechberger.cdecl.writer.SourceWriter;

/**
 * Writes types, fields and function signatures as C declarations
 * <p>
 * Example: {@code writeField(out, ptr(array(primitive("int"), "4")), "x", config)} writes {@code int (*x)[4]}
 */
public final class CDeclarations {

    private CDeclarations() {
    }

    /**
     * Write the signature of the function, without a trailing semicolon
     *
     * @param layoutVertical write every argument on its own line
     */
    public static void writeFunc(SourceWriter out, Function function, boolean layoutVertical, Config config) {
        CDecl.fromFunc(function, layoutVertical).write(out, function.name(), config);
    }

    public static void writeField(SourceWriter out, Type type, String ident, Config config) {
        CDecl.fromType(type).write(out, ident, config);
    }

    public static void writeType(SourceWriter out, Type type, Config config) {
        CDecl.fromType(type).write(out, null, config);
    }

    /**
     * Returns the bare type name, e.g. {@code int(*)[4]}
     */
    public static String typeToString(Type type, Config config) {
        var out = new SourceWriter(config);
        writeType(out, type, config);
        return out.output();
    }

    public static String fieldToString(Type type, String ident, Config config) {
        var out = new SourceWriter(config);
        writeField(out, type, ident, config);
        return out.output();
    }
}
