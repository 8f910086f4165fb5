package me.bechberger.cdecl.item;

import me.bechberger.cdecl.config.Config;
import me.bechberger.cdecl.config.Language;
import me.bechberger.cdecl.decl.CDeclarations;
import me.bechberger.cdecl.ir.Struct;
import me.bechberger.cdecl.writer.SourceWriter;

/**
 * Writes struct definitions, the header depends on the {@link me.bechberger.cdecl.config.Style} in C
 * <p>
 * Example: <pre>{@code
 * typedef struct Foo {
 *   int (*x)[4];
 * } Foo;
 * }</pre>
 */
public class StructWriter {

    private final Config config;

    public StructWriter(Config config) {
        this.config = config;
    }

    public void write(SourceWriter out, Struct struct) {
        boolean isC = config.language() == Language.C;
        boolean typedef = isC && config.style().generateTypedef();
        boolean tag = !isC || config.style().generateTag();

        if (typedef) {
            out.write("typedef ");
        }
        out.write(tag ? "struct " + struct.name() + " {" : "struct {");

        out.pushTab();
        for (var field : struct.fields()) {
            out.newLine();
            CDeclarations.writeField(out, field.type(), field.name(), config);
            out.write(";");
        }
        out.popTab();

        out.newLine();
        out.write(typedef ? "} " + struct.name() + ";" : "};");
    }
}
