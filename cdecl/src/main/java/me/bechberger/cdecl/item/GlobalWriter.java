package me.bechberger.cdecl.item;

import me.bechberger.cdecl.config.Config;
import me.bechberger.cdecl.decl.CDeclarations;
import me.bechberger.cdecl.ir.Global;
import me.bechberger.cdecl.writer.SourceWriter;

/**
 * Writes {@code extern} declarations of global variables
 */
public class GlobalWriter {

    private final Config config;

    public GlobalWriter(Config config) {
        this.config = config;
    }

    public void write(SourceWriter out, Global global) {
        out.write("extern ");
        CDeclarations.writeField(out, global.type(), global.name(), config);
        out.write(";");
    }
}
