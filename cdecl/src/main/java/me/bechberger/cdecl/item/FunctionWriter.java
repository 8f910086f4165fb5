package me.bechberger.cdecl.item;

import me.bechberger.cdecl.config.Config;
import me.bechberger.cdecl.config.Layout;
import me.bechberger.cdecl.decl.CDeclarations;
import me.bechberger.cdecl.ir.Function;
import me.bechberger.cdecl.writer.SourceWriter;

import java.util.logging.Logger;

/**
 * Writes function prototypes like {@code PREFIX int foo(int a, char *b) POSTFIX;}
 */
public class FunctionWriter {

    private static final Logger logger = Logger.getLogger(FunctionWriter.class.getName());

    private final Config config;

    public FunctionWriter(Config config) {
        this.config = config;
    }

    public void write(SourceWriter out, Function function) {
        var layout = config.function().args();
        switch (layout) {
            case HORIZONTAL -> write(out, function, false);
            case VERTICAL -> write(out, function, true);
            case AUTO -> {
                if (!out.tryWrite(o -> write(o, function, false), config.lineLength())) {
                    logger.finest("Function " + function.name() + " does not fit into " + config.lineLength()
                            + " characters, using " + Layout.VERTICAL + " layout");
                    write(out, function, true);
                }
            }
        }
    }

    private void write(SourceWriter out, Function function, boolean layoutVertical) {
        var prefix = config.function().prefix();
        if (prefix != null) {
            out.write(prefix + " ");
        }
        CDeclarations.writeFunc(out, function, layoutVertical, config);
        var postfix = config.function().postfix();
        if (postfix != null) {
            out.write(" " + postfix);
        }
        out.write(";");
    }
}
