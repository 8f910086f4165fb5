package me.bechberger.cdecl.gen;

import me.bechberger.cdecl.config.Config;
import me.bechberger.cdecl.config.FunctionConfig;
import me.bechberger.cdecl.config.Language;
import me.bechberger.cdecl.config.Layout;
import me.bechberger.cdecl.config.PointerConfig;
import me.bechberger.cdecl.config.Style;
import me.bechberger.cdecl.gen.TypeTreeReader.Declarations;
import me.bechberger.cdecl.item.FunctionWriter;
import me.bechberger.cdecl.item.GlobalWriter;
import me.bechberger.cdecl.item.StructWriter;
import me.bechberger.cdecl.writer.SourceWriter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Usage: java ... [options] <type-tree-json-file>
 */
@Command(name = "cdecl-gen", mixinStandardHelpOptions = true,
        description = "Prints C or C++ declarations for the globals, structs and functions in a JSON type tree file")
public class Main implements Runnable {

    private static final Logger logger = Logger.getLogger(Main.class.getName());

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "JSON file with the type trees")
    private Path input;

    @Option(names = {"-l", "--lang"}, description = "Target language: c or c++, default ${DEFAULT-VALUE}",
            defaultValue = "c++", converter = LanguageConverter.class)
    private Language language = Language.CXX;

    @Option(names = "--style", description = "Struct style in C: ${COMPLETION-CANDIDATES}, default ${DEFAULT-VALUE}",
            defaultValue = "BOTH")
    private Style style = Style.BOTH;

    @Option(names = "--args", description = "Function argument layout: ${COMPLETION-CANDIDATES}, default "
            + "${DEFAULT-VALUE}", defaultValue = "AUTO")
    private Layout args = Layout.AUTO;

    @Option(names = "--line-length", description = "Line length for the automatic layout, default ${DEFAULT-VALUE}",
            defaultValue = "100")
    private int lineLength = 100;

    @Option(names = "--tab-width", description = "Spaces per indentation level, default ${DEFAULT-VALUE}",
            defaultValue = "2")
    private int tabWidth = 2;

    @Option(names = "--non-null-attribute", description = "Annotation for pointers that are never null, e.g. "
            + "_Nonnull")
    private String nonNullAttribute;

    @Option(names = "--function-prefix", description = "Text in front of every function prototype")
    private String functionPrefix;

    @Option(names = "--function-postfix", description = "Text after every function prototype")
    private String functionPostfix;

    @Option(names = {"-v", "--verbose"}, description = "Be verbose")
    private boolean verbose = false;

    Config createConfig() {
        if (lineLength <= 0) {
            throw new ParameterException(spec.commandLine(), "Line length has to be positive, not " + lineLength);
        }
        if (tabWidth < 0) {
            throw new ParameterException(spec.commandLine(), "Tab width must not be negative, not " + tabWidth);
        }
        return new Config(language, style, new PointerConfig(nonNullAttribute),
                new FunctionConfig(functionPrefix, functionPostfix, args), lineLength, tabWidth);
    }

    @Override
    public void run() {
        if (verbose) {
            Logger.getGlobal().setLevel(Level.ALL);
        }
        var config = createConfig();
        try {
            var declarations = new TypeTreeReader().read(input);
            logger.fine("Writing " + input + " with " + config);
            spec.commandLine().getOut().print(render(declarations, config));
            spec.commandLine().getOut().flush();
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Write globals, then structs, then functions, separated by blank lines
     */
    static String render(Declarations declarations, Config config) {
        var out = new SourceWriter(config);
        var globalWriter = new GlobalWriter(config);
        var structWriter = new StructWriter(config);
        var functionWriter = new FunctionWriter(config);
        boolean first = true;
        for (var global : declarations.globals()) {
            first = separate(out, first);
            globalWriter.write(out, global);
        }
        for (var struct : declarations.structs()) {
            first = separate(out, first);
            structWriter.write(out, struct);
        }
        for (var function : declarations.functions()) {
            first = separate(out, first);
            functionWriter.write(out, function);
        }
        if (!first) {
            out.newLine();
        }
        return out.output();
    }

    private static boolean separate(SourceWriter out, boolean first) {
        if (!first) {
            out.newLine();
            out.newLine();
        }
        return false;
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        // use picocli + help if no args
        if (args.length == 0) {
            createCommandLine().execute("--help");
            return;
        }
        System.exit(createCommandLine().execute(args));
    }
}
