package me.bechberger.cdecl.item;

import me.bechberger.cdecl.config.Config;
import me.bechberger.cdecl.config.FunctionConfig;
import me.bechberger.cdecl.config.Language;
import me.bechberger.cdecl.config.Layout;
import me.bechberger.cdecl.ir.Function;
import me.bechberger.cdecl.writer.SourceWriter;
import org.junit.jupiter.api.Test;

import static me.bechberger.cdecl.ir.Function.function;
import static me.bechberger.cdecl.ir.Type.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class FunctionWriterTest {

    private static final Config C = Config.DEFAULT.withLanguage(Language.C);

    private static final Function PROCESS = function("process", primitive("int"),
            arg("input", constPtr(primitive("char"))),
            arg("length", primitive("size_t")),
            arg("callback", funcPtr(_void(), arg(ptr(_void())))));

    private static String write(Config config, Function function) {
        var out = new SourceWriter(config);
        new FunctionWriter(config).write(out, function);
        return out.output();
    }

    @Test
    public void testHorizontal() {
        var config = C.withFunction(FunctionConfig.DEFAULT.withArgs(Layout.HORIZONTAL)).withLineLength(10);
        assertEquals("int process(const char *input, size_t length, void (*callback)(void*));", write(config, PROCESS));
    }

    @Test
    public void testVertical() {
        var config = C.withFunction(FunctionConfig.DEFAULT.withArgs(Layout.VERTICAL));
        assertEquals("""
                int process(const char *input,
                            size_t length,
                            void (*callback)(void*));""", write(config, PROCESS));
    }

    @Test
    public void testAutoUsesHorizontalIfItFits() {
        assertEquals("int process(const char *input, size_t length, void (*callback)(void*));", write(C, PROCESS));
    }

    @Test
    public void testAutoUsesVerticalIfTooLong() {
        assertEquals("""
                int process(const char *input,
                            size_t length,
                            void (*callback)(void*));""", write(C.withLineLength(40), PROCESS));
    }

    @Test
    public void testAutoCountsTheSemicolon() {
        var function = function("f", _void(), arg("a", primitive("int")));
        // "void f(int a);" has 14 characters
        assertEquals("void f(int a);", write(C.withLineLength(14), function));
        assertEquals("void f(int a);", write(C.withLineLength(13), function));
        assertEquals("void f(int a,\n       int b);",
                write(C.withLineLength(13), function("f", _void(), arg("a", primitive("int")), arg("b", primitive("int")))));
    }

    @Test
    public void testPrefixAndPostfix() {
        var config = C.withFunction(new FunctionConfig("EXPORT", "NOEXCEPT", Layout.AUTO));
        assertEquals("EXPORT void init(void) NOEXCEPT;", write(config, function("init", _void())));
    }

    @Test
    public void testVerticalWithPrefixAlignsAfterPrefix() {
        var config = C.withFunction(new FunctionConfig("API", null, Layout.VERTICAL));
        assertEquals("API int *f(int a,\n           int b);",
                write(config, function("f", ptr(primitive("int")), arg("a", primitive("int")), arg("b", primitive("int")))));
    }
}
