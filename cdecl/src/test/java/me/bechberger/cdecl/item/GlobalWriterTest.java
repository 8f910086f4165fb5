package me.bechberger.cdecl.item;

import me.bechberger.cdecl.config.Config;
import me.bechberger.cdecl.config.Language;
import me.bechberger.cdecl.ir.Global;
import me.bechberger.cdecl.writer.SourceWriter;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static me.bechberger.cdecl.ir.Type.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class GlobalWriterTest {

    static Stream<Arguments> globalsAndExpectedCode() {
        return Stream.of(
                Arguments.of(new Global("counter", primitive("int")), "extern int counter;"),
                Arguments.of(new Global("table", array(constPtr(primitive("char")), "16")), "extern const char *table[16];"),
                Arguments.of(new Global("handler", funcPtr(_void())), "extern void (*handler)(void);"));
    }

    @ParameterizedTest
    @MethodSource("globalsAndExpectedCode")
    public void testGlobal(Global global, String expectedCode) {
        var config = Config.DEFAULT.withLanguage(Language.C);
        var out = new SourceWriter(config);
        new GlobalWriter(config).write(out, global);
        assertEquals(expectedCode, out.output());
    }
}
