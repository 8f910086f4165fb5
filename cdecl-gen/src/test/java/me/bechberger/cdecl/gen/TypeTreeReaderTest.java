package me.bechberger.cdecl.gen;

import com.alibaba.fastjson.JSON;
import me.bechberger.cdecl.config.Config;
import me.bechberger.cdecl.config.Language;
import me.bechberger.cdecl.decl.CDeclarations;
import me.bechberger.cdecl.gen.TypeTreeReader.InvalidTypeTreeException;
import me.bechberger.cdecl.ir.DeclarationType;
import me.bechberger.cdecl.ir.Global;
import me.bechberger.cdecl.ir.Struct;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import static me.bechberger.cdecl.ir.Function.function;
import static me.bechberger.cdecl.ir.Struct.field;
import static me.bechberger.cdecl.ir.Type.*;
import static org.junit.jupiter.api.Assertions.*;

public class TypeTreeReaderTest {

    private static final Config CONFIG = Config.DEFAULT.withLanguage(Language.C).withNonNullAttribute("NN");

    private TypeTreeReader reader;

    @BeforeEach
    public void setUp() {
        reader = new TypeTreeReader();
    }

    @ParameterizedTest
    @CsvSource(value = {
            "\"int\"|int x",
            "{\"kind\": \"primitive\", \"name\": \"unsigned long\"}|unsigned long x",
            "{\"kind\": \"ptr\", \"to\": \"char\", \"const\": true}|const char *x",
            "{\"kind\": \"ptr\", \"to\": \"int\", \"nullable\": false}|int *NN x",
            "{\"kind\": \"ptr\", \"to\": {\"kind\": \"array\", \"of\": \"int\", \"length\": 4}}|int (*x)[4]",
            "{\"kind\": \"array\", \"of\": {\"kind\": \"ptr\", \"to\": \"int\"}, \"length\": \"N\"}|int *x[N]",
            "{\"kind\": \"fn\"}|void (*x)(void)",
            "{\"kind\": \"fn\", \"ret\": \"int\", \"args\": [{\"type\": \"int\"}, {\"name\": \"data\", \"type\": " +
                    "{\"kind\": \"ptr\", \"to\": \"void\"}}]}|int (*x)(int, void *data)",
            "{\"kind\": \"ref\", \"to\": \"int\", \"const\": true}|const int &x",
            "{\"kind\": \"ref\", \"to\": \"int\"}|int &x",
            "{\"kind\": \"path\", \"name\": \"Vec\", \"generics\": [\"int\", {\"kind\": \"ptr\", \"to\": \"char\"}]}" +
                    "|Vec<int, char*> x",
            "{\"kind\": \"path\", \"name\": \"Foo\", \"tag\": \"union\"}|union Foo x"
    }, delimiter = '|')
    public void testReadType(String json, String expectedCode) {
        var type = reader.readType(JSON.parse(json));
        assertEquals(expectedCode, CDeclarations.fieldToString(type, "x", CONFIG));
    }

    @Test
    public void testReadSample() throws IOException, URISyntaxException {
        var path = Path.of(Objects.requireNonNull(TypeTreeReaderTest.class.getResource("/sample.json")).toURI());
        var declarations = reader.read(path);
        var node = tagged(DeclarationType.STRUCT, "Node");
        assertEquals(List.of(new Global("handlers", array(funcPtr(_void(), arg(primitive("int"))), "4"))),
                declarations.globals());
        assertEquals(List.of(new Struct("Node", List.of(field("value", primitive("int")), field("next", ptr(node))))),
                declarations.structs());
        assertEquals(List.of(
                function("node_value", primitive("int"), arg("node", new PtrType(node, true, false, false))),
                function("get_matrix", ptr(array(primitive("float"), "4")))), declarations.functions());
    }

    @Test
    public void testEmptyObject() {
        var declarations = reader.read("{}");
        assertTrue(declarations.globals().isEmpty());
        assertTrue(declarations.structs().isEmpty());
        assertTrue(declarations.functions().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"types\": []}",
            "{\"functions\": [{\"args\": []}]}",
            "{\"functions\": [{\"name\": \"f\", \"ret\": {\"kind\": \"tuple\"}}]}",
            "{\"globals\": [{\"name\": \"g\", \"type\": {\"kind\": \"ptr\"}}]}",
            "{\"globals\": [{\"name\": \"g\", \"type\": {\"kind\": \"path\", \"name\": \"A\", \"tag\": \"class\"}}]}",
            "{\"globals\": [{\"name\": \"g\", \"type\": 42}]}",
            "{\"structs\": [\"Foo\"]}",
            "{\"globals\": \"abc\"}",
            "{\"structs\": [{\"name\": \"Foo\", \"fields\": {}}]}",
            "{\"functions\": [{\"name\": \"f\", \"args\": 1}]}",
            "{\"globals\": [{\"name\": \"g\", \"type\": {\"kind\": \"path\", \"name\": \"A\", " +
                    "\"generics\": 5}}]}",
            "{\"globals\": [{\"name\": \"g\", \"type\": {\"kind\": \"ptr\", \"to\": \"int\", " +
                    "\"const\": \"maybe\"}}]}",
            "{\"globals\": [{\"name\": \"g\", \"type\": {\"kind\": \"ptr\", \"to\": \"int\", " +
                    "\"nullable\": 0}}]}",
            "{\"globals\": [{\"name\": \"g\", \"type\": {\"kind\": \"ref\", \"to\": \"int\", " +
                    "\"const\": [true]}}]}",
            "[1]",
            "{\"functions\": ["
    })
    public void testInvalidInput(String json) {
        assertThrows(InvalidTypeTreeException.class, () -> reader.read(json));
    }
}
