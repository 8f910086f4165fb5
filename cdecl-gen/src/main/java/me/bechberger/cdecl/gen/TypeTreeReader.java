package me.bechberger.cdecl.gen;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import me.bechberger.cdecl.ir.DeclarationType;
import me.bechberger.cdecl.ir.Function;
import me.bechberger.cdecl.ir.Global;
import me.bechberger.cdecl.ir.Struct;
import me.bechberger.cdecl.ir.Type;
import me.bechberger.cdecl.ir.Type.Argument;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads type trees, functions, structs and globals from JSON
 * <p>
 * Expected format of the file:
 * <pre>{@code
 * {
 *   "globals": [{"name": "counter", "type": <type>}],
 *   "structs": [{"name": "Foo", "fields": [{"name": "a", "type": <type>}]}],
 *   "functions": [{"name": "foo", "args": [{"name": "a", "type": <type>}], "ret": <type>}]
 * }
 * }</pre>
 * All three lists are optional, a function without {@code ret} returns {@code void}.
 * A type is either a string (primitive type name) or an object with a {@code kind}:
 * <ul>
 *     <li>{@code {"kind": "primitive", "name": "int"}}</li>
 *     <li>{@code {"kind": "path", "name": "Vec", "generics": [<type>], "tag": "struct"}},
 *     generics and tag are optional</li>
 *     <li>{@code {"kind": "ptr", "to": <type>, "const": false, "nullable": true}},
 *     const defaults to false, nullable to true</li>
 *     <li>{@code {"kind": "ref", "to": <type>, "const": false}}</li>
 *     <li>{@code {"kind": "array", "of": <type>, "length": "4"}}</li>
 *     <li>{@code {"kind": "fn", "ret": <type>, "args": [{"name": "a", "type": <type>}]}},
 *     argument names are optional</li>
 * </ul>
 */
public class TypeTreeReader {

    private static final Logger logger = Logger.getLogger(TypeTreeReader.class.getName());

    private static final Set<String> TOP_LEVEL_KEYS = Set.of("globals", "structs", "functions");

    public static class InvalidTypeTreeException extends RuntimeException {
        public InvalidTypeTreeException(String message) {
            super(message);
        }

        public InvalidTypeTreeException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Everything declared in one file, in file order
     */
    public record Declarations(List<Global> globals, List<Struct> structs, List<Function> functions) {
        public Declarations {
            globals = List.copyOf(globals);
            structs = List.copyOf(structs);
            functions = List.copyOf(functions);
        }
    }

    public Declarations read(Path jsonFile) throws IOException {
        return read(Files.readString(jsonFile));
    }

    public Declarations read(String json) {
        JSONObject root;
        try {
            root = JSON.parseObject(json);
        } catch (JSONException e) {
            throw new InvalidTypeTreeException("Cannot parse JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new InvalidTypeTreeException("Expected a JSON object, got an empty document");
        }
        if (!TOP_LEVEL_KEYS.containsAll(root.keySet())) {
            throw new InvalidTypeTreeException("Unexpected JSON format, expected top-level object to only contain "
                    + "the keys " + TOP_LEVEL_KEYS + ", not " + root.keySet());
        }
        List<Global> globals = new ArrayList<>();
        for (JSONObject global : objects(root, "globals")) {
            globals.add(new Global(requireString(global, "name"), readType(require(global, "type"))));
        }
        List<Struct> structs = new ArrayList<>();
        for (JSONObject struct : objects(root, "structs")) {
            structs.add(readStruct(struct));
        }
        List<Function> functions = new ArrayList<>();
        for (JSONObject function : objects(root, "functions")) {
            functions.add(readFunction(function));
        }
        logger.fine("Read " + globals.size() + " globals, " + structs.size() + " structs and " + functions.size()
                + " functions");
        return new Declarations(globals, structs, functions);
    }

    Struct readStruct(JSONObject struct) {
        var name = requireString(struct, "name");
        List<Struct.Field> fields = new ArrayList<>();
        for (JSONObject field : objects(struct, "fields")) {
            fields.add(new Struct.Field(requireString(field, "name"), readType(require(field, "type"))));
        }
        return new Struct(name, fields);
    }

    Function readFunction(JSONObject function) {
        var name = requireString(function, "name");
        var ret = function.containsKey("ret") ? readType(function.get("ret")) : Type._void();
        return new Function(name, readArguments(function), ret);
    }

    private List<Argument> readArguments(JSONObject owner) {
        List<Argument> args = new ArrayList<>();
        for (JSONObject arg : objects(owner, "args")) {
            args.add(new Argument(arg.getString("name"), readType(require(arg, "type"))));
        }
        return args;
    }

    /**
     * Read a type, either a primitive type name or a type object
     */
    public Type readType(Object json) {
        if (json instanceof String name) {
            return Type.primitive(name);
        }
        if (!(json instanceof JSONObject type)) {
            throw new InvalidTypeTreeException("Expected a type name or object, got " + json);
        }
        var kind = requireString(type, "kind");
        switch (kind) {
            case "primitive" -> {
                return Type.primitive(requireString(type, "name"));
            }
            case "path" -> {
                return new Type.PathType(requireString(type, "name"), readTypes(type, "generics"), readTag(type));
            }
            case "ptr" -> {
                return new Type.PtrType(readType(require(type, "to")), readBoolean(type, "const", false),
                        readBoolean(type, "nullable", true), false);
            }
            case "ref" -> {
                return new Type.PtrType(readType(require(type, "to")), readBoolean(type, "const", false), false, true);
            }
            case "array" -> {
                return Type.array(readType(require(type, "of")), requireString(type, "length"));
            }
            case "fn" -> {
                var ret = type.containsKey("ret") ? readType(type.get("ret")) : Type._void();
                return new Type.FuncPtrType(ret, readArguments(type));
            }
            default -> throw new InvalidTypeTreeException("Unknown type kind '" + kind + "' in " + type);
        }
    }

    private List<Type> readTypes(JSONObject owner, String key) {
        var array = array(owner, key);
        if (array == null) {
            return List.of();
        }
        return array.stream().map(this::readType).toList();
    }

    private static @Nullable DeclarationType readTag(JSONObject type) {
        var keyword = type.getString("tag");
        if (keyword == null) {
            return null;
        }
        var tag = DeclarationType.fromKeyword(keyword);
        if (tag == null) {
            throw new InvalidTypeTreeException("Unknown tag '" + keyword + "' in " + type);
        }
        return tag;
    }

    private static @Nullable JSONArray array(JSONObject owner, String key) {
        var value = owner.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof JSONArray array)) {
            throw new InvalidTypeTreeException("Expected an array for '" + key + "', got " + value + " in " + owner);
        }
        return array;
    }

    private static boolean readBoolean(JSONObject owner, String key, boolean defaultValue) {
        var value = owner.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean bool)) {
            throw new InvalidTypeTreeException("Expected a boolean for '" + key + "', got " + value + " in " + owner);
        }
        return bool;
    }

    private static List<JSONObject> objects(JSONObject owner, String key) {
        var array = array(owner, key);
        if (array == null) {
            return List.of();
        }
        List<JSONObject> objects = new ArrayList<>();
        for (Object element : array) {
            if (!(element instanceof JSONObject object)) {
                throw new InvalidTypeTreeException("Expected objects in '" + key + "', got " + element);
            }
            objects.add(object);
        }
        return objects;
    }

    private static Object require(JSONObject object, String key) {
        var value = object.get(key);
        if (value == null) {
            throw new InvalidTypeTreeException("Missing '" + key + "' in " + object);
        }
        return value;
    }

    private static String requireString(JSONObject object, String key) {
        return require(object, key).toString();
    }
}
