package com.tracegate.proxy.core.hook;

import java.util.Iterator;
import java.util.Map;

import org.luaj.vm2.LuaInteger;
import org.luaj.vm2.LuaTable;
import org.luaj.vm2.LuaValue;
import org.luaj.vm2.Varargs;
import org.luaj.vm2.lib.TwoArgFunction;
import org.luaj.vm2.lib.VarArgFunction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.tracegate.proxy.core.utils.JsonSupport;

/**
 * The {@code json} module available to hook scripts through
 * {@code require("json")}.
 * <p>
 * {@code json.decode(s)} returns the decoded value, or {@code nil} and an error
 * message. {@code json.encode(v)} returns a JSON string, or {@code nil} and an
 * error message. Objects become tables keyed by strings, arrays become 1-based
 * sequences and {@code null} becomes {@code nil}. When encoding, a table whose
 * keys are exactly {@code 1..n} (n &gt; 0) is written as an array; every other
 * table, the empty one included, is written as an object.
 * </p>
 */
public class LuaJsonLib extends TwoArgFunction {

    /** Module name passed to {@code require}. */
    public static final String MODULE_NAME = "json";

    /** Deepest table nesting {@code encode} accepts. */
    public static final int MAX_DEPTH = 64;

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Module loader: called by {@code require} with the module name.
     */
    @Override
    public LuaValue call(LuaValue modname, LuaValue env) {
        LuaTable module = new LuaTable();
        module.set("decode", new Decode());
        module.set("encode", new Encode());
        return module;
    }

    static final class Decode extends VarArgFunction {
        @Override
        public Varargs invoke(Varargs args) {
            String text = args.checkjstring(1);
            try {
                JsonNode node = mapper().readTree(text);
                if (node.isMissingNode()) {
                    return varargsOf(NIL, valueOf("unexpected end of JSON input"));
                }
                return toLua(node);
            } catch (JsonProcessingException e) {
                return varargsOf(NIL, valueOf(e.getOriginalMessage()));
            }
        }
    }

    static final class Encode extends VarArgFunction {
        @Override
        public Varargs invoke(Varargs args) {
            try {
                return valueOf(mapper().writeValueAsString(toJson(args.arg1(), 0)));
            } catch (JsonEncodeException e) {
                return varargsOf(NIL, valueOf(e.getMessage()));
            } catch (JsonProcessingException e) {
                return varargsOf(NIL, valueOf(e.getOriginalMessage()));
            }
        }
    }

    /**
     * Converts a Jackson tree into Lua values.
     */
    static LuaValue toLua(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return LuaValue.NIL;
        }
        if (node.isObject()) {
            LuaTable table = new LuaTable();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                table.set(LuaValue.valueOf(field.getKey()), toLua(field.getValue()));
            }
            return table;
        }
        if (node.isArray()) {
            LuaTable table = new LuaTable();
            int i = 1;
            for (JsonNode element : node) {
                table.set(i++, toLua(element));
            }
            return table;
        }
        if (node.isTextual()) {
            return LuaValue.valueOf(node.textValue());
        }
        if (node.isBoolean()) {
            return LuaValue.valueOf(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return LuaInteger.valueOf(node.longValue());
        }
        if (node.isNumber()) {
            return LuaValue.valueOf(node.doubleValue());
        }
        return LuaValue.valueOf(node.asText());
    }

    /**
     * Converts a Lua value into a Jackson tree.
     * 
     * @throws JsonEncodeException If the value has no JSON form.
     */
    static JsonNode toJson(LuaValue value, int depth) throws JsonEncodeException {
        if (depth > MAX_DEPTH) {
            throw new JsonEncodeException("nesting deeper than " + MAX_DEPTH + " levels");
        }
        switch (value.type()) {
            case LuaValue.TNIL:
                return NODES.nullNode();
            case LuaValue.TBOOLEAN:
                return NODES.booleanNode(value.toboolean());
            case LuaValue.TSTRING:
                return NODES.textNode(value.tojstring());
            case LuaValue.TNUMBER:
                return number(value);
            case LuaValue.TTABLE:
                return table(value.checktable(), depth);
            default:
                throw new JsonEncodeException("cannot encode value of type " + value.typename());
        }
    }

    private static JsonNode number(LuaValue value) throws JsonEncodeException {
        if (value.isinttype()) {
            return NODES.numberNode(value.toint());
        }
        double d = value.todouble();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new JsonEncodeException("cannot encode non-finite number");
        }
        if (d == Math.rint(d) && Math.abs(d) < 9.007199254740992E15) {
            return NODES.numberNode((long) d);
        }
        return NODES.numberNode(d);
    }

    private static JsonNode table(LuaTable table, int depth) throws JsonEncodeException {
        int length = table.length();
        int keys = 0;
        LuaValue key = LuaValue.NIL;
        while (true) {
            Varargs entry = table.next(key);
            key = entry.arg1();
            if (key.isnil()) {
                break;
            }
            keys++;
        }

        if (length > 0 && keys == length) {
            ArrayNode array = NODES.arrayNode(length);
            for (int i = 1; i <= length; i++) {
                array.add(toJson(table.get(i), depth + 1));
            }
            return array;
        }

        ObjectNode object = NODES.objectNode();
        key = LuaValue.NIL;
        while (true) {
            Varargs entry = table.next(key);
            key = entry.arg1();
            if (key.isnil()) {
                break;
            }
            int keyType = key.type();
            if (keyType != LuaValue.TSTRING && keyType != LuaValue.TNUMBER) {
                throw new JsonEncodeException("cannot encode table key of type " + key.typename());
            }
            object.set(key.tojstring(), toJson(entry.arg(2), depth + 1));
        }
        return object;
    }

    private static ObjectMapper mapper() {
        return JsonSupport.mapper();
    }

    /**
     * Raised while converting a Lua value that has no JSON representation.
     */
    static final class JsonEncodeException extends Exception {
        JsonEncodeException(String message) {
            super(message);
        }
    }
}
