package com.tracegate.proxy.core.hook;

import java.util.Locale;

import org.luaj.vm2.LuaTable;
import org.luaj.vm2.LuaValue;
import org.luaj.vm2.Varargs;

import com.tracegate.proxy.core.exceptions.HookExecutionException;
import com.tracegate.proxy.core.http.HeaderMap;

/**
 * Converts headers between {@link HeaderMap} and the Lua table shape scripts
 * see: lower-cased names mapping to 1-based lists of values.
 */
public final class LuaHeaders {

    private LuaHeaders() {
        // Utility class
    }

    public static LuaTable toTable(HeaderMap headers) {
        LuaTable table = new LuaTable();
        headers.forEachValue((name, value) -> {
            LuaValue key = LuaValue.valueOf(name.toLowerCase(Locale.ROOT));
            LuaValue list = table.get(key);
            if (list.isnil()) {
                list = new LuaTable();
                table.set(key, list);
            }
            list.set(list.length() + 1, LuaValue.valueOf(value));
        });
        return table;
    }

    /**
     * Reads a header table returned by a script. A list value contributes its
     * elements in order; a string or number is taken as a single value.
     * 
     * @throws HookExecutionException If a value has any other type.
     */
    public static HeaderMap fromTable(LuaTable table) {
        HeaderMap headers = new HeaderMap();
        LuaValue key = LuaValue.NIL;
        while (true) {
            Varargs entry = table.next(key);
            key = entry.arg1();
            if (key.isnil()) {
                break;
            }
            String name = key.tojstring();
            LuaValue value = entry.arg(2);
            if (value.istable()) {
                int n = value.length();
                for (int i = 1; i <= n; i++) {
                    headers.add(name, scalar(name, value.get(i)));
                }
            } else {
                headers.add(name, scalar(name, value));
            }
        }
        return headers;
    }

    private static String scalar(String name, LuaValue value) {
        int type = value.type();
        if (type == LuaValue.TSTRING || type == LuaValue.TNUMBER) {
            return value.tojstring();
        }
        throw new HookExecutionException("Header '" + name + "' has unsupported value type " + value.typename());
    }
}
