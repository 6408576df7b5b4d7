package com.tracegate.proxy.core.hook;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tracegate.proxy.core.http.HeaderMap;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class LuaJsonLibTest {

    private LuaSandbox sandbox;

    @BeforeEach
    void setUp() {
        sandbox = new LuaSandbox();
    }

    @AfterEach
    void tearDown() {
        sandbox.close();
    }

    /**
     * Runs {@code expr} inside processRequest and returns its string result.
     */
    private String eval(String expr) {
        sandbox.execute("local json = require('json')\n"
                + "function processRequest(body, headers)\n"
                + "  return tostring(" + expr + "), headers\n"
                + "end", "json-test");
        HookResult result = sandbox.call("processRequest", new byte[0], new HeaderMap());
        return new String(result.body(), StandardCharsets.UTF_8);
    }

    @Test
    void decode_objectAndArray() {
        assertThat(eval("json.decode('{\"a\":{\"b\":[10,20,30]}}').a.b[2]")).isEqualTo("20");
        assertThat(eval("#json.decode('[1,2,3,4]')")).isEqualTo("4");
        assertThat(eval("json.decode('\"text\"')")).isEqualTo("text");
    }

    @Test
    void decode_nullBecomesNil() {
        assertThat(eval("json.decode('{\"a\":null}').a")).isEqualTo("nil");
    }

    @Test
    void decode_invalid_returnsNilAndMessage() {
        assertThat(eval("select(1, json.decode('{broken'))")).isEqualTo("nil");
        assertThat(eval("type(select(2, json.decode('{broken')))")).isEqualTo("string");
        assertThat(eval("select(2, json.decode(''))")).isEqualTo("unexpected end of JSON input");
    }

    @Test
    void encode_sequenceAsArray_otherTablesAsObjects() {
        assertThat(eval("json.encode({1, 2, 'three'})")).isEqualTo("[1,2,\"three\"]");
        assertThat(eval("json.encode({model = 'gpt'})")).isEqualTo("{\"model\":\"gpt\"}");
        assertThat(eval("json.encode({})")).isEqualTo("{}");
        assertThat(eval("json.encode({[1] = 'a', [3] = 'c'})")).startsWith("{");
    }

    @Test
    void encode_numbers() {
        assertThat(eval("json.encode(3)")).isEqualTo("3");
        assertThat(eval("json.encode(2.5)")).isEqualTo("2.5");
        assertThat(eval("json.encode(true)")).isEqualTo("true");
    }

    @Test
    void encode_unsupportedValue_returnsNilAndMessage() {
        assertThat(eval("select(1, json.encode({f = function() end}))")).isEqualTo("nil");
        assertThat(eval("select(2, json.encode(print))")).contains("function");
    }

    @Test
    void encode_tooDeep_returnsError() {
        String deep = "(function() local t = {} local c = t for i = 1, 100 do c.n = {} c = c.n end return t end)()";

        assertThat(eval("select(2, json.encode(" + deep + "))")).contains("nesting");
    }

    @Test
    void decodeThenEncode_keepsStructure() {
        assertThat(eval("json.encode(json.decode('{\"messages\":[{\"role\":\"user\"}]}'))"))
                .isEqualTo("{\"messages\":[{\"role\":\"user\"}]}");
    }
}
