package io.github.flexsource.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonFlattenerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void flatten_正常ケース_入れ子オブジェクトを指定する_ドット区切りのキーになること() throws Exception {
        Map<String, Object> flat =
                JsonFlattener.flatten(mapper.readTree("{\"a\": {\"b\": 1, \"c\": {\"d\": \"x\"}}}"));
        assertEquals(Arrays.asList("a.b", "a.c.d"), Arrays.asList(flat.keySet().toArray()));
        assertEquals(1L, flat.get("a.b"));
        assertEquals("x", flat.get("a.c.d"));
    }

    @Test
    void flatten_正常ケース_オブジェクトのリストを指定する_アスタリスク区切りで値が集約されること()
            throws Exception {
        Map<String, Object> flat = JsonFlattener.flatten(mapper.readTree(
                "{\"persons\": [{\"name\": \"Alice\", \"lastName\": \"Smith\"},"
                        + " {\"name\": \"Bob\", \"lastName\": \"Jones\"}]}"));
        assertEquals(Arrays.asList("Alice", "Bob"), flat.get("persons.*.name"));
        assertEquals(Arrays.asList("Smith", "Jones"), flat.get("persons.*.lastName"));
    }

    @Test
    void flatten_正常ケース_入れ子のリストを指定する_値が一つのリストにまとめられること() throws Exception {
        Map<String, Object> flat = JsonFlattener.flatten(mapper.readTree(
                "{\"c\": [{\"o\": [{\"k\": 1}, {\"k\": 2}]}, {\"o\": [{\"k\": 3}]}]}"));
        assertEquals(Arrays.asList(1L, 2L, 3L), flat.get("c.*.o.*.k"));
    }

    @Test
    void flatten_正常ケース_スカラーのリストを指定する_リストの値のまま残ること() throws Exception {
        Map<String, Object> flat = JsonFlattener.flatten(mapper.readTree("{\"tags\": [\"a\", \"b\"]}"));
        assertEquals(Arrays.asList("a", "b"), flat.get("tags"));
    }

    @Test
    void flattenObjects_正常ケース_オブジェクトのリストを指定する_リストは展開されないこと() throws Exception {
        Map<String, Object> flat = JsonFlattener.flattenObjects(
                mapper.readTree("{\"m\": {\"x\": true}, \"l\": [{\"y\": null}]}"));
        assertEquals(true, flat.get("m.x"));
        List<Object> list = Collections.singletonList(Collections.singletonMap("y", null));
        assertEquals(list, flat.get("l"));
    }

    @Test
    void toJava_正常ケース_各種の値を指定する_対応するJava型に変換されること() throws Exception {
        assertEquals(3L, JsonFlattener.toJava(mapper.readTree("3")));
        assertEquals(1.5d, JsonFlattener.toJava(mapper.readTree("1.5")));
        assertEquals("s", JsonFlattener.toJava(mapper.readTree("\"s\"")));
        assertEquals(false, JsonFlattener.toJava(mapper.readTree("false")));
        assertNull(JsonFlattener.toJava(mapper.readTree("null")));
        assertEquals(Collections.singletonMap("a", Arrays.asList(1L, 2L)),
                JsonFlattener.toJava(mapper.readTree("{\"a\": [1, 2]}")));
    }
}
