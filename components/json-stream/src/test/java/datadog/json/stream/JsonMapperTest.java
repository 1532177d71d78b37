package datadog.json.stream;

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonMapperTest {
  @Test
  void testMapToJson() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("string", "bar");
    map.put("int", 3);
    map.put("long", 3456789123L);
    map.put("float", 3.5f);
    map.put("shortFloat", 1.1f);
    map.put("double", Math.PI);
    map.put("true", true);
    map.put("false", false);
    map.put("null", null);
    map.put("other", new StringBuilder("sb"));
    assertEquals(
        "{\"string\":\"bar\",\"int\":3,\"long\":3456789123,\"float\":3.5,\"shortFloat\":1.1,\"double\":3.141592653589793,\"true\":true,\"false\":false,\"null\":null,\"other\":\"sb\"}",
        JsonMapper.toJson(map),
        "Check map conversion");
    assertEquals("{}", JsonMapper.toJson(emptyMap()), "Check empty map");
    assertEquals("{}", JsonMapper.toJson((Map<String, ?>) null), "Check null map");
  }

  @Test
  void testCollectionToJson() {
    assertEquals(
        "[\"foo\",\"baz\",\"bar\",\"quux\"]",
        JsonMapper.toJson(asList("foo", "baz", "bar", "quux")),
        "Check collection conversion");
    assertEquals("[]", JsonMapper.toJson(emptyList()), "Check empty collection");
    assertEquals(
        "[\"a\",null]", JsonMapper.toJson(asList("a", null)), "Check collection null item");
  }

  @Test
  void testArrayToJson() {
    assertEquals(
        "[\"\\\"\",\"\\\\\",\"\\n\",\"\\t\"]",
        JsonMapper.toJson(new String[] {"\"", "\\", "\n", "\t"}),
        "Check string array escaping");
    assertEquals("[]", JsonMapper.toJson(new String[0]), "Check empty array");
    assertEquals("[]", JsonMapper.toJson((String[]) null), "Check null array");
  }

  @Test
  void testDocumentToJson() {
    assertEquals("", JsonMapper.toJson(root -> {}), "Check empty document");
    assertEquals(
        "{\"array\":[\"true\",\"false\"]}",
        JsonMapper.toJson(
            root ->
                root.object(o -> o.item("array").array(a -> a.value("true").value("false")))),
        "Check array / object nesting");
    assertEquals(
        "[{\"true\":true},{\"false\":false}]",
        JsonMapper.toJson(
            root ->
                root.array(
                    a -> {
                      a.object(o -> o.item("true").value(true));
                      a.object(o -> o.item("false").value(false));
                    })),
        "Check object / array nesting");
  }
}
