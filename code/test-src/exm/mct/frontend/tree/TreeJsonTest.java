package exm.mct.frontend.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import java.io.IOException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import exm.mct.ui.CompileResult;
import exm.mct.ui.MCTCompiler;

public class TreeJsonTest {

  private static final String PROGRAM =
      "int add(int a, int b) { return a + b; }\n" +
      "void show(bool flag) { if (flag) print(1); else { print(0); } }\n" +
      "int main() {\n" +
      "  int i;\n" +
      "  bool done = false;\n" +
      "  while (i < 3) { i = add(i, 1); }\n" +
      "  show(done == true);\n" +
      "  ;\n" +
      "  return i / 2;\n" +
      "}\n";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Program compile(String source) {
    CompileResult result = new MCTCompiler().compile(source);
    assertTrue(result.toString(), result.isSuccess());
    return result.getProgram();
  }

  @Test
  public void testRoundTrip() throws IOException {
    Program original = compile(PROGRAM);
    String json = TreeJson.toJson(original);
    Program imported = TreeJson.fromJson(json);
    assertNotSame(original, imported);
    assertEquals("Import of export should give an equal tree",
                 original, imported);
    assertEquals("Export should be stable", json, TreeJson.toJson(imported));
  }

  @Test
  public void testFormat() throws IOException {
    String json = TreeJson.toJson(compile(
        "int add(int a, int b) { return a + b; }"));
    JsonNode root = new ObjectMapper().readTree(json);
    assertEquals("Program", root.get("type").asText());

    JsonNode fn = root.get("body").get(0);
    assertEquals("FunctionDef", fn.get("type").asText());
    assertEquals("add", fn.get("name").asText());
    assertEquals("int", fn.get("returnType").asText());
    JsonNode param = fn.get("params").get(0);
    assertEquals("a", param.get("name").asText());
    assertEquals("int", param.get("dataType").asText());
    assertEquals("Params are plain objects", 2, param.size());

    JsonNode ret = fn.get("body").get("body").get(0);
    assertEquals("Return", ret.get("type").asText());
    JsonNode sum = ret.get("value");
    assertEquals("BinaryOp", sum.get("type").asText());
    assertEquals("+", sum.get("op").asText());
    assertEquals("Identifier", sum.get("left").get("type").asText());
    assertEquals("b", sum.get("right").get("name").asText());

    assertFalse("Positions are not exported", json.contains("position"));
  }

  @Test
  public void testLiteralFormat() throws IOException {
    String json = TreeJson.toJson(compile(
        "bool f() { return 5 > 2 == true; }"));
    JsonNode cmp = new ObjectMapper().readTree(json).get("body").get(0)
                          .get("body").get("body").get(0).get("value");
    JsonNode five = cmp.get("left").get("left");
    assertEquals("Literal", five.get("type").asText());
    assertEquals("int", five.get("dataType").asText());
    assertEquals("5", five.get("value").asText());
    JsonNode t = cmp.get("right");
    assertEquals("bool", t.get("dataType").asText());
    assertEquals("true", t.get("value").asText());
  }

  @Test
  public void testImportHandWritten() throws IOException {
    String json =
        "{\"type\": \"Program\", \"body\": [" +
        "  {\"type\": \"FunctionDef\", \"name\": \"one\"," +
        "   \"returnType\": \"int\", \"params\": []," +
        "   \"body\": {\"type\": \"Block\", \"body\": [" +
        "     {\"type\": \"Return\", \"value\":" +
        "       {\"type\": \"Literal\", \"dataType\": \"int\", \"value\": \"1\"}}" +
        "   ]}}" +
        "]}";
    assertEquals(compile("int one() { return 1; }"), TreeJson.fromJson(json));
  }

  @Test
  public void testRootMustBeProgram() throws IOException {
    exception.expect(IOException.class);
    TreeJson.fromJson("{\"type\": \"Identifier\", \"name\": \"x\"}");
  }

  @Test
  public void testUnknownField() throws IOException {
    exception.expect(IOException.class);
    TreeJson.fromJson("{\"type\": \"Program\", \"body\": [], \"extra\": 1}");
  }

  @Test
  public void testUnknownNodeType() throws IOException {
    exception.expect(IOException.class);
    TreeJson.fromJson("{\"type\": \"Switch\", \"body\": []}");
  }
}
