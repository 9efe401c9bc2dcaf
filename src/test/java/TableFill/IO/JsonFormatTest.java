package TableFill.IO;

import TableFill.Model.Automaton;
import TableFill.Model.MalformedAutomatonException;
import TableFill.SampleAutomata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

public class JsonFormatTest {
  private static Automaton resource(String name) throws IOException {
    try (InputStream is = JsonFormatTest.class.getResourceAsStream("/" + name)) {
      Assertions.assertNotNull(is, name);
      return JsonFormat.read(is);
    }
  }

  @Test
  void testReadEnglishKeys() throws IOException {
    Assertions.assertEquals(SampleAutomata.unreachableState(), resource("unreachable_state.json"));
  }

  @Test
  void testReadPortugueseKeys() throws IOException {
    // unknown keys such as "comentario" are ignored
    Assertions.assertEquals(SampleAutomata.endsWith01(), resource("afd_entrada.json"));
  }

  @Test
  void testWriteOrder() {
    String json = JsonFormat.toJson(SampleAutomata.unreachableState());
    int states = json.indexOf("\"states\"");
    int alphabet = json.indexOf("\"alphabet\"");
    int start = json.indexOf("\"start\"");
    int accepting = json.indexOf("\"accepting\"");
    int transitions = json.indexOf("\"transitions\"");
    Assertions.assertTrue(states >= 0 && states < alphabet && alphabet < start && start < accepting
        && accepting < transitions);
    Assertions.assertTrue(json.indexOf("\"q0\" : {") < json.indexOf("\"q3\" : {"));
  }

  @Test
  void testReadBack() throws IOException {
    Automaton partial = SampleAutomata.partialMerge();
    Assertions.assertEquals(partial, JsonFormat.fromJson(JsonFormat.toJson(partial)));

    ByteArrayOutputStream os = new ByteArrayOutputStream();
    JsonFormat.write(SampleAutomata.endsWith01(), os);
    Assertions.assertEquals(JsonFormat.toJson(SampleAutomata.endsWith01()), os.toString(StandardCharsets.UTF_8));
  }

  @Test
  void testFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("out.json");
    JsonFormat.write(SampleAutomata.endsWith01(), file);
    Assertions.assertEquals(SampleAutomata.endsWith01(), JsonFormat.read(file));
  }

  @Test
  void testOptionalFields() {
    Automaton a = JsonFormat.fromJson("{\"states\": [\"s\"], \"alphabet\": [\"a\"], \"start\": \"s\"}");
    Assertions.assertTrue(a.getAccepting().isEmpty());
    Assertions.assertNull(a.getSuccessor("s", "a"));
  }

  @Test
  void testMalformed() {
    Assertions.assertThrows(MalformedAutomatonException.class, () -> JsonFormat.fromJson("{not json"));
    Assertions.assertThrows(MalformedAutomatonException.class, () -> JsonFormat.fromJson("null"));
    Assertions.assertThrows(MalformedAutomatonException.class, () -> JsonFormat.fromJson("[1, 2]"));
    Assertions.assertThrows(MalformedAutomatonException.class,
        () -> JsonFormat.fromJson("{\"alphabet\": [\"a\"], \"start\": \"s\"}"));
    Assertions.assertThrows(MalformedAutomatonException.class,
        () -> JsonFormat.fromJson("{\"states\": [\"s\"], \"alphabet\": [\"a\"]}"));
    MalformedAutomatonException e = Assertions.assertThrows(MalformedAutomatonException.class,
        () -> JsonFormat.fromJson("{\"states\": [\"X\"], \"alphabet\": [\"a\"], \"start\": \"X\","
            + " \"transitions\": {\"X\": {\"a\": \"Y\"}}}"));
    Assertions.assertTrue(e.getMessage().contains("'Y'"));
  }

  @Test
  void testStateOrderKept() {
    Automaton a = JsonFormat.fromJson("{\"states\": [\"z\", \"a\", \"m\"], \"alphabet\": [\"b\", \"a\"],"
        + " \"start\": \"m\", \"accepting\": [\"m\", \"z\"]}");
    Assertions.assertEquals(List.of("z", "a", "m"), a.getStates());
    Assertions.assertEquals(List.of("b", "a"), a.getAlphabet());
    Assertions.assertEquals(List.of("z", "m"), List.copyOf(a.getAccepting()));
  }
}
