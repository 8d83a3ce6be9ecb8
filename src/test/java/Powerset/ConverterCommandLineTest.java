package Powerset;

import Powerset.Export.DotExporter;
import Powerset.Model.EpsilonNFA;
import Powerset.Model.ExplorationLimit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertThrows;

class ConverterCommandLineTest {
  @Test
  void testReadAndWriteDot(@TempDir Path tmp) throws Exception {
    EpsilonNFA nfa = ConverterCommandLine.readNFA(NFAFormatTest.getFilePath("ends_with_01.nfa"));
    SubsetDFA dfa = SubsetConstruction.determinize(nfa);
    Path out = tmp.resolve("dfa.dot");
    ConverterCommandLine.writeDotFile(out.toString(), dfa);
    Assertions.assertEquals(DotExporter.toDot(dfa), Files.readString(out, StandardCharsets.UTF_8));
  }

  @Test
  void testMissingInput(@TempDir Path tmp) {
    assertThrows(RuntimeException.class, () -> ConverterCommandLine.readNFA(tmp.resolve("missing.nfa")));
  }

  @Test
  void testParseLimit() {
    ExplorationLimit limit = ConverterCommandLine.parseLimit("25");
    Assertions.assertEquals(25, limit.getMaxStates());
  }

  @Test
  void testMain(@TempDir Path tmp) throws Exception {
    Path out = tmp.resolve("out.dot");
    String input = NFAFormatTest.getFilePath("epsilon.nfa").toString();
    PrintStream stdout = System.out;
    ByteArrayOutputStream captured = new ByteArrayOutputStream();
    System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    try {
      ConverterCommandLine.main(new String[] {"--maxStates", "10", "--writeDot", out.toString(), input});
    } finally {
      System.setOut(stdout);
    }
    String console = captured.toString(StandardCharsets.UTF_8);
    Assertions.assertTrue(console.contains("Original NFA size: 3"), console);
    Assertions.assertTrue(console.contains("State q1 {C} [accepting]:"), console);
    Assertions.assertTrue(console.contains("DFA size: 2"), console);
    Assertions.assertTrue(Files.readString(out).contains("start -> q0;"));
  }
}
