package Powerset.Export;

import Powerset.RandomEpsilonNFA;
import Powerset.Scenarios;
import Powerset.SubsetConstruction;
import Powerset.SubsetDFA;
import Powerset.Model.EpsilonNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class DotExporterTest {
  @Test
  void testEndsWith01() {
    SubsetDFA dfa = SubsetConstruction.determinize(Scenarios.endsWith01());
    String expected = String.join("\n",
        "digraph DFA {",
        "    rankdir=LR;",
        "    q0 [label=\"{A}\", shape=circle];",
        "    q1 [label=\"{A, B}\", shape=circle];",
        "    q2 [label=\"{A, C}\", shape=doublecircle];",
        "    start [shape=point];",
        "    start -> q0;",
        "    q0 -> q1 [label=\"0\"];",
        "    q0 -> q0 [label=\"1\"];",
        "    q1 -> q1 [label=\"0\"];",
        "    q1 -> q2 [label=\"1\"];",
        "    q2 -> q1 [label=\"0\"];",
        "    q2 -> q0 [label=\"1\"];",
        "}",
        "");
    Assertions.assertEquals(expected, DotExporter.toDot(dfa));
  }

  @Test
  void testWriterMatchesString() throws IOException {
    SubsetDFA dfa = SubsetConstruction.determinize(Scenarios.epsilonThenOne());
    StringWriter w = new StringWriter();
    DotExporter.write(dfa, w);
    Assertions.assertEquals(DotExporter.toDot(dfa), w.toString());
    Assertions.assertTrue(w.toString().contains("q0 [label=\"{A, B}\", shape=circle];"));
    Assertions.assertTrue(w.toString().contains("q1 [label=\"{C}\", shape=doublecircle];"));
  }

  @Test
  void testEscaping() {
    EpsilonNFA nfa = new EpsilonNFA(List.of("say\"hi\"", "back\\slash"), List.of('"'), "say\"hi\"", Set.of());
    nfa.addTransition("say\"hi\"", '"', "back\\slash");
    String dot = DotExporter.toDot(SubsetConstruction.determinize(nfa));
    Assertions.assertTrue(dot.contains("q0 [label=\"{say\\\"hi\\\"}\", shape=circle];"), dot);
    Assertions.assertTrue(dot.contains("q1 [label=\"{back\\\\slash}\", shape=circle];"), dot);
    Assertions.assertTrue(dot.contains("q0 -> q1 [label=\"\\\"\"];"), dot);
  }

  @Test
  void testOneEdgePerTransition() {
    for (int seed = 0; seed < 100; seed++) {
      SubsetDFA dfa = SubsetConstruction.determinize(RandomEpsilonNFA.getRandomAutomaton(seed, 8));
      Set<String> edges = new HashSet<>();
      int edgeCount = 0;
      for (String line : DotExporter.toDot(dfa).split("\n")) {
        if (line.contains("->") && !line.contains(DotExporter.START_NODE)) {
          Assertions.assertTrue(edges.add(line.strip()), "duplicate edge " + line + ", seed " + seed);
          edgeCount++;
        }
      }
      Assertions.assertEquals(dfa.getTransitionCount(), edgeCount, "seed " + seed);
    }
  }
}
