package Powerset;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import Powerset.Export.DotExporter;
import Powerset.Export.TextReport;
import Powerset.Model.EpsilonNFA;
import Powerset.Model.ExplorationLimit;
import net.automatalib.exception.FormatException;

public class ConverterCommandLine {
  public static void main(String[] args) {
    String dotFilename = null;
    ExplorationLimit limit = ExplorationLimit.unbounded();
    List<String> positional = new ArrayList<>(1);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        SubsetConstruction.DEBUG = true;
      } else if ("--writeDot".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --writeDot");
          printUsageAndExit(); // exits
        }
        dotFilename = args[++i]; // consume the value
      } else if ("--maxStates".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length) {
          System.err.println("Missing value for --maxStates");
          printUsageAndExit();
        }
        limit = parseLimit(args[++i]);
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 1) {
      printUsageAndExit();
    }

    final EpsilonNFA nfa = readNFA(Paths.get(positional.get(0)));
    System.out.println("Original NFA size: " + nfa.size());
    System.out.println("Alphabet size: " + nfa.getAlphabet().size());
    System.out.println(TextReport.describe(nfa));

    long before = System.currentTimeMillis();
    final SubsetDFA dfa = SubsetConstruction.determinize(nfa, limit);
    long after = System.currentTimeMillis();
    System.out.println("Converted DFA:");
    System.out.println(TextReport.describe(dfa));
    System.out.println("DFA size: " + dfa.size());
    System.out.println("Subset construction duration: " + ((after - before) / 1000f) + "s");

    if (dotFilename != null) {
      writeDotFile(dotFilename, dfa);
    } else {
      System.out.println();
      System.out.print(DotExporter.toDot(dfa));
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "ConverterCommandLine [--debug] [--maxStates <n>] [--writeDot <DOT output file>] <NFA input file>");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--maxStates <n>] : Fail if subset construction discovers more than n DFA states");
    System.out.println("[--writeDot <DOT output file>] : Write DFA graph to specified file instead of the console");
    System.out.println();
    System.out.println("<NFA input file> : NFA description, either labelled (\"Enter number of states: ...\")");
    System.out.println("  or compact (same values, whitespace separated). Use '#' as the epsilon symbol.");
    System.exit(0);
  }

  static ExplorationLimit parseLimit(String value) {
    try {
      return ExplorationLimit.maxStates(Integer.parseInt(value));
    } catch (IllegalArgumentException e) {
      // NumberFormatException is an IllegalArgumentException too
      System.err.println("Invalid value for --maxStates: " + value);
      printUsageAndExit();
      return ExplorationLimit.unbounded();
    }
  }

  static EpsilonNFA readNFA(Path path) {
    try {
      return NFAFormat.parseFile(path);
    } catch (FormatException e) {
      throw new RuntimeException("Invalid NFA description in " + path + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  static void writeDotFile(String filename, SubsetDFA dfa) {
    System.out.println("Writing to file: " + filename);
    try (Writer w = Files.newBufferedWriter(Paths.get(filename), StandardCharsets.UTF_8)) {
      DotExporter.write(dfa, w);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
