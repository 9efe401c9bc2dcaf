package TableFill;

import TableFill.IO.BAFormat;
import TableFill.IO.DotFormat;
import TableFill.IO.JsonFormat;
import TableFill.IO.TableRenderer;
import TableFill.Model.Automaton;
import TableFill.Model.MinimizationException;
import TableFill.Model.MinimizationResult;
import TableFill.Model.MinimizerConfig;
import TableFill.Reducer.ClassNaming;
import TableFill.Table.MarkingStrategy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class TableFillCommandLine {
  public static boolean DEBUG = false;

  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Parse arguments, minimize, write outputs.
   * @param args - command-line arguments
   * @return process exit status
   */
  static int run(String[] args) {
    String jsonOut = null;
    String baOut = null;
    String dotOut = null;
    String inputDotOut = null;
    MinimizerConfig config = MinimizerConfig.DEFAULT;
    List<String> positional = new ArrayList<>(1);

    try {
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        if ("--debug".equalsIgnoreCase(arg)) {
          DEBUG = true;
        } else if ("--strategy".equalsIgnoreCase(arg)) {
          config = config.withStrategy(MarkingStrategy.fromName(requireValue(args, i++, arg)));
        } else if ("--naming".equalsIgnoreCase(arg)) {
          config = config.withNaming(ClassNaming.fromName(requireValue(args, i++, arg)));
        } else if ("--writeJson".equalsIgnoreCase(arg)) {
          jsonOut = requireValue(args, i++, arg);
        } else if ("--writeBA".equalsIgnoreCase(arg)) {
          baOut = requireValue(args, i++, arg);
        } else if ("--writeDot".equalsIgnoreCase(arg)) {
          dotOut = requireValue(args, i++, arg);
        } else if ("--writeInputDot".equalsIgnoreCase(arg)) {
          inputDotOut = requireValue(args, i++, arg);
        } else if (arg.startsWith("-")) {
          // Unknown flag
          throw new IllegalArgumentException("Unknown option: " + arg);
        } else {
          positional.add(arg);
        }
      }
      if (positional.size() != 1) {
        throw new IllegalArgumentException("Expected exactly one input file");
      }
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsage();
      return EXIT_USAGE;
    }

    final Path input = Paths.get(positional.get(0));
    if (!Files.isRegularFile(input)) {
      System.err.println("[ERROR] File not found: " + input);
      return EXIT_FAILURE;
    }

    try {
      final Automaton automaton = readAutomaton(input);
      System.out.println("Original DFA size: " + automaton.size());
      System.out.println("Alphabet size: " + automaton.numSymbols());

      long before = System.currentTimeMillis();
      final MinimizationResult result = minimize(automaton, config);
      long after = System.currentTimeMillis();

      final Automaton minimized = result.minimized();
      System.out.println("Minimized DFA size: " + minimized.size());
      System.out.println("Reduction: " + (automaton.size() - minimized.size()) + " state(s)");
      System.out.println("Duration: " + ((after - before) / 1000f) + "s");

      if (jsonOut != null) {
        System.out.println("Writing to file: " + jsonOut);
        JsonFormat.write(minimized, Paths.get(jsonOut));
      } else {
        System.out.println(JsonFormat.toJson(minimized));
      }
      if (baOut != null) {
        System.out.println("Writing to file: " + baOut);
        BAFormat.write(minimized, Paths.get(baOut));
      }
      if (dotOut != null) {
        System.out.println("Writing to file: " + dotOut);
        Files.writeString(Paths.get(dotOut), DotFormat.toDot(minimized, "Minimized DFA"), StandardCharsets.UTF_8);
      }
      if (inputDotOut != null) {
        System.out.println("Writing to file: " + inputDotOut);
        Files.writeString(Paths.get(inputDotOut), DotFormat.toDot(automaton, "Original DFA"), StandardCharsets.UTF_8);
      }
      return 0;
    } catch (MinimizationException | IOException e) {
      System.err.println("[ERROR] Minimization failed: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private static String requireValue(String[] args, int i, String option) {
    // Require a value that isn't another flag
    if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[i + 1];
  }

  private static void printUsage() {
    System.out.println(
        "TableFill [--debug] [--strategy <s>] [--naming <n>] [--writeJson <file>] [--writeBA <file>] "
            + "[--writeDot <file>] [--writeInputDot <file>] <automaton file>");
    System.out.println("[--debug] : Print the marking table, every marked pair and the equivalence classes");
    System.out.println("[--strategy <s>] : passes (default), worklist or parallel");
    System.out.println("[--naming <n>] : braces (default, e.g. {q0,q1}), representative or indexed");
    System.out.println("[--writeJson <file>] : Write minimized DFA as JSON; printed to stdout otherwise");
    System.out.println("[--writeBA <file>] : Write minimized DFA in the BA format");
    System.out.println("[--writeDot <file>] : Write minimized DFA as a Graphviz graph");
    System.out.println("[--writeInputDot <file>] : Write input DFA as a Graphviz graph");
    System.out.println();
    System.out.println("<automaton file> : DFA as JSON, or in the BA format if the name ends in .ba");
    System.out.println("  JSON keys: states, alphabet, start, accepting, transitions");
  }

  static Automaton readAutomaton(Path input) throws IOException {
    if (input.getFileName().toString().toLowerCase().endsWith(".ba")) {
      return BAFormat.read(input);
    }
    return JsonFormat.read(input);
  }

  /**
   * {@link DFAMinimizer#minimize(Automaton, MinimizerConfig)} with progress output; the trace is recorded only
   * in debug mode.
   */
  static MinimizationResult minimize(Automaton automaton, MinimizerConfig config) {
    final MinimizationResult result = DFAMinimizer.minimize(automaton, config.withTrace(DEBUG));

    final List<String> unreachable = Reachability.unreachableStates(automaton);
    if (unreachable.isEmpty()) {
      System.out.println("No unreachable states");
    } else {
      System.out.println("Removed unreachable states " + unreachable + ", reachable: " + result.reachable().size());
    }

    System.out.println("Marked " + result.markedPairs() + " of " + result.totalPairs() + " pairs in "
        + result.passes() + " " + config.strategy().name().toLowerCase() + " step(s)");
    if (DEBUG) {
      System.out.print(TableRenderer.renderTrace(result.trace()));
      System.out.print(TableRenderer.renderTable(result.table(), result.reachable()));
    }

    System.out.println("Equivalence classes: " + result.classes().size());
    if (DEBUG) {
      System.out.print(TableRenderer.renderClasses(result.classes()));
    }
    return result;
  }
}
