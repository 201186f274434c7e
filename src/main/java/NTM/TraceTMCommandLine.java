package NTM;

import NTM.Model.Level;
import NTM.Model.MachineDefinition;
import NTM.Model.Tape;
import NTM.Simulation.SimulationResult;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class TraceTMCommandLine {
  public static boolean DEBUG = false;
  static final String DEFAULT_OUTPUT = "trace_output.txt";

  /**
   * Bundled machines and the inputs they are traced on by {@code --examples}.
   */
  static final List<Example> EXAMPLES = List.of(
      new Example("machines/check_a_plus.csv", "aaa", "output_a_plus.txt", TraceTM.DEFAULT_MAX_DEPTH),
      new Example("machines/check_a_plus_DTM.csv", "aaa", "output_a_plus_DTM.txt", TraceTM.DEFAULT_MAX_DEPTH),
      // the palindrome machines decide a nine-symbol input at depth 55 (DTM) and 54 (NTM)
      new Example("machines/check_palindrome_DTM.csv", "aaabbbaaa", "output_palindrome_DTM.txt", 60),
      new Example("machines/check_palindrome.csv", "aaabbbaaa", "output_palindrome.txt", 60),
      new Example("machines/check_2x0_DTM.csv", "000011", "output_2x0_DTM.txt", TraceTM.DEFAULT_MAX_DEPTH),
      new Example("machines/check_abc_star.csv", "abbbcccccc", "output_abc_star.txt", TraceTM.DEFAULT_MAX_DEPTH)
  );

  record Example(String resource, String input, String output, int maxDepth) { }

  public static void main(String[] args) {
    String output = DEFAULT_OUTPUT;
    int maxDepth = TraceTM.DEFAULT_MAX_DEPTH;
    boolean examples = false;
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        DEBUG = true;
      } else if ("--examples".equalsIgnoreCase(arg)) {
        examples = true;
      } else if ("--output".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --output");
          printUsageAndExit(); // exits
        }
        output = args[++i];
      } else if ("--maxDepth".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length) {
          System.err.println("Missing value for --maxDepth");
          printUsageAndExit();
        }
        maxDepth = parseMaxDepth(args[++i]);
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (examples) {
      if (!positional.isEmpty()) {
        printUsageAndExit();
      }
      runExamples();
      return;
    }
    // input may legitimately be the empty string
    if (positional.size() != 2) {
      printUsageAndExit();
    }

    long before = System.currentTimeMillis();
    final MachineDefinition definition = MachineFormat.getMachineFile(positional.get(0));
    long after = System.currentTimeMillis();
    if (DEBUG) {
      System.out.println("DEBUG: Parsed " + definition + " in " + ((after - before) / 1000f) + "s");
    }
    run(definition, positional.get(1), maxDepth, output);
  }

  private static int parseMaxDepth(String value) {
    try {
      int maxDepth = Integer.parseInt(value);
      if (maxDepth >= 0) {
        return maxDepth;
      }
    } catch (NumberFormatException e) {
      System.err.println("Invalid value for --maxDepth: " + value);
    }
    printUsageAndExit();
    return -1; // unreachable
  }

  private static void printUsageAndExit() {
    System.out.println(
        "TraceTM [--debug] [--maxDepth <n>] [--output <trace file>] <machine CSV file> <input string>");
    System.out.println("TraceTM [--debug] --examples");
    System.out.println("[--debug] : Additional timing and frontier-size output");
    System.out.println("[--maxDepth <n>] : Number of levels to explore (default " + TraceTM.DEFAULT_MAX_DEPTH + ")");
    System.out.println("[--output <trace file>] : Trace file, overwritten (default " + DEFAULT_OUTPUT + ")");
    System.out.println("[--examples] : Trace the bundled machines on their sample inputs");
    System.out.println();
    System.out.println("<machine CSV file> : machine definition, one record per line:");
    System.out.println("  name / states / input alphabet / tape alphabet / start / accept / reject,");
    System.out.println("  then rules: from,read,to,write,move (move is L, R, or anything else to stay).");
    System.out.println("  The blank symbol is " + Tape.BLANK + ".");
    System.exit(0);
  }

  static void runExamples() {
    for (Example example : EXAMPLES) {
      run(MachineFormat.getMachineResource(example.resource()), example.input(), example.maxDepth(), example.output());
    }
  }

  /**
   * Trace one machine on one input into {@code output}, echoing the trace to the console.
   */
  static SimulationResult run(MachineDefinition definition, String input, int maxDepth, String output) {
    long before = System.currentTimeMillis();
    SimulationResult result;
    try (Writer writer = new OutputStreamWriter(new FileOutputStream(output), StandardCharsets.UTF_8)) {
      result = TraceTM.simulate(definition, input, maxDepth, writer);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    long after = System.currentTimeMillis();

    if (DEBUG) {
      for (Level level : result.levels()) {
        System.out.println("DEBUG: Depth " + level.depth() + " frontier: " + level.size() + " configurations");
      }
      System.out.println("DEBUG: " + result.outcome() + " after " + result.configurationCount() + " configurations");
      System.out.println("DEBUG: Simulation duration: " + ((after - before) / 1000f) + "s, trace written to " + output);
    }
    return result;
  }
}
