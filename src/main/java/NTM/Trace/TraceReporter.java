package NTM.Trace;

import NTM.Model.Configuration;
import NTM.Model.Level;
import NTM.Simulation.SimulationResult;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Renders a finished run as human-readable text. Not meant for re-parsing.
 */
public final class TraceReporter {
  public static final String SEPARATOR = "==============================================";

  private TraceReporter() {
  }

  public static String render(String machineName, String input, SimulationResult result) {
    return header(machineName, input) + verdict(result) + trace(result);
  }

  public static String header(String machineName, String input) {
    return "Machine: " + machineName + "\n"
        + "Input String: " + input + "\n\n";
  }

  public static String verdict(SimulationResult result) {
    final int depth = result.depth();
    return switch (result.outcome()) {
      case ACCEPTED -> "Depth of Tree of configurations: " + depth + "\n"
          + "Accepted in " + depth + " transitions.\n\n";
      case REJECTED -> "Rejected in " + depth + " transitions.\n"
          + "Depth of Tree of configurations: " + depth + "\n\n";
      case DEPTH_EXHAUSTED -> "Max depth reached. Halting simulation.\n"
          + "Result: inconclusive after " + result.maxDepth() + " levels.\n\n";
    };
  }

  /**
   * One block per depth with every configuration, then the counters and the ratio.
   */
  public static String trace(SimulationResult result) {
    final StringBuilder sb = new StringBuilder("Trace:\n");
    for (Level level : result.levels()) {
      sb.append("Depth ").append(level.depth()).append(":\n");
      for (Configuration config : level.configurations()) {
        sb.append("  ").append(config).append('\n');
      }
    }
    sb.append("Total transitions: ").append(result.transitionCount()).append('\n');
    sb.append("Total non-leaf nodes: ").append(result.nonLeafCount()).append('\n');
    sb.append("Nondeterminism: ").append(formatRatio(result.nondeterminism())).append('\n');
    sb.append(SEPARATOR).append('\n');
    return sb.toString();
  }

  static String formatRatio(OptionalDouble ratio) {
    if (ratio.isEmpty()) {
      return "Undefined (no non-leaf nodes)";
    }
    return String.format(Locale.ROOT, "%.2f", ratio.getAsDouble());
  }
}
