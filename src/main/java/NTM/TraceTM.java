package NTM;

import NTM.Model.MachineDefinition;
import NTM.Simulation.FrontierExplorer;
import NTM.Simulation.SimulationResult;
import NTM.Trace.TraceReporter;

import java.io.IOException;
import java.util.Objects;

public class TraceTM {
  public static final int DEFAULT_MAX_DEPTH = 20;

  /**
   * Simulate {@code definition} on {@code input} and write the trace to {@code sink} and to the console.
   * @param definition - machine
   * @param input - initial right tape; empty means a single blank
   * @param maxDepth - levels that may be expanded
   * @param sink - receives the full trace
   * @return the run, for callers that want the numbers
   * @throws IOException if the sink cannot be written
   */
  public static SimulationResult simulate(MachineDefinition definition, String input, int maxDepth, Appendable sink)
      throws IOException {
    return simulate(definition, input, maxDepth, sink, System.out);
  }

  /**
   * Same as {@link #simulate(MachineDefinition, String, int, Appendable)}, with an explicit console.
   * Both sinks receive identical text, written once at the end of the run.
   */
  public static SimulationResult simulate(MachineDefinition definition, String input, int maxDepth,
                                          Appendable sink, Appendable console) throws IOException {
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(input, "input");

    final SimulationResult result = FrontierExplorer.explore(definition, input, maxDepth);
    final String text = TraceReporter.render(definition.getName(), input, result);
    sink.append(text);
    console.append(text);
    return result;
  }
}
