package NTM.Simulation;

import NTM.Model.Configuration;
import NTM.Model.Level;
import NTM.Model.MachineDefinition;
import NTM.Model.Outcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Breadth-first exploration of every configuration reachable from the start configuration.
 */
public final class FrontierExplorer {
  private FrontierExplorer() {
  }

  public static SimulationResult explore(MachineDefinition definition, CharSequence input, int maxDepth) {
    return explore(definition, Configuration.initial(definition.getStartState(), input), maxDepth);
  }

  /**
   * Expand the frontier one level at a time, for at most {@code maxDepth} levels.
   * The run stops at the first configuration in the accept state (level order, so at the
   * shallowest depth), when a level produces no successors, or when the depth bound is hit.
   * Configurations in the reject state count one transition and are dropped.
   * @param definition - machine
   * @param start - configuration at depth 0
   * @param maxDepth - number of levels that may be expanded
   * @return outcome, retained levels and counters
   */
  public static SimulationResult explore(MachineDefinition definition, Configuration start, int maxDepth) {
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
    }
    final SimulationStats stats = new SimulationStats();
    final List<Level> levels = new ArrayList<>();
    levels.add(new Level(0, List.of(start)));

    for (int depth = 0; depth < maxDepth; depth++) {
      final Level current = levels.get(depth);
      final List<Configuration> next = new ArrayList<>();

      for (Configuration config : current.configurations()) {
        if (definition.isAccepting(config.state())) {
          return result(Outcome.ACCEPTED, depth, maxDepth, levels, stats);
        }
        if (definition.isRejecting(config.state())) {
          stats.countRejected();
          continue;
        }
        final Expansion expansion = TransitionApplier.expand(config, definition);
        next.addAll(expansion.successors());
        stats.add(expansion);
      }

      if (next.isEmpty()) {
        return result(Outcome.REJECTED, depth, maxDepth, levels, stats);
      }
      levels.add(new Level(depth + 1, next));
    }
    return result(Outcome.DEPTH_EXHAUSTED, maxDepth, maxDepth, levels, stats);
  }

  private static SimulationResult result(Outcome outcome, int depth, int maxDepth, List<Level> levels, SimulationStats stats) {
    return new SimulationResult(outcome, depth, maxDepth, levels, stats.getTransitionCount(), stats.getNonLeafCount());
  }
}
