package NTM.Simulation;

import NTM.Model.Level;
import NTM.Model.Outcome;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Outcome of one run of the frontier explorer.
 * @param outcome - terminal state
 * @param depth - depth at which the run stopped; {@code maxDepth} when exhausted
 * @param maxDepth - bound the run was given
 * @param levels - every level built, starting at depth 0
 * @param transitionCount - explicit, implicit-reject and rejected-branch transitions
 * @param nonLeafCount - configurations with at least one outgoing transition
 */
public record SimulationResult(Outcome outcome,
                               int depth,
                               int maxDepth,
                               List<Level> levels,
                               long transitionCount,
                               long nonLeafCount) {

  public SimulationResult {
    levels = List.copyOf(levels);
  }

  /**
   * Average branching factor over non-leaf configurations.
   * @return empty if no configuration had an outgoing transition
   */
  public OptionalDouble nondeterminism() {
    if (nonLeafCount == 0) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of((double) transitionCount / nonLeafCount);
  }

  public boolean isAccepted() {
    return outcome == Outcome.ACCEPTED;
  }

  public boolean isRejected() {
    return outcome == Outcome.REJECTED;
  }

  public boolean isInconclusive() {
    return outcome == Outcome.DEPTH_EXHAUSTED;
  }

  /**
   * @return number of configurations over all retained levels
   */
  public long configurationCount() {
    long count = 0;
    for (Level level : levels) {
      count += level.size();
    }
    return count;
  }
}
