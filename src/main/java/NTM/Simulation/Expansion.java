package NTM.Simulation;

import NTM.Model.Configuration;

import java.util.List;

/**
 * Result of one expansion step.
 * @param successors - configurations reachable in one step, in rule-table order
 * @param transitions - transitions taken, including an implicit reject
 * @param nonLeaf - whether the configuration had at least one outgoing transition
 */
public record Expansion(List<Configuration> successors, int transitions, boolean nonLeaf) {
  private static final Expansion IMPLICIT_REJECT = new Expansion(List.of(), 1, true);
  private static final Expansion HALTED = new Expansion(List.of(), 0, false);

  public Expansion {
    successors = List.copyOf(successors);
  }

  /**
   * Counted as a transition into the reject state, but the dead branch is not materialized.
   */
  public static Expansion implicitReject() {
    return IMPLICIT_REJECT;
  }

  public static Expansion halted() {
    return HALTED;
  }
}
