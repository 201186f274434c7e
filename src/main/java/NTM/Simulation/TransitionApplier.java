package NTM.Simulation;

import NTM.Model.Configuration;
import NTM.Model.MachineDefinition;
import NTM.Model.Transition;

import java.util.ArrayList;
import java.util.List;

public final class TransitionApplier {
  private TransitionApplier() {
  }

  /**
   * Compute every configuration reachable from {@code config} in exactly one step.
   * Rules are applied in table order. A (state, symbol) pair with no rule, outside the accept
   * and reject states, is an implicit reject: it counts one transition and marks the
   * configuration non-leaf, but yields no successor.
   * @param config - configuration to expand
   * @param definition - machine
   * @return successors plus the counts this step contributes
   */
  public static Expansion expand(Configuration config, MachineDefinition definition) {
    final String state = config.state();
    final char head = config.head();
    final List<Transition> rules = definition.getTransitions(state, head);

    if (!rules.isEmpty()) {
      final List<Configuration> successors = new ArrayList<>(rules.size());
      for (Transition t : rules) {
        successors.add(new Configuration(config.tape().write(t.writeSymbol(), t.move()), t.toState()));
      }
      return new Expansion(successors, rules.size(), true);
    }

    if (!definition.isAccepting(state) && !definition.isRejecting(state)) {
      return Expansion.implicitReject();
    }
    return Expansion.halted();
  }
}
