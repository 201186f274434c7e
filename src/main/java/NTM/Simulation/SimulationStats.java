package NTM.Simulation;

/**
 * Counters for one run. Owned by a single explorer invocation.
 */
final class SimulationStats {
  private long transitionCount;
  private long nonLeafCount;

  void add(Expansion expansion) {
    transitionCount += expansion.transitions();
    if (expansion.nonLeaf()) {
      nonLeafCount++;
    }
  }

  // a branch already sitting in the reject state
  void countRejected() {
    transitionCount++;
  }

  long getTransitionCount() {
    return transitionCount;
  }

  long getNonLeafCount() {
    return nonLeafCount;
  }
}
