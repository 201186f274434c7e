package NTM.Model;

/**
 * Terminal state of one simulation run. Exactly one is reached per run.
 */
public enum Outcome {
  ACCEPTED,
  REJECTED,
  DEPTH_EXHAUSTED
}
