package NTM.Model;

import java.util.Objects;

/**
 * One snapshot of a machine branch: tape split at the head plus the current state.
 */
public record Configuration(Tape tape, String state) {

  public Configuration {
    Objects.requireNonNull(tape, "tape");
    Objects.requireNonNull(state, "state");
  }

  public static Configuration initial(String startState, CharSequence input) {
    return new Configuration(Tape.ofInput(input), startState);
  }

  public char head() {
    return tape.head();
  }

  public String left() {
    return tape.leftContents();
  }

  public String right() {
    return tape.rightContents();
  }

  @Override
  public String toString() {
    return "('" + left() + "', '" + state + "', '" + right() + "')";
  }
}
