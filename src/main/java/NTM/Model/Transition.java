package NTM.Model;

import java.util.Objects;

public record Transition(String fromState, char readSymbol, String toState, char writeSymbol, Move move) {

  public Transition {
    Objects.requireNonNull(fromState, "fromState");
    Objects.requireNonNull(toState, "toState");
    Objects.requireNonNull(move, "move");
  }

  @Override
  public String toString() {
    return fromState + "," + readSymbol + " -> " + toState + "," + writeSymbol + "," + move.token();
  }
}
