package NTM.Model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class MachineDefinitionTest {
  private static final List<String> STATES = List.of("q0", "q1", "qacc", "qrej");
  private static final List<Character> SIGMA = List.of('a');
  private static final List<Character> GAMMA = List.of('a', '_');

  private static MachineDefinition machine(List<Transition> transitions) {
    return new MachineDefinition("test", STATES, SIGMA, GAMMA, "q0", "qacc", "qrej", transitions);
  }

  @Test
  void testIndexKeepsTableOrder() {
    Transition first = new Transition("q0", 'a', "q1", 'a', Move.RIGHT);
    Transition other = new Transition("q1", 'a', "q1", 'a', Move.RIGHT);
    Transition second = new Transition("q0", 'a', "qacc", '_', Move.LEFT);
    MachineDefinition m = machine(List.of(first, other, second));

    Assertions.assertEquals(List.of(first, second), m.getTransitions("q0", 'a'));
    Assertions.assertEquals(List.of(other), m.getTransitions("q1", 'a'));
    Assertions.assertTrue(m.getTransitions("q0", '_').isEmpty());
    Assertions.assertTrue(m.hasExplicitTransition("q0", 'a'));
    Assertions.assertFalse(m.hasExplicitTransition("q1", '_'));
    Assertions.assertEquals(3, m.getTransitions().size());
  }

  @Test
  void testAccessors() {
    MachineDefinition m = machine(List.of());
    Assertions.assertEquals("test", m.getName());
    Assertions.assertEquals(STATES, List.copyOf(m.getStates()));
    Assertions.assertEquals(1, m.getInputAlphabet().size());
    Assertions.assertEquals(2, m.getTapeAlphabet().size());
    Assertions.assertTrue(m.getTapeAlphabet().contains(Tape.BLANK));
    Assertions.assertTrue(m.isAccepting("qacc"));
    Assertions.assertTrue(m.isRejecting("qrej"));
    Assertions.assertFalse(m.isAccepting("q0"));
  }

  @Test
  void testValidation() {
    // distinguished states must be distinct
    assertThrows(IllegalArgumentException.class, () ->
        new MachineDefinition("m", STATES, SIGMA, GAMMA, "q0", "q0", "qrej", List.of()));
    // unknown start state
    assertThrows(IllegalArgumentException.class, () ->
        new MachineDefinition("m", STATES, SIGMA, GAMMA, "q9", "qacc", "qrej", List.of()));
    // no blank in the tape alphabet
    assertThrows(IllegalArgumentException.class, () ->
        new MachineDefinition("m", STATES, SIGMA, List.of('a'), "q0", "qacc", "qrej", List.of()));
    // input symbol missing from the tape alphabet
    assertThrows(IllegalArgumentException.class, () ->
        new MachineDefinition("m", STATES, List.of('a', 'b'), GAMMA, "q0", "qacc", "qrej", List.of()));
    // duplicate state
    assertThrows(IllegalArgumentException.class, () ->
        new MachineDefinition("m", List.of("q0", "q0", "qacc", "qrej"), SIGMA, GAMMA, "q0", "qacc", "qrej", List.of()));
    // rule with an unknown target state and an unknown symbol
    assertThrows(IllegalArgumentException.class, () ->
        machine(List.of(new Transition("q0", 'a', "q7", 'a', Move.RIGHT))));
    assertThrows(IllegalArgumentException.class, () ->
        machine(List.of(new Transition("q0", 'a', "q1", 'z', Move.RIGHT))));
  }

  @Test
  void testMoveTokens() {
    Assertions.assertEquals(Move.LEFT, Move.fromToken("L"));
    Assertions.assertEquals(Move.RIGHT, Move.fromToken("R"));
    Assertions.assertEquals(Move.STAY, Move.fromToken("S"));
    Assertions.assertEquals(Move.STAY, Move.fromToken("N"));
    Assertions.assertEquals(Move.STAY, Move.fromToken("r")); // case sensitive
  }
}
