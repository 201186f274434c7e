package NTM.Model;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of a nondeterministic Turing machine.
 * Transitions keep table order, which fixes the order in which branches are enumerated.
 * Any (state, symbol) pair without a rule is an implicit transition to the reject state.
 */
public final class MachineDefinition {
  private final String name;
  private final Set<String> states;
  private final Alphabet<Character> inputAlphabet;
  private final Alphabet<Character> tapeAlphabet;
  private final String startState;
  private final String acceptState;
  private final String rejectState;
  private final List<Transition> transitions;
  private final Map<StateSymbol, List<Transition>> index;

  /**
   * @throws IllegalArgumentException if the distinguished states are unknown or not distinct,
   *     the tape alphabet lacks the blank or an input symbol, or a rule names an unknown
   *     state or symbol.
   */
  public MachineDefinition(String name,
                           List<String> states,
                           List<Character> inputAlphabet,
                           List<Character> tapeAlphabet,
                           String startState,
                           String acceptState,
                           String rejectState,
                           List<Transition> transitions) {
    this.name = Objects.requireNonNull(name, "name");
    this.states = Collections.unmodifiableSet(distinct(states, "state"));
    this.inputAlphabet = Alphabets.fromCollection(distinct(inputAlphabet, "input symbol"));
    this.tapeAlphabet = Alphabets.fromCollection(distinct(tapeAlphabet, "tape symbol"));
    this.startState = requireState(startState, "start");
    this.acceptState = requireState(acceptState, "accept");
    this.rejectState = requireState(rejectState, "reject");
    this.transitions = List.copyOf(transitions);

    if (startState.equals(acceptState) || startState.equals(rejectState) || acceptState.equals(rejectState)) {
      throw new IllegalArgumentException("Start, accept and reject states must be distinct: "
          + startState + ", " + acceptState + ", " + rejectState);
    }
    if (!this.tapeAlphabet.contains(Tape.BLANK)) {
      throw new IllegalArgumentException("Tape alphabet must contain the blank symbol " + Tape.BLANK);
    }
    for (Character c : this.inputAlphabet) {
      if (!this.tapeAlphabet.contains(c)) {
        throw new IllegalArgumentException("Input symbol " + c + " missing from tape alphabet");
      }
    }

    final Object2ObjectOpenHashMap<StateSymbol, List<Transition>> grouped = new Object2ObjectOpenHashMap<>();
    for (Transition t : this.transitions) {
      requireState(t.fromState(), "transition source");
      requireState(t.toState(), "transition target");
      requireTapeSymbol(t.readSymbol(), t);
      requireTapeSymbol(t.writeSymbol(), t);
      final StateSymbol key = new StateSymbol(t.fromState(), t.readSymbol());
      List<Transition> rules = grouped.get(key);
      if (rules == null) {
        rules = new ObjectArrayList<>();
        grouped.put(key, rules);
      }
      rules.add(t);
    }
    final Object2ObjectOpenHashMap<StateSymbol, List<Transition>> idx = new Object2ObjectOpenHashMap<>(grouped.size());
    for (Map.Entry<StateSymbol, List<Transition>> e : grouped.entrySet()) {
      idx.put(e.getKey(), List.copyOf(e.getValue()));
    }
    this.index = idx;
  }

  private static <T> Set<T> distinct(List<T> items, String what) {
    Set<T> set = new LinkedHashSet<>(items.size() * 2);
    for (T item : items) {
      if (!set.add(Objects.requireNonNull(item, what))) {
        throw new IllegalArgumentException("Duplicate " + what + ": " + item);
      }
    }
    return set;
  }

  private String requireState(String state, String role) {
    if (state == null || !states.contains(state)) {
      throw new IllegalArgumentException("Unknown " + role + " state: " + state);
    }
    return state;
  }

  private void requireTapeSymbol(char symbol, Transition t) {
    if (!tapeAlphabet.contains(symbol)) {
      throw new IllegalArgumentException("Symbol " + symbol + " of rule " + t + " is not in the tape alphabet");
    }
  }

  public String getName() {
    return name;
  }

  public Set<String> getStates() {
    return states;
  }

  public Alphabet<Character> getInputAlphabet() {
    return inputAlphabet;
  }

  public Alphabet<Character> getTapeAlphabet() {
    return tapeAlphabet;
  }

  public String getStartState() {
    return startState;
  }

  public String getAcceptState() {
    return acceptState;
  }

  public String getRejectState() {
    return rejectState;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  /**
   * Explicit rules for (state, symbol), in table order.
   * @return rules, or an empty list if the pair has none
   */
  public List<Transition> getTransitions(String state, char symbol) {
    return index.getOrDefault(new StateSymbol(state, symbol), List.of());
  }

  public boolean hasExplicitTransition(String state, char symbol) {
    return index.containsKey(new StateSymbol(state, symbol));
  }

  public boolean isAccepting(String state) {
    return acceptState.equals(state);
  }

  public boolean isRejecting(String state) {
    return rejectState.equals(state);
  }

  @Override
  public String toString() {
    return name + " (" + states.size() + " states, " + transitions.size() + " transitions)";
  }

  private record StateSymbol(String state, char symbol) { }
}
