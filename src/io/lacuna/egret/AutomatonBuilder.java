package io.lacuna.egret;

import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;

/**
 * Assembles an integer-labelled {@link Automaton} one piece at a time.
 *
 * @param <S> the symbols that trigger transitions between states
 */
public class AutomatonBuilder<S> {

  private final LinearSet<S> alphabet = new LinearSet<>();
  private final LinearSet<Integer> accept = new LinearSet<>();
  private final LinearList<Transition<S>> transitions = new LinearList<>();
  private int states = 0;
  private int init = -1;

  public AutomatonBuilder() {
  }

  /// shortcuts

  /**
   * @return an automaton that accepts exactly {@code symbols}
   */
  public static <S> Automaton<S> word(Iterable<S> alphabet, Iterable<S> symbols) {
    AutomatonBuilder<S> builder = new AutomatonBuilder<S>().alphabet(alphabet).states(1).initial(0);

    int state = 0;
    for (S symbol : symbols) {
      builder.states(state + 2).transition(state, symbol, state + 1);
      state++;
    }

    return builder.accept(state).build();
  }

  /**
   * @return a complete automaton that rejects any input
   */
  public static <S> Automaton<S> none(Iterable<S> alphabet) {
    AutomatonBuilder<S> builder = new AutomatonBuilder<S>().alphabet(alphabet).states(1).initial(0);
    alphabet.forEach(s -> builder.transition(0, s, 0));
    return builder.build();
  }

  /**
   * @return a complete automaton that accepts any input
   */
  public static <S> Automaton<S> any(Iterable<S> alphabet) {
    AutomatonBuilder<S> builder = new AutomatonBuilder<S>().alphabet(alphabet).states(1).initial(0).accept(0);
    alphabet.forEach(s -> builder.transition(0, s, 0));
    return builder.build();
  }

  ///

  @SafeVarargs
  public final AutomatonBuilder<S> alphabet(S... symbols) {
    for (S s : symbols) {
      alphabet.add(s);
    }
    return this;
  }

  public AutomatonBuilder<S> alphabet(Iterable<S> symbols) {
    symbols.forEach(alphabet::add);
    return this;
  }

  /**
   * @return the current builder, with states labelled {@code 0..n-1}
   */
  public AutomatonBuilder<S> states(int n) {
    states = n;
    return this;
  }

  public AutomatonBuilder<S> initial(int state) {
    init = state;
    return this;
  }

  /**
   * @return the current builder, with {@code states} added to the accepting states
   */
  public AutomatonBuilder<S> accept(int... states) {
    for (int s : states) {
      accept.add(s);
    }
    return this;
  }

  public AutomatonBuilder<S> transition(int from, S symbol, int to) {
    transitions.addLast(Transition.of(from, symbol, to));
    return this;
  }

  public AutomatonBuilder<S> epsilon(int from, int to) {
    transitions.addLast(Transition.epsilon(from, to));
    return this;
  }

  /**
   * @throws InvalidAutomatonException if the pieces don't form a valid automaton
   */
  public Automaton<S> build() {
    return Automaton.create(alphabet, states, init, accept, transitions);
  }
}
