package io.lacuna.egret;

import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;

import java.util.function.BiPredicate;

/**
 * The synchronized product of two deterministic automata.
 */
final class Product {

  private Product() {
  }

  /**
   * creates an automaton over every pair of states, assumes both automata are deterministic
   */
  static <S> Automaton<S> join(Automaton<S> a, Automaton<S> b, BiPredicate<Label, Label> isAccept) {

    LinearList<Label> states = new LinearList<>();
    LinearSet<Label> accept = new LinearSet<>();
    LinearList<Transition<S>> transitions = new LinearList<>();

    for (Label x : a.states()) {
      for (Label y : b.states()) {
        Label pair = Label.pair(x, y);
        states.addLast(pair);
        if (isAccept.test(x, y)) {
          accept.add(pair);
        }

        for (S symbol : a.alphabet()) {
          Image i = a.transition(x, symbol);
          Image j = b.transition(y, symbol);
          if (i.isSingle() && j.isSingle()) {
            transitions.addLast(new Transition<>(pair, symbol, Label.pair(i.single(), j.single())));
          }
        }
      }
    }

    Label init = a.initialState() == null || b.initialState() == null
            ? null
            : Label.pair(a.initialState(), b.initialState());

    return new Automaton<>(a.alphabet(), states, init, accept, transitions);
  }
}
