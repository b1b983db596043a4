package io.lacuna.egret;

import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The subset construction.
 */
final class Subsets {

  private static final Logger LOGGER = LoggerFactory.getLogger(Subsets.class);

  private Subsets() {
  }

  // merges non-deterministic sets of states into a single deterministic state
  static <S> Automaton<S> determinize(Automaton<S> automaton) {
    if (automaton.isDeterministic()) {
      throw new PreconditionException("Automaton is already deterministic");
    }

    Label.Group init = Label.group(automaton.epsilonClosure(automaton.initialState()));

    LinearList<Label.Group> queue = LinearList.of(init);
    LinearSet<Label> seen = LinearSet.of(init);
    LinearList<Label> states = LinearList.of(init);
    LinearList<Transition<S>> transitions = new LinearList<>();

    while (queue.size() > 0) {
      Label.Group state = queue.popLast();

      for (S symbol : automaton.alphabet()) {
        LinearSet<Label> image = new LinearSet<>();
        for (Label s : state.members()) {
          automaton.epsilonClosure(automaton.transition(s, symbol)).forEach(image::add);
        }

        if (image.size() > 0) {
          Label.Group next = Label.group(image);
          transitions.addLast(new Transition<>(state, symbol, next));

          if (!seen.contains(next)) {
            seen.add(next);
            states.addLast(next);
            queue.addLast(next);
          }
        }
      }
    }

    LinearSet<Label> accept = new LinearSet<>();
    for (Label state : states) {
      if (((Label.Group) state).members().containsAny(automaton.finalStates())) {
        accept.add(state);
      }
    }

    LOGGER.debug("determinized {} states into {} subsets", automaton.size(), states.size());

    return new Automaton<>(automaton.alphabet(), states, init, accept, transitions);
  }
}
