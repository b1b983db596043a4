package io.lacuna.egret;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimization by partition refinement: states start out split between final and non-final, and a class is split
 * whenever two of its members move to different classes on the same symbol.
 */
final class Partition {

  private static final Logger LOGGER = LoggerFactory.getLogger(Partition.class);

  // the class of a missing transition
  private static final int NONE = -1;

  private Partition() {
  }

  static <S> Automaton<S> minimize(Automaton<S> automaton) {
    if (!automaton.isDeterministic()) {
      throw new PreconditionException("Only a deterministic automaton can be minimized");
    }

    if (automaton.initialState() == null) {
      return Automaton.empty(automaton.alphabet());
    }

    ISet<Label> reachable = reachable(automaton);

    LinearList<Label> rejecting = new LinearList<>();
    LinearList<Label> accepting = new LinearList<>();
    for (Label state : automaton.states()) {
      if (reachable.contains(state)) {
        (automaton.isFinal(state) ? accepting : rejecting).addLast(state);
      }
    }

    IList<IList<Label>> classes = new LinearList<>();
    for (IList<Label> c : LinearList.of(rejecting, accepting)) {
      if (c.size() > 0) {
        classes.addLast(c);
      }
    }

    int passes = 0;
    boolean split = true;
    while (split) {
      split = false;
      passes++;

      IMap<Label, Integer> classOf = classOf(classes);
      LinearList<IList<Label>> refined = new LinearList<>();

      for (IList<Label> c : classes) {
        boolean distinguishable = Utils.pairs(c).stream()
                .anyMatch(p -> !signature(automaton, p.nth(0), classOf).equals(signature(automaton, p.nth(1), classOf)));

        if (distinguishable) {
          for (ISet<Label> group : Utils.groupBy(c, s -> signature(automaton, s, classOf)).values()) {
            refined.addLast(Utils.toList(group));
          }
          split = true;
        } else {
          refined.addLast(c);
        }
      }

      classes = refined;
    }

    LOGGER.debug("minimized {} states into {} classes after {} passes", automaton.size(), classes.size(), passes);

    return quotient(automaton, classes);
  }

  // the class reached on each symbol, in alphabet order
  private static <S> List<Integer> signature(Automaton<S> automaton, Label state, IMap<Label, Integer> classOf) {
    List<Integer> signature = new ArrayList<>();
    for (S symbol : automaton.alphabet()) {
      Image image = automaton.transition(state, symbol);
      signature.add(image.isEmpty() ? NONE : classOf.get(image.single(), NONE));
    }
    return signature;
  }

  private static IMap<Label, Integer> classOf(IList<IList<Label>> classes) {
    LinearMap<Label, Integer> m = new LinearMap<>();
    for (int i = 0; i < classes.size(); i++) {
      for (Label state : classes.nth(i)) {
        m.put(state, i);
      }
    }
    return m;
  }

  private static <S> Automaton<S> quotient(Automaton<S> automaton, IList<IList<Label>> classes) {
    IMap<Label, Integer> classOf = classOf(classes);

    LinearList<Label> states = new LinearList<>();
    classes.forEach(c -> states.addLast(Label.group(c)));

    Label init = states.nth(classOf.get(automaton.initialState(), NONE));

    LinearSet<Label> accept = new LinearSet<>();
    LinearList<Transition<S>> transitions = new LinearList<>();
    for (int i = 0; i < classes.size(); i++) {
      Label from = states.nth(i);
      for (Label state : classes.nth(i)) {
        if (automaton.isFinal(state)) {
          accept.add(from);
        }
        for (S symbol : automaton.alphabet()) {
          for (Label target : automaton.transition(state, symbol)) {
            transitions.addLast(new Transition<>(from, symbol, states.nth(classOf.get(target, NONE))));
          }
        }
      }
    }

    return new Automaton<>(automaton.alphabet(), states, init, accept, transitions);
  }

  private static <S> ISet<Label> reachable(Automaton<S> automaton) {
    LinearSet<Label> visited = LinearSet.of(automaton.initialState());
    LinearList<Label> queue = LinearList.of(automaton.initialState());

    while (queue.size() > 0) {
      Label state = queue.popFirst();
      for (S symbol : automaton.alphabet()) {
        for (Label next : automaton.transition(state, symbol)) {
          if (!visited.contains(next)) {
            visited.add(next);
            queue.addLast(next);
          }
        }
      }
    }

    return visited;
  }
}
