package io.lacuna.egret;

import io.lacuna.bifurcan.*;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Collectors;

/**
 * An immutable finite automaton over symbols of type {@code S}, possibly nondeterministic and possibly carrying
 * epsilon transitions.
 * <p>
 * States are identified by {@link Label}s. Automata created from integers have labels {@code 0..n-1}, while the
 * product, subset and partition constructions yield composite labels, which {@link #normalize()} maps back to a dense
 * integer range. Every operation returns a new automaton.
 *
 * @param <S> the symbols that trigger transitions between states
 * @author ztellman
 */
public class Automaton<S> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Automaton.class);

  // stands in for the epsilon symbol in the transition index
  private static final Object EPSILON = new Object();

  private static final IList<Label> NO_TARGETS = new LinearList<Label>().forked();

  private final ISet<S> alphabet;
  private final IList<Label> states;
  private final @Nullable Label initialState;
  private final ISet<Label> finalStates;
  private final IList<Transition<S>> transitions;

  private final IMap<Label, Integer> stateIndex;
  private final IMap<Label, IMap<Object, IList<Label>>> moves;

  Automaton(ISet<S> alphabet,
            IList<Label> states,
            @Nullable Label initialState,
            ISet<Label> finalStates,
            Iterable<Transition<S>> transitions) {

    LinearSet<S> symbols = new LinearSet<>();
    for (S symbol : alphabet) {
      if (symbol == null) {
        throw new InvalidAutomatonException("Invalid alphabet: epsilon cannot be a symbol");
      }
      symbols.add(symbol);
    }
    this.alphabet = symbols.forked();

    LinearMap<Label, Integer> stateIndex = new LinearMap<>();
    LinearList<Label> labels = new LinearList<>();
    for (Label state : states) {
      if (state == null || stateIndex.contains(state)) {
        throw new InvalidAutomatonException("Invalid states: duplicate or missing label " + state);
      }
      stateIndex.put(state, (int) stateIndex.size());
      labels.addLast(state);
    }
    this.states = labels.forked();
    this.stateIndex = stateIndex.forked();

    if (initialState == null ? states.size() != 0 : !stateIndex.contains(initialState)) {
      throw new InvalidAutomatonException("Invalid initial state " + initialState);
    }
    this.initialState = initialState;

    LinearSet<Label> accept = new LinearSet<>();
    for (Label state : finalStates) {
      if (state == null || !stateIndex.contains(state)) {
        throw new InvalidAutomatonException("Invalid final state " + state);
      }
      accept.add(state);
    }
    this.finalStates = accept.forked();

    LinearSet<Transition<S>> distinct = new LinearSet<>();
    LinearList<Transition<S>> list = new LinearList<>();
    LinearMap<Label, LinearMap<Object, LinearList<Label>>> index = new LinearMap<>();
    for (Transition<S> t : transitions) {
      if (t == null
              || !stateIndex.contains(t.from())
              || !stateIndex.contains(t.to())
              || !(t.isEpsilon() || symbols.contains(t.symbol()))) {
        throw new InvalidAutomatonException("Invalid transition " + t);
      }

      if (!distinct.contains(t)) {
        distinct.add(t);
        list.addLast(t);
        index.getOrCreate(t.from(), LinearMap::new)
                .getOrCreate(key(t.symbol()), LinearList::new)
                .addLast(t.to());
      }
    }
    this.transitions = list.forked();

    // targets are handed out through Image, so only persistent collections are kept
    LinearMap<Label, IMap<Object, IList<Label>>> moves = new LinearMap<>();
    for (Label from : index.keys()) {
      LinearMap<Object, LinearList<Label>> bySymbol = index.get(from, null);
      LinearMap<Object, IList<Label>> forked = new LinearMap<>();
      for (Object symbol : bySymbol.keys()) {
        forked.put(symbol, bySymbol.get(symbol, null).forked());
      }
      moves.put(from, forked.forked());
    }
    this.moves = moves.forked();
  }

  /**
   * @param alphabet the symbols of the automaton
   * @param numberOfStates the number of states, labelled {@code 0..numberOfStates-1}
   * @param initialState the initial state, or {@code -1} when {@code numberOfStates} is zero
   * @param finalStates the accepting states
   * @param transitions the transitions, using {@code null} symbols for epsilon moves
   * @throws InvalidAutomatonException if any of the arguments is inconsistent with the others
   */
  public static <S> Automaton<S> create(Iterable<S> alphabet,
                                        int numberOfStates,
                                        int initialState,
                                        Iterable<Integer> finalStates,
                                        Iterable<Transition<S>> transitions) {
    if (numberOfStates < 0) {
      throw new InvalidAutomatonException("Invalid number of states " + numberOfStates);
    }

    LinearSet<Label> finals = new LinearSet<>();
    for (Integer s : finalStates) {
      if (s == null) {
        throw new InvalidAutomatonException("Invalid final state null");
      }
      finals.add(Label.of(s));
    }

    return indexed(
            toSet(alphabet),
            numberOfStates,
            numberOfStates == 0 && initialState == -1 ? null : Label.of(initialState),
            finals,
            transitions);
  }

  /**
   * @return the automaton with no states, which accepts nothing
   */
  public static <S> Automaton<S> empty(Iterable<S> alphabet) {
    return new Automaton<>(toSet(alphabet), new LinearList<>(), null, new LinearSet<>(), new LinearList<>());
  }

  static <S> Automaton<S> indexed(ISet<S> alphabet,
                                  int numberOfStates,
                                  @Nullable Label initialState,
                                  ISet<Label> finalStates,
                                  Iterable<Transition<S>> transitions) {
    LinearList<Label> states = new LinearList<>();
    for (int i = 0; i < numberOfStates; i++) {
      states.addLast(Label.of(i));
    }
    return new Automaton<>(alphabet, states, initialState, finalStates, transitions);
  }

  private static <S> ISet<S> toSet(Iterable<S> symbols) {
    LinearSet<S> set = new LinearSet<>();
    symbols.forEach(set::add);
    return set;
  }

  private static Object key(@Nullable Object symbol) {
    return symbol == null ? EPSILON : symbol;
  }

  /// accessors

  public ISet<S> alphabet() {
    return alphabet;
  }

  public IList<Label> states() {
    return states;
  }

  public int size() {
    return (int) states.size();
  }

  public @Nullable Label initialState() {
    return initialState;
  }

  public ISet<Label> finalStates() {
    return finalStates;
  }

  public IList<Transition<S>> transitions() {
    return transitions;
  }

  public boolean contains(Label state) {
    return stateIndex.contains(state);
  }

  public boolean isFinal(Label state) {
    return finalStates.contains(state);
  }

  /// transition function

  /**
   * @return the states reached from {@code state} on {@code symbol}
   * @throws InvalidStateException if {@code state} isn't a state of this automaton
   * @throws InvalidSymbolException if {@code symbol} isn't part of the alphabet
   */
  public Image transition(Label state, S symbol) {
    if (!stateIndex.contains(state)) {
      throw new InvalidStateException("Invalid state " + state);
    }
    if (symbol == null || !alphabet.contains(symbol)) {
      throw new InvalidSymbolException("Invalid symbol " + symbol);
    }
    return Image.of(targets(state, symbol));
  }

  /**
   * @return the states reached from {@code state} through a single epsilon transition
   */
  public Image transition(Label state) {
    return Image.of(targets(state, EPSILON));
  }

  private IList<Label> targets(Label state, Object key) {
    if (!stateIndex.contains(state)) {
      throw new InvalidStateException("Invalid state " + state);
    }
    IMap<Object, IList<Label>> m = moves.get(state, null);
    return m == null ? NO_TARGETS : m.get(key, NO_TARGETS);
  }

  /**
   * @return every state reachable from {@code states} through zero or more epsilon transitions
   * @throws InvalidStateException if any of {@code states} isn't a state of this automaton
   */
  public ISet<Label> epsilonClosure(Iterable<Label> states) {
    LinearSet<Label> result = new LinearSet<>();
    LinearList<Label> stack = new LinearList<>();

    for (Label state : states) {
      if (!stateIndex.contains(state)) {
        throw new InvalidStateException("Invalid state " + state);
      }
      if (!result.contains(state)) {
        result.add(state);
        stack.addLast(state);
      }
    }

    while (stack.size() > 0) {
      Label state = stack.popLast();
      for (Label next : targets(state, EPSILON)) {
        if (!result.contains(next)) {
          result.add(next);
          stack.addLast(next);
        }
      }
    }

    return result;
  }

  public ISet<Label> epsilonClosure(Label... states) {
    return epsilonClosure(LinearList.of(states));
  }

  /// execution

  /**
   * Runs the automaton over {@code sequence}, tracking every live state rather than building a deterministic
   * automaton first. Never throws on a rejected sequence: the run stops with a negative status instead.
   *
   * @return the status of the run, and the epsilon-closed live states before and after each consumed symbol
   */
  public Run apply(Iterable<S> sequence) {
    LinearList<ISet<Label>> march = new LinearList<>();
    if (initialState == null) {
      return new Run(false, march);
    }

    try {
      march.addLast(epsilonClosure(initialState).forked());
      for (S symbol : sequence) {
        LinearSet<Label> image = new LinearSet<>();
        for (Label state : march.last()) {
          transition(state, symbol).forEach(image::add);
        }

        ISet<Label> closure = image.size() == 0 ? image : epsilonClosure(image);
        if (closure.size() == 0) {
          return new Run(false, march);
        }
        march.addLast(closure.forked());
      }
    } catch (IllegalArgumentException e) {
      LOGGER.debug("run stopped after {} symbols: {}", march.size() - 1, e.getMessage());
      return new Run(false, march);
    }

    return new Run(true, march);
  }

  /**
   * @return true if {@code sequence} can be consumed entirely and leaves at least one final state live
   */
  public boolean accepts(Iterable<S> sequence) {
    Run run = apply(sequence);
    return run.status() && run.last().containsAny(finalStates);
  }

  /// predicates

  /**
   * @return true if there are no epsilon transitions, and no state has two targets on the same symbol
   */
  public boolean isDeterministic() {
    for (Label state : states) {
      if (targets(state, EPSILON).size() > 0) {
        return false;
      }
      for (S symbol : alphabet) {
        if (transition(state, symbol).isMultiple()) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * @return true if the automaton is deterministic, and every state has exactly one target on every symbol
   */
  public boolean isDeterministicComplete() {
    if (initialState == null || !isDeterministic()) {
      return false;
    }

    for (Label state : states) {
      for (S symbol : alphabet) {
        if (transition(state, symbol).isEmpty()) {
          return false;
        }
      }
    }
    return true;
  }

  /// combinators

  /**
   * @return an integer-labelled copy of this automaton, where every missing transition leads to a new rejecting state
   * @throws PreconditionException if the automaton is nondeterministic, or already complete
   */
  public Automaton<S> completion() {
    if (!isDeterministic()) {
      throw new PreconditionException("This automaton is not deterministic");
    }
    if (isDeterministicComplete()) {
      throw new PreconditionException("This automaton is already deterministic and complete");
    }

    Automaton<S> a = normalize();
    Label sink = Label.of(a.size());

    LinearList<Transition<S>> transitions = Utils.toList(a.transitions);
    LinearList<Label> states = Utils.toList(a.states);
    states.addLast(sink);
    for (Label state : states) {
      for (S symbol : alphabet) {
        if (state.equals(sink) || a.transition(state, symbol).isEmpty()) {
          transitions.addLast(new Transition<>(state, symbol, sink));
        }
      }
    }

    return new Automaton<>(
            alphabet,
            states,
            a.initialState == null ? sink : a.initialState,
            a.finalStates,
            transitions);
  }

  // complete automata are returned as-is
  Automaton<S> completed() {
    return isDeterministicComplete() ? this : completion();
  }

  /**
   * @return an automaton accepting every sequence this one rejects
   * @throws PreconditionException if the automaton isn't deterministic and complete
   */
  public Automaton<S> complement() {
    if (!isDeterministicComplete()) {
      throw new PreconditionException("Only a deterministic and complete automaton can be complemented");
    }

    return new Automaton<>(
            alphabet,
            states,
            initialState,
            Utils.toSet(states.stream().filter(s -> !finalStates.contains(s))),
            transitions);
  }

  /**
   * Incomplete operands are completed first, so that a sequence rejected by one of them can still be accepted by
   * the other.
   *
   * @return an automaton over pairs of states, accepting what either automaton accepts
   * @throws PreconditionException if either automaton is nondeterministic, or the alphabets differ
   */
  public Automaton<S> union(Automaton<S> automaton) {
    checkProduct(automaton);
    Automaton<S> a = completed();
    Automaton<S> b = automaton.completed();
    return Product.join(a, b, (x, y) -> a.isFinal(x) || b.isFinal(y));
  }

  /**
   * @return an automaton over pairs of states, accepting what both automata accept
   * @throws PreconditionException if either automaton is nondeterministic, or the alphabets differ
   */
  public Automaton<S> intersection(Automaton<S> automaton) {
    checkProduct(automaton);
    return Product.join(this, automaton, (x, y) -> isFinal(x) && automaton.isFinal(y));
  }

  /**
   * @return an automaton accepting what this automaton accepts, less what {@code automaton} accepts
   * @throws PreconditionException if either automaton is nondeterministic, or the alphabets differ
   */
  public Automaton<S> difference(Automaton<S> automaton) {
    checkProduct(automaton);
    return intersection(automaton.completed().complement());
  }

  private void checkProduct(Automaton<S> automaton) {
    if (!Utils.sameElements(alphabet, automaton.alphabet)) {
      throw new PreconditionException("Alphabets differ: " + alphabet + " and " + automaton.alphabet);
    }
    if (!isDeterministic() || !automaton.isDeterministic()) {
      throw new PreconditionException("Product constructions need deterministic automata");
    }
  }

  /**
   * @return an automaton accepting the reverse of every sequence this one accepts
   */
  public Automaton<S> mirror() {
    if (finalStates.size() == 0) {
      return new Automaton<>(alphabet, states, initialState, new LinearSet<>(), reverse(transitions));
    }

    if (finalStates.size() == 1) {
      return new Automaton<>(
              alphabet,
              states,
              finalStates.iterator().next(),
              LinearSet.of(initialState),
              reverse(transitions));
    }

    // several final states, so a fresh initial state fans out to each of them
    Automaton<S> a = normalize();
    Label init = Label.of(a.size());

    LinearList<Transition<S>> reversed = reverse(a.transitions);
    for (Label f : a.finalStates) {
      reversed.addLast(Transition.epsilon(init, f));
    }

    LOGGER.debug("mirroring an automaton with {} final states", finalStates.size());
    return indexed(alphabet, a.size() + 1, init, LinearSet.of(a.initialState), reversed);
  }

  private static <S> LinearList<Transition<S>> reverse(IList<Transition<S>> transitions) {
    LinearList<Transition<S>> reversed = new LinearList<>();
    transitions.forEach(t -> reversed.addLast(t.reverse()));
    return reversed;
  }

  /**
   * Fuses the single final state of this automaton with the initial state of {@code automaton}. When the final state
   * has outgoing transitions and the initial state has incoming ones, the two are linked by an epsilon transition
   * instead.
   *
   * @return an automaton accepting a sequence accepted by this automaton followed by one accepted by {@code automaton}
   * @throws PreconditionException if this automaton doesn't have exactly one final state, or the alphabets differ
   */
  public Automaton<S> concat(Automaton<S> automaton) {
    if (finalStates.size() != 1) {
      throw new PreconditionException("The left automaton must have exactly one final state, not " + finalStates.size());
    }
    if (!Utils.sameElements(alphabet, automaton.alphabet)) {
      throw new PreconditionException("Alphabets differ: " + alphabet + " and " + automaton.alphabet);
    }

    Automaton<S> a = normalize();
    if (automaton.initialState == null) {
      return new Automaton<>(alphabet, a.states, a.initialState, new LinearSet<>(), a.transitions);
    }
    Automaton<S> b = automaton.normalize();

    int n = a.size();
    int init = ((Label.Leaf) b.initialState).index();
    Label.Leaf fin = (Label.Leaf) a.finalStates.iterator().next();

    boolean fuse = a.moves.get(fin, null) == null
            || b.transitions.stream().noneMatch(t -> t.to().equals(b.initialState));

    int[] offset = new int[b.size()];
    for (int i = 0; i < offset.length; i++) {
      if (!fuse) {
        offset[i] = n + i;
      } else if (i == init) {
        offset[i] = fin.index();
      } else {
        offset[i] = n + (i < init ? i : i - 1);
      }
    }

    LinearList<Transition<S>> transitions = Utils.toList(a.transitions);
    for (Transition<S> t : b.transitions) {
      transitions.addLast(new Transition<>(
              Label.of(offset[((Label.Leaf) t.from()).index()]),
              t.symbol(),
              Label.of(offset[((Label.Leaf) t.to()).index()])));
    }
    if (!fuse) {
      transitions.addLast(Transition.epsilon(fin, Label.of(offset[init])));
    }

    LinearSet<Label> finals = new LinearSet<>();
    b.finalStates.forEach(s -> finals.add(Label.of(offset[((Label.Leaf) s).index()])));

    return indexed(alphabet, fuse ? n + b.size() - 1 : n + b.size(), a.initialState, finals, transitions);
  }

  /**
   * Adds epsilon transitions from every final state back to the initial state, and a new accepting initial state
   * for the empty sequence.
   *
   * @return an automaton accepting zero or more repetitions of the sequences this one accepts
   */
  public Automaton<S> iteration() {
    Automaton<S> a = normalize();
    Label init = Label.of(a.size());

    LinearList<Transition<S>> transitions = Utils.toList(a.transitions);
    if (a.initialState != null) {
      transitions.addLast(Transition.epsilon(init, a.initialState));
      for (Label f : a.finalStates) {
        transitions.addLast(Transition.epsilon(f, a.initialState));
      }
    }

    LinearSet<Label> finals = new LinearSet<>();
    a.finalStates.forEach(finals::add);
    finals.add(init);

    return indexed(alphabet, a.size() + 1, init, finals, transitions);
  }

  /**
   * @return an equivalent deterministic automaton, whose states are sets of states of this automaton
   * @throws PreconditionException if the automaton is already deterministic
   */
  public Automaton<S> determinize() {
    return Subsets.determinize(this);
  }

  /**
   * @return the minimal equivalent deterministic automaton, whose states are classes of equivalent states of this
   * automaton
   * @throws PreconditionException if the automaton isn't deterministic
   */
  public Automaton<S> minimize() {
    return Partition.minimize(this);
  }

  /**
   * @return an equivalent automaton where each label is replaced by its position in {@link #states()}
   */
  public Automaton<S> normalize() {
    LinearSet<Label> finals = new LinearSet<>();
    finalStates.forEach(s -> finals.add(relabel(s)));

    LinearList<Transition<S>> transitions = new LinearList<>();
    this.transitions.forEach(t -> transitions.addLast(new Transition<>(relabel(t.from()), t.symbol(), relabel(t.to()))));

    return indexed(alphabet, size(), initialState == null ? null : relabel(initialState), finals, transitions);
  }

  private Label relabel(Label state) {
    return Label.of(stateIndex.get(state, -1));
  }

  @Override
  public String toString() {
    return "automaton[alphabet=" + alphabet
            + ", states=" + states
            + ", initial=" + initialState
            + ", final=" + finalStates
            + ", transitions=" + transitions.stream().map(Transition::toString).collect(Collectors.joining(", ", "[", "]"))
            + "]";
  }
}
