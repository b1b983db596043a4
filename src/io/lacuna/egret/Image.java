package io.lacuna.egret;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.Iterator;

/**
 * The result of the transition function for a given state and symbol: no target, or an ordered, duplicate-free
 * sequence of targets.
 */
public final class Image implements Iterable<Label> {

  public static final Image NONE = new Image(new LinearList<Label>().forked());

  private final IList<Label> targets;

  private Image(IList<Label> targets) {
    this.targets = targets.forked();
  }

  static Image of(IList<Label> targets) {
    return targets.size() == 0 ? NONE : new Image(targets);
  }

  public IList<Label> targets() {
    return targets;
  }

  public boolean isEmpty() {
    return targets.size() == 0;
  }

  public boolean isSingle() {
    return targets.size() == 1;
  }

  // the automaton is nondeterministic on this state and symbol
  public boolean isMultiple() {
    return targets.size() > 1;
  }

  /**
   * @return the only target
   * @throws IllegalStateException if there are zero or several targets
   */
  public Label single() {
    if (!isSingle()) {
      throw new IllegalStateException("expected a single target, got " + this);
    }
    return targets.first();
  }

  @Override
  public Iterator<Label> iterator() {
    return targets.iterator();
  }

  @Override
  public String toString() {
    return isEmpty() ? "none" : targets.toString();
  }
}
