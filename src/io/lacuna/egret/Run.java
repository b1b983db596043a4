package io.lacuna.egret;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of {@link Automaton#apply(Iterable)}: whether the whole sequence could be consumed, and the
 * epsilon-closed set of live states before the first symbol and after each consumed one.
 */
public final class Run {

  private final boolean status;
  private final IList<ISet<Label>> march;

  Run(boolean status, IList<ISet<Label>> march) {
    this.status = status;
    this.march = march.forked();
  }

  public boolean status() {
    return status;
  }

  public IList<ISet<Label>> march() {
    return march;
  }

  /**
   * @return the live states once the run stopped, or null if the march is empty
   */
  public @Nullable ISet<Label> last() {
    return march.size() == 0 ? null : march.last();
  }

  @Override
  public String toString() {
    return "run[status=" + status + ", march=" + march + "]";
  }
}
