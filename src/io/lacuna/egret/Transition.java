package io.lacuna.egret;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * A move from one state to another, either on a symbol or, when the symbol is {@code null}, spontaneously.
 *
 * @param <S> the symbols that trigger transitions between states
 */
public final class Transition<S> {

  private final Label from, to;
  private final @Nullable S symbol;

  public Transition(Label from, @Nullable S symbol, Label to) {
    this.from = Objects.requireNonNull(from, "from");
    this.to = Objects.requireNonNull(to, "to");
    this.symbol = symbol;
  }

  public static <S> Transition<S> of(int from, S symbol, int to) {
    return new Transition<>(Label.of(from), Objects.requireNonNull(symbol, "symbol"), Label.of(to));
  }

  public static <S> Transition<S> epsilon(int from, int to) {
    return new Transition<>(Label.of(from), null, Label.of(to));
  }

  public static <S> Transition<S> epsilon(Label from, Label to) {
    return new Transition<>(from, null, to);
  }

  public Label from() {
    return from;
  }

  public Label to() {
    return to;
  }

  public @Nullable S symbol() {
    return symbol;
  }

  public boolean isEpsilon() {
    return symbol == null;
  }

  /**
   * @return the same transition, pointing the other way
   */
  public Transition<S> reverse() {
    return new Transition<>(to, symbol, from);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Transition)) {
      return false;
    }
    Transition<?> t = (Transition<?>) o;
    return from.equals(t.from) && to.equals(t.to) && Objects.equals(symbol, t.symbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, symbol, to);
  }

  @Override
  public String toString() {
    return "{" + from + ", " + (symbol == null ? "ε" : symbol) + " => " + to + "}";
  }
}
