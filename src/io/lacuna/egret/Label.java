package io.lacuna.egret;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

import java.util.stream.Collectors;

/**
 * The identity of a state. Automata built from integers use {@link Leaf} labels, derived constructions use
 * {@link Pair} (products) and {@link Group} (subsets and equivalence classes). Labels are always compared
 * structurally.
 */
public abstract class Label {

  private Label() {
  }

  public static Leaf of(int index) {
    return new Leaf(index);
  }

  public static Pair pair(Label first, Label second) {
    return new Pair(first, second);
  }

  public static Group group(Iterable<Label> members) {
    LinearSet<Label> set = new LinearSet<>();
    members.forEach(set::add);
    return new Group(set);
  }

  public static Group group(Label... members) {
    return new Group(LinearSet.of(members));
  }

  ////

  public static final class Leaf extends Label {

    private final int index;

    private Leaf(int index) {
      this.index = index;
    }

    public int index() {
      return index;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Leaf && ((Leaf) o).index == index;
    }

    @Override
    public int hashCode() {
      return Integer.hashCode(index);
    }

    @Override
    public String toString() {
      return String.valueOf(index);
    }
  }

  /**
   * An ordered pair of labels, the state of a product construction.
   */
  public static final class Pair extends Label {

    private final Label first, second;

    private Pair(Label first, Label second) {
      if (first == null || second == null) {
        throw new IllegalArgumentException("pair components cannot be null");
      }
      this.first = first;
      this.second = second;
    }

    public Label first() {
      return first;
    }

    public Label second() {
      return second;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Pair)) {
        return false;
      }
      Pair p = (Pair) o;
      return first.equals(p.first) && second.equals(p.second);
    }

    @Override
    public int hashCode() {
      return 31 * first.hashCode() + second.hashCode();
    }

    @Override
    public String toString() {
      return "(" + first + ", " + second + ")";
    }
  }

  /**
   * An unordered set of labels, the state of a subset construction or an equivalence class.
   */
  public static final class Group extends Label {

    private final ISet<Label> members;

    private Group(ISet<Label> members) {
      this.members = members.forked();
    }

    public ISet<Label> members() {
      return members;
    }

    public boolean contains(Label label) {
      return members.contains(label);
    }

    public long size() {
      return members.size();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Group && Utils.sameElements(members, ((Group) o).members);
    }

    @Override
    public int hashCode() {
      return Utils.unorderedHash(members);
    }

    @Override
    public String toString() {
      return members.stream().map(Label::toString).collect(Collectors.joining(", ", "{", "}"));
    }
  }
}
