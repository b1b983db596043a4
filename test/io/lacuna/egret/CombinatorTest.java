package io.lacuna.egret;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.lacuna.egret.Utils.symbols;
import static io.lacuna.egret.Words.AB;
import static io.lacuna.egret.Words.accepts;
import static io.lacuna.egret.Words.assertEquivalent;
import static io.lacuna.egret.Words.assertLanguage;
import static org.junit.jupiter.api.Assertions.*;

class CombinatorTest {

  private static Automaton<String> word(String w) {
    return AutomatonBuilder.word(AB, symbols(w));
  }

  // every word ending with 'a', complete
  private static final Automaton<String> ENDS_WITH_A = new AutomatonBuilder<String>()
          .alphabet(AB)
          .states(2)
          .initial(0)
          .accept(1)
          .transition(0, "a", 1)
          .transition(0, "b", 0)
          .transition(1, "a", 1)
          .transition(1, "b", 0)
          .build();

  // every word of length two, incomplete
  private static final Automaton<String> LENGTH_TWO = new AutomatonBuilder<String>()
          .alphabet(AB)
          .states(3)
          .initial(0)
          .accept(2)
          .transition(0, "a", 1)
          .transition(0, "b", 1)
          .transition(1, "a", 2)
          .transition(1, "b", 2)
          .build();

  @Nested
  @DisplayName("completion and complement")
  class Complement {

    @Test
    void completionAddsSink() {
      Automaton<String> a = word("a");
      Automaton<String> c = a.completion();

      assertEquals(a.size() + 1, c.size());
      assertTrue(c.isDeterministicComplete());
      assertEquivalent(a, c, 4);
    }

    @Test
    void completionPreconditions() {
      assertThrows(PreconditionException.class, () -> ENDS_WITH_A.completion());
      assertThrows(PreconditionException.class, () -> word("ab").iteration().completion());
    }

    @Test
    void completionOfEmptyAutomaton() {
      Automaton<String> c = Automaton.empty(AB).completion();

      assertEquals(1, c.size());
      assertTrue(c.isDeterministicComplete());
      assertLanguage(w -> false, c, 3);
      assertLanguage(w -> true, c.complement(), 3);
    }

    @Test
    void complementInvertsAcceptance() {
      Automaton<String> c = word("a").completion().complement();

      assertLanguage(w -> !w.equals("a"), c, 4);
    }

    @Test
    void complementRequiresCompleteness() {
      assertThrows(PreconditionException.class, () -> word("a").complement());
      assertThrows(PreconditionException.class, () -> word("ab").iteration().complement());
    }

    @Test
    void doubleComplementIsIdentity() {
      Automaton<String> a = LENGTH_TWO.completion();

      assertEquivalent(a, a.complement().complement(), 5);
      assertEquivalent(ENDS_WITH_A, ENDS_WITH_A.complement().complement(), 5);
    }
  }

  @Nested
  @DisplayName("products")
  class Products {

    @Test
    void unionOfWords() {
      Automaton<String> u = word("a").union(word("b"));

      assertLanguage(w -> w.equals("a") || w.equals("b"), u, 4);
      assertTrue(u.initialState() instanceof Label.Pair);
    }

    @Test
    void intersection() {
      Automaton<String> i = ENDS_WITH_A.intersection(LENGTH_TWO);

      assertLanguage(w -> w.length() == 2 && w.endsWith("a"), i, 5);
      assertEquals(ENDS_WITH_A.size() * LENGTH_TWO.size(), i.size());
    }

    @Test
    void intersectionWithEmptyAutomaton() {
      Automaton<String> i = ENDS_WITH_A.intersection(Automaton.empty(AB));

      assertEquals(0, i.size());
      assertLanguage(w -> false, i, 3);
    }

    @Test
    void difference() {
      Automaton<String> d = ENDS_WITH_A.difference(word("ba"));

      assertLanguage(w -> w.endsWith("a") && !w.equals("ba"), d, 5);
    }

    @Test
    void deMorgan() {
      Automaton<String> a = ENDS_WITH_A;
      Automaton<String> b = LENGTH_TWO.completion();

      assertEquivalent(
              a.union(b).complement(),
              a.complement().intersection(b.complement()),
              5);
      assertEquivalent(
              a.intersection(b).complement(),
              a.complement().union(b.complement()),
              5);
    }

    @Test
    void productPreconditions() {
      Automaton<String> nfa = word("a").iteration();

      assertThrows(PreconditionException.class, () -> nfa.union(ENDS_WITH_A));
      assertThrows(PreconditionException.class, () -> ENDS_WITH_A.intersection(nfa));
      assertThrows(PreconditionException.class,
              () -> ENDS_WITH_A.union(AutomatonBuilder.word(List.of("a", "c"), symbols("c"))));
    }
  }

  @Nested
  @DisplayName("mirror")
  class Mirror {

    @Test
    void reversesWord() {
      Automaton<String> m = word("ab").mirror();

      assertLanguage(w -> w.equals("ba"), m, 4);
      assertEquals(Label.of(2), m.initialState());
    }

    @Test
    void severalFinalStates() {
      Automaton<String> a = new AutomatonBuilder<String>()
              .alphabet(AB)
              .states(3)
              .initial(0)
              .accept(1, 2)
              .transition(0, "a", 1)
              .transition(1, "b", 2)
              .build();

      assertLanguage(w -> w.equals("a") || w.equals("ba"), a.mirror(), 4);
    }

    @Test
    void noFinalStates() {
      assertLanguage(w -> false, AutomatonBuilder.none(AB).mirror(), 3);
    }

    @Test
    void mirrorTwiceKeepsLanguage() {
      assertEquivalent(ENDS_WITH_A, ENDS_WITH_A.mirror().mirror(), 5);
    }
  }

  @Nested
  @DisplayName("concatenation")
  class Concatenation {

    @Test
    void concatenatesWords() {
      Automaton<String> c = word("a").concat(word("b"));

      assertTrue(accepts(c, "ab"));
      for (String w : List.of("a", "b", "ba", "")) {
        assertFalse(accepts(c, w), w);
      }
      assertLanguage(w -> w.equals("ab"), c, 4);
      assertEquals(3, c.size());
    }

    @Test
    void bridgesLoopingStates() {
      // ab*
      Automaton<String> left = new AutomatonBuilder<String>()
              .alphabet(AB)
              .states(2)
              .initial(0)
              .accept(1)
              .transition(0, "a", 1)
              .transition(1, "b", 1)
              .build();

      // a*
      Automaton<String> right = new AutomatonBuilder<String>()
              .alphabet(AB)
              .states(1)
              .initial(0)
              .accept(0)
              .transition(0, "a", 0)
              .build();

      Automaton<String> c = left.concat(right);

      assertLanguage(w -> w.matches("ab*a*"), c, 5);
      assertEquals(3, c.size());
    }

    @Test
    void rightInitialStateNeedNotBeZero() {
      Automaton<String> right = new AutomatonBuilder<String>()
              .alphabet(AB)
              .states(3)
              .initial(2)
              .accept(0)
              .transition(2, "b", 1)
              .transition(1, "a", 0)
              .build();

      assertLanguage(w -> w.equals("aba"), word("a").concat(right), 4);
    }

    @Test
    void leftOperandNeedsSingleFinalState() {
      Automaton<String> twoFinals = new AutomatonBuilder<String>()
              .alphabet(AB)
              .states(2)
              .initial(0)
              .accept(0, 1)
              .transition(0, "a", 1)
              .build();

      assertThrows(PreconditionException.class, () -> twoFinals.concat(word("b")));
      assertThrows(PreconditionException.class, () -> AutomatonBuilder.none(AB).concat(word("b")));
    }

    @Test
    void emptyRightOperand() {
      assertLanguage(w -> false, word("a").concat(Automaton.empty(AB)), 3);
    }
  }

  @Nested
  @DisplayName("iteration")
  class Iteration {

    @Test
    void zeroOrMore() {
      Automaton<String> star = word("ab").iteration();

      assertLanguage(w -> w.matches("(ab)*"), star, 6);
      assertTrue(accepts(star, ""));
    }

    @Test
    void initialStateWithIncomingTransitions() {
      // a(ba)*, where the initial state can be re-entered
      Automaton<String> a = new AutomatonBuilder<String>()
              .alphabet(AB)
              .states(2)
              .initial(0)
              .accept(1)
              .transition(0, "a", 1)
              .transition(1, "b", 0)
              .build();

      assertLanguage(w -> w.matches("(a(ba)*)*"), a.iteration(), 6);
    }

    @Test
    void iterationOfEmptyAutomaton() {
      Automaton<String> star = Automaton.empty(AB).iteration();

      assertLanguage(String::isEmpty, star, 3);
    }
  }
}
