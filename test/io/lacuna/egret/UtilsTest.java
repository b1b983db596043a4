package io.lacuna.egret;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {

  @Test
  void pairsAreUnorderedAndDistinct() {
    IList<IList<String>> pairs = Utils.pairs(LinearList.of("a", "b", "c"));

    assertEquals(3, pairs.size());
    for (IList<String> p : pairs) {
      assertEquals(2, p.size());
      assertNotEquals(p.nth(0), p.nth(1));
    }
    assertEquals("a", pairs.nth(0).nth(0));
    assertEquals("b", pairs.nth(0).nth(1));
    assertEquals("b", pairs.nth(2).nth(0));
    assertEquals("c", pairs.nth(2).nth(1));
  }

  @Test
  void pairsOfSmallLists() {
    assertEquals(0, Utils.pairs(LinearList.of("a")).size());
    assertEquals(0, Utils.pairs(new LinearList<String>()).size());
    assertEquals(1, Utils.pairs(LinearList.of("a", "b")).size());
  }

  @Test
  void sameElements() {
    assertTrue(Utils.sameElements(LinearSet.of(1, 2, 3), LinearSet.of(3, 1, 2)));
    assertFalse(Utils.sameElements(LinearSet.of(1, 2, 3), LinearSet.of(1, 2)));
    assertFalse(Utils.sameElements(LinearSet.of(1, 2), LinearSet.of(1, 3)));
    assertEquals(Utils.unorderedHash(LinearSet.of(1, 2, 3)), Utils.unorderedHash(LinearSet.of(2, 3, 1)));
  }

  @Test
  void symbols() {
    IList<String> s = Utils.symbols("ab1");

    assertEquals(3, s.size());
    assertEquals("a", s.nth(0));
    assertEquals("1", s.nth(2));
    assertEquals(0, Utils.symbols("").size());
  }

  @Test
  void groupBy() {
    IMap<Integer, ISet<Integer>> groups = Utils.groupBy(LinearList.of(1, 2, 3, 4, 5), i -> i % 2);

    assertEquals(2, groups.size());
    assertEquals(3, groups.get(1, null).size());
    assertEquals(2, groups.get(0, null).size());
  }
}
