package io.lacuna.fst;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Optional;

import static io.lacuna.fst.TestUtils.set;
import static io.lacuna.fst.TestUtils.setOf;

public class FstTest {

  private static Fst<Integer> withDeadStates() {
    return new FstBuilder<Integer>()
            .addStates(0, 1, 2, 3, 4)
            .setInitial(0)
            .setFinal(2)
            .addTransition(0, "a", 1)
            .addTransition(1, "b", 2)
            .addTransition(0, "c", 3)
            .addTransition(4, "a", 2)
            .build();
  }

  @Test
  public void testTrimKeepsLiveStates() {
    Fst<Integer> trimmed = withDeadStates().trim();

    Assert.assertEquals(set(trimmed.states()), setOf(0, 1, 2));
    Assert.assertEquals(trimmed.transitionCount(), 2);
    Assert.assertEquals(trimmed.initialState(), Optional.of(0));
    Assert.assertEquals(set(trimmed.acceptedStrings(3)), setOf("a b"));
  }

  @Test
  public void testTrimIsIdempotent() {
    Fst<Integer> once = withDeadStates().trim();
    Assert.assertEquals(once.trim(), once);
    Assert.assertEquals(once.trim().hashCode(), once.hashCode());
  }

  @Test
  public void testTrimEmptyLanguage() {
    Fst<Integer> fst = new FstBuilder<Integer>()
            .addStates(0, 1)
            .setInitial(0)
            .addTransition(0, "a", 1)
            .build()
            .trim();

    Assert.assertEquals(fst.stateCount(), 0);
    Assert.assertFalse(fst.initialState().isPresent());
    Assert.assertTrue(fst.acceptedStrings(5).size() == 0);
  }

  @Test(expectedExceptions = UnknownStateException.class)
  public void testUnknownState() {
    new FstBuilder<String>()
            .addState("a")
            .addTransition("a", "x", "b");
  }

  @Test
  public void testUnknownStateNamesLabel() {
    try {
      Fst.<String>empty().withInitial("q");
      Assert.fail();
    } catch (UnknownStateException e) {
      Assert.assertEquals(e.label(), "q");
    }
  }

  @Test
  public void testEmpty() {
    Fst<String> empty = Fst.empty();

    Assert.assertEquals(empty.stateCount(), 0);
    Assert.assertFalse(empty.initialState().isPresent());
    Assert.assertEquals(empty, Fst.<String>empty());
    Assert.assertTrue(empty.withState("q").contains("q"));
    Assert.assertFalse(empty.contains("q"));
  }

  @Test
  public void testPersistence() {
    Fst<Integer> before = Fsts.linearAcceptor("a b");
    Fst<Integer> after = before
            .withTransition(0, "c", 2)
            .withFinal(1)
            .withoutState(2);

    Assert.assertEquals(before.transitionCount(), 2);
    Assert.assertEquals(set(before.finalStates()), setOf(2));
    Assert.assertTrue(before.contains(2));

    Assert.assertFalse(after.contains(2));
    Assert.assertEquals(after.transitionCount(), 1);
    Assert.assertEquals(set(after.acceptedStrings(3)), setOf("a"));
  }

  @Test
  public void testEqualityIgnoresConstructionOrder() {
    Fst<String> a = new FstBuilder<String>()
            .addStates("p", "q")
            .setInitial("p")
            .setFinal("q")
            .addTransition("p", "x", "y", "q")
            .addTransition("q", "z", "p")
            .build();
    Fst<String> b = new FstBuilder<String>()
            .addStates("q", "p")
            .addTransition("q", "z", "p")
            .addTransition("p", "x", "y", "q")
            .setFinal("q")
            .setInitial("p")
            .build();

    Assert.assertEquals(a, b);
    Assert.assertNotEquals(a, b.withFinal("q", "w"));
  }

  @Test
  public void testRedirect() {
    Fst<Integer> fst = new FstBuilder<Integer>()
            .addStates(0, 1, 2)
            .setInitial(0)
            .setFinal(2)
            .addTransition(0, "a", 1)
            .addTransition(1, "b", 2)
            .addTransition(0, "c", 2)
            .build()
            .redirect(1, 0);

    Assert.assertEquals(fst.transition(0, "a").get().dest(), Integer.valueOf(0));
    Assert.assertEquals(set(fst.reachable(Words.tokens("a a a"))), setOf(0));
    Assert.assertEquals(set(fst.trim().states()), setOf(0, 2));
    Assert.assertEquals(fst.trim().transitionCount(), 2);
    Assert.assertEquals(set(fst.acceptedStrings(2)), setOf("c", "a c", "a a c", "a a a c"));
  }

  @Test
  public void testWithOutput() {
    Fst<Integer> fst = Fsts.linearAcceptor("a");
    Transition<Integer> t = fst.transition(0, "a").get();
    Fst<Integer> updated = fst.withOutput(t, "x y");

    Assert.assertEquals(updated.transition(0, "a").get().output(), "x y");
    Assert.assertEquals(fst.transition(0, "a").get().output(), "a");
    Assert.assertEquals(set(updated.acceptedPairs(1)), setOf(Pair.of("a", "x y")));
  }

  @Test
  public void testMapStates() {
    Fst<String> fst = Fsts.linearAcceptor("a b").mapStates(i -> "q" + i);

    Assert.assertEquals(set(fst.states()), setOf("q0", "q1", "q2"));
    Assert.assertEquals(fst.initialState(), Optional.of("q0"));
    Assert.assertEquals(set(fst.finalStates()), setOf("q2"));
    Assert.assertEquals(set(fst.acceptedStrings(2)), setOf("a b"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testMapStatesMustBeInjective() {
    Fsts.linearAcceptor("a b").mapStates(i -> "q");
  }

  @Test
  public void testReverseLinear() {
    Fst<Integer> reversed = Fsts.linearAcceptor("a b c").reverse(-1);

    Assert.assertEquals(reversed.initialState(), Optional.of(-1));
    Assert.assertEquals(set(reversed.finalStates()), setOf(0));
    Assert.assertEquals(set(reversed.acceptedStrings(5)), setOf("c b a"));
  }

  @Test
  public void testReverseAcyclic() {
    Fst<Integer> fst = new FstBuilder<Integer>()
            .addStates(0, 1, 2, 3)
            .setInitial(0)
            .setFinal(1)
            .setFinal(3)
            .addTransition(0, "a", 1)
            .addTransition(0, "b", 2)
            .addTransition(2, "c", 3)
            .build();

    Assert.assertEquals(set(fst.acceptedStrings(4)), setOf("a", "b c"));
    Assert.assertEquals(set(fst.reverse(-1).acceptedStrings(4)), setOf("a", "c b"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testReverseRejectsExistingLabel() {
    Fsts.linearAcceptor("a").reverse(1);
  }

  @Test
  public void testAcceptedStringsOfCycleAreBounded() {
    Fst<Integer> fst = new FstBuilder<Integer>()
            .addState(0)
            .setInitial(0)
            .setFinal(0)
            .addTransition(0, "a", 0)
            .build();

    Assert.assertEquals(set(fst.acceptedStrings(1)), setOf("", "a", "a a", "a a a"));
  }

  @Test
  public void testProjections() {
    Fst<Integer> fst = new FstBuilder<Integer>()
            .addStates(0, 1)
            .setInitial(0)
            .setFinal(1)
            .addTransition(0, "a", "x", 1)
            .build();

    Assert.assertEquals(set(fst.acceptedPairs(1)), setOf(Pair.of("a", "x")));
    Assert.assertEquals(set(fst.projectInput().acceptedPairs(1)), setOf(Pair.of("a", "a")));
    Assert.assertEquals(set(fst.projectOutput().acceptedPairs(1)), setOf(Pair.of("x", "x")));
  }

  @Test
  public void testSubsequential() {
    Fst<Integer> fst = Fsts.linearAcceptor("a b");
    Assert.assertTrue(fst.isSubsequential());
    Assert.assertFalse(fst.withTransition(0, "a", 2).isSubsequential());
  }

  @Test
  public void testFinalOutputs() {
    Fst<Integer> fst = Fsts.linearAcceptor("a").withFinal(1, "x");

    Assert.assertTrue(fst.hasFinalOutputs());
    Assert.assertEquals(fst.finalOutput(1), Optional.of("x"));
    Assert.assertEquals(fst.finalOutput(0), Optional.empty());
    Assert.assertEquals(set(fst.acceptedPairs(1)), setOf(Pair.of("a", "a x")));
    Assert.assertFalse(fst.withoutFinal(1).isFinal(1));
  }
}
