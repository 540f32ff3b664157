package edu.jhu.hlt.depparse.transition;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.depparse.datatypes.DependencySentence;
import edu.jhu.hlt.depparse.datatypes.Token;

public class ReconstructionTest {

  private static List<Token> words(int n) {
    return TestingUtil.sentence("words", new int[n]).withoutHeads().getTokens();
  }

  @Test
  public void threeWordExample() {
    List<Token> out = Reconstruction.reconstruct(words(3),
        Arrays.asList("Shift", "Shift", "Shift", "LeftArc", "LeftArc", "RightArc"));
    assertEquals(3, out.get(0).head);
    assertEquals(3, out.get(1).head);
    assertEquals(0, out.get(2).head);
    assertEquals("w1", out.get(0).form);
    assertEquals(1, out.get(0).id);
  }

  @Test
  public void leftArcRemovesSecondFromTop() {
    List<Token> out = Reconstruction.reconstruct(words(3),
        Arrays.asList("Shift", "Shift", "LeftArc", "Shift", "RightArc", "RightArc"));
    // w1 <- w2, w3 <- w2, w2 <- ROOT
    assertEquals(2, out.get(0).head);
    assertEquals(0, out.get(1).head);
    assertEquals(2, out.get(2).head);
  }

  @Test
  public void unattachedWordsGoToRoot() {
    List<Token> out = Reconstruction.reconstruct(words(3), Arrays.asList("Shift", "Shift", "LeftArc"));
    assertEquals(2, out.get(0).head);
    assertEquals(0, out.get(1).head);
    assertEquals(0, out.get(2).head);

    out = Reconstruction.reconstruct(words(2), Collections.<String>emptyList());
    assertEquals(0, out.get(0).head);
    assertEquals(0, out.get(1).head);
  }

  @Test
  public void inputHeadsAreIgnored() {
    DependencySentence gold = TestingUtil.threeWords();
    List<Token> out = Reconstruction.reconstruct(gold.getTokens(),
        Arrays.asList("Shift", "Shift", "RightArc", "RightArc", "Shift", "RightArc"));
    assertEquals(1, out.get(1).head);
    assertEquals(0, out.get(0).head);
    assertEquals(0, out.get(2).head);
    // the input is not modified
    assertEquals(3, gold.getTokens().get(0).head);
  }

  @Test
  public void invalidTagFailsImmediately() {
    try {
      Reconstruction.reconstruct(words(2), Arrays.asList("Shift", "SHIFT", "RightArc"));
      fail("expected InvalidActionException");
    } catch (InvalidActionException e) {
      assertEquals("SHIFT", e.getTag());
      assertTrue(e.getMessage().contains("SHIFT"));
    }
  }

  @Test(expected = IllegalTransitionException.class)
  public void shiftWithEmptyBufferFails() {
    Reconstruction.reconstruct(words(1), Arrays.asList("Shift", "Shift"));
  }

  @Test(expected = IllegalTransitionException.class)
  public void reduceWithOnlyRootFails() {
    Reconstruction.reconstruct(words(1), Arrays.asList("RightArc"));
  }

  @Test
  public void decodedTransitionsGiveSameResultAsTags() {
    DependencySentence gold = TestingUtil.sentence("s", 2, 0, 2, 3);
    List<Transition> seq = Oracle.buildSequence(gold);
    assertEquals(
        Reconstruction.reconstruct(gold.getTokens(), TestingUtil.tags(seq)),
        Reconstruction.reconstructTransitions(gold.getTokens(), seq));
    assertEquals(gold.getTokens(), Reconstruction.reconstructTransitions(gold.getTokens(), seq));
  }

  @Test
  public void sentenceVersionKeepsId() {
    DependencySentence gold = TestingUtil.threeWords();
    DependencySentence r = Reconstruction.reconstruct(gold.withoutHeads(),
        TestingUtil.tags(Oracle.buildSequence(gold)));
    assertEquals(gold, r);
  }

  @Test
  public void replayEndsInTerminalState() {
    DependencySentence gold = TestingUtil.threeWords();
    Configuration c = Reconstruction.replay(gold.withoutHeads(), Oracle.buildSequence(gold));
    assertTrue(c.isTerminal());
    assertFalse(c.hasGold());
    assertEquals(6, c.numTransitions());
  }

  @Test
  public void leftArcOntoRootAttachesNothing() {
    List<Token> out = Reconstruction.reconstruct(words(1), Arrays.asList("Shift", "LeftArc"));
    assertEquals(1, out.size());
    assertEquals(0, out.get(0).head);
  }

  @Test
  public void replayContinuesAfterRootIsRemoved() {
    // ROOT is gone after the LeftArc, so w1 stays at the bottom and takes w2
    List<String> tags = Arrays.asList("Shift", "LeftArc", "Shift", "RightArc");
    List<Token> out = Reconstruction.reconstruct(words(2), tags);
    assertEquals(0, out.get(0).head);
    assertEquals(1, out.get(1).head);
    assertEquals(out, Reconstruction.reconstructTransitions(words(2),
        Arrays.asList(Transition.SHIFT, Transition.LEFT_ARC, Transition.SHIFT, Transition.RIGHT_ARC)));
  }

  @Test
  public void reduceWithOneWordLeftFails() {
    try {
      Reconstruction.reconstruct(words(1), Arrays.asList("Shift", "LeftArc", "RightArc"));
      fail("expected IllegalTransitionException");
    } catch (IllegalTransitionException e) {
      assertEquals(Transition.RIGHT_ARC, e.getTransition());
      assertTrue(e.getMessage(), e.getMessage().contains("stack=[1]"));
    }
  }

  @Test(expected = IllegalTransitionException.class)
  public void strictReplayStillChecksLegality() {
    Reconstruction.replay(TestingUtil.sentence("s", 0).withoutHeads(),
        Arrays.asList(Transition.SHIFT, Transition.LEFT_ARC));
  }
}
