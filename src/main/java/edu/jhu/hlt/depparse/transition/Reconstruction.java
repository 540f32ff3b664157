package edu.jhu.hlt.depparse.transition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import edu.jhu.hlt.depparse.datatypes.DependencySentence;
import edu.jhu.hlt.depparse.datatypes.Token;

/**
 * Inverse of the {@link Oracle}: replays a transition sequence (typically the
 * one a model picked at decode time) from the initial configuration and reads
 * the heads off of the arcs that were built.
 *
 * Replay trusts the sequence and does not re-check legality. A LeftArc which
 * takes ROOT as its dependent removes ROOT from the stack and builds no arc,
 * so the word on top ends up attached to ROOT by default. A step which cannot
 * be carried out at all (a Shift with an empty buffer, a reduction with fewer
 * than two words on the stack) fails with an {@link IllegalTransitionException}.
 */
public class Reconstruction {

  /**
   * @param tokens the sentence without ROOT, ids 1..n; any heads are ignored
   * @param tags wire names of the transitions, e.g. "Shift"
   * @return copies of the tokens with their reconstructed heads. A token that
   * never received a head is attached to ROOT.
   * @throws InvalidActionException on the first tag which is not a transition
   */
  public static List<Token> reconstruct(List<Token> tokens, List<String> tags) {
    Replay r = new Replay(tokens.size());
    for (String tag : tags)
      r.step(Transition.fromRepr(tag));
    return assignHeads(tokens, r.heads);
  }

  /** Same as {@link #reconstruct(List, List)} for already decoded transitions */
  public static List<Token> reconstructTransitions(List<Token> tokens, List<Transition> transitions) {
    Replay r = new Replay(tokens.size());
    for (Transition t : transitions)
      r.step(t);
    return assignHeads(tokens, r.heads);
  }

  /**
   * The configuration reached by applying every transition to sentence's start
   * state. Unlike reconstruction this goes through
   * {@link Transition#updateState(Configuration)}, so every transition must be
   * legal.
   */
  public static Configuration replay(DependencySentence sentence, List<Transition> transitions) {
    Configuration c = Configuration.initialState(sentence);
    for (Transition t : transitions)
      c = t.updateState(c);
    return c;
  }

  /** Reconstructed tree as a sentence, keeping the id of sentence */
  public static DependencySentence reconstruct(DependencySentence sentence, List<String> tags) {
    return new DependencySentence(sentence.getId(), reconstruct(sentence.getTokens(), tags));
  }

  private static List<Token> assignHeads(List<Token> tokens, int[] heads) {
    List<Token> out = new ArrayList<>(tokens.size());
    for (Token t : tokens) {
      int h = heads[t.id];
      out.add(t.withHead(h == Token.NO_HEAD ? Token.ROOT_ID : h));
    }
    return out;
  }

  /**
   * Bare stack and buffer for replaying decoded sequences. Unlike a
   * {@link Configuration} the stack may lose ROOT.
   */
  static final class Replay {
    private final int n;
    private final int[] stack;
    private int stackSize;
    private int position;
    final int[] heads;   // indexed by token id

    Replay(int n) {
      this.n = n;
      this.stack = new int[n + 1];
      this.stack[0] = Token.ROOT_ID;
      this.stackSize = 1;
      this.position = 0;
      this.heads = new int[n + 1];
      Arrays.fill(heads, Token.NO_HEAD);
    }

    void step(Transition t) {
      List<Transition> parts = t.components();
      if (parts.size() != 1 || !parts.get(0).equals(t)) {
        for (Transition p : parts)
          step(p);
        return;
      }
      if (t instanceof Shift) {
        if (position == n)
          throw new IllegalTransitionException(t, toString());
        stack[stackSize++] = ++position;
      } else if (t instanceof LeftArc) {
        if (stackSize < 2)
          throw new IllegalTransitionException(t, toString());
        int s0 = stack[stackSize - 1];
        int s1 = stack[stackSize - 2];
        if (s1 != Token.ROOT_ID)
          heads[s1] = s0;
        stack[stackSize - 2] = s0;
        stackSize--;
      } else if (t instanceof RightArc) {
        if (stackSize < 2)
          throw new IllegalTransitionException(t, toString());
        heads[stack[stackSize - 1]] = stack[stackSize - 2];
        stackSize--;
      } else {
        throw new IllegalTransitionException(t, toString());
      }
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("(Replay stack=[");
      for (int i = 0; i < stackSize; i++)
        sb.append(i == 0 ? "" : ", ").append(stack[i]);
      sb.append("] buffer=[");
      for (int i = position + 1; i <= n; i++)
        sb.append(i == position + 1 ? "" : ", ").append(i);
      return sb.append("])").toString();
    }
  }
}
