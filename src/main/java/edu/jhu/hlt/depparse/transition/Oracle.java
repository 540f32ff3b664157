package edu.jhu.hlt.depparse.transition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import edu.jhu.hlt.depparse.datatypes.DependencySentence;
import edu.jhu.hlt.depparse.datatypes.Token;
import edu.jhu.hlt.depparse.util.Describe;

/**
 * Static arc-standard oracle: converts a projective gold tree into the unique
 * sequence of transitions which rebuilds it.
 *
 * At every step the first applicable of LeftArc, RightArc, Shift is taken. An
 * arc is only built once the dependent has collected all of its own gold
 * dependents, so every subtree is closed before it is attached. For a
 * projective tree exactly one transition qualifies at each step; if none
 * does, the tree is non-projective (or not a tree) and the oracle fails.
 *
 * The oracle never consults a scoring model.
 */
public class Oracle {
  public static final Logger LOG = Logger.getLogger(Oracle.class);

  /** One oracle step along with what the parser looked like before it */
  public static final class Step {
    public final List<Integer> buffer;
    public final List<Integer> stack;
    public final Transition transition;

    public Step(List<Integer> buffer, List<Integer> stack, Transition transition) {
      this.buffer = Collections.unmodifiableList(buffer);
      this.stack = Collections.unmodifiableList(stack);
      this.transition = transition;
    }

    @Override
    public String toString() {
      return "[" + buffer + ", " + stack + ", " + transition + "]";
    }
  }

  /**
   * @throws NonProjectiveTreeException if the gold heads are not a projective
   * tree
   */
  public static List<Transition> buildSequence(DependencySentence goldTree) {
    List<Transition> seq = new ArrayList<>(2 * goldTree.size());
    Configuration c = run(goldTree, null);
    seq.addAll(c.getTransitions());
    return seq;
  }

  /**
   * Like {@link #buildSequence(DependencySentence)} but keeps a snapshot of the
   * buffer and stack before every transition.
   */
  public static List<Step> buildSteps(DependencySentence goldTree) {
    List<Step> steps = new ArrayList<>(2 * goldTree.size());
    run(goldTree, steps);
    return steps;
  }

  /**
   * A start state carrying the gold tree and its oracle sequence, for
   * training.
   */
  public static Configuration initialTrainingState(DependencySentence goldTree) {
    List<Transition> seq = buildSequence(goldTree);
    return Configuration.initialState(goldTree, new Configuration.Gold(goldTree, seq));
  }

  private static Configuration run(DependencySentence goldTree, List<Step> steps) {
    Configuration c = Configuration.initialState(goldTree, new Configuration.Gold(goldTree));
    boolean debug = LOG.isDebugEnabled();
    while (!c.isTerminal()) {
      Transition t = next(c);
      if (steps != null)
        steps.add(new Step(c.getBuffer(), c.getStack(), t));
      if (debug)
        LOG.debug("[oracle] " + goldTree.getId() + " " + t + " " + Describe.stackAndBuffer(c));
      c = t.apply(c, TransitionModel.NONE);
    }
    assert c.numTransitions() == 2 * goldTree.size();
    return c;
  }

  /**
   * The transition the oracle takes in state c, which must carry a gold tree.
   *
   * @throws NonProjectiveTreeException if no transition leads to the gold tree
   */
  public static Transition next(Configuration c) {
    if (!c.hasGold())
      throw new IllegalArgumentException("the oracle needs a gold tree: " + c);
    if (canLeftArc(c))
      return Transition.LEFT_ARC;
    if (canRightArc(c))
      return Transition.RIGHT_ARC;
    if (Transition.SHIFT.isLegal(c))
      return Transition.SHIFT;
    throw new NonProjectiveTreeException(c.getSentenceId(), c);
  }

  static boolean canLeftArc(Configuration c) {
    if (!Transition.LEFT_ARC.isLegal(c))
      return false;
    int s0 = c.top(0), s1 = c.top(1);
    return c.getGold().getHead(s1) == s0 && hasAllDependents(c, s1);
  }

  static boolean canRightArc(Configuration c) {
    if (!Transition.RIGHT_ARC.isLegal(c))
      return false;
    int s0 = c.top(0), s1 = c.top(1);
    return c.getGold().getHead(s0) == s1 && hasAllDependents(c, s0);
  }

  /** True if every gold dependent of tokenId is already attached */
  static boolean hasAllDependents(Configuration c, int tokenId) {
    assert tokenId != Token.ROOT_ID;
    for (int d : c.getGold().getDependents(tokenId))
      if (!c.isDone(d))
        return false;
    return true;
  }
}
