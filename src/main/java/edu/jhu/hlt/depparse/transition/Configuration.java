package edu.jhu.hlt.depparse.transition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import edu.jhu.hlt.depparse.datatypes.Arc;
import edu.jhu.hlt.depparse.datatypes.DependencySentence;
import edu.jhu.hlt.depparse.datatypes.Token;
import edu.jhu.hlt.depparse.util.LL;

/**
 * Represents a partially completed arc-standard parse of one sentence.
 *
 * Configurations are values: a {@link Transition} never changes the
 * configuration it is applied to, it builds a new one. The stack, arcs, done
 * set, and transition history are persistent lists, so a new configuration
 * shares everything but one cell with its predecessor and any number of
 * hypotheses can branch off a common prefix.
 *
 * The buffer is not stored explicitly: it is the suffix of the sentence after
 * {@link #getPosition()} tokens have been consumed.
 */
public final class Configuration {

  /**
   * Gold information, only available when building an oracle sequence or
   * training. Never present at decode time.
   */
  public static final class Gold {
    private final DependencySentence tree;
    private final List<Transition> sequence;   // may be null

    public Gold(DependencySentence tree, List<Transition> sequence) {
      if (tree == null)
        throw new IllegalArgumentException("gold tree may not be null");
      this.tree = tree;
      this.sequence = sequence == null
          ? null : Collections.unmodifiableList(new ArrayList<>(sequence));
    }

    public Gold(DependencySentence tree) {
      this(tree, null);
    }

    public DependencySentence getTree() {
      return tree;
    }

    public int getHead(int tokenId) {
      return tree.getHead(tokenId);
    }

    public int[] getDependents(int tokenId) {
      return tree.getDependents(tokenId);
    }

    public boolean hasSequence() {
      return sequence != null;
    }

    public List<Transition> getSequence() {
      return sequence;
    }
  }

  private final String sentenceId;
  private final List<Token> words;      // index = token id, ROOT at 0, never modified
  private final int position;           // number of tokens shifted so far
  private final LL<Integer> stack;      // car is the top of the stack, ROOT at the bottom
  private final LL<Arc> arcs;
  private final LL<Integer> done;
  private final LL<Transition> transitions;
  private final Gold gold;
  private final double score;

  Configuration(String sentenceId, List<Token> words, int position,
      LL<Integer> stack, LL<Arc> arcs, LL<Integer> done,
      LL<Transition> transitions, Gold gold, double score) {
    assert stack != null;
    assert position >= 0 && position < words.size();
    this.sentenceId = sentenceId;
    this.words = words;
    this.position = position;
    this.stack = stack;
    this.arcs = arcs;
    this.done = done;
    this.transitions = transitions;
    this.gold = gold;
    this.score = score;
  }

  /** Start state for decoding: everything in the buffer, ROOT on the stack */
  public static Configuration initialState(DependencySentence sentence) {
    return initialState(sentence, null);
  }

  public static Configuration initialState(DependencySentence sentence, Gold gold) {
    if (gold != null && gold.getTree().size() != sentence.size()) {
      throw new IllegalArgumentException("gold tree has " + gold.getTree().size()
          + " tokens but the sentence has " + sentence.size());
    }
    return new Configuration(
        sentence.getId(),
        sentence.getTokensWithRoot(),
        0,
        LL.of(Token.ROOT_ID),
        null,
        null,
        null,
        gold,
        0);
  }

  /* TRANSFORMATIONS (used by the transitions in this package) ****************/

  Configuration shift(Transition t) {
    int next = position + 1;
    return new Configuration(sentenceId, words, next,
        LL.prepend(next, stack), arcs, done, LL.prepend(t, transitions), gold, score);
  }

  /** ROOT stays at the bottom since it is never a dependent */
  Configuration reduce(Transition t, Arc arc, LL<Integer> newStack) {
    assert newStack != null && newStack.length() == stack.length() - 1;
    return new Configuration(sentenceId, words, position,
        newStack, LL.prepend(arc, arcs), LL.prepend(arc.dependent, done),
        LL.prepend(t, transitions), gold, score);
  }

  LL<Integer> stackCells() {
    return stack;
  }

  /**
   * Lets a scoring model record the score of the hypothesis this configuration
   * represents.
   */
  public Configuration withScore(double score) {
    return new Configuration(sentenceId, words, position,
        stack, arcs, done, transitions, gold, score);
  }

  /* QUERIES ******************************************************************/

  public String getSentenceId() {
    return sentenceId;
  }

  /** Number of tokens in the sentence, not counting ROOT */
  public int sentenceLength() {
    return words.size() - 1;
  }

  public Token getWord(int tokenId) {
    return words.get(tokenId);
  }

  public int getPosition() {
    return position;
  }

  public boolean isBufferEmpty() {
    return position == sentenceLength();
  }

  public int bufferSize() {
    return sentenceLength() - position;
  }

  /** Id of the next token to be shifted */
  public int peekBuffer() {
    if (isBufferEmpty())
      throw new IllegalStateException("buffer is empty");
    return position + 1;
  }

  public int stackSize() {
    return stack.length();
  }

  /**
   * Token id of the k-th element from the top of the stack without removing
   * it, so top(0) is the top and top(stackSize()-1) is ROOT.
   */
  public int top(int k) {
    if (k < 0 || k >= stackSize())
      throw new IndexOutOfBoundsException("k=" + k + " stackSize=" + stackSize());
    LL<Integer> cur = stack;
    for (int i = 0; i < k; i++)
      cur = cur.cdr();
    return cur.car();
  }

  /** True when the buffer is empty and only ROOT is left on the stack */
  public boolean isTerminal() {
    return isBufferEmpty() && stackSize() == 1;
  }

  public boolean isDone(int tokenId) {
    return LL.contains(done, tokenId);
  }

  public int numArcs() {
    return LL.length(arcs);
  }

  public int numTransitions() {
    return LL.length(transitions);
  }

  public boolean hasGold() {
    return gold != null;
  }

  /** May be null */
  public Gold getGold() {
    return gold;
  }

  public double getScore() {
    return score;
  }

  /** Stack from the bottom (ROOT) to the top */
  public List<Integer> getStack() {
    return LL.toList(stack);
  }

  /** Token ids remaining in the buffer, front first */
  public List<Integer> getBuffer() {
    List<Integer> buf = new ArrayList<>(bufferSize());
    for (int i = position + 1; i <= sentenceLength(); i++)
      buf.add(i);
    return buf;
  }

  /** Arcs in the order they were created */
  public List<Arc> getArcs() {
    return LL.toList(arcs);
  }

  /** Transitions in the order they were applied */
  public List<Transition> getTransitions() {
    return LL.toList(transitions);
  }

  /**
   * Heads implied by the arcs built so far, indexed by token id. Tokens which
   * have not been attached have {@link Token#NO_HEAD}.
   */
  public int[] heads() {
    int[] heads = new int[words.size()];
    Arrays.fill(heads, Token.NO_HEAD);
    for (Arc a : arcs == null ? Collections.<Arc>emptyList() : arcs)
      heads[a.dependent] = a.head;
    return heads;
  }

  @Override
  public String toString() {
    return "(Configuration " + sentenceId
        + " stack=" + getStack()
        + " buffer=" + getBuffer()
        + " arcs=" + getArcs()
        + " transitions=" + getTransitions()
        + ")";
  }
}
