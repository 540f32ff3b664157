package edu.jhu.hlt.depparse.datatypes;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sentence of {@link Token}s with dense ids 1..n. ROOT is implicit (id 0)
 * and is not stored in {@link #getTokens()}. Heads may be absent
 * ({@link Token#NO_HEAD}) when the sentence is to be parsed rather than used
 * as a gold tree.
 */
public class DependencySentence implements Serializable {
  private static final long serialVersionUID = -6602283719407452571L;

  private final String id;
  private final List<Token> tokens;

  // Indexed by token id, so heads[0] is ROOT's (absent) head
  private final int[] heads;
  private final transient int[][] dependents;

  public DependencySentence(String id, List<Token> tokens) {
    this.id = id;
    this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    int n = tokens.size();
    this.heads = new int[n + 1];
    this.heads[Token.ROOT_ID] = Token.NO_HEAD;
    for (int i = 0; i < n; i++) {
      Token t = tokens.get(i);
      if (t.id != i + 1) {
        throw new IllegalArgumentException("sentence " + id
            + ": token ids must be dense and 1-based, found " + t.id
            + " at position " + (i + 1));
      }
      if (t.head > n) {
        throw new IllegalArgumentException("sentence " + id
            + ": head of token " + t.id + " is " + t.head + " but there are only "
            + n + " tokens");
      }
      if (t.head == t.id)
        throw new IllegalArgumentException("sentence " + id + ": token " + t.id + " heads itself");
      heads[t.id] = t.head;
    }
    this.dependents = buildDependents(heads);
  }

  /** Rebuilds the dependents index, which is not serialized */
  private Object readResolve() {
    return new DependencySentence(id, tokens);
  }

  private static int[][] buildDependents(int[] heads) {
    int n = heads.length - 1;
    int[] counts = new int[n + 1];
    for (int i = 1; i <= n; i++)
      if (heads[i] != Token.NO_HEAD)
        counts[heads[i]]++;
    int[][] deps = new int[n + 1][];
    for (int i = 0; i <= n; i++)
      deps[i] = new int[counts[i]];
    int[] fill = new int[n + 1];
    for (int i = 1; i <= n; i++) {
      int h = heads[i];
      if (h != Token.NO_HEAD)
        deps[h][fill[h]++] = i;
    }
    return deps;
  }

  /**
   * @param heads one entry per token, heads[i] is the head of token i+1
   * (0 for ROOT, {@link Token#NO_HEAD} for none).
   */
  public static DependencySentence fromHeads(String id, String[] forms, int[] heads) {
    if (forms.length != heads.length)
      throw new IllegalArgumentException("forms.length=" + forms.length + " heads.length=" + heads.length);
    List<Token> tokens = new ArrayList<>(forms.length);
    for (int i = 0; i < forms.length; i++)
      tokens.add(new Token(i + 1, forms[i], heads[i]));
    return new DependencySentence(id, tokens);
  }

  public String getId() {
    return id;
  }

  /** Number of tokens, not counting ROOT */
  public int size() {
    return tokens.size();
  }

  public List<Token> getTokens() {
    return tokens;
  }

  /** Tokens with ROOT prepended, so that the list is indexed by token id */
  public List<Token> getTokensWithRoot() {
    List<Token> all = new ArrayList<>(tokens.size() + 1);
    all.add(Token.ROOT);
    all.addAll(tokens);
    return Collections.unmodifiableList(all);
  }

  public Token getToken(int tokenId) {
    if (tokenId == Token.ROOT_ID)
      return Token.ROOT;
    return tokens.get(tokenId - 1);
  }

  public int getHead(int tokenId) {
    return heads[tokenId];
  }

  public boolean hasAllHeads() {
    for (int i = 1; i < heads.length; i++)
      if (heads[i] == Token.NO_HEAD)
        return false;
    return true;
  }

  /** Ids of the tokens whose head is tokenId, in sentence order */
  public int[] getDependents(int tokenId) {
    return dependents[tokenId];
  }

  /**
   * True if every token has a head, the heads form a tree rooted at ROOT, and
   * no two arcs cross when drawn above the sentence.
   */
  public boolean isProjective() {
    int n = size();
    for (int d = 1; d <= n; d++) {
      int h = heads[d];
      if (h == Token.NO_HEAD)
        return false;
      if (!reachesRoot(d))
        return false;
      int left = Math.min(h, d), right = Math.max(h, d);
      for (int k = left + 1; k < right; k++)
        if (!dominates(h, k))
          return false;
    }
    return true;
  }

  private boolean reachesRoot(int tokenId) {
    int cur = tokenId;
    for (int steps = 0; steps <= size(); steps++) {
      if (cur == Token.ROOT_ID)
        return true;
      cur = heads[cur];
      if (cur == Token.NO_HEAD)
        return false;
    }
    return false;   // cycle
  }

  private boolean dominates(int ancestor, int tokenId) {
    int cur = tokenId;
    for (int steps = 0; steps <= size() && cur != Token.NO_HEAD; steps++) {
      if (cur == ancestor)
        return true;
      if (cur == Token.ROOT_ID)
        return false;
      cur = heads[cur];
    }
    return false;
  }

  /**
   * Mirror image of this sentence: token i becomes token n+1-i and heads are
   * remapped accordingly (ROOT stays ROOT).
   */
  public DependencySentence reverse() {
    int n = size();
    List<Token> rev = new ArrayList<>(n);
    for (int i = n; i >= 1; i--) {
      Token t = tokens.get(i - 1);
      int h = t.head;
      if (h != Token.NO_HEAD && h != Token.ROOT_ID)
        h = n + 1 - h;
      rev.add(t.withId(n + 1 - i, h));
    }
    return new DependencySentence(id, rev);
  }

  /** Same words, all heads removed */
  public DependencySentence withoutHeads() {
    List<Token> stripped = new ArrayList<>(size());
    for (Token t : tokens)
      stripped.add(t.withHead(Token.NO_HEAD));
    return new DependencySentence(id, stripped);
  }

  @Override
  public int hashCode() {
    return tokens.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof DependencySentence) {
      DependencySentence s = (DependencySentence) other;
      return (id == null ? s.id == null : id.equals(s.id)) && tokens.equals(s.tokens);
    }
    return false;
  }

  @Override
  public String toString() {
    return "(DependencySentence " + id + " " + tokens + ")";
  }
}
