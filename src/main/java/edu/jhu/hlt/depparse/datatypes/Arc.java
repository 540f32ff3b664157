package edu.jhu.hlt.depparse.datatypes;

import java.io.Serializable;

/**
 * A directed (head, dependent) relation between two token ids.
 */
public final class Arc implements Serializable {
  private static final long serialVersionUID = -2113580921553012440L;

  public final int head;
  public final int dependent;

  public Arc(int head, int dependent) {
    if (head < 0 || dependent < 0)
      throw new IllegalArgumentException("head=" + head + " dependent=" + dependent);
    if (dependent == Token.ROOT_ID)
      throw new IllegalArgumentException("ROOT may not be a dependent");
    if (head == dependent)
      throw new IllegalArgumentException("self loop on " + head);
    this.head = head;
    this.dependent = dependent;
  }

  @Override
  public int hashCode() {
    return 9001 * head + dependent;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Arc) {
      Arc a = (Arc) other;
      return head == a.head && dependent == a.dependent;
    }
    return false;
  }

  @Override
  public String toString() {
    return "(" + head + " -> " + dependent + ")";
  }
}
