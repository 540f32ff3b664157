package edu.jhu.hlt.depparse.datatypes;

import java.io.Serializable;

/**
 * A word in a sentence with (optionally) the id of its head. Ids are 1-based
 * within a sentence; id 0 is reserved for the synthetic ROOT.
 */
public final class Token implements Serializable {
  private static final long serialVersionUID = 2719461853395128802L;

  public static final int ROOT_ID = 0;
  public static final int NO_HEAD = -1;
  public static final String ROOT_FORM = "ROOT";

  public static final Token ROOT = new Token(ROOT_ID, ROOT_FORM, NO_HEAD);

  public final int id;
  public final String form;
  public final int head;

  public Token(int id, String form, int head) {
    if (id < 0)
      throw new IllegalArgumentException("id=" + id);
    if (form == null)
      throw new IllegalArgumentException("form may not be null");
    if (head < NO_HEAD)
      throw new IllegalArgumentException("head=" + head);
    if (id == ROOT_ID && head != NO_HEAD)
      throw new IllegalArgumentException("ROOT cannot have a head");
    this.id = id;
    this.form = form;
    this.head = head;
  }

  public Token(int id, String form) {
    this(id, form, NO_HEAD);
  }

  public boolean isRoot() {
    return id == ROOT_ID;
  }

  public boolean hasHead() {
    return head != NO_HEAD;
  }

  public Token withHead(int head) {
    return new Token(id, form, head);
  }

  public Token withId(int id, int head) {
    return new Token(id, form, head);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * id + head) + form.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Token) {
      Token t = (Token) other;
      return id == t.id && head == t.head && form.equals(t.form);
    }
    return false;
  }

  @Override
  public String toString() {
    return id + ":" + form + (hasHead() ? "<-" + head : "");
  }
}
