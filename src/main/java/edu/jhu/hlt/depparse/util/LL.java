package edu.jhu.hlt.depparse.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Persistent singly linked list. The head is the most recently added item and
 * tails are shared between every list built on top of them, so "copying" a
 * list to branch off a new hypothesis costs nothing.
 *
 * A null LL is the empty list; the static helpers accept null.
 */
public final class LL<T> implements Iterable<T> {

  private final T item;
  private final LL<T> next;
  private final int length;

  public LL(T item, LL<T> next) {
    this.item = item;
    this.next = next;
    this.length = next == null ? 1 : next.length + 1;
  }

  public static <T> LL<T> of(T item) {
    return new LL<>(item, null);
  }

  public T car() {
    return item;
  }

  public LL<T> cdr() {
    return next;
  }

  public int length() {
    return length;
  }

  public static int length(LL<?> l) {
    if (l == null)
      return 0;
    return l.length;
  }

  public static <T> LL<T> prepend(T item, LL<T> l) {
    return new LL<>(item, l);
  }

  public static boolean contains(LL<?> l, Object search) {
    for (LL<?> cur = l; cur != null; cur = cur.next) {
      if (cur.item == null ? search == null : cur.item.equals(search))
        return true;
    }
    return false;
  }

  /** Items from the most recently added to the oldest */
  @Override
  public Iterator<T> iterator() {
    return new Iterator<T>() {
      private LL<T> cur = LL.this;
      @Override
      public boolean hasNext() {
        return cur != null;
      }
      @Override
      public T next() {
        if (cur == null)
          throw new NoSuchElementException();
        T t = cur.item;
        cur = cur.next;
        return t;
      }
    };
  }

  /** Items in the order they were added (oldest first) */
  public static <T> List<T> toList(LL<T> l) {
    List<T> items = new ArrayList<>(length(l));
    for (LL<T> cur = l; cur != null; cur = cur.next)
      items.add(cur.item);
    Collections.reverse(items);
    return items;
  }

  @Override
  public String toString() {
    return item + " -> " + next;
  }
}
