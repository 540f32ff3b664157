package edu.jhu.hlt.depparse.transition;

/**
 * How transitions are grouped. The constituency schemes are listed so that
 * treebank configurations naming them can be read, but only
 * {@link #ARC_STANDARD} builds sequences here.
 */
public enum TransitionScheme {

  // top down, so the open transition comes before any constituents
  TOP_DOWN("top"),
  // unary transitions are modeled as one entire transition
  TOP_DOWN_COMPOUND("topc"),
  // unary is a separate transition
  TOP_DOWN_UNARY("topu"),

  // open transition comes after the first constituent it cares about
  IN_ORDER("in"),
  // unaries after preterminals are a single transition after the preterminal
  IN_ORDER_COMPOUND("inc"),
  // CompoundUnary on both preterminals and internal nodes
  IN_ORDER_UNARY("inu"),

  // Shift, LeftArc, RightArc over the two topmost stack elements
  ARC_STANDARD("arcstd");

  private final String shortName;

  TransitionScheme(String shortName) {
    this.shortName = shortName;
  }

  public String getShortName() {
    return shortName;
  }

  public boolean isDependencyScheme() {
    return this == ARC_STANDARD;
  }

  /** Accepts either the short name ("arcstd") or the enum name ("ARC_STANDARD") */
  public static TransitionScheme fromShortName(String name) {
    for (TransitionScheme ts : values())
      if (ts.shortName.equals(name) || ts.name().equals(name))
        return ts;
    throw new IllegalArgumentException("unknown transition scheme: " + name);
  }
}
