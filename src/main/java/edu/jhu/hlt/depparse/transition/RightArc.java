package edu.jhu.hlt.depparse.transition;

import edu.jhu.hlt.depparse.datatypes.Arc;
import edu.jhu.hlt.depparse.util.LL;

/**
 * The word below the top of the stack takes the top as a dependent: adds the
 * arc (s1, s0) and pops s0.
 */
public class RightArc extends Transition {
  private static final long serialVersionUID = 6236030318453715994L;

  @Override
  public boolean isLegal(Configuration state) {
    return state.stackSize() >= 2;
  }

  @Override
  public Configuration updateState(Configuration state) {
    if (!isLegal(state))
      throw new IllegalTransitionException(this, state);
    LL<Integer> s = state.stackCells();
    int s0 = s.car();
    int s1 = s.cdr().car();
    return state.reduce(this, new Arc(s1, s0), s.cdr());
  }

  @Override
  public String shortName() {
    return "RightArc";
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof RightArc;
  }

  @Override
  public int hashCode() {
    return 71;
  }
}
