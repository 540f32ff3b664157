package edu.jhu.hlt.depparse.transition;

import edu.jhu.hlt.depparse.datatypes.Arc;
import edu.jhu.hlt.depparse.datatypes.Token;
import edu.jhu.hlt.depparse.util.LL;

/**
 * The top of the stack takes the word below it as a dependent: adds the arc
 * (s0, s1) and removes s1 from the stack.
 */
public class LeftArc extends Transition {
  private static final long serialVersionUID = -3958824718129012877L;

  /**
   * Needs two words on the stack, and the lower one may not be ROOT since
   * ROOT never has a head.
   */
  @Override
  public boolean isLegal(Configuration state) {
    return state.stackSize() >= 2 && state.top(1) != Token.ROOT_ID;
  }

  @Override
  public Configuration updateState(Configuration state) {
    if (!isLegal(state))
      throw new IllegalTransitionException(this, state);
    LL<Integer> s = state.stackCells();
    int s0 = s.car();
    int s1 = s.cdr().car();
    LL<Integer> rest = s.cdr().cdr();
    return state.reduce(this, new Arc(s0, s1), LL.prepend(s0, rest));
  }

  @Override
  public String shortName() {
    return "LeftArc";
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof LeftArc;
  }

  @Override
  public int hashCode() {
    return 17;
  }
}
