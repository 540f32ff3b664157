package edu.jhu.hlt.depparse.transition;

/**
 * Moves the front of the buffer onto the top of the stack.
 */
public class Shift extends Transition {
  private static final long serialVersionUID = 1181650349178331467L;

  /** Disallow shifting when the buffer is empty */
  @Override
  public boolean isLegal(Configuration state) {
    return !state.isBufferEmpty();
  }

  @Override
  public Configuration updateState(Configuration state) {
    if (!isLegal(state))
      throw new IllegalTransitionException(this, state);
    return state.shift(this);
  }

  @Override
  public String shortName() {
    return "Shift";
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Shift;
  }

  @Override
  public int hashCode() {
    return 37;
  }
}
