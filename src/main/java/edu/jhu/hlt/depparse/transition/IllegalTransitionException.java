package edu.jhu.hlt.depparse.transition;

/**
 * Thrown when a {@link Transition} is applied to a {@link Configuration} in
 * which it is not legal. Correct oracle and decoding code never does this.
 */
public class IllegalTransitionException extends IllegalStateException {
  private static final long serialVersionUID = 5024381180622473117L;

  private final Transition transition;

  public IllegalTransitionException(Transition transition, Configuration state) {
    this(transition, String.valueOf(state));
  }

  /** @param state description of where the transition was attempted */
  public IllegalTransitionException(Transition transition, String state) {
    super(transition + " is not legal in " + state);
    this.transition = transition;
  }

  public Transition getTransition() {
    return transition;
  }
}
