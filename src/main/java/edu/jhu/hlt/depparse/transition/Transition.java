package edu.jhu.hlt.depparse.transition;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableMap;

/**
 * A parser action which turns one {@link Configuration} into the next.
 *
 * Transitions carry no state, so equality is by type. They sort with
 * {@link Shift} first and everything else alphabetically by name, which makes
 * transition vocabularies come out in the same order on every run.
 *
 * The model is passed in as a dependency injection: applying a transition
 * goes through {@link TransitionModel#bulkApply(List, List)} so that, for
 * example, a neural model can update its hidden state for many configurations
 * at once.
 */
public abstract class Transition implements Comparable<Transition>, Serializable {
  private static final long serialVersionUID = -8462113380913349785L;

  public static final Transition SHIFT = new Shift();
  public static final Transition LEFT_ARC = new LeftArc();
  public static final Transition RIGHT_ARC = new RightArc();

  /** Wire names of the atomic transitions */
  private static final ImmutableMap<String, Transition> BY_NAME = ImmutableMap.of(
      SHIFT.shortName(), SHIFT,
      LEFT_ARC.shortName(), LEFT_ARC,
      RIGHT_ARC.shortName(), RIGHT_ARC);

  /**
   * Whether this transition may be applied to the given state. Has no side
   * effects.
   */
  public abstract boolean isLegal(Configuration state);

  /**
   * The state resulting from this transition, computed without a model.
   * Models delegate to this for the structural part of an update.
   *
   * @throws IllegalTransitionException if the transition is not legal in state
   */
  public abstract Configuration updateState(Configuration state);

  /** A short name to identify this transition, also used as its wire format */
  public abstract String shortName();

  /**
   * Return a new state transformed via this transition. This is a
   * convenience method for {@link TransitionModel#bulkApply(List, List)}
   * with one state.
   *
   * @throws IllegalTransitionException if the transition is not legal in state,
   * in which case the model is never called
   */
  public Configuration apply(Configuration state, TransitionModel model) {
    if (!isLegal(state))
      throw new IllegalTransitionException(this, state);
    return model.apply(state, this);
  }

  /**
   * The transitions which could make up this one. An atomic transition is
   * its own only component.
   */
  public List<Transition> components() {
    return Collections.singletonList(this);
  }

  /** Name plus any label, atomic transitions have no label */
  public String shortLabel() {
    return shortName();
  }

  /**
   * Parses a wire name without any reflection.
   *
   * @throws InvalidActionException if desc is not a known transition
   */
  public static Transition fromRepr(String desc) {
    Transition t = desc == null ? null : BY_NAME.get(desc);
    if (t == null)
      throw new InvalidActionException(desc);
    return t;
  }

  @Override
  public int compareTo(Transition other) {
    if (equals(other))
      return 0;
    if (this instanceof Shift)
      return -1;
    if (other instanceof Shift)
      return 1;
    return toString().compareTo(other.toString());
  }

  @Override
  public String toString() {
    return shortLabel();
  }
}
