package edu.jhu.hlt.depparse.transition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Whatever scores and selects transitions at decode time (e.g. a neural
 * network). The transition system only talks to it through this interface:
 * every state update goes through {@link #bulkApply(List, List)}, which lets
 * an implementation batch its own bookkeeping (hidden states, scores) across
 * many configurations.
 *
 * Implementations must honor the structural effects of
 * {@link Transition#updateState(Configuration)} for every element.
 */
public interface TransitionModel {

  /**
   * Applies transitions.get(i) to states.get(i) for every i and returns the
   * resulting states in the same order.
   */
  public List<Configuration> bulkApply(List<Configuration> states, List<Transition> transitions);

  default public Configuration apply(Configuration state, Transition transition) {
    List<Configuration> next = bulkApply(
        Collections.singletonList(state), Collections.singletonList(transition));
    return next.get(0);
  }

  /** No model: states are updated structurally and nothing else is recorded */
  public static final TransitionModel NONE = new Structural();

  public static class Structural implements TransitionModel {
    @Override
    public List<Configuration> bulkApply(List<Configuration> states, List<Transition> transitions) {
      if (states.size() != transitions.size()) {
        throw new IllegalArgumentException("got " + states.size()
            + " states but " + transitions.size() + " transitions");
      }
      List<Configuration> next = new ArrayList<>(states.size());
      for (int i = 0; i < states.size(); i++)
        next.add(transitions.get(i).updateState(states.get(i)));
      return next;
    }

    @Override
    public String toString() {
      return "TransitionModel.NONE";
    }
  }
}
