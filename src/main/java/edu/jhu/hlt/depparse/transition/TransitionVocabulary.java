package edu.jhu.hlt.depparse.transition;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableSortedSet;

/**
 * The set of transitions a model knows about, and checks that another
 * dataset does not need anything the training data never showed it.
 */
public class TransitionVocabulary {
  public static final Logger LOG = Logger.getLogger(TransitionVocabulary.class);

  /**
   * Unique transitions across all of the sequences, Shift first and the rest
   * by name.
   */
  public static ImmutableSortedSet<Transition> allTransitions(Iterable<? extends List<Transition>> sequences) {
    ImmutableSortedSet.Builder<Transition> b = ImmutableSortedSet.naturalOrder();
    for (List<Transition> seq : sequences)
      b.addAll(seq);
    return b.build();
  }

  /**
   * Check that all the transitions in the other dataset are known in the train
   * set.
   *
   * A transition missing from train is accepted, with a warning, as long as
   * every one of its components is known: the model can't have learned the
   * combination, but it can at least represent it.
   *
   * @return the transitions which were accepted with a warning
   * @throws UnknownTransitionVocabularyException if a transition has a
   * component which never appears in train
   */
  public static ImmutableSortedSet<Transition> checkTransitions(
      Collection<Transition> trainTransitions,
      Collection<Transition> otherTransitions,
      String treebankName) {
    Set<Transition> train = trainTransitions instanceof Set
        ? (Set<Transition>) trainTransitions
        : ImmutableSortedSet.copyOf(trainTransitions);
    ImmutableSortedSet.Builder<Transition> unknown = ImmutableSortedSet.naturalOrder();
    for (Transition t : otherTransitions) {
      if (train.contains(t))
        continue;
      for (Transition component : t.components()) {
        if (!train.contains(component))
          throw new UnknownTransitionVocabularyException(t, treebankName);
      }
      unknown.add(t);
    }
    ImmutableSortedSet<Transition> u = unknown.build();
    if (!u.isEmpty()) {
      LOG.warn("Found transitions where the components are all valid, but the"
          + " complete transition is unknown in the " + treebankName + " set: " + u);
    }
    return u;
  }
}
