package edu.jhu.hlt.depparse.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableSortedSet;

import edu.jhu.hlt.depparse.datatypes.DependencySentence;
import edu.jhu.hlt.depparse.transition.InvalidActionException;
import edu.jhu.hlt.depparse.transition.NonProjectiveTreeException;
import edu.jhu.hlt.depparse.transition.Oracle;
import edu.jhu.hlt.depparse.transition.Reconstruction;
import edu.jhu.hlt.depparse.transition.Transition;
import edu.jhu.hlt.depparse.transition.TransitionScheme;
import edu.jhu.hlt.depparse.transition.TransitionVocabulary;
import edu.jhu.hlt.depparse.util.ExperimentProperties;

/**
 * Turns treebanks into transition sequences and back. This is where
 * per-sentence failures stop: a non-projective tree or a bad decoded sequence
 * is logged and skipped rather than aborting the whole treebank.
 */
public class TreebankConverter {
  public static final Logger LOG = Logger.getLogger(TreebankConverter.class);

  /** Sequences built from one treebank */
  public static final class Conversion {
    public final List<DependencySentence> sentences;
    public final List<List<Transition>> sequences;
    public final ImmutableSortedSet<Transition> transitions;
    public final List<String> skipped;

    public Conversion(List<DependencySentence> sentences, List<List<Transition>> sequences,
        ImmutableSortedSet<Transition> transitions, List<String> skipped) {
      assert sentences.size() == sequences.size();
      this.sentences = Collections.unmodifiableList(sentences);
      this.sequences = Collections.unmodifiableList(sequences);
      this.transitions = transitions;
      this.skipped = Collections.unmodifiableList(skipped);
    }

    public int size() {
      return sequences.size();
    }
  }

  private final TransitionScheme scheme;
  private final boolean reverse;
  private final boolean skipNonProjective;

  public TreebankConverter(TransitionScheme scheme, boolean reverse, boolean skipNonProjective) {
    if (!scheme.isDependencyScheme())
      throw new UnsupportedOperationException("can only build dependency sequences, not " + scheme);
    this.scheme = scheme;
    this.reverse = reverse;
    this.skipNonProjective = skipNonProjective;
  }

  public TreebankConverter(ExperimentProperties config) {
    this(TransitionScheme.fromShortName(config.getString("transitionScheme", TransitionScheme.ARC_STANDARD.getShortName())),
        config.getBoolean("reverse", false),
        config.getBoolean("skipNonProjective", true));
  }

  public TreebankConverter() {
    this(TransitionScheme.ARC_STANDARD, false, true);
  }

  public TransitionScheme getScheme() {
    return scheme;
  }

  /**
   * Turn a single tree into a list of transitions based on the scheme.
   *
   * @throws NonProjectiveTreeException regardless of skipNonProjective
   */
  public List<Transition> buildSequence(DependencySentence tree) {
    switch (scheme) {
      case ARC_STANDARD:
        return Oracle.buildSequence(tree);
      default:
        throw new UnsupportedOperationException("scheme " + scheme);
    }
  }

  /**
   * Turn each of the trees into a list of transitions, reversing them first if
   * configured to. Trees the oracle cannot handle are skipped and their ids
   * are added to skipped.
   *
   * @param kept receives the (possibly reversed) trees which were converted,
   * parallel to the returned sequences
   */
  public List<List<Transition>> buildTreebank(List<DependencySentence> trees,
      List<DependencySentence> kept, List<String> skipped) {
    List<List<Transition>> sequences = new ArrayList<>(trees.size());
    for (DependencySentence tree : trees) {
      DependencySentence t = reverse ? tree.reverse() : tree;
      try {
        sequences.add(buildSequence(t));
        kept.add(t);
      } catch (NonProjectiveTreeException e) {
        if (!skipNonProjective)
          throw e;
        LOG.warn("skipping sentence " + tree.getId() + ": " + e.getMessage());
        skipped.add(tree.getId());
      }
    }
    return sequences;
  }

  /**
   * Converts trees to a list of sequences, then collects the list of known
   * transitions.
   */
  public Conversion convertTreesToSequences(List<DependencySentence> trees, String treebankName) {
    if (trees.isEmpty()) {
      return new Conversion(Collections.<DependencySentence>emptyList(),
          Collections.<List<Transition>>emptyList(),
          ImmutableSortedSet.<Transition>of(),
          Collections.<String>emptyList());
    }
    LOG.info("Building " + treebankName + " transition sequences");
    List<DependencySentence> kept = new ArrayList<>(trees.size());
    List<String> skipped = new ArrayList<>();
    List<List<Transition>> sequences = buildTreebank(trees, kept, skipped);
    ImmutableSortedSet<Transition> transitions = TransitionVocabulary.allTransitions(sequences);
    LOG.info("Built " + sequences.size() + " " + treebankName + " sequences, skipped "
        + skipped.size() + ", " + transitions.size() + " distinct transitions");
    return new Conversion(kept, sequences, transitions, skipped);
  }

  /**
   * Converts dev/test data and checks it against the training vocabulary.
   *
   * @throws edu.jhu.hlt.depparse.transition.UnknownTransitionVocabularyException
   * if the other treebank needs a transition train cannot provide
   */
  public Conversion convertAndCheck(Conversion train, List<DependencySentence> trees, String treebankName) {
    Conversion other = convertTreesToSequences(trees, treebankName);
    TransitionVocabulary.checkTransitions(train.transitions, other.transitions, treebankName);
    return other;
  }

  /**
   * Rebuilds trees from decoded tag sequences, one per sentence. A sequence
   * with a tag that is not a transition is logged and its sentence left out
   * of the result; skipped receives its id.
   *
   * @param sentences in the orientation the sequences were built in (see
   * {@link Conversion#sentences}); when reversing, the output is flipped back
   * to the original word order.
   */
  public List<DependencySentence> reconstructAll(List<DependencySentence> sentences,
      List<List<String>> tagSequences, List<String> skipped) {
    if (sentences.size() != tagSequences.size()) {
      throw new IllegalArgumentException(sentences.size() + " sentences but "
          + tagSequences.size() + " tag sequences");
    }
    List<DependencySentence> out = new ArrayList<>(sentences.size());
    for (int i = 0; i < sentences.size(); i++) {
      DependencySentence s = sentences.get(i);
      try {
        DependencySentence r = Reconstruction.reconstruct(s, tagSequences.get(i));
        out.add(reverse ? r.reverse() : r);
      } catch (InvalidActionException e) {
        LOG.warn("could not reconstruct sentence " + s.getId() + ": " + e.getMessage());
        skipped.add(s.getId());
      }
    }
    return out;
  }
}
