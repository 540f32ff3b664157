package edu.jhu.hlt.depparse.transition;

/**
 * A treebank uses a transition which cannot be built out of transitions seen
 * in the training data. A model trained on that data cannot parse it.
 */
public class UnknownTransitionVocabularyException extends RuntimeException {
  private static final long serialVersionUID = -1439003478290718523L;

  private final Transition transition;
  private final String treebankName;

  public UnknownTransitionVocabularyException(Transition transition, String treebankName) {
    super("Found transition " + transition + " in the " + treebankName
        + " set which doesn't exist in the train set");
    this.transition = transition;
    this.treebankName = treebankName;
  }

  public Transition getTransition() {
    return transition;
  }

  public String getTreebankName() {
    return treebankName;
  }
}
