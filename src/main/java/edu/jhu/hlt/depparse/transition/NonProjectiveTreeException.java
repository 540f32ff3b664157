package edu.jhu.hlt.depparse.transition;

/**
 * The oracle got stuck: no transition reproduces the gold tree from the
 * current configuration, which happens for crossing arcs or for heads that do
 * not form a tree.
 */
public class NonProjectiveTreeException extends RuntimeException {
  private static final long serialVersionUID = -771408470358263961L;

  private final String sentenceId;

  public NonProjectiveTreeException(String sentenceId, Configuration stuck) {
    super("sentence " + sentenceId + " is non-projective or not a tree, stuck at " + stuck);
    this.sentenceId = sentenceId;
  }

  public String getSentenceId() {
    return sentenceId;
  }
}
