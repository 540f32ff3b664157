package edu.jhu.hlt.depparse.transition;

/**
 * A transition tag which is not one of the wire names "Shift", "LeftArc" or
 * "RightArc".
 */
public class InvalidActionException extends IllegalArgumentException {
  private static final long serialVersionUID = 3870117525394640029L;

  private final String tag;

  public InvalidActionException(String tag) {
    super("Invalid action: " + tag);
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }
}
