package com.github.reachability;

/**
 * Unified single exception that's thrown by net construction and every analysis in this library.
 * The code enum classifies the failure: structural problems with the net, state-space ceilings
 * that were hit, or plain usage errors. Absence results (no deadlock, nothing to optimize) are
 * never reported through this exception.
 */
public final class ReachabilityException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public ReachabilityException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public ReachabilityException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public ReachabilityException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public ReachabilityException(final Code code, final String message,
      final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  /**
   * True for failures caused by an exploration ceiling. Callers may retry these with a higher
   * ceiling; the library itself never does.
   */
  public boolean isLimitExceeded() {
    return code == Code.STATE_LIMIT_EXCEEDED || code == Code.ITERATION_LIMIT_EXCEEDED
        || code == Code.NODE_LIMIT_EXCEEDED;
  }

  /**
   * True for failures raised while the net was being put together.
   */
  public boolean isStructural() {
    return code == Code.INVALID_PLACE || code == Code.INVALID_TRANSITION
        || code == Code.DUPLICATE_NODE || code == Code.UNKNOWN_NODE || code == Code.ILLEGAL_ARC
        || code == Code.NET_ALREADY_FINALIZED;
  }

  public static enum Code {
    // 1.
    INVALID_PLACE("Place id cannot be blank and its initial token count must be 0 or 1"),
    // 2.
    INVALID_TRANSITION("Transition id cannot be blank"),
    // 3.
    DUPLICATE_NODE("Node id is already registered in this net"),
    // 4.
    UNKNOWN_NODE("Arc references a node that was never added to the net"),
    // 5.
    ILLEGAL_ARC(
        "Arcs must connect a place to a transition or a transition to a place, with weight >= 1"),
    // 6.
    NET_ALREADY_FINALIZED("Net is finalized and cannot be modified any further"),
    // 7.
    NET_NOT_FINALIZED("Net must be finalized before markings can be queried"),
    // 8.
    UNKNOWN_TRANSITION("Net failed to lookup transition with provided id"),
    // 9.
    TRANSITION_NOT_ENABLED("Attempted to fire a transition that is not enabled in the marking"),
    // 10.
    INVALID_MARKING("Marking length does not match the number of places of the net"),
    // 11.
    UNSAFE_NET("Firing would put a second token on a place, the net is not 1-safe"),
    // 12.
    STATE_LIMIT_EXCEEDED("Explicit exploration exceeded its state ceiling, net may be unbounded"),
    // 13.
    ITERATION_LIMIT_EXCEEDED(
        "Symbolic fixed point did not converge within its iteration ceiling, net may be unbounded"),
    // 14.
    NODE_LIMIT_EXCEEDED("Decision diagram grew beyond its node ceiling"),
    // 15.
    MANAGER_MISMATCH("Decision diagrams from different managers cannot be combined"),
    // 16.
    INVALID_WEIGHTS("Weight vector length must match the number of places"),
    // 17.
    INVALID_CONFIGURATION("Analysis configuration is invalid"),
    // 18.
    PARSE_FAILURE("Failed to read the net description"),
    // 19.
    UNKNOWN_FAILURE("Analysis failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
