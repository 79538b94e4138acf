package com.github.reachability;

/**
 * This class encapsulates all the configuration parameters for a reachability analysis. Use the
 * {@code AnalysisConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. every ceiling that is not set, or set to a non-positive value, falls back to its default<br>
 * 2. ceilings are what turns "the net is unbounded or just too big" into a reported failure
 * instead of an exploration that never ends. There is no auto-retry with a higher ceiling, that
 * decision is left to callers<br>
 * 3. the depth-first explicit search has no ceiling, {@link #getStateLimit()} only bounds the
 * breadth-first one<br>
 *
 * @author gaurav
 */
public final class AnalysisConfiguration {
  public static final int DEFAULT_STATE_LIMIT = 10_000;
  public static final int DEFAULT_ITERATION_LIMIT = 1_000;
  public static final int DEFAULT_NODE_LIMIT = 4_000_000;

  private final int stateLimit;
  private final int iterationLimit;
  private final int nodeLimit;
  private final SearchMode searchMode;
  private final RelationMode relationMode;

  public int getStateLimit() {
    return stateLimit;
  }

  public int getIterationLimit() {
    return iterationLimit;
  }

  public int getNodeLimit() {
    return nodeLimit;
  }

  public SearchMode getSearchMode() {
    return searchMode;
  }

  public RelationMode getRelationMode() {
    return relationMode;
  }

  /**
   * Configuration with every default applied.
   */
  public static AnalysisConfiguration defaults() {
    return new AnalysisConfiguration(0, 0, 0, SearchMode.BREADTH_FIRST, RelationMode.MONOLITHIC);
  }

  public final static class AnalysisConfigurationBuilder {
    private int stateLimit;
    private int iterationLimit;
    private int nodeLimit;
    private SearchMode searchMode = SearchMode.BREADTH_FIRST;
    private RelationMode relationMode = RelationMode.MONOLITHIC;

    public static AnalysisConfigurationBuilder newBuilder() {
      return new AnalysisConfigurationBuilder();
    }

    public AnalysisConfigurationBuilder stateLimit(final int stateLimit) {
      this.stateLimit = stateLimit;
      return this;
    }

    public AnalysisConfigurationBuilder iterationLimit(final int iterationLimit) {
      this.iterationLimit = iterationLimit;
      return this;
    }

    public AnalysisConfigurationBuilder nodeLimit(final int nodeLimit) {
      this.nodeLimit = nodeLimit;
      return this;
    }

    public AnalysisConfigurationBuilder searchMode(final SearchMode searchMode) {
      this.searchMode = searchMode;
      return this;
    }

    public AnalysisConfigurationBuilder relationMode(final RelationMode relationMode) {
      this.relationMode = relationMode;
      return this;
    }

    public AnalysisConfiguration build() throws ReachabilityException {
      final AnalysisConfiguration config = new AnalysisConfiguration(stateLimit, iterationLimit,
          nodeLimit, searchMode, relationMode);
      config.validate();
      return config;
    }

    private AnalysisConfigurationBuilder() {}
  }

  private void validate() throws ReachabilityException {
    StringBuilder messages = new StringBuilder();
    if (searchMode == null) {
      messages.append("SearchMode cannot be null. ");
    }
    if (relationMode == null) {
      messages.append("RelationMode cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new ReachabilityException(ReachabilityException.Code.INVALID_CONFIGURATION,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "AnalysisConfiguration [stateLimit=" + stateLimit + ", iterationLimit="
        + iterationLimit + ", nodeLimit=" + nodeLimit + ", searchMode=" + searchMode
        + ", relationMode=" + relationMode + "]";
  }

  private AnalysisConfiguration(final int stateLimit, final int iterationLimit,
      final int nodeLimit, final SearchMode searchMode, final RelationMode relationMode) {
    this.stateLimit = stateLimit <= 0 ? DEFAULT_STATE_LIMIT : stateLimit;
    this.iterationLimit = iterationLimit <= 0 ? DEFAULT_ITERATION_LIMIT : iterationLimit;
    this.nodeLimit = nodeLimit <= 0 ? DEFAULT_NODE_LIMIT : nodeLimit;
    this.searchMode = searchMode;
    this.relationMode = relationMode;
  }

}
