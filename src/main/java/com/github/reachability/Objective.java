package com.github.reachability;

/**
 * Direction of the linear objective optimized over a reachable set.
 */
public enum Objective {
  MAXIMIZE,
  MINIMIZE;

  /**
   * True iff the candidate value is strictly better than the incumbent. Equal values never win
   * which keeps the first optimum met in canonical order.
   */
  boolean improves(final double candidate, final double incumbent) {
    return this == MAXIMIZE ? candidate > incumbent : candidate < incumbent;
  }
}
