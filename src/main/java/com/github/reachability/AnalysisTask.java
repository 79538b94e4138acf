package com.github.reachability;

import java.util.Locale;

import com.github.reachability.ReachabilityException.Code;

/**
 * Work the command line can be asked to do.
 */
public enum AnalysisTask {
  // 1. parse, both explorations, deadlock and, with weights, optimization
  ALL("all"),
  // 2. explicit breadth-first exploration only
  EXPLICIT("explicit", "explicit-only"),
  // 3. symbolic fixed point only
  SYMBOLIC("symbolic", "symbolic-only", "bdd"),
  // 4. symbolic exploration followed by the deadlock query
  DEADLOCK("deadlock"),
  // 5. symbolic exploration followed by optimization, needs weights
  OPTIMIZE("optimize");

  private final String[] names;

  private AnalysisTask(final String... names) {
    this.names = names;
  }

  public String getName() {
    return names[0];
  }

  public static AnalysisTask fromName(final String name) throws ReachabilityException {
    if (name != null) {
      final String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (final AnalysisTask task : values()) {
        for (final String candidate : task.names) {
          if (candidate.equals(normalized)) {
            return task;
          }
        }
      }
    }
    throw new ReachabilityException(Code.INVALID_CONFIGURATION, "Unknown task '" + name
        + "', expected one of all, explicit, symbolic, deadlock, optimize");
  }
}
