package com.github.reachability;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Simple statistics holder for one exploration run. Explorers fill it in as they go, callers only
 * ever read it.
 */
public final class ExplorationStatistics {
  private final String runId = UUID.randomUUID().toString();
  private final String explorer;
  private final long startMillis = System.currentTimeMillis();
  long endMillis;
  BigInteger markings = BigInteger.ZERO;
  // explicit: markings expanded, symbolic: unused
  long expansions;
  // symbolic: fixed-point rounds, explicit: unused
  int iterations;
  // symbolic: live nodes in the run's decision diagram arena when the run ended
  int diagramNodes;

  ExplorationStatistics(final String explorer) {
    this.explorer = explorer;
  }

  public String getRunId() {
    return runId;
  }

  public String getExplorer() {
    return explorer;
  }

  public BigInteger getMarkings() {
    return markings;
  }

  public long getExpansions() {
    return expansions;
  }

  public int getIterations() {
    return iterations;
  }

  public int getDiagramNodes() {
    return diagramNodes;
  }

  public long getElapsedMillis() {
    return (endMillis == 0L ? System.currentTimeMillis() : endMillis) - startMillis;
  }

  void stop() {
    endMillis = System.currentTimeMillis();
  }

  @Override
  public String toString() {
    return "ExplorationStatistics [runId=" + runId + ", explorer=" + explorer + ", markings="
        + markings + ", expansions=" + expansions + ", iterations=" + iterations
        + ", diagramNodes=" + diagramNodes + ", elapsedMillis=" + getElapsedMillis() + "]";
  }

}
