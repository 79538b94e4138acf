package com.github.reachability;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.reachability.ReachabilityException.Code;

/**
 * Enumerative reachability: every reachable marking is materialized as a value. This is the
 * ground truth the symbolic engine is checked against and the fallback for small nets.
 *
 * Notes for users:<br>
 * 1. breadth-first and depth-first search return the same set, only the visiting order differs<br>
 *
 * 2. breadth-first search is bounded by {@link AnalysisConfiguration#getStateLimit()}. Finding
 * more markings than that fails the run with {@code STATE_LIMIT_EXCEEDED} and no partial result.
 * Depth-first search has no ceiling<br>
 *
 * 3. depth-first search runs on an explicit stack, large state spaces do not grow the call
 * stack<br>
 *
 * 4. an explorer owns nothing but its configuration and the net it reads, every run builds its
 * own working set<br>
 */
public final class ExplicitExplorer {
  private static final Logger logger =
      LogManager.getLogger(ExplicitExplorer.class.getSimpleName());

  private final PetriNet net;
  private final AnalysisConfiguration config;

  public ExplicitExplorer(final PetriNet net, final AnalysisConfiguration config)
      throws ReachabilityException {
    if (net == null || !net.isFinalized()) {
      throw new ReachabilityException(Code.NET_NOT_FINALIZED);
    }
    if (config == null) {
      throw new ReachabilityException(Code.INVALID_CONFIGURATION, "Configuration cannot be null");
    }
    this.net = net;
    this.config = config;
  }

  public ExplicitExplorer(final PetriNet net) throws ReachabilityException {
    this(net, AnalysisConfiguration.defaults());
  }

  /**
   * Explore with the configured search mode.
   */
  public ExplicitReachableSet explore() throws ReachabilityException {
    return explore(config.getSearchMode());
  }

  public ExplicitReachableSet explore(final SearchMode mode) throws ReachabilityException {
    switch (mode) {
      case BREADTH_FIRST:
        return breadthFirst();
      case DEPTH_FIRST:
        return depthFirst();
      default:
        throw new ReachabilityException(Code.INVALID_CONFIGURATION,
            "Unsupported search mode " + mode);
    }
  }

  public ExplicitReachableSet breadthFirst() throws ReachabilityException {
    final ExplorationStatistics statistics = new ExplorationStatistics("explicit-bfs");
    final String runId = statistics.getRunId();
    final int stateLimit = config.getStateLimit();
    logInfo(runId, "Starting breadth-first exploration with state ceiling " + stateLimit);

    final Marking initial = net.getInitialMarking();
    final Set<Marking> visited = new HashSet<>();
    final Deque<Marking> queue = new ArrayDeque<>();
    visited.add(initial);
    queue.add(initial);
    final int transitions = net.transitionCount();
    while (!queue.isEmpty()) {
      final Marking current = queue.poll();
      statistics.expansions++;
      for (int transition = 0; transition < transitions; transition++) {
        if (!net.isEnabled(transition, current)) {
          continue;
        }
        final Marking successor = net.fire(transition, current);
        if (visited.add(successor)) {
          queue.add(successor);
          if (visited.size() > stateLimit) {
            statistics.stop();
            logWarning(runId, "State ceiling of " + stateLimit + " exceeded after "
                + statistics.getElapsedMillis() + " millis");
            throw new ReachabilityException(Code.STATE_LIMIT_EXCEEDED, "State limit exceeded ("
                + stateLimit + "). Net appears unbounded or too large to enumerate.");
          }
        }
      }
      if (logger.isDebugEnabled() && statistics.expansions % 10_000 == 0) {
        logDebug(runId, String.format("expanded:%d, visited:%d, queued:%d",
            statistics.expansions, visited.size(), queue.size()));
      }
    }
    return finish(visited, statistics);
  }

  public ExplicitReachableSet depthFirst() throws ReachabilityException {
    final ExplorationStatistics statistics = new ExplorationStatistics("explicit-dfs");
    final String runId = statistics.getRunId();
    logInfo(runId, "Starting depth-first exploration");

    final Set<Marking> visited = new HashSet<>();
    final Deque<Marking> stack = new ArrayDeque<>();
    stack.push(net.getInitialMarking());
    final int transitions = net.transitionCount();
    while (!stack.isEmpty()) {
      final Marking current = stack.pop();
      if (!visited.add(current)) {
        continue;
      }
      statistics.expansions++;
      // pushed in reverse so the first enabled transition is explored first
      for (int transition = transitions - 1; transition >= 0; transition--) {
        if (net.isEnabled(transition, current)) {
          final Marking successor = net.fire(transition, current);
          if (!visited.contains(successor)) {
            stack.push(successor);
          }
        }
      }
      if (logger.isDebugEnabled() && statistics.expansions % 10_000 == 0) {
        logDebug(runId, String.format("expanded:%d, visited:%d, stacked:%d",
            statistics.expansions, visited.size(), stack.size()));
      }
    }
    return finish(visited, statistics);
  }

  private ExplicitReachableSet finish(final Set<Marking> visited,
      final ExplorationStatistics statistics) {
    statistics.markings = BigInteger.valueOf(visited.size());
    statistics.stop();
    logInfo(statistics.getRunId(), String.format("Found %d reachable markings in %d millis",
        visited.size(), statistics.getElapsedMillis()));
    return new ExplicitReachableSet(net.placeCount(), visited, statistics);
  }

  private static void logInfo(final String runId, final String message) {
    logger.info(new StringBuilder().append("[r:").append(runId).append("] ").append(message)
        .toString());
  }

  private static void logWarning(final String runId, final String message) {
    logger.warn(new StringBuilder().append("[r:").append(runId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String runId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[r:").append(runId).append("] ").append(message)
          .toString());
    }
  }

}
