package com.github.reachability;

import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.reachability.ReachabilityException.Code;

/**
 * Extremizes {@code sum(weights[i] * marking[i])} over a reachable set.
 *
 * Markings are visited in canonical order and only a strictly better value replaces the
 * incumbent, so among equally good markings the canonically least one is returned. An empty set
 * yields no result.
 */
public final class ReachableSetOptimizer {
  private static final Logger logger =
      LogManager.getLogger(ReachableSetOptimizer.class.getSimpleName());

  public Optional<OptimizationResult> optimize(final ReachableSet reachable, final double[] weights,
      final Objective objective) throws ReachabilityException {
    if (reachable == null) {
      throw new ReachabilityException(Code.INVALID_MARKING, "Reachable set cannot be null");
    }
    if (objective == null) {
      throw new ReachabilityException(Code.INVALID_CONFIGURATION, "Objective cannot be null");
    }
    if (weights == null || weights.length != reachable.placeCount()) {
      throw new ReachabilityException(Code.INVALID_WEIGHTS,
          String.format("Weight vector length (%d) must match number of places (%d)",
              weights == null ? 0 : weights.length, reachable.placeCount()));
    }
    final long started = System.currentTimeMillis();
    Marking best = null;
    double bestValue = 0.0d;
    for (final Marking marking : reachable) {
      final double value = evaluate(weights, marking);
      if (best == null || objective.improves(value, bestValue)) {
        best = marking;
        bestValue = value;
      }
    }
    if (best == null) {
      logger.info("Nothing to optimize, reachable set is empty");
      return Optional.empty();
    }
    logger.info(String.format("%s optimum %s at %s in %d millis", objective, bestValue, best,
        System.currentTimeMillis() - started));
    return Optional.of(new OptimizationResult(best, bestValue, objective));
  }

  public static double evaluate(final double[] weights, final Marking marking) {
    double value = 0.0d;
    for (int place = 0; place < weights.length; place++) {
      value += weights[place] * marking.get(place);
    }
    return value;
  }

}
