package com.github.reachability;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.Optional;

import org.junit.Test;

import com.github.reachability.ReachabilityException.Code;

public class ReachableSetOptimizerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final ReachableSetOptimizer optimizer = new ReachableSetOptimizer();

  @Test
  public void testSimpleNet() throws ReachabilityException {
    final ReachableSet reachable = new SymbolicEngine(Nets.simple()).explore();
    final double[] weights = {3.0, 1.0};

    final OptimizationResult max = optimizer.optimize(reachable, weights, Objective.MAXIMIZE).get();
    assertEquals(Marking.of(1, 0), max.getMarking());
    assertEquals(3.0, max.getValue(), 0.0);

    final OptimizationResult min = optimizer.optimize(reachable, weights, Objective.MINIMIZE).get();
    assertEquals(Marking.of(0, 1), min.getMarking());
    assertEquals(1.0, min.getValue(), 0.0);
  }

  @Test
  public void testOptimumBoundsEveryMarking() throws ReachabilityException {
    final PetriNet net = Nets.philosophers(3);
    final ExplicitReachableSet reachable = new ExplicitExplorer(net).explore();
    final double[] weights = new double[net.placeCount()];
    for (int place = 0; place < weights.length; place++) {
      weights[place] = (place % 5) - 1.5;
    }
    final OptimizationResult max =
        optimizer.optimize(reachable, weights, Objective.MAXIMIZE).get();
    final OptimizationResult min =
        optimizer.optimize(reachable, weights, Objective.MINIMIZE).get();
    assertTrue(reachable.contains(max.getMarking()));
    assertTrue(reachable.contains(min.getMarking()));
    for (final Marking marking : reachable) {
      final double value = ReachableSetOptimizer.evaluate(weights, marking);
      assertTrue(value <= max.getValue());
      assertTrue(value >= min.getValue());
    }
    // both representations agree
    final ReachableSet symbolic = new SymbolicEngine(net).explore();
    assertEquals(max, optimizer.optimize(symbolic, weights, Objective.MAXIMIZE).get());
  }

  @Test
  public void testTiesKeepFirstInCanonicalOrder() throws ReachabilityException {
    // every switch marking has the same value when off and on weigh the same
    final ReachableSet reachable = new ExplicitExplorer(Nets.switches(3)).explore();
    final double[] weights = {1, 1, 1, 1, 1, 1};
    final OptimizationResult result =
        optimizer.optimize(reachable, weights, Objective.MAXIMIZE).get();
    assertEquals(reachable.markings().first(), result.getMarking());
    assertEquals(3.0, result.getValue(), 0.0);
  }

  @Test
  public void testEmptySetHasNoOptimum() throws ReachabilityException {
    final ReachableSet empty = new ExplicitReachableSet(2, Collections.<Marking>emptyList(),
        new ExplorationStatistics("none"));
    assertEquals(Optional.empty(),
        optimizer.optimize(empty, new double[] {1, 2}, Objective.MAXIMIZE));
  }

  @Test
  public void testWeightLengthMismatch() throws ReachabilityException {
    final ReachableSet reachable = new ExplicitExplorer(Nets.simple()).explore();
    try {
      optimizer.optimize(reachable, new double[] {1, 2, 3}, Objective.MAXIMIZE);
      fail("Three weights for two places should have been rejected");
    } catch (ReachabilityException expected) {
      assertEquals(Code.INVALID_WEIGHTS, expected.getCode());
      assertFalse(expected.isLimitExceeded());
    }
  }

}
