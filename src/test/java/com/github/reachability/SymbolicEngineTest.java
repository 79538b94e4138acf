package com.github.reachability;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigInteger;
import java.util.Arrays;

import org.junit.Test;

import com.github.reachability.AnalysisConfiguration.AnalysisConfigurationBuilder;
import com.github.reachability.ReachabilityException.Code;

/**
 * Tests to maintain the sanity and correctness of the symbolic fixed point, always measured
 * against explicit exploration.
 */
public class SymbolicEngineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testSimpleNet() throws ReachabilityException {
    final SymbolicReachableSet reachable = new SymbolicEngine(Nets.simple()).explore();
    assertEquals(2, reachable.size());
    assertEquals(Arrays.asList(Marking.of(0, 1), Marking.of(1, 0)),
        Arrays.asList(reachable.markings().toArray(new Marking[0])));
    assertTrue(reachable.contains(Marking.of(1, 0)));
    assertFalse(reachable.contains(Marking.of(1, 1)));
    assertFalse(reachable.contains(Marking.of(0, 0)));
    assertEquals(BigInteger.valueOf(2), reachable.getStatistics().getMarkings());
    assertTrue(reachable.getStatistics().getDiagramNodes() > 2);
  }

  @Test
  public void testAgreesWithExplicitExploration() throws ReachabilityException {
    final PetriNet[] nets = {Nets.simple(), Nets.chain(8), Nets.ring(6), Nets.switches(5),
        Nets.philosophers(2), Nets.philosophers(3), Nets.selfLoop()};
    for (final PetriNet net : nets) {
      final ExplicitReachableSet explicit = new ExplicitExplorer(net).explore();
      for (final RelationMode mode : RelationMode.values()) {
        final AnalysisConfiguration config =
            AnalysisConfigurationBuilder.newBuilder().relationMode(mode).build();
        final SymbolicReachableSet symbolic = new SymbolicEngine(net, config).explore();
        assertEquals(net + " in " + mode, explicit.markings(), symbolic.markings());
        assertEquals(explicit.size(), symbolic.size());
        // rounds never exceed the number of markings
        assertTrue(symbolic.getStatistics().getIterations() <= explicit.size());
      }
    }
  }

  @Test
  public void testMembershipOverAllMarkings() throws ReachabilityException {
    final PetriNet net = Nets.philosophers(2);
    final ExplicitReachableSet explicit = new ExplicitExplorer(net).explore();
    final SymbolicReachableSet symbolic = new SymbolicEngine(net).explore();
    final int places = net.placeCount();
    for (int bits = 0; bits < (1 << places); bits++) {
      final int[] tokens = new int[places];
      for (int place = 0; place < places; place++) {
        tokens[place] = (bits >> (places - 1 - place)) & 1;
      }
      final Marking marking = Marking.of(tokens);
      assertEquals(marking.toString(), explicit.contains(marking), symbolic.contains(marking));
    }
  }

  @Test
  public void testIterationsFollowDistance() throws ReachabilityException {
    // the last place of a chain is 8 firings away, one more round confirms the fixed point
    final SymbolicReachableSet reachable = new SymbolicEngine(Nets.chain(8)).explore();
    assertEquals(9, reachable.size());
    assertEquals(9, reachable.getStatistics().getIterations());
    // a dead initial marking converges at once
    final PetriNet dead = PetriNet.PetriNetBuilder.newBuilder().place("p", 0).transition("t")
        .arc("p", "t").build();
    final SymbolicReachableSet single = new SymbolicEngine(dead).explore();
    assertEquals(1, single.size());
    assertEquals(1, single.getStatistics().getIterations());
  }

  @Test
  public void testIterationCeiling() throws ReachabilityException {
    final AnalysisConfiguration config =
        AnalysisConfigurationBuilder.newBuilder().iterationLimit(3).build();
    try {
      new SymbolicEngine(Nets.chain(8), config).explore();
      fail("A chain of 8 cannot converge in 3 rounds");
    } catch (ReachabilityException expected) {
      assertEquals(Code.ITERATION_LIMIT_EXCEEDED, expected.getCode());
      assertTrue(expected.isLimitExceeded());
    }
    final AnalysisConfiguration enough =
        AnalysisConfigurationBuilder.newBuilder().iterationLimit(9).build();
    assertEquals(9, new SymbolicEngine(Nets.chain(8), enough).explore().size());
  }

  @Test
  public void testNodeCeiling() throws ReachabilityException {
    final AnalysisConfiguration config =
        AnalysisConfigurationBuilder.newBuilder().nodeLimit(8).build();
    try {
      new SymbolicEngine(Nets.philosophers(3), config).explore();
      fail("Philosophers do not fit into 8 nodes");
    } catch (ReachabilityException expected) {
      assertEquals(Code.NODE_LIMIT_EXCEEDED, expected.getCode());
    }
  }

  @Test
  public void testUnsafeNetFails() throws ReachabilityException {
    for (final RelationMode mode : RelationMode.values()) {
      final AnalysisConfiguration config =
          AnalysisConfigurationBuilder.newBuilder().relationMode(mode).build();
      try {
        new SymbolicEngine(Nets.unsafe(), config).explore();
        fail("Exploring a net that is not 1-safe should have failed");
      } catch (ReachabilityException expected) {
        assertEquals(Code.UNSAFE_NET, expected.getCode());
      }
    }
  }

  @Test
  public void testEncodeExplicitSet() throws ReachabilityException {
    final PetriNet net = Nets.philosophers(3);
    final ExplicitReachableSet explicit = new ExplicitExplorer(net).explore();
    final SymbolicReachableSet encoded = new SymbolicEngine(net).encode(explicit);
    assertEquals(explicit.size(), encoded.size());
    assertEquals(explicit.markings(), encoded.markings());
    // encoding is canonical, same function as the fixed point
    final SymbolicReachableSet explored = new SymbolicEngine(net).explore();
    assertEquals(explored.getFunction().nodeCount(), encoded.getFunction().nodeCount());
  }

  @Test
  public void testFirstMatchingMarking() throws ReachabilityException {
    final PetriNet net = Nets.switches(3);
    final SymbolicReachableSet reachable = new SymbolicEngine(net).explore();
    final BddManager manager = reachable.getFunction().getManager();
    // everything is reachable, the least marking with on01 set
    final int on01 = net.placeIndex("on01");
    final Marking first =
        reachable.first(manager.variable(SymbolicEngine.currentVariable(on01))).get();
    assertTrue(first.isMarked(on01));
    assertEquals(reachable.markings().stream().filter(m -> m.isMarked(on01)).findFirst().get(),
        first);
    assertFalse(reachable.first(manager.constant(false)).isPresent());
  }

  @Test
  public void testCountBeyondLongRange() throws ReachabilityException {
    // 1. 63 independent switches reach 2^63 markings, one more than a long holds
    final PetriNet net = Nets.pairedSwitches(63);
    final SymbolicReachableSet reachable = new SymbolicEngine(net).explore();
    final BigInteger expected = BigInteger.ONE.shiftLeft(63);
    assertEquals(expected, reachable.count());
    assertEquals(expected, reachable.getStatistics().getMarkings());

    // 2. size saturates instead of overflowing
    assertEquals(Long.MAX_VALUE, reachable.size());

    // 3. membership and the deadlock query still work without extraction
    final int[] tokens = new int[net.placeCount()];
    for (int i = 0; i < 63; i++) {
      tokens[net.placeIndex(String.format("s%02d", i) + (i % 2 == 0 ? "a" : "b"))] = 1;
    }
    assertTrue(reachable.contains(Marking.of(tokens)));
    assertFalse(new DeadlockDetector(net).detect(reachable).isPresent());

    // 4. one switch fewer still fits a long exactly
    final SymbolicReachableSet smaller = new SymbolicEngine(Nets.pairedSwitches(62)).explore();
    assertEquals(1L << 62, smaller.size());
    assertEquals(BigInteger.ONE.shiftLeft(62), smaller.count());
  }

}
