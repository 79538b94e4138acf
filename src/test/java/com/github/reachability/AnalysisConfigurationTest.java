package com.github.reachability;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.reachability.AnalysisConfiguration.AnalysisConfigurationBuilder;
import com.github.reachability.ReachabilityException.Code;

public class AnalysisConfigurationTest {

  @Test
  public void testDefaults() {
    final AnalysisConfiguration config = AnalysisConfiguration.defaults();
    assertEquals(AnalysisConfiguration.DEFAULT_STATE_LIMIT, config.getStateLimit());
    assertEquals(AnalysisConfiguration.DEFAULT_ITERATION_LIMIT, config.getIterationLimit());
    assertEquals(AnalysisConfiguration.DEFAULT_NODE_LIMIT, config.getNodeLimit());
    assertEquals(SearchMode.BREADTH_FIRST, config.getSearchMode());
    assertEquals(RelationMode.MONOLITHIC, config.getRelationMode());
  }

  @Test
  public void testBuilder() throws ReachabilityException {
    final AnalysisConfiguration config = AnalysisConfigurationBuilder.newBuilder().stateLimit(5)
        .iterationLimit(7).nodeLimit(1000).searchMode(SearchMode.DEPTH_FIRST)
        .relationMode(RelationMode.PARTITIONED).build();
    assertEquals(5, config.getStateLimit());
    assertEquals(7, config.getIterationLimit());
    assertEquals(1000, config.getNodeLimit());
    assertEquals(SearchMode.DEPTH_FIRST, config.getSearchMode());
    assertEquals(RelationMode.PARTITIONED, config.getRelationMode());
  }

  @Test
  public void testNonPositiveLimitsFallBack() throws ReachabilityException {
    final AnalysisConfiguration config = AnalysisConfigurationBuilder.newBuilder().stateLimit(0)
        .iterationLimit(-3).nodeLimit(-1).build();
    assertEquals(AnalysisConfiguration.DEFAULT_STATE_LIMIT, config.getStateLimit());
    assertEquals(AnalysisConfiguration.DEFAULT_ITERATION_LIMIT, config.getIterationLimit());
    assertEquals(AnalysisConfiguration.DEFAULT_NODE_LIMIT, config.getNodeLimit());
  }

  @Test
  public void testMissingModes() {
    try {
      AnalysisConfigurationBuilder.newBuilder().searchMode(null).build();
      fail("A missing search mode should have been rejected");
    } catch (ReachabilityException expected) {
      assertEquals(Code.INVALID_CONFIGURATION, expected.getCode());
    }
  }
}
