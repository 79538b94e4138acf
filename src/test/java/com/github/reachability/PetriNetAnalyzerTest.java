package com.github.reachability;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.junit.Before;
import org.junit.Test;

/**
 * Tests to maintain the sanity of the command line: exit codes and the printed summary.
 */
public class PetriNetAnalyzerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;
  private PetriNetAnalyzer analyzer;

  @Before
  public void setUp() throws Exception {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    analyzer = new PetriNetAnalyzer(new PrintStream(out, true, "UTF-8"),
        new PrintStream(err, true, "UTF-8"));
  }

  @Test
  public void testAllTasks() throws Exception {
    final int status = analyzer.run(new String[] {fixture("simple.pnml"), "--weights", "3,1"});
    assertEquals(PetriNetAnalyzer.EXIT_OK, status);
    final String printed = printed(out);
    assertTrue(printed, printed.contains("Reachable markings: 2"));
    assertTrue(printed, printed.contains("Agrees with explicit exploration: true"));
    assertTrue(printed, printed.contains("Deadlock found: (0,1)"));
    assertTrue(printed, printed.contains("Places with tokens: [p2]"));
    assertTrue(printed, printed.contains("Optimal marking (MAXIMIZE): (1,0)"));
    assertTrue(printed, printed.contains("Objective value: 3.00"));
    assertTrue(printed, printed.contains("Explorer: explicit-bfs"));
    assertTrue(printed, printed.contains("Explorer: symbolic"));
  }

  @Test
  public void testStateCeilingInAllTask() throws Exception {
    // 1. mutex has 3 reachable markings, a ceiling of 1 stops the explicit search
    final int status =
        analyzer.run(new String[] {fixture("mutex.pnml"), "--state-limit", "1"});
    final String printed = printed(out);

    // 2. the remaining analyses still run and report
    assertTrue(printed, printed.contains("Skipped: "));
    assertTrue(printed, printed.contains("Explorer: symbolic"));
    assertTrue(printed, printed.contains("Reachable markings: 3"));
    assertTrue(printed, printed.contains("No deadlock found"));
    assertFalse(printed, printed.contains("Agrees with explicit exploration"));

    // 3. but the run as a whole failed
    assertEquals(PetriNetAnalyzer.EXIT_FAILURE, status);
  }

  @Test
  public void testNumbersIgnoreDefaultLocale() throws Exception {
    final Locale defaultLocale = Locale.getDefault();
    try {
      Locale.setDefault(Locale.GERMANY);
      assertEquals(PetriNetAnalyzer.EXIT_OK, analyzer.run(new String[] {fixture("simple.pnml"),
          "--task", "optimize", "--weights", "3,1"}));
    } finally {
      Locale.setDefault(defaultLocale);
    }
    final String printed = printed(out);
    assertTrue(printed, printed.contains("Objective value: 3.00"));
    assertFalse(printed, printed.contains("3,00"));
  }

  @Test
  public void testSingleTasks() throws Exception {
    assertEquals(PetriNetAnalyzer.EXIT_OK,
        analyzer.run(new String[] {fixture("mutex.pnml"), "--task", "explicit-only"}));
    assertTrue(printed(out).contains("Reachable markings: 3"));
    assertEquals(PetriNetAnalyzer.EXIT_OK,
        analyzer.run(new String[] {fixture("mutex.pnml"), "--task", "deadlock"}));
    assertTrue(printed(out).contains("No deadlock found"));
    assertEquals(PetriNetAnalyzer.EXIT_OK, analyzer.run(new String[] {fixture("simple.pnml"),
        "--task", "optimize", "--weights", "3,1", "--minimize"}));
    assertTrue(printed(out).contains("Optimal marking (MINIMIZE): (0,1)"));
  }

  @Test
  public void testUsageErrors() throws Exception {
    assertEquals(PetriNetAnalyzer.EXIT_USAGE, analyzer.run(new String[0]));
    assertEquals(PetriNetAnalyzer.EXIT_USAGE, analyzer.run(new String[] {"missing.pnml"}));
    assertEquals(PetriNetAnalyzer.EXIT_USAGE,
        analyzer.run(new String[] {fixture("simple.pnml"), "--task", "simulate"}));
    assertEquals(PetriNetAnalyzer.EXIT_USAGE,
        analyzer.run(new String[] {fixture("simple.pnml"), "--weights", "1,x"}));
    assertEquals(PetriNetAnalyzer.EXIT_USAGE,
        analyzer.run(new String[] {fixture("simple.pnml"), "--weights", "1,2,3"}));
    assertEquals(PetriNetAnalyzer.EXIT_USAGE,
        analyzer.run(new String[] {fixture("simple.pnml"), "--task", "optimize"}));
    assertEquals(PetriNetAnalyzer.EXIT_USAGE, analyzer.run(new String[] {fixture("dangling.pnml")}));
    assertTrue(printed(err).contains("Usage"));
  }

  @Test
  public void testAnalysisFailure() throws Exception {
    assertEquals(PetriNetAnalyzer.EXIT_FAILURE, analyzer.run(
        new String[] {fixture("mutex.pnml"), "--task", "symbolic", "--iteration-limit", "1"}));
    assertTrue(printed(err).contains("Iteration limit exceeded"));
  }

  @Test
  public void testWeightParsing() throws Exception {
    assertArrayEquals(new double[] {1.0, 2.5, -3.0},
        PetriNetAnalyzer.Options.parseWeights("1, 2.5,-3"), 0.0);
  }

  @Test
  public void testMarkingTable() throws Exception {
    final PetriNet net = Nets.chain(3);
    final String table =
        PetriNetAnalyzer.formatMarkings(net, new ExplicitExplorer(net).explore(), 2);
    assertTrue(table, table.contains("Reachable markings (4 total):"));
    assertTrue(table, table.contains("  p00"));
    assertTrue(table, table.contains("M0"));
    assertTrue(table, table.contains("... (2 more)"));
  }

  private static String fixture(final String name) throws Exception {
    return PnmlParserTest.fixture(name).toString();
  }

  private static String printed(final ByteArrayOutputStream stream) {
    return new String(stream.toByteArray(), StandardCharsets.UTF_8);
  }

}
