package com.github.reachability;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import com.github.reachability.ReachabilityException.Code;

/**
 * Tests to maintain the sanity and correctness of PNML reading.
 */
public class PnmlParserTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final PnmlParser parser = new PnmlParser();

  @Test
  public void testNamespacedNetOnPage() throws Exception {
    final PetriNet net = parser.parse(fixture("simple.pnml"));
    assertEquals(2, net.placeCount());
    assertEquals(1, net.transitionCount());
    assertEquals(2, net.getArcs().size());
    assertEquals("ready", net.getPlaces().get(0).getName());
    assertEquals("finish", net.getTransitions().get(0).getName());
    assertEquals(Marking.of(1, 0), net.getInitialMarking());
    assertEquals(2, new ExplicitExplorer(net).explore().size());
  }

  @Test
  public void testPlainNet() throws Exception {
    final PetriNet net = parser.parse(fixture("mutex.pnml"));
    assertEquals(5, net.placeCount());
    assertEquals(4, net.transitionCount());
    // crit1, crit2, idle1, idle2, lock
    assertEquals(Marking.of(0, 0, 1, 1, 1), net.getInitialMarking());
    final ReachableSet reachable = new SymbolicEngine(net).explore();
    assertEquals(3, reachable.size());
    assertEquals("lock", net.getPlaces().get(4).getName());
  }

  @Test
  public void testInlineDocument() throws ReachabilityException {
    final String pnml = "<pnml><net id='n'><place id='a'><initialMarking><text>1</text>"
        + "</initialMarking></place><place id='b'/><transition id='t'/>"
        + "<arc source='a' target='t'><inscription><text>2</text></inscription></arc>"
        + "<arc source='t' target='b'/></net></pnml>";
    final PetriNet net = parser.parse(stream(pnml));
    assertEquals(2, net.getArcs().get(0).getWeight());
    assertEquals(Marking.of(0, 1), net.fire("t", net.getInitialMarking()));
  }

  @Test
  public void testDanglingArc() throws Exception {
    assertParseFails(fixture("dangling.pnml"), Code.UNKNOWN_NODE);
  }

  @Test
  public void testMalformedMarking() throws Exception {
    assertParseFails(fixture("malformed.pnml"), Code.PARSE_FAILURE);
  }

  @Test
  public void testBrokenDocuments() {
    assertParseFails("<pnml><net>", Code.PARSE_FAILURE);
    assertParseFails("<pnml/>", Code.PARSE_FAILURE);
    assertParseFails("<pnml><net><place/></net></pnml>", Code.PARSE_FAILURE);
    assertParseFails("<pnml><net><place id='p'><initialMarking><text>2</text></initialMarking>"
        + "</place></net></pnml>", Code.INVALID_PLACE);
    assertParseFails(Paths.get("does-not-exist.pnml"), Code.PARSE_FAILURE);
  }

  @Test
  public void testIdSharedByPlaceAndTransition() {
    // ids are document-wide in PNML, an arc to 'x' could name either node
    assertParseFails("<pnml><net id='n'><place id='x'/><transition id='x'/>"
        + "<arc source='x' target='x'/></net></pnml>", Code.DUPLICATE_NODE);
  }

  private void assertParseFails(final Path path, final Code code) {
    try {
      parser.parse(path);
      fail("Parsing " + path + " should have failed with " + code);
    } catch (ReachabilityException expected) {
      assertEquals(code, expected.getCode());
    }
  }

  private void assertParseFails(final String document, final Code code) {
    try {
      parser.parse(stream(document));
      fail("Parsing should have failed with " + code);
    } catch (ReachabilityException expected) {
      assertEquals(code, expected.getCode());
    }
  }

  static Path fixture(final String name) throws URISyntaxException {
    return Paths.get(PnmlParserTest.class.getResource("/" + name).toURI());
  }

  private static ByteArrayInputStream stream(final String document) {
    return new ByteArrayInputStream(document.getBytes(StandardCharsets.UTF_8));
  }

}
