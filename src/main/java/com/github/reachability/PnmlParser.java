package com.github.reachability;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import com.github.reachability.PetriNet.PetriNetBuilder;
import com.github.reachability.ReachabilityException.Code;

/**
 * Reads place/transition nets from PNML documents into a finalized {@link PetriNet}.
 *
 * Elements are matched on their local name so plain documents and documents in the 2003 or 2009
 * PNML grammar namespaces read the same. Places, transitions and arcs are collected from anywhere
 * under the first {@code net} element, which covers nets split over {@code page} elements.
 * Malformed XML or numbers fail with {@code PARSE_FAILURE}; structural problems such as dangling
 * arcs or duplicate ids surface with their own codes from the net builder.
 */
public final class PnmlParser {
  private static final Logger logger = LogManager.getLogger(PnmlParser.class.getSimpleName());

  public PetriNet parse(final Path path) throws ReachabilityException {
    if (path == null || !Files.isRegularFile(path)) {
      throw new ReachabilityException(Code.PARSE_FAILURE, "PNML file not found: " + path);
    }
    try (InputStream stream = Files.newInputStream(path)) {
      final PetriNet net = parse(stream);
      logger.info(String.format("Parsed %s: %d places, %d transitions, %d arcs", path,
          net.placeCount(), net.transitionCount(), net.getArcs().size()));
      return net;
    } catch (IOException ioException) {
      throw new ReachabilityException(Code.PARSE_FAILURE, "Failed to read " + path, ioException);
    }
  }

  public PetriNet parse(final InputStream stream) throws ReachabilityException {
    final Document document;
    try {
      document = newDocumentBuilder().parse(stream);
    } catch (SAXException | IOException exception) {
      throw new ReachabilityException(Code.PARSE_FAILURE,
          "Failed to parse XML: " + exception.getMessage(), exception);
    }
    final NodeList nets = document.getElementsByTagNameNS("*", "net");
    if (nets.getLength() == 0) {
      throw new ReachabilityException(Code.PARSE_FAILURE, "No <net> element found in PNML input");
    }
    final Element net = (Element) nets.item(0);

    final PetriNetBuilder builder = PetriNetBuilder.newBuilder();
    final NodeList places = net.getElementsByTagNameNS("*", "place");
    for (int i = 0; i < places.getLength(); i++) {
      final Element place = (Element) places.item(i);
      final String id = requiredAttribute(place, "id", "Place");
      final String tokens = labelText(place, "initialMarking");
      builder.place(id, orDefault(labelText(place, "name"), id),
          tokens == null ? 0 : parseInteger(tokens, "initial marking of place " + id));
    }
    final NodeList transitions = net.getElementsByTagNameNS("*", "transition");
    for (int i = 0; i < transitions.getLength(); i++) {
      final Element transition = (Element) transitions.item(i);
      final String id = requiredAttribute(transition, "id", "Transition");
      final String name = labelText(transition, "name");
      builder.transition(new Transition(id, Optional.ofNullable(name)));
    }
    final NodeList arcs = net.getElementsByTagNameNS("*", "arc");
    for (int i = 0; i < arcs.getLength(); i++) {
      final Element arc = (Element) arcs.item(i);
      final String source = requiredAttribute(arc, "source", "Arc");
      final String target = requiredAttribute(arc, "target", "Arc");
      final String weight = labelText(arc, "inscription");
      builder.arc(source, target,
          weight == null ? 1 : parseInteger(weight, "weight of arc " + source + "->" + target));
    }
    return builder.build();
  }

  private static DocumentBuilder newDocumentBuilder() throws ReachabilityException {
    try {
      final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setExpandEntityReferences(false);
      return factory.newDocumentBuilder();
    } catch (ParserConfigurationException exception) {
      throw new ReachabilityException(Code.UNKNOWN_FAILURE, exception);
    }
  }

  /**
   * Text of {@code <label><text>..</text></label>} directly under the element, null if absent or
   * blank.
   */
  private static String labelText(final Element element, final String label) {
    final Element labelElement = child(element, label);
    if (labelElement == null) {
      return null;
    }
    final Element text = child(labelElement, "text");
    final String content = text == null ? labelElement.getTextContent() : text.getTextContent();
    if (content == null || content.trim().isEmpty()) {
      return null;
    }
    return content.trim();
  }

  private static Element child(final Element parent, final String localName) {
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(node))) {
        return (Element) node;
      }
    }
    return null;
  }

  private static String localName(final Node node) {
    return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
  }

  private static String requiredAttribute(final Element element, final String attribute,
      final String kind) throws ReachabilityException {
    final String value = element.getAttribute(attribute);
    if (value == null || value.trim().isEmpty()) {
      throw new ReachabilityException(Code.PARSE_FAILURE,
          kind + " element missing '" + attribute + "' attribute");
    }
    return value.trim();
  }

  private static int parseInteger(final String text, final String what)
      throws ReachabilityException {
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException exception) {
      throw new ReachabilityException(Code.PARSE_FAILURE,
          "Invalid " + what + ": " + text, exception);
    }
  }

  private static String orDefault(final String value, final String fallback) {
    return value == null ? fallback : value;
  }

}
