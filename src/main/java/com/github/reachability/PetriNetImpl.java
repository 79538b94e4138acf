package com.github.reachability;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.reachability.ReachabilityException.Code;

/**
 * Default {@link PetriNet}.
 *
 * Notes for users:<br>
 * 1. construction is not thread-safe. Once {@link #finalizeStructure()} returned, the net is
 * effectively immutable and every query is safe to call from any thread<br>
 *
 * 2. all derived structures are plain arrays indexed by the canonical place and transition
 * orders, so enabling and firing are a handful of array reads<br>
 *
 * @author gaurav
 */
public final class PetriNetImpl implements PetriNet {
  private static final Logger logger = LogManager.getLogger(PetriNetImpl.class.getSimpleName());

  // K=id, V=node, insertion ordered until finalization
  private final Map<String, Place> placesTable = new LinkedHashMap<>();
  private final Map<String, Transition> transitionsTable = new LinkedHashMap<>();
  private final List<Arc> arcs = new ArrayList<>();

  // K=transition id, V=place ids. Filled while arcs are added.
  private final Map<String, TreeSet<String>> presets = new HashMap<>();
  private final Map<String, TreeSet<String>> postsets = new HashMap<>();

  private volatile boolean finalized;

  // derived during finalization, read-only afterwards
  private List<Place> orderedPlaces;
  private List<Transition> orderedTransitions;
  private Map<String, Integer> placeIndexTable;
  private Map<String, Integer> transitionIndexTable;
  private int[][] inputIndices;
  private int[][] outputIndices;
  // strict inputs lose their token, strict outputs gain one, self-loop places keep theirs
  private int[][] strictInputIndices;
  private int[][] strictOutputIndices;

  @Override
  public void addPlace(final Place place) throws ReachabilityException {
    mutable();
    if (place == null) {
      throw new ReachabilityException(Code.INVALID_PLACE, "Null place is invalid");
    }
    final String id = place.getId();
    if (placesTable.containsKey(id) || transitionsTable.containsKey(id)) {
      throw new ReachabilityException(Code.DUPLICATE_NODE,
          "Place id " + id + " is already registered in this net");
    }
    placesTable.put(id, place);
  }

  @Override
  public void addTransition(final Transition transition) throws ReachabilityException {
    mutable();
    if (transition == null) {
      throw new ReachabilityException(Code.INVALID_TRANSITION, "Null transition is invalid");
    }
    final String id = transition.getId();
    if (placesTable.containsKey(id) || transitionsTable.containsKey(id)) {
      throw new ReachabilityException(Code.DUPLICATE_NODE,
          "Transition id " + id + " is already registered in this net");
    }
    transitionsTable.put(id, transition);
    presets.put(id, new TreeSet<>());
    postsets.put(id, new TreeSet<>());
  }

  @Override
  public void addArc(final Arc arc) throws ReachabilityException {
    mutable();
    if (arc == null) {
      throw new ReachabilityException(Code.ILLEGAL_ARC, "Null arc is invalid");
    }
    final String source = arc.getSource();
    final String target = arc.getTarget();
    final boolean sourceIsPlace = placesTable.containsKey(source);
    final boolean targetIsPlace = placesTable.containsKey(target);
    if (!sourceIsPlace && !transitionsTable.containsKey(source)) {
      throw new ReachabilityException(Code.UNKNOWN_NODE,
          "Arc references unknown source node: " + source);
    }
    if (!targetIsPlace && !transitionsTable.containsKey(target)) {
      throw new ReachabilityException(Code.UNKNOWN_NODE,
          "Arc references unknown target node: " + target);
    }
    if (sourceIsPlace == targetIsPlace) {
      throw new ReachabilityException(Code.ILLEGAL_ARC, String.format(
          "Invalid arc: %s -> %s. Arcs must connect places to transitions or transitions to places.",
          source, target));
    }
    if (sourceIsPlace) {
      presets.get(target).add(source);
    } else {
      postsets.get(source).add(target);
    }
    arcs.add(arc);
  }

  @Override
  public synchronized void finalizeStructure() {
    if (finalized) {
      return;
    }
    final List<Place> places = new ArrayList<>(placesTable.values());
    places.sort((one, two) -> one.getId().compareTo(two.getId()));
    final List<Transition> transitions = new ArrayList<>(transitionsTable.values());
    transitions.sort((one, two) -> one.getId().compareTo(two.getId()));

    final Map<String, Integer> placeIndices = new HashMap<>();
    for (int index = 0; index < places.size(); index++) {
      placeIndices.put(places.get(index).getId(), index);
    }
    final Map<String, Integer> transitionIndices = new HashMap<>();
    final int[][] inputs = new int[transitions.size()][];
    final int[][] outputs = new int[transitions.size()][];
    final int[][] strictInputs = new int[transitions.size()][];
    final int[][] strictOutputs = new int[transitions.size()][];
    for (int index = 0; index < transitions.size(); index++) {
      final String transitionId = transitions.get(index).getId();
      transitionIndices.put(transitionId, index);
      inputs[index] = toIndices(presets.get(transitionId), placeIndices);
      outputs[index] = toIndices(postsets.get(transitionId), placeIndices);
      strictInputs[index] = difference(inputs[index], outputs[index]);
      strictOutputs[index] = difference(outputs[index], inputs[index]);
    }

    orderedPlaces = Collections.unmodifiableList(places);
    orderedTransitions = Collections.unmodifiableList(transitions);
    placeIndexTable = Collections.unmodifiableMap(placeIndices);
    transitionIndexTable = Collections.unmodifiableMap(transitionIndices);
    inputIndices = inputs;
    outputIndices = outputs;
    strictInputIndices = strictInputs;
    strictOutputIndices = strictOutputs;
    finalized = true;
    logger.info(String.format("Finalized net with %d places, %d transitions, %d arcs",
        places.size(), transitions.size(), arcs.size()));
  }

  @Override
  public boolean isFinalized() {
    return finalized;
  }

  @Override
  public List<Place> getPlaces() {
    if (finalized) {
      return orderedPlaces;
    }
    return Collections.unmodifiableList(new ArrayList<>(placesTable.values()));
  }

  @Override
  public List<Transition> getTransitions() {
    if (finalized) {
      return orderedTransitions;
    }
    return Collections.unmodifiableList(new ArrayList<>(transitionsTable.values()));
  }

  @Override
  public List<Arc> getArcs() {
    return Collections.unmodifiableList(arcs);
  }

  @Override
  public int placeCount() {
    return placesTable.size();
  }

  @Override
  public int transitionCount() {
    return transitionsTable.size();
  }

  @Override
  public int placeIndex(final String placeId) throws ReachabilityException {
    requireFinalized();
    final Integer index = placeIndexTable.get(placeId);
    if (index == null) {
      throw new ReachabilityException(Code.UNKNOWN_NODE, "Net has no place with id " + placeId);
    }
    return index;
  }

  @Override
  public int transitionIndex(final String transitionId) throws ReachabilityException {
    requireFinalized();
    final Integer index = transitionIndexTable.get(transitionId);
    if (index == null) {
      throw new ReachabilityException(Code.UNKNOWN_TRANSITION,
          "Net has no transition with id " + transitionId);
    }
    return index;
  }

  @Override
  public int[] inputPlaces(final int transitionIndex) throws ReachabilityException {
    checkTransition(transitionIndex);
    return inputIndices[transitionIndex].clone();
  }

  @Override
  public int[] outputPlaces(final int transitionIndex) throws ReachabilityException {
    checkTransition(transitionIndex);
    return outputIndices[transitionIndex].clone();
  }

  @Override
  public Marking getInitialMarking() throws ReachabilityException {
    requireFinalized();
    final int[] tokens = new int[orderedPlaces.size()];
    for (int index = 0; index < tokens.length; index++) {
      tokens[index] = orderedPlaces.get(index).getInitialTokens();
    }
    return Marking.wrap(tokens);
  }

  @Override
  public boolean isEnabled(final String transitionId, final Marking marking)
      throws ReachabilityException {
    return isEnabled(transitionIndex(transitionId), marking);
  }

  @Override
  public boolean isEnabled(final int transitionIndex, final Marking marking)
      throws ReachabilityException {
    checkTransition(transitionIndex);
    checkMarking(marking);
    return enabled(transitionIndex, marking.tokens());
  }

  @Override
  public Marking fire(final String transitionId, final Marking marking)
      throws ReachabilityException {
    return fire(transitionIndex(transitionId), marking);
  }

  @Override
  public Marking fire(final int transitionIndex, final Marking marking)
      throws ReachabilityException {
    checkTransition(transitionIndex);
    checkMarking(marking);
    final int[] tokens = marking.tokens();
    if (!enabled(transitionIndex, tokens)) {
      throw new ReachabilityException(Code.TRANSITION_NOT_ENABLED,
          String.format("Transition %s is not enabled in marking %s",
              orderedTransitions.get(transitionIndex).getId(), marking));
    }
    final int[] next = tokens.clone();
    for (final int place : strictInputIndices[transitionIndex]) {
      next[place]--;
    }
    for (final int place : strictOutputIndices[transitionIndex]) {
      if (next[place] > 0) {
        throw new ReachabilityException(Code.UNSAFE_NET,
            String.format("Firing %s in marking %s puts a second token on place %s",
                orderedTransitions.get(transitionIndex).getId(), marking,
                orderedPlaces.get(place).getId()));
      }
      next[place]++;
    }
    return Marking.wrap(next);
  }

  @Override
  public List<String> enabledTransitions(final Marking marking) throws ReachabilityException {
    requireFinalized();
    checkMarking(marking);
    final List<String> enabled = new ArrayList<>();
    for (int index = 0; index < orderedTransitions.size(); index++) {
      if (enabled(index, marking.tokens())) {
        enabled.add(orderedTransitions.get(index).getId());
      }
    }
    return enabled;
  }

  @Override
  public boolean isDead(final Marking marking) throws ReachabilityException {
    requireFinalized();
    checkMarking(marking);
    for (int index = 0; index < orderedTransitions.size(); index++) {
      if (enabled(index, marking.tokens())) {
        return false;
      }
    }
    return true;
  }

  private boolean enabled(final int transitionIndex, final int[] tokens) {
    for (final int place : inputIndices[transitionIndex]) {
      if (tokens[place] < 1) {
        return false;
      }
    }
    return true;
  }

  private void mutable() throws ReachabilityException {
    if (finalized) {
      throw new ReachabilityException(Code.NET_ALREADY_FINALIZED);
    }
  }

  private void requireFinalized() throws ReachabilityException {
    if (!finalized) {
      throw new ReachabilityException(Code.NET_NOT_FINALIZED);
    }
  }

  private void checkTransition(final int transitionIndex) throws ReachabilityException {
    requireFinalized();
    if (transitionIndex < 0 || transitionIndex >= orderedTransitions.size()) {
      throw new ReachabilityException(Code.UNKNOWN_TRANSITION,
          "Net has no transition at index " + transitionIndex);
    }
  }

  private void checkMarking(final Marking marking) throws ReachabilityException {
    if (marking == null || marking.size() != orderedPlaces.size()) {
      throw new ReachabilityException(Code.INVALID_MARKING, String.format(
          "Marking %s does not fit a net with %d places", marking, orderedPlaces.size()));
    }
  }

  private static int[] toIndices(final TreeSet<String> placeIds,
      final Map<String, Integer> placeIndices) {
    final int[] indices = new int[placeIds.size()];
    int cursor = 0;
    for (final String placeId : placeIds) {
      indices[cursor++] = placeIndices.get(placeId);
    }
    Arrays.sort(indices);
    return indices;
  }

  private static int[] difference(final int[] sorted, final int[] excluded) {
    return Arrays.stream(sorted).filter(index -> Arrays.binarySearch(excluded, index) < 0)
        .toArray();
  }

  @Override
  public String toString() {
    return "PetriNet [places=" + placesTable.size() + ", transitions=" + transitionsTable.size()
        + ", arcs=" + arcs.size() + ", finalized=" + finalized + "]";
  }

}
