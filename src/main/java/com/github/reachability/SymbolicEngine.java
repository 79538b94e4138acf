package com.github.reachability;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.reachability.ReachabilityException.Code;

/**
 * Symbolic reachability: markings and the transition relation are Boolean functions held in a
 * decision diagram and the reachable set is the least fixed point of the image operator.
 *
 * Notes for users:<br>
 * 1. place i owns two variables, {@code 2i} for the current state and {@code 2i+1} for the next
 * state. Interleaving keeps every transition relation linear in the number of places<br>
 *
 * 2. a transition's relation is its enabling condition over current variables AND one next-state
 * constraint per place: strict inputs become false, strict outputs and self-loop places become
 * true, every other place keeps its value. The global relation is the disjunction of all of them<br>
 *
 * 3. image(S) = rename(exists current. S AND R), the rename maps every next-state variable onto
 * its current-state twin and is exact<br>
 *
 * 4. the fixed point starts from the initial marking and stops as soon as the image adds nothing
 * new. Not converging within {@link AnalysisConfiguration#getIterationLimit()} rounds fails the run
 * with {@code ITERATION_LIMIT_EXCEEDED}. A reached marking enabling a transition whose strict
 * output is already marked fails it with {@code UNSAFE_NET}, exactly where explicit firing would<br>
 *
 * 5. every run creates its own {@link BddManager}; the returned set keeps it alive for extraction<br>
 *
 * @author gaurav
 */
public final class SymbolicEngine {
  private static final Logger logger = LogManager.getLogger(SymbolicEngine.class.getSimpleName());

  private final PetriNet net;
  private final AnalysisConfiguration config;

  public SymbolicEngine(final PetriNet net, final AnalysisConfiguration config)
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

  public SymbolicEngine(final PetriNet net) throws ReachabilityException {
    this(net, AnalysisConfiguration.defaults());
  }

  public SymbolicReachableSet explore() throws ReachabilityException {
    final ExplorationStatistics statistics = new ExplorationStatistics("symbolic");
    final String runId = statistics.getRunId();
    final int places = net.placeCount();
    final int iterationLimit = config.getIterationLimit();
    final BddManager manager = new BddManager(2 * places, config.getNodeLimit());
    logInfo(runId, String.format("Starting symbolic exploration, %d places, %s relation, "
        + "iteration ceiling %d", places, config.getRelationMode(), iterationLimit));

    final BitSet current = currentVariables(places);
    final List<Bdd> relations = new ArrayList<>(net.transitionCount());
    final List<Bdd> unsafeGuards = new ArrayList<>(net.transitionCount());
    Bdd globalRelation = manager.constant(false);
    for (int transition = 0; transition < net.transitionCount(); transition++) {
      final Bdd relation = transitionRelation(manager, transition);
      relations.add(relation);
      unsafeGuards.add(unsafeGuard(manager, transition));
      if (config.getRelationMode() == RelationMode.MONOLITHIC) {
        globalRelation = globalRelation.or(relation);
      }
    }
    if (config.getRelationMode() == RelationMode.MONOLITHIC) {
      logDebug(runId, "Global transition relation has " + globalRelation.nodeCount() + " nodes");
    }

    Bdd reached = encode(manager, net.getInitialMarking(), false);
    int iteration = 0;
    while (true) {
      iteration++;
      if (iteration > iterationLimit) {
        statistics.iterations = iteration - 1;
        statistics.stop();
        logWarning(runId, "Iteration ceiling of " + iterationLimit + " reached after "
            + statistics.getElapsedMillis() + " millis");
        throw new ReachabilityException(Code.ITERATION_LIMIT_EXCEEDED,
            "Iteration limit exceeded (" + iterationLimit
                + "). Net may be unbounded or have a very large state space.");
      }
      checkSafe(reached, unsafeGuards, current);
      final Bdd image = config.getRelationMode() == RelationMode.MONOLITHIC
          ? image(reached, globalRelation, current)
          : partitionedImage(reached, relations, current);
      if (image.implies(reached)) {
        break;
      }
      reached = reached.or(image);
      logDebug(runId, String.format("iteration:%d, reached nodes:%d, arena nodes:%d", iteration,
          reached.nodeCount(), manager.getNodeCount()));
    }

    statistics.iterations = iteration;
    statistics.diagramNodes = manager.getNodeCount();
    final SymbolicReachableSet result = new SymbolicReachableSet(reached, places, statistics);
    statistics.markings = result.count();
    statistics.stop();
    logInfo(runId, String.format("Fixed point after %d iterations, %s reachable markings, "
        + "%d diagram nodes, %d millis", iteration, statistics.markings,
        statistics.diagramNodes, statistics.getElapsedMillis()));
    return result;
  }

  /**
   * Builds the characteristic function of an explicit set of markings, the inverse of
   * {@link SymbolicReachableSet#markings()}.
   */
  public SymbolicReachableSet encode(final ReachableSet markings) throws ReachabilityException {
    if (markings.placeCount() != net.placeCount()) {
      throw new ReachabilityException(Code.INVALID_MARKING, String.format(
          "Set of %d-place markings does not fit a net with %d places", markings.placeCount(),
          net.placeCount()));
    }
    final ExplorationStatistics statistics = new ExplorationStatistics("symbolic-encode");
    final BddManager manager = new BddManager(2 * net.placeCount(), config.getNodeLimit());
    Bdd function = manager.constant(false);
    for (final Marking marking : markings) {
      function = function.or(encode(manager, marking, false));
    }
    statistics.diagramNodes = manager.getNodeCount();
    final SymbolicReachableSet result =
        new SymbolicReachableSet(function, net.placeCount(), statistics);
    statistics.markings = result.count();
    statistics.stop();
    logInfo(statistics.getRunId(), "Encoded " + statistics.markings + " markings into "
        + function.nodeCount() + " nodes");
    return result;
  }

  /**
   * The minterm of a 0/1 marking over current or next-state variables.
   */
  static Bdd encode(final BddManager manager, final Marking marking, final boolean next)
      throws ReachabilityException {
    final int places = marking.size();
    final int[] variables = new int[places];
    final boolean[] values = new boolean[places];
    for (int place = 0; place < places; place++) {
      if (marking.get(place) > 1) {
        throw new ReachabilityException(Code.UNSAFE_NET,
            "Marking " + marking + " is not a 1-safe marking");
      }
      variables[place] = next ? nextVariable(place) : currentVariable(place);
      values[place] = marking.isMarked(place);
    }
    return manager.cube(variables, values);
  }

  Bdd transitionRelation(final BddManager manager, final int transition)
      throws ReachabilityException {
    final int places = net.placeCount();
    final boolean[] input = new boolean[places];
    final boolean[] output = new boolean[places];
    for (final int place : net.inputPlaces(transition)) {
      input[place] = true;
    }
    for (final int place : net.outputPlaces(transition)) {
      output[place] = true;
    }

    final List<Integer> literalVariables = new ArrayList<>();
    final List<Boolean> literalValues = new ArrayList<>();
    final List<Integer> framePlaces = new ArrayList<>();
    for (int place = 0; place < places; place++) {
      if (input[place]) {
        literalVariables.add(currentVariable(place));
        literalValues.add(true);
      }
      if (input[place] && !output[place]) {
        literalVariables.add(nextVariable(place));
        literalValues.add(false);
      } else if (output[place]) {
        literalVariables.add(nextVariable(place));
        literalValues.add(true);
      } else {
        framePlaces.add(place);
      }
    }
    final int[] variables = new int[literalVariables.size()];
    final boolean[] values = new boolean[literalValues.size()];
    for (int index = 0; index < variables.length; index++) {
      variables[index] = literalVariables.get(index);
      values[index] = literalValues.get(index);
    }
    Bdd relation = manager.cube(variables, values);
    for (final int place : framePlaces) {
      relation = relation.and(unchanged(manager, place));
    }
    return relation;
  }

  /**
   * Enabling condition of the transition over current variables.
   */
  static Bdd enabling(final BddManager manager, final PetriNet net, final int transition)
      throws ReachabilityException {
    final int[] inputs = net.inputPlaces(transition);
    final int[] variables = new int[inputs.length];
    final boolean[] values = new boolean[inputs.length];
    for (int index = 0; index < inputs.length; index++) {
      variables[index] = currentVariable(inputs[index]);
      values[index] = true;
    }
    return manager.cube(variables, values);
  }

  /**
   * Markings in which the transition is enabled while one of its strict outputs already holds a
   * token.
   */
  private Bdd unsafeGuard(final BddManager manager, final int transition)
      throws ReachabilityException {
    final int[] inputs = net.inputPlaces(transition);
    Bdd occupied = manager.constant(false);
    for (final int place : net.outputPlaces(transition)) {
      if (Arrays.binarySearch(inputs, place) < 0) {
        occupied = occupied.or(manager.variable(currentVariable(place)));
      }
    }
    return enabling(manager, net, transition).and(occupied);
  }

  private void checkSafe(final Bdd reached, final List<Bdd> unsafeGuards, final BitSet current)
      throws ReachabilityException {
    for (int transition = 0; transition < unsafeGuards.size(); transition++) {
      final Bdd offending = reached.and(unsafeGuards.get(transition));
      if (!offending.isFalse()) {
        final Optional<BitSet> witness = offending.firstSolution(current);
        throw new ReachabilityException(Code.UNSAFE_NET, String.format(
            "Firing %s in reachable marking %s puts a second token on one of its output places",
            net.getTransitions().get(transition).getId(),
            witness.map(bits -> decode(bits, net.placeCount())).orElse(null)));
      }
    }
  }

  private static Bdd image(final Bdd states, final Bdd relation, final BitSet current)
      throws ReachabilityException {
    return states.and(relation).exists(current).rename(SymbolicEngine::toCurrent);
  }

  private static Bdd partitionedImage(final Bdd states, final List<Bdd> relations,
      final BitSet current) throws ReachabilityException {
    Bdd image = states.getManager().constant(false);
    for (final Bdd relation : relations) {
      image = image.or(image(states, relation, current));
    }
    return image;
  }

  private static Bdd unchanged(final BddManager manager, final int place)
      throws ReachabilityException {
    final int[] variables = {currentVariable(place), nextVariable(place)};
    return manager.cube(variables, new boolean[] {true, true})
        .or(manager.cube(variables, new boolean[] {false, false}));
  }

  static int currentVariable(final int place) {
    return 2 * place;
  }

  static int nextVariable(final int place) {
    return 2 * place + 1;
  }

  private static int toCurrent(final int variable) {
    return variable & ~1;
  }

  static BitSet currentVariables(final int places) {
    final BitSet variables = new BitSet(2 * places);
    for (int place = 0; place < places; place++) {
      variables.set(currentVariable(place));
    }
    return variables;
  }

  static BitSet encodeAssignment(final Marking marking) {
    final BitSet assignment = new BitSet(2 * marking.size());
    for (int place = 0; place < marking.size(); place++) {
      if (marking.isMarked(place)) {
        assignment.set(currentVariable(place));
      }
    }
    return assignment;
  }

  private static Marking decode(final BitSet assignment, final int places) {
    final int[] tokens = new int[places];
    for (int place = 0; place < places; place++) {
      tokens[place] = assignment.get(currentVariable(place)) ? 1 : 0;
    }
    return Marking.wrap(tokens);
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
