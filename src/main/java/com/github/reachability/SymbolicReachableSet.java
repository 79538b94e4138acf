package com.github.reachability;

import java.math.BigInteger;
import java.util.BitSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A reachable set held as a Boolean function over the current-state variables, one per place.
 * Extraction decodes every satisfying assignment into a marking, bit of place i set iff place i
 * holds a token.
 */
public final class SymbolicReachableSet implements ReachableSet {
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private final Bdd function;
  private final int placeCount;
  private final BitSet currentVariables;
  private final ExplorationStatistics statistics;
  // decoded on first use
  private SortedSet<Marking> extracted;

  SymbolicReachableSet(final Bdd function, final int placeCount,
      final ExplorationStatistics statistics) {
    this.function = function;
    this.placeCount = placeCount;
    this.currentVariables = SymbolicEngine.currentVariables(placeCount);
    this.statistics = statistics;
  }

  /**
   * The characteristic function of the set.
   */
  public Bdd getFunction() {
    return function;
  }

  @Override
  public int placeCount() {
    return placeCount;
  }

  @Override
  public long size() {
    return count().min(LONG_MAX).longValue();
  }

  @Override
  public BigInteger count() {
    return function.satCount(currentVariables);
  }

  @Override
  public boolean isEmpty() {
    return function.isFalse();
  }

  @Override
  public boolean contains(final Marking marking) {
    if (marking == null || marking.size() != placeCount) {
      return false;
    }
    for (int place = 0; place < placeCount; place++) {
      if (marking.get(place) > 1) {
        return false;
      }
    }
    return function.evaluate(SymbolicEngine.encodeAssignment(marking));
  }

  @Override
  public synchronized SortedSet<Marking> markings() {
    if (extracted == null) {
      final SortedSet<Marking> markings = new TreeSet<>();
      function.forEachSolution(currentVariables, assignment -> markings.add(decode(assignment)));
      extracted = Collections.unmodifiableSortedSet(markings);
    }
    return extracted;
  }

  @Override
  public Iterator<Marking> iterator() {
    return markings().iterator();
  }

  /**
   * Canonically least marking satisfying both this set and the given restriction, straight off
   * the diagram without extracting the whole set.
   */
  public Optional<Marking> first(final Bdd restriction) throws ReachabilityException {
    final Optional<BitSet> solution = function.and(restriction).firstSolution(currentVariables);
    return solution.map(this::decode);
  }

  @Override
  public ExplorationStatistics getStatistics() {
    return statistics;
  }

  private Marking decode(final BitSet assignment) {
    final int[] tokens = new int[placeCount];
    for (int place = 0; place < placeCount; place++) {
      tokens[place] = assignment.get(SymbolicEngine.currentVariable(place)) ? 1 : 0;
    }
    return Marking.wrap(tokens);
  }

  @Override
  public String toString() {
    return "SymbolicReachableSet [placeCount=" + placeCount + ", function=" + function + "]";
  }
}
