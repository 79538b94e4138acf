package com.github.reachability;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.SortedSet;

/**
 * The set of markings an exploration found reachable, independent of how it is represented.
 * Iteration always follows the canonical marking order so that every consumer sees the markings
 * in the same sequence regardless of the representation or of the search that produced them.
 */
public interface ReachableSet extends Iterable<Marking> {

  /**
   * Length of every marking in the set.
   */
  int placeCount();

  /**
   * Number of distinct markings, saturating at {@link Long#MAX_VALUE}. Use {@link #count()} for
   * sets that may be larger.
   */
  long size();

  /**
   * Exact number of distinct markings.
   */
  BigInteger count();

  boolean isEmpty();

  boolean contains(final Marking marking);

  /**
   * All markings as explicit values, in canonical order.
   */
  SortedSet<Marking> markings();

  /**
   * Markings in canonical order.
   */
  @Override
  Iterator<Marking> iterator();

  /**
   * Statistics of the run that produced this set.
   */
  ExplorationStatistics getStatistics();

}
