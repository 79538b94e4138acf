package com.github.reachability;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A reachable set held as explicit marking values.
 */
public final class ExplicitReachableSet implements ReachableSet {
  private final int placeCount;
  private final SortedSet<Marking> markings;
  private final ExplorationStatistics statistics;

  ExplicitReachableSet(final int placeCount, final Collection<Marking> markings,
      final ExplorationStatistics statistics) {
    this.placeCount = placeCount;
    this.markings = Collections.unmodifiableSortedSet(new TreeSet<>(markings));
    this.statistics = statistics;
  }

  @Override
  public int placeCount() {
    return placeCount;
  }

  @Override
  public long size() {
    return markings.size();
  }

  @Override
  public BigInteger count() {
    return BigInteger.valueOf(markings.size());
  }

  @Override
  public boolean isEmpty() {
    return markings.isEmpty();
  }

  @Override
  public boolean contains(final Marking marking) {
    return marking != null && marking.size() == placeCount && markings.contains(marking);
  }

  @Override
  public SortedSet<Marking> markings() {
    return markings;
  }

  @Override
  public Iterator<Marking> iterator() {
    return markings.iterator();
  }

  @Override
  public ExplorationStatistics getStatistics() {
    return statistics;
  }

  @Override
  public String toString() {
    return "ExplicitReachableSet [placeCount=" + placeCount + ", size=" + markings.size() + "]";
  }
}
