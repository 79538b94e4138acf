package com.github.reachability;

import java.math.BigInteger;
import java.util.BitSet;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.IntUnaryOperator;

/**
 * Opaque, immutable handle to a Boolean function held by a {@link BddManager}. Every operation
 * returns a new handle and leaves its operands untouched. Two handles of the same manager are
 * equal iff they denote the same function.
 */
public final class Bdd {
  private final BddManager manager;
  private final int node;

  Bdd(final BddManager manager, final int node) {
    this.manager = manager;
    this.node = node;
  }

  public BddManager getManager() {
    return manager;
  }

  public Bdd and(final Bdd other) throws ReachabilityException {
    manager.checkOwner(other);
    return manager.wrap(manager.and(node, other.node));
  }

  public Bdd or(final Bdd other) throws ReachabilityException {
    manager.checkOwner(other);
    return manager.wrap(manager.or(node, other.node));
  }

  /**
   * this AND NOT other.
   */
  public Bdd andNot(final Bdd other) throws ReachabilityException {
    manager.checkOwner(other);
    return manager.wrap(manager.diff(node, other.node));
  }

  public Bdd not() throws ReachabilityException {
    return manager.wrap(manager.not(node));
  }

  /**
   * Cofactor with the variable fixed to the given value.
   */
  public Bdd restrict(final int variable, final boolean value) throws ReachabilityException {
    return manager.wrap(manager.restrict(node, variable, value));
  }

  /**
   * Eliminates one variable: restrict(v, false) OR restrict(v, true).
   */
  public Bdd exists(final int variable) throws ReachabilityException {
    return restrict(variable, false).or(restrict(variable, true));
  }

  /**
   * Eliminates every variable of the set, same result as eliminating them one at a time.
   */
  public Bdd exists(final BitSet variables) throws ReachabilityException {
    return manager.wrap(manager.exists(node, variables));
  }

  /**
   * Renames the support variables through a mapping that has to be injective on the support.
   */
  public Bdd rename(final IntUnaryOperator mapping) throws ReachabilityException {
    return manager.wrap(manager.rename(node, mapping));
  }

  public boolean isTrue() {
    return node == BddManager.TRUE;
  }

  public boolean isFalse() {
    return node == BddManager.FALSE;
  }

  /**
   * True iff every satisfying assignment of this function also satisfies the other one.
   */
  public boolean implies(final Bdd other) throws ReachabilityException {
    return andNot(other).isFalse();
  }

  public boolean evaluate(final BitSet assignment) {
    return manager.evaluate(node, assignment);
  }

  /**
   * Variables this function actually depends on.
   */
  public BitSet support() {
    return manager.support(node);
  }

  /**
   * Number of satisfying assignments over the given variables, which must cover the support.
   */
  public BigInteger satCount(final BitSet variables) {
    return manager.satCount(node, variables);
  }

  /**
   * Every satisfying assignment over the given variables exactly once, lexicographically ordered
   * with false before true.
   */
  public void forEachSolution(final BitSet variables, final Consumer<BitSet> action) {
    manager.forEachSolution(node, variables, action);
  }

  /**
   * The lexicographically least satisfying assignment over the given variables.
   */
  public Optional<BitSet> firstSolution(final BitSet variables) {
    return Optional.ofNullable(manager.firstSolution(node, variables));
  }

  /**
   * Number of decision diagram nodes of this function, terminals included.
   */
  public int nodeCount() {
    return manager.size(node);
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(manager) + node;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Bdd other = (Bdd) obj;
    return manager == other.manager && node == other.node;
  }

  @Override
  public String toString() {
    return "Bdd [node=" + node + ", nodes=" + nodeCount() + "]";
  }
}
