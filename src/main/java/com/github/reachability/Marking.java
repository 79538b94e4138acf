package com.github.reachability;

import java.util.Arrays;
import java.util.BitSet;

/**
 * An immutable token vector, one entry per place in the canonical place order of a finalized net.
 * Firing never mutates a marking, it always produces a new one.
 *
 * Markings compare lexicographically entry by entry which is the canonical iteration order used
 * wherever results have to be reproducible (deadlock witnesses, optimizer tie-breaks, printing).
 */
public final class Marking implements Comparable<Marking> {
  private final int[] tokens;
  // lazily computed, markings are hashed heavily by the explorers
  private int hash;

  private Marking(final int[] tokens) {
    this.tokens = tokens;
  }

  public static Marking of(final int... tokens) {
    if (tokens == null) {
      throw new IllegalArgumentException("tokens cannot be null");
    }
    return new Marking(tokens.clone());
  }

  /**
   * Builds a 0/1 marking of the given length from the set bits, bit i standing for place i.
   */
  public static Marking fromBits(final BitSet bits, final int length) {
    final int[] tokens = new int[length];
    for (int index = bits.nextSetBit(0); index >= 0
        && index < length; index = bits.nextSetBit(index + 1)) {
      tokens[index] = 1;
    }
    return new Marking(tokens);
  }

  // used by the net to hand over a freshly computed vector without another copy
  static Marking wrap(final int[] tokens) {
    return new Marking(tokens);
  }

  public int size() {
    return tokens.length;
  }

  public int get(final int placeIndex) {
    return tokens[placeIndex];
  }

  public boolean isMarked(final int placeIndex) {
    return tokens[placeIndex] > 0;
  }

  public int[] toArray() {
    return tokens.clone();
  }

  /**
   * Indices of the places holding at least one token.
   */
  public BitSet markedPlaces() {
    final BitSet bits = new BitSet(tokens.length);
    for (int index = 0; index < tokens.length; index++) {
      if (tokens[index] > 0) {
        bits.set(index);
      }
    }
    return bits;
  }

  int[] tokens() {
    return tokens;
  }

  @Override
  public int compareTo(final Marking other) {
    return Arrays.compare(tokens, other.tokens);
  }

  @Override
  public int hashCode() {
    int result = hash;
    if (result == 0) {
      result = Arrays.hashCode(tokens);
      hash = result;
    }
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return Arrays.equals(tokens, ((Marking) obj).tokens);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("(");
    for (int index = 0; index < tokens.length; index++) {
      if (index > 0) {
        builder.append(',');
      }
      builder.append(tokens[index]);
    }
    return builder.append(')').toString();
  }
}
