package com.github.reachability;

/**
 * This represents how the symbolic engine applies the transition relation during image
 * computation.
 */
public enum RelationMode {
  // one global relation, the disjunction of every transition's relation
  MONOLITHIC,
  // one relation per transition, their images are OR-ed together
  PARTITIONED;
}
