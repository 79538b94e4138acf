package com.github.reachability;

/**
 * This represents the order in which the explicit explorer visits markings. Both modes return the
 * same reachable set, only the visiting order and the ceiling policy differ.
 */
public enum SearchMode {
  // work queue, bounded by the configured state ceiling
  BREADTH_FIRST,
  // explicit stack instead of recursion, no ceiling
  DEPTH_FIRST;
}
