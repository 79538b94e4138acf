package com.github.reachability;

import java.util.Objects;

import com.github.reachability.ReachabilityException.Code;

/**
 * A directed flow arc between two node ids. Whether the endpoints resolve and alternate between
 * places and transitions is checked by the net the arc is added to.
 *
 * The weight is kept as written in the net description. 1-safe semantics only look at whether an
 * arc exists, so weights above 1 carry no additional meaning during firing.
 */
public final class Arc {
  private final String source;
  private final String target;
  private final int weight;

  public Arc(final String source, final String target, final int weight)
      throws ReachabilityException {
    if (source == null || source.trim().isEmpty() || target == null
        || target.trim().isEmpty()) {
      throw new ReachabilityException(Code.ILLEGAL_ARC, "Arc endpoints cannot be blank");
    }
    if (weight < 1) {
      throw new ReachabilityException(Code.ILLEGAL_ARC,
          String.format("Arc %s->%s has non-positive weight %d", source, target, weight));
    }
    this.source = source.trim();
    this.target = target.trim();
    this.weight = weight;
  }

  public Arc(final String source, final String target) throws ReachabilityException {
    this(source, target, 1);
  }

  public String getSource() {
    return source;
  }

  public String getTarget() {
    return target;
  }

  public int getWeight() {
    return weight;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Arc)) {
      return false;
    }
    Arc arc = (Arc) o;
    return weight == arc.weight && source.equals(arc.source) && target.equals(arc.target);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, weight);
  }

  @Override
  public String toString() {
    return "Arc [" + source + "->" + target + ", weight=" + weight + "]";
  }
}
