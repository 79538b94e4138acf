package com.github.reachability;

/**
 * A marking attaining the extremum of a linear objective together with that value.
 */
public final class OptimizationResult {
  private final Marking marking;
  private final double value;
  private final Objective objective;

  OptimizationResult(final Marking marking, final double value, final Objective objective) {
    this.marking = marking;
    this.value = value;
    this.objective = objective;
  }

  public Marking getMarking() {
    return marking;
  }

  public double getValue() {
    return value;
  }

  public Objective getObjective() {
    return objective;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((marking == null) ? 0 : marking.hashCode());
    long temp = Double.doubleToLongBits(value);
    result = prime * result + (int) (temp ^ (temp >>> 32));
    result = prime * result + ((objective == null) ? 0 : objective.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof OptimizationResult)) {
      return false;
    }
    OptimizationResult other = (OptimizationResult) obj;
    return objective == other.objective && marking.equals(other.marking)
        && Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
  }

  @Override
  public String toString() {
    return "OptimizationResult [objective=" + objective + ", marking=" + marking + ", value="
        + value + "]";
  }
}
