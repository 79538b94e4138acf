package com.github.reachability;

import java.util.Optional;

import com.github.reachability.ReachabilityException.Code;

/**
 * Immutable metadata about a transition. Its pre-set and post-set are not held here, they are
 * derived by the owning net when it is finalized so that the same transition metadata can be
 * wired into different nets.
 */
public final class Transition {
  private final String id;
  private final String name;

  public Transition(final String id, final Optional<String> name) throws ReachabilityException {
    if (id == null || id.trim().isEmpty()) {
      throw new ReachabilityException(Code.INVALID_TRANSITION);
    }
    this.id = id.trim();
    if (name != null && name.isPresent() && !name.get().trim().isEmpty()) {
      this.name = name.get().trim();
    } else {
      this.name = this.id;
    }
  }

  public Transition(final String id) throws ReachabilityException {
    this(id, Optional.empty());
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    Transition other = (Transition) obj;
    return id.equals(other.id);
  }

  @Override
  public String toString() {
    return "Transition [id=" + id + ", name=" + name + "]";
  }
}
