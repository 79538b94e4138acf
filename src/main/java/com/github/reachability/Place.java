package com.github.reachability;

import java.util.Optional;

import com.github.reachability.ReachabilityException.Code;

/**
 * This object represents immutable metadata about a place. Places are identified by their id
 * alone; the display name is informational and defaults to the id.
 */
public final class Place {
  private final String id;
  private final String name;
  private final int initialTokens;

  /**
   * Place name is optional. For 1-safe nets the initial token count is either 0 or 1.
   */
  public Place(final String id, final Optional<String> name, final int initialTokens)
      throws ReachabilityException {
    if (id == null || id.trim().isEmpty()) {
      throw new ReachabilityException(Code.INVALID_PLACE, "Place id cannot be blank");
    }
    if (initialTokens < 0 || initialTokens > 1) {
      throw new ReachabilityException(Code.INVALID_PLACE,
          "Place " + id + " has initial token count " + initialTokens + ", expected 0 or 1");
    }
    this.id = id.trim();
    if (name != null && name.isPresent() && !name.get().trim().isEmpty()) {
      this.name = name.get().trim();
    } else {
      this.name = this.id;
    }
    this.initialTokens = initialTokens;
  }

  public Place(final String id, final int initialTokens) throws ReachabilityException {
    this(id, Optional.empty(), initialTokens);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public int getInitialTokens() {
    return initialTokens;
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
    Place other = (Place) obj;
    return id.equals(other.id);
  }

  @Override
  public String toString() {
    return "Place [id=" + id + ", name=" + name + ", initialTokens=" + initialTokens + "]";
  }
}
