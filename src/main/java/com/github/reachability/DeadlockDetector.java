package com.github.reachability;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.reachability.ReachabilityException.Code;

/**
 * Finds a reachable marking in which no transition is enabled.
 *
 * Both representations report the canonically least deadlock: an explicit set is scanned in
 * its iteration order, a symbolic set is queried directly as {@code reached AND NOT enabled} and
 * the least satisfying assignment is decoded. An empty result means no reachable marking is
 * dead, which only holds as a claim about the net if the set handed in is complete.
 */
public final class DeadlockDetector {
  private static final Logger logger =
      LogManager.getLogger(DeadlockDetector.class.getSimpleName());

  private final PetriNet net;

  public DeadlockDetector(final PetriNet net) throws ReachabilityException {
    if (net == null || !net.isFinalized()) {
      throw new ReachabilityException(Code.NET_NOT_FINALIZED);
    }
    this.net = net;
  }

  public Optional<Marking> detect(final ReachableSet reachable) throws ReachabilityException {
    if (reachable == null) {
      throw new ReachabilityException(Code.INVALID_MARKING, "Reachable set cannot be null");
    }
    if (reachable.placeCount() != net.placeCount()) {
      throw new ReachabilityException(Code.INVALID_MARKING, String.format(
          "Set of %d-place markings does not fit a net with %d places", reachable.placeCount(),
          net.placeCount()));
    }
    final Optional<Marking> deadlock = reachable instanceof SymbolicReachableSet
        ? query((SymbolicReachableSet) reachable)
        : scan(reachable);
    if (deadlock.isPresent()) {
      logger.info("Deadlock found at " + deadlock.get());
    } else {
      logger.info("No deadlock among " + reachable.count() + " reachable markings");
    }
    return deadlock;
  }

  /**
   * Every reachable marking that is a deadlock, in canonical order.
   */
  public List<Marking> detectAll(final ReachableSet reachable)
      throws ReachabilityException {
    final List<Marking> deadlocks = new ArrayList<>();
    for (final Marking marking : reachable) {
      if (net.isDead(marking)) {
        deadlocks.add(marking);
      }
    }
    return deadlocks;
  }

  private Optional<Marking> scan(final ReachableSet reachable) throws ReachabilityException {
    for (final Marking marking : reachable) {
      if (net.isDead(marking)) {
        return Optional.of(marking);
      }
    }
    return Optional.empty();
  }

  private Optional<Marking> query(final SymbolicReachableSet reachable)
      throws ReachabilityException {
    final BddManager manager = reachable.getFunction().getManager();
    Bdd enabled = manager.constant(false);
    for (int transition = 0; transition < net.transitionCount(); transition++) {
      enabled = enabled.or(SymbolicEngine.enabling(manager, net, transition));
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Enabling predicate has " + enabled.nodeCount() + " nodes");
    }
    return reachable.first(enabled.not());
  }

}
