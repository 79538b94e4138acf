package com.github.reachability;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A 1-safe Place/Transition net and its firing semantics.
 *
 * Notes for users:<br>
 * 0a. correctness of the firing rule is the most important virtue of this net, everything else
 * (explicit and symbolic exploration, deadlock search, optimization) is built on top of it<br>
 * 0b. less boilerplate code is the next most important virtue, hence the builder<br>
 *
 * 1. a net is put together by adding places, transitions and arcs in any order as long as every
 * arc's endpoints are added before the arc itself<br>
 *
 * 2. {@link #finalizeStructure()} derives the canonical place order (sorted place ids), the
 * canonical transition order (sorted transition ids) and every transition's pre-set and post-set.
 * It is idempotent. After it ran the net is immutable and every marking query becomes legal;
 * before it ran every marking query fails with {@code NET_NOT_FINALIZED}<br>
 *
 * 3. markings are plain immutable vectors indexed by the canonical place order. The net never
 * keeps a "current" marking of its own, so a finalized net can be shared by as many explorers as
 * needed<br>
 *
 * 4. a place that is both input and output of a transition keeps its token when the transition
 * fires. A firing that would put a second token on a place is reported as {@code UNSAFE_NET}
 * instead of silently producing a non 1-safe marking<br>
 */
public interface PetriNet {

  ///// Construction API /////
  /**
   * Register a place. Fails with {@code DUPLICATE_NODE} if the id is already used by a place or a
   * transition. PNML declares node ids as XML IDs, unique across the whole document, and an arc
   * names its endpoints by id alone, so one namespace for both kinds keeps arcs unambiguous.
   */
  void addPlace(final Place place) throws ReachabilityException;

  /**
   * Register a transition. Fails with {@code DUPLICATE_NODE} if the id is already used by a place
   * or a transition, for the same document-wide id uniqueness PNML imposes on places.
   */
  void addTransition(final Transition transition) throws ReachabilityException;

  /**
   * Register a flow arc. Fails if an endpoint is unknown or if the arc does not alternate between
   * a place and a transition.
   */
  void addArc(final Arc arc) throws ReachabilityException;

  /**
   * Compute the canonical orderings and pre/post-set indices. Calling it again is a no-op.
   */
  void finalizeStructure();

  /**
   * Check if the net has been finalized.
   */
  boolean isFinalized();


  ///// Structure queries /////
  /**
   * Places in canonical order once finalized, in insertion order before that.
   */
  List<Place> getPlaces();

  /**
   * Transitions in canonical order once finalized, in insertion order before that.
   */
  List<Transition> getTransitions();

  List<Arc> getArcs();

  int placeCount();

  int transitionCount();

  /**
   * Position of the place in every marking vector of this net.
   */
  int placeIndex(final String placeId) throws ReachabilityException;

  /**
   * Position of the transition in the canonical transition order.
   */
  int transitionIndex(final String transitionId) throws ReachabilityException;

  /**
   * Pre-set of the transition at the given canonical index, as sorted place indices.
   */
  int[] inputPlaces(final int transitionIndex) throws ReachabilityException;

  /**
   * Post-set of the transition at the given canonical index, as sorted place indices.
   */
  int[] outputPlaces(final int transitionIndex) throws ReachabilityException;


  ///// Marking API /////
  /**
   * The vector of each place's configured initial token count in canonical place order.
   */
  Marking getInitialMarking() throws ReachabilityException;

  boolean isEnabled(final String transitionId, final Marking marking)
      throws ReachabilityException;

  boolean isEnabled(final int transitionIndex, final Marking marking)
      throws ReachabilityException;

  /**
   * Fire an enabled transition and return the successor marking. The given marking is left
   * untouched.
   */
  Marking fire(final String transitionId, final Marking marking) throws ReachabilityException;

  Marking fire(final int transitionIndex, final Marking marking) throws ReachabilityException;

  /**
   * Ids of all transitions enabled in the marking, in canonical transition order.
   */
  List<String> enabledTransitions(final Marking marking) throws ReachabilityException;

  /**
   * A marking is dead iff no transition is enabled in it.
   */
  boolean isDead(final Marking marking) throws ReachabilityException;

  /**
   * A simple builder to let users use fluent APIs to build nets. {@link #build()} hands back a
   * finalized net.
   */
  public final static class PetriNetBuilder {
    private final List<Place> places = new ArrayList<>();
    private final List<Transition> transitions = new ArrayList<>();
    private final List<Arc> arcs = new ArrayList<>();
    private ReachabilityException deferred;

    public static PetriNetBuilder newBuilder() {
      return new PetriNetBuilder();
    }

    public PetriNetBuilder place(final Place place) {
      this.places.add(place);
      return this;
    }

    public PetriNetBuilder place(final String id, final int initialTokens) {
      try {
        this.places.add(new Place(id, initialTokens));
      } catch (ReachabilityException problem) {
        defer(problem);
      }
      return this;
    }

    public PetriNetBuilder place(final String id, final String name, final int initialTokens) {
      try {
        this.places.add(new Place(id, Optional.ofNullable(name), initialTokens));
      } catch (ReachabilityException problem) {
        defer(problem);
      }
      return this;
    }

    public PetriNetBuilder transition(final Transition transition) {
      this.transitions.add(transition);
      return this;
    }

    public PetriNetBuilder transition(final String id) {
      try {
        this.transitions.add(new Transition(id));
      } catch (ReachabilityException problem) {
        defer(problem);
      }
      return this;
    }

    public PetriNetBuilder arc(final Arc arc) {
      this.arcs.add(arc);
      return this;
    }

    public PetriNetBuilder arc(final String source, final String target) {
      return arc(source, target, 1);
    }

    public PetriNetBuilder arc(final String source, final String target, final int weight) {
      try {
        this.arcs.add(new Arc(source, target, weight));
      } catch (ReachabilityException problem) {
        defer(problem);
      }
      return this;
    }

    /**
     * Shorthand for a transition together with its pre-set and post-set.
     */
    public PetriNetBuilder transition(final String id, final String[] inputs,
        final String[] outputs) {
      transition(id);
      for (final String input : inputs) {
        arc(input, id);
      }
      for (final String output : outputs) {
        arc(id, output);
      }
      return this;
    }

    public PetriNet build() throws ReachabilityException {
      if (deferred != null) {
        throw deferred;
      }
      final PetriNet net = new PetriNetImpl();
      for (final Place place : places) {
        net.addPlace(place);
      }
      for (final Transition transition : transitions) {
        net.addTransition(transition);
      }
      for (final Arc arc : arcs) {
        net.addArc(arc);
      }
      net.finalizeStructure();
      return net;
    }

    // the first construction problem wins, it is rethrown from build()
    private void defer(final ReachabilityException problem) {
      if (deferred == null) {
        deferred = problem;
      }
    }

    private PetriNetBuilder() {}
  }

}
