package com.github.reachability;

import com.github.reachability.PetriNet.PetriNetBuilder;

/**
 * Small nets with known state spaces shared by the tests and the benchmark.
 */
final class Nets {

  /**
   * p1 -> t1 -> p2 with a token on p1: reaches (1,0) and (0,1), the latter is dead.
   */
  static PetriNet simple() throws ReachabilityException {
    return PetriNetBuilder.newBuilder().place("p1", 1).place("p2", 0)
        .transition("t1", new String[] {"p1"}, new String[] {"p2"}).build();
  }

  /**
   * A token moving down a line of {@code length + 1} places, dead at the last one.
   */
  static PetriNet chain(final int length) throws ReachabilityException {
    final PetriNetBuilder builder = PetriNetBuilder.newBuilder();
    for (int i = 0; i <= length; i++) {
      builder.place(id("p", i), i == 0 ? 1 : 0);
    }
    for (int i = 0; i < length; i++) {
      builder.transition(id("t", i), new String[] {id("p", i)}, new String[] {id("p", i + 1)});
    }
    return builder.build();
  }

  /**
   * A token circulating over {@code size} places, never dead.
   */
  static PetriNet ring(final int size) throws ReachabilityException {
    final PetriNetBuilder builder = PetriNetBuilder.newBuilder();
    for (int i = 0; i < size; i++) {
      builder.place(id("p", i), i == 0 ? 1 : 0);
    }
    for (int i = 0; i < size; i++) {
      builder.transition(id("t", i), new String[] {id("p", i)},
          new String[] {id("p", (i + 1) % size)});
    }
    return builder.build();
  }

  /**
   * {@code count} independent on/off switches, 2^count reachable markings and no deadlock.
   */
  static PetriNet switches(final int count) throws ReachabilityException {
    final PetriNetBuilder builder = PetriNetBuilder.newBuilder();
    for (int i = 0; i < count; i++) {
      builder.place(id("off", i), 1).place(id("on", i), 0);
      builder.transition(id("up", i), new String[] {id("off", i)}, new String[] {id("on", i)});
      builder.transition(id("down", i), new String[] {id("on", i)}, new String[] {id("off", i)});
    }
    return builder.build();
  }

  /**
   * Independent on/off switches whose two places sort next to each other, {@code sNNa} off and
   * {@code sNNb} on, so the variable order keeps every switch local. 2^count reachable markings.
   */
  static PetriNet pairedSwitches(final int count) throws ReachabilityException {
    final PetriNetBuilder builder = PetriNetBuilder.newBuilder();
    for (int i = 0; i < count; i++) {
      final String off = id("s", i) + "a";
      final String on = id("s", i) + "b";
      builder.place(off, 1).place(on, 0);
      builder.transition(id("up", i), new String[] {off}, new String[] {on});
      builder.transition(id("down", i), new String[] {on}, new String[] {off});
    }
    return builder.build();
  }

  /**
   * Dining philosophers picking up the left fork first; everybody holding a left fork is the
   * only deadlock.
   */
  static PetriNet philosophers(final int count) throws ReachabilityException {
    final PetriNetBuilder builder = PetriNetBuilder.newBuilder();
    for (int i = 0; i < count; i++) {
      builder.place(id("think", i), 1).place(id("fork", i), 1).place(id("left", i), 0)
          .place(id("eat", i), 0);
    }
    for (int i = 0; i < count; i++) {
      final String right = id("fork", (i + 1) % count);
      builder.transition(id("takeLeft", i), new String[] {id("think", i), id("fork", i)},
          new String[] {id("left", i)});
      builder.transition(id("takeRight", i), new String[] {id("left", i), right},
          new String[] {id("eat", i)});
      builder.transition(id("release", i), new String[] {id("eat", i)},
          new String[] {id("think", i), id("fork", i), right});
    }
    return builder.build();
  }

  /**
   * t reads p through a self-loop and moves the token from q to r.
   */
  static PetriNet selfLoop() throws ReachabilityException {
    return PetriNetBuilder.newBuilder().place("p", 1).place("q", 1).place("r", 0)
        .transition("t", new String[] {"p", "q"}, new String[] {"p", "r"}).build();
  }

  /**
   * t moves the token of p1 onto p2 which already holds one.
   */
  static PetriNet unsafe() throws ReachabilityException {
    return PetriNetBuilder.newBuilder().place("p1", 1).place("p2", 1)
        .transition("t", new String[] {"p1"}, new String[] {"p2"}).build();
  }

  private static String id(final String prefix, final int index) {
    return String.format("%s%02d", prefix, index);
  }

  private Nets() {}
}
