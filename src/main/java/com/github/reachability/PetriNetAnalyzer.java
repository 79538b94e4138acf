package com.github.reachability;

import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.reachability.AnalysisConfiguration.AnalysisConfigurationBuilder;
import com.github.reachability.ReachabilityException.Code;

/**
 * Command line entry point: parses a PNML file and runs the requested analyses, printing a human
 * readable summary.
 *
 * Exit status is 0 on success, 1 when the arguments or the input file are unusable and 2 when an
 * analysis fails, e.g. because a ceiling was hit or the net turned out not to be 1-safe. The
 * {@code all} task carries on past an explicit state ceiling but still exits with 2.
 */
public final class PetriNetAnalyzer {
  private static final Logger logger =
      LogManager.getLogger(PetriNetAnalyzer.class.getSimpleName());

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_FAILURE = 2;

  static final int PRINT_LIMIT = 20;
  private static final String RULE =
      "======================================================================";

  private final PrintStream out;
  private final PrintStream err;

  PetriNetAnalyzer(final PrintStream out, final PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(final String[] args) {
    System.exit(new PetriNetAnalyzer(System.out, System.err).run(args));
  }

  int run(final String[] args) {
    final Options options;
    try {
      options = Options.parse(args);
    } catch (ReachabilityException usageProblem) {
      err.println("Error: " + usageProblem.getMessage());
      err.println(usage());
      return EXIT_USAGE;
    }
    if (!Files.isRegularFile(options.file)) {
      err.println("Error: File '" + options.file + "' not found");
      return EXIT_USAGE;
    }

    final PetriNet net;
    final AnalysisConfiguration config;
    try {
      net = new PnmlParser().parse(options.file);
      final AnalysisConfigurationBuilder builder = AnalysisConfigurationBuilder.newBuilder();
      if (options.stateLimit != null) {
        builder.stateLimit(options.stateLimit);
      }
      if (options.iterationLimit != null) {
        builder.iterationLimit(options.iterationLimit);
      }
      config = builder.build();
      if (options.weights != null && options.weights.length != net.placeCount()) {
        throw new ReachabilityException(Code.INVALID_WEIGHTS,
            String.format("Weight vector length (%d) must match number of places (%d)",
                options.weights.length, net.placeCount()));
      }
    } catch (ReachabilityException inputProblem) {
      err.println("Error: " + inputProblem.getMessage());
      return EXIT_USAGE;
    }

    boolean ceilingHit = false;
    try {
      switch (options.task) {
        case ALL:
          ceilingHit = runAll(options, net, config);
          break;
        case EXPLICIT:
          printExplicit(new ExplicitExplorer(net, config).explore(), net);
          break;
        case SYMBOLIC:
          printSymbolic(new SymbolicEngine(net, config).explore(), null);
          break;
        case DEADLOCK:
          printDeadlock(net, new SymbolicEngine(net, config).explore());
          break;
        case OPTIMIZE:
          printOptimum(net, new SymbolicEngine(net, config).explore(), options);
          break;
        default:
          throw new ReachabilityException(Code.INVALID_CONFIGURATION,
              "Unsupported task " + options.task);
      }
    } catch (ReachabilityException analysisProblem) {
      logger.error("Analysis failed", analysisProblem);
      err.println("Error: " + analysisProblem.getMessage());
      return EXIT_FAILURE;
    }
    header("Analysis Complete");
    return ceilingHit ? EXIT_FAILURE : EXIT_OK;
  }

  /**
   * Returns true if explicit exploration hit its state ceiling and was skipped.
   */
  private boolean runAll(final Options options, final PetriNet net,
      final AnalysisConfiguration config) throws ReachabilityException {
    boolean ceilingHit = false;
    header("PETRI NET ANALYSIS");
    out.println("Input file: " + options.file);
    out.println("  - Places: " + net.placeCount());
    out.println("  - Transitions: " + net.transitionCount());
    out.println("  - Arcs: " + net.getArcs().size());
    out.println("  - Initial marking: " + net.getInitialMarking());

    header("Explicit Reachability");
    ExplicitReachableSet explicit = null;
    try {
      explicit = new ExplicitExplorer(net, config).explore();
      printExplicit(explicit, net);
    } catch (ReachabilityException ceiling) {
      if (ceiling.getCode() != Code.STATE_LIMIT_EXCEEDED) {
        throw ceiling;
      }
      logger.warn("Explicit exploration skipped", ceiling);
      out.println("Skipped: " + ceiling.getMessage());
      ceilingHit = true;
    }

    header("Symbolic Reachability");
    final SymbolicReachableSet symbolic = new SymbolicEngine(net, config).explore();
    printSymbolic(symbolic, explicit);

    header("Deadlock Detection");
    printDeadlock(net, symbolic);

    if (options.weights != null) {
      header("Optimization over Reachable Markings");
      printOptimum(net, symbolic, options);
    }
    return ceilingHit;
  }

  private void printExplicit(final ExplicitReachableSet reachable, final PetriNet net) {
    final ExplorationStatistics statistics = reachable.getStatistics();
    out.println("Explorer: " + statistics.getExplorer());
    out.println("Reachable markings: " + statistics.getMarkings());
    out.println("Expansions: " + statistics.getExpansions());
    out.println("Computation time: " + statistics.getElapsedMillis() + " ms");
    out.print(formatMarkings(net, reachable, PRINT_LIMIT));
  }

  private void printSymbolic(final SymbolicReachableSet reachable,
      final ExplicitReachableSet explicit) {
    final ExplorationStatistics statistics = reachable.getStatistics();
    out.println("Explorer: " + statistics.getExplorer());
    out.println("Reachable markings: " + statistics.getMarkings());
    out.println("Fixed-point iterations: " + statistics.getIterations());
    out.println("Diagram nodes: " + statistics.getDiagramNodes() + " allocated, "
        + reachable.getFunction().nodeCount() + " in the reachable set");
    out.println("Computation time: " + statistics.getElapsedMillis() + " ms");
    if (explicit != null) {
      out.println("Agrees with explicit exploration: "
          + explicit.markings().equals(reachable.markings()));
    }
  }

  private void printDeadlock(final PetriNet net, final ReachableSet reachable)
      throws ReachabilityException {
    final long started = System.currentTimeMillis();
    final Optional<Marking> deadlock = new DeadlockDetector(net).detect(reachable);
    if (deadlock.isPresent()) {
      out.println("Deadlock found: " + deadlock.get());
      final StringBuilder marked = new StringBuilder();
      for (int place = 0; place < net.placeCount(); place++) {
        if (deadlock.get().isMarked(place)) {
          marked.append(marked.length() == 0 ? "" : ", ")
              .append(net.getPlaces().get(place).getId());
        }
      }
      out.println("Places with tokens: [" + marked + "]");
    } else {
      out.println("No deadlock found (system is deadlock-free)");
    }
    out.println("Computation time: " + (System.currentTimeMillis() - started) + " ms");
  }

  private void printOptimum(final PetriNet net, final ReachableSet reachable,
      final Options options) throws ReachabilityException {
    final Optional<OptimizationResult> optimum =
        new ReachableSetOptimizer().optimize(reachable, options.weights, options.objective);
    if (!optimum.isPresent()) {
      out.println("No optimal marking found");
      return;
    }
    final Marking marking = optimum.get().getMarking();
    out.println("Optimal marking (" + options.objective + "): " + marking);
    out.println("Objective value: "
        + String.format(Locale.ROOT, "%.2f", optimum.get().getValue()));
    out.println("Breakdown:");
    for (int place = 0; place < net.placeCount(); place++) {
      if (marking.isMarked(place)) {
        out.println(String.format(Locale.ROOT, "  %s: weight=%s, tokens=%d, contrib=%s",
            net.getPlaces().get(place).getId(), options.weights[place], marking.get(place),
            options.weights[place] * marking.get(place)));
      }
    }
  }

  /**
   * The first {@code limit} markings in canonical order as a table with one column per place.
   */
  static String formatMarkings(final PetriNet net, final ReachableSet reachable, final int limit) {
    final StringBuilder table = new StringBuilder();
    table.append(String.format("Reachable markings (%d total):%n", reachable.count()));
    table.append(String.format("  %-8s |", "Marking"));
    for (final Place place : net.getPlaces()) {
      table.append(String.format(" %5s", place.getId()));
    }
    table.append(System.lineSeparator());
    final StringBuilder rule = new StringBuilder("  ");
    for (int i = 0; i < 10 + 6 * net.placeCount(); i++) {
      rule.append('-');
    }
    table.append(rule).append(System.lineSeparator());
    int row = 0;
    for (final Marking marking : reachable) {
      if (row >= limit) {
        table.append(String.format("  ... (%d more)%n",
            reachable.count().subtract(BigInteger.valueOf(limit))));
        break;
      }
      table.append(String.format("  M%-7d |", row));
      for (int place = 0; place < marking.size(); place++) {
        table.append(String.format(" %5d", marking.get(place)));
      }
      table.append(System.lineSeparator());
      row++;
    }
    return table.toString();
  }

  private void header(final String title) {
    out.println();
    out.println(RULE);
    out.println("  " + title);
    out.println(RULE);
  }

  static String usage() {
    return "Usage: PetriNetAnalyzer <file.pnml> [--task all|explicit|symbolic|deadlock|optimize]"
        + " [--weights w1,w2,...] [--minimize] [--state-limit N] [--iteration-limit N]";
  }

  /**
   * Parsed command line.
   */
  static final class Options {
    Path file;
    AnalysisTask task = AnalysisTask.ALL;
    double[] weights;
    Objective objective = Objective.MAXIMIZE;
    Integer stateLimit;
    Integer iterationLimit;

    static Options parse(final String[] args) throws ReachabilityException {
      final Options options = new Options();
      for (int i = 0; args != null && i < args.length; i++) {
        final String arg = args[i];
        switch (arg) {
          case "--task":
            options.task = AnalysisTask.fromName(value(args, ++i, arg));
            break;
          case "--weights":
            options.weights = parseWeights(value(args, ++i, arg));
            break;
          case "--minimize":
            options.objective = Objective.MINIMIZE;
            break;
          case "--state-limit":
            options.stateLimit = parseLimit(value(args, ++i, arg), arg);
            break;
          case "--iteration-limit":
            options.iterationLimit = parseLimit(value(args, ++i, arg), arg);
            break;
          default:
            if (arg.startsWith("--")) {
              throw new ReachabilityException(Code.INVALID_CONFIGURATION,
                  "Unknown option " + arg);
            }
            if (options.file != null) {
              throw new ReachabilityException(Code.INVALID_CONFIGURATION,
                  "Only one PNML file may be given");
            }
            options.file = Paths.get(arg);
        }
      }
      if (options.file == null) {
        throw new ReachabilityException(Code.INVALID_CONFIGURATION, "Missing PNML file");
      }
      if (options.task == AnalysisTask.OPTIMIZE && options.weights == null) {
        throw new ReachabilityException(Code.INVALID_WEIGHTS,
            "--weights required for optimization task");
      }
      return options;
    }

    static double[] parseWeights(final String text) throws ReachabilityException {
      final String[] parts = text.split(",", -1);
      final double[] weights = new double[parts.length];
      for (int i = 0; i < parts.length; i++) {
        try {
          weights[i] = Double.parseDouble(parts[i].trim());
        } catch (NumberFormatException problem) {
          throw new ReachabilityException(Code.INVALID_WEIGHTS,
              "Invalid weight format. Use comma-separated numbers.", problem);
        }
      }
      return weights;
    }

    private static int parseLimit(final String text, final String option)
        throws ReachabilityException {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException problem) {
        throw new ReachabilityException(Code.INVALID_CONFIGURATION,
            option + " expects an integer, got " + text, problem);
      }
    }

    private static String value(final String[] args, final int index, final String option)
        throws ReachabilityException {
      if (index >= args.length) {
        throw new ReachabilityException(Code.INVALID_CONFIGURATION, option + " expects a value");
      }
      return args[index];
    }
  }

}
