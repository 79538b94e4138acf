package com.github.reachability;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.IntUnaryOperator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.reachability.ReachabilityException.Code;

/**
 * Reduced ordered binary decision diagrams over a fixed number of variables, ordered by variable
 * index.
 *
 * Notes for users:<br>
 * 1. a manager is the context of exactly one analysis run. It owns the node arena, the unique
 * table and all operation caches; nothing is shared between managers and nothing is global. Drop
 * the manager (and every {@link Bdd} handed out by it) when the run is over<br>
 *
 * 2. nodes live in parallel int arrays and refer to their children by index. Node 0 is the
 * constant false, node 1 the constant true. The unique table guarantees that two handles denote
 * the same function iff they point at the same node<br>
 *
 * 3. nodes are never freed. Instead the arena is bounded by a node ceiling and growing past it
 * fails the run with {@code NODE_LIMIT_EXCEEDED}<br>
 *
 * 4. not thread-safe, a run is single-threaded<br>
 */
public final class BddManager {
  private static final Logger logger = LogManager.getLogger(BddManager.class.getSimpleName());

  static final int FALSE = 0;
  static final int TRUE = 1;
  private static final int TERMINAL_VARIABLE = Integer.MAX_VALUE;
  private static final int INITIAL_CAPACITY = 1 << 10;
  // op caches are memo tables only, dropping them is always safe
  private static final int MAX_CACHE_ENTRIES = 1 << 21;

  private static final int OP_AND = 0;
  private static final int OP_OR = 1;
  private static final int OP_DIFF = 2;

  private final String managerId = UUID.randomUUID().toString();
  private final int variableCount;
  private final int nodeLimit;

  // node arena
  private int[] variables;
  private int[] lows;
  private int[] highs;
  private int nodeCount;

  // unique table, chained through nextInChain
  private int[] heads;
  private int[] nextInChain;

  private final Map<Long, Integer>[] applyCaches;
  private final Map<Integer, Integer> notCache = new HashMap<>();

  private final Bdd falseBdd;
  private final Bdd trueBdd;

  @SuppressWarnings("unchecked")
  public BddManager(final int variableCount, final int nodeLimit) {
    if (variableCount < 0) {
      throw new IllegalArgumentException("variableCount cannot be negative: " + variableCount);
    }
    this.variableCount = variableCount;
    this.nodeLimit = nodeLimit <= 0 ? AnalysisConfiguration.DEFAULT_NODE_LIMIT : nodeLimit;
    variables = new int[INITIAL_CAPACITY];
    lows = new int[INITIAL_CAPACITY];
    highs = new int[INITIAL_CAPACITY];
    nextInChain = new int[INITIAL_CAPACITY];
    heads = new int[INITIAL_CAPACITY];
    Arrays.fill(heads, -1);
    applyCaches = new Map[] {new HashMap<>(), new HashMap<>(), new HashMap<>()};

    // terminals are not part of the unique table
    variables[FALSE] = TERMINAL_VARIABLE;
    variables[TRUE] = TERMINAL_VARIABLE;
    nodeCount = 2;
    falseBdd = new Bdd(this, FALSE);
    trueBdd = new Bdd(this, TRUE);
    logDebug(managerId, "Created manager over " + variableCount + " variables");
  }

  public String getId() {
    return managerId;
  }

  public int getVariableCount() {
    return variableCount;
  }

  /**
   * Nodes allocated so far, terminals included.
   */
  public int getNodeCount() {
    return nodeCount;
  }

  public Bdd constant(final boolean value) {
    return value ? trueBdd : falseBdd;
  }

  public Bdd variable(final int variable) throws ReachabilityException {
    checkVariable(variable);
    return wrap(makeNode(variable, FALSE, TRUE));
  }

  public Bdd literal(final int variable, final boolean positive) throws ReachabilityException {
    checkVariable(variable);
    return wrap(positive ? makeNode(variable, FALSE, TRUE) : makeNode(variable, TRUE, FALSE));
  }

  /**
   * Conjunction of literals, variable {@code variables[i]} taking {@code values[i]}. Built bottom
   * up in one pass, no intermediate conjunctions.
   */
  public Bdd cube(final int[] cubeVariables, final boolean[] values)
      throws ReachabilityException {
    if (cubeVariables.length != values.length) {
      throw new IllegalArgumentException("variables and values differ in length");
    }
    final Integer[] order = new Integer[cubeVariables.length];
    for (int index = 0; index < order.length; index++) {
      checkVariable(cubeVariables[index]);
      order[index] = index;
    }
    Arrays.sort(order, (one, two) -> Integer.compare(cubeVariables[two], cubeVariables[one]));
    int node = TRUE;
    int previous = -1;
    for (final int index : order) {
      if (cubeVariables[index] == previous) {
        throw new IllegalArgumentException("Variable " + previous + " repeats in cube");
      }
      previous = cubeVariables[index];
      node = values[index] ? makeNode(previous, FALSE, node) : makeNode(previous, node, FALSE);
    }
    return wrap(node);
  }

  Bdd wrap(final int node) {
    if (node == FALSE) {
      return falseBdd;
    }
    if (node == TRUE) {
      return trueBdd;
    }
    return new Bdd(this, node);
  }

  ///// node level operations, used through Bdd /////

  int and(final int f, final int g) throws ReachabilityException {
    return apply(OP_AND, f, g);
  }

  int or(final int f, final int g) throws ReachabilityException {
    return apply(OP_OR, f, g);
  }

  int diff(final int f, final int g) throws ReachabilityException {
    return apply(OP_DIFF, f, g);
  }

  int not(final int f) throws ReachabilityException {
    if (f == FALSE) {
      return TRUE;
    }
    if (f == TRUE) {
      return FALSE;
    }
    final Integer cached = notCache.get(f);
    if (cached != null) {
      return cached;
    }
    final int result = makeNode(variables[f], not(lows[f]), not(highs[f]));
    cache(notCache, f, result);
    return result;
  }

  int restrict(final int f, final int variable, final boolean value)
      throws ReachabilityException {
    checkVariable(variable);
    return restrict(f, variable, value, new HashMap<>());
  }

  private int restrict(final int f, final int variable, final boolean value,
      final Map<Integer, Integer> memo) throws ReachabilityException {
    if (variables[f] > variable) {
      // terminal, or variable sits above f in the order so f cannot depend on it
      return f;
    }
    if (variables[f] == variable) {
      return value ? highs[f] : lows[f];
    }
    final Integer cached = memo.get(f);
    if (cached != null) {
      return cached;
    }
    final int result = makeNode(variables[f], restrict(lows[f], variable, value, memo),
        restrict(highs[f], variable, value, memo));
    memo.put(f, result);
    return result;
  }

  /**
   * Existential elimination of every variable in the set. At each node labelled with a quantified
   * variable the two cofactors are OR-ed, which is the restrict-to-0 OR restrict-to-1 rule applied
   * to all quantified variables in a single pass.
   */
  int exists(final int f, final BitSet quantified) throws ReachabilityException {
    if (quantified.isEmpty()) {
      return f;
    }
    return exists(f, quantified, quantified.length() - 1, new HashMap<>());
  }

  private int exists(final int f, final BitSet quantified, final int lastQuantified,
      final Map<Integer, Integer> memo) throws ReachabilityException {
    if (variables[f] > lastQuantified) {
      return f;
    }
    final Integer cached = memo.get(f);
    if (cached != null) {
      return cached;
    }
    final int low = exists(lows[f], quantified, lastQuantified, memo);
    final int high = exists(highs[f], quantified, lastQuantified, memo);
    final int result =
        quantified.get(variables[f]) ? or(low, high) : makeNode(variables[f], low, high);
    memo.put(f, result);
    return result;
  }

  /**
   * Renames every support variable v to mapping(v). The mapping must be injective on the support
   * of f, the result then has exactly the satisfying assignments of f with variable roles
   * swapped accordingly. Order preserving mappings are relabelled structurally, all other
   * mappings are rebuilt with if-then-else.
   */
  int rename(final int f, final IntUnaryOperator mapping) throws ReachabilityException {
    final BitSet support = support(f);
    final BitSet targets = new BitSet();
    boolean orderPreserving = true;
    int previousTarget = -1;
    for (int variable = support.nextSetBit(0); variable >= 0; variable =
        support.nextSetBit(variable + 1)) {
      final int target = mapping.applyAsInt(variable);
      checkVariable(target);
      if (targets.get(target)) {
        throw new IllegalArgumentException(
            "Renaming is not injective, variable " + target + " is hit twice");
      }
      targets.set(target);
      if (target <= previousTarget) {
        orderPreserving = false;
      }
      previousTarget = target;
    }
    return rename(f, mapping, orderPreserving, new HashMap<>());
  }

  private int rename(final int f, final IntUnaryOperator mapping, final boolean orderPreserving,
      final Map<Integer, Integer> memo) throws ReachabilityException {
    if (f == FALSE || f == TRUE) {
      return f;
    }
    final Integer cached = memo.get(f);
    if (cached != null) {
      return cached;
    }
    final int low = rename(lows[f], mapping, orderPreserving, memo);
    final int high = rename(highs[f], mapping, orderPreserving, memo);
    final int target = mapping.applyAsInt(variables[f]);
    final int result;
    if (orderPreserving) {
      result = makeNode(target, low, high);
    } else {
      final int positive = makeNode(target, FALSE, TRUE);
      final int negative = makeNode(target, TRUE, FALSE);
      result = or(and(positive, high), and(negative, low));
    }
    memo.put(f, result);
    return result;
  }

  boolean evaluate(final int f, final BitSet assignment) {
    int node = f;
    while (node != FALSE && node != TRUE) {
      node = assignment.get(variables[node]) ? highs[node] : lows[node];
    }
    return node == TRUE;
  }

  BitSet support(final int f) {
    final BitSet support = new BitSet(variableCount);
    final BitSet visited = new BitSet();
    collectSupport(f, support, visited);
    return support;
  }

  private void collectSupport(final int f, final BitSet support, final BitSet visited) {
    if (f == FALSE || f == TRUE || visited.get(f)) {
      return;
    }
    visited.set(f);
    support.set(variables[f]);
    collectSupport(lows[f], support, visited);
    collectSupport(highs[f], support, visited);
  }

  /**
   * Nodes reachable from f, terminals included.
   */
  int size(final int f) {
    final BitSet visited = new BitSet();
    final Deque<Integer> stack = new ArrayDeque<>();
    stack.push(f);
    int count = 0;
    while (!stack.isEmpty()) {
      final int node = stack.pop();
      if (visited.get(node)) {
        continue;
      }
      visited.set(node);
      count++;
      if (node != FALSE && node != TRUE) {
        stack.push(lows[node]);
        stack.push(highs[node]);
      }
    }
    return count;
  }

  /**
   * Number of assignments to the variables of {@code support} that satisfy f. The support of f
   * must be contained in it.
   */
  BigInteger satCount(final int f, final BitSet support) {
    final int[] levels = levels(support);
    final int width = support.cardinality();
    final BigInteger count = satCount(f, levels, width, new HashMap<>());
    return count.shiftLeft(level(f, levels, width));
  }

  private BigInteger satCount(final int f, final int[] levels, final int width,
      final Map<Integer, BigInteger> memo) {
    if (f == FALSE) {
      return BigInteger.ZERO;
    }
    if (f == TRUE) {
      return BigInteger.ONE;
    }
    final BigInteger cached = memo.get(f);
    if (cached != null) {
      return cached;
    }
    final int level = level(f, levels, width);
    final BigInteger low = satCount(lows[f], levels, width, memo)
        .shiftLeft(level(lows[f], levels, width) - level - 1);
    final BigInteger high = satCount(highs[f], levels, width, memo)
        .shiftLeft(level(highs[f], levels, width) - level - 1);
    final BigInteger result = low.add(high);
    memo.put(f, result);
    return result;
  }

  /**
   * Calls the consumer once per satisfying assignment over {@code support}, in lexicographic
   * order of the support variables with false before true. The support of f must be contained in
   * it. The BitSet handed to the consumer is a fresh copy.
   */
  void forEachSolution(final int f, final BitSet support, final Consumer<BitSet> consumer) {
    final int[] supportVariables = support.stream().toArray();
    checkSupport(f, support);
    if (f == FALSE) {
      return;
    }
    enumerate(f, supportVariables, 0, new BitSet(), consumer);
  }

  private void enumerate(final int f, final int[] supportVariables, final int position,
      final BitSet assignment, final Consumer<BitSet> consumer) {
    if (f == FALSE) {
      return;
    }
    if (position == supportVariables.length) {
      consumer.accept((BitSet) assignment.clone());
      return;
    }
    final int variable = supportVariables[position];
    final boolean decided = variables[f] == variable;
    assignment.clear(variable);
    enumerate(decided ? lows[f] : f, supportVariables, position + 1, assignment, consumer);
    assignment.set(variable);
    enumerate(decided ? highs[f] : f, supportVariables, position + 1, assignment, consumer);
    assignment.clear(variable);
  }

  /**
   * The lexicographically least satisfying assignment, or null when f is false.
   */
  BitSet firstSolution(final int f, final BitSet support) {
    checkSupport(f, support);
    if (f == FALSE) {
      return null;
    }
    final BitSet assignment = new BitSet();
    int node = f;
    while (node != TRUE) {
      // every non-false node has a solution, so prefer the low branch whenever it is alive
      if (lows[node] != FALSE) {
        node = lows[node];
      } else {
        assignment.set(variables[node]);
        node = highs[node];
      }
    }
    return assignment;
  }

  private void checkSupport(final int f, final BitSet support) {
    final BitSet outside = support(f);
    outside.andNot(support);
    if (!outside.isEmpty()) {
      throw new IllegalArgumentException("Function depends on variables " + outside
          + " outside of the requested support " + support);
    }
  }

  private int[] levels(final BitSet support) {
    final int[] levels = new int[variableCount];
    Arrays.fill(levels, -1);
    int level = 0;
    for (int variable = support.nextSetBit(0); variable >= 0; variable =
        support.nextSetBit(variable + 1)) {
      if (variable < variableCount) {
        levels[variable] = level++;
      }
    }
    return levels;
  }

  private int level(final int f, final int[] levels, final int width) {
    if (f == FALSE || f == TRUE) {
      return width;
    }
    final int level = levels[variables[f]];
    if (level < 0) {
      throw new IllegalArgumentException(
          "Function depends on variable " + variables[f] + " outside of the requested support");
    }
    return level;
  }

  ///// internals /////

  private int apply(final int op, final int f, final int g) throws ReachabilityException {
    switch (op) {
      case OP_AND:
        if (f == FALSE || g == FALSE) {
          return FALSE;
        }
        if (f == TRUE || f == g) {
          return g;
        }
        if (g == TRUE) {
          return f;
        }
        break;
      case OP_OR:
        if (f == TRUE || g == TRUE) {
          return TRUE;
        }
        if (f == FALSE || f == g) {
          return g;
        }
        if (g == FALSE) {
          return f;
        }
        break;
      case OP_DIFF:
        if (f == FALSE || g == TRUE || f == g) {
          return FALSE;
        }
        if (g == FALSE) {
          return f;
        }
        if (f == TRUE) {
          return not(g);
        }
        break;
      default:
        throw new IllegalStateException("Unknown operator " + op);
    }
    // and/or are commutative, normalize the key
    final int first = op != OP_DIFF && g < f ? g : f;
    final int second = first == f ? g : f;
    final long key = ((long) first << 32) | (second & 0xffffffffL);
    final Map<Long, Integer> cache = applyCaches[op];
    final Integer cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    final int variable = Math.min(variables[first], variables[second]);
    final int firstLow = variables[first] == variable ? lows[first] : first;
    final int firstHigh = variables[first] == variable ? highs[first] : first;
    final int secondLow = variables[second] == variable ? lows[second] : second;
    final int secondHigh = variables[second] == variable ? highs[second] : second;
    final int result = makeNode(variable, apply(op, firstLow, secondLow),
        apply(op, firstHigh, secondHigh));
    cache(cache, key, result);
    return result;
  }

  private <K> void cache(final Map<K, Integer> cache, final K key, final int value) {
    if (cache.size() >= MAX_CACHE_ENTRIES) {
      logDebug(managerId, "Dropping full operation cache of " + cache.size() + " entries");
      cache.clear();
    }
    cache.put(key, value);
  }

  private int makeNode(final int variable, final int low, final int high)
      throws ReachabilityException {
    if (low == high) {
      return low;
    }
    final int bucket = hash(variable, low, high) & (heads.length - 1);
    for (int node = heads[bucket]; node >= 0; node = nextInChain[node]) {
      if (variables[node] == variable && lows[node] == low && highs[node] == high) {
        return node;
      }
    }
    if (nodeCount >= nodeLimit) {
      logWarning(managerId, "Node ceiling of " + nodeLimit + " reached");
      throw new ReachabilityException(Code.NODE_LIMIT_EXCEEDED,
          "Decision diagram exceeded its node ceiling of " + nodeLimit);
    }
    if (nodeCount == variables.length) {
      grow();
      return makeNode(variable, low, high);
    }
    final int node = nodeCount++;
    variables[node] = variable;
    lows[node] = low;
    highs[node] = high;
    nextInChain[node] = heads[bucket];
    heads[bucket] = node;
    return node;
  }

  private void grow() {
    final int capacity = variables.length << 1;
    variables = Arrays.copyOf(variables, capacity);
    lows = Arrays.copyOf(lows, capacity);
    highs = Arrays.copyOf(highs, capacity);
    nextInChain = Arrays.copyOf(nextInChain, capacity);
    heads = new int[capacity];
    Arrays.fill(heads, -1);
    for (int node = 2; node < nodeCount; node++) {
      final int bucket = hash(variables[node], lows[node], highs[node]) & (capacity - 1);
      nextInChain[node] = heads[bucket];
      heads[bucket] = node;
    }
    logDebug(managerId, "Grew node arena to " + capacity + " slots");
  }

  private static int hash(final int variable, final int low, final int high) {
    int hash = variable * 0x9E3779B1;
    hash = (hash ^ low) * 0x85EBCA6B;
    hash = (hash ^ high) * 0xC2B2AE35;
    return hash ^ (hash >>> 16);
  }

  private void checkVariable(final int variable) {
    if (variable < 0 || variable >= variableCount) {
      throw new IllegalArgumentException(
          "Variable " + variable + " is outside of [0, " + variableCount + ")");
    }
  }

  void checkOwner(final Bdd other) throws ReachabilityException {
    if (other.getManager() != this) {
      throw new ReachabilityException(Code.MANAGER_MISMATCH);
    }
  }

  private static void logWarning(final String managerId, final String message) {
    logger.warn(new StringBuilder().append("[b:").append(managerId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String managerId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[b:").append(managerId).append("] ")
          .append(message).toString());
    }
  }

  @Override
  public String toString() {
    return "BddManager [id=" + managerId + ", variables=" + variableCount + ", nodes="
        + nodeCount + ", nodeLimit=" + nodeLimit + "]";
  }

}
