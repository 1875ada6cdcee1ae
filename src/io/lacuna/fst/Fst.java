package io.lacuna.fst;

import io.lacuna.bifurcan.*;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * An unweighted finite-state transducer {@code (Q, T, q0, F)} whose states are addressed by labels.
 * <p>
 * Every label is bound to an internal handle; handles never leave this class. Instances are immutable: each
 * {@code with*} method returns a new version which shares structure with this one, so keeping a reference to an
 * older version is enough to roll back any number of edits.
 * <p>
 * Final states carry a final output, the word emitted when a run ends there. It is the empty word for ordinary
 * acceptors; a state which is not final has an unknown output.
 *
 * @param <Q> the state labels
 * @author ztellman
 */
public final class Fst<Q> {

  /**
   * the empty label
   */
  public static final String EPSILON = Words.EMPTY;

  private static final int NONE = -1;

  private static final ISet<Arc> NO_ARCS = Utils.persistentSet();

  private static final Comparator<Arc> ARC_ORDER = Comparator
          .comparing((Arc a) -> a.input)
          .thenComparing(a -> a.output)
          .thenComparingInt(a -> a.dest);

  private final IMap<Q, Integer> handles;
  private final IMap<Integer, Q> labels;
  private final IMap<Integer, ISet<Arc>> arcs;
  private final IMap<Integer, String> finals;
  private final int initial;
  private final int nextHandle;

  private Fst(IMap<Q, Integer> handles,
              IMap<Integer, Q> labels,
              IMap<Integer, ISet<Arc>> arcs,
              IMap<Integer, String> finals,
              int initial,
              int nextHandle) {
    this.handles = handles;
    this.labels = labels;
    this.arcs = arcs;
    this.finals = finals;
    this.initial = initial;
    this.nextHandle = nextHandle;
  }

  /**
   * @return an automaton without states
   */
  public static <Q> Fst<Q> empty() {
    return new Fst<>(
            Utils.persistentMap(),
            Utils.persistentMap(),
            Utils.persistentMap(),
            Utils.persistentMap(),
            NONE,
            0);
  }

  /// editing

  /**
   * @return the automaton with a state labeled {@code label}, or this automaton if it already has one
   */
  public Fst<Q> withState(Q label) {
    Objects.requireNonNull(label, "label");
    if (handles.contains(label)) {
      return this;
    }

    int h = nextHandle;
    return new Fst<>(
            handles.put(label, h),
            labels.put(h, label),
            arcs.put(h, NO_ARCS),
            finals,
            initial,
            h + 1);
  }

  public Fst<Q> withInitial(Q label) {
    return new Fst<>(handles, labels, arcs, finals, handle(label), nextHandle);
  }

  public Fst<Q> withFinal(Q label) {
    return withFinal(label, EPSILON);
  }

  /**
   * @return the automaton with {@code label} final, emitting {@code output} when a run ends there
   */
  public Fst<Q> withFinal(Q label, String output) {
    Objects.requireNonNull(output, "output");
    return new Fst<>(handles, labels, arcs, finals.put(handle(label), output), initial, nextHandle);
  }

  public Fst<Q> withoutFinal(Q label) {
    return new Fst<>(handles, labels, arcs, finals.remove(handle(label)), initial, nextHandle);
  }

  public Fst<Q> withTransition(Q src, String symbol, Q dest) {
    return withTransition(src, symbol, symbol, dest);
  }

  public Fst<Q> withTransition(Q src, String input, String output, Q dest) {
    int s = handle(src);
    int d = handle(dest);
    Arc arc = new Arc(
            s,
            Objects.requireNonNull(input, "input"),
            Objects.requireNonNull(output, "output"),
            d);
    return withArcs(s, arcs(s).add(arc));
  }

  public Fst<Q> withoutTransition(Transition<Q> t) {
    Arc arc = arc(t);
    return withArcs(arc.src, arcs(arc.src).remove(arc));
  }

  /**
   * @return the automaton with the output of the existing transition {@code t} replaced by {@code output}
   */
  public Fst<Q> withOutput(Transition<Q> t, String output) {
    Objects.requireNonNull(output, "output");
    Arc arc = arc(t);
    return withArcs(arc.src, arcs(arc.src).remove(arc).add(new Arc(arc.src, arc.input, output, arc.dest)));
  }

  /**
   * @return the automaton with every transition into {@code from} pointing at {@code to} instead
   */
  public Fst<Q> redirect(Q from, Q to) {
    int f = handle(from);
    int t = handle(to);

    IMap<Integer, ISet<Arc>> updated = arcs;
    for (Integer h : arcs.keys()) {
      ISet<Arc> set = arcs(h);
      ISet<Arc> next = set;
      for (Arc a : set) {
        if (a.dest == f) {
          next = next.remove(a).add(new Arc(a.src, a.input, a.output, t));
        }
      }
      if (next != set) {
        updated = updated.put(h, next);
      }
    }

    return new Fst<>(handles, labels, updated, finals, initial, nextHandle);
  }

  /**
   * @return the automaton without {@code label}, its final output, and every transition into or out of it
   */
  public Fst<Q> withoutState(Q label) {
    int h = handle(label);

    IMap<Integer, ISet<Arc>> updated = arcs.remove(h);
    for (Integer s : arcs.keys()) {
      if (s == h) {
        continue;
      }
      ISet<Arc> set = arcs(s);
      ISet<Arc> next = set;
      for (Arc a : set) {
        if (a.dest == h) {
          next = next.remove(a);
        }
      }
      if (next != set) {
        updated = updated.put(s, next);
      }
    }

    return new Fst<>(
            handles.remove(label),
            labels.remove(h),
            updated,
            finals.remove(h),
            initial == h ? NONE : initial,
            nextHandle);
  }

  /// queries

  public long stateCount() {
    return labels.size();
  }

  public long transitionCount() {
    long n = 0;
    for (Integer h : arcs.keys()) {
      n += arcs(h).size();
    }
    return n;
  }

  public boolean contains(Q label) {
    return handles.contains(label);
  }

  /**
   * @return every state label, in the order the states were added
   */
  public ISet<Q> states() {
    return Utils.toSet(sortedHandles().stream().map(this::label));
  }

  /**
   * @return the initial state, absent only for an automaton which accepts nothing
   */
  public Optional<Q> initialState() {
    return initial == NONE ? Optional.empty() : Optional.of(label(initial));
  }

  public ISet<Q> finalStates() {
    return Utils.toSet(Utils.sorted(finals.keys(), Comparator.naturalOrder()).stream().map(this::label));
  }

  public boolean isFinal(Q label) {
    return finals.contains(handle(label));
  }

  /**
   * @return the final output of {@code label}, or nothing if it is not final
   */
  public Optional<String> finalOutput(Q label) {
    return Optional.ofNullable(finals.get(handle(label), null));
  }

  public IList<Transition<Q>> transitions() {
    LinearList<Transition<Q>> result = new LinearList<>();
    for (int h : sortedHandles()) {
      for (Arc a : sortedArcs(h)) {
        result.addLast(transition(a));
      }
    }
    return result;
  }

  /**
   * @return the transitions leaving {@code src}, ordered by input then output
   */
  public IList<Transition<Q>> transitions(Q src) {
    return Utils.toList(sortedArcs(handle(src)).stream().map(this::transition));
  }

  /**
   * @return the first transition leaving {@code src} on {@code input}, which is the only one in a subsequential
   * transducer
   */
  public Optional<Transition<Q>> transition(Q src, String input) {
    for (Arc a : sortedArcs(handle(src))) {
      if (a.input.equals(input)) {
        return Optional.of(transition(a));
      }
    }
    return Optional.empty();
  }

  /**
   * @return the states reached from the initial state by reading {@code inputs}
   */
  public ISet<Q> reachable(Iterable<String> inputs) {
    ISet<Integer> current = new LinearSet<>();
    if (initial != NONE) {
      current.add(initial);
    }

    for (String x : inputs) {
      ISet<Integer> next = new LinearSet<>();
      for (Integer h : current) {
        for (Arc a : arcs(h)) {
          if (a.input.equals(x)) {
            next.add(a.dest);
          }
        }
      }
      current = next;
    }

    return Utils.toSet(Utils.sorted(current, Comparator.naturalOrder()).stream().map(this::label));
  }

  /**
   * @return true if no state has two transitions on the same input
   */
  public boolean isSubsequential() {
    for (Integer h : arcs.keys()) {
      ISet<Arc> set = arcs(h);
      if (Utils.map(set, a -> a.input).size() != set.size()) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return true if some final state emits a non-empty final output
   */
  public boolean hasFinalOutputs() {
    for (Integer h : finals.keys()) {
      if (!finals.get(h, EPSILON).isEmpty()) {
        return true;
      }
    }
    return false;
  }

  /// combinators

  /**
   * @return the automaton restricted to the states which are reachable from the initial state and can reach a final
   * state; if the initial state is not among them the result has no states at all
   */
  public Fst<Q> trim() {
    if (initial == NONE) {
      return empty();
    }

    // forward pass
    ISet<Integer> forward = LinearSet.of(initial);
    LinearList<Integer> queue = LinearList.of(initial);
    while (queue.size() > 0) {
      int s = queue.popFirst();
      for (Arc a : arcs(s)) {
        if (!forward.contains(a.dest)) {
          forward.add(a.dest);
          queue.addLast(a.dest);
        }
      }
    }

    // backward pass, over the transitions which survived the forward pass
    LinearMap<Integer, LinearList<Integer>> incoming = new LinearMap<>();
    for (Integer s : forward) {
      for (Arc a : arcs(s)) {
        if (forward.contains(a.dest)) {
          incoming.getOrCreate(a.dest, LinearList::new).addLast(s);
        }
      }
    }

    ISet<Integer> live = new LinearSet<>();
    for (Integer f : finals.keys()) {
      if (forward.contains(f)) {
        live.add(f);
        queue.addLast(f);
      }
    }
    while (queue.size() > 0) {
      int s = queue.popFirst();
      for (Integer p : incoming.get(s, new LinearList<>())) {
        if (!live.contains(p)) {
          live.add(p);
          queue.addLast(p);
        }
      }
    }

    if (!live.contains(initial)) {
      return empty();
    }

    LinearList<Integer> order = Utils.sorted(live, Comparator.naturalOrder());
    Fst<Q> result = empty();
    for (int h : order) {
      result = result.withState(label(h));
    }
    result = result.withInitial(label(initial));
    for (int h : order) {
      String output = finals.get(h, null);
      if (output != null) {
        result = result.withFinal(label(h), output);
      }
    }
    for (int h : order) {
      for (Arc a : sortedArcs(h)) {
        if (live.contains(a.dest)) {
          result = result.withTransition(label(h), a.input, a.output, label(a.dest));
        }
      }
    }

    return result;
  }

  /**
   * @return the product of this automaton and {@code other}, following pairs of transitions with identical labels,
   * trimmed
   */
  public <R> Fst<Pair<Q, R>> intersect(Fst<R> other) {
    return product(other, (a, b) -> a.input.equals(b.input) && a.output.equals(b.output), false);
  }

  /**
   * @return the relational composition of this transducer with {@code other}, where each output of this transducer
   * is read as an input of {@code other}, trimmed
   */
  public <R> Fst<Pair<Q, R>> compose(Fst<R> other) {
    return product(other, (a, b) -> a.output.equals(b.input), true);
  }

  private <R> Fst<Pair<Q, R>> product(Fst<R> other, BiPredicate<Arc, Arc> matches, boolean compose) {
    requireNoFinalOutputs();
    other.requireNoFinalOutputs();

    if (initial == NONE || other.initial == NONE) {
      return empty();
    }

    Pair<Integer, Integer> init = Pair.of(initial, other.initial);
    ISet<Pair<Integer, Integer>> seen = LinearSet.of(init);
    LinearList<Pair<Integer, Integer>> queue = LinearList.of(init);

    Pair<Q, R> initLabel = Pair.of(label(initial), other.label(other.initial));
    Fst<Pair<Q, R>> result = Fst.<Pair<Q, R>>empty().withState(initLabel).withInitial(initLabel);

    while (queue.size() > 0) {
      Pair<Integer, Integer> pair = queue.popFirst();
      int q1 = pair.first();
      int q2 = pair.second();
      Pair<Q, R> src = Pair.of(label(q1), other.label(q2));

      if (finals.contains(q1) && other.finals.contains(q2)) {
        result = result.withFinal(src);
      }

      for (Arc a : sortedArcs(q1)) {
        for (Arc b : other.sortedArcs(q2)) {
          if (!matches.test(a, b)) {
            continue;
          }

          Pair<Integer, Integer> next = Pair.of(a.dest, b.dest);
          Pair<Q, R> dest = Pair.of(label(a.dest), other.label(b.dest));
          if (!seen.contains(next)) {
            seen.add(next);
            queue.addLast(next);
            result = result.withState(dest);
          }
          result = result.withTransition(src, a.input, compose ? b.output : a.output, dest);
        }
      }
    }

    return result.trim();
  }

  /**
   * @param newInitial the label of the added initial state, which must not already be in use
   * @return the automaton with every transition reversed, a new initial state with empty transitions to each former
   * final state, and the former initial state as its only final state
   */
  public Fst<Q> reverse(Q newInitial) {
    requireNoFinalOutputs();
    if (handles.contains(newInitial)) {
      throw new IllegalArgumentException("state already exists: " + newInitial);
    }

    Fst<Q> result = empty();
    for (int h : sortedHandles()) {
      result = result.withState(label(h));
    }
    result = result.withState(newInitial).withInitial(newInitial);
    if (initial != NONE) {
      result = result.withFinal(label(initial));
    }

    for (int h : sortedHandles()) {
      for (Arc a : sortedArcs(h)) {
        result = result.withTransition(label(a.dest), a.input, a.output, label(a.src));
      }
    }
    for (int f : Utils.sorted(finals.keys(), Comparator.naturalOrder())) {
      result = result.withTransition(newInitial, EPSILON, EPSILON, label(f));
    }

    return result;
  }

  /**
   * @param f a function which must be injective on the states of this automaton
   * @return an isomorphic automaton with every state label rewritten by {@code f}
   */
  public <R> Fst<R> mapStates(Function<? super Q, ? extends R> f) {
    LinearMap<Integer, R> mapped = new LinearMap<>();
    Fst<R> result = empty();
    for (int h : sortedHandles()) {
      R r = Objects.requireNonNull(f.apply(label(h)), "mapped label");
      if (result.contains(r)) {
        throw new IllegalArgumentException("state relabeling is not injective, two states map to " + r);
      }
      mapped.put(h, r);
      result = result.withState(r);
    }

    if (initial != NONE) {
      result = result.withInitial(mapped.get(initial, null));
    }
    for (int h : sortedHandles()) {
      String output = finals.get(h, null);
      if (output != null) {
        result = result.withFinal(mapped.get(h, null), output);
      }
      for (Arc a : sortedArcs(h)) {
        result = result.withTransition(mapped.get(h, null), a.input, a.output, mapped.get(a.dest, null));
      }
    }

    return result;
  }

  /**
   * @return the acceptor of the input side of this transducer
   */
  public Fst<Q> projectInput() {
    Fst<Q> result = mapArcs(a -> new Arc(a.src, a.input, a.input, a.dest));
    IMap<Integer, String> plain = Utils.persistentMap();
    for (Integer h : finals.keys()) {
      plain = plain.put(h, EPSILON);
    }
    return new Fst<>(result.handles, result.labels, result.arcs, plain, initial, nextHandle);
  }

  /**
   * @return the acceptor of the output side of this transducer
   */
  public Fst<Q> projectOutput() {
    requireNoFinalOutputs();
    return mapArcs(a -> new Arc(a.src, a.output, a.output, a.dest));
  }

  private Fst<Q> mapArcs(UnaryOperator<Arc> f) {
    IMap<Integer, ISet<Arc>> updated = arcs;
    for (Integer h : arcs.keys()) {
      ISet<Arc> set = NO_ARCS;
      for (Arc a : arcs(h)) {
        set = set.add(f.apply(a));
      }
      updated = updated.put(h, set);
    }
    return new Fst<>(handles, labels, updated, finals, initial, nextHandle);
  }

  /// enumeration

  /**
   * Enumerates the paths from the initial state which take at most {@code maxLen + 2} steps, so that a word of
   * {@code maxLen} symbols framed by begin and end markers is still found. Transitions with empty input and output
   * are free. For cyclic automata the result is the subset of the language within that bound.
   *
   * @return the input words, space-delimited, of every enumerated path ending in a final state
   */
  public ISet<String> acceptedStrings(int maxLen) {
    return Utils.toSet(enumerate(maxLen).stream().map(Pair::first));
  }

  /**
   * @return the {@code (input, output)} pairs of every path found by {@link #acceptedStrings(int)}, where the output
   * includes the final output of the last state
   */
  public ISet<Pair<String, String>> acceptedPairs(int maxLen) {
    return Utils.toSet(enumerate(maxLen).stream());
  }

  private LinearList<Pair<String, String>> enumerate(int maxLen) {
    LinearList<Pair<String, String>> accepted = new LinearList<>();
    if (initial == NONE) {
      return accepted;
    }

    int bound = Math.max(0, maxLen + 2);
    Path start = new Path(initial, EPSILON, EPSILON, 0);
    ISet<Path> visited = LinearSet.of(start);
    LinearList<Path> queue = LinearList.of(start);

    while (queue.size() > 0) {
      Path p = queue.popFirst();

      String output = finals.get(p.state, null);
      if (output != null) {
        accepted.addLast(Pair.of(p.input, Words.concat(p.output, output)));
      }

      for (Arc a : sortedArcs(p.state)) {
        boolean free = a.input.isEmpty() && a.output.isEmpty();
        int steps = free ? p.steps : p.steps + 1;
        if (steps > bound) {
          continue;
        }

        Path next = new Path(a.dest, Words.concat(p.input, a.input), Words.concat(p.output, a.output), steps);
        if (!visited.contains(next)) {
          visited.add(next);
          queue.addLast(next);
        }
      }
    }

    return accepted;
  }

  ///

  void requireNoFinalOutputs() {
    if (hasFinalOutputs()) {
      throw new IllegalArgumentException(
              "automaton has non-empty final outputs, convert them to end-marker transitions first");
    }
  }

  private int handle(Q label) {
    Integer h = handles.get(Objects.requireNonNull(label, "label"), null);
    if (h == null) {
      throw new UnknownStateException(label);
    }
    return h;
  }

  private Q label(int handle) {
    return labels.get(handle, null);
  }

  private ISet<Arc> arcs(int handle) {
    return arcs.get(handle, NO_ARCS);
  }

  private LinearList<Arc> sortedArcs(int handle) {
    return Utils.sorted(arcs(handle), ARC_ORDER);
  }

  private LinearList<Integer> sortedHandles() {
    return Utils.sorted(labels.keys(), Comparator.naturalOrder());
  }

  private Transition<Q> transition(Arc a) {
    return new Transition<>(label(a.src), a.input, a.output, label(a.dest));
  }

  private Arc arc(Transition<Q> t) {
    Arc arc = new Arc(handle(t.src()), t.input(), t.output(), handle(t.dest()));
    if (!arcs(arc.src).contains(arc)) {
      throw new IllegalArgumentException("no such transition: " + t);
    }
    return arc;
  }

  private Fst<Q> withArcs(int handle, ISet<Arc> set) {
    return new Fst<>(handles, labels, arcs.put(handle, set), finals, initial, nextHandle);
  }

  private List<Object> signature() {
    HashSet<Q> states = new HashSet<>();
    HashMap<Q, String> outputs = new HashMap<>();
    for (int h : sortedHandles()) {
      states.add(label(h));
      String output = finals.get(h, null);
      if (output != null) {
        outputs.put(label(h), output);
      }
    }
    HashSet<Transition<Q>> transitions = new HashSet<>();
    transitions().forEach(transitions::add);
    return Arrays.asList(states, transitions, initialState(), outputs);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Fst)) {
      return false;
    }
    return signature().equals(((Fst<?>) o).signature());
  }

  @Override
  public int hashCode() {
    return signature().hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("fst[");
    sb.append("initial=").append(initialState().map(String::valueOf).orElse("none"));
    sb.append(", finals={");
    String sep = "";
    for (int h : Utils.sorted(finals.keys(), Comparator.naturalOrder())) {
      sb.append(sep).append(label(h));
      String output = finals.get(h, EPSILON);
      if (!output.isEmpty()) {
        sb.append("/").append(output);
      }
      sep = ", ";
    }
    sb.append("}, transitions=[");
    sep = "";
    for (Transition<Q> t : transitions()) {
      sb.append(sep).append(t);
      sep = ", ";
    }
    return sb.append("]]").toString();
  }

  ///

  private static final class Arc {
    final int src;
    final String input;
    final String output;
    final int dest;

    Arc(int src, String input, String output, int dest) {
      this.src = src;
      this.input = input;
      this.output = output;
      this.dest = dest;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Arc)) {
        return false;
      }
      Arc a = (Arc) o;
      return src == a.src && dest == a.dest && input.equals(a.input) && output.equals(a.output);
    }

    @Override
    public int hashCode() {
      return Objects.hash(src, input, output, dest);
    }
  }

  private static final class Path {
    final int state;
    final String input;
    final String output;
    final int steps;

    Path(int state, String input, String output, int steps) {
      this.state = state;
      this.input = input;
      this.output = output;
      this.steps = steps;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Path)) {
        return false;
      }
      Path p = (Path) o;
      return state == p.state && steps == p.steps && input.equals(p.input) && output.equals(p.output);
    }

    @Override
    public int hashCode() {
      return Objects.hash(state, input, output, steps);
    }
  }
}
