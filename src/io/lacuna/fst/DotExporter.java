package io.lacuna.fst;

import io.lacuna.bifurcan.LinearMap;

/**
 * Renders automata as Graphviz source.
 *
 * @author ztellman
 */
public final class DotExporter {

  private DotExporter() {
  }

  /**
   * Nodes are numbered in state order. The initial state is bold, final states are double circles labeled with their
   * final output when it is non-empty, and empty labels are shown as the epsilon symbol of {@code config}. When some
   * final output is non-empty, states which are not final are labeled with the unknown symbol of {@code config}.
   *
   * @return the {@code dot} source of {@code fst}
   */
  public static <Q> String toDot(Fst<Q> fst, FstConfig config) {
    StringBuilder sb = new StringBuilder();
    sb.append("digraph G {\n");
    sb.append("  rankdir=LR;\n");
    sb.append("  node [shape=circle];\n");

    Q initial = fst.initialState().orElse(null);
    boolean outputs = fst.hasFinalOutputs();
    LinearMap<Q, Integer> ids = new LinearMap<>();
    for (Q q : fst.states()) {
      int id = (int) ids.size();
      ids.put(q, id);

      String label = String.valueOf(q);
      sb.append("  ").append(id).append(" [");
      if (q.equals(initial)) {
        sb.append("style=bold ");
      }
      if (fst.isFinal(q)) {
        sb.append("shape=doublecircle ");
        String output = fst.finalOutput(q).orElse(Fst.EPSILON);
        if (!output.isEmpty()) {
          label = label + "/" + output;
        }
      } else if (outputs) {
        label = label + "/" + config.unknown();
      }
      sb.append("label=\"").append(escape(label)).append("\"];\n");
    }

    for (Transition<Q> t : fst.transitions()) {
      String in = display(t.input(), config);
      String out = display(t.output(), config);
      String label = in.equals(out) ? in : in + ":" + out;
      sb.append("  ")
              .append(ids.get(t.src(), -1))
              .append(" -> ")
              .append(ids.get(t.dest(), -1))
              .append(" [label=\"")
              .append(escape(label))
              .append("\"];\n");
    }

    return sb.append("}\n").toString();
  }

  private static String display(String symbol, FstConfig config) {
    return symbol.isEmpty() ? config.epsilon() : symbol;
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
