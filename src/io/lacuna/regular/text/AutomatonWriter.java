package io.lacuna.regular.text;

import io.lacuna.bifurcan.*;
import io.lacuna.regular.Automaton;
import io.lacuna.regular.StateId;
import io.lacuna.regular.Transition;
import io.lacuna.regular.Utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders automata as text, either as a canonical dump:
 *
 * <pre>
 * # AFD
 * Q: q0, q1
 * Σ: a, b
 * δ:
 * q0, a -> q1
 * q1, b -> q0
 * q0: q0
 * F: q0
 * </pre>
 *
 * or as a transition table.  Nondeterministic destinations are written as sets, even when there's only one.
 */
public final class AutomatonWriter {

  public static final String UNDEFINED = "—";

  private AutomatonWriter() {
  }

  public static String dump(Automaton automaton, String name) {
    List<String> lines = new ArrayList<>();
    lines.add("# " + name);
    lines.add("Q: " + join(Utils.sorted(automaton.states())));
    lines.add("Σ: " + join(Utils.sorted(automaton.alphabet())));
    lines.add("δ:");

    IList<Transition> transitions = automaton.transitions();
    int i = 0;
    while (i < transitions.size()) {
      Transition t = transitions.nth(i);

      // transitions are sorted, so destinations for the same pair are contiguous
      List<StateId> targets = new ArrayList<>();
      while (i < transitions.size() && sameKey(t, transitions.nth(i))) {
        targets.add(transitions.nth(i++).target);
      }

      String symbol = t.isEpsilon() ? String.valueOf(Automaton.EPSILON) : t.symbol.toString();
      String target = automaton.isDeterministic() ? targets.get(0).toString() : "{" + join(targets) + "}";
      lines.add(t.origin + ", " + symbol + " -> " + target);
    }

    lines.add("q0: " + automaton.start());
    lines.add("F: " + join(Utils.sorted(automaton.finals())));
    return String.join("\n", lines) + "\n";
  }

  public static void write(Automaton automaton, String name, Path path) throws IOException {
    Files.write(path, dump(automaton, name).getBytes(StandardCharsets.UTF_8));
  }

  /**
   * @return a fixed-width table with one row per state, where {@code ->} marks the start state and {@code *} marks
   * accepting states
   */
  public static String table(Automaton automaton) {
    List<StateId> states = Utils.sorted(automaton.states());
    List<Character> signals = Utils.sorted(automaton.alphabet());
    boolean epsilons = states.stream().anyMatch(s -> automaton.epsilonTransitions(s).size() > 0);

    List<List<String>> rows = new ArrayList<>();

    List<String> header = new ArrayList<>();
    header.add("State");
    signals.forEach(c -> header.add(c.toString()));
    if (epsilons) {
      header.add(String.valueOf(Automaton.EPSILON));
    }
    header.add("Final?");
    rows.add(header);

    for (StateId s : states) {
      List<String> row = new ArrayList<>();
      row.add((s.equals(automaton.start()) ? "->" : "  ") + (automaton.isFinal(s) ? "*" : " ") + s);
      for (char c : signals) {
        row.add(cell(automaton.transitions(s, c), automaton.isDeterministic()));
      }
      if (epsilons) {
        row.add(cell(automaton.epsilonTransitions(s), false));
      }
      row.add(automaton.isFinal(s) ? "yes" : "no");
      rows.add(row);
    }

    int[] widths = new int[header.size()];
    for (List<String> row : rows) {
      for (int i = 0; i < row.size(); i++) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }

    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < rows.size(); r++) {
      List<String> row = rows.get(r);
      sb.append('|');
      for (int i = 0; i < row.size(); i++) {
        sb.append(' ').append(pad(row.get(i), widths[i])).append(" |");
      }
      sb.append('\n');

      if (r == 0) {
        sb.append('|');
        for (int w : widths) {
          sb.append("-".repeat(w + 2)).append('|');
        }
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  ///

  private static boolean sameKey(Transition a, Transition b) {
    return a.origin.equals(b.origin) && (a.isEpsilon() ? b.isEpsilon() : a.symbol.equals(b.symbol));
  }

  private static String cell(ISet<StateId> targets, boolean deterministic) {
    if (targets.size() == 0) {
      return UNDEFINED;
    }
    List<StateId> sorted = Utils.sorted(targets);
    return deterministic ? sorted.get(0).toString() : "{" + join(sorted) + "}";
  }

  private static String pad(String s, int width) {
    return s + " ".repeat(width - s.length());
  }

  private static String join(List<?> vals) {
    return vals.stream().map(Object::toString).collect(Collectors.joining(", "));
  }
}
