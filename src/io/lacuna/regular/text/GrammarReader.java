package io.lacuna.regular.text;

import io.lacuna.bifurcan.*;
import io.lacuna.regular.Automaton;
import io.lacuna.regular.Grammar;
import io.lacuna.regular.GrammarShapeException;
import io.lacuna.regular.Production;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads right-linear grammars written one production per line:
 *
 * <pre>
 * # Grammar: G = ({S, A}, {a, b}, P, S)
 * S -> aA | ε
 * A -> bS
 * w = abab
 * </pre>
 *
 * The {@code G = (...)} header and the {@code w = ...} input line are both optional.  Without a header, the
 * nonterminals and terminals are whatever the productions use, and the first production's left side is the start
 * symbol.  Nonterminals are an uppercase letter followed by any digits or primes, anything else is a terminal.
 */
public class GrammarReader {

  private static final Logger LOG = LoggerFactory.getLogger(GrammarReader.class);

  private static final Pattern HEADER = Pattern.compile("^#?\\s*(?:[^=:]*:\\s*)?G\\s*=\\s*\\((.*)\\)\\s*$");
  private static final Pattern INPUT = Pattern.compile("^w\\s*=(.*)$");
  private static final Pattern NONTERMINAL = Pattern.compile("[A-Z][0-9']*");

  private final Consumer<GrammarShapeException> onMalformed;

  public GrammarReader() {
    this(e -> LOG.warn("skipping production: {}", e.getMessage()));
  }

  /**
   * @param onMalformed invoked once for each production which can't be expressed in right-linear form
   */
  public GrammarReader(Consumer<GrammarShapeException> onMalformed) {
    this.onMalformed = onMalformed;
  }

  public GrammarFile read(Path path) throws IOException {
    return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
  }

  public GrammarFile read(Reader reader) throws IOException {
    try (BufferedReader r = new BufferedReader(reader)) {
      return parse(r.lines().collect(Collectors.toList()));
    }
  }

  public GrammarFile parse(String text) {
    return parse(List.of(text.split("\r?\n", -1)));
  }

  public GrammarFile parse(List<String> lines) {
    Header header = null;
    String input = null;
    LinearList<Production> productions = new LinearList<>();

    for (int i = 0; i < lines.size(); i++) {
      int lineNumber = i + 1;
      String line = lines.get(i).trim();

      Matcher m = HEADER.matcher(line);
      if (m.matches()) {
        header = header(m.group(1), lineNumber);
        continue;
      }

      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }

      m = INPUT.matcher(line);
      if (m.matches()) {
        String w = m.group(1).trim();
        input = w.equals(String.valueOf(Automaton.EPSILON)) ? "" : w;
        continue;
      }

      int arrow = line.indexOf("->");
      if (arrow < 0) {
        throw new GrammarFormatException("expected a production, got '" + line + "'", lineNumber);
      }

      String left = line.substring(0, arrow).trim();
      String[] alternatives = line.substring(arrow + 2).split("\\|", -1);
      for (String alternative : alternatives) {
        String text = left + " -> " + alternative.trim();
        try {
          productions.addLast(production(left, alternative, alternatives.length > 1, text, lineNumber));
        } catch (GrammarShapeException e) {
          onMalformed.accept(e);
        }
      }
    }

    if (header == null) {
      header = infer(productions);
    }

    if (!header.nonterminals.contains(header.start)) {
      throw new GrammarFormatException("start symbol '" + header.start + "' is not a nonterminal", -1);
    }

    return new GrammarFile(new Grammar(header.nonterminals, header.terminals, productions, header.start), input);
  }

  ///

  private static class Header {
    final LinearSet<String> nonterminals = new LinearSet<>();
    final LinearSet<Character> terminals = new LinearSet<>();
    String start;
  }

  private static Header header(String body, int line) {
    List<String> parts = split(body, line);
    if (parts.size() != 4) {
      throw new GrammarFormatException("expected G = ({nonterminals}, {terminals}, P, start)", line);
    }

    Header h = new Header();
    elements(parts.get(0), line).forEach(h.nonterminals::add);
    for (String t : elements(parts.get(1), line)) {
      if (t.length() != 1) {
        throw new GrammarFormatException("terminal '" + t + "' is not a single character", line);
      }
      if (t.charAt(0) == Automaton.EPSILON) {
        throw new GrammarFormatException(Automaton.EPSILON + " cannot be declared as a terminal", line);
      }
      h.terminals.add(t.charAt(0));
    }
    h.start = parts.get(3);
    return h;
  }

  // splits on commas which aren't inside braces
  private static List<String> split(String body, int line) {
    List<String> parts = new ArrayList<>();
    StringBuilder sb = new StringBuilder();
    int depth = 0;

    for (char c : body.toCharArray()) {
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
      } else if (c == ',' && depth == 0) {
        parts.add(sb.toString().trim());
        sb.setLength(0);
        continue;
      }
      sb.append(c);
    }

    if (depth != 0) {
      throw new GrammarFormatException("unbalanced braces in grammar header", line);
    }
    parts.add(sb.toString().trim());
    return parts;
  }

  private static List<String> elements(String set, int line) {
    if (!set.startsWith("{") || !set.endsWith("}")) {
      throw new GrammarFormatException("expected a set, got '" + set + "'", line);
    }

    List<String> result = new ArrayList<>();
    for (String s : set.substring(1, set.length() - 1).split(",")) {
      if (!s.trim().isEmpty()) {
        result.add(s.trim());
      }
    }
    return result;
  }

  private static Header infer(IList<Production> productions) {
    if (productions.size() == 0) {
      throw new GrammarFormatException("grammar has no productions", -1);
    }

    Header h = new Header();
    for (Production p : productions) {
      h.nonterminals.add(p.left);
      if (p.right != null) {
        h.nonterminals.add(p.right);
      }
      if (p.terminal != null) {
        h.terminals.add(p.terminal.charAt(0));
      }
    }
    h.start = productions.nth(0).left;
    return h;
  }

  // only a lone ε, or nothing at all after the arrow, is an empty production
  private static Production production(String left, String alternative, boolean choice, String text, int line) {
    if (!NONTERMINAL.matcher(left).matches()) {
      throw new GrammarShapeException(text, "must rewrite a single nonterminal", line);
    }

    List<String> tokens = tokenize(alternative);
    if (tokens.isEmpty() && choice) {
      throw new GrammarShapeException(text, "is an empty alternative, write " + Automaton.EPSILON + " instead", line);
    }
    if (tokens.isEmpty() || (tokens.size() == 1 && tokens.get(0).equals(String.valueOf(Automaton.EPSILON)))) {
      return Production.empty(left);
    }

    if (tokens.contains(String.valueOf(Automaton.EPSILON))) {
      throw new GrammarShapeException(text, "mixes " + Automaton.EPSILON + " with other symbols", line);
    }

    boolean first = NONTERMINAL.matcher(tokens.get(0)).matches();
    if (tokens.size() == 1) {
      return first ? Production.unit(left, tokens.get(0)) : new Production(left, tokens.get(0), null);
    }

    if (tokens.size() == 2 && !first && NONTERMINAL.matcher(tokens.get(1)).matches()) {
      return new Production(left, tokens.get(0), tokens.get(1));
    }

    throw new GrammarShapeException(text, "is not of the form A -> aB, A -> B, A -> a, or A -> ε", line);
  }

  private static List<String> tokenize(String s) {
    List<String> tokens = new ArrayList<>();
    int i = 0;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c >= 'A' && c <= 'Z') {
        int j = i + 1;
        while (j < s.length() && (Character.isDigit(s.charAt(j)) || s.charAt(j) == '\'')) {
          j++;
        }
        tokens.add(s.substring(i, j));
        i = j;
      } else {
        tokens.add(String.valueOf(c));
        i++;
      }
    }
    return tokens;
  }
}
