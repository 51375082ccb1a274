package io.lacuna.regular;

import io.lacuna.regular.text.AutomatonWriter;
import io.lacuna.regular.text.GrammarFile;
import io.lacuna.regular.text.GrammarReader;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Reads a grammar, converts it into an NFA, a DFA, and the DFA's reverse and complement, writes each of them out, and
 * runs an input string through them.
 */
public class Main {

  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  public static final String NFA_FILE = "AFN.txt";
  public static final String DFA_FILE = "AFD.txt";
  public static final String REVERSE_FILE = "REV.txt";
  public static final String COMPLEMENT_FILE = "COMP.txt";

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  static ArgumentParser parser() {
    ArgumentParser parser = ArgumentParsers.newFor("regular").build()
            .defaultHelp(true)
            .description("Converts a right-linear grammar into finite automata and simulates an input string");

    parser.addArgument("grammar")
            .help("grammar file");
    parser.addArgument("input")
            .nargs("?")
            .help("input string, defaults to the grammar's 'w =' line");
    parser.addArgument("-o", "--output")
            .setDefault(".")
            .help("directory the automata are written to");
    parser.addArgument("--max-states")
            .type(Integer.class)
            .setDefault(Determinizer.DEFAULT_MAX_STATES)
            .help("most states subset construction may discover");
    parser.addArgument("--no-rename")
            .action(Arguments.storeTrue())
            .help("keep the subset labels of determinized states");

    return parser;
  }

  /**
   * @return the process exit code: 0 on success, 1 for bad arguments, 2 if the grammar couldn't be processed
   */
  static int run(String[] args, PrintStream out) {
    ArgumentParser parser = parser();
    Namespace ns;
    try {
      ns = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      return 1;
    }

    int maxStates = ns.getInt("max_states");
    if (maxStates <= 0) {
      LOG.error("--max-states must be positive, was {}", maxStates);
      return 1;
    }

    try {
      Pipeline p = new Pipeline(new Determinizer(maxStates), !ns.getBoolean("no_rename"));
      p.run(Paths.get(ns.getString("grammar")), Paths.get(ns.getString("output")), out);

      Optional<String> input = Optional.ofNullable(ns.getString("input"));
      if (!input.isPresent()) {
        input = p.input;
      }

      if (input.isPresent()) {
        p.simulate(input.get(), out);
      } else {
        LOG.info("no input string given, skipping simulation");
      }
      return 0;
    } catch (IOException e) {
      LOG.error("I/O failure: {}", e.getMessage());
      return 2;
    } catch (AutomatonException e) {
      LOG.error("{}", e.getMessage());
      return 2;
    }
  }

  static class Pipeline {

    private final Determinizer determinizer;
    private final boolean rename;

    Automaton nfa, dfa, reverse, complement;
    Optional<String> input = Optional.empty();

    Pipeline(Determinizer determinizer, boolean rename) {
      this.determinizer = determinizer;
      this.rename = rename;
    }

    void run(Path grammarFile, Path outputDir, PrintStream out) throws IOException {
      LOG.info("reading grammar from {}", grammarFile);
      GrammarFile file = new GrammarReader().read(grammarFile);
      input = file.input();
      Files.createDirectories(outputDir);

      nfa = new NfaBuilder().build(file.grammar());
      emit(nfa, "AFN", outputDir.resolve(NFA_FILE), out);

      dfa = determinize(nfa);
      emit(dfa, "AFD", outputDir.resolve(DFA_FILE), out);

      reverse = determinize(Operations.reverse(dfa));
      emit(reverse, "REV", outputDir.resolve(REVERSE_FILE), out);

      complement = Operations.complement(Operations.complete(dfa));
      emit(complement, "COMP", outputDir.resolve(COMPLEMENT_FILE), out);
    }

    void simulate(String input, PrintStream out) {
      out.println("input: " + (input.isEmpty() ? String.valueOf(Automaton.EPSILON) : "'" + input + "'"));
      report("AFD", Simulator.simulate(dfa, input), out);
      report("REV", Simulator.simulate(reverse, input), out);
      report("COMP", Simulator.simulate(complement, input), out);
    }

    private Automaton determinize(Automaton automaton) {
      Automaton dfa = determinizer.determinize(automaton);
      return rename ? StateRenamer.rename(dfa) : dfa;
    }

    private void emit(Automaton automaton, String name, Path path, PrintStream out) throws IOException {
      AutomatonWriter.write(automaton, name, path);
      LOG.info("wrote {} {} to {}", name, automaton, path);

      out.println("== " + name);
      out.print(AutomatonWriter.table(automaton));
      out.println();
    }

    private static void report(String name, Simulation simulation, PrintStream out) {
      out.println("== " + name + ": " + (simulation.accepted() ? "ACCEPTED" : "REJECTED"));
      int i = 0;
      for (Simulation.Step step : simulation.trace()) {
        out.println("  " + i++ + ": " + step);
      }
      simulation.failure().ifPresent(f -> out.println("  " + f));
    }
  }
}
