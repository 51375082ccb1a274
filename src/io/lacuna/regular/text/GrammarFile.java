package io.lacuna.regular.text;

import io.lacuna.regular.Grammar;

import java.util.Optional;

/**
 * A parsed grammar, along with the input string given by its {@code w = ...} line, if any.
 */
public final class GrammarFile {

  private final Grammar grammar;
  private final String input;

  GrammarFile(Grammar grammar, String input) {
    this.grammar = grammar;
    this.input = input;
  }

  public Grammar grammar() {
    return grammar;
  }

  /**
   * @return the declared input string, which is distinct from an empty one
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }
}
