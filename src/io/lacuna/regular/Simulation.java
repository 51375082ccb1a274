package io.lacuna.regular;

import io.lacuna.bifurcan.*;

import java.util.Optional;

/**
 * The outcome of running an input string through an automaton: a verdict, the trace of the run, and, if the run was
 * cut short, where and why.
 */
public final class Simulation {

  public enum Reason {
    SYMBOL_NOT_IN_ALPHABET,
    UNDEFINED_TRANSITION,
    DEAD_END
  }

  public static final class Failure {
    public final int position;
    public final char symbol;
    public final Reason reason;

    Failure(int position, char symbol, Reason reason) {
      this.position = position;
      this.symbol = symbol;
      this.reason = reason;
    }

    @Override
    public String toString() {
      switch (reason) {
        case SYMBOL_NOT_IN_ALPHABET:
          return "'" + symbol + "' at position " + position + " is not in the alphabet";
        case UNDEFINED_TRANSITION:
          return "no transition for '" + symbol + "' at position " + position;
        default:
          return "no state is active after '" + symbol + "' at position " + position;
      }
    }
  }

  /**
   * The states active after consuming one symbol, or, for the first step, before consuming anything.
   */
  public static final class Step {
    private final ISet<StateId> states;
    private final Character symbol;

    Step(ISet<StateId> states, Character symbol) {
      this.states = states;
      this.symbol = symbol;
    }

    public ISet<StateId> states() {
      return states;
    }

    /**
     * @return the single active state of a deterministic run
     */
    public StateId state() {
      if (states.size() != 1) {
        throw new IllegalStateException("step has " + states.size() + " active states");
      }
      return states.iterator().next();
    }

    /**
     * @return the symbol consumed to reach this step, or nothing for the initial step
     */
    public Optional<Character> symbol() {
      return Optional.ofNullable(symbol);
    }

    @Override
    public String toString() {
      String s = states.size() == 1 ? states.iterator().next().toString() : StateId.composite(states).toString();
      return (symbol == null ? "" : symbol + " => ") + s;
    }
  }

  private final boolean accepted;
  private final IList<Step> trace;
  private final Failure failure;

  Simulation(boolean accepted, IList<Step> trace, Failure failure) {
    this.accepted = accepted;
    this.trace = trace;
    this.failure = failure;
  }

  public boolean accepted() {
    return accepted;
  }

  public IList<Step> trace() {
    return trace;
  }

  public Optional<Failure> failure() {
    return Optional.ofNullable(failure);
  }

  @Override
  public String toString() {
    return (accepted ? "accepted" : "rejected") + (failure == null ? "" : ": " + failure);
  }
}
