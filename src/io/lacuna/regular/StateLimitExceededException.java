package io.lacuna.regular;

/**
 * Thrown when subset construction discovers more states than its configured ceiling.
 */
public class StateLimitExceededException extends AutomatonException {

  private final int limit;

  public StateLimitExceededException(int limit) {
    super("subset construction exceeded " + limit + " states");
    this.limit = limit;
  }

  public int limit() {
    return limit;
  }
}
