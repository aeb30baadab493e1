package io.zmanim.eval;

/**
 * A calculation that produced no value, e.g. a solar angle the sun never reaches that day.
 *
 * @param reason a human readable explanation
 */
public record FailureValue(String reason) implements Value {
  @Override
  public String typeName() {
    return "failure";
  }

  @Override
  public boolean isFailure() {
    return true;
  }
}
