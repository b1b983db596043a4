package io.lacuna.egret;

/**
 * Thrown when an operation is applied to an automaton which doesn't satisfy its preconditions.
 */
public class PreconditionException extends IllegalStateException {

  public PreconditionException(String message) {
    super(message);
  }
}
