package io.lacuna.egret;

/**
 * Thrown when an automaton breaks one of its construction invariants.
 */
public class InvalidAutomatonException extends IllegalArgumentException {

  public InvalidAutomatonException(String message) {
    super(message);
  }
}
