package io.lacuna.egret;

/**
 * Thrown when a label is not a state of the automaton being queried.
 */
public class InvalidStateException extends IllegalArgumentException {

  public InvalidStateException(String message) {
    super(message);
  }
}
