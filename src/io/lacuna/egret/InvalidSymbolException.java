package io.lacuna.egret;

/**
 * Thrown when a symbol is neither epsilon nor a member of the automaton's alphabet.
 */
public class InvalidSymbolException extends IllegalArgumentException {

  public InvalidSymbolException(String message) {
    super(message);
  }
}
