package dev.taxomatch.path;

/**
 * Raised synchronously when the matching engine is handed input it cannot work with: an empty
 * source path, a blank node label, or a source leaf whose label yields no extractable terms.
 *
 * <p>This is the only hard error surfaced by the engine. Malformed candidates and unreachable
 * ontology entries are absorbed into the graded scoring model instead.
 */
public class InvalidInputException extends RuntimeException {

  public InvalidInputException(String message) {
    super(message);
  }
}
