package dev.taxomatch.ontology;

/**
 * Failure of the lexical-ontology collaborator: unreadable source files, or an unreachable or
 * failing remote lexicon. Adapters wrap their own failures in it; the semantic matcher treats it as
 * "no relations known for this term".
 */
public class OntologyLookupException extends RuntimeException {

  public OntologyLookupException(String message) {
    super(message);
  }

  public OntologyLookupException(String message, Throwable cause) {
    super(message, cause);
  }
}
