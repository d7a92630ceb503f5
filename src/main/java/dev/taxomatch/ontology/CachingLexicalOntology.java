package dev.taxomatch.ontology;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-through cache in front of another {@link LexicalOntology}.
 *
 * <p>Entries are populated lazily with {@link ConcurrentHashMap#computeIfAbsent} and never change
 * once computed, so concurrent readers and writers need no further coordination. Failed lookups
 * propagate and are not cached, so a transient failure is retried on the next lookup. The cache can
 * be discarded at any time with {@link #clear()}.
 */
public class CachingLexicalOntology implements LexicalOntology {

  private final LexicalOntology delegate;
  private final ConcurrentHashMap<String, List<Sense>> cache = new ConcurrentHashMap<>();

  public CachingLexicalOntology(LexicalOntology delegate) {
    this.delegate = delegate;
  }

  @Override
  public List<Sense> senses(String term) {
    return cache.computeIfAbsent(term, t -> List.copyOf(delegate.senses(t)));
  }

  /** Number of cached terms. */
  public int size() {
    return cache.size();
  }

  /** Drops every cached entry. */
  public void clear() {
    cache.clear();
  }
}
