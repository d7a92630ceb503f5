package dev.taxomatch.term;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Normalized word tokens derived from one category label. Iteration follows label order so that
 * matching and logging are deterministic; equality ignores order.
 *
 * @param terms the normalized tokens (lower-cased, punctuation-stripped, optionally stemmed)
 */
public record TermSet(Set<String> terms) {

  private static final TermSet EMPTY = new TermSet(Set.of());

  public TermSet {
    terms = Collections.unmodifiableSet(new LinkedHashSet<>(terms));
  }

  public static TermSet empty() {
    return EMPTY;
  }

  /** Wraps already-normalized terms. */
  public static TermSet of(String... terms) {
    return new TermSet(new LinkedHashSet<>(Arrays.asList(terms)));
  }

  public boolean isEmpty() {
    return terms.isEmpty();
  }

  public int size() {
    return terms.size();
  }

  public boolean contains(String term) {
    return terms.contains(term);
  }

  public boolean containsAll(Collection<String> phrase) {
    return !phrase.isEmpty() && terms.containsAll(phrase);
  }

  /** Union of this set and another, this set's terms first. */
  public TermSet union(TermSet other) {
    Set<String> merged = new LinkedHashSet<>(terms);
    merged.addAll(other.terms);
    return new TermSet(merged);
  }

  @Override
  public String toString() {
    return terms.toString();
  }
}
