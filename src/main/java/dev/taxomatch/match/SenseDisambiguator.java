package dev.taxomatch.match;

import dev.taxomatch.ontology.Sense;
import dev.taxomatch.term.TermSet;
import dev.taxomatch.term.TermSplitter;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the meaning of a polysemous category word from the words around it in the taxonomy.
 *
 * <p>Each sense is scored against the context terms (the parent and children of the category): a
 * context term found among the sense's related lemmas (synonyms, hypernyms, hyponyms and part-whole
 * relations) adds 1.0, one found only in the sense's gloss adds 0.5. On top of that, every gloss of
 * a directly related meaning adds the {@link LongestCommonSubstring#similarity longest common
 * substring similarity} between it and each context term, provided the shared run is at least
 * {@value #MIN_COMMON_RUN} characters long or spans the whole term. "Cheese" under "Dairy" thereby
 * resolves to the food rather than to the slang sense. When no sense scores above zero, or the best
 * score is shared, the caller should keep every sense.
 */
public final class SenseDisambiguator {

  static final double RELATION_HIT = 1.0;
  static final double GLOSS_HIT = 0.5;
  static final int MIN_COMMON_RUN = 4;

  private final TermSplitter splitter;

  public SenseDisambiguator(TermSplitter splitter) {
    this.splitter = splitter;
  }

  /**
   * @param senses candidate senses of one term
   * @param context normalized context terms
   * @return the single best-scoring sense, or empty when the context does not decide
   */
  public Optional<Sense> disambiguate(List<Sense> senses, TermSet context) {
    if (senses.size() < 2 || context.isEmpty()) {
      return Optional.empty();
    }

    Sense best = null;
    double bestScore = 0.0;
    boolean tied = false;
    for (Sense sense : senses) {
      double score = score(sense, context);
      if (score > bestScore) {
        best = sense;
        bestScore = score;
        tied = false;
      } else if (score == bestScore && score > 0.0) {
        tied = true;
      }
    }
    return tied ? Optional.empty() : Optional.ofNullable(best);
  }

  /** Overlap score of one sense with the context terms. */
  double score(Sense sense, TermSet context) {
    Set<String> related = new HashSet<>();
    for (String lemma : sense.synonyms()) {
      related.addAll(splitter.tokens(lemma));
    }
    for (String lemma : sense.hypernyms()) {
      related.addAll(splitter.tokens(lemma));
    }
    for (String lemma : sense.hyponyms()) {
      related.addAll(splitter.tokens(lemma));
    }
    for (String lemma : sense.meronyms()) {
      related.addAll(splitter.tokens(lemma));
    }
    for (String lemma : sense.holonyms()) {
      related.addAll(splitter.tokens(lemma));
    }
    TermSet glossTerms = splitter.split(sense.gloss());
    List<String> relatedGlosses =
        sense.relatedGlosses().stream().map(g -> g.toLowerCase(Locale.ROOT)).toList();

    double score = 0.0;
    for (String term : context.terms()) {
      if (related.contains(term)) {
        score += RELATION_HIT;
      } else if (glossTerms.contains(term)) {
        score += GLOSS_HIT;
      }
      for (String gloss : relatedGlosses) {
        score += relatedGlossScore(term, gloss);
      }
    }
    return score;
  }

  static double relatedGlossScore(String term, String gloss) {
    int run = LongestCommonSubstring.length(term, gloss);
    if (run == 0 || run < Math.min(MIN_COMMON_RUN, term.length())) {
      return 0.0;
    }
    return (double) run / Math.max(term.length(), gloss.length());
  }
}
