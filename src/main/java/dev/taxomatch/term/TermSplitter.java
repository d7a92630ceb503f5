package dev.taxomatch.term;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.KeywordTokenizer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.en.KStemFilter;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.jspecify.annotations.Nullable;

/**
 * Splits category labels into normalized terms.
 *
 * <p>Labels are broken on whitespace and separator punctuation ({@code & / , ; | + - ( )}), each
 * token is stripped of remaining punctuation and lower-cased, English stop-words and purely numeric
 * tokens are dropped, and inflected forms are optionally reduced with Lucene's {@link KStemFilter}.
 * KStem only strips a suffix when the result is a dictionary word, so "couches" becomes "couch"
 * and "dresses" becomes "dress", and stems stay usable as ontology lookup keys.
 *
 * <p>Every term that takes part in a comparison, including related terms returned by the ontology,
 * must go through the same splitter: a stemmed label compared with an unstemmed one silently loses
 * exact matches.
 */
public final class TermSplitter {

  private static final Pattern SEPARATORS = Pattern.compile("[\\s&/,;|+()\\-]+");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]");
  private static final Pattern NUMERIC = Pattern.compile("\\p{N}+");

  private static final CharArraySet STOP_WORDS = EnglishAnalyzer.ENGLISH_STOP_WORDS_SET;

  private static final String FIELD = "term";

  private static final Analyzer STEMMER =
      new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
          Tokenizer source = new KeywordTokenizer();
          return new TokenStreamComponents(source, new KStemFilter(source));
        }
      };

  private final boolean useStemming;

  public TermSplitter(boolean useStemming) {
    this.useStemming = useStemming;
  }

  public boolean usesStemming() {
    return useStemming;
  }

  /**
   * Splits a label into its term set.
   *
   * @param label the category label (null or blank yields an empty set)
   * @return the normalized terms, empty when the label holds only stop-words, numbers or
   *     punctuation
   */
  public TermSet split(@Nullable String label) {
    return new TermSet(new LinkedHashSet<>(tokens(label)));
  }

  /**
   * Normalizes a phrase into an ordered token list, the form used for multi-word ontology lemmas
   * such as "cottage cheese".
   */
  public List<String> tokens(@Nullable String phrase) {
    if (phrase == null || phrase.isBlank()) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    for (String raw : SEPARATORS.split(phrase.toLowerCase(Locale.ROOT))) {
      String token = normalize(raw);
      if (token != null && !tokens.contains(token)) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  /** Splits every label and returns the union, in label order. */
  public TermSet splitAll(List<String> labels) {
    Set<String> merged = new LinkedHashSet<>();
    for (String label : labels) {
      merged.addAll(tokens(label));
    }
    return new TermSet(merged);
  }

  /**
   * Normalizes one raw token.
   *
   * @return the normalized token, or null when it is dropped
   */
  @Nullable String normalize(String raw) {
    String token = NON_ALPHANUMERIC.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("");
    if (token.isEmpty() || NUMERIC.matcher(token).matches() || STOP_WORDS.contains(token)) {
      return null;
    }
    return useStemming ? stem(token) : token;
  }

  private static String stem(String token) {
    try (TokenStream stream = STEMMER.tokenStream(FIELD, token)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      String stemmed = stream.incrementToken() ? term.toString() : token;
      stream.end();
      return stemmed;
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot stem '" + token + "'", e);
    }
  }
}
