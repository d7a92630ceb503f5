package dev.taxomatch.match;

import dev.taxomatch.ontology.LexicalOntology;
import dev.taxomatch.ontology.OntologyLookupException;
import dev.taxomatch.ontology.RelationKind;
import dev.taxomatch.ontology.Sense;
import dev.taxomatch.ontology.TermRelation;
import dev.taxomatch.term.ExtendedTermSet;
import dev.taxomatch.term.TermSet;
import dev.taxomatch.term.TermSplitter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether two taxonomy nodes denote the same concept.
 *
 * <p>Each source category term is resolved against the candidate, strongest evidence first:
 *
 * <ol>
 *   <li>the term itself is a candidate category term: {@link MatchKind#EXACT}
 *   <li>an ontology relation of the term (synonym, hypernym, hyponym) is a candidate category term:
 *       {@link MatchKind#SYNONYM} or {@link MatchKind#HYPERNYM}; multi-word lemmas need all their
 *       words present. Accepted regardless of the threshold. Part-whole relations never match a
 *       category directly.
 *   <li>a candidate category term is the head of a compound source term ("armchair" ends with
 *       "chair"): {@link MatchKind#HYPERNYM}. The head must have at least {@value
 *       #MIN_HEAD_LENGTH} characters and leave a modifier of at least {@value
 *       #MIN_MODIFIER_LENGTH}; a term found at the start or in the middle of another does not
 *       count.
 *   <li>the best Damerau-Levenshtein similarity against a candidate category term reaches the
 *       threshold: {@link MatchKind#EDIT_DISTANCE}
 *   <li>the term or one of its relations, part-whole ones included, appears in the candidate's
 *       parent or children: {@link MatchKind#HYPERNYM}, the candidate being a broader or narrower
 *       neighbour
 * </ol>
 *
 * <p>Senses of polysemous terms are narrowed with the source node's context through {@link
 * SenseDisambiguator}. The configured {@link TermMatchPolicy} then turns per-term outcomes into a
 * node decision. A node without terms on either side yields {@link
 * MatchKind#INSUFFICIENT_INFORMATION}.
 *
 * <p>An ontology failure for a term is logged and treated as "no relations known"; matching of
 * that term continues with edit distance.
 */
@Component
public class SemanticMatcher {

  private static final Logger log = LoggerFactory.getLogger(SemanticMatcher.class);

  static final int MIN_HEAD_LENGTH = 4;
  static final int MIN_MODIFIER_LENGTH = 3;

  private final LexicalOntology ontology;
  private final TermSplitter splitter;
  private final MatchingConfig config;
  private final SenseDisambiguator disambiguator;

  public SemanticMatcher(LexicalOntology ontology, TermSplitter splitter, MatchingConfig config) {
    this.ontology = ontology;
    this.splitter = splitter;
    this.config = config;
    this.disambiguator = new SenseDisambiguator(splitter);
  }

  public MatchingConfig config() {
    return config;
  }

  /** Matches with the configured threshold. */
  public NodeMatch match(ExtendedTermSet source, ExtendedTermSet candidate) {
    return match(source, candidate, config.threshold());
  }

  /**
   * Matches a source node against a candidate node.
   *
   * @param source extended term set of the source node
   * @param candidate extended term set of the candidate node
   * @param threshold minimum edit-distance similarity (tnode) for the fallback path
   * @return the node-level decision with per-term detail
   */
  public NodeMatch match(ExtendedTermSet source, ExtendedTermSet candidate, double threshold) {
    if (source.isDegenerate() || candidate.isDegenerate()) {
      return NodeMatch.insufficientInformation();
    }

    TermSet sourceContext = source.context();
    List<TermMatch> termMatches = new ArrayList<>(source.category().size());
    int matched = 0;
    MatchKind weakest = MatchKind.EXACT;
    for (String term : source.category().terms()) {
      TermMatch termMatch = matchTerm(term, sourceContext, candidate, threshold);
      termMatches.add(termMatch);
      if (termMatch.isMatch()) {
        matched++;
        weakest = weakest.weakest(termMatch.kind());
      }
    }

    int total = source.category().size();
    double coverage = (double) matched / total;
    if (config.termMatchPolicy().accepts(matched, total)) {
      return new NodeMatch(weakest, coverage, termMatches);
    }
    return new NodeMatch(MatchKind.NO_MATCH, coverage, termMatches);
  }

  private TermMatch matchTerm(
      String term, TermSet sourceContext, ExtendedTermSet candidate, double threshold) {
    TermSet category = candidate.category();
    if (category.contains(term)) {
      return new TermMatch(term, term, MatchKind.EXACT, 1.0);
    }

    List<RelatedTerm> related = relatedTerms(term, sourceContext);
    TermMatch byRelation = null;
    for (RelatedTerm relatedTerm : related) {
      if (relatedTerm.kind().isPartWhole()) {
        continue;
      }
      if (category.containsAll(relatedTerm.tokens())) {
        MatchKind kind =
            relatedTerm.kind() == RelationKind.SYNONYM ? MatchKind.SYNONYM : MatchKind.HYPERNYM;
        if (byRelation == null || kind.ordinal() < byRelation.kind().ordinal()) {
          byRelation = new TermMatch(term, relatedTerm.phrase(), kind, 1.0);
        }
      }
    }
    if (byRelation != null) {
      return byRelation;
    }

    for (String candidateTerm : category.terms()) {
      if (isHeadOf(candidateTerm, term)) {
        return new TermMatch(term, candidateTerm, MatchKind.HYPERNYM, 1.0);
      }
    }

    String closest = null;
    double bestSimilarity = 0.0;
    for (String candidateTerm : category.terms()) {
      double similarity = DamerauLevenshtein.similarity(term, candidateTerm);
      if (similarity > bestSimilarity) {
        bestSimilarity = similarity;
        closest = candidateTerm;
      }
    }
    if (closest != null && bestSimilarity >= threshold) {
      return new TermMatch(term, closest, MatchKind.EDIT_DISTANCE, bestSimilarity);
    }

    List<TermSet> neighbours = new ArrayList<>(candidate.children().size() + 1);
    neighbours.add(candidate.parent());
    neighbours.addAll(candidate.children());
    for (TermSet neighbour : neighbours) {
      if (neighbour.contains(term)) {
        return new TermMatch(term, term, MatchKind.HYPERNYM, 1.0);
      }
      for (RelatedTerm relatedTerm : related) {
        if (neighbour.containsAll(relatedTerm.tokens())) {
          return new TermMatch(term, relatedTerm.phrase(), MatchKind.HYPERNYM, 1.0);
        }
      }
    }

    return TermMatch.unmatched(term, bestSimilarity);
  }

  /** Whether {@code head} closes the compound {@code term} as a separate component. */
  static boolean isHeadOf(String head, String term) {
    return head.length() >= MIN_HEAD_LENGTH
        && term.length() - head.length() >= MIN_MODIFIER_LENGTH
        && term.endsWith(head);
  }

  /** Ontology relations of a term, normalized with the same splitter as the term sets. */
  private List<RelatedTerm> relatedTerms(String term, TermSet sourceContext) {
    List<Sense> senses = lookup(term);
    if (senses.isEmpty()) {
      return List.of();
    }
    List<Sense> chosen =
        disambiguator.disambiguate(senses, sourceContext).map(List::of).orElse(senses);

    List<RelatedTerm> related = new ArrayList<>();
    for (TermRelation relation : Sense.relationsOf(chosen)) {
      List<String> tokens = splitter.tokens(relation.term());
      if (tokens.isEmpty() || tokens.equals(List.of(term))) {
        continue;
      }
      related.add(new RelatedTerm(tokens, relation.kind()));
    }
    return related;
  }

  private List<Sense> lookup(String term) {
    try {
      return ontology.senses(term);
    } catch (OntologyLookupException e) {
      log.warn(
          "Ontology lookup failed for '{}', falling back to edit distance: {}",
          term,
          e.getMessage());
      return List.of();
    }
  }

  private record RelatedTerm(List<String> tokens, RelationKind kind) {

    String phrase() {
      return String.join(" ", tokens);
    }
  }
}
