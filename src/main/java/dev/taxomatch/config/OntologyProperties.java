package dev.taxomatch.config;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised configuration for the lexical ontology, bound from {@code taxomatch.ontology.*}.
 *
 * <ul>
 *   <li>{@code lexicon} - JSON lexicon resource, used when no WordNet location is set
 *   <li>{@code wordnet-location} - directory holding the WordNet Prolog files ({@code wn_s.pl},
 *       {@code wn_hyp.pl}, {@code wn_g.pl}); must end with a slash
 *   <li>{@code cache} - wrap the ontology in a read-through cache (default true)
 * </ul>
 */
@ConfigurationProperties(prefix = "taxomatch.ontology")
public record OntologyProperties(
    @DefaultValue("classpath:ontology/lexicon.json") String lexicon,
    @Nullable String wordnetLocation,
    @DefaultValue("true") boolean cache) {}
