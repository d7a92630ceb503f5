package dev.taxomatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the taxonomy mapper.
 *
 * <p>Wires the ontology, matcher, ranker and mapping service; callers drive it through {@link
 * dev.taxomatch.mapping.TaxonomyMappingService}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TaxomatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(TaxomatchApplication.class, args);
    }
}
