package dev.taxomatch.mapping;

import dev.taxomatch.path.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Request to map one source path onto a candidate taxonomy.
 *
 * @param source the source path, root first
 * @param candidates candidate paths; null or malformed entries are skipped, not rejected
 * @param maxResults the maximum number of ranked candidates to return (must be >= 1)
 * @param minScore optional minimum ranking score in [0, 1]
 */
public record MappingRequest(
    Path source, List<Path> candidates, int maxResults, @Nullable Double minScore) {

  /** Default number of results when not specified. */
  private static final int DEFAULT_MAX_RESULTS = 10;

  /** Compact constructor validating input. */
  public MappingRequest {
    if (source == null) {
      throw new IllegalArgumentException("Source path must not be null");
    }
    if (candidates == null) {
      throw new IllegalArgumentException("Candidates must not be null");
    }
    if (maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be at least 1");
    }
    if (minScore != null && (minScore < 0.0 || minScore > 1.0)) {
      throw new IllegalArgumentException("minScore must be in [0, 1], got: " + minScore);
    }
    candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
  }

  /** Convenience constructor defaulting maxResults to 10 and no score threshold. */
  public MappingRequest(Path source, List<Path> candidates) {
    this(source, candidates, DEFAULT_MAX_RESULTS, null);
  }

  /** Convenience constructor with maxResults and no score threshold. */
  public MappingRequest(Path source, List<Path> candidates, int maxResults) {
    this(source, candidates, maxResults, null);
  }
}
