package dev.taxomatch.mapping.eval;

import dev.taxomatch.path.Path;
import java.util.List;

/**
 * An annotated mapping: a source path, a candidate taxonomy, and the candidate that a curator
 * judged to be the right target.
 *
 * @param id short identifier used in reports
 * @param source source path labels, root first
 * @param candidates candidate taxonomy as label paths, root first
 * @param expected labels of the expected target path
 */
public record GoldenMapping(
    String id, List<String> source, List<List<String>> candidates, List<String> expected) {

  public GoldenMapping {
    source = List.copyOf(source);
    candidates = candidates.stream().map(List::copyOf).toList();
    expected = List.copyOf(expected);
  }

  public Path sourcePath() {
    return Path.of(source);
  }

  public List<Path> candidatePaths() {
    return candidates.stream().map(Path::of).toList();
  }
}
