package dev.taxomatch.ontology;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lexical ontology read from the WordNet Prolog distribution.
 *
 * <p>Four files are understood:
 *
 * <ul>
 *   <li>{@code wn_s.pl} (required) - {@code s(synset_id,w_num,'word',ss_type,sense_number,
 *       tag_count).} one line per word in a synset
 *   <li>{@code wn_hyp.pl} (optional) - {@code hyp(synset_id,hypernym_synset_id).}
 *   <li>{@code wn_g.pl} (optional) - {@code g(synset_id,'(gloss)').}
 *   <li>{@code wn_mp.pl} (optional) - {@code mp(whole_synset_id,part_synset_id).}
 * </ul>
 *
 * <p>Only noun synsets are kept, since taxonomy categories are nouns. Each word's senses are
 * ordered by WordNet sense number, most common first. Each sense carries the glosses of the synsets
 * it is directly linked to by hypernymy, hyponymy or part meronymy. Lines that do not parse are
 * skipped and counted.
 *
 * @see <a href="https://wordnet.princeton.edu/documentation/prologdb5wn">prologdb(5WN)</a>
 */
public final class WordNetPrologOntology implements LexicalOntology {

  private static final Logger log = LoggerFactory.getLogger(WordNetPrologOntology.class);

  private static final Pattern SYNSET_LINE =
      Pattern.compile("^s\\((\\d+),(\\d+),'((?:[^']|'')*)',(\\w),(\\d+),(\\d+)\\)\\.\\s*$");
  private static final Pattern HYPERNYM_LINE = Pattern.compile("^hyp\\((\\d+),(\\d+)\\)\\.\\s*$");
  private static final Pattern PART_MERONYM_LINE =
      Pattern.compile("^mp\\((\\d+),(\\d+)\\)\\.\\s*$");
  private static final Pattern GLOSS_LINE =
      Pattern.compile("^g\\((\\d+),'((?:[^']|'')*)'\\)\\.\\s*$");

  private static final String NOUN = "n";

  private final Map<String, List<Sense>> senses;

  private WordNetPrologOntology(Map<String, List<Sense>> senses) {
    this.senses = Map.copyOf(senses);
  }

  /**
   * Parses the Prolog files without part meronyms. Readers are not closed.
   *
   * @see #load(Reader, Reader, Reader, Reader)
   */
  public static WordNetPrologOntology load(
      Reader synsets, @Nullable Reader hypernyms, @Nullable Reader glosses) {
    return load(synsets, hypernyms, glosses, null);
  }

  /**
   * Parses the Prolog files into an in-memory ontology. Readers are not closed.
   *
   * @param synsets contents of {@code wn_s.pl}
   * @param hypernyms contents of {@code wn_hyp.pl}, or null
   * @param glosses contents of {@code wn_g.pl}, or null
   * @param partMeronyms contents of {@code wn_mp.pl}, or null
   * @return the loaded ontology
   * @throws OntologyLookupException if a file cannot be read
   */
  public static WordNetPrologOntology load(
      Reader synsets,
      @Nullable Reader hypernyms,
      @Nullable Reader glosses,
      @Nullable Reader partMeronyms) {
    Map<String, List<String>> synsetWords = new HashMap<>();
    Map<String, List<WordSense>> wordSenses = new HashMap<>();
    Map<String, Set<String>> hypernymIds = new HashMap<>();
    Map<String, Set<String>> hyponymIds = new HashMap<>();
    Map<String, Set<String>> meronymIds = new HashMap<>();
    Map<String, Set<String>> holonymIds = new HashMap<>();
    Map<String, String> glossById = new HashMap<>();

    int rejected = parseSynsets(synsets, synsetWords, wordSenses);
    if (hypernyms != null) {
      rejected +=
          parsePointers(
              hypernyms, "wn_hyp.pl", HYPERNYM_LINE, synsetWords, hypernymIds, hyponymIds);
    }
    if (partMeronyms != null) {
      rejected +=
          parsePointers(
              partMeronyms, "wn_mp.pl", PART_MERONYM_LINE, synsetWords, meronymIds, holonymIds);
    }
    if (glosses != null) {
      rejected += parseGlosses(glosses, synsetWords, glossById);
    }

    Map<String, List<Sense>> senses = new HashMap<>();
    for (Map.Entry<String, List<WordSense>> entry : wordSenses.entrySet()) {
      String word = entry.getKey();
      List<Sense> list = new ArrayList<>();
      entry.getValue().stream()
          .sorted(Comparator.comparingInt(WordSense::senseNumber))
          .forEach(
              ws -> {
                String id = ws.synsetId();
                list.add(
                    new Sense(
                        id,
                        wordsExcept(synsetWords.get(id), word),
                        wordsOf(hypernymIds.get(id), synsetWords),
                        wordsOf(hyponymIds.get(id), synsetWords),
                        wordsOf(meronymIds.get(id), synsetWords),
                        wordsOf(holonymIds.get(id), synsetWords),
                        glossById.get(id),
                        glossesOf(
                            glossById,
                            hypernymIds.get(id),
                            hyponymIds.get(id),
                            meronymIds.get(id),
                            holonymIds.get(id))));
              });
      senses.put(word, list);
    }

    log.info(
        "Loaded WordNet ontology: {} words, {} noun synsets, {} lines rejected",
        senses.size(),
        synsetWords.size(),
        rejected);
    return new WordNetPrologOntology(senses);
  }

  @Override
  public List<Sense> senses(String term) {
    return senses.getOrDefault(term.trim().toLowerCase(Locale.ROOT), List.of());
  }

  /** Number of distinct words loaded. */
  public int size() {
    return senses.size();
  }

  private static int parseSynsets(
      Reader reader, Map<String, List<String>> synsetWords, Map<String, List<WordSense>> words) {
    int rejected = 0;
    for (String line : readLines(reader, "wn_s.pl")) {
      Matcher matcher = SYNSET_LINE.matcher(line);
      if (!matcher.matches()) {
        rejected++;
        continue;
      }
      if (!NOUN.equals(matcher.group(4))) {
        continue;
      }
      String synsetId = matcher.group(1);
      String word = unquote(matcher.group(3)).toLowerCase(Locale.ROOT).replace('_', ' ');
      int senseNumber = Integer.parseInt(matcher.group(5));
      synsetWords.computeIfAbsent(synsetId, k -> new ArrayList<>()).add(word);
      words.computeIfAbsent(word, k -> new ArrayList<>()).add(new WordSense(synsetId, senseNumber));
    }
    return rejected;
  }

  /** Reads {@code op(from,to).} lines into forward and reverse links between noun synsets. */
  private static int parsePointers(
      Reader reader,
      String fileName,
      Pattern line,
      Map<String, List<String>> synsetWords,
      Map<String, Set<String>> forward,
      Map<String, Set<String>> reverse) {
    int rejected = 0;
    for (String text : readLines(reader, fileName)) {
      Matcher matcher = line.matcher(text);
      if (!matcher.matches()) {
        rejected++;
        continue;
      }
      String from = matcher.group(1);
      String to = matcher.group(2);
      if (!synsetWords.containsKey(from) || !synsetWords.containsKey(to)) {
        continue;
      }
      forward.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
      reverse.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
    }
    return rejected;
  }

  private static int parseGlosses(
      Reader reader, Map<String, List<String>> synsetWords, Map<String, String> glossById) {
    int rejected = 0;
    for (String line : readLines(reader, "wn_g.pl")) {
      Matcher matcher = GLOSS_LINE.matcher(line);
      if (!matcher.matches()) {
        rejected++;
        continue;
      }
      if (synsetWords.containsKey(matcher.group(1))) {
        glossById.put(matcher.group(1), unquote(matcher.group(2)));
      }
    }
    return rejected;
  }

  private static List<String> readLines(Reader reader, String fileName) {
    BufferedReader buffered =
        reader instanceof BufferedReader br ? br : new BufferedReader(reader);
    try {
      List<String> lines = new ArrayList<>();
      String line;
      while ((line = buffered.readLine()) != null) {
        if (!line.isBlank()) {
          lines.add(line.trim());
        }
      }
      return lines;
    } catch (IOException e) {
      throw new OntologyLookupException("Failed to read WordNet file " + fileName, e);
    }
  }

  private static String unquote(String quoted) {
    return quoted.replace("''", "'");
  }

  private static Set<String> wordsExcept(List<String> synset, String word) {
    Set<String> result = new LinkedHashSet<>(synset);
    result.remove(word);
    return result;
  }

  private static Set<String> wordsOf(
      @Nullable Set<String> synsetIds, Map<String, List<String>> synsetWords) {
    Set<String> result = new LinkedHashSet<>();
    if (synsetIds != null) {
      for (String id : synsetIds) {
        result.addAll(synsetWords.getOrDefault(id, List.of()));
      }
    }
    return result;
  }

  @SafeVarargs
  private static List<String> glossesOf(
      Map<String, String> glossById, @Nullable Set<String>... synsetIdSets) {
    Set<String> glosses = new LinkedHashSet<>();
    for (Set<String> ids : synsetIdSets) {
      if (ids == null) {
        continue;
      }
      for (String id : ids) {
        String gloss = glossById.get(id);
        if (gloss != null) {
          glosses.add(gloss);
        }
      }
    }
    return List.copyOf(glosses);
  }

  private record WordSense(String synsetId, int senseNumber) {}
}
