package ai.wordle.game;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads word lists produced by the offline word-list pipeline.
 * <p>
 * Two formats are understood:
 * <ul>
 *   <li>{@code .txt}: one word per line; every word counts once.</li>
 *   <li>{@code .csv}: header {@code word,count}; rows with a non-positive count are dropped.</li>
 * </ul>
 * Words are lowercased and stripped of accents; only {@code [a-z]{L}} survives, first
 * occurrence wins, and the result is sorted. When no explicit file is given the loader
 * looks in its directory for {@code spanish_<L>letter.csv}, then {@code mini_spanish_<L>.txt}.
 */
public class LexiconLoader implements LexiconSource {

    private static final Logger log = LoggerFactory.getLogger(LexiconLoader.class);
    private static final Pattern DIACRITICS = Pattern.compile("\\p{Mn}+");

    private final Path directory;

    public LexiconLoader(Path directory) {
        this.directory = directory;
    }

    @Override
    public Lexicon load(int wordLength, ProbabilityMode mode) throws IOException {
        return load(resolve(wordLength), wordLength, mode);
    }

    /**
     * Loads a specific file.
     *
     * @throws IOException           if the file cannot be read
     * @throws IllegalArgumentException if no word of the requested length survives filtering
     */
    public Lexicon load(Path file, int wordLength, ProbabilityMode mode) throws IOException {
        if (!Files.exists(file)) {
            throw new FileNotFoundException("Word list not found: " + file);
        }
        Map<String, Long> counts = file.getFileName().toString().endsWith(".csv")
                ? readCsv(file, wordLength)
                : readTxt(file, wordLength);
        if (counts.isEmpty()) {
            throw new IllegalArgumentException("No " + wordLength + "-letter words found in " + file);
        }
        List<String> words = new ArrayList<>(counts.keySet());
        Collections.sort(words);
        Vocabulary vocabulary = Vocabulary.of(wordLength, words);
        ProbabilityDistribution distribution = mode == ProbabilityMode.UNIFORM
                ? ProbabilityDistribution.uniform(vocabulary)
                : ProbabilityDistribution.frequency(vocabulary, counts);
        if (log.isDebugEnabled()) {
            log.debug("Loaded {} {}-letter words ({}) from {}", words.size(), wordLength, mode, file);
        }
        return new Lexicon(vocabulary, distribution, mode);
    }

    /**
     * Default file for a word length: the downloaded CSV if present, else the mini list.
     *
     * @throws FileNotFoundException if neither exists
     */
    public Path resolve(int wordLength) throws FileNotFoundException {
        Path csv = directory.resolve("spanish_" + wordLength + "letter.csv");
        if (Files.exists(csv)) {
            return csv;
        }
        Path mini = directory.resolve("mini_spanish_" + wordLength + ".txt");
        if (Files.exists(mini)) {
            return mini;
        }
        throw new FileNotFoundException("No word list found for " + wordLength + "-letter words. Looked for "
                + csv + " and " + mini);
    }

    private static Map<String, Long> readTxt(Path file, int wordLength) throws IOException {
        Pattern accepted = acceptedPattern(wordLength);
        Map<String, Long> counts = new HashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = normalize(line);
                if (!word.isEmpty() && accepted.matcher(word).matches()) {
                    counts.putIfAbsent(word, 1L);
                }
            }
        }
        return counts;
    }

    private static Map<String, Long> readCsv(Path file, int wordLength) throws IOException {
        Pattern accepted = acceptedPattern(wordLength);
        Map<String, Long> counts = new HashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null) {
                return counts;
            }
            String[] columns = header.split(",");
            int wordColumn = indexOf(columns, "word");
            int countColumn = indexOf(columns, "count");
            if (wordColumn < 0 || countColumn < 0) {
                throw new IOException("CSV " + file + " must have a 'word,count' header, got: " + header);
            }
            String line;
            while ((line = reader.readLine()) != null) {
                String[] cells = line.split(",");
                if (cells.length <= Math.max(wordColumn, countColumn)) {
                    continue;
                }
                String word = normalize(cells[wordColumn]);
                if (word.isEmpty() || counts.containsKey(word) || !accepted.matcher(word).matches()) {
                    continue;
                }
                long count;
                try {
                    count = Long.parseLong(cells[countColumn].trim());
                } catch (NumberFormatException e) {
                    throw new IOException("Invalid count in " + file + ": " + line, e);
                }
                if (count > 0) {
                    counts.put(word, count);
                }
            }
        }
        return counts;
    }

    private static int indexOf(String[] columns, String name) {
        for (int i = 0; i < columns.length; i++) {
            if (columns[i].trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    private static Pattern acceptedPattern(int wordLength) {
        return Pattern.compile("^[a-z]{" + wordLength + "}$");
    }

    static String normalize(String raw) {
        String decomposed = Normalizer.normalize(raw.trim().toLowerCase(Locale.ROOT), Normalizer.Form.NFKD);
        return DIACRITICS.matcher(decomposed).replaceAll("");
    }
}
