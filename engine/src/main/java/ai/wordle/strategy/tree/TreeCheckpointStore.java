package ai.wordle.strategy.tree;

import ai.wordle.game.ProbabilityMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File storage for decision-tree checkpoints and finished trees.
 * <p>
 * Layout inside the directory, per configuration:
 * <ul>
 *   <li>{@code checkpoint_<L>_<mode>.json}: partial map while a build is in progress.</li>
 *   <li>{@code tree_<L>_<mode>.json}: finished tree; its presence marks the configuration done.</li>
 * </ul>
 * Saves always replace the whole file: the document is written to a temporary file in the same
 * directory, synced, then moved over the target atomically, so a reader (or a restarted build)
 * sees either the previous complete map or the new one.
 */
public class TreeCheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(TreeCheckpointStore.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Path directory;

    public TreeCheckpointStore(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    public Path checkpointPath(int wordLength, ProbabilityMode mode) {
        return directory.resolve("checkpoint_" + wordLength + "_" + mode.key() + ".json");
    }

    public Path treePath(int wordLength, ProbabilityMode mode) {
        return directory.resolve("tree_" + wordLength + "_" + mode.key() + ".json");
    }

    /**
     * Loads the checkpoint, or an empty map if none exists.
     *
     * @throws CheckpointCorruptedException if the file exists but is unreadable or inconsistent
     */
    public Map<FeedbackPath, String> loadCheckpoint(int wordLength, ProbabilityMode mode) throws IOException {
        return read(checkpointPath(wordLength, mode), wordLength, mode);
    }

    /**
     * Atomically replaces the checkpoint with the given map.
     */
    public void saveCheckpoint(int wordLength, ProbabilityMode mode, Map<FeedbackPath, String> nodes) throws IOException {
        write(checkpointPath(wordLength, mode), wordLength, mode, nodes);
    }

    public void deleteCheckpoint(int wordLength, ProbabilityMode mode) throws IOException {
        if (Files.deleteIfExists(checkpointPath(wordLength, mode)) && log.isDebugEnabled()) {
            log.debug("Checkpoint removed for {}_{}", wordLength, mode.key());
        }
    }

    /**
     * Finished tree for the configuration, if one has been written.
     *
     * @throws CheckpointCorruptedException if the tree file exists but is unreadable or inconsistent
     */
    public Optional<DecisionTree> loadTree(int wordLength, ProbabilityMode mode) throws IOException {
        Path path = treePath(wordLength, mode);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(new DecisionTree(wordLength, mode, read(path, wordLength, mode)));
    }

    public void saveTree(DecisionTree tree) throws IOException {
        write(treePath(tree.wordLength(), tree.mode()), tree.wordLength(), tree.mode(), tree.asMap());
    }

    private Map<FeedbackPath, String> read(Path path, int wordLength, ProbabilityMode mode) throws IOException {
        Map<FeedbackPath, String> nodes = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            return nodes;
        }
        TreeDocument document;
        try {
            document = OBJECT_MAPPER.readValue(path.toFile(), TreeDocument.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointCorruptedException("Unreadable tree file " + path, e);
        }
        if (document.getWordLength() != wordLength || !mode.key().equals(document.getMode())) {
            throw new CheckpointCorruptedException("Tree file " + path + " belongs to "
                    + document.getWordLength() + "_" + document.getMode() + ", expected " + wordLength + "_" + mode.key());
        }
        if (document.getNodes() == null) {
            throw new CheckpointCorruptedException("Tree file " + path + " has no nodes");
        }
        for (Map.Entry<String, String> entry : document.getNodes().entrySet()) {
            String guess = entry.getValue();
            if (guess == null || guess.length() != wordLength) {
                throw new CheckpointCorruptedException("Invalid guess '" + guess + "' at path '"
                        + entry.getKey() + "' in " + path);
            }
            try {
                nodes.put(FeedbackPath.parse(entry.getKey(), wordLength), guess);
            } catch (IllegalArgumentException e) {
                throw new CheckpointCorruptedException("Malformed path '" + entry.getKey() + "' in " + path, e);
            }
        }
        return nodes;
    }

    private void write(Path path, int wordLength, ProbabilityMode mode, Map<FeedbackPath, String> nodes) throws IOException {
        Files.createDirectories(directory);
        Map<String, String> keyed = new LinkedHashMap<>();
        for (Map.Entry<FeedbackPath, String> entry : nodes.entrySet()) {
            keyed.put(entry.getKey().key(), entry.getValue());
        }
        TreeDocument document = new TreeDocument(wordLength, mode.key(), keyed);

        Path tmp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
        try {
            byte[] body = OBJECT_MAPPER.writeValueAsBytes(document);
            try (FileOutputStream out = new FileOutputStream(tmp.toFile())) {
                out.write(body);
                out.getFD().sync();
            }
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                // Same-directory renames are atomic on every platform we target; this is the last resort.
                log.warn("Atomic move not supported in {}; falling back to replace", directory);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        if (log.isTraceEnabled()) {
            log.trace("Wrote {} nodes to {}", nodes.size(), path);
        }
    }
}
