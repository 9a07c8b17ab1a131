package ai.wordle.strategy.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.wordle.game.ProbabilityMode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TreeCheckpointStoreTest {

    @TempDir
    Path dir;

    private static Map<FeedbackPath, String> sampleNodes() {
        Map<FeedbackPath, String> nodes = new LinkedHashMap<>();
        nodes.put(FeedbackPath.ROOT, "casa");
        nodes.put(FeedbackPath.parse("0120", 4), "mesa");
        nodes.put(FeedbackPath.parse("0120/0002", 4), "rosa");
        return nodes;
    }

    @Test
    void missingCheckpoint_isEmpty() throws IOException {
        TreeCheckpointStore store = new TreeCheckpointStore(dir.resolve("trees"));
        assertTrue(store.loadCheckpoint(4, ProbabilityMode.UNIFORM).isEmpty());
        assertEquals(Optional.empty(), store.loadTree(4, ProbabilityMode.UNIFORM));
    }

    @Test
    void save_replacesTheWholeCheckpointAndLeavesNoTempFiles() throws IOException {
        TreeCheckpointStore store = new TreeCheckpointStore(dir);
        store.saveCheckpoint(4, ProbabilityMode.UNIFORM, Map.of(FeedbackPath.ROOT, "casa"));
        store.saveCheckpoint(4, ProbabilityMode.UNIFORM, sampleNodes());

        assertEquals(sampleNodes(), store.loadCheckpoint(4, ProbabilityMode.UNIFORM));
        try (Stream<Path> files = Files.list(dir)) {
            List<String> names = files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
            assertEquals(List.of("checkpoint_4_uniform.json"), names);
        }
    }

    @Test
    void treeFile_usesSnakeCaseFieldsAndSlashJoinedPaths() throws IOException {
        TreeCheckpointStore store = new TreeCheckpointStore(dir);
        store.saveTree(new DecisionTree(4, ProbabilityMode.UNIFORM, sampleNodes()));

        JsonNode json = new ObjectMapper().readTree(store.treePath(4, ProbabilityMode.UNIFORM).toFile());
        assertEquals(4, json.get("word_length").asInt());
        assertEquals("uniform", json.get("mode").asText());
        assertEquals("casa", json.get("nodes").get("").asText());
        assertEquals("rosa", json.get("nodes").get("0120/0002").asText());
    }

    @Test
    void checkpoint_isDeletedOnRequest() throws IOException {
        TreeCheckpointStore store = new TreeCheckpointStore(dir);
        store.saveCheckpoint(4, ProbabilityMode.FREQUENCY, sampleNodes());
        store.deleteCheckpoint(4, ProbabilityMode.FREQUENCY);
        assertFalse(Files.exists(store.checkpointPath(4, ProbabilityMode.FREQUENCY)));
        store.deleteCheckpoint(4, ProbabilityMode.FREQUENCY);
    }

    @Test
    void savedTree_isFoundUnderItsConfiguration() throws IOException {
        TreeCheckpointStore store = new TreeCheckpointStore(dir);
        store.saveTree(new DecisionTree(4, ProbabilityMode.FREQUENCY, sampleNodes()));

        DecisionTree tree = store.loadTree(4, ProbabilityMode.FREQUENCY).orElseThrow();
        assertEquals(3, tree.size());
        assertEquals(Optional.of("rosa"), tree.guessAt(FeedbackPath.parse("0120/0002", 4)));
        assertEquals(Optional.empty(), store.loadTree(4, ProbabilityMode.UNIFORM));
        assertTrue(Files.exists(dir.resolve("tree_4_frequency.json")));
    }

    @Test
    void unreadableCheckpoint_isCorrupted() throws IOException {
        TreeCheckpointStore store = new TreeCheckpointStore(dir);
        Files.writeString(store.checkpointPath(4, ProbabilityMode.UNIFORM), "{\"word_length\": 4, \"nodes\": {",
                StandardCharsets.UTF_8);
        assertThrows(CheckpointCorruptedException.class, () -> store.loadCheckpoint(4, ProbabilityMode.UNIFORM));
    }

    @Test
    void checkpointOfAnotherConfiguration_isCorrupted() throws IOException {
        TreeCheckpointStore store = new TreeCheckpointStore(dir);
        store.saveCheckpoint(4, ProbabilityMode.FREQUENCY, sampleNodes());
        Files.copy(store.checkpointPath(4, ProbabilityMode.FREQUENCY), store.checkpointPath(4, ProbabilityMode.UNIFORM));
        assertThrows(CheckpointCorruptedException.class, () -> store.loadCheckpoint(4, ProbabilityMode.UNIFORM));
    }

    @Test
    void badGuessOrPath_isCorrupted() throws IOException {
        TreeCheckpointStore store = new TreeCheckpointStore(dir);
        Path file = store.checkpointPath(4, ProbabilityMode.UNIFORM);

        Files.writeString(file, "{\"word_length\":4,\"mode\":\"uniform\",\"nodes\":{\"\":\"casas\"}}", StandardCharsets.UTF_8);
        assertThrows(CheckpointCorruptedException.class, () -> store.loadCheckpoint(4, ProbabilityMode.UNIFORM));

        Files.writeString(file, "{\"word_length\":4,\"mode\":\"uniform\",\"nodes\":{\"01\":\"casa\"}}", StandardCharsets.UTF_8);
        assertThrows(CheckpointCorruptedException.class, () -> store.loadCheckpoint(4, ProbabilityMode.UNIFORM));
    }
}
