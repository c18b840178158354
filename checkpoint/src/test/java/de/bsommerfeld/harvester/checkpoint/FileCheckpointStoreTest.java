package de.bsommerfeld.harvester.checkpoint;

import de.bsommerfeld.harvester.core.domain.AnnotationType;
import de.bsommerfeld.harvester.core.domain.AssetReport;
import de.bsommerfeld.harvester.core.domain.CommentEntry;
import de.bsommerfeld.harvester.core.domain.NormalizedAnnotation;
import de.bsommerfeld.harvester.core.domain.Point;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * File round-trips, atomic replacement and corruption handling of
 * FileCheckpointStore.
 */
class FileCheckpointStoreTest {

    private static final String RUN = "project-1-0123456789abcdef";

    @TempDir
    Path dir;

    private FileCheckpointStore store;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        store = new FileCheckpointStore(dir.resolve("checkpoints"), clock);
    }

    // -- load --

    @Test
    void load_shouldReturnEmptyWhenNoCheckpointExists() {
        HarvestCheckpoint checkpoint = store.load(RUN);

        assertTrue(checkpoint.isEmpty());
        assertEquals(RUN, checkpoint.runId());
    }

    @Test
    void load_shouldDiscardCorruptCheckpoint() throws IOException {
        Files.createDirectories(store.fileFor(RUN).getParent());
        Files.writeString(store.fileFor(RUN), "{ \"runId\": \"" + RUN + "\", \"processedIds\": [");

        HarvestCheckpoint checkpoint = store.load(RUN);

        assertTrue(checkpoint.isEmpty());
    }

    @Test
    void load_shouldDiscardCheckpointOfAnotherRun() throws Exception {
        store.save("other-run", List.of(), Set.of("a1"));
        Files.move(store.fileFor("other-run"), store.fileFor(RUN));

        assertTrue(store.load(RUN).isEmpty());
    }

    // -- save --

    @Test
    void save_shouldRoundTripReportAndProcessedIds() throws Exception {
        AssetReport report = report();

        store.save(RUN, List.of(report), Set.of("a1", "a2"));
        HarvestCheckpoint loaded = store.load(RUN);

        assertEquals(Set.of("a1", "a2"), loaded.processedIds());
        assertEquals(List.of(report), loaded.partialReport());
        assertEquals("2024-05-01T12:00:00Z", loaded.savedAt());
    }

    @Test
    void save_shouldReplacePreviousState() throws Exception {
        store.save(RUN, List.of(), Set.of("a1"));
        store.save(RUN, List.of(report()), Set.of("a1", "a2"));

        HarvestCheckpoint loaded = store.load(RUN);
        assertEquals(2, loaded.processedIds().size());
        assertEquals(1, loaded.partialReport().size());
    }

    @Test
    void save_shouldLeaveNoTempFilesBehind() throws Exception {
        store.save(RUN, List.of(report()), Set.of("a1"));
        store.save(RUN, List.of(report()), Set.of("a1", "a2"));

        try (Stream<Path> files = Files.list(dir.resolve("checkpoints"))) {
            assertEquals(List.of(store.fileFor(RUN)), files.toList());
        }
    }

    @Test
    void save_shouldFailWhenDirectoryIsAFile() throws IOException {
        Path blocked = dir.resolve("blocked");
        Files.writeString(blocked, "not a directory");
        FileCheckpointStore broken = new FileCheckpointStore(blocked);

        assertThrows(CheckpointException.class, () -> broken.save(RUN, List.of(), Set.of("a1")));
    }

    // -- clear --

    @Test
    void clear_shouldDeleteCheckpoint() throws Exception {
        store.save(RUN, List.of(), Set.of("a1"));

        store.clear(RUN);

        assertFalse(Files.exists(store.fileFor(RUN)));
        assertTrue(store.load(RUN).isEmpty());
    }

    @Test
    void clear_shouldTolerateMissingCheckpoint() {
        assertDoesNotThrow(() -> store.clear(RUN));
    }

    private static AssetReport report() {
        NormalizedAnnotation rect = NormalizedAnnotation.box(AnnotationType.RECTANGLE, "#FF6B6B", 25.0, 22.5, 10.0, 8.9);
        NormalizedAnnotation arrow = NormalizedAnnotation.path(AnnotationType.ARROW, "#FF6B6B",
                List.of(new Point(1.0, 2.0), new Point(3.0, 4.0)));
        CommentEntry comment = new CommentEntry("Fix the logo", "Dana", "2024-04-30 09:00",
                "2024-04-30T09:00:00Z", List.of(rect, arrow), "#FF6B6B");
        return new AssetReport("a1", "intro.mov", "video", null,
                "https://app.frame.io/presentation/p1?item=a1", "/Edits", List.of(comment));
    }
}
