package tollgate.core.service.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import tollgate.adapter.out.content.FileSystemContentReader;
import tollgate.adapter.out.state.memory.InMemoryTaskStateRepository;
import tollgate.core.model.state.Diff;
import tollgate.core.model.state.ProposedChange;

@DisplayName("TaskStateTracker")
class TaskStateTrackerTest {

    @TempDir
    Path contentRoot;

    private InMemoryTaskStateRepository repository;
    private TaskStateTracker tracker;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTaskStateRepository(Duration.ofDays(7));
        tracker = new TaskStateTracker(repository, new FileSystemContentReader(contentRoot));
    }

    @AfterEach
    void tearDown() {
        repository.shutdown();
    }

    @Nested
    @DisplayName("createState() / getState()")
    class CreateAndGet {

        @Test
        @DisplayName("should round-trip a new state")
        void shouldRoundTrip() {
            var created = tracker.createState("t1", true).await().indefinitely();

            var read = tracker.getState("t1").await().indefinitely().orElseThrow();

            assertEquals(created, read);
            assertTrue(read.dryRun());
            assertTrue(read.diffs().isEmpty());
            assertTrue(read.safetyChecks().isEmpty());
        }

        @Test
        @DisplayName("should report an unknown task as not found")
        void shouldReportNotFound() {
            assertTrue(tracker.getState("missing").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should overwrite an existing record")
        void shouldOverwriteExisting() {
            tracker.createState("t1", true).await().indefinitely();
            tracker.updateSafetyCheck("t1", "secrets", true).await().indefinitely();

            tracker.createState("t1", false).await().indefinitely();

            var read = tracker.getState("t1").await().indefinitely().orElseThrow();
            assertFalse(read.dryRun());
            assertTrue(read.safetyChecks().isEmpty());
        }
    }

    @Nested
    @DisplayName("updateDiffs()")
    class UpdateDiffs {

        @Test
        @DisplayName("should accumulate diffs when the caller appends to the stored list")
        void shouldAccumulateDiffs() {
            tracker.createState("t1", true).await().indefinitely();
            var d1 = new Diff("README.md", "old", "new", Map.of("tool", "readme"));
            var d2 = new Diff("profile.bio", "", "Java engineer", Map.of("tool", "bio"));

            tracker.updateDiffs("t1", List.of(d1)).await().indefinitely();
            var current = tracker.getState("t1").await().indefinitely().orElseThrow();
            var appended = new ArrayList<>(current.diffs());
            appended.add(d2);
            tracker.updateDiffs("t1", appended).await().indefinitely();

            assertEquals(
                    List.of(d1, d2),
                    tracker.getState("t1").await().indefinitely().orElseThrow().diffs());
        }

        @Test
        @DisplayName("should return false for an unknown task")
        void shouldReturnFalseForUnknownTask() {
            assertFalse(tracker.updateDiffs("missing", List.of()).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("updateSafetyCheck()")
    class UpdateSafetyCheck {

        @Test
        @DisplayName("should record checks by name and keep diffs")
        void shouldRecordChecks() {
            tracker.createState("t1", true).await().indefinitely();
            var diff = new Diff("README.md", "", "hello", Map.of());
            tracker.updateDiffs("t1", List.of(diff)).await().indefinitely();

            assertTrue(tracker.updateSafetyCheck("t1", "content_safety", true).await().indefinitely());
            assertTrue(tracker.updateSafetyCheck("t1", "secrets", false).await().indefinitely());

            var read = tracker.getState("t1").await().indefinitely().orElseThrow();
            assertEquals(Map.of("content_safety", true, "secrets", false), read.safetyChecks());
            assertEquals(List.of(diff), read.diffs());
        }

        @Test
        @DisplayName("should return false for an unknown task")
        void shouldReturnFalseForUnknownTask() {
            assertFalse(tracker.updateSafetyCheck("missing", "secrets", true).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("generateDiff()")
    class GenerateDiff {

        @Test
        @DisplayName("should pair the current content with the proposal")
        void shouldPairCurrentContent() throws IOException {
            Files.writeString(contentRoot.resolve("README.md"), "# Hello");

            var diff = tracker.generateDiff(new ProposedChange("README.md", "# Hello, world", "readme_writer"))
                    .await()
                    .indefinitely();

            assertEquals("README.md", diff.path());
            assertEquals("# Hello", diff.originalContent());
            assertEquals("# Hello, world", diff.proposedContent());
            assertEquals(Map.of(TaskStateTracker.TOOL_METADATA_KEY, "readme_writer"), diff.metadata());
        }

        @Test
        @DisplayName("should use an empty original when nothing exists at the address")
        void shouldUseEmptyOriginalWhenMissing() {
            var diff = tracker.generateDiff(new ProposedChange("docs/NEW.md", "content", "docs"))
                    .await()
                    .indefinitely();

            assertEquals("", diff.originalContent());
            assertTrue(diff.changesContent());
        }

        @Test
        @DisplayName("should not persist anything")
        void shouldNotPersist() {
            tracker.generateDiff(new ProposedChange("README.md", "x", "readme")).await().indefinitely();

            assertTrue(tracker.getState("README.md").await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("readyToApply()")
    class ReadyToApply {

        @Test
        @DisplayName("should require at least one check and all checks passed")
        void shouldRequirePassedChecks() {
            tracker.createState("t1", true).await().indefinitely();
            assertFalse(tracker.readyToApply("t1").await().indefinitely());

            tracker.updateSafetyCheck("t1", "content_safety", true).await().indefinitely();
            assertTrue(tracker.readyToApply("t1").await().indefinitely());

            tracker.updateSafetyCheck("t1", "secrets", false).await().indefinitely();
            assertFalse(tracker.readyToApply("t1").await().indefinitely());
        }

        @Test
        @DisplayName("should refuse an unknown task")
        void shouldRefuseUnknownTask() {
            assertFalse(tracker.readyToApply("missing").await().indefinitely());
        }
    }
}
