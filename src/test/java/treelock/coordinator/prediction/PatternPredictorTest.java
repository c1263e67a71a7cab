package treelock.coordinator.prediction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.model.Holder;
import treelock.coordinator.model.LockEvent;
import treelock.coordinator.model.LockEventType;
import treelock.coordinator.model.PatternEntry;
import treelock.coordinator.model.Scope;
import treelock.coordinator.model.ScopeHint;
import treelock.coordinator.scope.ScopeResolver;
import treelock.coordinator.store.FilePatternRepository;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for sequence learning and prediction.
 */
class PatternPredictorTest {

    @TempDir
    Path dataDir;

    private PatternPredictor predictor(CoordinatorConfig config) {
        return new PatternPredictor(new FilePatternRepository(dataDir), new ScopeResolver(), config);
    }

    @Test
    void repeatedCheckoutStatusIsLearnedAndPredicted() {
        PatternPredictor predictor = predictor(CoordinatorConfig.defaults());

        for (int i = 0; i < 20; i++) {
            predictor.observe("wt1", "checkout");
            predictor.observe("wt1", "status");
        }

        PatternEntry entry = predictor.entries().stream()
                .filter(e -> e.antecedent().equals(List.of("status", "checkout")))
                .findFirst()
                .orElseThrow();
        assertEquals("status", entry.successor());
        assertTrue(entry.confidence() >= 0.70);

        Optional<ScopeHint> hint = predictor.predict(List.of("checkout", "status", "checkout"), "wt1");
        assertTrue(hint.isPresent());
        assertEquals("status", hint.get().verb());
        assertEquals(Scope.worktree("wt1"), hint.get().scope());
        assertEquals(1.0, hint.get().confidence(), 1e-9);
    }

    @Test
    void predictionsBelowThresholdAreSuppressed() {
        PatternPredictor predictor = predictor(CoordinatorConfig.defaults());
        List<String> antecedent = List.of("fetch", "merge");

        predictor.learn(antecedent, "push");
        predictor.learn(antecedent, "push");
        predictor.learn(antecedent, "status");
        assertTrue(predictor.predict(antecedent, "wt1").isEmpty(), "2/3 is below 0.70");

        predictor.learn(antecedent, "push");
        ScopeHint hint = predictor.predict(antecedent, "wt1").orElseThrow();
        assertEquals("push", hint.verb());
        assertEquals(Scope.global(), hint.scope());
        assertEquals(0.75, hint.confidence(), 1e-9);
    }

    @Test
    void unknownOrShortHistoryPredictsNothing() {
        PatternPredictor predictor = predictor(CoordinatorConfig.defaults());
        predictor.learn(List.of("add", "commit"), "push");

        assertTrue(predictor.predict(List.of("commit"), "wt1").isEmpty());
        assertTrue(predictor.predict(List.of("status", "diff"), "wt1").isEmpty());
    }

    @Test
    void replayRestoresTheTable() {
        CoordinatorConfig config = CoordinatorConfig.defaults();
        PatternPredictor first = predictor(config);
        for (int i = 0; i < 4; i++) {
            first.learn(List.of("add", "commit"), "push");
        }

        PatternPredictor restarted = predictor(config);
        assertEquals(4, restarted.replay());
        assertEquals("push", restarted.predict(List.of("add", "commit"), "wt1").orElseThrow().verb());

        // observations of another length are ignored
        PatternPredictor longer = predictor(CoordinatorConfig.defaults().withSequenceLength(3));
        assertEquals(0, longer.replay());
    }

    @Test
    void learnsOnlyFromReleasesPerCaller() {
        PatternPredictor predictor = predictor(CoordinatorConfig.defaults().withSequenceLength(1));
        Holder wt1 = new Holder("wt1", 1, "add", "r1", false);
        Holder wt2 = new Holder("wt2", 2, "fetch", "r2", false);

        predictor.onEvent(LockEvent.of(LockEventType.ACQUIRED, Scope.worktree("wt1"), 0, wt1));
        predictor.onEvent(LockEvent.of(LockEventType.RELEASED, Scope.worktree("wt1"), 5, wt1));
        predictor.onEvent(LockEvent.of(LockEventType.RELEASED, Scope.global(), 5, wt2));
        predictor.onEvent(LockEvent.of(LockEventType.RELEASED, Scope.worktree("wt1"), 5,
                new Holder("wt1", 1, "commit", "r3", false)));

        assertEquals(List.of("commit"), predictor.recentVerbs("wt1"));
        assertEquals(List.of("fetch"), predictor.recentVerbs("wt2"));
        List<PatternEntry> entries = predictor.entries();
        assertEquals(1, entries.size());
        assertEquals(List.of("add"), entries.get(0).antecedent());
        assertEquals("commit", entries.get(0).successor());
    }
}
