package treelock.coordinator.prediction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treelock.coordinator.config.CoordinatorConfig;
import treelock.coordinator.core.LockEventListener;
import treelock.coordinator.model.LockEvent;
import treelock.coordinator.model.LockEventType;
import treelock.coordinator.model.PatternEntry;
import treelock.coordinator.model.ScopeHint;
import treelock.coordinator.repository.PatternRepository;
import treelock.coordinator.scope.ScopeResolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Learns which verb tends to follow the last N verbs of a caller and
 * predicts the next one.
 *
 * The table is maintained incrementally: each completed operation (a
 * RELEASED event) adds one observation for the caller's preceding N verbs.
 * Observations are appended to the pattern log and replayed at startup.
 */
public class PatternPredictor implements LockEventListener {

    private static final Logger log = LoggerFactory.getLogger(PatternPredictor.class);

    private final PatternRepository repository;
    private final ScopeResolver resolver;
    private final int sequenceLength;
    private final double threshold;

    // antecedent -> successor -> count
    private final Map<List<String>, Map<String, Long>> table = new HashMap<>();
    private final Map<List<String>, Long> totals = new HashMap<>();
    private final Map<String, Deque<String>> recentByCaller = new HashMap<>();

    public PatternPredictor(PatternRepository repository, ScopeResolver resolver, CoordinatorConfig config) {
        this.repository = repository;
        this.resolver = resolver;
        this.sequenceLength = config.sequenceLength();
        this.threshold = config.predictionThreshold();
    }

    /**
     * Rebuild the table from the pattern log.
     */
    public synchronized int replay() {
        try {
            List<PatternEntry> observations = repository.loadAll();
            int used = 0;
            for (PatternEntry observation : observations) {
                if (observation.antecedent().size() == sequenceLength) {
                    count(observation.antecedent(), observation.successor(), observation.observedCount());
                    used++;
                }
            }
            log.info("Replayed {} pattern observation(s) into {} antecedent(s)", used, table.size());
            return used;
        } catch (RuntimeException e) {
            log.warn("Failed to replay pattern log: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public void onEvent(LockEvent event) {
        if (event.type() != LockEventType.RELEASED || event.callerId() == null) {
            return;
        }
        observe(event.callerId(), event.verb());
    }

    /**
     * Record that {@code callerId} completed {@code verb}.
     */
    public void observe(String callerId, String verb) {
        List<String> sequence;
        synchronized (this) {
            Deque<String> recent = recentByCaller.computeIfAbsent(callerId, k -> new ArrayDeque<>());
            sequence = new ArrayList<>(recent);
            sequence.add(verb);
            recent.addLast(verb);
            while (recent.size() > sequenceLength) {
                recent.pollFirst();
            }
        }
        if (sequence.size() == sequenceLength + 1) {
            learn(sequence);
        }
    }

    /**
     * Learn from a completed sequence: the last verb is the successor of the N verbs before it.
     */
    public void learn(List<String> completedSequence) {
        if (completedSequence.size() < sequenceLength + 1) {
            return;
        }
        int end = completedSequence.size() - 1;
        learn(completedSequence.subList(end - sequenceLength, end), completedSequence.get(end));
    }

    public void learn(List<String> antecedent, String successor) {
        List<String> key = List.copyOf(antecedent);
        synchronized (this) {
            count(key, successor, 1);
        }
        try {
            repository.append(key, successor);
        } catch (RuntimeException e) {
            log.warn("Failed to persist pattern {} -> {}: {}", key, successor, e.getMessage());
        }
    }

    /**
     * Predict the verb following {@code recent} (its last N verbs are used).
     * Only predictions with confidence at or above the threshold are returned.
     *
     * @param target worktree id the predicted verb would apply to
     */
    public synchronized Optional<ScopeHint> predict(List<String> recent, String target) {
        if (recent.size() < sequenceLength) {
            return Optional.empty();
        }
        List<String> key = List.copyOf(recent.subList(recent.size() - sequenceLength, recent.size()));
        Map<String, Long> successors = table.get(key);
        if (successors == null) {
            return Optional.empty();
        }
        long total = totals.getOrDefault(key, 0L);
        return successors.entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
                .map(best -> new ScopeHint(best.getKey(), resolver.resolve(best.getKey(), target),
                        (double) best.getValue() / total))
                .filter(hint -> hint.confidence() >= threshold);
    }

    /** Most recently completed verbs of a caller, oldest first. */
    public synchronized List<String> recentVerbs(String callerId) {
        Deque<String> recent = recentByCaller.get(callerId);
        return recent == null ? List.of() : List.copyOf(recent);
    }

    public synchronized List<PatternEntry> entries() {
        List<PatternEntry> entries = new ArrayList<>();
        table.forEach((antecedent, successors) -> {
            long total = totals.getOrDefault(antecedent, 0L);
            successors.forEach((successor, count) ->
                    entries.add(new PatternEntry(antecedent, successor, count, total)));
        });
        entries.sort(Comparator.comparingDouble(PatternEntry::confidence).reversed()
                .thenComparing(e -> String.join(" ", e.antecedent()))
                .thenComparing(PatternEntry::successor));
        return entries;
    }

    public int sequenceLength() {
        return sequenceLength;
    }

    private void count(List<String> antecedent, String successor, long n) {
        List<String> key = List.copyOf(antecedent);
        table.computeIfAbsent(key, k -> new HashMap<>()).merge(successor, n, Long::sum);
        totals.merge(key, n, Long::sum);
    }
}
