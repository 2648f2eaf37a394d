package ai.review.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Process-local store. Reviews in progress are always kept; of the finished ones (completed or
 * failed) only the most recently updated {@code review.state.max-final-records} are retained,
 * tree snapshot included.
 */
@Component
public class InMemoryReviewStateStore implements ReviewStateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewStateStore.class);

    static final int DEFAULT_MAX_FINAL_RECORDS = 100;

    private final Map<String, ReviewRecord> records = new ConcurrentHashMap<>();
    private final int maxFinalRecords;

    /**
     * Default constructor for non-Spring contexts (e.g., tests).
     */
    public InMemoryReviewStateStore() {
        this(DEFAULT_MAX_FINAL_RECORDS);
    }

    @Autowired
    public InMemoryReviewStateStore(@Value("${review.state.max-final-records:100}") int maxFinalRecords) {
        this.maxFinalRecords = Math.max(1, maxFinalRecords);
    }

    @Override
    public Optional<ReviewRecord> find(String reviewId) {
        return Optional.ofNullable(records.get(reviewId));
    }

    @Override
    public ReviewRecord update(String reviewId, UnaryOperator<ReviewRecord> change) {
        ReviewRecord updated = records.compute(reviewId,
                (id, current) -> change.apply(current != null ? current : ReviewRecord.pending(id)));
        if (updated.status().isFinal()) {
            evictFinished();
        }
        return updated;
    }

    @Override
    public Collection<ReviewRecord> all() {
        return new ArrayList<>(records.values());
    }

    private synchronized void evictFinished() {
        List<ReviewRecord> finished = new ArrayList<>();
        for (ReviewRecord record : records.values()) {
            if (record.status().isFinal()) {
                finished.add(record);
            }
        }
        if (finished.size() <= maxFinalRecords) {
            return;
        }
        finished.sort(Comparator.comparing(ReviewRecord::updatedAt).thenComparing(ReviewRecord::reviewId));
        for (ReviewRecord record : finished.subList(0, finished.size() - maxFinalRecords)) {
            records.remove(record.reviewId());
            if (log.isDebugEnabled()) {
                log.debug("[{}] Evicted finished review ({})", record.reviewId(), record.status());
            }
        }
    }
}
