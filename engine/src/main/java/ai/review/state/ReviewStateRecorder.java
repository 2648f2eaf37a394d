package ai.review.state;

import ai.review.events.ReviewError;
import ai.review.events.ReviewEventObserver;
import ai.review.events.ReviewPayload;
import ai.review.events.SearchPayload;
import ai.review.report.ReasoningCompleted;
import ai.review.report.ReportGenerated;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Mirrors every review event into the {@link ReviewStateStore}: status, last phase, iteration
 * counter and the latest tree snapshot. Failures are recorded by {@link ReviewErrorHandler}.
 * Once a review is final its record is no longer changed here.
 */
@Component
public class ReviewStateRecorder implements ReviewEventObserver {

    private static final Logger log = LoggerFactory.getLogger(ReviewStateRecorder.class);

    private final ReviewStateStore store;

    public ReviewStateRecorder(ReviewStateStore store) {
        this.store = store;
    }

    @Override
    public void observe(String topic, Object payload) {
        if (payload instanceof ReviewError || !(payload instanceof ReviewPayload)) {
            return;
        }
        ReviewPayload reviewPayload = (ReviewPayload) payload;
        ReviewRecord record = store.update(reviewPayload.reviewId(), current -> {
            if (current.status().isFinal()) {
                return current;
            }
            if (payload instanceof ReportGenerated) {
                return current.reported(topic, ((ReportGenerated) payload).reportPath());
            }
            if (payload instanceof ReasoningCompleted) {
                return current.withProgress(ReviewStatus.REPORTING, topic,
                        ((ReasoningCompleted) payload).outcome().iterations(), null);
            }
            if (payload instanceof SearchPayload) {
                SearchPayload search = (SearchPayload) payload;
                return current.withProgress(ReviewStatus.RUNNING, topic,
                        search.context().currentIteration(), search.tree());
            }
            return current.withProgress(ReviewStatus.RUNNING, topic, current.currentIteration(), null);
        });
        if (log.isTraceEnabled()) {
            log.trace("[{}] {} -> {} (iteration {})", record.reviewId(), topic, record.status(), record.currentIteration());
        }
    }
}
