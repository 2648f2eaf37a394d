package ai.review.agent;

import ai.review.ReviewException;
import ai.review.config.MctsProperties;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs calls to external collaborators with a timeout.
 *
 * <p>The calling phase blocks until the call returns or the timeout expires, so the review
 * stays sequential. On expiry the worker is interrupted and a {@link PhaseTimeoutException} is
 * thrown; any other failure is rethrown as a {@link CollaboratorException} unless it already is
 * a {@link ReviewException}.
 */
@Component
public class ExternalCalls implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ExternalCalls.class);

    private final Duration timeout;
    private final ExecutorService executor;

    @Autowired
    public ExternalCalls(MctsProperties properties) {
        this(properties.getPhaseTimeout());
    }

    public ExternalCalls(Duration timeout) {
        this.timeout = timeout;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "review-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Invokes {@code call} and waits at most the configured timeout for it.
     *
     * @param collaborator name used in logs and error messages
     * @param call the external call
     * @return whatever the call returned
     */
    public <T> T call(String collaborator, Callable<T> call) {
        long startNanos = System.nanoTime();
        Future<T> future = executor.submit(call);
        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (log.isDebugEnabled()) {
                log.debug("{} responded in {} ms", collaborator, (System.nanoTime() - startNanos) / 1_000_000L);
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {} ms", collaborator, timeout.toMillis());
            throw new PhaseTimeoutException(collaborator, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ReviewException) {
                throw (ReviewException) cause;
            }
            throw new CollaboratorException(collaborator + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CollaboratorException(collaborator + " call interrupted", e);
        }
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
