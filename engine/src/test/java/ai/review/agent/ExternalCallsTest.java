package ai.review.agent;

import static org.junit.jupiter.api.Assertions.*;

import ai.review.ReviewException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ExternalCallsTest {

    private final ExternalCalls calls = new ExternalCalls(Duration.ofMillis(200));

    @AfterEach
    void tearDown() {
        calls.destroy();
    }

    @Test
    void returnsTheResult() {
        assertEquals("ok", calls.call("scorer", () -> "ok"));
    }

    @Test
    void slowCallTimesOutAndIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);

        PhaseTimeoutException error = assertThrows(PhaseTimeoutException.class, () -> calls.call("evaluator", () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return "late";
        }));

        assertEquals("evaluator did not respond within 200 ms", error.getMessage());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    void checkedFailuresAreWrapped() {
        CollaboratorException error = assertThrows(CollaboratorException.class,
                () -> calls.call("commit source", () -> {
                    throw new IOException("connection refused");
                }));

        assertTrue(error.getMessage().startsWith("commit source failed"));
        assertInstanceOf(IOException.class, error.getCause());
    }

    @Test
    void reviewExceptionsPassThrough() {
        ReviewException original = new ReviewException("bad reply");

        ReviewException error = assertThrows(ReviewException.class, () -> calls.call("scorer", () -> {
            throw original;
        }));

        assertSame(original, error);
    }
}
