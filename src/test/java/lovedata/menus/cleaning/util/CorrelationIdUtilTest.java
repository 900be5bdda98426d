package lovedata.menus.cleaning.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CorrelationIdUtil
 * MDC access and hand-over of the id to cleaning worker threads
 */
class CorrelationIdUtilTest {

    @BeforeEach
    void setUp() {
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void testGetCurrentCorrelationId_WhenNotSet_ReturnsDefaultValue() {
        assertThat(CorrelationIdUtil.getCurrentCorrelationId()).isEqualTo("NO-CORRELATION-ID");
        assertThat(CorrelationIdUtil.hasCorrelationId()).isFalse();
    }

    @Test
    void testSetAndClear() {
        // Given
        CorrelationIdUtil.setCorrelationId("upload-42");

        // Then
        assertThat(MDC.get(CorrelationIdUtil.CORRELATION_ID_KEY)).isEqualTo("upload-42");
        assertThat(CorrelationIdUtil.hasCorrelationId()).isTrue();

        // When
        CorrelationIdUtil.clearCorrelationId();

        // Then
        assertThat(CorrelationIdUtil.hasCorrelationId()).isFalse();
    }

    @Test
    void testWrap_CarriesIdToWorkerThread() throws Exception {
        // Given: id set on the submitting thread
        CorrelationIdUtil.setCorrelationId("run-7");
        Supplier<String> task = CorrelationIdUtil.wrap(CorrelationIdUtil::getCurrentCorrelationId);
        ExecutorService worker = Executors.newSingleThreadExecutor();

        try {
            // When
            String seenByWorker = CompletableFuture.supplyAsync(task, worker).get();
            String leftOnWorker = CompletableFuture.supplyAsync(
                    CorrelationIdUtil::getCurrentCorrelationId, worker).get();

            // Then: worker saw the id during the task and was restored afterwards
            assertThat(seenByWorker).isEqualTo("run-7");
            assertThat(leftOnWorker).isEqualTo("NO-CORRELATION-ID");
        } finally {
            worker.shutdownNow();
        }
    }

    @Test
    void testWrap_RestoresPreviousIdOnSameThread() {
        CorrelationIdUtil.setCorrelationId("captured");
        Supplier<String> task = CorrelationIdUtil.wrap(CorrelationIdUtil::getCurrentCorrelationId);
        CorrelationIdUtil.setCorrelationId("current");

        String seen = task.get();

        assertThat(seen).isEqualTo("captured");
        assertThat(CorrelationIdUtil.getCurrentCorrelationId()).isEqualTo("current");
    }

    @Test
    void testWrap_NoIdCaptured_WorkerRunsWithout() {
        Supplier<Boolean> task = CorrelationIdUtil.wrap(CorrelationIdUtil::hasCorrelationId);
        CorrelationIdUtil.setCorrelationId("later");

        assertThat(task.get()).isFalse();
        assertThat(CorrelationIdUtil.getCurrentCorrelationId()).isEqualTo("later");
    }
}
