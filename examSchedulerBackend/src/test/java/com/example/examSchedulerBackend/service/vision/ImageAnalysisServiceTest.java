package com.example.examSchedulerBackend.service.vision;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImageAnalysisServiceTest {

    private static final byte[] IMAGE = {1, 2, 3};

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        timer.shutdownNow();
    }

    private static VisionBackend backend(String name) {
        VisionBackend backend = mock(VisionBackend.class);
        when(backend.getName()).thenReturn(name);
        return backend;
    }

    private ImageAnalysisService service(Duration timeout, VisionBackend... backends) {
        return new ImageAnalysisService(List.of(backends), timeout, executor, timer);
    }

    @Test
    void analyze_returnsFirstAnswer_withoutTryingLaterBackends() throws Exception {
        VisionBackend first = backend("scout");
        VisionBackend second = backend("maverick");
        when(first.analyze(any(), anyString())).thenReturn("DATES:\n01-01-25");

        ImageAnalysisResult result = service(Duration.ofSeconds(5), first, second)
                .analyze(IMAGE, "image/png").get(5, TimeUnit.SECONDS);

        assertThat(result.isAvailable()).isTrue();
        assertThat(result.getBackend()).isEqualTo("scout");
        assertThat(result.getText()).isEqualTo("DATES:\n01-01-25");
        assertThat(result.getFailures()).isEmpty();
        verify(second, never()).analyze(any(), anyString());
    }

    @Test
    void analyze_movesOn_afterUnsupportedAndTransientFailures() throws Exception {
        VisionBackend retired = backend("retired");
        VisionBackend flaky = backend("flaky");
        VisionBackend working = backend("working");
        when(retired.analyze(any(), anyString()))
                .thenThrow(new VisionBackendException("retired", "model decommissioned", true));
        when(flaky.analyze(any(), anyString()))
                .thenThrow(new VisionBackendException("flaky", "HTTP 503: busy", false));
        when(working.analyze(any(), anyString())).thenReturn("ok");

        ImageAnalysisResult result = service(Duration.ofSeconds(5), retired, flaky, working)
                .analyze(IMAGE, "image/jpeg").get(5, TimeUnit.SECONDS);

        assertThat(result.getBackend()).isEqualTo("working");
        assertThat(result.getFailures()).hasSize(2);
        assertThat(result.getFailures().get(0)).startsWith("retired: unsupported");
        assertThat(result.getFailures().get(1)).startsWith("flaky: VisionBackendException");
    }

    @Test
    void analyze_isUnavailable_whenEveryBackendFails() throws Exception {
        VisionBackend first = backend("a");
        VisionBackend second = backend("b");
        when(first.analyze(any(), anyString())).thenThrow(new IllegalStateException("boom"));
        when(second.analyze(any(), anyString())).thenThrow(new VisionBackendException("b", "no content", false));

        ImageAnalysisResult result = service(Duration.ofSeconds(5), first, second)
                .analyze(IMAGE, "image/png").get(5, TimeUnit.SECONDS);

        assertThat(result.isAvailable()).isFalse();
        assertThat(result.getText()).isNull();
        assertThat(result.getFailures()).extracting(f -> f.substring(0, 2)).containsExactly("a:", "b:");
    }

    @Test
    void analyze_isUnavailable_whenNoBackendIsConfigured() throws Exception {
        ImageAnalysisResult result = service(Duration.ofSeconds(1)).analyze(IMAGE, "image/png").get(1, TimeUnit.SECONDS);

        assertThat(result.isAvailable()).isFalse();
        assertThat(result.getFailures()).isEmpty();
    }

    @Test
    void analyze_timesOutSlowBackend_andTriesNext() throws Exception {
        VisionBackend slow = backend("slow");
        VisionBackend fast = backend("fast");
        when(slow.analyze(any(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return "too late";
        });
        when(fast.analyze(any(), anyString())).thenReturn("in time");

        ImageAnalysisResult result = service(Duration.ofMillis(200), slow, fast)
                .analyze(IMAGE, "image/png").get(5, TimeUnit.SECONDS);

        assertThat(result.getBackend()).isEqualTo("fast");
        assertThat(result.getFailures()).containsExactly("slow: timed out after 200ms");
    }

    @Test
    void analyze_interruptsBackendCall_whenItTimesOut() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        VisionBackend slow = backend("slow");
        when(slow.analyze(any(), anyString())).thenAnswer(invocation -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "too late";
        });

        ImageAnalysisResult result = service(Duration.ofMillis(100), slow)
                .analyze(IMAGE, "image/png").get(5, TimeUnit.SECONDS);

        assertThat(result.isAvailable()).isFalse();
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void analyze_startsTimeoutWhenCallBegins_notWhileWaitingForWorker() throws Exception {
        ExecutorService singleWorker = Executors.newFixedThreadPool(1);
        try {
            VisionBackend steady = backend("steady");
            when(steady.analyze(any(), anyString())).thenAnswer(invocation -> {
                Thread.sleep(300);
                return "DATES:\n01-01-25";
            });
            ImageAnalysisService service =
                    new ImageAnalysisService(List.of(steady), Duration.ofMillis(500), singleWorker, timer);

            CompletableFuture<ImageAnalysisResult> first = service.analyze(IMAGE, "image/png");
            CompletableFuture<ImageAnalysisResult> second = service.analyze(IMAGE, "image/png");

            assertThat(first.get(5, TimeUnit.SECONDS).isAvailable()).isTrue();
            assertThat(second.get(5, TimeUnit.SECONDS).isAvailable()).isTrue();
            assertThat(second.get().getFailures()).isEmpty();
        } finally {
            singleWorker.shutdownNow();
        }
    }

    @Test
    void analyze_recordsRejection_whenNoWorkerIsFree() throws Exception {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        VisionBackend only = backend("only");

        ImageAnalysisResult result = new ImageAnalysisService(List.of(only), Duration.ofSeconds(1), closed, timer)
                .analyze(IMAGE, "image/png").get(1, TimeUnit.SECONDS);

        assertThat(result.isAvailable()).isFalse();
        assertThat(result.getFailures()).containsExactly("only: rejected, no free vision worker");
        verify(only, never()).analyze(any(), anyString());
    }

    @Test
    void analyze_stopsFurtherAttempts_whenCallerCancels() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        VisionBackend slow = backend("slow");
        VisionBackend next = backend("next");
        when(slow.analyze(any(), anyString())).thenAnswer(invocation -> {
            started.countDown();
            Thread.sleep(5_000);
            return "too late";
        });

        CompletableFuture<ImageAnalysisResult> outcome = service(Duration.ofSeconds(10), slow, next)
                .analyze(IMAGE, "image/png");
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        outcome.cancel(true);

        assertThat(outcome).isCancelled();
        verify(next, never()).analyze(any(), anyString());
    }

    @Test
    void getBackendNames_keepsOrder() {
        assertThat(service(Duration.ofSeconds(1), backend("x"), backend("y")).getBackendNames())
                .containsExactly("x", "y");
    }
}
