package com.example.examSchedulerBackend.service.vision;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends an image through an ordered list of vision backends, one attempt each
 * with its own timeout. The first answer wins. Unsupported and transient
 * failures both move on to the next backend; running out of backends yields an
 * unavailable result rather than an exception.
 *
 * <p>Completing or cancelling the returned future stops any further attempts.
 */
@Slf4j
public class ImageAnalysisService {

    private final List<VisionBackend> backends;
    private final Duration attemptTimeout;
    private final ExecutorService executor;
    private final ScheduledExecutorService timer;

    public ImageAnalysisService(List<VisionBackend> backends, Duration attemptTimeout, ExecutorService executor,
                                ScheduledExecutorService timer) {
        this.backends = List.copyOf(backends);
        this.attemptTimeout = attemptTimeout;
        this.executor = executor;
        this.timer = timer;
    }

    public List<String> getBackendNames() {
        List<String> names = new ArrayList<>();
        for (VisionBackend backend : backends) {
            names.add(backend.getName());
        }
        return names;
    }

    public CompletableFuture<ImageAnalysisResult> analyze(byte[] image, String mimeType) {
        CompletableFuture<ImageAnalysisResult> outcome = new CompletableFuture<>();
        attempt(0, image, mimeType, new ArrayList<>(), outcome);
        return outcome;
    }

    private void attempt(int index, byte[] image, String mimeType, List<String> failures,
                         CompletableFuture<ImageAnalysisResult> outcome) {
        if (outcome.isDone()) {
            return;
        }
        if (index >= backends.size()) {
            log.warn("No vision backend could analyse the image ({} tried)", backends.size());
            outcome.complete(ImageAnalysisResult.unavailable(failures));
            return;
        }

        VisionBackend backend = backends.get(index);
        CompletableFuture<String> call = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> runAttempt(backend, image, mimeType, call));
        } catch (RejectedExecutionException e) {
            call.completeExceptionally(e);
            task = null;
        }
        if (task != null) {
            Future<?> running = task;
            // interrupts a call that timed out or was abandoned by the caller
            call.whenComplete((text, error) -> {
                if (error != null) {
                    running.cancel(true);
                }
            });
        }
        outcome.whenComplete((result, error) -> call.cancel(true));

        call.whenComplete((text, error) -> {
            if (error == null) {
                log.info("Image analysed by {}", backend.getName());
                outcome.complete(ImageAnalysisResult.success(backend.getName(), text, failures));
                return;
            }
            String reason = describe(error);
            log.warn("Vision backend {} failed: {}", backend.getName(), reason);
            failures.add(backend.getName() + ": " + reason);
            attempt(index + 1, image, mimeType, failures, outcome);
        });
    }

    /**
     * Runs on a worker thread. The attempt's timeout starts here, once the call
     * actually begins, not when it was submitted.
     */
    private void runAttempt(VisionBackend backend, byte[] image, String mimeType, CompletableFuture<String> call) {
        if (call.isDone()) {
            return;
        }
        ScheduledFuture<?> deadline = timer.schedule(() -> call.completeExceptionally(new TimeoutException()),
                attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            call.complete(backend.analyze(image, mimeType));
        } catch (RuntimeException e) {
            call.completeExceptionally(e);
        } finally {
            deadline.cancel(false);
        }
    }

    private String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "timed out after " + attemptTimeout.toMillis() + "ms";
        }
        if (cause instanceof RejectedExecutionException) {
            return "rejected, no free vision worker";
        }
        if (cause instanceof VisionBackendException && ((VisionBackendException) cause).isUnsupported()) {
            return "unsupported (" + cause.getMessage() + ")";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
