package com.phillippitts.dialoguetts.service.orchestration;

import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.domain.DialogueSegment;
import com.phillippitts.dialoguetts.exception.SynthesisException;
import com.phillippitts.dialoguetts.exception.SynthesisExceptionBuilder;
import com.phillippitts.dialoguetts.exception.SynthesisTimeoutException;
import com.phillippitts.dialoguetts.service.metrics.SynthesisMetrics;
import com.phillippitts.dialoguetts.service.synthesis.ChunkTask;
import com.phillippitts.dialoguetts.service.synthesis.SpeechSynthesizer;
import com.phillippitts.dialoguetts.service.synthesis.SpeechSynthesizerFactory;
import com.phillippitts.dialoguetts.service.synthesis.SynthesisResult;
import com.phillippitts.dialoguetts.service.text.TextSegmenter;
import com.phillippitts.dialoguetts.util.LogSanitizer;
import com.phillippitts.dialoguetts.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Synthesizes a batch of dialogue segments on a bounded set of worker loops.
 *
 * <p>Key features:
 * <ul>
 *   <li><b>Chunking:</b> each segment's text is split by {@link TextSegmenter}; every chunk is one
 *       {@link ChunkTask} and one synthesis call</li>
 *   <li><b>Fan-out:</b> tasks go onto a shared queue drained by at most {@code maxWorkers} worker
 *       loops; each loop opens its own {@link SpeechSynthesizer} once, reuses it for every task
 *       and closes it on exit</li>
 *   <li><b>Isolation:</b> a failing chunk fails only its segment; the segment's remaining
 *       chunks are skipped and other segments carry on</li>
 *   <li><b>Timeout:</b> a segment is timed out if it is not finished within the per-task timeout
 *       of a worker picking up its first chunk, so queued segments are not penalized for waiting.
 *       The running synthesis call is not interrupted; its late result is discarded</li>
 *   <li><b>Ordering:</b> chunks are joined in ordinal order and results are sorted by segment
 *       index, so completion order never leaks into the output</li>
 * </ul>
 *
 * <p><b>Thread Model:</b> only synthesis runs on the executor. The calling thread enqueues the
 * work, then blocks on a completion queue and does all bookkeeping (attaching audio, building
 * {@link SegmentResult}s, logging) itself.
 *
 * <p>If no worker manages to open a synthesizer, the last worker to exit fails every task still
 * queued, so a batch always terminates.
 */
@Service
public class SynthesisOrchestrator {

    private static final Logger LOG = LogManager.getLogger(SynthesisOrchestrator.class);

    private static final int PREVIEW_CHARS = 30;

    private final SpeechSynthesizerFactory synthesizerFactory;
    private final SynthesisMetrics metrics;

    public SynthesisOrchestrator(SpeechSynthesizerFactory synthesizerFactory, SynthesisMetrics metrics) {
        this.synthesizerFactory = Objects.requireNonNull(synthesizerFactory, "synthesizerFactory");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Synthesizes every segment and attaches audio to the ones that succeed.
     *
     * @param segments   segments with voices already bound; indexes must be unique
     * @param maxWorkers maximum number of concurrent synthesis calls
     * @param chunkSize  maximum characters per synthesis call
     * @param timeout    per-segment timeout, measured from dispatch
     * @param executor   executor that runs the worker loops; must allow {@code maxWorkers}
     *                   concurrent tasks
     * @return successful segments and one result per segment, both sorted by index
     * @throws IllegalArgumentException if a parameter is out of range or indexes repeat
     */
    public SynthesisOutcome synthesizeAll(List<DialogueSegment> segments, int maxWorkers, int chunkSize,
                                          Duration timeout, Executor executor) {
        Objects.requireNonNull(segments, "segments");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(executor, "executor");
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got: " + maxWorkers);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1, got: " + chunkSize);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        if (segments.isEmpty()) {
            return SynthesisOutcome.empty();
        }

        Batch batch = new Batch(timeout.toMillis());
        for (DialogueSegment segment : segments) {
            batch.add(segment, chunkSize);
        }

        int workers = Math.min(maxWorkers, batch.tasks.size());
        LOG.info("Synthesizing {} segments ({} chunks) with {} workers, timeout {} ms",
                segments.size(), batch.tasks.size(), workers, batch.timeoutMs);
        startWorkers(batch, workers, executor);

        return collect(batch, segments.size());
    }

    private void startWorkers(Batch batch, int workers, Executor executor) {
        batch.liveWorkers.set(workers);
        for (int i = 0; i < workers; i++) {
            try {
                executor.execute(() -> workerLoop(batch));
            } catch (RejectedExecutionException e) {
                LOG.error("Executor rejected synthesis worker: {}", e.getMessage());
                workerExited(batch, e);
            }
        }
    }

    private void workerLoop(Batch batch) {
        Throwable exitCause = null;
        try (SpeechSynthesizer synthesizer = synthesizerFactory.create()) {
            ChunkTask task;
            while ((task = batch.tasks.poll()) != null) {
                SegmentTracker tracker = batch.trackers.get(task.segmentIndex());
                if (tracker.isDone()) {
                    LOG.debug("Skipping chunk {}: segment already finished", task.id());
                    continue;
                }
                tracker.markDispatched(batch.timeoutMs);
                tracker.accept(runTask(synthesizer, task));
            }
        } catch (RuntimeException e) {
            LOG.error("Synthesis worker stopped: {}", e.getMessage(), e);
            exitCause = e;
        } finally {
            workerExited(batch, exitCause);
        }
    }

    private SynthesisResult runTask(SpeechSynthesizer synthesizer, ChunkTask task) {
        ThreadContext.put("chunk", task.id());
        long t0 = System.nanoTime();
        try {
            AudioFragment audio = synthesizer.synthesize(task.text(), task.voice());
            long elapsed = System.nanoTime() - t0;
            metrics.recordChunkLatency(elapsed, true);
            LOG.debug("Chunk {} synthesized in {} ms ({} ms audio)",
                    task.id(), TimeUtils.nanosToMillis(elapsed), audio.durationMillis());
            return SynthesisResult.success(task, audio, TimeUtils.nanosToMillis(elapsed));
        } catch (RuntimeException e) {
            long elapsed = System.nanoTime() - t0;
            metrics.recordChunkLatency(elapsed, false);
            LOG.warn("Chunk {} of '{}' failed: {}", task.id(), task.speaker(), e.getMessage());
            return SynthesisResult.failure(task, e, TimeUtils.nanosToMillis(elapsed));
        } finally {
            ThreadContext.remove("chunk");
        }
    }

    private void workerExited(Batch batch, Throwable cause) {
        if (batch.liveWorkers.decrementAndGet() > 0) {
            return;
        }
        ChunkTask orphan;
        while ((orphan = batch.tasks.poll()) != null) {
            SegmentTracker tracker = batch.trackers.get(orphan.segmentIndex());
            tracker.fail(SynthesisExceptionBuilder.create("No synthesis worker available")
                    .speaker(orphan.speaker())
                    .metadata("segment", orphan.segmentIndex())
                    .cause(cause)
                    .build());
        }
    }

    private SynthesisOutcome collect(Batch batch, int expected) {
        List<SegmentResult> results = new ArrayList<>(expected);
        List<DialogueSegment> succeeded = new ArrayList<>();
        try {
            for (int i = 0; i < expected; i++) {
                SegmentTracker tracker = batch.completions.take();
                results.add(finish(tracker, batch.timeoutMs));
                if (tracker.status == SegmentStatus.SUCCEEDED) {
                    succeeded.add(tracker.segment);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while collecting synthesis results; failing unfinished segments");
            for (SegmentTracker tracker : batch.trackers.values()) {
                if (!tracker.collected) {
                    tracker.fail(new SynthesisException("Interrupted before completion", tracker.segment.speaker()));
                    results.add(finish(tracker, batch.timeoutMs));
                    if (tracker.status == SegmentStatus.SUCCEEDED) {
                        succeeded.add(tracker.segment);
                    }
                }
            }
        }

        results.sort(Comparator.comparingInt(SegmentResult::index));
        succeeded.sort(Comparator.comparingInt(DialogueSegment::index));
        SynthesisOutcome outcome = new SynthesisOutcome(succeeded, results);
        LOG.info("Synthesis finished: {} succeeded, {} failed, {} timed out",
                outcome.succeededCount(), outcome.failedCount(), outcome.timedOutCount());
        return outcome;
    }

    /**
     * Moves a completed tracker to its terminal state. Runs on the calling thread only.
     */
    private SegmentResult finish(SegmentTracker tracker, long timeoutMs) {
        tracker.collected = true;
        DialogueSegment segment = tracker.segment;
        long elapsedMs = tracker.elapsedMillis();

        if (tracker.audio != null) {
            segment.attachAudio(tracker.audio);
            tracker.status = SegmentStatus.SUCCEEDED;
            metrics.incrementSegmentSuccess();
            LOG.info("✓ [{}] {}: {} chunks, {} ms audio, {} ms",
                    segment.index(), segment.speaker(), tracker.chunkCount,
                    tracker.audio.durationMillis(), elapsedMs);
            return new SegmentResult(segment.index(), segment.speaker(), SegmentStatus.SUCCEEDED,
                    tracker.chunkCount, elapsedMs, null);
        }

        Throwable error = unwrap(tracker.error);
        if (error instanceof TimeoutException) {
            tracker.status = SegmentStatus.TIMED_OUT;
            error = new SynthesisTimeoutException(segment.index(), timeoutMs);
            metrics.incrementSegmentFailure(SynthesisMetrics.REASON_TIMEOUT);
        } else {
            tracker.status = SegmentStatus.FAILED;
            metrics.incrementSegmentFailure(SynthesisMetrics.REASON_ERROR);
        }
        String message = error == null ? "unknown error" : error.getMessage();
        LOG.warn("✗ [{}] {} {}: {} (text: {})", segment.index(), segment.speaker(), tracker.status, message,
                LogSanitizer.preview(segment.text(), PREVIEW_CHARS));
        return new SegmentResult(segment.index(), segment.speaker(), tracker.status,
                tracker.chunkCount, elapsedMs, message);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Shared state of one {@link #synthesizeAll} call.
     */
    private static final class Batch {
        final long timeoutMs;
        final Map<Integer, SegmentTracker> trackers = new HashMap<>();
        final ConcurrentLinkedQueue<ChunkTask> tasks = new ConcurrentLinkedQueue<>();
        final BlockingQueue<SegmentTracker> completions = new LinkedBlockingQueue<>();
        final AtomicInteger liveWorkers = new AtomicInteger();

        Batch(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        void add(DialogueSegment segment, int chunkSize) {
            SegmentTracker tracker = new SegmentTracker(segment);
            if (trackers.putIfAbsent(segment.index(), tracker) != null) {
                throw new IllegalArgumentException("Duplicate segment index: " + segment.index());
            }
            tracker.result.whenComplete((audio, error) -> {
                tracker.completedNanos = System.nanoTime();
                tracker.audio = audio;
                tracker.error = error;
                completions.add(tracker);
            });

            tracker.status = SegmentStatus.CHUNKING;
            if (segment.voiceProfile() == null) {
                tracker.fail(new SynthesisException("No voice bound to segment " + segment.index(),
                        segment.speaker()));
                return;
            }
            List<String> chunks = TextSegmenter.segment(segment.text(), chunkSize);
            if (chunks.isEmpty()) {
                tracker.fail(new SynthesisException("Segment " + segment.index() + " has no text to synthesize",
                        segment.speaker()));
                return;
            }
            tracker.expect(chunks.size());
            for (int ordinal = 0; ordinal < chunks.size(); ordinal++) {
                tasks.add(new ChunkTask(segment.index(), ordinal, chunks.size(), segment.speaker(),
                        chunks.get(ordinal), segment.voiceProfile()));
            }
        }
    }

    /**
     * Collects chunk results for one segment. Workers write through {@link #accept}; the calling
     * thread reads the outcome fields only after taking the tracker off the completion queue.
     */
    private static final class SegmentTracker {
        final DialogueSegment segment;
        final CompletableFuture<AudioFragment> result = new CompletableFuture<>();
        private final AtomicBoolean dispatched = new AtomicBoolean();
        private AtomicReferenceArray<AudioFragment> parts;
        private AtomicInteger remaining;
        int chunkCount;
        volatile SegmentStatus status = SegmentStatus.PENDING;
        volatile long dispatchedNanos;
        volatile long completedNanos;
        volatile AudioFragment audio;
        volatile Throwable error;
        boolean collected;

        SegmentTracker(DialogueSegment segment) {
            this.segment = segment;
        }

        void expect(int chunks) {
            this.chunkCount = chunks;
            this.parts = new AtomicReferenceArray<>(chunks);
            this.remaining = new AtomicInteger(chunks);
        }

        boolean isDone() {
            return result.isDone();
        }

        void markDispatched(long timeoutMs) {
            if (dispatched.compareAndSet(false, true)) {
                dispatchedNanos = System.nanoTime();
                status = SegmentStatus.DISPATCHED;
                result.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
            }
        }

        void accept(SynthesisResult chunk) {
            if (!chunk.success()) {
                result.completeExceptionally(chunk.error());
                return;
            }
            parts.set(chunk.task().ordinal(), chunk.audio());
            if (remaining.decrementAndGet() > 0) {
                return;
            }
            List<AudioFragment> ordered = new ArrayList<>(chunkCount);
            for (int i = 0; i < chunkCount; i++) {
                ordered.add(parts.get(i));
            }
            try {
                result.complete(AudioFragment.concat(ordered));
            } catch (IllegalArgumentException e) {
                result.completeExceptionally(new SynthesisException(
                        "Chunks of segment " + segment.index() + " differ in format", segment.speaker(), e));
            }
        }

        void fail(Throwable cause) {
            result.completeExceptionally(cause);
        }

        long elapsedMillis() {
            if (!dispatched.get()) {
                return 0;
            }
            return TimeUtils.nanosToMillis(Math.max(0, completedNanos - dispatchedNanos));
        }
    }
}
