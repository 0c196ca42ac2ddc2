package com.phillippitts.dialoguetts.service.pipeline;

import com.phillippitts.dialoguetts.config.SynthesisExecutorFactory;
import com.phillippitts.dialoguetts.config.run.ProcessingOptions;
import com.phillippitts.dialoguetts.config.run.RunConfiguration;
import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.domain.DialogueSegment;
import com.phillippitts.dialoguetts.domain.DocumentProfile;
import com.phillippitts.dialoguetts.exception.DialogueIoException;
import com.phillippitts.dialoguetts.service.audio.AudioAssembler;
import com.phillippitts.dialoguetts.service.audio.WavWriter;
import com.phillippitts.dialoguetts.service.dialogue.DialogueParser;
import com.phillippitts.dialoguetts.service.orchestration.SynthesisOrchestrator;
import com.phillippitts.dialoguetts.service.orchestration.SynthesisOutcome;
import com.phillippitts.dialoguetts.service.text.TextSegmenter;
import com.phillippitts.dialoguetts.service.voice.VoiceRegistry;
import com.phillippitts.dialoguetts.util.LogSanitizer;
import com.phillippitts.dialoguetts.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs the whole script-to-audio pipeline for one run configuration.
 *
 * <p>Steps:
 * <ol>
 *   <li>Read and parse the script; no labeled text ends the run with
 *       {@link RunReport.Outcome#NO_SEGMENTS}</li>
 *   <li>Bind a voice to every segment through the {@link VoiceRegistry}</li>
 *   <li>Synthesize on a per-run pool of {@code max_workers} threads</li>
 *   <li>Write each successful segment to {@code temp_segments/segment_NNNN.wav} next to the
 *       output</li>
 *   <li>Assemble in script order and write the output through a temp sibling, so a failed run
 *       never leaves a partial file at the output path</li>
 *   <li>Remove the per-segment files when {@code cleanup_temp_files} is set</li>
 * </ol>
 *
 * <p>{@link #runDocument} is the single-voice variant for plain text: the document is split
 * into {@code chunk_size} pieces that all share one {@link DocumentProfile}, and each piece is a
 * segment of its own, so one failed piece is left out instead of failing the document.
 *
 * <p>Every log line of a run carries the same {@code runId} in the Log4j2 ThreadContext,
 * including lines written by synthesis workers.
 */
@Service
public class DialoguePipelineService {

    private static final Logger LOG = LogManager.getLogger(DialoguePipelineService.class);

    static final String TEMP_DIR_NAME = "temp_segments";
    private static final int PREVIEW_CHARS = 50;

    private final SynthesisOrchestrator orchestrator;
    private final AudioAssembler assembler;
    private final SynthesisExecutorFactory executorFactory;

    public DialoguePipelineService(SynthesisOrchestrator orchestrator,
                                   AudioAssembler assembler,
                                   SynthesisExecutorFactory executorFactory) {
        this.orchestrator = orchestrator;
        this.assembler = assembler;
        this.executorFactory = executorFactory;
    }

    /**
     * Runs the pipeline.
     *
     * @param config run configuration
     * @return processing statistics; the run succeeded if {@link RunReport#isSuccess()}
     * @throws com.phillippitts.dialoguetts.exception.ConfigurationException if paths are missing or
     *         no voice can be resolved
     * @throws DialogueIoException if the script cannot be read or the output cannot be written
     * @throws com.phillippitts.dialoguetts.exception.FormatMismatchException if segment formats differ
     */
    public RunReport run(RunConfiguration config) {
        return withRunId(() -> execute(config));
    }

    /**
     * Converts plain text to one WAV file in a single voice.
     *
     * @param text       document text
     * @param profile    voice for the whole document
     * @param output     output WAV path
     * @param processing workers, chunk size, timeout and cleanup; the pause is not used because
     *                   the speaker never changes
     * @return processing statistics; each segment of the report is one chunk of the document
     * @throws DialogueIoException if the output cannot be written
     */
    public RunReport runDocument(String text, DocumentProfile profile, Path output, ProcessingOptions processing) {
        return withRunId(() -> executeDocument(text, profile, output.toAbsolutePath(), processing));
    }

    private RunReport withRunId(Supplier<RunReport> body) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        ThreadContext.put("runId", runId);
        long t0 = System.nanoTime();
        try {
            RunReport report = body.get();
            LOG.info("Run {} finished in {} ms: {}", runId, TimeUtils.elapsedMillis(t0), report.outcome());
            return report;
        } finally {
            ThreadContext.remove("runId");
        }
    }

    private RunReport execute(RunConfiguration config) {
        Path input = config.requireInputFile();
        Path output = config.requireOutputFile().toAbsolutePath();
        VoiceRegistry registry = config.voiceRegistry();
        ProcessingOptions processing = config.processing();

        String script = readScript(input);
        LOG.info("Loaded dialogue from {} ({} characters)", input, script.length());

        List<DialogueSegment> segments = DialogueParser.parse(script);
        if (segments.isEmpty()) {
            LOG.error("No dialogue segments found. Check format: 'Speaker：text'");
            return RunReport.noSegments();
        }
        for (DialogueSegment segment : segments) {
            segment.bindVoice(registry.resolve(segment.speaker()));
            LOG.info("  [{}] {} (spk_id={}): {}", segment.index(), segment.speaker(),
                    segment.voiceProfile().speakerId(), LogSanitizer.preview(segment.text(), PREVIEW_CHARS));
        }

        return synthesizeAndWrite(segments, processing, output);
    }

    private RunReport executeDocument(String text, DocumentProfile profile, Path output,
                                      ProcessingOptions processing) {
        List<String> chunks = TextSegmenter.segment(text, processing.chunkSize());
        if (chunks.isEmpty()) {
            LOG.error("No text to process");
            return RunReport.noSegments();
        }
        LOG.info("Document split into {} chunks, voice profile '{}' (spk_id={})",
                chunks.size(), profile.id(), profile.voiceProfile().speakerId());

        List<DialogueSegment> segments = new ArrayList<>(chunks.size());
        for (String chunk : chunks) {
            DialogueSegment segment = new DialogueSegment(segments.size(), profile.id(), chunk);
            segment.bindVoice(profile.voiceProfile());
            segments.add(segment);
        }
        return synthesizeAndWrite(segments, processing, output);
    }

    private RunReport synthesizeAndWrite(List<DialogueSegment> segments, ProcessingOptions processing, Path output) {
        SynthesisOutcome outcome = synthesize(segments, processing);
        if (outcome.succeededCount() == 0) {
            LOG.error("All {} segments failed; no output written", segments.size());
            return RunReport.of(outcome, segments.size(), null, 0);
        }

        Path tempDir = output.getParent().resolve(TEMP_DIR_NAME);
        List<Path> segmentFiles = new ArrayList<>();
        try {
            writeSegmentFiles(outcome.succeeded(), tempDir, segmentFiles);
            AudioFragment track = assembler.assemble(outcome.succeeded(), processing.pauseMs());
            writeAtomically(track, output);
            LOG.info("Saved {} ({} ms audio): {}/{} segments, {} failed, {} timed out, {} chunks",
                    output, track.durationMillis(), outcome.succeededCount(), segments.size(),
                    outcome.failedCount(), outcome.timedOutCount(), outcome.totalChunks());
            return RunReport.of(outcome, segments.size(), output, track.durationMillis());
        } finally {
            if (processing.cleanupTempFiles()) {
                cleanup(segmentFiles, tempDir);
            }
        }
    }

    private SynthesisOutcome synthesize(List<DialogueSegment> segments, ProcessingOptions processing) {
        ThreadPoolTaskExecutor executor = executorFactory.create(processing.maxWorkers());
        try {
            return orchestrator.synthesizeAll(segments, processing.maxWorkers(), processing.chunkSize(),
                    processing.taskTimeout(), executor);
        } finally {
            executor.shutdown();
        }
    }

    private static String readScript(Path input) {
        try {
            return Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DialogueIoException("Failed to read dialogue script", input, e);
        }
    }

    private static void writeSegmentFiles(List<DialogueSegment> segments, Path tempDir, List<Path> written) {
        try {
            Files.createDirectories(tempDir);
        } catch (IOException e) {
            throw new DialogueIoException("Failed to create segment directory", tempDir, e);
        }
        for (DialogueSegment segment : segments) {
            Path file = tempDir.resolve(segmentFileName(segment.index()));
            WavWriter.write(segment.audio(), file);
            written.add(file);
        }
        LOG.debug("Wrote {} segment files to {}", written.size(), tempDir);
    }

    static String segmentFileName(int index) {
        return String.format(Locale.ROOT, "segment_%04d.wav", index);
    }

    private static void writeAtomically(AudioFragment track, Path output) {
        Path temp = output.resolveSibling(output.getFileName() + ".part");
        try {
            Files.createDirectories(output.getParent());
            WavWriter.write(track, temp);
            try {
                Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new DialogueIoException("Failed to write output", output, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    private static void cleanup(List<Path> segmentFiles, Path tempDir) {
        for (Path file : segmentFiles) {
            deleteQuietly(file);
        }
        try (var leftovers = Files.list(tempDir)) {
            if (leftovers.findAny().isEmpty()) {
                Files.deleteIfExists(tempDir);
            }
        } catch (IOException e) {
            LOG.debug("Leaving {} in place: {}", tempDir, e.toString());
        }
        LOG.debug("Cleaned up {} segment files", segmentFiles.size());
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not delete {}: {}", path, e.toString());
        }
    }
}
