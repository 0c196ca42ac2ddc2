package com.phillippitts.dialoguetts.service.synthesis.process;

import com.phillippitts.dialoguetts.config.properties.SynthesisEngineProperties;
import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.domain.VoiceProfile;
import com.phillippitts.dialoguetts.exception.DialogueIoException;
import com.phillippitts.dialoguetts.exception.InvalidAudioException;
import com.phillippitts.dialoguetts.exception.SynthesisException;
import com.phillippitts.dialoguetts.exception.SynthesisExceptionBuilder;
import com.phillippitts.dialoguetts.service.audio.WavReader;
import com.phillippitts.dialoguetts.service.synthesis.SpeechSynthesizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link SpeechSynthesizer} that shells out to the PaddleSpeech command-line tool.
 *
 * <p>CLI contract, one process per chunk:
 * <pre>
 * ${binary} tts --am ${am} --voc ${voc} --lang ${language} --spk_id ${spk}
 *           --input=${text} --output ${workDir}/chunk_N.wav
 * </pre>
 *
 * <p>Each handle owns a private temporary working directory, so handles running in parallel
 * never collide on output files. The chunk WAV is decoded with {@link WavReader} and deleted
 * straight away; the directory is removed on {@link #close()}.
 */
public final class ProcessSpeechSynthesizer implements SpeechSynthesizer {

    private static final Logger LOG = LogManager.getLogger(ProcessSpeechSynthesizer.class);

    private final SynthesisEngineProperties properties;
    private final SynthesisProcessRunner runner;
    private final Path workDir;
    private int sequence;
    private volatile boolean closed;

    ProcessSpeechSynthesizer(SynthesisEngineProperties properties, ProcessFactory processFactory, Path workDir) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.runner = new SynthesisProcessRunner(processFactory, properties);
        this.workDir = Objects.requireNonNull(workDir, "workDir");
    }

    /**
     * Opens a handle with a fresh temporary working directory.
     *
     * @throws SynthesisException if the working directory cannot be created
     */
    static ProcessSpeechSynthesizer open(SynthesisEngineProperties properties, ProcessFactory processFactory) {
        try {
            Path dir = Files.createTempDirectory("dialoguetts-synth-");
            LOG.debug("Opened synthesis handle in {}", dir);
            return new ProcessSpeechSynthesizer(properties, processFactory, dir);
        } catch (IOException e) {
            throw SynthesisExceptionBuilder.create("Cannot create synthesis working directory")
                    .cause(e)
                    .build();
        }
    }

    @Override
    public AudioFragment synthesize(String text, VoiceProfile voice) {
        if (closed) {
            throw new IllegalStateException("Synthesizer is closed");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        Objects.requireNonNull(voice, "voice must not be null");

        Path output = workDir.resolve("chunk_" + (sequence++) + ".wav");
        String context = "spk_id=" + voice.speakerId() + ", am=" + voice.acousticModel();
        try {
            runner.run(buildCommand(text, voice, output), workDir, context);
            if (!Files.isRegularFile(output)) {
                throw SynthesisExceptionBuilder.create("Synthesis tool exited without writing output")
                        .metadata("output", output)
                        .metadata("context", context)
                        .build();
            }
            return WavReader.read(output);
        } catch (InvalidAudioException | DialogueIoException e) {
            throw SynthesisExceptionBuilder.create("Unreadable synthesis output: " + e.getMessage())
                    .metadata("output", output)
                    .metadata("context", context)
                    .cause(e)
                    .build();
        } finally {
            deleteQuietly(output);
        }
    }

    List<String> buildCommand(String text, VoiceProfile voice, Path output) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolveBinary(properties.binaryPath()));
        cmd.add("tts");
        cmd.add("--am");
        cmd.add(voice.acousticModel());
        cmd.add("--voc");
        cmd.add(voice.vocoder());
        cmd.add("--lang");
        cmd.add(properties.language());
        cmd.add("--spk_id");
        cmd.add(String.valueOf(voice.speakerId()));
        // Attached form, so text starting with '-' is not read as an option
        cmd.add("--input=" + text);
        cmd.add("--output");
        cmd.add(output.toAbsolutePath().toString());
        return cmd;
    }

    /**
     * Bare command names are left for PATH lookup; anything with a directory part is made
     * absolute so it does not depend on the handle's working directory.
     */
    private static String resolveBinary(String binary) {
        Path path = Path.of(binary);
        if (path.isAbsolute() || path.getParent() == null) {
            return binary;
        }
        return path.toAbsolutePath().normalize().toString();
    }

    Path workDir() {
        return workDir;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not delete {}: {}", path, e.toString());
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        runner.close();
        try (var leftovers = Files.list(workDir)) {
            leftovers.forEach(ProcessSpeechSynthesizer::deleteQuietly);
        } catch (IOException e) {
            LOG.debug("Could not list {}: {}", workDir, e.toString());
        }
        deleteQuietly(workDir);
    }
}
