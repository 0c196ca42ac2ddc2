package com.phillippitts.dialoguetts.presentation.cli;

import com.phillippitts.dialoguetts.config.run.ProcessingOptions;
import com.phillippitts.dialoguetts.config.run.RunConfiguration;
import com.phillippitts.dialoguetts.config.run.RunConfigurationLoader;
import com.phillippitts.dialoguetts.domain.Character;
import com.phillippitts.dialoguetts.domain.DocumentProfile;
import com.phillippitts.dialoguetts.domain.VoiceProfile;
import com.phillippitts.dialoguetts.exception.ConfigurationException;
import com.phillippitts.dialoguetts.exception.DialogueIoException;
import com.phillippitts.dialoguetts.exception.DialogueTtsException;
import com.phillippitts.dialoguetts.service.orchestration.SegmentResult;
import com.phillippitts.dialoguetts.service.pipeline.DialoguePipelineService;
import com.phillippitts.dialoguetts.service.pipeline.RunReport;
import com.phillippitts.dialoguetts.service.voice.VoiceRegistry;
import com.phillippitts.dialoguetts.service.voice.VoiceTestService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * # Process dialogue with config file
 * java -jar dialogue-tts.jar --config=config/characters_config.json
 *
 * # List character voices
 * java -jar dialogue-tts.jar --config=config/characters_config.json --list-characters
 *
 * # Test a specific character voice
 * java -jar dialogue-tts.jar --config=config/characters_config.json --test-voice="Keonne Rodriguez"
 *
 * # Convert a plain document with one voice (no config file)
 * java -jar dialogue-tts.jar --file=document.txt --output=output/document_audio.wav --profile=male
 * java -jar dialogue-tts.jar --text="你好，世界。"
 *
 * # List document voice profiles, or audition one
 * java -jar dialogue-tts.jar --list-options
 * java -jar dialogue-tts.jar --test --profile=female
 * </pre>
 *
 * <p>{@code --output-dir=<dir>} puts the test-voice and profile-test files somewhere other than
 * the working directory.
 *
 * <p>Exit code is {@value #EXIT_OK} on success and {@value #EXIT_FAILURE} on any failure,
 * including a run in which no segment could be synthesized.
 */
@Component
public class DialogueCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LogManager.getLogger(DialogueCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    static final String OPT_CONFIG = "config";
    static final String OPT_LIST = "list-characters";
    static final String OPT_TEST_VOICE = "test-voice";
    static final String OPT_OUTPUT_DIR = "output-dir";
    static final String OPT_TEXT = "text";
    static final String OPT_FILE = "file";
    static final String OPT_OUTPUT = "output";
    static final String OPT_PROFILE = "profile";
    static final String OPT_LIST_OPTIONS = "list-options";
    static final String OPT_TEST = "test";

    static final String DEFAULT_DOCUMENT_OUTPUT = "output/document_audio.wav";

    private static final String RULE = "=".repeat(80);

    private final RunConfigurationLoader configurationLoader;
    private final DialoguePipelineService pipelineService;
    private final VoiceTestService voiceTestService;

    private volatile int exitCode = EXIT_OK;

    public DialogueCommandRunner(RunConfigurationLoader configurationLoader,
                                 DialoguePipelineService pipelineService,
                                 VoiceTestService voiceTestService) {
        this.configurationLoader = configurationLoader;
        this.pipelineService = pipelineService;
        this.voiceTestService = voiceTestService;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    int execute(ApplicationArguments args) {
        String configPath = singleValue(args, OPT_CONFIG);
        if (configPath == null) {
            if (isDocumentMode(args)) {
                return executeDocument(args);
            }
            LOG.error("Missing required option --{}=<file> (or --{}/--{} for a plain document)",
                    OPT_CONFIG, OPT_TEXT, OPT_FILE);
            return EXIT_FAILURE;
        }

        try {
            RunConfiguration config = configurationLoader.load(Path.of(configPath));
            if (args.containsOption(OPT_LIST)) {
                listCharacters(config.voiceRegistry());
                return EXIT_OK;
            }
            String testVoice = singleValue(args, OPT_TEST_VOICE);
            if (testVoice != null) {
                voiceTestService.testVoice(config.voiceRegistry(), testVoice, outputDir(args));
                return EXIT_OK;
            }
            RunReport report = pipelineService.run(config);
            logReport(report);
            return report.isSuccess() ? EXIT_OK : EXIT_FAILURE;
        } catch (DialogueTtsException e) {
            LOG.error("✗ {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    private static boolean isDocumentMode(ApplicationArguments args) {
        return args.containsOption(OPT_TEXT) || args.containsOption(OPT_FILE)
                || args.containsOption(OPT_LIST_OPTIONS) || args.containsOption(OPT_TEST);
    }

    private int executeDocument(ApplicationArguments args) {
        try {
            if (args.containsOption(OPT_LIST_OPTIONS)) {
                listOptions();
                return EXIT_OK;
            }
            DocumentProfile profile = profile(args);
            if (args.containsOption(OPT_TEST)) {
                voiceTestService.testProfile(profile, outputDir(args));
                return EXIT_OK;
            }

            String text = documentText(args);
            if (text.isBlank()) {
                LOG.error("No text to process");
                return EXIT_FAILURE;
            }
            String output = singleValue(args, OPT_OUTPUT);
            ProcessingOptions processing = configurationLoader.defaultProcessing();
            LOG.info("Starting document processing with '{}' voice profile...", profile.id());
            RunReport report = pipelineService.runDocument(text, profile,
                    Path.of(output == null ? DEFAULT_DOCUMENT_OUTPUT : output), processing);
            logDocumentReport(report, profile);
            return report.isSuccess() ? EXIT_OK : EXIT_FAILURE;
        } catch (DialogueTtsException e) {
            LOG.error("✗ {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    private static DocumentProfile profile(ApplicationArguments args) {
        String id = singleValue(args, OPT_PROFILE);
        if (id == null) {
            return DocumentProfile.DEFAULT;
        }
        return DocumentProfile.fromId(id).orElseThrow(() -> new ConfigurationException(
                "Unknown voice profile '" + id + "'; choose one of: " + DocumentProfile.ids()));
    }

    private static String documentText(ApplicationArguments args) {
        String file = singleValue(args, OPT_FILE);
        String text = singleValue(args, OPT_TEXT);
        if (file != null && text != null) {
            throw new ConfigurationException("--" + OPT_TEXT + " and --" + OPT_FILE + " are mutually exclusive");
        }
        if (file == null) {
            String inline = text == null ? "" : text;
            LOG.info("Processing {} characters from command line", inline.length());
            return inline;
        }
        Path path = Path.of(file);
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            LOG.info("Read {} characters from {}", content.length(), path);
            return content;
        } catch (IOException e) {
            throw new DialogueIoException("Failed to read document", path, e);
        }
    }

    private static Path outputDir(ApplicationArguments args) {
        String outputDir = singleValue(args, OPT_OUTPUT_DIR);
        return outputDir == null ? Path.of("") : Path.of(outputDir);
    }

    private static String singleValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    private static void listCharacters(VoiceRegistry registry) {
        LOG.info(RULE);
        LOG.info("CHARACTER VOICE CONFIGURATION");
        LOG.info(RULE);
        for (Character c : registry.characters()) {
            LOG.info(String.format("Name: %-20s | Gender: %-6s | Speaker ID: %3d | Aliases: %s",
                    c.name(), c.gender(), c.voiceProfile().speakerId(), String.join(", ", c.aliases())));
        }
        registry.narrator().ifPresent(n -> LOG.info("Default Narrator: {} | Gender: {} | Speaker ID: {}",
                n.name(), n.gender(), n.voiceProfile().speakerId()));
        LOG.info(RULE);
    }

    private static void listOptions() {
        LOG.info(RULE);
        LOG.info("DOCUMENT VOICE PROFILES");
        LOG.info(RULE);
        for (DocumentProfile p : DocumentProfile.values()) {
            VoiceProfile voice = p.voiceProfile();
            LOG.info(String.format("%-10s | Model: %-22s | Vocoder: %-18s | Speaker: %3d | %s",
                    p.id(), voice.acousticModel(), voice.vocoder(), voice.speakerId(), p.description()));
        }
        LOG.info("Dialogue characters may use any acoustic model, vocoder and speaker id in their voice_profile");
        LOG.info(RULE);
    }

    private static void logDocumentReport(RunReport report, DocumentProfile profile) {
        if (!report.isSuccess()) {
            LOG.error("✗ Document processing failed: {}", report.outcome() == RunReport.Outcome.NO_SEGMENTS
                    ? "No text chunks generated" : "All chunks failed to process");
            return;
        }
        LOG.info(RULE);
        LOG.info("✓ Document processing completed successfully!");
        LOG.info("Output: {}", report.outputFile());
        LOG.info("Voice Profile: {}", profile.id());
        LOG.info("Statistics: {}/{} chunks processed", report.succeeded(), report.totalSegments());
        LOG.info("Total characters: {}", report.characters());
        LOG.info(RULE);
    }

    private static void logReport(RunReport report) {
        LOG.info("Processing complete: {}", report.outcome());
        LOG.info("  Successful segments: {}/{}", report.succeeded(), report.totalSegments());
        LOG.info("  Failed segments: {}", report.failed());
        LOG.info("  Timed out segments: {}", report.timedOut());
        LOG.info("  Total text chunks: {}", report.totalChunks());
        for (SegmentResult r : report.segments()) {
            if (!r.success()) {
                LOG.warn("  [{}] {} {}: {}", r.index(), r.speaker(), r.status(), r.error());
            }
        }
        if (report.outputFile() != null) {
            LOG.info("  Output: {} ({} ms)", report.outputFile(), report.audioDurationMs());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
