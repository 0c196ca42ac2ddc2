package com.phillippitts.dialoguetts.service.pipeline;

import com.phillippitts.dialoguetts.config.SynthesisExecutorFactory;
import com.phillippitts.dialoguetts.config.properties.OrchestrationProperties;
import com.phillippitts.dialoguetts.config.properties.ThreadPoolProperties;
import com.phillippitts.dialoguetts.config.run.ProcessingOptions;
import com.phillippitts.dialoguetts.config.run.RunConfiguration;
import com.phillippitts.dialoguetts.config.run.RunConfigurationLoader;
import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.domain.DocumentProfile;
import com.phillippitts.dialoguetts.domain.PcmFormat;
import com.phillippitts.dialoguetts.exception.DialogueIoException;
import com.phillippitts.dialoguetts.exception.FormatMismatchException;
import com.phillippitts.dialoguetts.service.audio.AudioAssembler;
import com.phillippitts.dialoguetts.service.audio.WavReader;
import com.phillippitts.dialoguetts.service.metrics.SynthesisMetrics;
import com.phillippitts.dialoguetts.service.orchestration.SegmentStatus;
import com.phillippitts.dialoguetts.service.orchestration.SynthesisOrchestrator;
import com.phillippitts.dialoguetts.testutil.FakeSynthesizerFactory;
import com.phillippitts.dialoguetts.testutil.FakeSynthesizerFactory.Call;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end pipeline runs against an in-memory synthesizer: script file in, WAV file out.
 */
class DialoguePipelineServiceTest {

    private static final String[] LINES = {
            "你好，基翁。",
            "你好，娜奥米！",
            "今天天气不错。",
            "是的，我们去散步吧。"
    };

    private static final String SCRIPT = "娜奥米：" + LINES[0] + "\n"
            + "基翁：" + LINES[1] + "\n"
            + "娜奥米：" + LINES[2] + "\n"
            + "基翁：" + LINES[3] + "\n";

    private static final byte[] PAUSE = AudioFragment.silence(300, FakeSynthesizerFactory.FORMAT).data();

    @TempDir
    Path tempDir;

    private FakeSynthesizerFactory synthesizers;
    private DialoguePipelineService pipeline;
    private RunConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        synthesizers = new FakeSynthesizerFactory()
                .withLatency(text -> ThreadLocalRandom.current().nextLong(0, 60));
        SynthesisOrchestrator orchestrator = new SynthesisOrchestrator(synthesizers,
                new SynthesisMetrics(new SimpleMeterRegistry()));
        pipeline = new DialoguePipelineService(orchestrator, new AudioAssembler(),
                new SynthesisExecutorFactory(new ThreadPoolProperties()));
        loader = new RunConfigurationLoader(new OrchestrationProperties(null, null));
    }

    @Test
    void shouldAssembleDialogueInScriptOrder() throws IOException {
        RunConfiguration config = configure(SCRIPT, true);

        RunReport report = pipeline.run(config);

        assertThat(report.outcome()).isEqualTo(RunReport.Outcome.COMPLETED);
        assertThat(report.isSuccess()).isTrue();
        assertThat(report.totalSegments()).isEqualTo(4);
        assertThat(report.succeeded()).isEqualTo(4);
        assertThat(report.failed()).isZero();
        assertThat(report.totalChunks()).isEqualTo(4);
        assertThat(report.outputFile()).isEqualTo(config.outputFile().toAbsolutePath());

        AudioFragment written = WavReader.read(config.outputFile());
        assertThat(written.format()).isEqualTo(FakeSynthesizerFactory.FORMAT);
        assertThat(written.data()).isEqualTo(concat(
                render(LINES[0]), PAUSE, render(LINES[1]), PAUSE, render(LINES[2]), PAUSE, render(LINES[3])));
        assertThat(report.audioDurationMs()).isEqualTo(written.durationMillis());
    }

    @Test
    void shouldBindEachLineToItsCharacterVoice() throws IOException {
        pipeline.run(configure(SCRIPT, true));

        assertThat(synthesizers.calls()).hasSize(4).allSatisfy(call -> {
            int expectedSpk = call.text().equals(LINES[0]) || call.text().equals(LINES[2]) ? 5 : 10;
            assertThat(call.voice().speakerId()).isEqualTo(expectedSpk);
        });
        assertThat(synthesizers.maxConcurrentCalls()).isLessThanOrEqualTo(2);
    }

    @Test
    void shouldRemoveSegmentFilesWhenCleanupEnabled() throws IOException {
        RunConfiguration config = configure(SCRIPT, true);

        pipeline.run(config);

        Path outputDir = config.outputFile().getParent();
        assertThat(outputDir.resolve(DialoguePipelineService.TEMP_DIR_NAME)).doesNotExist();
        assertThat(outputDir.resolve("dialogue.wav.part")).doesNotExist();
    }

    @Test
    void shouldKeepSegmentFilesWhenCleanupDisabled() throws IOException {
        RunConfiguration config = configure(SCRIPT, false);

        pipeline.run(config);

        Path segments = config.outputFile().getParent().resolve(DialoguePipelineService.TEMP_DIR_NAME);
        for (int i = 0; i < LINES.length; i++) {
            Path file = segments.resolve(DialoguePipelineService.segmentFileName(i));
            assertThat(WavReader.read(file).data()).isEqualTo(render(LINES[i]));
        }
    }

    @Test
    void shouldSkipFailedSegmentAndRecomputePauses() throws IOException {
        synthesizers.failingWhen(text -> text.equals(LINES[1]));

        RunConfiguration config = configure(SCRIPT, true);
        RunReport report = pipeline.run(config);

        assertThat(report.outcome()).isEqualTo(RunReport.Outcome.COMPLETED);
        assertThat(report.succeeded()).isEqualTo(3);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.segments().get(1).status()).isEqualTo(SegmentStatus.FAILED);
        // Naomi, Naomi, Keonne: only one speaker change is left
        assertThat(WavReader.read(config.outputFile()).data()).isEqualTo(concat(
                render(LINES[0]), render(LINES[2]), PAUSE, render(LINES[3])));
    }

    @Test
    void shouldWriteNothingWhenAllSegmentsFail() throws IOException {
        synthesizers.failingWhen(text -> true);
        RunConfiguration config = configure(SCRIPT, true);

        RunReport report = pipeline.run(config);

        assertThat(report.outcome()).isEqualTo(RunReport.Outcome.ALL_FAILED);
        assertThat(report.isSuccess()).isFalse();
        assertThat(report.outputFile()).isNull();
        assertThat(report.failed()).isEqualTo(4);
        assertThat(config.outputFile()).doesNotExist();
    }

    @Test
    void shouldReportNoSegmentsForUnlabeledScript() throws IOException {
        RunConfiguration config = configure("这是一段没有任何说话人标签的文字。", true);

        RunReport report = pipeline.run(config);

        assertThat(report.outcome()).isEqualTo(RunReport.Outcome.NO_SEGMENTS);
        assertThat(report.isSuccess()).isFalse();
        assertThat(synthesizers.calls()).isEmpty();
        assertThat(config.outputFile()).doesNotExist();
    }

    @Test
    void shouldAbortOnFormatMismatchWithoutOutput() throws IOException {
        PcmFormat hiFi = new PcmFormat(24_000, 1, 16);
        synthesizers.withFormat(text -> text.equals(LINES[2]) ? hiFi : FakeSynthesizerFactory.FORMAT);
        RunConfiguration config = configure(SCRIPT, true);

        assertThatThrownBy(() -> pipeline.run(config))
                .isInstanceOf(FormatMismatchException.class)
                .hasMessageContaining("segment 2");
        assertThat(config.outputFile()).doesNotExist();
        assertThat(config.outputFile().getParent().resolve(DialoguePipelineService.TEMP_DIR_NAME)).doesNotExist();
    }

    @Test
    void shouldVoiceLeadingNarrationWithNarrator() throws IOException {
        pipeline.run(configure("很久很久以前。\n娜奥米：你好。", true));

        assertThat(synthesizers.calls()).extracting(Call::text).containsExactlyInAnyOrder("很久很久以前。", "你好。");
        assertThat(synthesizers.calls()).filteredOn(call -> call.text().equals("很久很久以前。"))
                .singleElement()
                .satisfies(call -> assertThat(call.voice().speakerId()).isEqualTo(0));
    }

    @Test
    void shouldFailWhenScriptIsMissing() throws IOException {
        RunConfiguration config = configure(SCRIPT, true);
        Files.delete(config.inputFile());

        assertThatThrownBy(() -> pipeline.run(config))
                .isInstanceOf(DialogueIoException.class)
                .hasMessageContaining("dialogue.txt");
    }

    @Test
    void shouldClearRunIdAfterRun() throws IOException {
        pipeline.run(configure(SCRIPT, true));

        assertThat(ThreadContext.get("runId")).isNull();
    }

    @Test
    void shouldConvertDocumentInOneVoiceWithoutPauses() {
        Path output = tempDir.resolve("doc/document_audio.wav");
        ProcessingOptions processing = new ProcessingOptions(2, 8, 300, true, Duration.ofSeconds(30));

        RunReport report = pipeline.runDocument("第一句话。第二句话。第三句话。", DocumentProfile.MALE, output, processing);

        assertThat(report.outcome()).isEqualTo(RunReport.Outcome.COMPLETED);
        assertThat(report.totalSegments()).isEqualTo(3);
        assertThat(report.succeeded()).isEqualTo(3);
        assertThat(report.characters()).isEqualTo(15);
        assertThat(synthesizers.calls()).extracting(call -> call.voice().speakerId()).containsOnly(1);
        assertThat(WavReader.read(output).data()).isEqualTo(concat(
                render("第一句话。"), render("第二句话。"), render("第三句话。")));
        assertThat(output.getParent().resolve(DialoguePipelineService.TEMP_DIR_NAME)).doesNotExist();
    }

    @Test
    void shouldLeaveOutFailedDocumentChunk() {
        synthesizers.failingWhen(text -> text.equals("第二句话。"));
        Path output = tempDir.resolve("document_audio.wav");
        ProcessingOptions processing = new ProcessingOptions(2, 8, 300, true, Duration.ofSeconds(30));

        RunReport report = pipeline.runDocument("第一句话。第二句话。第三句话。", DocumentProfile.DEFAULT, output, processing);

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.succeeded()).isEqualTo(2);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.characters()).isEqualTo(10);
        assertThat(WavReader.read(output).data()).isEqualTo(concat(render("第一句话。"), render("第三句话。")));
    }

    @Test
    void shouldReportNoSegmentsForBlankDocument() {
        Path output = tempDir.resolve("blank.wav");

        RunReport report = pipeline.runDocument(" \n ", DocumentProfile.DEFAULT, output,
                ProcessingOptions.defaults(Duration.ofSeconds(30)));

        assertThat(report.outcome()).isEqualTo(RunReport.Outcome.NO_SEGMENTS);
        assertThat(synthesizers.calls()).isEmpty();
        assertThat(output).doesNotExist();
    }

    @Test
    void segmentFilesShouldBeZeroPadded() {
        assertThat(DialoguePipelineService.segmentFileName(3)).isEqualTo("segment_0003.wav");
        assertThat(DialoguePipelineService.segmentFileName(1234)).isEqualTo("segment_1234.wav");
    }

    private RunConfiguration configure(String script, boolean cleanup) throws IOException {
        Files.writeString(tempDir.resolve("dialogue.txt"), script, StandardCharsets.UTF_8);
        String json = """
                {
                  "input_file": "dialogue.txt",
                  "output_file": "out/dialogue.wav",
                  "characters": [
                    {"name": "Naomi Sinclair", "aliases": ["娜奥米"], "gender": "female",
                     "voice_profile": {"spk_id": 5}},
                    {"name": "Keonne Rodriguez", "aliases": ["基翁"], "gender": "male",
                     "voice_profile": {"spk_id": 10}}
                  ],
                  "default_narrator": {"gender": "male", "voice_profile": {"spk_id": 0}},
                  "processing": {"max_workers": 2, "chunk_size": 200, "pause_between_speakers_ms": 300,
                                 "cleanup_temp_files": %s, "task_timeout_seconds": 30}
                }
                """.formatted(cleanup);
        Path configFile = tempDir.resolve("characters_config.json");
        Files.writeString(configFile, json, StandardCharsets.UTF_8);
        return loader.load(configFile);
    }

    private static byte[] render(String text) {
        return FakeSynthesizerFactory.render(text).data();
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }
}
