package com.phillippitts.dialoguetts.service.voice;

import com.phillippitts.dialoguetts.config.properties.OrchestrationProperties;
import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.domain.Character;
import com.phillippitts.dialoguetts.domain.DocumentProfile;
import com.phillippitts.dialoguetts.domain.VoiceProfile;
import com.phillippitts.dialoguetts.exception.ConfigurationException;
import com.phillippitts.dialoguetts.exception.DialogueIoException;
import com.phillippitts.dialoguetts.service.audio.WavWriter;
import com.phillippitts.dialoguetts.service.synthesis.SpeechSynthesizer;
import com.phillippitts.dialoguetts.service.synthesis.SpeechSynthesizerFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a short self-introduction with one character's voice so the voice can be auditioned
 * without running a whole script. Document profiles are auditioned with a fixed test sentence.
 */
@Service
public class VoiceTestService {

    private static final Logger LOG = LogManager.getLogger(VoiceTestService.class);

    static final String PROFILE_TEST_TEXT = "你好，这是一个中文语音合成测试。欢迎使用PaddleSpeech。";

    private final SpeechSynthesizerFactory synthesizerFactory;
    private final OrchestrationProperties orchestrationProperties;

    public VoiceTestService(SpeechSynthesizerFactory synthesizerFactory,
                            OrchestrationProperties orchestrationProperties) {
        this.synthesizerFactory = synthesizerFactory;
        this.orchestrationProperties = orchestrationProperties;
    }

    /**
     * Synthesizes the test sentence for a character and writes {@code test_<name>.wav}.
     *
     * @param registry  registry to look the character up in (exact, then partial match)
     * @param name      character name or alias
     * @param outputDir directory for the WAV file
     * @return path of the written file
     * @throws ConfigurationException if no character matches {@code name}
     * @throws com.phillippitts.dialoguetts.exception.SynthesisException if synthesis fails
     */
    public Path testVoice(VoiceRegistry registry, String name, Path outputDir) {
        Character character = registry.findCharacter(name)
                .orElseThrow(() -> new ConfigurationException("Character '" + name + "' not found in configuration"));

        LOG.info("Testing voice for: {}", character.name());
        LOG.info("  Gender: {}", character.gender());
        LOG.info("  Speaker ID: {}", character.voiceProfile().speakerId());
        LOG.info("  Aliases: {}", String.join(", ", character.aliases()));

        String text = orchestrationProperties.testVoiceText(character.name());
        return render(text, character.voiceProfile(), outputDir.resolve(fileName(character.name())));
    }

    /**
     * Synthesizes the test sentence with a document profile and writes
     * {@code test_output_<profile>.wav}.
     *
     * @param profile   voice profile to audition
     * @param outputDir directory for the WAV file
     * @return path of the written file
     * @throws com.phillippitts.dialoguetts.exception.SynthesisException if synthesis fails
     */
    public Path testProfile(DocumentProfile profile, Path outputDir) {
        VoiceProfile voice = profile.voiceProfile();
        LOG.info("Running synthesis test with '{}' profile (model={}, spk_id={})",
                profile.id(), voice.acousticModel(), voice.speakerId());
        return render(PROFILE_TEST_TEXT, voice, outputDir.resolve("test_output_" + profile.id() + ".wav"));
    }

    private Path render(String text, VoiceProfile voice, Path output) {
        Path outputDir = output.getParent();
        try {
            if (outputDir != null) {
                Files.createDirectories(outputDir);
            }
        } catch (IOException e) {
            throw new DialogueIoException("Failed to create output directory", outputDir, e);
        }
        try (SpeechSynthesizer synthesizer = synthesizerFactory.create()) {
            AudioFragment audio = synthesizer.synthesize(text, voice);
            WavWriter.write(audio, output);
        }
        LOG.info("✓ Test audio saved to: {}", output);
        return output;
    }

    static String fileName(String characterName) {
        return "test_" + characterName.trim().replaceAll("[\\s/\\\\]+", "_") + ".wav";
    }
}
