package com.phillippitts.dialoguetts.config.run;

import com.phillippitts.dialoguetts.config.properties.OrchestrationProperties;
import com.phillippitts.dialoguetts.domain.Character;
import com.phillippitts.dialoguetts.domain.VoiceProfile;
import com.phillippitts.dialoguetts.exception.ConfigurationException;
import com.phillippitts.dialoguetts.exception.DialogueIoException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a character configuration JSON document into a {@link RunConfiguration}.
 *
 * <p>Document shape:
 * <pre>
 * {
 *   "input_file": "dialogue.txt",
 *   "output_file": "output/dialogue.wav",
 *   "characters": [
 *     {"name": "Naomi", "aliases": ["娜奥米"], "gender": "female", "description": "...",
 *      "voice_profile": {"am": "fastspeech2_aishell3", "voc": "hifigan_aishell3", "spk_id": 5}}
 *   ],
 *   "default_narrator": {"gender": "male", "voice_profile": {"spk_id": 0}},
 *   "processing": {"max_workers": 4, "chunk_size": 200, "pause_between_speakers_ms": 300,
 *                  "cleanup_temp_files": true, "task_timeout_seconds": 120}
 * }
 * </pre>
 *
 * <p>Missing voice fields fall back to the AISHELL-3 model pair and speaker 0. Relative
 * {@code input_file} and {@code output_file} paths are resolved against the directory that
 * contains the document.
 */
@Component
public class RunConfigurationLoader {

    private static final Logger LOG = LogManager.getLogger(RunConfigurationLoader.class);

    public static final String NARRATOR_NAME = "Narrator";
    public static final List<String> NARRATOR_ALIASES = List.of("Narrator", "旁白");

    private final OrchestrationProperties orchestrationProperties;

    public RunConfigurationLoader(OrchestrationProperties orchestrationProperties) {
        this.orchestrationProperties = orchestrationProperties;
    }

    /**
     * Loads and validates a configuration document.
     *
     * @param configFile path to the JSON document
     * @return immutable run configuration
     * @throws DialogueIoException    if the file cannot be read
     * @throws ConfigurationException if the JSON is malformed or a value is invalid
     */
    public RunConfiguration load(Path configFile) {
        String json;
        try {
            json = Files.readString(configFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DialogueIoException("Failed to read configuration", configFile, e);
        }

        String source = configFile.toString();
        try {
            JSONObject root = new JSONObject(json);
            Path baseDir = configFile.toAbsolutePath().getParent();

            List<Character> characters = new ArrayList<>();
            JSONArray array = root.optJSONArray("characters");
            if (array != null) {
                for (int i = 0; i < array.length(); i++) {
                    Character c = parseCharacter(array.getJSONObject(i), source);
                    characters.add(c);
                    LOG.info("Loaded character: {} (aliases: {})", c.name(), c.aliases());
                }
            }

            Character narrator = parseNarrator(root.optJSONObject("default_narrator"));
            if (narrator != null) {
                LOG.info("Loaded default narrator: spk_id={}", narrator.voiceProfile().speakerId());
            }

            RunConfiguration config = new RunConfiguration(
                    configFile,
                    resolvePath(baseDir, root.optString("input_file", "")),
                    resolvePath(baseDir, root.optString("output_file", "")),
                    characters,
                    narrator,
                    parseProcessing(root.optJSONObject("processing")));
            LOG.info("Loaded {} characters from {}", characters.size(), configFile);
            return config;
        } catch (JSONException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getMessage(), source, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration value: " + e.getMessage(), source, e);
        }
    }

    private static Character parseCharacter(JSONObject json, String source) {
        String name = json.optString("name", "").trim();
        if (name.isEmpty()) {
            throw new ConfigurationException("Character entry without a name", source);
        }
        String gender = json.optString("gender", VoiceProfile.UNKNOWN_GENDER);
        String description = json.optString("description", "");

        List<String> aliases = new ArrayList<>();
        JSONArray aliasArray = json.optJSONArray("aliases");
        if (aliasArray != null) {
            for (int i = 0; i < aliasArray.length(); i++) {
                aliases.add(aliasArray.getString(i));
            }
        }

        VoiceProfile profile = parseVoiceProfile(json.optJSONObject("voice_profile"), gender, description);
        return new Character(name, aliases, gender, profile, description);
    }

    private static Character parseNarrator(JSONObject json) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        String gender = json.optString("gender", VoiceProfile.UNKNOWN_GENDER);
        VoiceProfile profile = parseVoiceProfile(json.optJSONObject("voice_profile"), gender, "Default Narrator");
        return new Character(NARRATOR_NAME, NARRATOR_ALIASES, gender, profile,
                "Default narrator for unassigned text");
    }

    private static VoiceProfile parseVoiceProfile(JSONObject json, String gender, String description) {
        JSONObject voice = json == null ? new JSONObject() : json;
        return new VoiceProfile(
                voice.optString("am", VoiceProfile.DEFAULT_ACOUSTIC_MODEL),
                voice.optString("voc", VoiceProfile.DEFAULT_VOCODER),
                voice.optInt("spk_id", 0),
                gender,
                description);
    }

    /**
     * Processing options used when no configuration document is given (document mode).
     */
    public ProcessingOptions defaultProcessing() {
        return ProcessingOptions.defaults(Duration.ofSeconds(orchestrationProperties.getDefaultTaskTimeoutSeconds()));
    }

    private ProcessingOptions parseProcessing(JSONObject json) {
        JSONObject p = json == null ? new JSONObject() : json;
        int timeoutSeconds = p.optInt("task_timeout_seconds", orchestrationProperties.getDefaultTaskTimeoutSeconds());
        return new ProcessingOptions(
                p.optInt("max_workers", ProcessingOptions.defaultMaxWorkers()),
                p.optInt("chunk_size", ProcessingOptions.DEFAULT_CHUNK_SIZE),
                p.optLong("pause_between_speakers_ms", ProcessingOptions.DEFAULT_PAUSE_MS),
                p.optBoolean("cleanup_temp_files", true),
                Duration.ofSeconds(timeoutSeconds));
    }

    private static Path resolvePath(Path baseDir, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Path path = Path.of(value);
        if (path.isAbsolute() || baseDir == null) {
            return path;
        }
        return baseDir.resolve(path).normalize();
    }
}
