package com.phillippitts.dialoguetts.config.run;

import com.phillippitts.dialoguetts.domain.Character;
import com.phillippitts.dialoguetts.exception.ConfigurationException;
import com.phillippitts.dialoguetts.service.voice.VoiceRegistry;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one pipeline run needs, loaded from a character configuration document.
 *
 * <p>Immutable and passed explicitly; nothing here is stored in global state.
 *
 * @param configFile the document this was loaded from
 * @param inputFile  dialogue script, or null if the document names none
 * @param outputFile final WAV artifact, or null if the document names none
 * @param characters characters in document order
 * @param narrator   default narrator, or null if none is configured
 * @param processing processing options
 */
public record RunConfiguration(
        Path configFile,
        Path inputFile,
        Path outputFile,
        List<Character> characters,
        Character narrator,
        ProcessingOptions processing
) {

    public RunConfiguration {
        Objects.requireNonNull(configFile, "configFile must not be null");
        characters = characters == null ? List.of() : List.copyOf(characters);
        Objects.requireNonNull(processing, "processing must not be null");
    }

    /**
     * Builds the registry for this run's characters.
     *
     * @throws ConfigurationException if two characters share a name
     */
    public VoiceRegistry voiceRegistry() {
        return new VoiceRegistry(characters, narrator);
    }

    public Optional<Character> defaultNarrator() {
        return Optional.ofNullable(narrator);
    }

    public Path requireInputFile() {
        if (inputFile == null) {
            throw new ConfigurationException("input_file is not set", configFile.toString());
        }
        return inputFile;
    }

    public Path requireOutputFile() {
        if (outputFile == null) {
            throw new ConfigurationException("output_file is not set", configFile.toString());
        }
        return outputFile;
    }
}
