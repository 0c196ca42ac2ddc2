package com.phillippitts.dialoguetts.domain;

import java.util.Objects;

/**
 * Immutable parameter set identifying exactly one synthesizable voice.
 *
 * @param acousticModel acoustic model id (e.g., "fastspeech2_aishell3")
 * @param vocoder       vocoder id (e.g., "hifigan_aishell3")
 * @param speakerId     speaker id within a multi-speaker model
 * @param gender        free-form gender tag ("male", "female", "unknown")
 * @param description   human-readable description, may be empty
 */
public record VoiceProfile(
        String acousticModel,
        String vocoder,
        int speakerId,
        String gender,
        String description
) {

    public static final String DEFAULT_ACOUSTIC_MODEL = "fastspeech2_aishell3";
    public static final String DEFAULT_VOCODER = "hifigan_aishell3";
    public static final String UNKNOWN_GENDER = "unknown";

    public VoiceProfile {
        Objects.requireNonNull(acousticModel, "acousticModel must not be null");
        Objects.requireNonNull(vocoder, "vocoder must not be null");
        if (speakerId < 0) {
            throw new IllegalArgumentException("speakerId must not be negative, got: " + speakerId);
        }
        gender = gender == null || gender.isBlank() ? UNKNOWN_GENDER : gender;
        description = description == null ? "" : description;
    }

    /**
     * Creates a profile on the default AISHELL-3 model pair.
     */
    public static VoiceProfile of(int speakerId, String gender) {
        return new VoiceProfile(DEFAULT_ACOUSTIC_MODEL, DEFAULT_VOCODER, speakerId, gender, "");
    }
}
