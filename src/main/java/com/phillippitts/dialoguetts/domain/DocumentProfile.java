package com.phillippitts.dialoguetts.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Predefined single voices for plain-document conversion, all on the AISHELL-3 model pair.
 */
public enum DocumentProfile {

    DEFAULT(0, "female", "Default voice"),
    FEMALE(0, "female", "Female voice"),
    MALE(1, "male", "Male voice");

    private final int speakerId;
    private final String gender;
    private final String description;

    DocumentProfile(int speakerId, String gender, String description) {
        this.speakerId = speakerId;
        this.gender = gender;
        this.description = description;
    }

    /** Lower-case name as accepted on the command line. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String description() {
        return description;
    }

    public VoiceProfile voiceProfile() {
        return new VoiceProfile(VoiceProfile.DEFAULT_ACOUSTIC_MODEL, VoiceProfile.DEFAULT_VOCODER,
                speakerId, gender, description);
    }

    /**
     * Looks a profile up by its command-line id, ignoring case.
     */
    public static Optional<DocumentProfile> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String wanted = id.trim();
        return Arrays.stream(values()).filter(p -> p.id().equalsIgnoreCase(wanted)).findFirst();
    }

    public static String ids() {
        return Arrays.stream(values()).map(DocumentProfile::id).collect(Collectors.joining(", "));
    }
}
