package com.phillippitts.dialoguetts.domain;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A named speaker with aliases and the voice used to render its lines.
 *
 * <p>Name and alias comparison is case-insensitive.
 *
 * @param name         canonical name, unique within a run
 * @param aliases      alternative labels that identify this character in scripts
 * @param gender       gender tag
 * @param voiceProfile voice used for this character's lines
 * @param description  human-readable description, may be empty
 */
public record Character(
        String name,
        List<String> aliases,
        String gender,
        VoiceProfile voiceProfile,
        String description
) {

    public Character {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        gender = gender == null || gender.isBlank() ? VoiceProfile.UNKNOWN_GENDER : gender;
        Objects.requireNonNull(voiceProfile, "voiceProfile must not be null");
        description = description == null ? "" : description;
    }

    /**
     * True if the label equals the name or any alias, ignoring case.
     */
    public boolean matches(String label) {
        if (label == null) {
            return false;
        }
        String needle = normalize(label);
        if (normalize(name).equals(needle)) {
            return true;
        }
        for (String alias : aliases) {
            if (normalize(alias).equals(needle)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if any non-blank alias contains the label or is contained in it, ignoring case.
     */
    public boolean partiallyMatches(String label) {
        if (label == null || label.isBlank()) {
            return false;
        }
        String needle = normalize(label);
        for (String alias : aliases) {
            String a = normalize(alias);
            if (!a.isEmpty() && (a.contains(needle) || needle.contains(a))) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }
}
