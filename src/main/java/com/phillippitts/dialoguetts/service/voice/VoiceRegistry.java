package com.phillippitts.dialoguetts.service.voice;

import com.phillippitts.dialoguetts.domain.Character;
import com.phillippitts.dialoguetts.domain.VoiceProfile;
import com.phillippitts.dialoguetts.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves speaker labels from a script to voice profiles.
 *
 * <p>Resolution order for {@link #resolve(String)}:
 * <ol>
 *   <li>Exact match, case-insensitive, against each character's name and aliases</li>
 *   <li>Partial match: an alias containing the label or contained in it</li>
 *   <li>The default narrator, if configured</li>
 *   <li>The first registered character</li>
 * </ol>
 * Every step scans characters in registration order and the first hit wins.
 *
 * <p><b>Known gap:</b> the partial step is ambiguous. A short alias such as "A" matches any
 * label containing that letter, so an unrelated speaker can be assigned the wrong voice.
 * Ties are broken only by registration order. Kept as-is for compatibility with existing
 * character configurations.
 *
 * <p><b>Thread Safety:</b> Immutable after construction; safe to share across threads.
 */
public final class VoiceRegistry {

    private static final Logger LOG = LogManager.getLogger(VoiceRegistry.class);

    private final List<Character> characters;
    private final Character narrator;

    /**
     * @param characters characters in registration order; names must be unique (case-insensitive)
     * @param narrator   default narrator, or null if none is configured
     * @throws ConfigurationException if two characters share a name
     */
    public VoiceRegistry(List<Character> characters, Character narrator) {
        this.characters = characters == null ? List.of() : List.copyOf(characters);
        this.narrator = narrator;
        requireUniqueNames(this.characters);
    }

    private static void requireUniqueNames(List<Character> characters) {
        Set<String> seen = new HashSet<>();
        for (Character c : characters) {
            if (!seen.add(c.name().trim().toLowerCase(Locale.ROOT))) {
                throw new ConfigurationException("Duplicate character name: " + c.name());
            }
        }
    }

    /**
     * Finds the character for a label using the exact and partial steps only.
     *
     * @param label speaker label as it appeared in the script
     * @return matching character, or empty if neither step matches
     */
    public Optional<Character> findCharacter(String label) {
        for (Character c : characters) {
            if (c.matches(label)) {
                return Optional.of(c);
            }
        }
        for (Character c : characters) {
            if (c.partiallyMatches(label)) {
                LOG.debug("Partial alias match '{}' -> {}", label, c.name());
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a speaker label to the voice that should render it.
     *
     * @param label speaker label as it appeared in the script
     * @return voice profile, never null
     * @throws ConfigurationException if no character or narrator is configured at all
     */
    public VoiceProfile resolve(String label) {
        Optional<Character> match = findCharacter(label);
        if (match.isPresent()) {
            Character c = match.get();
            LOG.debug("Resolved '{}' -> {} (spk_id={})", label, c.name(), c.voiceProfile().speakerId());
            return c.voiceProfile();
        }
        if (narrator != null) {
            LOG.debug("No character for '{}', using default narrator", label);
            return narrator.voiceProfile();
        }
        if (!characters.isEmpty()) {
            LOG.warn("No character or narrator for '{}', falling back to {}", label, characters.get(0).name());
            return characters.get(0).voiceProfile();
        }
        throw new ConfigurationException("No voice available for speaker '" + label
                + "': no characters and no default narrator configured");
    }

    public List<Character> characters() {
        return characters;
    }

    public Optional<Character> narrator() {
        return Optional.ofNullable(narrator);
    }
}
