package com.phillippitts.dialoguetts.service.voice;

import com.phillippitts.dialoguetts.domain.Character;
import com.phillippitts.dialoguetts.domain.VoiceProfile;
import com.phillippitts.dialoguetts.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoiceRegistryTest {

    private Character naomi;
    private Character keonne;
    private Character narrator;

    @BeforeEach
    void setUp() {
        naomi = new Character("Naomi Sinclair", List.of("娜奥米", "Naomi"), "female",
                VoiceProfile.of(5, "female"), "");
        keonne = new Character("Keonne Rodriguez", List.of("基翁", "Keonne"), "male",
                VoiceProfile.of(10, "male"), "");
        narrator = new Character("Narrator", List.of("Narrator", "旁白"), "male", VoiceProfile.of(0, "male"), "");
    }

    @Test
    void shouldResolveExactNameOrAlias() {
        VoiceRegistry registry = new VoiceRegistry(List.of(naomi, keonne), narrator);

        assertThat(registry.resolve("娜奥米").speakerId()).isEqualTo(5);
        assertThat(registry.resolve("keonne").speakerId()).isEqualTo(10);
        assertThat(registry.resolve("Keonne Rodriguez").speakerId()).isEqualTo(10);
    }

    @Test
    void shouldResolvePartialAliasMatch() {
        VoiceRegistry registry = new VoiceRegistry(List.of(naomi, keonne), narrator);

        assertThat(registry.resolve("基翁先生").speakerId()).isEqualTo(10);
        assertThat(registry.findCharacter("基翁先生")).contains(keonne);
    }

    @Test
    void shouldFallBackToNarrator() {
        VoiceRegistry registry = new VoiceRegistry(List.of(naomi, keonne), narrator);

        assertThat(registry.findCharacter("路人")).isEmpty();
        assertThat(registry.resolve("路人").speakerId()).isZero();
    }

    @Test
    void shouldFallBackToFirstCharacterWithoutNarrator() {
        VoiceRegistry registry = new VoiceRegistry(List.of(naomi, keonne), null);

        assertThat(registry.resolve("路人").speakerId()).isEqualTo(5);
        assertThat(registry.narrator()).isEmpty();
    }

    @Test
    void shouldFailWhenNothingIsConfigured() {
        VoiceRegistry registry = new VoiceRegistry(List.of(), null);

        assertThatThrownBy(() -> registry.resolve("A"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("'A'");
    }

    @Test
    void shouldUseNarratorWhenNoCharacters() {
        VoiceRegistry registry = new VoiceRegistry(null, narrator);

        assertThat(registry.resolve("anyone").speakerId()).isZero();
        assertThat(registry.characters()).isEmpty();
    }

    @Test
    void shouldRejectDuplicateNames() {
        Character twin = new Character("naomi sinclair", List.of(), "female", VoiceProfile.of(6, "female"), "");

        assertThatThrownBy(() -> new VoiceRegistry(List.of(naomi, twin), null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate character name");
    }

    @Test
    void partialMatchTieShouldGoToFirstRegistered() {
        Character captain = new Character("Captain", List.of("A队长"), "male", VoiceProfile.of(20, "male"), "");
        Character doctor = new Character("Doctor", List.of("A医生"), "female", VoiceProfile.of(21, "female"), "");
        VoiceRegistry registry = new VoiceRegistry(List.of(captain, doctor), narrator);

        assertThat(registry.resolve("A").speakerId()).isEqualTo(20);
    }

    @Test
    void exactMatchShouldWinOverEarlierPartialMatch() {
        Character first = new Character("First", List.of("基翁先生"), "male", VoiceProfile.of(30, "male"), "");
        VoiceRegistry registry = new VoiceRegistry(List.of(first, keonne), narrator);

        assertThat(registry.resolve("基翁").speakerId()).isEqualTo(10);
    }
}
