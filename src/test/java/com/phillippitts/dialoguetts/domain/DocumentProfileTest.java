package com.phillippitts.dialoguetts.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentProfileTest {

    @Test
    void shouldResolveCommandLineIdsIgnoringCase() {
        assertThat(DocumentProfile.fromId("male")).contains(DocumentProfile.MALE);
        assertThat(DocumentProfile.fromId(" Female ")).contains(DocumentProfile.FEMALE);
        assertThat(DocumentProfile.fromId("robot")).isEmpty();
        assertThat(DocumentProfile.fromId(null)).isEmpty();
    }

    @Test
    void profilesShouldUseMultiSpeakerModel() {
        assertThat(DocumentProfile.DEFAULT.voiceProfile().speakerId()).isZero();
        assertThat(DocumentProfile.FEMALE.voiceProfile().speakerId()).isZero();
        assertThat(DocumentProfile.MALE.voiceProfile().speakerId()).isEqualTo(1);
        assertThat(DocumentProfile.MALE.voiceProfile().vocoder()).isEqualTo(VoiceProfile.DEFAULT_VOCODER);
        assertThat(DocumentProfile.ids()).isEqualTo("default, female, male");
    }
}
