package com.phillippitts.dialoguetts.domain;

import java.util.Objects;

/**
 * One speaker-attributed unit of dialogue with a stable position in output order.
 *
 * <p>{@code index}, {@code speaker} and {@code text} are fixed at parse time. The voice is bound
 * once before synthesis and the audio once after a successful synthesis; both bindings happen on
 * the pipeline thread, never on a worker.
 */
public final class DialogueSegment {

    private final int index;
    private final String speaker;
    private final String text;
    private VoiceProfile voiceProfile;
    private AudioFragment audio;

    public DialogueSegment(int index, String speaker, String text) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
        this.index = index;
        this.speaker = Objects.requireNonNull(speaker, "speaker must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    public int index() {
        return index;
    }

    public String speaker() {
        return speaker;
    }

    public String text() {
        return text;
    }

    public VoiceProfile voiceProfile() {
        return voiceProfile;
    }

    public AudioFragment audio() {
        return audio;
    }

    public void bindVoice(VoiceProfile profile) {
        this.voiceProfile = Objects.requireNonNull(profile, "profile must not be null");
    }

    public void attachAudio(AudioFragment fragment) {
        this.audio = Objects.requireNonNull(fragment, "fragment must not be null");
    }

    @Override
    public String toString() {
        return "DialogueSegment[index=" + index + ", speaker=" + speaker + ", chars=" + text.length() + "]";
    }
}
