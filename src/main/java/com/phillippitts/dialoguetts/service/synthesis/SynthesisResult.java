package com.phillippitts.dialoguetts.service.synthesis;

import com.phillippitts.dialoguetts.domain.AudioFragment;

import java.util.Objects;

/**
 * Outcome of one {@link ChunkTask}: either audio or the error that prevented it.
 *
 * @param task      task this result belongs to
 * @param audio     synthesized audio, null on failure
 * @param error     failure cause, null on success
 * @param elapsedMs wall time of the synthesis call
 */
public record SynthesisResult(ChunkTask task, AudioFragment audio, Throwable error, long elapsedMs) {

    public SynthesisResult {
        Objects.requireNonNull(task, "task must not be null");
        if ((audio == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of audio and error must be set");
        }
    }

    public static SynthesisResult success(ChunkTask task, AudioFragment audio, long elapsedMs) {
        return new SynthesisResult(task, audio, null, elapsedMs);
    }

    public static SynthesisResult failure(ChunkTask task, Throwable error, long elapsedMs) {
        return new SynthesisResult(task, null, error, elapsedMs);
    }

    public boolean success() {
        return audio != null;
    }
}
