package com.phillippitts.dialoguetts.service.synthesis;

import com.phillippitts.dialoguetts.domain.VoiceProfile;

import java.util.Objects;

/**
 * One synthesis call: a slice of a segment's text plus the voice to render it with.
 *
 * @param segmentIndex index of the owning segment
 * @param ordinal      position of this chunk within the segment, from 0
 * @param chunkCount   total chunks of the owning segment
 * @param speaker      speaker label of the owning segment, for diagnostics
 * @param text         text slice
 * @param voice        voice to render with
 */
public record ChunkTask(
        int segmentIndex,
        int ordinal,
        int chunkCount,
        String speaker,
        String text,
        VoiceProfile voice
) {

    public ChunkTask {
        if (ordinal < 0 || ordinal >= chunkCount) {
            throw new IllegalArgumentException("ordinal " + ordinal + " outside [0, " + chunkCount + ")");
        }
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(voice, "voice must not be null");
    }

    public String id() {
        return segmentIndex + "." + ordinal;
    }
}
