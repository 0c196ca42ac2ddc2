package com.phillippitts.dialoguetts.service.audio;

import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.domain.DialogueSegment;
import com.phillippitts.dialoguetts.domain.PcmFormat;
import com.phillippitts.dialoguetts.exception.FormatMismatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Joins per-segment audio into one track in script order.
 *
 * <p>Segments are walked by ascending index. Whenever the speaker label differs from the
 * previous segment's, a block of digital silence of the configured pause is inserted first.
 * Samples are appended raw: no crossfade, no resampling, no normalization.
 *
 * <p>The first segment's format is the reference; every other fragment must match it exactly.
 */
@Component
public class AudioAssembler {

    private static final Logger LOG = LogManager.getLogger(AudioAssembler.class);

    /**
     * Assembles segments that all carry audio.
     *
     * @param segments successful segments, in any order; neither the list nor its elements are modified
     * @param pauseMs  silence between different speakers, in milliseconds
     * @return one fragment in the reference format
     * @throws IllegalArgumentException if {@code segments} is empty, a segment has no audio, or
     *                                  {@code pauseMs} is negative
     * @throws FormatMismatchException  if a fragment's format differs from the first one's
     */
    public AudioFragment assemble(List<DialogueSegment> segments, long pauseMs) {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("segments must not be empty");
        }
        if (pauseMs < 0) {
            throw new IllegalArgumentException("pauseMs must not be negative, got: " + pauseMs);
        }

        List<DialogueSegment> ordered = new ArrayList<>(segments);
        ordered.sort(Comparator.comparingInt(DialogueSegment::index));

        PcmFormat reference = requireAudio(ordered.get(0)).format();
        for (DialogueSegment segment : ordered) {
            PcmFormat actual = requireAudio(segment).format();
            if (!reference.equals(actual)) {
                throw new FormatMismatchException(segment.index(), reference, actual);
            }
        }

        byte[] silence = AudioFragment.silence(pauseMs, reference).data();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String previousSpeaker = null;
        int pauses = 0;
        for (DialogueSegment segment : ordered) {
            if (previousSpeaker != null && !previousSpeaker.equals(segment.speaker())) {
                out.writeBytes(silence);
                pauses++;
            }
            out.writeBytes(segment.audio().data());
            previousSpeaker = segment.speaker();
        }

        AudioFragment result = new AudioFragment(out.toByteArray(), reference);
        LOG.info("Assembled {} segments with {} speaker pauses: {} ms at {}",
                ordered.size(), pauses, result.durationMillis(), reference);
        return result;
    }

    private static AudioFragment requireAudio(DialogueSegment segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        if (segment.audio() == null) {
            throw new IllegalArgumentException("Segment " + segment.index() + " has no audio");
        }
        return segment.audio();
    }
}
