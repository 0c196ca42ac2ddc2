package com.phillippitts.dialoguetts.domain;

import com.phillippitts.dialoguetts.util.TimeUtils;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Raw PCM sample buffer plus its format descriptor.
 *
 * <p>The buffer is not copied on construction, and {@link #data()} returns it as is. Whoever
 * creates a fragment hands ownership of the array to it; fragments are shared between workers
 * and the assembler, so every holder treats the array as read-only.
 *
 * @param data   interleaved little-endian PCM samples, aligned to the format's block size
 * @param format sample rate, channel count and bit depth of {@code data}
 */
public record AudioFragment(byte[] data, PcmFormat format) {

    public AudioFragment {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(format, "format must not be null");
        if (data.length % format.blockAlign() != 0) {
            throw new IllegalArgumentException("PCM length " + data.length
                    + " not aligned to block size " + format.blockAlign());
        }
    }

    /**
     * Creates a fragment of digital silence.
     *
     * @param durationMs silence duration in milliseconds
     * @param format     format of the silence
     * @return zero-filled fragment of exactly {@code sampleRate * durationMs / 1000} frames
     */
    public static AudioFragment silence(long durationMs, PcmFormat format) {
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must not be negative, got: " + durationMs);
        }
        long frames = TimeUtils.millisToFrames(durationMs, format.sampleRate());
        return new AudioFragment(new byte[Math.toIntExact(frames * format.blockAlign())], format);
    }

    /**
     * Appends the fragments' samples in list order. All fragments must share one format.
     *
     * @throws IllegalArgumentException if the list is empty or formats differ
     */
    public static AudioFragment concat(List<AudioFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be empty");
        }
        if (fragments.size() == 1) {
            return fragments.get(0);
        }
        PcmFormat format = fragments.get(0).format();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (AudioFragment f : fragments) {
            if (!format.equals(f.format())) {
                throw new IllegalArgumentException("Cannot concatenate " + f.format() + " onto " + format);
            }
            out.writeBytes(f.data());
        }
        return new AudioFragment(out.toByteArray(), format);
    }

    public int byteLength() {
        return data.length;
    }

    public long frameCount() {
        return data.length / format.blockAlign();
    }

    public long durationMillis() {
        return TimeUtils.framesToMillis(frameCount(), format.sampleRate());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioFragment other)) {
            return false;
        }
        return format.equals(other.format) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * format.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "AudioFragment[" + format + ", frames=" + frameCount() + "]";
    }
}
