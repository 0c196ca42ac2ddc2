package com.phillippitts.dialoguetts.service.audio;

import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.domain.PcmFormat;
import com.phillippitts.dialoguetts.exception.DialogueIoException;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes {@link AudioFragment}s as canonical 44-byte-header PCM WAV files in the fragment's own
 * format.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Writes a WAV file, creating or overwriting {@code wavPath}.
     *
     * @throws DialogueIoException if the file cannot be written
     */
    public static void write(AudioFragment fragment, Path wavPath) {
        Objects.requireNonNull(fragment, "fragment must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(wavPath))) {
            writeTo(fragment, os);
        } catch (IOException e) {
            throw new DialogueIoException("Failed to write WAV file", wavPath, e);
        }
    }

    static void writeTo(AudioFragment fragment, OutputStream os) throws IOException {
        PcmFormat format = fragment.format();
        byte[] pcm = fragment.data();

        // RIFF header
        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, WavFormat.CANONICAL_HEADER_SIZE - WavFormat.CHUNK_HEADER_SIZE + pcm.length);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        // fmt chunk
        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, WavFormat.FMT_CHUNK_MIN_SIZE);
        writeLEShort(os, WavFormat.AUDIO_FORMAT_PCM);
        writeLEShort(os, format.channels());
        writeLEInt(os, format.sampleRate());
        writeLEInt(os, format.byteRate());
        writeLEShort(os, format.blockAlign());
        writeLEShort(os, format.bitsPerSample());

        // data chunk
        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, pcm.length);
        os.write(pcm);
        os.flush();
    }

    private static void writeLEShort(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
