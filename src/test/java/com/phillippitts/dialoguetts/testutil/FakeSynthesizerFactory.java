package com.phillippitts.dialoguetts.testutil;

import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.domain.PcmFormat;
import com.phillippitts.dialoguetts.domain.VoiceProfile;
import com.phillippitts.dialoguetts.exception.SynthesisException;
import com.phillippitts.dialoguetts.service.synthesis.SpeechSynthesizer;
import com.phillippitts.dialoguetts.service.synthesis.SpeechSynthesizerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link SpeechSynthesizerFactory} for tests that need no external binary.
 *
 * <p>Audio is derived from the text alone (see {@link #render(String, PcmFormat)}), so a test
 * can compute the exact bytes a segment or a whole run should produce. Latency, failures and
 * output format are scripted per text. Every handle records the calls made on it and the
 * factory tracks handle lifecycle and peak concurrency.
 */
public final class FakeSynthesizerFactory implements SpeechSynthesizerFactory {

    /** Default output format: 16 kHz, mono, 16-bit. */
    public static final PcmFormat FORMAT = new PcmFormat(16_000, 1, 16);

    /** Frames rendered per character of input text. */
    public static final int FRAMES_PER_CHAR = 160;

    private volatile Function<String, PcmFormat> formatFor = text -> FORMAT;
    private volatile ToLongFunction<String> latencyMs = text -> 0L;
    private volatile Predicate<String> failWhen = text -> false;
    private final AtomicInteger creationFailures = new AtomicInteger();

    private final AtomicInteger created = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());

    /** One recorded synthesis call. */
    public record Call(String text, VoiceProfile voice, String threadName) {}

    public FakeSynthesizerFactory withLatency(ToLongFunction<String> latencyMs) {
        this.latencyMs = latencyMs;
        return this;
    }

    public FakeSynthesizerFactory failingWhen(Predicate<String> failWhen) {
        this.failWhen = failWhen;
        return this;
    }

    public FakeSynthesizerFactory withFormat(Function<String, PcmFormat> formatFor) {
        this.formatFor = formatFor;
        return this;
    }

    /** The next {@code count} calls to {@link #create()} throw. */
    public FakeSynthesizerFactory failingCreations(int count) {
        this.creationFailures.set(count);
        return this;
    }

    @Override
    public SpeechSynthesizer create() {
        if (creationFailures.getAndDecrement() > 0) {
            throw new SynthesisException("Scripted handle failure");
        }
        created.incrementAndGet();
        return new FakeSynthesizer();
    }

    /**
     * Deterministic audio for a text: {@value #FRAMES_PER_CHAR} frames per character, every
     * sample set to a non-zero value derived from the text's hash.
     */
    public static AudioFragment render(String text, PcmFormat format) {
        int frames = text.length() * FRAMES_PER_CHAR;
        int bytesPerSample = format.bitsPerSample() / 8;
        byte[] data = new byte[frames * format.blockAlign()];
        int value = (text.hashCode() & 0x7FFF) | 1;
        for (int i = 0; i < data.length; i += bytesPerSample) {
            data[i] = (byte) value;
            if (bytesPerSample > 1) {
                data[i + 1] = (byte) (value >>> 8);
            }
        }
        return new AudioFragment(data, format);
    }

    public static AudioFragment render(String text) {
        return render(text, FORMAT);
    }

    public int createdCount() {
        return created.get();
    }

    public int closedCount() {
        return closed.get();
    }

    public int maxConcurrentCalls() {
        return maxActive.get();
    }

    public List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public List<String> texts() {
        return calls().stream().map(Call::text).toList();
    }

    private final class FakeSynthesizer implements SpeechSynthesizer {
        private volatile boolean open = true;

        @Override
        public AudioFragment synthesize(String text, VoiceProfile voice) {
            if (!open) {
                throw new IllegalStateException("Synthesizer is closed");
            }
            calls.add(new Call(text, voice, Thread.currentThread().getName()));
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                long delay = latencyMs.applyAsLong(text);
                if (delay > 0) {
                    Thread.sleep(delay);
                }
                if (failWhen.test(text)) {
                    throw new SynthesisException("Scripted failure for '" + text + "'", "fake");
                }
                return render(text, formatFor.apply(text));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SynthesisException("Interrupted", e);
            } finally {
                active.decrementAndGet();
            }
        }

        @Override
        public void close() {
            if (open) {
                open = false;
                closed.incrementAndGet();
            }
        }
    }
}
