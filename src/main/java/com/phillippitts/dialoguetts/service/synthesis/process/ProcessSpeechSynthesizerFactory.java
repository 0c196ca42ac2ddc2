package com.phillippitts.dialoguetts.service.synthesis.process;

import com.phillippitts.dialoguetts.config.properties.SynthesisEngineProperties;
import com.phillippitts.dialoguetts.service.synthesis.SpeechSynthesizer;
import com.phillippitts.dialoguetts.service.synthesis.SpeechSynthesizerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Production {@link SpeechSynthesizerFactory}: every call opens a new
 * {@link ProcessSpeechSynthesizer} with its own working directory.
 */
@Component
public class ProcessSpeechSynthesizerFactory implements SpeechSynthesizerFactory {

    private final SynthesisEngineProperties properties;
    private final ProcessFactory processFactory;

    @Autowired
    public ProcessSpeechSynthesizerFactory(SynthesisEngineProperties properties) {
        this(properties, new DefaultProcessFactory());
    }

    ProcessSpeechSynthesizerFactory(SynthesisEngineProperties properties, ProcessFactory processFactory) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    @Override
    public SpeechSynthesizer create() {
        return ProcessSpeechSynthesizer.open(properties, processFactory);
    }
}
