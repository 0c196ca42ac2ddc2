package com.phillippitts.dialoguetts;

import com.phillippitts.dialoguetts.config.properties.OrchestrationProperties;
import com.phillippitts.dialoguetts.config.properties.SynthesisEngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        SynthesisEngineProperties.class,
        OrchestrationProperties.class
})
public class DialogueTtsApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DialogueTtsApplication.class, args)));
    }

}
