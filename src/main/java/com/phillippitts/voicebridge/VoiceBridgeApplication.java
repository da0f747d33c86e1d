package com.phillippitts.voicebridge;

import com.phillippitts.voicebridge.config.properties.StreamProperties;
import com.phillippitts.voicebridge.config.properties.SynthesizerProperties;
import com.phillippitts.voicebridge.config.properties.TranscriberProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        StreamProperties.class,
        SynthesizerProperties.class,
        TranscriberProperties.class
})
public class VoiceBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceBridgeApplication.class, args);
    }

}
