package com.phillippitts.voicebridge.config;

import com.phillippitts.voicebridge.config.properties.StreamProperties;
import com.phillippitts.voicebridge.config.properties.SynthesizerProperties;
import com.phillippitts.voicebridge.config.properties.TranscriberProperties;
import com.phillippitts.voicebridge.service.audio.AudioEncoding;
import com.phillippitts.voicebridge.service.audio.AudioFormat;
import com.phillippitts.voicebridge.service.audio.AudioNormalizer;
import com.phillippitts.voicebridge.service.audio.PcmAudioNormalizer;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import com.phillippitts.voicebridge.service.stt.AzureRecognitionConnectionFactory;
import com.phillippitts.voicebridge.service.stt.AzureTranscriber;
import com.phillippitts.voicebridge.service.synth.ElevenLabsConnectionFactory;
import com.phillippitts.voicebridge.service.synth.ElevenLabsSynthesizer;
import com.phillippitts.voicebridge.service.synth.InMemorySynthesisCache;
import com.phillippitts.voicebridge.service.synth.SynthesisCache;
import com.phillippitts.voicebridge.util.LogSanitizer;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the streaming adapters.
 *
 * <p>Each adapter is created only when its {@code voice.<adapter>.enabled} property is true. Spring
 * starts it after construction and stops it on context shutdown, so the connection, supervisor and
 * worker threads live exactly as long as the context.
 */
@Configuration
public class StreamingAdapterConfig {

    private static final Logger LOG = LogManager.getLogger(StreamingAdapterConfig.class);

    @Bean
    public StreamingMetrics streamingMetrics(MeterRegistry registry) {
        return new StreamingMetrics(registry);
    }

    @Bean
    public SynthesisCache synthesisCache() {
        return new InMemorySynthesisCache();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "voice.synthesizer", name = "enabled", havingValue = "true")
    public ElevenLabsSynthesizer elevenLabsSynthesizer(SynthesizerProperties synthesizerProperties,
                                                       StreamProperties streamProperties,
                                                       SynthesisCache synthesisCache,
                                                       StreamingMetrics metrics,
                                                       ApplicationEventPublisher publisher) {
        if (synthesizerProperties.getApiKey() == null || synthesizerProperties.getApiKey().isBlank()) {
            LOG.warn("voice.synthesizer.api-key is empty; ElevenLabs will reject the handshake");
        } else {
            LOG.info("ElevenLabs synthesizer enabled (voice={}, key={})",
                    synthesizerProperties.getVoiceId(), LogSanitizer.mask(synthesizerProperties.getApiKey()));
        }
        return new ElevenLabsSynthesizer(
                new ElevenLabsConnectionFactory(synthesizerProperties),
                synthesizerProperties,
                streamProperties,
                audioNormalizer(synthesizerProperties),
                synthesisCache,
                metrics,
                publisher);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "voice.transcriber", name = "enabled", havingValue = "true")
    public AzureTranscriber azureTranscriber(TranscriberProperties transcriberProperties,
                                             StreamProperties streamProperties,
                                             StreamingMetrics metrics,
                                             ApplicationEventPublisher publisher) {
        if (transcriberProperties.getSubscriptionKey() == null || transcriberProperties.getSubscriptionKey().isBlank()
                || transcriberProperties.getRegion() == null || transcriberProperties.getRegion().isBlank()) {
            LOG.warn("voice.transcriber.subscription-key or region is empty; Azure sessions will fail to start");
        }
        return new AzureTranscriber(
                new AzureRecognitionConnectionFactory(transcriberProperties),
                streamProperties,
                metrics,
                publisher);
    }

    static AudioNormalizer audioNormalizer(SynthesizerProperties properties) {
        if (properties.isUseMulaw()) {
            return new PcmAudioNormalizer(AudioEncoding.MULAW, AudioFormat.MULAW_SAMPLE_RATE);
        }
        return new PcmAudioNormalizer(AudioEncoding.PCM16, properties.getProviderSampleRate());
    }
}
