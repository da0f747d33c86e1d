package com.phillippitts.voicebridge.config;

import com.phillippitts.voicebridge.config.properties.SynthesizerProperties;
import com.phillippitts.voicebridge.service.audio.AudioEncoding;
import com.phillippitts.voicebridge.service.audio.AudioFormat;
import com.phillippitts.voicebridge.service.audio.PcmAudioNormalizer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingAdapterConfigTest {

    @Test
    void mulawModeShouldPassAudioThrough() {
        SynthesizerProperties props = new SynthesizerProperties();
        props.setUseMulaw(true);

        PcmAudioNormalizer normalizer = (PcmAudioNormalizer) StreamingAdapterConfig.audioNormalizer(props);

        assertThat(normalizer.getEncoding()).isEqualTo(AudioEncoding.MULAW);
        assertThat(normalizer.normalize(new byte[] { 1 }, 16_000).format()).isEqualTo(AudioFormat.FORMAT_MULAW);
    }

    @Test
    void pcmModeShouldProduceWav() {
        SynthesizerProperties props = new SynthesizerProperties();
        props.setProviderSampleRate(22_050);

        PcmAudioNormalizer normalizer = (PcmAudioNormalizer) StreamingAdapterConfig.audioNormalizer(props);

        assertThat(normalizer.getEncoding()).isEqualTo(AudioEncoding.PCM16);
        assertThat(normalizer.normalize(new byte[4], 22_050).format()).isEqualTo(AudioFormat.FORMAT_WAV);
    }
}
