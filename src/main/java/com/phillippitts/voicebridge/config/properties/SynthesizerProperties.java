package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the ElevenLabs streaming synthesizer.
 *
 * <p>The API key is an opaque value; by default it is resolved from {@code ELEVENLABS_API_KEY}
 * in application.properties.
 */
@ConfigurationProperties(prefix = "voice.synthesizer")
@Validated
public class SynthesizerProperties {

    /** Enable the synthesizer bean. */
    private boolean enabled = false;

    private String apiKey = "";

    /** ElevenLabs voice id. */
    private String voiceId = "";

    @NotBlank(message = "Synthesizer model must not be blank")
    private String model = "eleven_turbo_v2_5";

    /** WebSocket base URL; the stream-input path is appended. */
    @NotBlank(message = "Synthesizer base URL must not be blank")
    private String baseUrl = "wss://api.elevenlabs.io";

    /** Request 8 kHz mu-law from the provider and emit it unconverted. */
    private boolean useMulaw = false;

    /** Target sample rate of emitted PCM audio. */
    @Positive(message = "Sampling rate must be positive")
    private int samplingRate = 16_000;

    /** Sample rate requested from the provider ({@code pcm_<rate>}). */
    @Positive(message = "Provider sample rate must be positive")
    private int providerSampleRate = 16_000;

    @Positive(message = "Inactivity timeout must be positive")
    private int inactivityTimeoutSeconds = 60;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double stability = 0.5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityBoost = 0.8;

    /** Serve repeated text from the in-memory synthesis cache. */
    private boolean caching = true;

    /** Maximum characters per text frame. Words are never split. */
    @Positive(message = "Max chunk chars must be positive")
    private int maxChunkChars = 250;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getVoiceId() {
        return voiceId;
    }

    public void setVoiceId(String voiceId) {
        this.voiceId = voiceId;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public boolean isUseMulaw() {
        return useMulaw;
    }

    public void setUseMulaw(boolean useMulaw) {
        this.useMulaw = useMulaw;
    }

    public int getSamplingRate() {
        return samplingRate;
    }

    public void setSamplingRate(int samplingRate) {
        this.samplingRate = samplingRate;
    }

    public int getProviderSampleRate() {
        return providerSampleRate;
    }

    public void setProviderSampleRate(int providerSampleRate) {
        this.providerSampleRate = providerSampleRate;
    }

    public int getInactivityTimeoutSeconds() {
        return inactivityTimeoutSeconds;
    }

    public void setInactivityTimeoutSeconds(int inactivityTimeoutSeconds) {
        this.inactivityTimeoutSeconds = inactivityTimeoutSeconds;
    }

    public double getStability() {
        return stability;
    }

    public void setStability(double stability) {
        this.stability = stability;
    }

    public double getSimilarityBoost() {
        return similarityBoost;
    }

    public void setSimilarityBoost(double similarityBoost) {
        this.similarityBoost = similarityBoost;
    }

    public boolean isCaching() {
        return caching;
    }

    public void setCaching(boolean caching) {
        this.caching = caching;
    }

    public int getMaxChunkChars() {
        return maxChunkChars;
    }

    public void setMaxChunkChars(int maxChunkChars) {
        this.maxChunkChars = maxChunkChars;
    }

    /**
     * Provider output format for the stream-input endpoint.
     *
     * @return {@code ulaw_8000} in mu-law mode, otherwise {@code pcm_<providerSampleRate>}
     */
    public String providerOutputFormat() {
        return useMulaw ? "ulaw_8000" : "pcm_" + providerSampleRate;
    }
}
