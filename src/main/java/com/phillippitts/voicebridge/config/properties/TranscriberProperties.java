package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the Azure streaming transcriber.
 *
 * <p>The telephony provider decides the input audio format
 * (see {@link com.phillippitts.voicebridge.service.stt.TranscriberAudioFormat}).
 */
@ConfigurationProperties(prefix = "voice.transcriber")
@Validated
public class TranscriberProperties {

    /** Enable the transcriber bean. */
    private boolean enabled = false;

    private String subscriptionKey = "";

    private String region = "";

    @NotBlank(message = "Recognition language must not be blank")
    private String language = "en-IN";

    /** twilio, exotel, plivo or web_based_call. */
    @NotBlank(message = "Telephony provider must not be blank")
    private String telephonyProvider = "twilio";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSubscriptionKey() {
        return subscriptionKey;
    }

    public void setSubscriptionKey(String subscriptionKey) {
        this.subscriptionKey = subscriptionKey;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getTelephonyProvider() {
        return telephonyProvider;
    }

    public void setTelephonyProvider(String telephonyProvider) {
        this.telephonyProvider = telephonyProvider;
    }
}
