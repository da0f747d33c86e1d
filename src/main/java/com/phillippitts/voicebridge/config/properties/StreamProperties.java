package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Timing configuration shared by all streaming adapters.
 */
@ConfigurationProperties(prefix = "voice.stream")
@Validated
public class StreamProperties {

    /** Fixed interval between supervisor liveness checks, in milliseconds. */
    @Positive(message = "Supervisor interval must be positive")
    private long supervisorIntervalMs = 50;

    /** Delay between liveness polls while a send waits for a connection, in milliseconds. */
    @Positive(message = "Connection poll interval must be positive")
    private long connectionPollMs = 100;

    /** Maximum time the result loop blocks waiting for the next inbound event, in milliseconds. */
    @Positive(message = "Receive poll interval must be positive")
    private long receivePollMs = 200;

    /** Pause after a failed receive before the result loop retries, in milliseconds. */
    @Positive(message = "Receive retry delay must be positive")
    private long receiveRetryDelayMs = 1000;

    /** Upper bound for awaiting background task termination on stop, in milliseconds. */
    @Positive(message = "Shutdown timeout must be positive")
    private long shutdownTimeoutMs = 5000;

    public long getSupervisorIntervalMs() {
        return supervisorIntervalMs;
    }

    public void setSupervisorIntervalMs(long supervisorIntervalMs) {
        this.supervisorIntervalMs = supervisorIntervalMs;
    }

    public long getConnectionPollMs() {
        return connectionPollMs;
    }

    public void setConnectionPollMs(long connectionPollMs) {
        this.connectionPollMs = connectionPollMs;
    }

    public long getReceivePollMs() {
        return receivePollMs;
    }

    public void setReceivePollMs(long receivePollMs) {
        this.receivePollMs = receivePollMs;
    }

    public long getReceiveRetryDelayMs() {
        return receiveRetryDelayMs;
    }

    public void setReceiveRetryDelayMs(long receiveRetryDelayMs) {
        this.receiveRetryDelayMs = receiveRetryDelayMs;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }
}
