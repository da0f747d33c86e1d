package com.phillippitts.voicebridge.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void voiceBridgeExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        VoiceBridgeException ex = new VoiceBridgeException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void streamConnectionExceptionShouldDefaultProvider() {
        StreamConnectionException ex = new StreamConnectionException("refused");

        assertThat(ex.getMessage()).isEqualTo("refused");
        assertThat(ex.getProviderName()).isEqualTo("unknown");
        assertThat(ex).isInstanceOf(VoiceBridgeException.class);
    }

    @Test
    void streamConnectionExceptionShouldIncludeProvider() {
        StreamConnectionException ex = new StreamConnectionException("refused", "elevenlabs");

        assertThat(ex.getMessage()).contains("refused").contains("elevenlabs");
        assertThat(ex.getProviderName()).isEqualTo("elevenlabs");
    }

    @Test
    void malformedEventExceptionShouldIncludeProviderAndCause() {
        IllegalArgumentException cause = new IllegalArgumentException("bad base64");
        MalformedEventException ex = new MalformedEventException("elevenlabs", "Cannot decode", cause);

        assertThat(ex.getMessage()).contains("Cannot decode").contains("elevenlabs");
        assertThat(ex.getProviderName()).isEqualTo("elevenlabs");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void builderShouldAppendDurationAndMetadata() {
        IOException cause = new IOException("reset");

        StreamConnectionException ex = StreamConnectionExceptionBuilder.create("Failed to connect")
                .provider("azure")
                .cause(cause)
                .durationMs(120)
                .metadata("region", "westeurope")
                .metadata("ignored", null)
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Failed to connect (durationMs=120, region=westeurope) (provider: azure)");
        assertThat(ex.getProviderName()).isEqualTo("azure");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void builderWithoutDetailsShouldKeepPlainMessage() {
        StreamConnectionException ex = StreamConnectionExceptionBuilder.create("closed").build();

        assertThat(ex.getMessage()).isEqualTo("closed (provider: unknown)");
        assertThat(ex.getCause()).isNull();
    }

    @Test
    void builderShouldRejectEmptyMessage() {
        assertThatThrownBy(() -> StreamConnectionExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
