package io.rtfde.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.rtfde.core.logging.DiagnosticChannel;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DiagnosticsConfigTest {

    @Test
    void missingChannelsDefaultToInfo() {
        DiagnosticsConfig config = new DiagnosticsConfig(LogFormat.TEXT,
                Map.of(DiagnosticChannel.VALIDATION, ChannelLevel.DEBUG));

        assertThat(config.channelLevels()).hasSize(DiagnosticChannel.values().length);
        assertThat(config.levelOf(DiagnosticChannel.GENERAL)).isEqualTo(ChannelLevel.INFO);
        assertThat(config.levelOf(DiagnosticChannel.VALIDATION)).isEqualTo(ChannelLevel.DEBUG);
    }

    @Test
    void isDetachedFromTheCallersMap() {
        Map<DiagnosticChannel, ChannelLevel> levels = new HashMap<>();
        DiagnosticsConfig config = new DiagnosticsConfig(LogFormat.TEXT, levels);

        levels.put(DiagnosticChannel.GENERAL, ChannelLevel.DEBUG);

        assertThat(config.levelOf(DiagnosticChannel.GENERAL)).isEqualTo(ChannelLevel.INFO);
        assertThat(config.channelLevels()).isUnmodifiable();
    }

    @Test
    void withChannelLevelReturnsAdjustedCopy() {
        DiagnosticsConfig base = DiagnosticsConfig.defaults();

        DiagnosticsConfig adjusted = base.withChannelLevel(DiagnosticChannel.TRANSFORMATION, ChannelLevel.DEBUG);

        assertThat(base.levelOf(DiagnosticChannel.TRANSFORMATION)).isEqualTo(ChannelLevel.INFO);
        assertThat(adjusted.levelOf(DiagnosticChannel.TRANSFORMATION)).isEqualTo(ChannelLevel.DEBUG);
    }

    @Test
    void onlyTraceAndDebugPermitDebugOutput() {
        assertThat(ChannelLevel.TRACE.permitsDebug()).isTrue();
        assertThat(ChannelLevel.DEBUG.permitsDebug()).isTrue();
        assertThat(ChannelLevel.INFO.permitsDebug()).isFalse();
        assertThat(ChannelLevel.OFF.permitsDebug()).isFalse();
    }

    @Test
    void parsesLevelsAndFormatsCaseInsensitively() {
        assertThat(ChannelLevel.from("Debug")).isEqualTo(ChannelLevel.DEBUG);
        assertThat(LogFormat.from(" json ")).isEqualTo(LogFormat.JSON);
        assertThat(catchThrowable(() -> LogFormat.from("yaml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("yaml");
    }
}
