package io.rtfde.core.logging;

import io.rtfde.core.config.DiagnosticsConfig;
import io.rtfde.core.diff.DiffEngine;
import io.rtfde.core.grammar.GrammarReport;
import io.rtfde.core.grammar.ParserGrammar;
import io.rtfde.core.tree.Tree;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes diagnostic payloads to their channel loggers when the channel's configured level permits debug output.
 * Payloads for disabled channels are never rendered. Constructing a gate applies its channel levels to logback,
 * so the injected config decides both whether a payload is rendered and whether it is emitted.
 */
public class DiagnosticGate {

    private final DiagnosticsConfig config;
    private final DiffEngine diffEngine;
    private final Map<DiagnosticChannel, Logger> loggers = new EnumMap<>(DiagnosticChannel.class);

    public DiagnosticGate(DiagnosticsConfig config) {
        this(config, new DiffEngine());
    }

    public DiagnosticGate(DiagnosticsConfig config, DiffEngine diffEngine) {
        this.config = Objects.requireNonNull(config, "config");
        this.diffEngine = Objects.requireNonNull(diffEngine, "diffEngine");
        LoggingConfigurator.applyChannelLevels(config);
        for (DiagnosticChannel channel : DiagnosticChannel.values()) {
            loggers.put(channel, LoggerFactory.getLogger(channel.loggerName()));
        }
    }

    public boolean isEnabled(DiagnosticChannel channel) {
        return config.levelOf(channel).permitsDebug();
    }

    public void logIfEnabled(DiagnosticChannel channel, DiagnosticPayload payload) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(payload, "payload");
        Logger logger = loggers.get(channel);
        if (!isEnabled(channel) || !logger.isDebugEnabled()) {
            return;
        }
        logger.debug(payload.render());
    }

    public void logValidation(Supplier<?> data) {
        logIfEnabled(DiagnosticChannel.VALIDATION, new TextPayload(data));
    }

    public void logTransformation(Supplier<?> data) {
        logIfEnabled(DiagnosticChannel.TRANSFORMATION, new TextPayload(data));
    }

    /**
     * Records a token dropped by HTMLRTF stripping. The payload shape is checked even when the channel is
     * disabled.
     *
     * @throws MalformedDiagnosticPayloadException if {@code candidate} is not a token
     */
    public void logStrippedToken(Object candidate) {
        logIfEnabled(DiagnosticChannel.HTMLRTF_STRIPPING, TokenPayload.from(candidate));
    }

    public void logStringDiff(String original, String revised) {
        logStringDiff(original, revised, null);
    }

    public void logStringDiff(String original, String revised, String separator) {
        logIfEnabled(DiagnosticChannel.GENERAL,
                new DiffPayload(() -> diffEngine.stringDiff(original, revised, separator)));
    }

    public void logTreeDiff(Tree original, Tree revised) {
        logIfEnabled(DiagnosticChannel.GENERAL, new DiffPayload(() -> diffEngine.treeDiff(original, revised)));
    }

    public void logGrammar(ParserGrammar grammar) {
        logIfEnabled(DiagnosticChannel.GENERAL, new TextPayload(() -> GrammarReport.describe(grammar)));
    }
}
