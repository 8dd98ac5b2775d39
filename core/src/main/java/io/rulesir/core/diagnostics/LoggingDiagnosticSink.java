package io.rulesir.core.diagnostics;

import io.rulesir.core.spi.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link DiagnosticSink}: writes errors and warnings to the {@value #LOGGER_NAME}
 * logger, at ERROR and WARN level respectively.
 */
public final class LoggingDiagnosticSink implements DiagnosticSink {

    /** Name of the logger diagnostics are written to. */
    public static final String LOGGER_NAME = "rules-ir.diagnostics";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void reportError(String message) {
        LOG.error(message);
    }

    @Override
    public void reportWarning(String message) {
        LOG.warn(message);
    }
}
