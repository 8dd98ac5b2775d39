package io.rulesir.core.spi;

/**
 * Receiver for non-fatal compiler diagnostics, such as a duplicate definition.
 *
 * <p>
 * Install a custom sink on {@link io.rulesir.core.symbols.Symbols} before registration begins
 * to collect diagnostics instead of logging them. Reports never affect control flow:
 * exceptions thrown by a sink are caught by the caller and logged.
 */
public interface DiagnosticSink {

    /**
     * Reports an error. Compilation continues.
     *
     * @param message human-readable description, e.g. {@code "Duplicated schema definition: User."}
     */
    void reportError(String message);

    /**
     * Reports a warning.
     *
     * @param message human-readable description
     */
    void reportWarning(String message);
}
