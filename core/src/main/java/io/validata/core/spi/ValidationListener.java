package io.validata.core.spi;

/**
 * SPI for observability hooks around validation calls.
 *
 * <p>
 * Integrations bridge these events to metrics or tracing systems; the core has no telemetry
 * dependency. Implementations MUST be thread-safe and non-blocking: {@link #onFieldFaulted} is
 * called from pool threads. Exceptions thrown by listeners are caught and logged by the
 * validator and never change a validation result.
 */
public interface ValidationListener {

    /**
     * Called when a top-level validation call begins (not for nested records).
     *
     * @param event contains the record name and eligible field count
     */
    void onValidationStarted(ValidationStartedEvent event);

    /**
     * Called when a top-level validation call produced a report.
     *
     * @param event contains the record name, field count, violation count and duration
     */
    void onValidationCompleted(ValidationCompletedEvent event);

    /**
     * Called when evaluating one field failed internally (malformed bound, depth limit, etc.).
     *
     * @param event contains the record name, field label and fault detail
     */
    void onFieldFaulted(FieldFaultedEvent event);

    // --- Event records ---

    /** Event emitted when a validation call starts. */
    record ValidationStartedEvent(String recordName, int fieldCount) {}

    /** Event emitted when a validation call completes. */
    record ValidationCompletedEvent(String recordName, int fieldCount, int violationCount, long durationMs) {}

    /** Event emitted when a field's evaluation faults. */
    record FieldFaultedEvent(String recordName, String fieldLabel, String detail) {}
}
