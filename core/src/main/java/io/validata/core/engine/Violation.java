package io.validata.core.engine;

import io.validata.core.model.ValidationReport;
import java.util.List;
import java.util.Objects;

/**
 * What a failed rule reports back to the field evaluator: a message key with parameters, a
 * nested record's report, or the failing elements of a sequence.
 */
public sealed interface Violation {

    static Violation of(String messageKey, String... params) {
        return new Failed(messageKey, List.of(params));
    }

    /**
     * A plain rule violation, rendered later through the message store.
     *
     * @param messageKey e.g. {@code min.string}
     * @param params     up to two template parameters following the field label
     */
    record Failed(String messageKey, List<String> params) implements Violation {
        public Failed {
            Objects.requireNonNull(messageKey, "messageKey must not be null");
            params = List.copyOf(params);
        }
    }

    /** A sub-record produced a non-empty report. Override messages never replace it. */
    record Nested(ValidationReport report) implements Violation {
        public Nested {
            Objects.requireNonNull(report, "report must not be null");
        }
    }

    /** Rendered element messages and element reports, in element order. */
    record Elements(List<Object> entries) implements Violation {
        public Elements {
            entries = List.copyOf(entries);
        }
    }
}
