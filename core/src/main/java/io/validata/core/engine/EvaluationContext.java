package io.validata.core.engine;

import io.validata.core.config.ValidatorConfig;
import io.validata.core.error.RuleEvaluationException;
import io.validata.core.model.Field;
import io.validata.core.model.Record;
import io.validata.core.model.RuleSpec;
import io.validata.core.model.ValidationReport;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State for evaluating one field: the enclosing record (for {@code same}/{@code match}), the
 * configuration, the nesting depth and the handle used to validate sub-records.
 *
 * <p>
 * Created per field task and confined to it, so the memo of sub-record reports needs no
 * synchronization. Repeated rules on the same field therefore validate each sub-record once.
 */
public final class EvaluationContext {

    /** Validates a sub-record at the given depth, inside the caller's pool. */
    @FunctionalInterface
    public interface SubRecordValidator {
        ValidationReport validate(Record record, int depth);
    }

    private final ValidatorConfig config;
    private final MessageSynthesizer synthesizer;
    private final Record record;
    private final Field field;
    private final String displayLabel;
    private final int depth;
    private final SubRecordValidator subRecords;
    private final Map<Record, ValidationReport> memo = new IdentityHashMap<>();

    public EvaluationContext(
            ValidatorConfig config,
            MessageSynthesizer synthesizer,
            Record record,
            Field field,
            int depth,
            SubRecordValidator subRecords) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
        this.record = Objects.requireNonNull(record, "record must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.depth = depth;
        this.subRecords = Objects.requireNonNull(subRecords, "subRecords must not be null");
        this.displayLabel = FieldLabels.humanize(field.label());
    }

    public ValidatorConfig config() {
        return config;
    }

    public String locale() {
        return config.locale();
    }

    /** Wire-label of the field under evaluation. */
    public String fieldLabel() {
        return field.label();
    }

    /** Humanized label used in messages. */
    public String displayLabel() {
        return displayLabel;
    }

    public int depth() {
        return depth;
    }

    /** Looks up a sibling by wire-label, eligible or not. */
    public Optional<Field> findField(String label) {
        return record.findByLabel(label);
    }

    /**
     * Validates {@code sub} one level deeper, once per sub-record per field.
     *
     * @throws RuleEvaluationException if the nesting depth limit would be exceeded
     */
    public ValidationReport validateNested(Record sub) {
        if (depth + 1 > config.maxDepth()) {
            throw new RuleEvaluationException(
                    "maximum nesting depth " + config.maxDepth() + " exceeded at field '" + field.label() + "'", null);
        }
        ValidationReport cached = memo.get(sub);
        if (cached != null) {
            return cached;
        }
        ValidationReport report = subRecords.validate(sub, depth + 1);
        memo.put(sub, report);
        return report;
    }

    /** Renders a plain violation for {@code label}, honouring the rule's override message. */
    public String render(Violation.Failed violation, String label, RuleSpec rule) {
        return synthesizer.render(locale(), violation.messageKey(), label, violation.params(), rule);
    }

    /** Renders the template for {@code key} for this field, honouring the rule's override message. */
    public String render(String key, List<String> params, RuleSpec rule) {
        return synthesizer.render(locale(), key, displayLabel, params, rule);
    }
}
