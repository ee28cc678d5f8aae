package io.validata.core.engine;

import io.validata.core.model.Field;
import io.validata.core.model.FieldOutcome;
import io.validata.core.model.RuleSpec;
import io.validata.core.model.Value;
import io.validata.core.spec.RuleChainParser;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one field's rule chain left to right and stops at the first violation.
 *
 * <p>
 * {@code required} may appear anywhere in the chain. While the value is empty every other rule
 * is skipped, so an empty optional field passes and an empty required field fails on
 * {@code required} (the {@code bool} message for booleans). A non-empty value is handed to the
 * {@link TypeDispatcher} for every rule, {@code required} included, so nested records are
 * validated even when their only rule is {@code required}.
 *
 * <p>
 * Stateless and thread-safe; internal faults propagate to the caller.
 */
public final class FieldEvaluator {

    static final String REQUIRED_KEY = "required";
    static final String BOOL_KEY = "bool";

    private final TypeDispatcher dispatcher;

    public FieldEvaluator(TypeDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    public FieldOutcome evaluate(Field field, EvaluationContext context) {
        List<RuleSpec> rules = RuleChainParser.parse(field.rules());
        Value value = field.value();
        boolean empty = value.isEmpty();

        for (RuleSpec rule : rules) {
            if (rule.isRequired() && empty) {
                String key = value.kind() == Value.Kind.BOOL ? BOOL_KEY : REQUIRED_KEY;
                return FieldOutcome.violation(field.label(), key, context.render(key, List.of(), rule));
            }
            if (empty) {
                continue;
            }
            Optional<Violation> violation = dispatcher.dispatch(value, rule, context);
            if (violation.isPresent()) {
                return toOutcome(field, violation.get(), rule, context);
            }
        }
        return FieldOutcome.passed(field.label());
    }

    private static FieldOutcome toOutcome(Field field, Violation violation, RuleSpec rule, EvaluationContext context) {
        if (violation instanceof Violation.Nested nested) {
            return FieldOutcome.nested(field.label(), nested.report());
        }
        if (violation instanceof Violation.Elements elements) {
            return FieldOutcome.elements(field.label(), elements.entries());
        }
        Violation.Failed failed = (Violation.Failed) violation;
        return FieldOutcome.violation(
                field.label(), failed.messageKey(), context.render(failed, context.displayLabel(), rule));
    }
}
