package io.validata.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.validata.core.config.ValidatorConfig;
import io.validata.core.error.RuleEvaluationException;
import io.validata.core.model.Field;
import io.validata.core.model.FieldOutcome;
import io.validata.core.model.Record;
import io.validata.core.model.ValidationReport;
import io.validata.core.model.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for chain ordering, the required short-circuit and outcome rendering. */
@DisplayName("FieldEvaluatorTest")
class FieldEvaluatorTest {

    private final FieldEvaluator evaluator = new FieldEvaluator(new TypeDispatcher());

    private FieldOutcome evaluate(String label, Value value, String rules) {
        Record record = Record.builder().field(label, value, rules).build();
        Field field = record.findByLabel(label).orElseThrow();
        EvaluationContext context = new EvaluationContext(
                ValidatorConfig.DEFAULT,
                new MessageSynthesizer(ValidatorConfig.DEFAULT.messageStore()),
                record,
                field,
                0,
                (sub, depth) -> ValidationReport.empty());
        return evaluator.evaluate(field, context);
    }

    @Test
    @DisplayName("first violation wins")
    void firstViolationWins() {
        FieldOutcome outcome = evaluate("name", Value.text("a!"), "string|min:3");

        assertThat(outcome.type()).isEqualTo(FieldOutcome.Type.VIOLATION);
        assertThat(outcome.messageKey()).isEqualTo("string");
    }

    @Test
    void passingChain() {
        assertThat(evaluate("name", Value.text("Kofi"), "required|string|from:1,5").isPassed())
                .isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"required|email", "email|required", "email|min:3|required"})
    @DisplayName("required is honoured anywhere in the chain")
    void requiredAnywhere(String rules) {
        FieldOutcome outcome = evaluate("email", Value.text(""), rules);

        assertThat(outcome.messageKey()).isEqualTo(FieldEvaluator.REQUIRED_KEY);
        assertThat(outcome.message()).isEqualTo("The email field is required");
    }

    @Test
    @DisplayName("an empty optional field skips every rule")
    void emptyOptionalPasses() {
        assertThat(evaluate("email", Value.text(""), "email|min:5").isPassed()).isTrue();
    }

    @Test
    @DisplayName("an empty boolean fails with the bool message")
    void boolRequired() {
        FieldOutcome outcome = evaluate("terms", Value.bool(false), "required");

        assertThat(outcome.messageKey()).isEqualTo(FieldEvaluator.BOOL_KEY);
        assertThat(outcome.message()).isEqualTo("The terms field must be true");
    }

    @Test
    @DisplayName("messages use the humanized label, the outcome keeps the wire-label")
    void humanizedMessageWireKey() {
        FieldOutcome outcome = evaluate("firstName", Value.text("x"), "min:2");

        assertThat(outcome.label()).isEqualTo("firstName");
        assertThat(outcome.message()).isEqualTo("The first name field must be at least 2 characters");
    }

    @Test
    void overrideMessage() {
        FieldOutcome outcome = evaluate("age", Value.signed(12), "min:18>You must be an adult");

        assertThat(outcome.message()).isEqualTo("You must be an adult");
        assertThat(outcome.messageKey()).isEqualTo("min.numeric");
    }

    @Test
    @DisplayName("empty tokens in the chain are no-ops")
    void emptyTokens() {
        assertThat(evaluate("name", Value.text("abc"), "||min:2|").isPassed()).isTrue();
    }

    @Test
    @DisplayName("a malformed bound propagates for the caller to isolate")
    void faultsPropagate() {
        assertThatThrownBy(() -> evaluate("age", Value.signed(3), "min:abc"))
                .isInstanceOf(RuleEvaluationException.class);
    }
}
