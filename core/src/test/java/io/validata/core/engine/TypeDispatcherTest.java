package io.validata.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.validata.core.config.ValidatorConfig;
import io.validata.core.error.RuleEvaluationException;
import io.validata.core.error.UniquenessCheckException;
import io.validata.core.model.Field;
import io.validata.core.model.FieldOutcome;
import io.validata.core.model.Record;
import io.validata.core.model.UniqueTarget;
import io.validata.core.model.ValidationReport;
import io.validata.core.model.Value;
import io.validata.core.spec.RuleChainParser;
import io.validata.core.spi.UniquenessChecker;
import io.validata.core.testkit.TestFiles;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for rule routing by value kind: message keys per kind, unknown rules as no-ops, and the
 * container fallbacks (references, nested records, sequences).
 */
@DisplayName("TypeDispatcherTest")
class TypeDispatcherTest {

    private final TypeDispatcher dispatcher = new TypeDispatcher();

    private static EvaluationContext contextFor(Record record, String label, ValidatorConfig config) {
        Field field = record.findByLabel(label).orElseThrow();
        return new EvaluationContext(
                config,
                new MessageSynthesizer(config.messageStore()),
                record,
                field,
                0,
                (sub, depth) -> ValidationReport.empty());
    }

    private Optional<Violation> dispatch(Value value, String rule) {
        Record record = Record.builder().field("subject", value, rule).build();
        return dispatcher.dispatch(
                value, RuleChainParser.parseRule(rule), contextFor(record, "subject", ValidatorConfig.DEFAULT));
    }

    private static String key(Optional<Violation> violation) {
        return ((Violation.Failed) violation.orElseThrow()).messageKey();
    }

    // --- Message keys by kind ---

    @Nested
    @DisplayName("comparative message keys")
    class ComparativeKeys {

        @Test
        void textUsesStringSuffix() {
            assertThat(key(dispatch(Value.text("ab"), "min:3"))).isEqualTo("min.string");
            assertThat(key(dispatch(Value.text("abcd"), "max:3"))).isEqualTo("max.string");
            assertThat(key(dispatch(Value.text("ab"), "size:3"))).isEqualTo("size.string");
            assertThat(key(dispatch(Value.text("ab"), "between:3,5"))).isEqualTo("between.string");
        }

        @Test
        void numbersUseNumericSuffix() {
            assertThat(key(dispatch(Value.signed(2), "min:3"))).isEqualTo("min.numeric");
            assertThat(key(dispatch(Value.unsigned(9), "max:3"))).isEqualTo("max.numeric");
            assertThat(key(dispatch(Value.floating(0.5), "from:1,2"))).isEqualTo("from.numeric");
            assertThat(key(dispatch(Value.signed(4), "equal:3"))).isEqualTo("equal.numeric");
        }

        @Test
        @DisplayName("range violations carry both bounds")
        void rangeParams() {
            Violation.Failed failed = (Violation.Failed) dispatch(Value.signed(9), "between:1,5").orElseThrow();

            assertThat(failed.params()).containsExactly("1", "5");
        }

        @Test
        @DisplayName("a range with one bound is a rule fault")
        void rangeNeedsTwoBounds() {
            assertThatThrownBy(() -> dispatch(Value.signed(3), "between:5"))
                    .isInstanceOf(RuleEvaluationException.class)
                    .hasMessageContaining("two comma-separated bounds");
        }
    }

    @Test
    @DisplayName("rules unknown to a kind are no-ops")
    void unknownRulesIgnored() {
        assertThat(dispatch(Value.text("x"), "frobnicate")).isEmpty();
        assertThat(dispatch(Value.text("x"), "int")).isEmpty();
        assertThat(dispatch(Value.signed(5), "email")).isEmpty();
        assertThat(dispatch(Value.bool(true), "min:3")).isEmpty();
        assertThat(dispatch(Value.opaque(new Object()), "string")).isEmpty();
    }

    @Test
    @DisplayName("plain and parameterized tables are separate")
    void plainVersusParameterized() {
        assertThat(dispatcher.handles(Value.Kind.TEXT, RuleChainParser.parseRule("min:3"))).isTrue();
        assertThat(dispatcher.handles(Value.Kind.TEXT, RuleChainParser.parseRule("min"))).isFalse();
        assertThat(dispatcher.handles(Value.Kind.FILE, RuleChainParser.parseRule("image"))).isTrue();
        assertThat(dispatcher.handles(Value.Kind.FILE, RuleChainParser.parseRule("image:png"))).isTrue();
        assertThat(dispatcher.handles(Value.Kind.BOOL, RuleChainParser.parseRule("required"))).isFalse();
    }

    @Test
    @DisplayName("enum parameter is the raw argument and works on numbers")
    void enumOnNumbers() {
        Violation.Failed failed = (Violation.Failed) dispatch(Value.signed(3), "enum:1,2").orElseThrow();

        assertThat(failed.messageKey()).isEqualTo("enum");
        assertThat(failed.params()).containsExactly("1,2");
        assertThat(dispatch(Value.signed(2), "enum:1,2")).isEmpty();
    }

    // --- Cross-field ---

    @Nested
    @DisplayName("same and match")
    class CrossField {

        private Optional<Violation> run(String password, String confirm, String rule) {
            Record record = Record.builder()
                    .field("password", Value.text(password), "required")
                    .field("confirmPassword", Value.text(confirm), rule)
                    .build();
            return dispatcher.dispatch(
                    Value.text(confirm),
                    RuleChainParser.parseRule(rule),
                    contextFor(record, "confirmPassword", ValidatorConfig.DEFAULT));
        }

        @Test
        void sameCarriesOtherLabel() {
            Violation.Failed failed = (Violation.Failed) run("a", "b", "same:password").orElseThrow();

            assertThat(failed.messageKey()).isEqualTo("same");
            assertThat(failed.params()).containsExactly("password");
        }

        @Test
        void matchHasNoParameter() {
            Violation.Failed failed = (Violation.Failed) run("a", "b", "match:password").orElseThrow();

            assertThat(failed.messageKey()).isEqualTo("match");
            assertThat(failed.params()).isEmpty();
        }

        @Test
        void equalValuesPass() {
            assertThat(run("secret", "secret ", "same:password")).isEmpty();
        }

        @Test
        @DisplayName("a missing referenced field is a violation")
        void missingFieldViolates() {
            assertThat(run("a", "a", "same:nope")).isPresent();
        }
    }

    // --- Files ---

    @Nested
    @DisplayName("file rules")
    class FileRules {

        @Test
        void imageKeys() {
            assertThat(dispatch(Value.file(TestFiles.png("a.png")), "image")).isEmpty();
            assertThat(key(dispatch(Value.file(TestFiles.pdf("a.pdf")), "image"))).isEqualTo("image");
            assertThat(key(dispatch(Value.file(TestFiles.png("a.png")), "image:jpg"))).isEqualTo("image_type");
            assertThat(key(dispatch(Value.file(TestFiles.png("a.png")), "file:pdf"))).isEqualTo("file_type");
            assertThat(key(dispatch(Value.file(TestFiles.png("a.png")), "mimes:pdf,docx"))).isEqualTo("mimes");
        }

        @Test
        @DisplayName("file size violation carries the amount and unit key")
        void sizeKey() {
            Violation.Failed failed = (Violation.Failed)
                    dispatch(Value.file(TestFiles.pngOfSize("big.png", 2048)), "size:1kb").orElseThrow();

            assertThat(failed.messageKey()).isEqualTo("size.file_kb");
            assertThat(failed.params()).containsExactly("1");
        }

        @Test
        @DisplayName("malformed or tb sizes never reject")
        void inactiveSizes() {
            Value big = Value.file(TestFiles.pngOfSize("big.png", 4096));

            assertThat(dispatch(big, "size:1tb")).isEmpty();
            assertThat(dispatch(big, "size:01kb")).isEmpty();
        }

        @Test
        @DisplayName("an unset file reference passes every file rule")
        void unsetReference() {
            assertThat(dispatch(Value.file(null), "image")).isEmpty();
        }
    }

    // --- Uniqueness ---

    @Nested
    @DisplayName("unique")
    class Unique {

        private Optional<Violation> run(UniquenessChecker checker, String rule) {
            ValidatorConfig config = ValidatorConfig.builder().uniquenessChecker(checker).build();
            Record record = Record.builder().field("email", Value.text("a@b.com"), rule).build();
            return dispatcher.dispatch(
                    Value.text("a@b.com"), RuleChainParser.parseRule(rule), contextFor(record, "email", config));
        }

        @Test
        void takenValueViolates() {
            UniquenessChecker checker = mock(UniquenessChecker.class);
            when(checker.exists(any(), anyString())).thenReturn(true);

            assertThat(key(run(checker, "unique:users.email"))).isEqualTo("unique");
            verify(checker).exists(new UniqueTarget("users", "email"), "a@b.com");
        }

        @Test
        void freeValuePasses() {
            assertThat(run((target, value) -> false, "unique:users.email")).isEmpty();
        }

        @Test
        @DisplayName("an argument without a dot is a no-op")
        void noDotNoop() {
            UniquenessChecker checker = mock(UniquenessChecker.class);

            assertThat(run(checker, "unique:users")).isEmpty();
            verifyNoInteractions(checker);
        }

        @Test
        @DisplayName("no configured checker is a rule fault")
        void missingChecker() {
            assertThatThrownBy(() -> run(null, "unique:users.email"))
                    .isInstanceOf(RuleEvaluationException.class)
                    .hasMessageContaining("uniqueness checker");
        }

        @Test
        @DisplayName("store failures are tagged with the field label")
        void storeFailureTagged() {
            UniquenessChecker checker = (target, value) -> {
                throw new UniquenessCheckException("connection refused", null);
            };

            assertThatThrownBy(() -> run(checker, "unique:users.email"))
                    .isInstanceOf(UniquenessCheckException.class)
                    .satisfies(e -> assertThat(((UniquenessCheckException) e).fieldLabel()).isEqualTo("email"));
        }
    }

    // --- Containers ---

    @Test
    @DisplayName("sequence elements fail with 1-based labels, in order")
    void elementPass() {
        Value tags = Value.sequence(Value.text("ok"), Value.text("x"), Value.text("fine"), Value.text("y"));

        Violation.Elements elements = (Violation.Elements) dispatch(tags, "min:2").orElseThrow();

        assertThat(elements.entries())
                .containsExactly(
                        "The subject (2) field must be at least 2 characters",
                        "The subject (4) field must be at least 2 characters");
    }

    @Test
    @DisplayName("slice bounds check the element count before the element pass")
    void sliceThenElements() {
        Value tags = Value.sequence(Value.text("a"), Value.text("b"));

        Violation.Failed failed = (Violation.Failed) dispatch(tags, "slice:min:3").orElseThrow();
        assertThat(failed.messageKey()).isEqualTo("min.slice");
        assertThat(failed.params()).containsExactly("3");

        assertThat(key(dispatch(tags, "slice:max:1"))).isEqualTo("max.slice");
        assertThat(dispatch(tags, "slice:max:5")).isEmpty();
    }

    @Test
    @DisplayName("nested record reports surface as a nested violation")
    void nestedRecurse() {
        Record inner = Record.builder().field("city", Value.text(""), "required").build();
        Record outer = Record.builder().field("address", Value.record(inner), "required").build();
        ValidationReport innerReport = ValidationReport.of(
                List.of(FieldOutcome.violation("city", "required", "The city field is required")));
        EvaluationContext context = new EvaluationContext(
                ValidatorConfig.DEFAULT,
                new MessageSynthesizer(ValidatorConfig.DEFAULT.messageStore()),
                outer,
                outer.findByLabel("address").orElseThrow(),
                0,
                (sub, depth) -> {
                    assertThat(sub).isSameAs(inner);
                    assertThat(depth).isEqualTo(1);
                    return innerReport;
                });

        Optional<Violation> violation =
                dispatcher.dispatch(Value.record(inner), RuleChainParser.parseRule("required"), context);

        assertThat(violation).containsInstanceOf(Violation.Nested.class);
        assertThat(((Violation.Nested) violation.get()).report()).isEqualTo(innerReport);
    }
}
