package io.validata.core.engine;

import io.validata.core.model.RuleSpec;
import io.validata.core.model.Value;
import java.util.Optional;

/** One entry of the dispatch table: applies a rule to a value of a known kind. */
@FunctionalInterface
public interface RuleCheck {

    /**
     * @return the violation, or empty when the value satisfies the rule
     * @throws io.validata.core.error.RuleEvaluationException if the rule cannot be evaluated
     */
    Optional<Violation> check(Value value, RuleSpec rule, EvaluationContext context);
}
