package io.validata.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One parsed rule of a chain: {@code name[:argument][>message]}.
 *
 * @param name       rule name, e.g. {@code "min"}; may be empty for an empty token
 * @param argument   raw text after the first {@code ':'}, or {@code null} when absent
 * @param parameters {@code argument} split on {@code ','}; empty when there is no argument
 * @param message    override message after the first {@code '>'}, or {@code null}
 */
public record RuleSpec(String name, String argument, List<String> parameters, String message) {

    public static final String REQUIRED = "required";

    public RuleSpec {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public boolean isRequired() {
        return REQUIRED.equals(name) && argument == null;
    }

    public boolean hasArgument() {
        return argument != null;
    }

    public boolean hasMessage() {
        return message != null && !message.isEmpty();
    }

    /** The rule token without its override message, as written. */
    public String token() {
        return argument == null ? name : name + ":" + argument;
    }
}
