package io.validata.core.binding;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a field's rule chain, e.g. {@code @Rules("required|email")}. Only fields that also
 * carry a wire-label ({@code @JsonProperty}) are validated.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Rules {

    /** The rule chain: {@code rule ("|" rule)*} with {@code rule := name[":" args][">" message]}. */
    String value();
}
