package io.validata.core.spi;

import java.util.Optional;

/**
 * Source of localized message templates.
 *
 * <p>
 * Templates use positional {@code %s} placeholders: the field label first, then up to two rule
 * parameters. Keys are either a bare rule name ({@code email}) or a compound
 * {@code category.subtype} ({@code min.string}).
 *
 * <p>
 * Implementations MUST be thread-safe; lookups happen concurrently from field tasks.
 */
public interface MessageStore {

    /**
     * Looks up a template.
     *
     * @param locale lower-case locale tag, e.g. {@code "en"}; unknown locales fall back to English
     * @param key    message key
     * @return the template, or empty when no template exists for the key
     */
    Optional<String> lookup(String locale, String key);
}
