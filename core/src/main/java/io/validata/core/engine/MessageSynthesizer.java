package io.validata.core.engine;

import io.validata.core.model.RuleSpec;
import io.validata.core.spi.MessageStore;
import java.util.ArrayList;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a rule violation into the message shown to the caller.
 *
 * <p>
 * An override message on the rule wins and is used verbatim. Otherwise the template for the key is
 * looked up and formatted with the field label followed by at most two parameters. A key with no
 * template renders as the key itself. Thread-safe.
 */
public final class MessageSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(MessageSynthesizer.class);
    private static final int MAX_PARAMS = 2;
    static final String FAULT_PREFIX = "validation fault: ";

    private final MessageStore store;

    public MessageSynthesizer(MessageStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * @param rule the violated rule; its override message, if any, is returned unchanged
     */
    public String render(String locale, String key, String label, List<String> params, RuleSpec rule) {
        if (rule != null && rule.hasMessage()) {
            return rule.message();
        }
        return format(locale, key, label, params);
    }

    /** Renders the template for {@code key}, ignoring any override. */
    public String format(String locale, String key, String label, List<String> params) {
        String template = store.lookup(locale, key).orElse(null);
        if (template == null) {
            return key;
        }
        List<Object> args = new ArrayList<>(MAX_PARAMS + 1);
        args.add(label);
        for (int i = 0; i < params.size() && i < MAX_PARAMS; i++) {
            args.add(params.get(i));
        }
        try {
            return String.format(Locale.ROOT, template, args.toArray());
        } catch (IllegalFormatException e) {
            LOG.debug("message.unformattable locale={} key={} cause={}", locale, key, e.getMessage());
            return template;
        }
    }

    /** Report text for a field whose evaluation failed internally. */
    public static String fault(String detail) {
        return FAULT_PREFIX + detail;
    }
}
