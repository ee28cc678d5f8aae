package io.validata.core.config;

import io.validata.core.engine.locale.YamlMessageStore;
import io.validata.core.engine.mime.MagicNumberSniffer;
import io.validata.core.spi.ContentSniffer;
import io.validata.core.spi.MessageStore;
import io.validata.core.spi.UniquenessChecker;
import io.validata.core.spi.ValidationListener;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable configuration for a {@link io.validata.core.engine.RecordValidator}.
 *
 * <p>
 * Nested records are validated with the same configuration as their parent.
 *
 * @param locale            lower-case message locale, e.g. {@code "en"}
 * @param parallelism       worker threads in the validator's pool
 * @param maxDepth          maximum nesting depth of sub-records; deeper fields fault
 * @param messageStore      message templates
 * @param contentSniffer    file type detection for {@code image}, {@code file} and {@code mimes}
 * @param uniquenessChecker backing store for {@code unique}; {@code null} when not configured
 * @param listener          lifecycle hooks; {@code null} when not configured
 */
public record ValidatorConfig(
        String locale,
        int parallelism,
        int maxDepth,
        MessageStore messageStore,
        ContentSniffer contentSniffer,
        UniquenessChecker uniquenessChecker,
        ValidationListener listener) {

    public static final String DEFAULT_LOCALE = "en";
    public static final int DEFAULT_MAX_DEPTH = 32;

    /** English, one worker per processor, depth 32, bundled messages, magic-number sniffing. */
    public static final ValidatorConfig DEFAULT = builder().build();

    public ValidatorConfig {
        Objects.requireNonNull(locale, "locale must not be null");
        Objects.requireNonNull(messageStore, "messageStore must not be null");
        Objects.requireNonNull(contentSniffer, "contentSniffer must not be null");
        locale = locale.trim().toLowerCase(Locale.ROOT);
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got: " + maxDepth);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder pre-populated with this configuration. */
    public Builder toBuilder() {
        return new Builder()
                .locale(locale)
                .parallelism(parallelism)
                .maxDepth(maxDepth)
                .messageStore(messageStore)
                .contentSniffer(contentSniffer)
                .uniquenessChecker(uniquenessChecker)
                .listener(listener);
    }

    /** Builder for {@link ValidatorConfig}. Not thread-safe. */
    public static final class Builder {

        private String locale = DEFAULT_LOCALE;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private MessageStore messageStore;
        private ContentSniffer contentSniffer;
        private UniquenessChecker uniquenessChecker;
        private ValidationListener listener;

        private Builder() {}

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder messageStore(MessageStore messageStore) {
            this.messageStore = messageStore;
            return this;
        }

        public Builder contentSniffer(ContentSniffer contentSniffer) {
            this.contentSniffer = contentSniffer;
            return this;
        }

        public Builder uniquenessChecker(UniquenessChecker uniquenessChecker) {
            this.uniquenessChecker = uniquenessChecker;
            return this;
        }

        public Builder listener(ValidationListener listener) {
            this.listener = listener;
            return this;
        }

        public ValidatorConfig build() {
            return new ValidatorConfig(
                    locale,
                    parallelism,
                    maxDepth,
                    messageStore != null ? messageStore : YamlMessageStore.bundled(),
                    contentSniffer != null ? contentSniffer : new MagicNumberSniffer(),
                    uniquenessChecker,
                    listener);
        }
    }
}
