package io.validata.core.error;

/** Thrown when a locale message bundle cannot be read or is not a mapping of templates. */
public final class MessageStoreException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public MessageStoreException(String message, String source) {
        super(message, null, Phase.CONFIGURATION);
        this.source = source;
    }

    public MessageStoreException(String message, Throwable cause, String source) {
        super(message, cause, null, Phase.CONFIGURATION);
        this.source = source;
    }

    /** The bundle path or classpath resource that caused the error. */
    public String source() {
        return source;
    }
}
