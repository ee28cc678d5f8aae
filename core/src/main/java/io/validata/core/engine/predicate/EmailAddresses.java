package io.validata.core.engine.predicate;

/**
 * Recognizes a single RFC 5322 mailbox: either a bare {@code addr-spec} or
 * {@code display-name <addr-spec>}.
 *
 * <pre>
 * addr-spec  := local-part "@" domain
 * local-part := dot-atom | quoted-string
 * domain     := dot-atom | "[" dtext* "]"
 * </pre>
 *
 * <p>
 * Non-ASCII characters are accepted as {@code atext}. Comments are not supported. Surrounding
 * whitespace is ignored.
 */
final class EmailAddresses {

    private static final String ATEXT_SPECIALS = "!#$%&'*+-/=?^_`{|}~";

    private final String input;
    private int pos;

    private EmailAddresses(String input) {
        this.input = input;
    }

    /** {@code true} when the whole value is exactly one mailbox. */
    static boolean isMailbox(String value) {
        String trimmed = value.strip();
        if (trimmed.isEmpty()) {
            return false;
        }
        // A bare address is tried first; a display name is only considered when that fails.
        EmailAddresses bare = new EmailAddresses(trimmed);
        if (bare.addrSpec() && bare.atEnd()) {
            return true;
        }
        EmailAddresses named = new EmailAddresses(trimmed);
        return named.nameAddr() && named.atEnd();
    }

    // --- Grammar ---

    private boolean nameAddr() {
        if (peek() != '<') {
            if (!phrase()) {
                return false;
            }
            skipWhitespace();
        }
        if (!consume('<')) {
            return false;
        }
        if (!addrSpec()) {
            return false;
        }
        return consume('>');
    }

    private boolean addrSpec() {
        boolean local = peek() == '"' ? quotedString() : dotAtom();
        if (!local || !consume('@')) {
            return false;
        }
        return peek() == '[' ? domainLiteral() : dotAtom();
    }

    private boolean dotAtom() {
        if (!atom()) {
            return false;
        }
        while (peek() == '.') {
            pos++;
            if (!atom()) {
                return false;
            }
        }
        return true;
    }

    private boolean atom() {
        int start = pos;
        while (!atEnd() && isAtext(input.charAt(pos))) {
            pos++;
        }
        return pos > start;
    }

    private boolean quotedString() {
        if (!consume('"')) {
            return false;
        }
        while (!atEnd()) {
            char c = input.charAt(pos++);
            if (c == '"') {
                return true;
            }
            if (c == '\\') {
                if (atEnd()) {
                    return false;
                }
                pos++;
            } else if (c < 0x20 && c != '\t' || c == 0x7F) {
                return false;
            }
        }
        return false;
    }

    private boolean domainLiteral() {
        if (!consume('[')) {
            return false;
        }
        while (!atEnd()) {
            char c = input.charAt(pos++);
            if (c == ']') {
                return true;
            }
            if (c == '[' || c == '\\' || c < 0x21 || c == 0x7F) {
                return false;
            }
        }
        return false;
    }

    /** One or more words (atoms, quoted strings, or obsolete dots) separated by whitespace. */
    private boolean phrase() {
        int words = 0;
        while (!atEnd()) {
            skipWhitespace();
            char c = peek();
            if (c == '"') {
                if (!quotedString()) {
                    return false;
                }
            } else if (c == '.') {
                pos++;
            } else if (!atom()) {
                break;
            }
            words++;
        }
        return words > 0;
    }

    // --- Scanning ---

    private static boolean isAtext(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || ATEXT_SPECIALS.indexOf(c) >= 0
                || c > 0x7F;
    }

    private void skipWhitespace() {
        while (!atEnd() && (input.charAt(pos) == ' ' || input.charAt(pos) == '\t')) {
            pos++;
        }
    }

    private boolean consume(char expected) {
        if (peek() == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private char peek() {
        return atEnd() ? '\0' : input.charAt(pos);
    }

    private boolean atEnd() {
        return pos >= input.length();
    }
}
