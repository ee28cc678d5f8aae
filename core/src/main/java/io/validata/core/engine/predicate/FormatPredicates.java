package io.validata.core.engine.predicate;

import static java.time.temporal.ChronoField.DAY_OF_MONTH;
import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.MONTH_OF_YEAR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;
import static java.time.temporal.ChronoField.YEAR;

import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structured-text formats: e-mail addresses, phone numbers, identity card and digital address
 * numbers, dates and times.
 */
public final class FormatPredicates {

    private static final int EMAIL_MIN_LENGTH = 6;
    private static final int EMAIL_MAX_LENGTH = 254;
    private static final int LOCAL_PART_MAX_LENGTH = 64;
    private static final Set<String> BLOCKED_DOMAINS = Set.of("localhost", "localhost.com", "example.com");

    private static final Pattern PHONE = Pattern.compile("0\\d{9}");
    private static final Pattern PHONE_WITH_CODE = Pattern.compile("\\+("
            + "999|998|997|996|995|994|993|992|991|990|979|978|977|976|975|974|973|972|971|970|"
            + "969|968|967|966|965|964|963|962|961|960|899|898|897|896|895|894|893|892|891|890|"
            + "889|888|887|886|885|884|883|882|881|880|879|878|877|876|875|874|873|872|871|870|"
            + "859|858|857|856|855|854|853|852|851|850|839|838|837|836|835|834|833|832|831|830|"
            + "809|808|807|806|805|804|803|802|801|800|699|698|697|696|695|694|693|692|691|690|"
            + "689|688|687|686|685|684|683|682|681|680|679|678|677|676|675|674|673|672|671|670|"
            + "599|598|597|596|595|594|593|592|591|590|509|508|507|506|505|504|503|502|501|500|"
            + "429|428|427|426|425|424|423|422|421|420|389|388|387|386|385|384|383|382|381|380|"
            + "379|378|377|376|375|374|373|372|371|370|359|358|357|356|355|354|353|352|351|350|"
            + "299|298|297|296|295|294|293|292|291|290|289|288|287|286|285|284|283|282|281|280|"
            + "269|268|267|266|265|264|263|262|261|260|259|258|257|256|255|254|253|252|251|250|"
            + "249|248|247|246|245|244|243|242|241|240|239|238|237|236|235|234|233|232|231|230|"
            + "229|228|227|226|225|224|223|222|221|220|219|218|217|216|215|214|213|212|211|210|"
            + "98|95|94|93|92|91|90|86|84|82|81|66|65|64|63|62|61|60|58|57|56|55|54|53|52|51|"
            + "49|48|47|46|45|44|43|41|40|39|36|34|33|32|31|30|27|20|7|1"
            + ")[0-9]{1,14}");
    private static final Pattern GH_CARD = Pattern.compile("GHA-\\d{9}-\\d");
    private static final Pattern GH_GPS = Pattern.compile("[A-Z]{2}-\\d{1,4}-\\d{4}");

    private FormatPredicates() {}

    /** Date and time layouts accepted by the date rules. */
    public enum DateFormat {
        /** {@code 2006-01-02T15:04:05Z} or with a {@code ±hh:mm} offset. */
        RFC3339("rfc3339", new DateTimeFormatterBuilder()
                .append(date())
                .appendLiteral('T')
                .append(time(2))
                .appendOffset("+HH:MM", "Z")
                .toFormatter(Locale.ROOT)),
        /** {@code 2006-01-02 15:04:05}; the hour may be a single digit. */
        DATETIME("datetime", new DateTimeFormatterBuilder()
                .append(date())
                .appendLiteral(' ')
                .append(time(1))
                .toFormatter(Locale.ROOT)),
        DATEONLY("dateonly", date()),
        TIMEONLY("timeonly", time(1));

        private final String ruleName;
        private final DateTimeFormatter formatter;

        DateFormat(String ruleName, DateTimeFormatter formatter) {
            this.ruleName = ruleName;
            this.formatter = formatter.withResolverStyle(ResolverStyle.STRICT);
        }

        public String ruleName() {
            return ruleName;
        }

        /** Message key, e.g. {@code date.rfc3339}. */
        public String messageKey() {
            return "date." + ruleName;
        }

        private static DateTimeFormatter date() {
            return new DateTimeFormatterBuilder()
                    .appendValue(YEAR, 4)
                    .appendLiteral('-')
                    .appendValue(MONTH_OF_YEAR, 2)
                    .appendLiteral('-')
                    .appendValue(DAY_OF_MONTH, 2)
                    .toFormatter(Locale.ROOT);
        }

        private static DateTimeFormatter time(int minHourWidth) {
            return new DateTimeFormatterBuilder()
                    .appendValue(HOUR_OF_DAY, minHourWidth, 2, SignStyle.NOT_NEGATIVE)
                    .appendLiteral(':')
                    .appendValue(MINUTE_OF_HOUR, 2)
                    .appendLiteral(':')
                    .appendValue(SECOND_OF_MINUTE, 2)
                    .optionalStart()
                    .appendFraction(NANO_OF_SECOND, 1, 9, true)
                    .optionalEnd()
                    .toFormatter(Locale.ROOT);
        }
    }

    /**
     * Length-bounded mailbox check. Rejects reserved domains and over-long local parts before
     * parsing the address itself with {@link EmailAddresses}.
     */
    public static boolean isNotEmail(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < EMAIL_MIN_LENGTH || bytes.length > EMAIL_MAX_LENGTH) {
            return true;
        }
        int at = lastIndexOf(bytes, (byte) '@');
        if (at <= 0 || at > bytes.length - 3) {
            return true;
        }
        String domain = new String(bytes, at + 1, bytes.length - at - 1, StandardCharsets.UTF_8);
        if (BLOCKED_DOMAINS.contains(domain)) {
            return true;
        }
        if (at > LOCAL_PART_MAX_LENGTH) {
            return true;
        }
        return !EmailAddresses.isMailbox(value);
    }

    /** Local number: {@code 0} followed by nine digits. */
    public static boolean isNotPhone(String value) {
        return !PHONE.matcher(value).matches();
    }

    /** International number: {@code +}, a known calling code, then 1 to 14 digits. */
    public static boolean isNotPhoneWithCode(String value) {
        return !PHONE_WITH_CODE.matcher(value).matches();
    }

    /** An e-mail address if the value contains {@code @}, else an international or local number. */
    public static boolean isNotUsername(String value) {
        if (value.contains("@")) {
            return isNotEmail(value);
        }
        if (value.startsWith("+")) {
            return isNotPhoneWithCode(value);
        }
        return isNotPhone(value);
    }

    /** Ghana card number, {@code GHA-123456789-0}. */
    public static boolean isNotGhCard(String value) {
        return !GH_CARD.matcher(value).matches();
    }

    /** Ghana digital address, {@code GA-123-4567}. */
    public static boolean isNotGhGps(String value) {
        return !GH_GPS.matcher(value).matches();
    }

    public static boolean isNotDate(String value, DateFormat format) {
        try {
            format.formatter.parse(value);
            return false;
        } catch (DateTimeParseException e) {
            return true;
        }
    }

    private static int lastIndexOf(byte[] bytes, byte b) {
        for (int i = bytes.length - 1; i >= 0; i--) {
            if (bytes[i] == b) {
                return i;
            }
        }
        return -1;
    }
}
