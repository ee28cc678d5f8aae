package io.validata.core.model;

import java.math.BigInteger;

/**
 * Parsed {@code size:<amount><unit>} file limit.
 *
 * @param amount    the amount as written (e.g. {@code "2"})
 * @param unit      lower-cased unit: {@code kb}, {@code mb}, {@code gb} or {@code tb}
 * @param byteLimit limit in bytes; zero for {@code tb}, which disables the check
 */
public record SizeLimit(String amount, String unit, BigInteger byteLimit) {

    /** Message key for a violation of this limit, e.g. {@code size.file_mb}. */
    public String messageKey() {
        return "size.file_" + unit;
    }

    /** {@code true} when a file of {@code size} bytes exceeds an active limit. */
    public boolean isExceededBy(long size) {
        return byteLimit.signum() > 0 && BigInteger.valueOf(size).compareTo(byteLimit) > 0;
    }
}
