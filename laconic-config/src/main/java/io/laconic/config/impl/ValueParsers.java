/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.regex.Pattern;

import io.laconic.config.ConfigException;

/**
 * Text to typed value conversions behind the node accessors. Every failure is
 * a {@link ConfigException.BadValue} naming the node path.
 *
 * <p>
 * This is public just for the "config" package to use, don't touch it
 */
public final class ValueParsers {
    private ValueParsers() {
    }

    private static final Pattern DECIMAL = Pattern
            .compile("[+-]?(?:\\d(?:_?\\d)*(?:\\.(?:\\d(?:_?\\d)*)?)?|\\.\\d(?:_?\\d)*)(?:[eE][+-]?\\d(?:_?\\d)*)?");
    private static final Pattern SPECIAL_DOUBLE = Pattern.compile("[+-]?(?:inf|infinity|nan)");
    // date, then optionally a time, then optionally an offset
    private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE).optionalStart().appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME).optionalStart().appendOffsetId()
            .optionalEnd().optionalEnd().toFormatter();

    public static int parseInt(String path, String text) {
        BigInteger v = parseIntegral(text);
        if (v == null || v.bitLength() > 31)
            throw new ConfigException.BadValue(path, "invalid int value '" + text + "'");
        return v.intValue();
    }

    public static long parseLong(String path, String text) {
        BigInteger v = parseIntegral(text);
        if (v == null || v.bitLength() > 63)
            throw new ConfigException.BadValue(path, "invalid int value '" + text + "'");
        return v.longValue();
    }

    /**
     * Integer literal: optional sign, then decimal digits or a
     * <code>0x</code>, <code>0o</code> or <code>0b</code> prefixed number.
     * Single underscores may separate digits. A decimal number other than
     * zero can't start with 0.
     *
     * @return the number, or null if the text is not an integer literal
     */
    static BigInteger parseIntegral(String text) {
        String s = ConfigImplUtil.unicodeTrim(text);
        boolean negative = false;
        if (s.startsWith("+") || s.startsWith("-")) {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }

        int radix = 10;
        if (s.length() > 1 && s.charAt(0) == '0') {
            char p = Character.toLowerCase(s.charAt(1));
            if (p == 'x')
                radix = 16;
            else if (p == 'o')
                radix = 8;
            else if (p == 'b')
                radix = 2;
            if (radix != 10) {
                s = s.substring(2);
                // a single separator may follow the prefix
                if (s.startsWith("_"))
                    s = s.substring(1);
            }
        }

        if (s.isEmpty() || s.startsWith("_") || s.endsWith("_") || s.contains("__"))
            return null;
        String digits = s.replace("_", "");
        for (int i = 0; i < digits.length(); ++i) {
            if (Character.digit(digits.charAt(i), radix) < 0)
                return null;
        }
        if (radix == 10 && digits.length() > 1 && digits.charAt(0) == '0') {
            for (int i = 0; i < digits.length(); ++i) {
                if (digits.charAt(i) != '0')
                    return null;
            }
        }

        BigInteger v = new BigInteger(digits, radix);
        return negative ? v.negate() : v;
    }

    public static double parseDouble(String path, String text) {
        String s = ConfigImplUtil.unicodeTrim(text);
        String lower = s.toLowerCase(Locale.ROOT);
        if (SPECIAL_DOUBLE.matcher(lower).matches()) {
            boolean negative = lower.startsWith("-");
            if (lower.endsWith("nan"))
                return Double.NaN;
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (!DECIMAL.matcher(s).matches())
            throw new ConfigException.BadValue(path, "invalid float value '" + text + "'");
        try {
            return Double.parseDouble(s.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new ConfigException.BadValue(path, "invalid float value '" + text + "'", e);
        }
    }

    public static boolean parseBoolean(String path, String text) {
        String s = ConfigImplUtil.unicodeTrim(text).toLowerCase(Locale.ROOT);
        if (s.equals("true") || s.equals("t") || s.equals("yes") || s.equals("y")
                || s.equals("1") || s.equals("on"))
            return true;
        if (s.equals("false") || s.equals("f") || s.equals("no") || s.equals("n")
                || s.equals("0") || s.equals("off"))
            return false;
        throw new ConfigException.BadValue(path, "invalid bool value '" + text + "'");
    }

    /**
     * ISO-8601 date-time. A trailing <code>Z</code> means UTC, a single space
     * may separate date and time, and values without an offset (including
     * plain dates) are taken as UTC.
     */
    public static OffsetDateTime parseDateTime(String path, String text) {
        String s = ConfigImplUtil.unicodeTrim(text);
        if (s.endsWith("Z") || s.endsWith("z"))
            s = s.substring(0, s.length() - 1) + "+00:00";
        if (s.length() > 10 && s.charAt(10) == ' ')
            s = s.substring(0, 10) + "T" + s.substring(11);

        try {
            TemporalAccessor parsed = DATE_TIME.parseBest(s, OffsetDateTime::from,
                    LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime)
                return (OffsetDateTime) parsed;
            else if (parsed instanceof LocalDateTime)
                return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
            else
                return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ConfigException.BadValue(path, "invalid datetime value '" + text + "'", e);
        }
    }
}
