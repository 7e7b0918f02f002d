/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import java.util.Locale;

/** This is public just for the "config" package to use, don't touch it */
final public class ConfigImplUtil {
    private ConfigImplUtil() {
    }

    /**
     * This is public ONLY for use by the "config" package, DO NOT USE this ABI
     * may change.
     */
    public static boolean equalsHandlingNull(Object a, Object b) {
        if (a == null && b != null)
            return false;
        else if (a != null && b == null)
            return false;
        else if (a == b) // catches null == null plus optimizes identity case
            return true;
        else
            return a.equals(b);
    }

    /**
     * This is public ONLY for use by the "config" package, DO NOT USE this ABI
     * may change.
     *
     * @return true if both are non-null and equal ignoring case
     */
    public static boolean equalsIgnoreCase(String a, String b) {
        if (a == null || b == null)
            return false;
        return a.toLowerCase(Locale.ROOT).equals(b.toLowerCase(Locale.ROOT));
    }

    /**
     * This is public ONLY for use by the "config" package, DO NOT USE this ABI
     * may change.
     *
     * @return the name trimmed, or "" for null
     */
    public static String normalizeName(String name) {
        if (name == null)
            return "";
        return unicodeTrim(name);
    }

    /**
     * Renders a quoted Laconic string which the tokenizer reads back to the
     * same text.
     */
    static String renderQuotedString(String s) {
        StringBuilder sb = new StringBuilder();
        sb.append('"');
        for (int i = 0; i < s.length(); ++i) {
            char c = s.charAt(i);
            switch (c) {
            case '"':
                sb.append("\\\"");
                break;
            case '\\':
                sb.append("\\\\");
                break;
            case '\n':
                sb.append("\\n");
                break;
            case '\b':
                sb.append("\\b");
                break;
            case '\f':
                sb.append("\\f");
                break;
            case '\r':
                sb.append("\\r");
                break;
            case '\t':
                sb.append("\\t");
                break;
            case '\0':
                sb.append("\\0");
                break;
            default:
                if (Character.isISOControl(c))
                    sb.append(String.format("\\u%04x", (int) c));
                else
                    sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * True if the text can be written without quotes and still comes back
     * from the tokenizer as a single identifier with the same text.
     */
    static boolean isBareSafe(String s) {
        if (s.isEmpty() || s.equals("null") || s.charAt(0) == '#')
            return false;
        for (int i = 0; i < s.length(); ++i) {
            char c = s.charAt(i);
            if (isWhitespace(c) || Character.isISOControl(c))
                return false;
            switch (c) {
            case '{':
            case '}':
            case '=':
            case '"':
            case '\'':
                return false;
            default:
                break;
            }
            char next = i + 1 < s.length() ? s.charAt(i + 1) : 0;
            if (c == '/' && (next == '/' || next == '*'))
                return false;
            if (c == '|' && next == '*')
                return false;
        }
        return true;
    }

    static String renderBareOrQuoted(String s) {
        if (isBareSafe(s))
            return s;
        else
            return renderQuotedString(s);
    }

    static boolean isWhitespace(int codepoint) {
        switch (codepoint) {
        // try to hit the most common ASCII ones first, then the nonbreaking
        // spaces that Java brokenly leaves out of isWhitespace.
        case ' ':
        case '\n':
        case '\u00A0':
        case '\u2007':
        case '\u202F':
            return true;
        default:
            return Character.isWhitespace(codepoint);
        }
    }

    /** This is public just for the "config" package to use, don't touch it! */
    public static String unicodeTrim(String s) {
        // String.trim() actually is broken, since there are plenty of
        // non-ASCII whitespace characters.
        final int length = s.length();
        if (length == 0)
            return s;

        int start = 0;
        while (start < length) {
            char c = s.charAt(start);
            if (c == ' ' || c == '\n') {
                start += 1;
            } else {
                int cp = s.codePointAt(start);
                if (isWhitespace(cp))
                    start += Character.charCount(cp);
                else
                    break;
            }
        }

        int end = length;
        while (end > start) {
            char c = s.charAt(end - 1);
            if (c == ' ' || c == '\n') {
                --end;
            } else {
                int cp;
                int delta;
                if (Character.isLowSurrogate(c)) {
                    cp = s.codePointAt(end - 2);
                    delta = 2;
                } else {
                    cp = s.codePointAt(end - 1);
                    delta = 1;
                }
                if (isWhitespace(cp))
                    end -= delta;
                else
                    break;
            }
        }
        return s.substring(start, end);
    }

    static boolean isBlank(String s) {
        return s == null || unicodeTrim(s).isEmpty();
    }
}
