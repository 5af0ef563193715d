package de.caluga.topology.driver.bson;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * BSON regular expression. The server syntax is kept as is, {@link Pattern} cannot represent all of
 * the BSON flags. Flags are always stored sorted.
 */
public class MongoRegex {
    private final String pattern;
    private final String flags;

    public MongoRegex(String pattern, String flags) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern must not be null");
        }

        this.pattern = pattern;
        this.flags = sortFlags(flags == null ? "" : flags);
    }

    public MongoRegex(String pattern) {
        this(pattern, "");
    }

    public static MongoRegex fromPattern(Pattern p) {
        return new MongoRegex(p.pattern(), flagsOf(p.flags()));
    }

    /**
     * BSON option characters for the given {@link Pattern} flags, in "ilmsux" order
     */
    public static String flagsOf(int f) {
        StringBuilder b = new StringBuilder();

        if ((f & Pattern.CASE_INSENSITIVE) != 0) {
            b.append('i');
        }

        if ((f & Pattern.MULTILINE) != 0) {
            b.append('m');
        }

        if ((f & Pattern.DOTALL) != 0) {
            b.append('s');
        }

        if ((f & Pattern.UNICODE_CASE) != 0) {
            b.append('u');
        }

        if ((f & Pattern.COMMENTS) != 0) {
            b.append('x');
        }

        return b.toString();
    }

    private static String sortFlags(String flags) {
        char[] c = flags.toCharArray();
        java.util.Arrays.sort(c);
        return new String(c);
    }

    public String getPattern() {
        return pattern;
    }

    public String getFlags() {
        return flags;
    }

    /**
     * java pattern with the flags java knows about, 'l' is dropped
     */
    public Pattern toPattern() {
        int f = 0;

        if (flags.indexOf('i') >= 0) f |= Pattern.CASE_INSENSITIVE;
        if (flags.indexOf('m') >= 0) f |= Pattern.MULTILINE;
        if (flags.indexOf('s') >= 0) f |= Pattern.DOTALL;
        if (flags.indexOf('u') >= 0) f |= Pattern.UNICODE_CASE;
        if (flags.indexOf('x') >= 0) f |= Pattern.COMMENTS;

        return Pattern.compile(pattern, f);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MongoRegex that = (MongoRegex) o;
        return pattern.equals(that.pattern) && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, flags);
    }

    @Override
    public String toString() {
        return "/" + pattern + "/" + flags;
    }
}
