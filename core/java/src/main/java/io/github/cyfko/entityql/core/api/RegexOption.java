package io.github.cyfko.entityql.core.api;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Options applicable to a {@link Op#REGEX} condition.
 */
public enum RegexOption {
    /** Case-insensitive matching ({@code i}). */
    CASE_INSENSITIVE('i', Pattern.CASE_INSENSITIVE),
    /** {@code ^} and {@code $} match at line boundaries ({@code m}). */
    MULTILINE('m', Pattern.MULTILINE),
    /** {@code .} also matches line terminators ({@code s}). */
    DOT_ALL('s', Pattern.DOTALL),
    /** Whitespace and comments are permitted in the pattern ({@code x}). */
    COMMENTS('x', Pattern.COMMENTS);

    private final char flag;
    private final int patternFlag;

    RegexOption(char flag, int patternFlag) {
        this.flag = flag;
        this.patternFlag = patternFlag;
    }

    /**
     * @return the single-letter flag conventionally used for this option
     */
    public char getFlag() {
        return flag;
    }

    /**
     * Folds a set of options into {@link Pattern} compile flags.
     *
     * @param options the options, may be empty
     * @return the combined flag mask
     */
    public static int toPatternFlags(Set<RegexOption> options) {
        int flags = 0;
        for (RegexOption option : options) {
            flags |= option.patternFlag;
        }
        return flags;
    }
}
