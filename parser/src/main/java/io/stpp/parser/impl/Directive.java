package io.stpp.parser.impl;

/** The directive keywords understood by the interpreter. */
public enum Directive {
    IF("if"),
    ELIF("elif"),
    ELSE("else"),
    ENDIF("endif"),
    DEFINE("define"),
    UNDEF("undef"),
    /** Any other word; echoed to the output unchanged. */
    UNKNOWN(null);

    private final String keyword;

    Directive(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Classifies a directive word. Matching is exact and case-sensitive.
     *
     * @param word the word following the marker
     * @return the matching directive, {@link #UNKNOWN} if none matches
     */
    public static Directive fromKeyword(String word) {
        for (Directive directive : values()) {
            if (word.equals(directive.keyword)) {
                return directive;
            }
        }
        return UNKNOWN;
    }
}
