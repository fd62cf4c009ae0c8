package com.questrail.testkit.reporter;

/**
 * Formatting of source line numbers carried by reporter events.
 */
public final class LineNumbers
{
    /** Line number value meaning "unknown". */
    public static final int UNKNOWN = 0;

    /** Text shown in place of an unknown line number. */
    public static final String UNKNOWN_TEXT = "???";

    private LineNumbers() {}

    public static boolean isKnown(int line) {
        return line > 0;
    }

    /**
     * Returns the decimal line number, or {@value #UNKNOWN_TEXT} if unknown.
     */
    public static String format(int line) {
        return isKnown(line) ? Integer.toString(line) : UNKNOWN_TEXT;
    }
}
