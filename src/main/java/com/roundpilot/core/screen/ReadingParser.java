package com.roundpilot.core.screen;

/**
 * Parses recognized text into numbers.
 */
public final class ReadingParser {

    private ReadingParser() {}

    /**
     * Parses a reading such as {@code "2.35x"} or {@code "1,250.00"}.
     * Spaces, {@code x} markers and thousands separators are dropped and only
     * digits and dots are kept.
     *
     * @throws ReadException if nothing numeric remains
     */
    public static double parseNumber(String text) {
        if (text == null) {
            throw new ReadException("No text recognized");
        }
        var cleaned = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (Character.isDigit(c) || c == '.') {
                cleaned.append(c);
            }
        }
        if (cleaned.length() == 0) {
            throw new ReadException("No numeric value in '" + text.strip() + "'");
        }
        try {
            return Double.parseDouble(cleaned.toString());
        } catch (NumberFormatException e) {
            throw new ReadException("Unparseable number '" + text.strip() + "'", e);
        }
    }

    /**
     * Parses a player count shown as {@code "current/total"} and returns the total.
     * A bare number is taken as the total.
     */
    public static int parsePlayerTotal(String text) {
        if (text == null) {
            throw new ReadException("No text recognized");
        }
        int slash = text.indexOf('/');
        String total = slash >= 0 ? text.substring(slash + 1) : text;
        return (int) parseNumber(total);
    }

    /**
     * Current player count of a {@code "current/total"} reading.
     */
    public static int parsePlayerCurrent(String text) {
        if (text == null) {
            throw new ReadException("No text recognized");
        }
        int slash = text.indexOf('/');
        String current = slash >= 0 ? text.substring(0, slash) : text;
        return (int) parseNumber(current);
    }
}
