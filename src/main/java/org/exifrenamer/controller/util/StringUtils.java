package org.exifrenamer.controller.util;

import java.nio.charset.StandardCharsets;

public class StringUtils {

    private StringUtils() {
        // utility class
    }

    /**
     * @param filename a file name, without any directory
     * @return the name up to (not including) the last dot; the whole name if
     *         there is no dot, or the only dot is the first character
     */
    public static String getBaseName(final String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot <= 0) {
            return filename;
        }
        return filename.substring(0, dot);
    }

    /**
     * @param filename a file name, without any directory
     * @return the extension including its dot, in its original case, or the
     *         empty string
     */
    public static String getExtension(final String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return filename.substring(dot);
    }

    /**
     * Decode bytes as UTF-8, dropping anything that is not valid UTF-8.
     *
     * @param bytes the raw bytes, may be null
     * @return the decoded text; empty for null input
     */
    public static String decodeUtf8Lenient(final byte[] bytes) {
        if (bytes == null) {
            return "";
        }
        return new String(bytes, StandardCharsets.UTF_8).replace("\uFFFD", "");
    }

    /**
     * Trim whitespace and NUL padding from both ends.
     *
     * @param text the text, may be null
     * @return the trimmed text; empty for null input
     */
    public static String trimPadding(final String text) {
        if (text == null) {
            return "";
        }
        int start = 0;
        int end = text.length();
        while (start < end && isPadding(text.charAt(start))) {
            start++;
        }
        while (end > start && isPadding(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isPadding(final char c) {
        return c == '\0' || Character.isWhitespace(c);
    }

    /**
     * @param text the text, may be null
     * @return the text with every space character removed; empty for null
     */
    public static String removeSpaces(final String text) {
        if (text == null) {
            return "";
        }
        return text.replace(" ", "");
    }

    /**
     * Make camera text safe to use inside a file name.  Path separators and
     * the other characters common file systems refuse are replaced or
     * dropped, as are control characters.
     *
     * @param text the text, may be null
     * @return the cleaned text; empty for null
     */
    public static String sanitiseForFileName(final String text) {
        if (text == null) {
            return "";
        }
        StringBuilder clean = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '/':
                case '\\':
                case '|':
                case ':':
                case '*':
                    clean.append('-');
                    break;
                case '"':
                    clean.append('\'');
                    break;
                case '?':
                case '<':
                case '>':
                    break;
                default:
                    if (!Character.isISOControl(c)) {
                        clean.append(c);
                    }
            }
        }
        return clean.toString();
    }
}
