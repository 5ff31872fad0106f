package com.assetvault.upload.service;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a user-supplied title, or failing that the file name, into the title stored on
 * an asset. Placeholder values some clients send instead of a real title become null.
 */
public final class AssetTitles {

    private static final Set<String> PLACEHOLDERS = Set.of("unknown", "untitled", "untitled asset");
    private static final Pattern SEPARATORS = Pattern.compile("[_-]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AssetTitles() {
    }

    public static String normalize(String title, String fileName) {
        String fromTitle = clean(title);
        if (fromTitle != null) {
            return fromTitle;
        }
        return fromFileName(fileName);
    }

    static String fromFileName(String fileName) {
        if (fileName == null) {
            return null;
        }
        String name = fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return clean(SEPARATORS.matcher(name).replaceAll(" "));
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = WHITESPACE.matcher(value.trim()).replaceAll(" ");
        if (collapsed.isEmpty() || PLACEHOLDERS.contains(collapsed.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return collapsed;
    }
}
