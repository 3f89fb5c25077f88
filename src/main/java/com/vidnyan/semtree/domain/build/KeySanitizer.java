package com.vidnyan.semtree.domain.build;

/**
 * Turns mapping keys into element names. Keys that are already valid names pass unchanged.
 */
public final class KeySanitizer {

    private KeySanitizer() {
    }

    public static String sanitize(String key) {
        if (key == null || key.isEmpty()) {
            return "_";
        }
        StringBuilder name = new StringBuilder(key.length() + 1);
        char first = key.charAt(0);
        if (isAsciiLetter(first) || first == '_') {
            name.append(first);
        } else {
            name.append('_');
            name.append(isNameChar(first) ? first : '_');
        }
        for (int i = 1; i < key.length(); i++) {
            char c = key.charAt(i);
            name.append(isNameChar(c) ? c : '_');
        }
        return name.toString();
    }

    public static boolean isValidName(String key) {
        return key != null && !key.isEmpty() && sanitize(key).equals(key);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }
}
