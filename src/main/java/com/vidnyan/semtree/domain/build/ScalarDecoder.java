package com.vidnyan.semtree.domain.build;

import com.vidnyan.semtree.domain.rule.ScalarStyle;

/**
 * Scalar text handling for configuration formats. {@link #strip} removes delimiters only and is
 * used by the syntax branch; {@link #decode} yields the scalar's value for the data branch.
 */
public final class ScalarDecoder {

    private ScalarDecoder() {
    }

    public static String strip(String raw, ScalarStyle style) {
        return switch (style) {
            case PLAIN -> raw.strip();
            case JSON_STRING, DOUBLE_QUOTED, SINGLE_QUOTED -> unquote(raw.strip());
            case BLOCK -> blockScalar(raw);
            case ALIAS -> aliasName(raw);
        };
    }

    public static String decode(String raw, ScalarStyle style) {
        return switch (style) {
            case PLAIN -> fold(raw.strip(), false);
            case JSON_STRING -> unescapeJson(unquote(raw.strip()));
            case DOUBLE_QUOTED -> fold(unquote(raw.strip()), true);
            case SINGLE_QUOTED -> fold(unquote(raw.strip()), false).replace("''", "'");
            case BLOCK -> blockScalar(raw);
            case ALIAS -> aliasName(raw);
        };
    }

    static String aliasName(String text) {
        String alias = text.strip();
        return alias.startsWith("*") ? alias.substring(1) : alias;
    }

    static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'') && last == first) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    /**
     * Decodes JSON escapes; malformed escapes are kept as written.
     */
    static String unescapeJson(String content) {
        if (content.indexOf('\\') < 0) {
            return content;
        }
        StringBuilder out = new StringBuilder(content.length());
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c != '\\' || i + 1 >= content.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = content.charAt(i + 1);
            switch (next) {
                case '"' -> out.append('"');
                case '\\' -> out.append('\\');
                case '/' -> out.append('/');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'u' -> {
                    int code = hex(content, i + 2, 4);
                    if (code < 0) {
                        out.append("\\u");
                    } else {
                        out.append((char) code);
                        i += 4;
                    }
                }
                default -> out.append('\\').append(next);
            }
            i += 2;
        }
        return out.toString();
    }

    /**
     * Applies YAML flow line folding and, for double-quoted scalars, escape decoding.
     */
    static String fold(String content, boolean escapes) {
        if (content.indexOf('\n') < 0 && content.indexOf('\r') < 0 && (!escapes || content.indexOf('\\') < 0)) {
            return content;
        }
        StringBuilder out = new StringBuilder(content.length());
        int i = 0;
        int n = content.length();
        while (i < n) {
            char c = content.charAt(i);
            if (escapes && c == '\\' && i + 1 < n) {
                char next = content.charAt(i + 1);
                if (next == '\n' || next == '\r') {
                    i = skipLineBreak(content, i + 1);
                    i = skipBlanks(content, i);
                    continue;
                }
                i = appendYamlEscape(content, i, out);
                continue;
            }
            if (c == '\n' || c == '\r') {
                trimTrailingBlanks(out);
                int breaks = 0;
                while (i < n && (content.charAt(i) == '\n' || content.charAt(i) == '\r')) {
                    i = skipLineBreak(content, i);
                    breaks++;
                    i = skipBlanks(content, i);
                }
                out.append(breaks == 1 ? " " : "\n".repeat(breaks - 1));
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * Literal ({@code |}) and folded ({@code >}) block scalars: drops the indicator line,
     * removes the content indentation and applies the chomping indicator.
     */
    static String blockScalar(String raw) {
        String text = raw.replace("\r\n", "\n").replace('\r', '\n');
        int headerEnd = text.indexOf('\n');
        if (headerEnd < 0) {
            return "";
        }
        String header = text.substring(0, headerEnd).strip();
        boolean folded = header.startsWith(">");
        char chomp = header.contains("-") ? '-' : header.contains("+") ? '+' : ' ';
        int explicitIndent = -1;
        for (char c : header.toCharArray()) {
            if (c >= '1' && c <= '9') {
                explicitIndent = c - '0';
            }
        }
        String[] lines = text.substring(headerEnd + 1).split("\n", -1);
        int indent = explicitIndent >= 0 ? explicitIndent : detectIndent(lines);

        int last = lines.length - 1;
        while (last >= 0 && lines[last].isBlank()) {
            last--;
        }
        if (last < 0) {
            return "";
        }
        int trailingBreaks = lines.length - 1 - last;
        StringBuilder body = new StringBuilder();
        String previous = null;
        int blanks = 0;
        for (int i = 0; i <= last; i++) {
            String line = lines[i].length() >= indent ? lines[i].substring(indent) : lines[i].strip();
            if (line.isEmpty()) {
                blanks++;
                continue;
            }
            if (previous == null) {
                body.append("\n".repeat(blanks));
            } else if (!folded) {
                body.append("\n".repeat(blanks + 1));
            } else if (blanks == 0 && !line.startsWith(" ") && !previous.startsWith(" ")) {
                body.append(' ');
            } else {
                body.append("\n".repeat(Math.max(blanks, 1)));
            }
            body.append(line);
            previous = line;
            blanks = 0;
        }
        return switch (chomp) {
            case '-' -> body.toString();
            case '+' -> body + "\n".repeat(Math.max(trailingBreaks, 1));
            default -> body + "\n";
        };
    }

    private static int detectIndent(String[] lines) {
        for (String line : lines) {
            if (!line.isBlank()) {
                int indent = 0;
                while (indent < line.length() && line.charAt(indent) == ' ') {
                    indent++;
                }
                return indent;
            }
        }
        return 0;
    }

    private static int appendYamlEscape(String content, int at, StringBuilder out) {
        char code = content.charAt(at + 1);
        switch (code) {
            case '0' -> out.append('\0');
            case 'a' -> out.append('\u0007');
            case 'b' -> out.append('\b');
            case 't', '\t' -> out.append('\t');
            case 'n' -> out.append('\n');
            case 'v' -> out.append('\u000B');
            case 'f' -> out.append('\f');
            case 'r' -> out.append('\r');
            case 'e' -> out.append('\u001B');
            case ' ' -> out.append(' ');
            case '"' -> out.append('"');
            case '/' -> out.append('/');
            case '\\' -> out.append('\\');
            case 'N' -> out.append('\u0085');
            case '_' -> out.append('\u00A0');
            case 'L' -> out.append('\u2028');
            case 'P' -> out.append('\u2029');
            case 'x', 'u', 'U' -> {
                int digits = code == 'x' ? 2 : code == 'u' ? 4 : 8;
                int value = hex(content, at + 2, digits);
                if (value < 0 || !Character.isValidCodePoint(value)) {
                    out.append('\\').append(code);
                    return at + 2;
                }
                out.appendCodePoint(value);
                return at + 2 + digits;
            }
            default -> out.append('\\').append(code);
        }
        return at + 2;
    }

    private static int hex(String text, int from, int digits) {
        if (from + digits > text.length()) {
            return -1;
        }
        try {
            return (int) Long.parseLong(text.substring(from, from + digits), 16);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static int skipLineBreak(String text, int at) {
        if (text.charAt(at) == '\r' && at + 1 < text.length() && text.charAt(at + 1) == '\n') {
            return at + 2;
        }
        return at + 1;
    }

    private static int skipBlanks(String text, int at) {
        while (at < text.length() && (text.charAt(at) == ' ' || text.charAt(at) == '\t')) {
            at++;
        }
        return at;
    }

    private static void trimTrailingBlanks(StringBuilder out) {
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == ' ' || out.charAt(end - 1) == '\t')) {
            end--;
        }
        out.setLength(end);
    }
}
