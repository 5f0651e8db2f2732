package com.vidnyan.cga.adapter.out.parser.regex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Set;

/**
 * A source file prepared for pattern matching: comments and string contents blanked out
 * (offsets and line breaks preserved), plus offset-to-line lookup and bracket matching.
 */
final class SourceText {

    private final String original;
    private final String clean;
    private final int[] lineStarts;
    private final BitSet literalBreaks;

    private SourceText(String original, Syntax syntax) {
        this.original = original;
        this.literalBreaks = new BitSet(original.length());
        this.clean = blank(original, syntax, literalBreaks);
        this.lineStarts = lineStarts(original);
    }

    /**
     * C-family sources: {@code //} and block comments, single, double and backtick quotes.
     */
    static SourceText cFamily(String source) {
        return new SourceText(source, Syntax.C_FAMILY);
    }

    /**
     * JavaScript and TypeScript: C-family rules plus regular expression literals,
     * and template literals whose {@code ${...}} expressions are kept as code.
     */
    static SourceText script(String source) {
        return new SourceText(source, Syntax.SCRIPT);
    }

    /**
     * Python sources: {@code #} comments, single, double and triple quotes.
     */
    static SourceText python(String source) {
        return new SourceText(source, Syntax.PYTHON);
    }

    String original() {
        return original;
    }

    String clean() {
        return clean;
    }

    int lineCount() {
        return lineStarts.length;
    }

    /**
     * 1-based line of an offset.
     */
    int lineAt(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return (index >= 0 ? index : -index - 2) + 1;
    }

    /**
     * 1-based column of an offset.
     */
    int columnAt(int offset) {
        return offset - lineStarts[lineAt(offset) - 1] + 1;
    }

    /**
     * Offset of the first character of a 1-based line.
     */
    int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * Brace depth at the start of every line, indexed by 1-based line.
     */
    int[] lineDepths() {
        int[] depths = new int[lineStarts.length + 1];
        int depth = 0;
        int line = 1;
        depths[1] = 0;
        for (int i = 0; i < clean.length(); i++) {
            char c = clean.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == '\n' && line < lineStarts.length) {
                depths[++line] = depth;
            }
        }
        return depths;
    }

    /**
     * Text of a 1-based line of the cleaned source, without the line break.
     */
    String cleanLine(int line) {
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] - 1 : clean.length();
        return clean.substring(start, Math.max(start, end));
    }

    /**
     * Original contents of the string literal whose opening quote is at {@code quote}.
     */
    String literalAt(int quote) {
        char fence = original.charAt(quote);
        int end = original.indexOf(fence, quote + 1);
        return end < 0 ? original.substring(quote + 1) : original.substring(quote + 1, end);
    }

    /**
     * Offset of the brace closing the first block opened at or after {@code from},
     * or the end of the source when the block is never closed.
     */
    int blockEnd(int from) {
        int depth = 0;
        boolean opened = false;
        for (int i = from; i < clean.length(); i++) {
            char c = clean.charAt(i);
            if (c == '{') {
                depth++;
                opened = true;
            } else if (c == '}') {
                depth--;
                if (opened && depth == 0) {
                    return i;
                }
            }
        }
        return clean.length();
    }

    /**
     * Offset of the parenthesis matching the one at {@code open}, or -1.
     */
    int closingParen(int open) {
        int depth = 0;
        for (int i = open; i < clean.length(); i++) {
            char c = clean.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Number of top-level arguments in the call whose opening parenthesis is at {@code open}.
     */
    int argumentCount(int open) {
        int close = closingParen(open);
        if (close < 0) {
            return 0;
        }
        String inside = clean.substring(open + 1, close);
        if (inside.isBlank()) {
            return 0;
        }
        return splitTopLevel(inside).size();
    }

    /**
     * Indentation-delimited block end for Python: last line, 1-based, whose indentation is deeper
     * than {@code indent}, starting after {@code headerLine}.
     */
    int indentedBlockEnd(int headerLine, int indent) {
        int last = headerLine;
        int brackets = Math.max(0, bracketDelta(cleanLine(headerLine)));
        for (int line = headerLine + 1; line <= lineStarts.length; line++) {
            String text = cleanLine(line);
            boolean continuation = brackets > 0 || startsInsideLiteral(line);
            brackets = Math.max(0, brackets + bracketDelta(text));
            if (text.isBlank()) {
                continue;
            }
            if (!continuation && indentOf(text) <= indent) {
                break;
            }
            last = line;
        }
        return last;
    }

    /**
     * Whether a 1-based line begins inside a multi-line string or template literal.
     */
    boolean startsInsideLiteral(int line) {
        return line > 1 && literalBreaks.get(lineStarts[line - 1] - 1);
    }

    private static int bracketDelta(String text) {
        int delta = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                delta++;
            } else if (c == ')' || c == ']' || c == '}') {
                delta--;
            }
        }
        return delta;
    }

    static int indentOf(String line) {
        int indent = 0;
        while (indent < line.length() && (line.charAt(indent) == ' ' || line.charAt(indent) == '\t')) {
            indent++;
        }
        return indent;
    }

    /**
     * Split on commas not nested inside brackets of any kind.
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (c == '(' || c == '[' || c == '{' || c == '<') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}' || c == '>') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (!current.toString().isBlank()) {
            parts.add(current.toString().trim());
        }
        return parts;
    }

    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static String blank(String source, Syntax syntax, BitSet literalBreaks) {
        char[] out = source.toCharArray();
        new Blanker(source, out, syntax, literalBreaks).code(0, false);
        return new String(out);
    }

    private enum Syntax {
        C_FAMILY, SCRIPT, PYTHON
    }

    /**
     * Blanks comments and literal text in place. Template interpolations stay visible as code.
     */
    private static final class Blanker {

        private static final String REGEX_PRECEDERS = "(,=:[!&|?{};+-*%~^";
        private static final Set<String> REGEX_KEYWORDS = Set.of(
                "return", "typeof", "case", "yield", "throw", "await", "in", "of", "delete", "void");

        private final String source;
        private final char[] out;
        private final Syntax syntax;
        private final BitSet literalBreaks;

        Blanker(String source, char[] out, Syntax syntax, BitSet literalBreaks) {
            this.source = source;
            this.out = out;
            this.syntax = syntax;
            this.literalBreaks = literalBreaks;
        }

        /**
         * Scans code from {@code from}. Inside an interpolation, returns just past the brace closing it.
         */
        int code(int from, boolean interpolation) {
            boolean python = syntax == Syntax.PYTHON;
            int depth = 0;
            int i = from;
            while (i < out.length) {
                char c = out[i];
                if (!python && c == '/' && next(i) == '/') {
                    i = blankUntilLineEnd(out, i);
                } else if (!python && c == '/' && next(i) == '*') {
                    int end = indexOf(source, "*/", i + 2);
                    int stop = end < 0 ? out.length : end + 2;
                    blankRange(out, i, stop);
                    i = stop;
                } else if (python && c == '#') {
                    i = blankUntilLineEnd(out, i);
                } else if (python && (c == '"' || c == '\'') && source.startsWith(String.valueOf(c).repeat(3), i)) {
                    i = tripleQuoted(i, String.valueOf(c).repeat(3));
                } else if (!python && c == '`') {
                    i = template(i);
                } else if (c == '"' || c == '\'') {
                    i = quoted(i, c);
                } else if (syntax == Syntax.SCRIPT && c == '/' && regexAllowed(i)) {
                    i = regex(i);
                } else {
                    if (interpolation && c == '{') {
                        depth++;
                    } else if (interpolation && c == '}') {
                        if (depth == 0) {
                            out[i] = ' ';
                            return i + 1;
                        }
                        depth--;
                    }
                    i++;
                }
            }
            return i;
        }

        private char next(int i) {
            return i + 1 < out.length ? out[i + 1] : '\0';
        }

        private int quoted(int open, char quote) {
            int j = open + 1;
            while (j < out.length && out[j] != quote && out[j] != '\n') {
                if (out[j] == '\\') {
                    j++;
                }
                j++;
            }
            int stop = Math.min(j, out.length);
            blankRange(out, open + 1, stop);
            return stop + 1;
        }

        private int tripleQuoted(int open, String fence) {
            int end = indexOf(source, fence, open + 3);
            int stop = end < 0 ? out.length : end + 3;
            int bodyEnd = end < 0 ? out.length : end;
            markBreaks(open + 3, bodyEnd);
            blankRange(out, open + 3, bodyEnd);
            return stop;
        }

        private int template(int open) {
            int j = open + 1;
            while (j < out.length) {
                char c = out[j];
                if (c == '\\') {
                    blankRange(out, j, j + 2);
                    j += 2;
                } else if (c == '`') {
                    return j + 1;
                } else if (c == '$' && next(j) == '{') {
                    out[j] = ' ';
                    out[j + 1] = ' ';
                    j = code(j + 2, true);
                } else {
                    if (c == '\n') {
                        literalBreaks.set(j);
                    } else {
                        out[j] = ' ';
                    }
                    j++;
                }
            }
            return j;
        }

        /**
         * A slash starts a regular expression when an operand is expected: at line start,
         * after an operator or opening bracket, or after a keyword such as {@code return}.
         */
        private boolean regexAllowed(int slash) {
            int k = slash - 1;
            while (k >= 0 && (out[k] == ' ' || out[k] == '\t' || out[k] == '\r')) {
                k--;
            }
            if (k < 0 || out[k] == '\n') {
                return true;
            }
            char previous = out[k];
            if (previous == '>') {
                return k > 0 && out[k - 1] == '='; // arrow body
            }
            if (REGEX_PRECEDERS.indexOf(previous) >= 0) {
                return true;
            }
            if (!Character.isJavaIdentifierPart(previous)) {
                return false;
            }
            int wordStart = k;
            while (wordStart > 0 && Character.isJavaIdentifierPart(out[wordStart - 1])) {
                wordStart--;
            }
            return REGEX_KEYWORDS.contains(new String(out, wordStart, k - wordStart + 1));
        }

        private int regex(int slash) {
            int j = slash + 1;
            boolean inClass = false;
            while (j < out.length && out[j] != '\n') {
                char c = out[j];
                if (c == '\\' && j + 1 < out.length && out[j + 1] != '\n') {
                    j += 2;
                    continue;
                }
                if (c == '[') {
                    inClass = true;
                } else if (c == ']') {
                    inClass = false;
                } else if (c == '/' && !inClass) {
                    break;
                }
                j++;
            }
            if (j >= out.length || out[j] == '\n') {
                return slash + 1; // a division after all
            }
            blankRange(out, slash + 1, j);
            int k = j + 1;
            while (k < out.length && Character.isLetter(out[k])) {
                k++;
            }
            return k;
        }

        private void markBreaks(int from, int to) {
            for (int i = from; i < Math.min(to, out.length); i++) {
                if (out[i] == '\n') {
                    literalBreaks.set(i);
                }
            }
        }
    }

    private static int blankUntilLineEnd(char[] out, int from) {
        int i = from;
        while (i < out.length && out[i] != '\n') {
            out[i] = ' ';
            i++;
        }
        return i;
    }

    private static void blankRange(char[] out, int from, int to) {
        for (int i = Math.max(0, from); i < Math.min(to, out.length); i++) {
            if (out[i] != '\n') {
                out[i] = ' ';
            }
        }
    }

    private static int indexOf(String source, String needle, int from) {
        return from >= source.length() ? -1 : source.indexOf(needle, from);
    }
}
