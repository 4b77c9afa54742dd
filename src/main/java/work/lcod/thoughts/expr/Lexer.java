package work.lcod.thoughts.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Indentation-aware tokenizer for the computation grammar.
 * Newlines inside brackets are joined, blank and comment-only lines never produce tokens.
 */
final class Lexer {
    private static final List<String> OPERATORS = List.of(
        "**=", "//=", ">>=", "<<=", "...",
        "**", "//", "==", "!=", "<=", ">=", "->", "+=", "-=", "*=", "/=", "%=",
        "&=", "|=", "^=", "<<", ">>", ":=", "@=",
        "+", "-", "*", "/", "%", "(", ")", "[", "]", "{", "}", ",", ":", ".", ";",
        "=", "<", ">", "@", "&", "|", "^", "~"
    );
    private static final Set<String> STRING_PREFIXES = Set.of(
        "r", "u", "b", "f", "rb", "br", "fr", "rf"
    );
    private static final int TAB_SIZE = 8;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int lineStart;
    private int depth;
    private boolean atLineStart = true;
    private boolean lineHasContent;

    Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    List<Token> tokenize() {
        indents.push(0);
        while (pos < source.length()) {
            if (atLineStart && depth == 0) {
                if (!readIndentation()) {
                    continue;
                }
            }
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f' || c == '\r') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && isLineContinuation()) {
                continue;
            } else if (c == '\n') {
                newline();
            } else if (isDigit(c) || (c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                readNameOrPrefixedString();
            } else if (c == '\'' || c == '"') {
                readString(pos, "");
            } else {
                readOperator();
            }
        }
        if (depth > 0) {
            throw error("unbalanced bracket at end of input");
        }
        if (lineHasContent) {
            emit(TokenType.NEWLINE, "", column());
        }
        while (indents.size() > 1) {
            indents.pop();
            emit(TokenType.DEDENT, "", 1);
        }
        emit(TokenType.EOF, "", column());
        return tokens;
    }

    private boolean readIndentation() {
        int width = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c != '\f') {
                break;
            }
            pos++;
        }
        if (pos >= source.length()) {
            return false;
        }
        char c = source.charAt(pos);
        if (c == '\n' || c == '\r' || c == '#') {
            // blank or comment-only line, indentation is irrelevant
            if (c == '#') {
                skipComment();
            }
            if (pos < source.length() && source.charAt(pos) == '\r') {
                pos++;
            }
            if (pos < source.length() && source.charAt(pos) == '\n') {
                pos++;
                line++;
                lineStart = pos;
            }
            return false;
        }
        atLineStart = false;
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            emit(TokenType.INDENT, "", 1);
        } else if (width < current) {
            while (indents.size() > 1 && width < indents.peek()) {
                indents.pop();
                emit(TokenType.DEDENT, "", 1);
            }
            if (width != indents.peek()) {
                throw error("unindent does not match any outer indentation level");
            }
        }
        return true;
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
        }
    }

    private boolean isLineContinuation() {
        int next = pos + 1;
        if (next < source.length() && source.charAt(next) == '\r') {
            next++;
        }
        if (next < source.length() && source.charAt(next) == '\n') {
            pos = next + 1;
            line++;
            lineStart = pos;
            return true;
        }
        throw error("unexpected character '\\'");
    }

    private void newline() {
        if (depth == 0 && lineHasContent) {
            emit(TokenType.NEWLINE, "", column());
            lineHasContent = false;
        }
        pos++;
        line++;
        lineStart = pos;
        atLineStart = depth == 0;
    }

    private void readNumber() {
        int start = pos;
        int startColumn = column();
        boolean seenDot = false;
        boolean seenExponent = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (isDigit(c) || c == '_') {
                pos++;
            } else if (c == '.' && !seenDot && !seenExponent) {
                seenDot = true;
                pos++;
            } else if ((c == 'e' || c == 'E') && !seenExponent) {
                int next = pos + 1;
                if (next < source.length() && (source.charAt(next) == '+' || source.charAt(next) == '-')) {
                    next++;
                }
                if (next >= source.length() || !isDigit(source.charAt(next))) {
                    break;
                }
                seenExponent = true;
                pos = next;
            } else {
                break;
            }
        }
        String text = source.substring(start, pos);
        if (text.endsWith("_") || text.contains("__")) {
            throw error("invalid numeric literal '" + text + "'");
        }
        if (pos < source.length() && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '_')) {
            throw error("invalid numeric literal '" + text + source.charAt(pos) + "'");
        }
        emitAt(TokenType.NUMBER, text.replace("_", ""), startColumn);
    }

    private void readNameOrPrefixedString() {
        int start = pos;
        while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String word = source.substring(start, pos);
        if (pos < source.length()
            && (source.charAt(pos) == '\'' || source.charAt(pos) == '"')
            && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
            readString(start, word.toLowerCase(Locale.ROOT));
            return;
        }
        emitAt(TokenType.NAME, word, start - lineStart + 1);
    }

    private void readString(int tokenStart, String prefix) {
        int startColumn = tokenStart - lineStart + 1;
        char quote = source.charAt(pos);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), pos);
        boolean raw = prefix.contains("r");
        pos += triple ? 3 : 1;
        var value = new StringBuilder();
        while (true) {
            if (pos >= source.length()) {
                throw error("unterminated string literal");
            }
            char c = source.charAt(pos);
            if (triple && source.startsWith(String.valueOf(quote).repeat(3), pos)) {
                pos += 3;
                break;
            }
            if (!triple && c == quote) {
                pos++;
                break;
            }
            if (c == '\n') {
                if (!triple) {
                    throw error("unterminated string literal");
                }
                line++;
                lineStart = pos + 1;
                value.append(c);
                pos++;
                continue;
            }
            if (c == '\\' && pos + 1 < source.length()) {
                char next = source.charAt(pos + 1);
                if (raw) {
                    value.append(c).append(next);
                } else {
                    value.append(unescape(next));
                }
                if (next == '\n') {
                    line++;
                    lineStart = pos + 2;
                }
                pos += 2;
                continue;
            }
            value.append(c);
            pos++;
        }
        emitAt(TokenType.STRING, value.toString(), startColumn);
    }

    private String unescape(char c) {
        return switch (c) {
            case 'n' -> "\n";
            case 't' -> "\t";
            case 'r' -> "\r";
            case '0' -> "\0";
            case '\n' -> "";
            default -> String.valueOf(c);
        };
    }

    private void readOperator() {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                int startColumn = column();
                pos += op.length();
                if ("(".equals(op) || "[".equals(op) || "{".equals(op)) {
                    depth++;
                } else if (")".equals(op) || "]".equals(op) || "}".equals(op)) {
                    if (depth == 0) {
                        pos -= op.length();
                        throw error("unmatched '" + op + "'");
                    }
                    depth--;
                }
                emitAt(TokenType.OP, op, startColumn);
                return;
            }
        }
        throw error("unexpected character '" + source.charAt(pos) + "'");
    }

    private void emit(TokenType type, String text, int column) {
        tokens.add(new Token(type, text, line, column));
    }

    private void emitAt(TokenType type, String text, int column) {
        lineHasContent = true;
        emit(type, text, column);
    }

    private int column() {
        return pos - lineStart + 1;
    }

    // Numeric literals are ASCII only; other Unicode digits are rejected as unexpected characters.
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private SourceParseException error(String message) {
        return new SourceParseException(message, line, column());
    }
}
