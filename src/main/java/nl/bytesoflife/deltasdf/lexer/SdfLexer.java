package nl.bytesoflife.deltasdf.lexer;

import nl.bytesoflife.deltasdf.LexException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for SDF files.
 * Splits SDF text into tokens, dropping whitespace and comments. The lexer itself
 * holds no state: every call to {@link #stream(String)} starts an independent scan.
 */
public class SdfLexer {

    // Signed integer or real: 1, -2, 0.5, .6, 1., 1e-3
    private static final Pattern NUMBER = Pattern.compile(
        "[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    // Sized or unsized based constant: 1'b0, 'B1, 4'hF, 8'sd255
    private static final Pattern BASED_NUMBER = Pattern.compile(
        "\\d*'[sS]?[bBoOdDhH][0-9a-fA-FxXzZ?_]+");

    // Longest operators first so that "==" is not read as two tokens
    private static final String[] OPERATORS = {
        "===", "!==", "==", "!=", "&&", "||", "~&", "~|", "~^", "^~", "~", "!", "&", "|", "^"
    };

    public List<Token> tokenize(String content) {
        List<Token> tokens = new ArrayList<>();
        Iterator<Token> it = stream(content);
        while (it.hasNext()) {
            tokens.add(it.next());
        }
        return tokens;
    }

    /**
     * Returns a lazy token iterator over the content. The last token is always {@link TokenType#EOF}.
     */
    public Iterator<Token> stream(String content) {
        return new Scanner(content);
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '/' || c == '.'
            || c == '[' || c == ']' || c == '*' || c == '$' || c == '\\';
    }

    private static final class Scanner implements Iterator<Token> {

        private final String input;
        private final Matcher numberMatcher;
        private final Matcher basedMatcher;
        private int pos;
        private int line = 1;
        private int lineStart;
        private boolean done;

        Scanner(String input) {
            this.input = input;
            this.numberMatcher = NUMBER.matcher(input);
            this.basedMatcher = BASED_NUMBER.matcher(input);
        }

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Token next() {
            if (done) {
                throw new NoSuchElementException();
            }
            Token token = scan();
            if (token.type() == TokenType.EOF) {
                done = true;
            }
            return token;
        }

        private Token scan() {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                return token(TokenType.EOF, "", pos);
            }

            int start = pos;
            char c = input.charAt(pos);
            switch (c) {
                case '(' -> {
                    pos++;
                    return token(TokenType.LPAR, "(", start);
                }
                case ')' -> {
                    pos++;
                    return token(TokenType.RPAR, ")", start);
                }
                case ':' -> {
                    pos++;
                    return token(TokenType.COLON, ":", start);
                }
                case '"' -> {
                    return scanQuotedString();
                }
                default -> {
                    // handled below
                }
            }

            if (c == '\'' || Character.isDigit(c)) {
                if (lookingAt(basedMatcher)) {
                    pos = basedMatcher.end();
                    return token(TokenType.BASED_NUMBER, input.substring(start, pos), start);
                }
            }

            if (c == '+' || c == '-' || c == '.' || Character.isDigit(c)) {
                if (lookingAt(numberMatcher)) {
                    int end = numberMatcher.end();
                    // "1ns" or "1_reg" continue as a word
                    if (end >= input.length() || !isWordChar(input.charAt(end)) || c == '+' || c == '-') {
                        pos = end;
                        return token(TokenType.NUMBER, input.substring(start, pos), start);
                    }
                }
            }

            if (isWordChar(c)) {
                return scanWord();
            }

            for (String op : OPERATORS) {
                if (input.startsWith(op, pos)) {
                    pos += op.length();
                    return token(TokenType.OPERATOR, op, start);
                }
            }

            throw error("Unexpected character '" + c + "'", start);
        }

        private Token scanWord() {
            int start = pos;
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (c == '\\') {
                    // escaped character is part of the identifier
                    if (pos + 1 >= input.length() || Character.isWhitespace(input.charAt(pos + 1))) {
                        throw error("Dangling escape character", pos);
                    }
                    pos += 2;
                } else if (isWordChar(c)) {
                    pos++;
                } else {
                    break;
                }
            }
            String word = input.substring(start, pos);
            Keyword keyword = Keyword.lookup(word);
            if (keyword != null) {
                return new Token(TokenType.KEYWORD, word, keyword, start, line, start - lineStart + 1);
            }
            return token(TokenType.IDENTIFIER, word, start);
        }

        private Token scanQuotedString() {
            int start = pos;
            int startLine = line;
            int startColumn = start - lineStart + 1;
            pos++;
            StringBuilder sb = new StringBuilder();
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (c == '"') {
                    pos++;
                    return new Token(TokenType.QSTRING, sb.toString(), null, start, startLine, startColumn);
                }
                // only \" and \\ are escapes; any other backslash is kept as written
                if (c == '\\' && pos + 1 < input.length()
                        && (input.charAt(pos + 1) == '"' || input.charAt(pos + 1) == '\\')) {
                    pos++;
                    c = input.charAt(pos);
                }
                if (c == '\n') {
                    line++;
                    lineStart = pos + 1;
                }
                sb.append(c);
                pos++;
            }
            throw new LexException("Unterminated quoted string", start, startLine, startColumn);
        }

        private void skipWhitespaceAndComments() {
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (c == '\n') {
                    pos++;
                    line++;
                    lineStart = pos;
                } else if (Character.isWhitespace(c)) {
                    pos++;
                } else if (input.startsWith("//", pos)) {
                    while (pos < input.length() && input.charAt(pos) != '\n') {
                        pos++;
                    }
                } else if (input.startsWith("/*", pos)) {
                    skipBlockComment();
                } else {
                    break;
                }
            }
        }

        private void skipBlockComment() {
            int start = pos;
            int startLine = line;
            int startColumn = start - lineStart + 1;
            pos += 2;
            while (pos < input.length()) {
                if (input.startsWith("*/", pos)) {
                    pos += 2;
                    return;
                }
                if (input.charAt(pos) == '\n') {
                    line++;
                    lineStart = pos + 1;
                }
                pos++;
            }
            throw new LexException("Unterminated block comment", start, startLine, startColumn);
        }

        private boolean lookingAt(Matcher matcher) {
            matcher.region(pos, input.length());
            return matcher.lookingAt();
        }

        private Token token(TokenType type, String text, int start) {
            return new Token(type, text, null, start, line, start - lineStart + 1);
        }

        private LexException error(String message, int at) {
            return new LexException(message, at, line, at - lineStart + 1);
        }
    }
}
