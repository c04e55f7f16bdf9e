package nl.bytesoflife.deltasdf.parser;

import nl.bytesoflife.deltasdf.SyntaxException;
import nl.bytesoflife.deltasdf.lexer.Keyword;
import nl.bytesoflife.deltasdf.lexer.SdfLexer;
import nl.bytesoflife.deltasdf.lexer.Token;
import nl.bytesoflife.deltasdf.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parser for COND equations.
 *
 * <p>Precedence from lowest to highest, all binary levels left-associative:
 * {@code ||}, {@code &&}, {@code | ~|}, {@code ^ ~^ ^~}, {@code & ~&},
 * {@code == != === !==}, unary {@code ~ !}, then identifiers, constants and
 * parenthesized sub-expressions.
 *
 * <p>The result is not a tree: it is the consumed token text joined by single spaces,
 * so {@code en==1'b1} becomes {@code en == 1'b1}.
 */
public class ConditionParser {

    private static final List<Set<String>> BINARY_LEVELS = List.of(
        Set.of("||"),
        Set.of("&&"),
        Set.of("|", "~|"),
        Set.of("^", "~^", "^~"),
        Set.of("&", "~&"),
        Set.of("==", "!=", "===", "!=="));

    private static final Set<String> UNARY = Set.of("~", "!");

    private final TokenCursor cursor;
    private final List<String> parts = new ArrayList<>();

    ConditionParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    /**
     * Normalizes a standalone equation such as {@code a&(B|C)}.
     */
    public static String normalize(String equation) {
        TokenCursor cursor = new TokenCursor(new SdfLexer().stream(equation));
        String result = new ConditionParser(cursor).parse();
        if (!cursor.at(TokenType.EOF)) {
            throw new SyntaxException("Unexpected token after condition", cursor.peek());
        }
        return result;
    }

    /**
     * Consumes one equation from the cursor and returns its normalized text. Stops at the
     * first token that cannot continue the expression.
     */
    String parse() {
        parts.clear();
        parseBinary(0);
        return String.join(" ", parts);
    }

    private void parseBinary(int level) {
        if (level == BINARY_LEVELS.size()) {
            parseUnary();
            return;
        }
        parseBinary(level + 1);
        Set<String> operators = BINARY_LEVELS.get(level);
        while (cursor.at(TokenType.OPERATOR) && operators.contains(cursor.peek().text())) {
            parts.add(cursor.next().text());
            parseBinary(level + 1);
        }
    }

    private void parseUnary() {
        if (cursor.at(TokenType.OPERATOR) && UNARY.contains(cursor.peek().text())) {
            parts.add(cursor.next().text());
            parseUnary();
            return;
        }
        parsePrimary();
    }

    private void parsePrimary() {
        Token token = cursor.peek();
        switch (token.type()) {
            case IDENTIFIER, NUMBER, BASED_NUMBER -> parts.add(cursor.next().text());
            case KEYWORD -> {
                if (token.is(Keyword.POSEDGE) || token.is(Keyword.NEGEDGE)) {
                    throw new SyntaxException("Expected condition operand", token);
                }
                parts.add(cursor.next().text());
            }
            case LPAR -> {
                // "(IOPATH ..." or "(posedge ..." ends the equation, it does not open a group
                if (endsEquation(cursor.peek(1))) {
                    throw new SyntaxException("Expected condition operand", token);
                }
                parts.add(cursor.next().text());
                parseBinary(0);
                Token close = cursor.peek();
                if (!close.is(TokenType.RPAR)) {
                    throw new SyntaxException("Unbalanced parenthesis in condition, expected ')'", close);
                }
                parts.add(cursor.next().text());
            }
            default -> throw new SyntaxException("Expected condition operand", token);
        }
    }

    private static boolean endsEquation(Token token) {
        return token.is(Keyword.IOPATH) || token.is(Keyword.POSEDGE) || token.is(Keyword.NEGEDGE);
    }
}
