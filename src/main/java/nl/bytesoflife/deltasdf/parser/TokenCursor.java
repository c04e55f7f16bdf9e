package nl.bytesoflife.deltasdf.parser;

import nl.bytesoflife.deltasdf.SyntaxException;
import nl.bytesoflife.deltasdf.lexer.Keyword;
import nl.bytesoflife.deltasdf.lexer.Token;
import nl.bytesoflife.deltasdf.lexer.TokenType;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Pulls tokens from the lexer on demand and buffers the few needed for lookahead.
 */
class TokenCursor {

    private final Iterator<Token> source;
    private final List<Token> buffer = new ArrayList<>();
    private Token last;

    TokenCursor(Iterator<Token> source) {
        this.source = source;
    }

    Token peek() {
        return peek(0);
    }

    Token peek(int ahead) {
        while (buffer.size() <= ahead) {
            if (source.hasNext()) {
                last = source.next();
                buffer.add(last);
            } else {
                // the lexer ends with EOF; keep returning it
                buffer.add(last);
            }
        }
        return buffer.get(ahead);
    }

    Token next() {
        Token token = peek();
        buffer.remove(0);
        return token;
    }

    boolean at(TokenType type) {
        return peek().is(type);
    }

    /**
     * True when the next two tokens are '(' and the given keyword.
     */
    boolean atOpen(Keyword keyword) {
        return peek().is(TokenType.LPAR) && peek(1).is(keyword);
    }

    Token expect(TokenType type, String what) {
        Token token = peek();
        if (!token.is(type)) {
            throw new SyntaxException("Expected " + what, token);
        }
        return next();
    }

    Token expect(Keyword keyword) {
        Token token = peek();
        if (!token.is(keyword)) {
            throw new SyntaxException("Expected " + keyword.text(), token);
        }
        return next();
    }

    void open(Keyword keyword) {
        expect(TokenType.LPAR, "'('");
        expect(keyword);
    }

    void close() {
        expect(TokenType.RPAR, "')'");
    }
}
