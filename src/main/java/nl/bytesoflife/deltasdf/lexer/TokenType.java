package nl.bytesoflife.deltasdf.lexer;

public enum TokenType {
    LPAR,
    RPAR,
    COLON,
    QSTRING,
    NUMBER,
    BASED_NUMBER,
    KEYWORD,
    IDENTIFIER,
    OPERATOR,
    EOF
}
