package work.lcod.thoughts.expr;

/**
 * Lexical categories produced by {@link Lexer}.
 */
enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
}
