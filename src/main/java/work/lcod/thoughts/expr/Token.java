package work.lcod.thoughts.expr;

record Token(TokenType type, String text, int line, int column) {
    boolean is(TokenType expected, String value) {
        return type == expected && text.equals(value);
    }

    boolean isOp(String value) {
        return is(TokenType.OP, value);
    }

    boolean isKeyword(String value) {
        return is(TokenType.NAME, value);
    }

    String describe() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case EOF -> "end of input";
            default -> "'" + text + "'";
        };
    }
}
