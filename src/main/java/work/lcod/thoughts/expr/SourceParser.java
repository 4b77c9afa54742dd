package work.lcod.thoughts.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for computation sources: an optional {@code def} header followed by
 * indented statements, or a bare statement sequence. Statements outside the restricted grammar
 * are parsed loosely and returned as {@link Statement.Unsupported}; expressions are parsed
 * strictly and any unsupported form raises {@link SourceParseException}.
 */
public final class SourceParser {
    private static final Set<String> BLOCK_KEYWORDS = Set.of(
        "if", "elif", "else", "for", "while", "try", "except", "finally", "with", "class", "async", "match"
    );
    private static final Set<String> SIMPLE_KEYWORDS = Set.of(
        "import", "from", "global", "nonlocal", "del", "assert", "raise", "yield", "await"
    );
    private static final Set<String> RESERVED = Set.of(
        "def", "return", "if", "elif", "else", "for", "while", "try", "except", "finally", "with",
        "class", "async", "import", "from", "global", "nonlocal", "del", "assert", "raise", "yield",
        "await", "lambda", "pass", "break", "continue", "and", "or", "not", "in", "is"
    );
    private static final Set<String> AUGMENTED = Set.of(
        "+=", "-=", "*=", "/=", "//=", "%=", "**=", "&=", "|=", "^=", ">>=", "<<=", "@="
    );

    private final List<Token> tokens;
    private int index;

    private SourceParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Program parseProgram(String source) {
        var parser = new SourceParser(new Lexer(source).tokenize());
        var statements = parser.statementsUntilEnd();
        return new Program(statements);
    }

    /**
     * Parses text holding exactly one expression (e.g. a step's canonical expression).
     */
    public static Expression parseExpression(String text) {
        var parser = new SourceParser(new Lexer(text).tokenize());
        var expression = parser.expressionList();
        while (parser.peek().type() == TokenType.NEWLINE) {
            parser.advance();
        }
        if (parser.peek().type() != TokenType.EOF) {
            throw parser.unexpected("end of expression");
        }
        return expression;
    }

    private List<Statement> statementsUntilEnd() {
        var statements = new ArrayList<Statement>();
        while (peek().type() != TokenType.EOF) {
            if (peek().type() == TokenType.NEWLINE) {
                advance();
                continue;
            }
            if (peek().type() == TokenType.INDENT) {
                throw unexpected("statement");
            }
            statements.addAll(statement());
        }
        return statements;
    }

    private List<Statement> block() {
        var statements = new ArrayList<Statement>();
        while (peek().type() != TokenType.DEDENT && peek().type() != TokenType.EOF) {
            if (peek().type() == TokenType.NEWLINE) {
                advance();
                continue;
            }
            statements.addAll(statement());
        }
        if (peek().type() == TokenType.DEDENT) {
            advance();
        }
        return statements;
    }

    private List<Statement> statement() {
        Token token = peek();
        if (token.isKeyword("def")) {
            return List.of(functionDefinition());
        }
        if (token.type() == TokenType.NAME && BLOCK_KEYWORDS.contains(token.text())) {
            return List.of(blockStatement());
        }
        if (token.isOp("@")) {
            skipToLineEnd();
            return List.of(new Statement.Unsupported("decorator", token.line()));
        }
        return simpleStatements();
    }

    private Statement functionDefinition() {
        Token def = advance();
        String name = expectName("function name");
        expectOp("(");
        var parameters = new ArrayList<String>();
        while (!peek().isOp(")")) {
            if (peek().isOp("*") || peek().isOp("**")) {
                advance();
                if (peek().type() == TokenType.NAME) {
                    advance();
                    skipParameterTail();
                }
            } else if (peek().isOp("/")) {
                advance();
            } else {
                String parameter = expectName("parameter name");
                skipParameterTail();
                if (!parameters.contains(parameter)) {
                    parameters.add(parameter);
                }
            }
            if (!peek().isOp(",")) {
                break;
            }
            advance();
        }
        expectOp(")");
        if (peek().isOp("->")) {
            advance();
            expression();
        }
        expectOp(":");
        var body = suite();
        return new Statement.FunctionDefinition(name, parameters, body, def.line());
    }

    private void skipParameterTail() {
        if (peek().isOp(":")) {
            advance();
            expression();
        }
        if (peek().isOp("=")) {
            advance();
            expression();
        }
    }

    private Statement blockStatement() {
        Token keyword = advance();
        int depth = 0;
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.NEWLINE || token.type() == TokenType.EOF) {
                throw unexpected("':'");
            }
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
            } else if (token.isOp(":") && depth == 0) {
                advance();
                break;
            }
            advance();
        }
        var body = suite();
        return new Statement.Unsupported(keyword.text() + " block", body, keyword.line());
    }

    private List<Statement> suite() {
        if (peek().type() == TokenType.NEWLINE) {
            advance();
            if (peek().type() != TokenType.INDENT) {
                throw unexpected("indented block");
            }
            advance();
            return block();
        }
        return simpleStatements();
    }

    private List<Statement> simpleStatements() {
        var statements = new ArrayList<Statement>();
        while (true) {
            statements.add(simpleStatement());
            if (peek().isOp(";")) {
                advance();
                if (atLineEnd()) {
                    break;
                }
                continue;
            }
            if (!atLineEnd()) {
                throw unexpected("end of statement");
            }
            break;
        }
        if (peek().type() == TokenType.NEWLINE) {
            advance();
        }
        return statements;
    }

    private Statement simpleStatement() {
        Token token = peek();
        int line = token.line();
        if (token.isKeyword("return")) {
            advance();
            if (atStatementEnd()) {
                return new Statement.Return(Optional.empty(), line);
            }
            return new Statement.Return(Optional.of(expressionList()), line);
        }
        if (token.isKeyword("pass") || token.isKeyword("break") || token.isKeyword("continue")) {
            advance();
            return new Statement.Unsupported(token.text(), line);
        }
        if (token.type() == TokenType.NAME && SIMPLE_KEYWORDS.contains(token.text())) {
            skipToStatementEnd();
            return new Statement.Unsupported(token.text(), line);
        }

        Expression first = expressionList();
        if (peek().isOp("=")) {
            var targets = new ArrayList<Expression>();
            targets.add(first);
            advance();
            Expression value = expressionList();
            while (peek().isOp("=")) {
                advance();
                targets.add(value);
                value = expressionList();
            }
            if (targets.size() > 1) {
                return new Statement.Unsupported("multi-target assignment", line);
            }
            if (first instanceof Expression.Name name) {
                return new Statement.Assignment(name.id(), value, line);
            }
            return new Statement.Unsupported(describeTarget(first) + " assignment", line);
        }
        if (peek().type() == TokenType.OP && AUGMENTED.contains(peek().text())) {
            advance();
            expressionList();
            return new Statement.Unsupported("augmented assignment", line);
        }
        if (peek().isOp(":")) {
            advance();
            expression();
            if (peek().isOp("=")) {
                advance();
                expressionList();
            }
            return new Statement.Unsupported("annotated assignment", line);
        }
        return new Statement.Unsupported("expression statement", line);
    }

    private String describeTarget(Expression target) {
        if (target instanceof Expression.TupleDisplay || target instanceof Expression.ListDisplay) {
            return "destructuring";
        }
        if (target instanceof Expression.Subscript) {
            return "subscript";
        }
        if (target instanceof Expression.Attribute) {
            return "attribute";
        }
        return "non-identifier";
    }

    // ---- expressions ---------------------------------------------------

    private Expression expressionList() {
        Expression first = expression();
        if (!peek().isOp(",")) {
            return first;
        }
        var elements = new ArrayList<Expression>();
        elements.add(first);
        while (peek().isOp(",")) {
            advance();
            if (atExpressionListEnd()) {
                break;
            }
            elements.add(expression());
        }
        return new Expression.TupleDisplay(elements);
    }

    private Expression expression() {
        if (peek().isKeyword("lambda")) {
            throw unsupported("lambda expressions");
        }
        Expression result = orTest();
        if (peek().isKeyword("if")) {
            throw unsupported("conditional expressions");
        }
        return result;
    }

    private Expression orTest() {
        Expression first = andTest();
        if (!peek().isKeyword("or")) {
            return first;
        }
        var values = new ArrayList<Expression>();
        values.add(first);
        while (peek().isKeyword("or")) {
            advance();
            values.add(andTest());
        }
        return new Expression.BoolOp(Expression.BoolOperator.OR, values);
    }

    private Expression andTest() {
        Expression first = notTest();
        if (!peek().isKeyword("and")) {
            return first;
        }
        var values = new ArrayList<Expression>();
        values.add(first);
        while (peek().isKeyword("and")) {
            advance();
            values.add(notTest());
        }
        return new Expression.BoolOp(Expression.BoolOperator.AND, values);
    }

    private Expression notTest() {
        if (peek().isKeyword("not")) {
            advance();
            return new Expression.Unary(Expression.UnaryOperator.NOT, notTest());
        }
        return comparison();
    }

    private Expression comparison() {
        Expression left = arithmetic();
        var operators = new ArrayList<Expression.ComparisonOperator>();
        var comparators = new ArrayList<Expression>();
        while (true) {
            Optional<Expression.ComparisonOperator> operator = comparisonOperator();
            if (operator.isEmpty()) {
                break;
            }
            operators.add(operator.get());
            comparators.add(arithmetic());
        }
        if (operators.isEmpty()) {
            return left;
        }
        return new Expression.Compare(left, operators, comparators);
    }

    private Optional<Expression.ComparisonOperator> comparisonOperator() {
        Token token = peek();
        if (token.type() == TokenType.OP) {
            var operator = switch (token.text()) {
                case "<" -> Expression.ComparisonOperator.LESS;
                case "<=" -> Expression.ComparisonOperator.LESS_EQUAL;
                case ">" -> Expression.ComparisonOperator.GREATER;
                case ">=" -> Expression.ComparisonOperator.GREATER_EQUAL;
                case "==" -> Expression.ComparisonOperator.EQUAL;
                case "!=" -> Expression.ComparisonOperator.NOT_EQUAL;
                default -> null;
            };
            if (operator != null) {
                advance();
            }
            return Optional.ofNullable(operator);
        }
        if (token.isKeyword("in")) {
            advance();
            return Optional.of(Expression.ComparisonOperator.IN);
        }
        if (token.isKeyword("not") && peekAt(1).isKeyword("in")) {
            advance();
            advance();
            return Optional.of(Expression.ComparisonOperator.NOT_IN);
        }
        if (token.isKeyword("is")) {
            advance();
            if (peek().isKeyword("not")) {
                advance();
                return Optional.of(Expression.ComparisonOperator.IS_NOT);
            }
            return Optional.of(Expression.ComparisonOperator.IS);
        }
        return Optional.empty();
    }

    private Expression arithmetic() {
        Expression left = term();
        while (true) {
            Expression.BinaryOperator operator;
            if (peek().isOp("+")) {
                operator = Expression.BinaryOperator.ADD;
            } else if (peek().isOp("-")) {
                operator = Expression.BinaryOperator.SUBTRACT;
            } else {
                return left;
            }
            advance();
            left = new Expression.Binary(operator, left, term());
        }
    }

    private Expression term() {
        Expression left = factor();
        while (true) {
            Expression.BinaryOperator operator;
            if (peek().isOp("*")) {
                operator = Expression.BinaryOperator.MULTIPLY;
            } else if (peek().isOp("/")) {
                operator = Expression.BinaryOperator.DIVIDE;
            } else if (peek().isOp("//")) {
                operator = Expression.BinaryOperator.FLOOR_DIVIDE;
            } else if (peek().isOp("%")) {
                operator = Expression.BinaryOperator.MODULO;
            } else if (peek().isOp("@")) {
                throw unsupported("matrix multiplication");
            } else {
                return left;
            }
            advance();
            left = new Expression.Binary(operator, left, factor());
        }
    }

    private Expression factor() {
        if (peek().isOp("-")) {
            advance();
            return new Expression.Unary(Expression.UnaryOperator.MINUS, factor());
        }
        if (peek().isOp("+")) {
            advance();
            return new Expression.Unary(Expression.UnaryOperator.PLUS, factor());
        }
        if (peek().isOp("~")) {
            throw unsupported("bitwise operators");
        }
        return power();
    }

    private Expression power() {
        Expression base = primary();
        if (peek().isOp("**")) {
            advance();
            return new Expression.Binary(Expression.BinaryOperator.POWER, base, factor());
        }
        return base;
    }

    private Expression primary() {
        Expression result = atom();
        while (true) {
            if (peek().isOp("(")) {
                advance();
                result = callArguments(result);
            } else if (peek().isOp("[")) {
                advance();
                if (peek().isOp(":")) {
                    throw unsupported("slices");
                }
                Expression index = expressionList();
                if (peek().isOp(":")) {
                    throw unsupported("slices");
                }
                expectOp("]");
                result = new Expression.Subscript(result, index);
            } else if (peek().isOp(".")) {
                advance();
                result = new Expression.Attribute(result, expectName("attribute name"));
            } else {
                return result;
            }
        }
    }

    private Expression callArguments(Expression function) {
        var arguments = new ArrayList<Expression>();
        var keywords = new ArrayList<Expression.Keyword>();
        while (!peek().isOp(")")) {
            if (peek().isOp("*") || peek().isOp("**")) {
                throw unsupported("argument unpacking");
            }
            if (peek().type() == TokenType.NAME && peekAt(1).isOp("=") && !RESERVED.contains(peek().text())) {
                String name = advance().text();
                advance();
                keywords.add(new Expression.Keyword(name, expression()));
            } else {
                if (!keywords.isEmpty()) {
                    throw unexpected("keyword argument");
                }
                arguments.add(expression());
                if (peek().isKeyword("for")) {
                    throw unsupported("generator expressions");
                }
            }
            if (!peek().isOp(",")) {
                break;
            }
            advance();
        }
        expectOp(")");
        return new Expression.Call(function, arguments, keywords);
    }

    private Expression atom() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER -> {
                advance();
                return Expression.NumberLiteral.of(token.text());
            }
            case STRING -> {
                var value = new StringBuilder();
                while (peek().type() == TokenType.STRING) {
                    value.append(advance().text());
                }
                return new Expression.StringLiteral(value.toString());
            }
            case NAME -> {
                advance();
                return switch (token.text()) {
                    case "True" -> new Expression.Constant(Expression.Constant.Kind.TRUE);
                    case "False" -> new Expression.Constant(Expression.Constant.Kind.FALSE);
                    case "None" -> new Expression.Constant(Expression.Constant.Kind.NONE);
                    default -> {
                        if (RESERVED.contains(token.text())) {
                            index--;
                            throw unexpected("expression");
                        }
                        yield new Expression.Name(token.text());
                    }
                };
            }
            case OP -> {
                if (token.isOp("(")) {
                    advance();
                    return parenthesized();
                }
                if (token.isOp("[")) {
                    advance();
                    return listDisplay();
                }
                if (token.isOp("{")) {
                    throw unsupported("dict and set displays");
                }
                throw unexpected("expression");
            }
            default -> throw unexpected("expression");
        }
    }

    private Expression parenthesized() {
        if (peek().isOp(")")) {
            advance();
            return new Expression.TupleDisplay(List.of());
        }
        Expression first = expression();
        if (peek().isKeyword("for")) {
            throw unsupported("generator expressions");
        }
        if (peek().isOp(")")) {
            advance();
            return first;
        }
        var elements = new ArrayList<Expression>();
        elements.add(first);
        while (peek().isOp(",")) {
            advance();
            if (peek().isOp(")")) {
                break;
            }
            elements.add(expression());
        }
        expectOp(")");
        return new Expression.TupleDisplay(elements);
    }

    private Expression listDisplay() {
        var elements = new ArrayList<Expression>();
        while (!peek().isOp("]")) {
            elements.add(expression());
            if (peek().isKeyword("for")) {
                throw unsupported("list comprehensions");
            }
            if (!peek().isOp(",")) {
                break;
            }
            advance();
        }
        expectOp("]");
        return new Expression.ListDisplay(elements);
    }

    // ---- token helpers -------------------------------------------------

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        int target = Math.min(index + offset, tokens.size() - 1);
        return tokens.get(target);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private boolean atLineEnd() {
        var type = peek().type();
        return type == TokenType.NEWLINE || type == TokenType.EOF || type == TokenType.DEDENT;
    }

    private boolean atStatementEnd() {
        return atLineEnd() || peek().isOp(";");
    }

    private boolean atExpressionListEnd() {
        Token token = peek();
        return atStatementEnd()
            || token.isOp("=")
            || token.isOp(")")
            || token.isOp("]")
            || token.isOp(":")
            || (token.type() == TokenType.OP && AUGMENTED.contains(token.text()));
    }

    private void skipToStatementEnd() {
        int depth = 0;
        while (!atLineEnd() && !(depth == 0 && peek().isOp(";"))) {
            Token token = advance();
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
            }
        }
    }

    private void skipToLineEnd() {
        while (!atLineEnd()) {
            advance();
        }
        if (peek().type() == TokenType.NEWLINE) {
            advance();
        }
    }

    private String expectName(String what) {
        Token token = peek();
        if (token.type() != TokenType.NAME || RESERVED.contains(token.text())) {
            throw unexpected(what);
        }
        advance();
        return token.text();
    }

    private void expectOp(String op) {
        if (!peek().isOp(op)) {
            throw unexpected("'" + op + "'");
        }
        advance();
    }

    private SourceParseException unexpected(String expected) {
        Token token = peek();
        return new SourceParseException(
            "expected " + expected + " but found " + token.describe(),
            token.line(),
            token.column()
        );
    }

    private SourceParseException unsupported(String what) {
        Token token = peek();
        return new SourceParseException("unsupported construct: " + what, token.line(), token.column());
    }
}
