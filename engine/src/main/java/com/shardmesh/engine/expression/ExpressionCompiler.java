package com.shardmesh.engine.expression;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.shardmesh.engine.JsValues;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Compiles custom expressions written in the {@code CustomExpression} grammar into {@link Expr} trees.
 * Syntax errors, including any attempt at a call, surface as {@link ExpressionException}.
 */
public final class ExpressionCompiler {
    private static final int MAX_DEPTH = 64;

    private static final Map<String, Expr.BinaryOperator> BINARY = Map.ofEntries(
            Map.entry("+", Expr.BinaryOperator.ADD),
            Map.entry("-", Expr.BinaryOperator.SUBTRACT),
            Map.entry("*", Expr.BinaryOperator.MULTIPLY),
            Map.entry("/", Expr.BinaryOperator.DIVIDE),
            Map.entry("%", Expr.BinaryOperator.REMAINDER),
            Map.entry("<", Expr.BinaryOperator.LESS),
            Map.entry("<=", Expr.BinaryOperator.LESS_EQUAL),
            Map.entry(">", Expr.BinaryOperator.GREATER),
            Map.entry(">=", Expr.BinaryOperator.GREATER_EQUAL),
            Map.entry("==", Expr.BinaryOperator.EQUAL),
            Map.entry("!=", Expr.BinaryOperator.NOT_EQUAL),
            Map.entry("===", Expr.BinaryOperator.STRICT_EQUAL),
            Map.entry("!==", Expr.BinaryOperator.STRICT_NOT_EQUAL));

    private static final Map<String, Expr.UnaryOperator> UNARY = Map.of(
            "!", Expr.UnaryOperator.NOT,
            "-", Expr.UnaryOperator.NEGATE,
            "+", Expr.UnaryOperator.PLUS);

    private static final BaseErrorListener FAIL_ON_SYNTAX_ERROR = new BaseErrorListener() {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new ExpressionException("Syntax error at " + charPositionInLine + ": " + msg);
        }
    };

    private ExpressionCompiler() {
    }

    public static Expr compile(String source) {
        CustomExpressionLexer lexer = new CustomExpressionLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FAIL_ON_SYNTAX_ERROR);

        CustomExpressionParser parser = new CustomExpressionParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FAIL_ON_SYNTAX_ERROR);

        return new TreeBuilder().visit(parser.parse().expression());
    }

    /**
     * Maps parse-tree contexts onto the closed {@link Expr} node set. Not thread-safe; one per compile.
     */
    private static final class TreeBuilder extends CustomExpressionBaseVisitor<Expr> {
        private int depth;

        @Override
        public Expr visitPrimaryExpression(CustomExpressionParser.PrimaryExpressionContext ctx) {
            return visit(ctx.primary());
        }

        @Override
        public Expr visitMemberExpression(CustomExpressionParser.MemberExpressionContext ctx) {
            return new Expr.Member(visit(ctx.expression()), ctx.propertyName().getText());
        }

        @Override
        public Expr visitUnaryExpression(CustomExpressionParser.UnaryExpressionContext ctx) {
            return nested(() -> new Expr.Unary(UNARY.get(ctx.op.getText()), visit(ctx.expression())));
        }

        @Override
        public Expr visitMultiplicativeExpression(CustomExpressionParser.MultiplicativeExpressionContext ctx) {
            return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
        }

        @Override
        public Expr visitAdditiveExpression(CustomExpressionParser.AdditiveExpressionContext ctx) {
            return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
        }

        @Override
        public Expr visitRelationalExpression(CustomExpressionParser.RelationalExpressionContext ctx) {
            return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
        }

        @Override
        public Expr visitEqualityExpression(CustomExpressionParser.EqualityExpressionContext ctx) {
            return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
        }

        @Override
        public Expr visitAndExpression(CustomExpressionParser.AndExpressionContext ctx) {
            return new Expr.Logical(true, visit(ctx.expression(0)), visit(ctx.expression(1)));
        }

        @Override
        public Expr visitOrExpression(CustomExpressionParser.OrExpressionContext ctx) {
            return new Expr.Logical(false, visit(ctx.expression(0)), visit(ctx.expression(1)));
        }

        @Override
        public Expr visitConditionalExpression(CustomExpressionParser.ConditionalExpressionContext ctx) {
            return nested(() -> new Expr.Conditional(
                    visit(ctx.expression(0)), visit(ctx.expression(1)), visit(ctx.expression(2))));
        }

        @Override
        public Expr visitNumberLiteral(CustomExpressionParser.NumberLiteralContext ctx) {
            String text = ctx.NUMBER().getText();
            try {
                return new Expr.Literal(JsValues.numberNode(Double.parseDouble(text)));
            } catch (NumberFormatException e) {
                throw new ExpressionException("Malformed number '" + text + "'");
            }
        }

        @Override
        public Expr visitStringLiteral(CustomExpressionParser.StringLiteralContext ctx) {
            return new Expr.Literal(TextNode.valueOf(unquote(ctx.STRING().getText())));
        }

        @Override
        public Expr visitTrueLiteral(CustomExpressionParser.TrueLiteralContext ctx) {
            return new Expr.Literal(BooleanNode.TRUE);
        }

        @Override
        public Expr visitFalseLiteral(CustomExpressionParser.FalseLiteralContext ctx) {
            return new Expr.Literal(BooleanNode.FALSE);
        }

        @Override
        public Expr visitNullLiteral(CustomExpressionParser.NullLiteralContext ctx) {
            return new Expr.Literal(NullNode.getInstance());
        }

        @Override
        public Expr visitUndefinedLiteral(CustomExpressionParser.UndefinedLiteralContext ctx) {
            return new Expr.Literal(JsValues.undefined());
        }

        @Override
        public Expr visitReference(CustomExpressionParser.ReferenceContext ctx) {
            return new Expr.Reference(ctx.IDENTIFIER().getText());
        }

        @Override
        public Expr visitParenthesized(CustomExpressionParser.ParenthesizedContext ctx) {
            return nested(() -> visit(ctx.expression()));
        }

        private Expr binary(String operator, CustomExpressionParser.ExpressionContext left,
                            CustomExpressionParser.ExpressionContext right) {
            return new Expr.Binary(BINARY.get(operator), visit(left), visit(right));
        }

        private Expr nested(Supplier<Expr> inner) {
            if (++depth > MAX_DEPTH) {
                throw new ExpressionException("Expression nested deeper than " + MAX_DEPTH);
            }
            try {
                return inner.get();
            } finally {
                depth--;
            }
        }
    }

    private static String unquote(String quoted) {
        StringBuilder text = new StringBuilder(quoted.length());
        for (int i = 1; i < quoted.length() - 1; i++) {
            char c = quoted.charAt(i);
            if (c != '\\') {
                text.append(c);
                continue;
            }
            char escaped = quoted.charAt(++i);
            switch (escaped) {
                case 'n' -> text.append('\n');
                case 't' -> text.append('\t');
                case 'r' -> text.append('\r');
                default -> text.append(escaped);
            }
        }
        return text.toString();
    }
}
