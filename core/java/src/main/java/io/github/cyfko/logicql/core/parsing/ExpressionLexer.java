package io.github.cyfko.logicql.core.parsing;

import io.github.cyfko.logicql.core.api.Op;
import io.github.cyfko.logicql.core.api.Operand;
import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicql.core.exception.ParseError;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns the textual form of an expression into tokens.
 * <p>
 * Accepted text is exactly what {@link io.github.cyfko.logicql.core.model.Expression#toString()}
 * renders: operand names ({@code A}, {@code B}, {@code C}, {@code TRUE}, {@code FALSE}, any
 * case), {@code !}, {@code &&}, {@code ||}, {@code (} and {@code )}. Whitespace is ignored.
 * </p>
 *
 * <pre>{@code
 * ExpressionLexer.tokenize("!(A && b) || TRUE");
 * // [Operator(NOT), LeftParen, Variable(A), Operator(AND), Variable(B), RightParen,
 * //  Operator(OR), Variable(TRUE)]
 * }</pre>
 *
 * <p>
 * The lexer produces tokens only. It does not check structure: {@code "A B"} lexes fine and
 * is rejected later by {@link TokenValidator}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionLexer {

    private ExpressionLexer() {}

    /**
     * Tokenizes an expression.
     *
     * @param text the expression text; blank text yields an empty list
     * @return the tokens in surface order
     * @throws ExpressionSyntaxException with {@link ParseError#UNKNOWN_TOKEN} on unrecognized text
     * @throws NullPointerException if {@code text} is null
     */
    public static List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "expression text cannot be null");

        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            switch (c) {
                case '(' -> {
                    tokens.add(Token.LEFT_PAREN);
                    i++;
                }
                case ')' -> {
                    tokens.add(Token.RIGHT_PAREN);
                    i++;
                }
                case '!' -> {
                    tokens.add(Token.operator(Op.NOT));
                    i++;
                }
                case '&', '|' -> {
                    if (i + 1 >= text.length() || text.charAt(i + 1) != c) {
                        throw new ExpressionSyntaxException(ParseError.UNKNOWN_TOKEN, String.format(
                                "Unknown token '%c' at position %d, expected '%c%c'", c, i, c, c));
                    }
                    tokens.add(Token.operator(c == '&' ? Op.AND : Op.OR));
                    i += 2;
                }
                default -> {
                    if (!Character.isLetter(c)) {
                        throw new ExpressionSyntaxException(ParseError.UNKNOWN_TOKEN, String.format(
                                "Unknown token '%c' at position %d", c, i));
                    }
                    int start = i;
                    while (i < text.length() && Character.isLetter(text.charAt(i))) {
                        i++;
                    }
                    tokens.add(Token.variable(operand(text.substring(start, i), start)));
                }
            }
        }
        return tokens;
    }

    private static Operand operand(String word, int position) {
        try {
            return Operand.fromString(word);
        } catch (IllegalArgumentException e) {
            throw new ExpressionSyntaxException(ParseError.UNKNOWN_TOKEN, String.format(
                    "Unknown operand '%s' at position %d. Operands are %s",
                    word, position, List.of(Operand.values())), e);
        }
    }
}
