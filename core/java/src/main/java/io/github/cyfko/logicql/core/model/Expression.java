package io.github.cyfko.logicql.core.model;

import io.github.cyfko.logicql.core.api.Operand;
import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.parsing.ExpressionLexer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An ordered, immutable sequence of {@link Token}s as assembled by the caller.
 * <p>
 * The sequence is exactly what validation and conversion operate on: no implicit token is
 * ever inserted. Editing operations mirror what a token lane offers (append, insert at a
 * drop position, reorder, remove, clear) and each returns a new instance.
 * </p>
 *
 * <pre>{@code
 * Expression expr = Expression.empty()
 *     .append(Token.variable(Operand.A))
 *     .append(Token.operator(Op.AND))
 *     .append(Token.variable(Operand.B));
 *
 * expr.toString();        // "A && B"
 * expr.usedVariables();   // [A, B]
 * expr.move(2, 0);        // "B A &&"
 * }</pre>
 *
 * @param tokens the tokens, in surface order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Expression(List<Token> tokens) {

    private static final Expression EMPTY = new Expression(List.of());

    /**
     * Canonical constructor; copies the token list.
     *
     * @throws NullPointerException if {@code tokens} or any token is null
     */
    public Expression {
        tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens cannot be null"));
    }

    public static Expression empty() {
        return EMPTY;
    }

    public static Expression of(Token... tokens) {
        return new Expression(List.of(tokens));
    }

    /**
     * Builds an expression from its textual form.
     *
     * @param text expression text such as {@code "!(A && B) || C"}
     * @return the tokenized expression
     * @throws io.github.cyfko.logicql.core.exception.ExpressionSyntaxException on unrecognized text
     */
    public static Expression parse(String text) {
        return new Expression(ExpressionLexer.tokenize(text));
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Expression append(Token token) {
        return insert(tokens.size(), token);
    }

    /**
     * Inserts a token so that it ends up at {@code index}.
     *
     * @param index position in {@code [0, size()]}
     * @param token the token to insert
     * @return a new expression
     * @throws IndexOutOfBoundsException if {@code index} is out of range
     */
    public Expression insert(int index, Token token) {
        Objects.requireNonNull(token, "token cannot be null");
        List<Token> copy = new ArrayList<>(tokens);
        copy.add(index, token);
        return new Expression(copy);
    }

    /**
     * Removes the token at {@code index}.
     *
     * @param index position in {@code [0, size())}
     * @return a new expression
     * @throws IndexOutOfBoundsException if {@code index} is out of range
     */
    public Expression remove(int index) {
        List<Token> copy = new ArrayList<>(tokens);
        copy.remove(index);
        return new Expression(copy);
    }

    /**
     * Moves the token at {@code from} to {@code to}.
     * <p>
     * The token is first removed, then inserted at {@code to} in the shortened sequence.
     * </p>
     *
     * @param from current index, in {@code [0, size())}
     * @param to   target index, in {@code [0, size())}
     * @return a new expression
     * @throws IndexOutOfBoundsException if an index is out of range
     */
    public Expression move(int from, int to) {
        List<Token> copy = new ArrayList<>(tokens);
        Token moved = copy.remove(from);
        copy.add(to, moved);
        return new Expression(copy);
    }

    public Expression clear() {
        return EMPTY;
    }

    /**
     * Lists the distinct free variables occurring in this expression, in ascending order.
     *
     * @return the used variables, possibly empty
     */
    public List<Operand> usedVariables() {
        Set<Operand> used = EnumSet.noneOf(Operand.class);
        for (Token token : tokens) {
            if (token instanceof Token.Variable variable && !variable.name().isConstant()) {
                used.add(variable.name());
            }
        }
        return List.copyOf(used);
    }

    @Override
    public String toString() {
        return tokens.stream().map(Token::label).collect(Collectors.joining(" "));
    }
}
