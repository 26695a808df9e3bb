package io.github.cyfko.logicql.core.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The fixed set of tokens a caller may offer on a palette.
 * <p>
 * Order is the palette order: operands {@code A, B, C, TRUE, FALSE}, then operators
 * {@code &&, ||, !}, then the grouping markers {@code (} and {@code )}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TokenVocabulary {

    private static final TokenVocabulary INSTANCE = new TokenVocabulary();

    private final List<Token.Variable> operands;
    private final List<Token.Operator> operators;
    private final List<Token> groupers;

    private TokenVocabulary() {
        this.operands = Arrays.stream(Operand.values())
                .map(Token::variable)
                .collect(Collectors.toUnmodifiableList());
        this.operators = List.of(Token.operator(Op.AND), Token.operator(Op.OR), Token.operator(Op.NOT));
        this.groupers = List.of(Token.LEFT_PAREN, Token.RIGHT_PAREN);
    }

    public static TokenVocabulary standard() {
        return INSTANCE;
    }

    public List<Token.Variable> operands() {
        return operands;
    }

    public List<Token.Operator> operators() {
        return operators;
    }

    public List<Token> groupers() {
        return groupers;
    }

    /**
     * Returns every token of the vocabulary in palette order.
     *
     * @return unmodifiable list of all tokens
     */
    public List<Token> all() {
        List<Token> all = new ArrayList<>(operands.size() + operators.size() + groupers.size());
        all.addAll(operands);
        all.addAll(operators);
        all.addAll(groupers);
        return List.copyOf(all);
    }
}
