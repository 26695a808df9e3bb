package io.github.cyfko.logicql.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.logicql.core.api.Op;
import io.github.cyfko.logicql.core.api.Operand;
import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.model.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON interchange form of tokens, used when a token crosses a transport boundary
 * (for instance the payload of a drag operation).
 * <p>
 * A token is written as its tag plus its payload; grouping tokens have no payload.
 * </p>
 *
 * <table border="1">
 * <caption>Interchange form</caption>
 * <thead><tr><th>Token</th><th>JSON</th></tr></thead>
 * <tbody>
 * <tr><td>{@code Variable(A)}</td><td>{@code {"type":"VAR","value":"A"}}</td></tr>
 * <tr><td>{@code Operator(AND)}</td><td>{@code {"type":"OP","value":"&&"}}</td></tr>
 * <tr><td>{@code LeftParen}</td><td>{@code {"type":"LPAREN"}}</td></tr>
 * <tr><td>{@code RightParen}</td><td>{@code {"type":"RPAREN"}}</td></tr>
 * </tbody>
 * </table>
 *
 * <p>An {@link Expression} is written as a JSON array of tokens.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The shared {@link ObjectMapper} is only used for tree reads and writes, which are
 * thread-safe once the mapper is configured.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TokenCodec {

    static final String TYPE = "type";
    static final String VALUE = "value";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TokenCodec() {}

    /**
     * Serializes one token.
     *
     * @param token the token
     * @return its JSON form
     */
    public static String write(Token token) {
        return serialize(toNode(token));
    }

    /**
     * Serializes an expression as a JSON array.
     *
     * @param expression the expression
     * @return its JSON form
     */
    public static String writeExpression(Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        ArrayNode array = MAPPER.createArrayNode();
        for (Token token : expression.tokens()) {
            array.add(toNode(token));
        }
        return serialize(array);
    }

    /**
     * Reads one token.
     *
     * @param json the JSON form
     * @return the token
     * @throws IllegalArgumentException if the payload is not a valid token
     */
    public static Token read(String json) {
        return fromNode(parse(json));
    }

    /**
     * Reads an expression from a JSON array of tokens.
     *
     * @param json the JSON form
     * @return the expression
     * @throws IllegalArgumentException if the payload is not an array of valid tokens
     */
    public static Expression readExpression(String json) {
        JsonNode node = parse(json);
        if (!node.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array of tokens, got: " + node.getNodeType());
        }
        List<Token> tokens = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            tokens.add(fromNode(element));
        }
        return new Expression(tokens);
    }

    static ObjectNode toNode(Token token) {
        Objects.requireNonNull(token, "token cannot be null");
        ObjectNode node = MAPPER.createObjectNode();
        if (token instanceof Token.Variable variable) {
            node.put(TYPE, TokenType.VAR.name());
            node.put(VALUE, variable.name().name());
        } else if (token instanceof Token.Operator operator) {
            node.put(TYPE, TokenType.OP.name());
            node.put(VALUE, operator.kind().getSymbol());
        } else if (token instanceof Token.LeftParen) {
            node.put(TYPE, TokenType.LPAREN.name());
        } else {
            node.put(TYPE, TokenType.RPAREN.name());
        }
        return node;
    }

    static Token fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Token must be a JSON object, got: " + node);
        }
        TokenType type = TokenType.of(node.path(TYPE).asText(null));
        return switch (type) {
            case VAR -> Token.variable(Operand.fromString(requireValue(node, type)));
            case OP -> Token.operator(Op.fromString(requireValue(node, type)));
            case LPAREN -> Token.LEFT_PAREN;
            case RPAREN -> Token.RIGHT_PAREN;
        };
    }

    private static String requireValue(JsonNode node, TokenType type) {
        JsonNode value = node.get(VALUE);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("Token of type " + type + " requires a textual '" + VALUE + "'");
        }
        return value.asText();
    }

    private static JsonNode parse(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed token payload: " + e.getOriginalMessage(), e);
        }
    }

    private static String serialize(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize token payload", e);
        }
    }

    /**
     * Tags of the interchange form.
     */
    enum TokenType {
        VAR,
        OP,
        LPAREN,
        RPAREN;

        static TokenType of(String tag) {
            if (tag == null) {
                throw new IllegalArgumentException("Token payload has no '" + TYPE + "'");
            }
            for (TokenType type : values()) {
                if (type.name().equals(tag)) return type;
            }
            throw new IllegalArgumentException("Unknown token type: '" + tag + "'");
        }
    }
}
