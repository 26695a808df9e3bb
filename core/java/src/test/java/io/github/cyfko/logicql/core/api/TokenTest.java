package io.github.cyfko.logicql.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.cyfko.logicql.core.api.Op.AND;
import static io.github.cyfko.logicql.core.api.Op.NOT;
import static io.github.cyfko.logicql.core.api.Op.OR;
import static io.github.cyfko.logicql.core.api.Operand.A;
import static io.github.cyfko.logicql.core.api.Operand.B;
import static io.github.cyfko.logicql.core.api.Token.LEFT_PAREN;
import static io.github.cyfko.logicql.core.api.Token.RIGHT_PAREN;
import static io.github.cyfko.logicql.core.api.Token.operator;
import static io.github.cyfko.logicql.core.api.Token.variable;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Token Tests")
class TokenTest {

    @Test
    @DisplayName("Equality is structural")
    void testEquality() {
        assertEquals(variable(A), new Token.Variable(A));
        assertEquals(operator(AND), new Token.Operator(AND));
        assertEquals(LEFT_PAREN, new Token.LeftParen());
        assertEquals(RIGHT_PAREN, new Token.RightParen());
        assertNotEquals(variable(A), variable(B));
        assertNotEquals(LEFT_PAREN, RIGHT_PAREN);
        assertEquals(variable(A).hashCode(), new Token.Variable(A).hashCode());
    }

    @Test
    @DisplayName("Labels match the chip text")
    void testLabels() {
        assertEquals("A", variable(A).label());
        assertEquals("&&", operator(AND).label());
        assertEquals("||", operator(OR).label());
        assertEquals("!", operator(NOT).label());
        assertEquals("(", LEFT_PAREN.label());
        assertEquals(")", RIGHT_PAREN.label());
    }

    @Test
    @DisplayName("Debug form names the case")
    void testToString() {
        assertEquals("Variable(A)", variable(A).toString());
        assertEquals("Operator(AND)", operator(AND).toString());
        assertEquals("LeftParen", LEFT_PAREN.toString());
        assertEquals("RightParen", RIGHT_PAREN.toString());
    }

    @Test
    @DisplayName("Payloads are required")
    void testNullPayload() {
        assertThrows(NullPointerException.class, () -> variable(null));
        assertThrows(NullPointerException.class, () -> operator(null));
    }

    @Test
    @DisplayName("Operator predicates")
    void testPredicates() {
        assertTrue(Token.isOperator(operator(NOT), NOT));
        assertFalse(Token.isOperator(operator(AND), NOT));
        assertFalse(Token.isOperator(null, NOT));
        assertTrue(Token.isBinaryOperator(operator(OR)));
        assertFalse(Token.isBinaryOperator(operator(NOT)));
        assertFalse(Token.isBinaryOperator(variable(A)));
        assertFalse(Token.isBinaryOperator(null));
    }

    @Test
    @DisplayName("Vocabulary lists every token once")
    void testVocabulary() {
        TokenVocabulary vocabulary = TokenVocabulary.standard();

        assertSame(vocabulary, TokenVocabulary.standard());
        assertEquals(5, vocabulary.operands().size());
        assertEquals(List.of(operator(AND), operator(OR), operator(NOT)), vocabulary.operators());
        assertEquals(List.of(LEFT_PAREN, RIGHT_PAREN), vocabulary.groupers());
        assertEquals(10, vocabulary.all().size());
        assertEquals(10, vocabulary.all().stream().distinct().count());
    }
}
