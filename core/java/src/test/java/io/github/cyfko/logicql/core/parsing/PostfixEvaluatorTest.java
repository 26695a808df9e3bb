package io.github.cyfko.logicql.core.parsing;

import io.github.cyfko.logicql.core.api.Environment;
import io.github.cyfko.logicql.core.api.Operand;
import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicql.core.exception.ParseError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.github.cyfko.logicql.core.api.Op.AND;
import static io.github.cyfko.logicql.core.api.Op.NOT;
import static io.github.cyfko.logicql.core.api.Op.OR;
import static io.github.cyfko.logicql.core.api.Operand.A;
import static io.github.cyfko.logicql.core.api.Operand.B;
import static io.github.cyfko.logicql.core.api.Operand.C;
import static io.github.cyfko.logicql.core.api.Operand.FALSE;
import static io.github.cyfko.logicql.core.api.Operand.TRUE;
import static io.github.cyfko.logicql.core.api.Token.LEFT_PAREN;
import static io.github.cyfko.logicql.core.api.Token.operator;
import static io.github.cyfko.logicql.core.api.Token.variable;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Test suite for {@link PostfixEvaluator}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("PostfixEvaluator Tests")
class PostfixEvaluatorTest {

    private static boolean eval(String infix, Environment env) {
        return PostfixEvaluator.evaluate(PostfixConverter.toPostfix(ExpressionLexer.tokenize(infix)), env);
    }

    @Nested
    @DisplayName("Evaluation")
    class EvaluationTests {

        @ParameterizedTest(name = "{0} with A={1}, B={2}, C={3} -> {4}")
        @CsvSource(delimiter = ';', value = {
            "A;                  true;  false; false; true",
            "A && B;             true;  false; false; false",
            "A && B;             true;  true;  false; true",
            "A || B;             false; false; false; false",
            "A || B;             false; true;  false; true",
            "!A;                 false; false; false; true",
            "!!A;                true;  false; false; true",
            "!!A;                false; false; false; false",
            "(A || B) && C;      false; true;  true;  true",
            "(A || B) && C;      false; true;  false; false",
            "A || B && C;        true;  false; false; true",
            "!(A && B) || C;     true;  true;  false; false",
            "TRUE && A;          true;  false; false; true",
            "FALSE || !TRUE;     true;  true;  true;  false"
        })
        void testEvaluate(String infix, boolean a, boolean b, boolean c, boolean expected) {
            Environment env = Environment.of(Map.of(A, a, B, b, C, c));
            assertEquals(expected, eval(infix, env));
        }

        @Test
        @DisplayName("Unbound variables read as false")
        void testMissingBinding() {
            assertFalse(eval("A || B || C", Environment.none()));
            assertTrue(eval("!C", Environment.of(Map.of(A, true))));
        }

        @Test
        @DisplayName("Operand order follows the stack: left pushed first")
        void testOperandOrder() {
            List<Token> postfix = List.of(variable(TRUE), variable(FALSE), operator(AND));
            assertFalse(PostfixEvaluator.evaluate(postfix, Environment.none()));
        }

        @Test
        @DisplayName("Repeated calls give identical results")
        void testDeterministic() {
            List<Token> postfix = PostfixConverter.toPostfix(ExpressionLexer.tokenize("(A || !B) && C"));
            Environment env = Environment.of(Map.of(A, false, B, false, C, true));
            List<Token> snapshot = new ArrayList<>(postfix);

            boolean first = PostfixEvaluator.evaluate(postfix, env);
            boolean second = PostfixEvaluator.evaluate(postfix, env);

            assertEquals(first, second);
            assertEquals(snapshot, postfix);
        }
    }

    @Nested
    @DisplayName("Environment Lookups")
    class EnvironmentLookupTests {

        @Mock
        private Environment environment;

        @BeforeEach
        void setUp() {
            MockitoAnnotations.openMocks(this);
            when(environment.valueOf(any(Operand.class))).thenReturn(true);
        }

        @Test
        @DisplayName("Constants are never looked up")
        void testConstantsNotLookedUp() {
            boolean value = eval("TRUE && !FALSE", environment);

            assertTrue(value);
            verifyNoInteractions(environment);
        }

        @Test
        @DisplayName("Free variables are looked up once per occurrence")
        void testFreeVariablesLookedUp() {
            eval("A && (A || B) && TRUE", environment);

            verify(environment, times(2)).valueOf(A);
            verify(environment, times(1)).valueOf(B);
            verify(environment, never()).valueOf(TRUE);
            verifyNoMoreInteractions(environment);
        }
    }

    @Nested
    @DisplayName("Malformed Postfix")
    class MalformedPostfixTests {

        @Test
        @DisplayName("NOT without operand")
        void testNotUnderflow() {
            ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class,
                    () -> PostfixEvaluator.evaluate(List.of(operator(NOT)), Environment.none()));
            assertEquals(ParseError.INCOMPLETE_EXPRESSION, e.getError());
        }

        @Test
        @DisplayName("Binary operator with one operand")
        void testBinaryUnderflow() {
            ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class,
                    () -> PostfixEvaluator.evaluate(List.of(variable(A), operator(OR)), Environment.none()));
            assertEquals(ParseError.INCOMPLETE_EXPRESSION, e.getError());
            assertTrue(e.getMessage().contains("OR"));
        }

        @Test
        @DisplayName("Empty postfix leaves no value")
        void testEmpty() {
            ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class,
                    () -> PostfixEvaluator.evaluate(List.of(), Environment.none()));
            assertEquals(ParseError.INCOMPLETE_EXPRESSION, e.getError());
        }

        @Test
        @DisplayName("Several values left on the stack")
        void testLeftovers() {
            ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class,
                    () -> PostfixEvaluator.evaluate(List.of(variable(A), variable(B)), Environment.none()));
            assertEquals(ParseError.INCOMPLETE_EXPRESSION, e.getError());
            assertTrue(e.getMessage().contains("2"));
        }

        @Test
        @DisplayName("Grouping marker is an unknown operator")
        void testGroupingMarker() {
            ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class,
                    () -> PostfixEvaluator.evaluate(List.of(variable(A), LEFT_PAREN), Environment.none()));
            assertEquals(ParseError.UNKNOWN_OPERATOR, e.getError());
        }
    }

    @Test
    @DisplayName("Null arguments rejected")
    void testNulls() {
        assertThrows(NullPointerException.class, () -> PostfixEvaluator.evaluate(null, Environment.none()));
        assertThrows(NullPointerException.class, () -> PostfixEvaluator.evaluate(List.of(variable(A)), null));
    }
}
