package io.github.cyfko.logicql.core.parsing;

import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.config.EnginePolicy;
import io.github.cyfko.logicql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicql.core.exception.ParseError;
import io.github.cyfko.logicql.core.utils.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.cyfko.logicql.core.api.Op.AND;
import static io.github.cyfko.logicql.core.api.Op.NOT;
import static io.github.cyfko.logicql.core.api.Op.OR;
import static io.github.cyfko.logicql.core.api.Operand.A;
import static io.github.cyfko.logicql.core.api.Operand.B;
import static io.github.cyfko.logicql.core.api.Operand.TRUE;
import static io.github.cyfko.logicql.core.api.Token.LEFT_PAREN;
import static io.github.cyfko.logicql.core.api.Token.RIGHT_PAREN;
import static io.github.cyfko.logicql.core.api.Token.operator;
import static io.github.cyfko.logicql.core.api.Token.variable;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link TokenValidator}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("TokenValidator Tests")
class TokenValidatorTest {

    private static ValidationResult validate(String text) {
        return TokenValidator.validate(ExpressionLexer.tokenize(text), EnginePolicy.defaults());
    }

    @Nested
    @DisplayName("Valid Expressions")
    class ValidExpressionTests {

        @ParameterizedTest
        @DisplayName("Well-formed expressions pass")
        @ValueSource(strings = {
            "A", "TRUE", "!A", "!!A", "A && B", "A || B && C", "(A || B) && C",
            "!(A && B)", "((A))", "!(!A || FALSE)", "A && !B", "(A) || (B)"
        })
        void testValid(String text) {
            ValidationResult result = validate(text);
            assertTrue(result.isValid(), () -> text + " -> " + result);
            assertNull(result.getError());
            assertEquals(-1, result.getPosition());
        }

        @Test
        @DisplayName("Input list is not modified")
        void testInputUntouched() {
            List<Token> tokens = new ArrayList<>(List.of(variable(A), operator(AND), variable(B)));
            List<Token> snapshot = List.copyOf(tokens);

            TokenValidator.validate(tokens, EnginePolicy.defaults());

            assertEquals(snapshot, tokens);
        }
    }

    @Nested
    @DisplayName("Structural Errors")
    class StructuralErrorTests {

        @Test
        @DisplayName("Empty sequence")
        void testEmpty() {
            ValidationResult result = TokenValidator.validate(List.of(), EnginePolicy.defaults());
            assertFalse(result.isValid());
            assertEquals(ParseError.EMPTY_EXPRESSION, result.getError());
        }

        @ParameterizedTest
        @DisplayName("Rejected expressions report the expected error and position")
        @CsvSource(delimiter = ';', value = {
            "A B;            MISSING_OPERATOR;           0",
            "A (B);          MISSING_OPERATOR;           0",
            "(A) B;          MISSING_OPERATOR;           2",
            "(A)(B);         MISSING_OPERATOR;           2",
            "A && B TRUE;    MISSING_OPERATOR;           2",
            "&& A;           DANGLING_OPERATOR;          0",
            "A ||;           DANGLING_OPERATOR;          1",
            "A && || B;      INVALID_OPERATOR_PLACEMENT; 2",
            "(&& A);         INVALID_OPERATOR_PLACEMENT; 1",
            "! && A;         INVALID_OPERATOR_PLACEMENT; 0",
            "A && ! || B;    INVALID_OPERATOR_PLACEMENT; 2",
            "! || A;         INVALID_OPERATOR_PLACEMENT; 0"
        })
        void testRejected(String text, ParseError expected, int position) {
            ValidationResult result = validate(text);
            assertFalse(result.isValid());
            assertEquals(expected, result.getError(), () -> text + " -> " + result);
            assertEquals(position, result.getPosition());
            assertNotNull(result.getErrorMessage());
        }

        @Test
        @DisplayName("First violation wins")
        void testFirstViolationReported() {
            ValidationResult result = validate("A B && ||");
            assertEquals(ParseError.MISSING_OPERATOR, result.getError());
            assertEquals(0, result.getPosition());
        }

        @Test
        @DisplayName("Leading binary operator is dangling rather than misplaced")
        void testLeadingAnd() {
            ValidationResult result = TokenValidator.validate(List.of(operator(AND), variable(A)), EnginePolicy.defaults());
            assertEquals(ParseError.DANGLING_OPERATOR, result.getError());
        }

        @Test
        @DisplayName("Parenthesis balance is left to the converter")
        void testUnbalancedPassesValidation() {
            assertTrue(TokenValidator.validate(List.of(LEFT_PAREN, variable(A)), EnginePolicy.defaults()).isValid());
            assertTrue(TokenValidator.validate(List.of(variable(A), RIGHT_PAREN), EnginePolicy.defaults()).isValid());
        }
    }

    @Nested
    @DisplayName("Grouping Rules")
    class GroupingRuleTests {

        @Test
        @DisplayName("Empty group rejected under strict grouping")
        void testEmptyGroupStrict() {
            ValidationResult result = validate("A && ()");
            assertEquals(ParseError.EMPTY_GROUP, result.getError());
            assertEquals(2, result.getPosition());
        }

        @Test
        @DisplayName("Operator before ')' is dangling under strict grouping")
        void testOperatorBeforeClose() {
            assertEquals(ParseError.DANGLING_OPERATOR, validate("(A &&)").getError());
            assertEquals(ParseError.DANGLING_OPERATOR, validate("(A || !)").getError());
        }

        @Test
        @DisplayName("Trailing NOT is dangling under strict grouping")
        void testTrailingNot() {
            ValidationResult result = validate("A && !");
            assertEquals(ParseError.DANGLING_OPERATOR, result.getError());
            assertEquals(2, result.getPosition());
        }

        @Test
        @DisplayName("Relaxed policy leaves grouping errors to later stages")
        void testRelaxedPolicy() {
            EnginePolicy relaxed = EnginePolicy.relaxed();
            assertTrue(TokenValidator.validate(List.of(LEFT_PAREN, RIGHT_PAREN), relaxed).isValid());
            assertTrue(TokenValidator.validate(List.of(variable(A), operator(NOT)), relaxed).isValid());
            assertTrue(TokenValidator.validate(
                    List.of(LEFT_PAREN, variable(A), operator(OR), RIGHT_PAREN), relaxed).isValid());
        }
    }

    @Nested
    @DisplayName("Policy Limits")
    class PolicyLimitTests {

        @Test
        @DisplayName("Too many tokens")
        void testTooLong() {
            EnginePolicy policy = EnginePolicy.builder().maxTokenCount(3).build();
            List<Token> tokens = List.of(variable(A), operator(AND), variable(B), operator(OR), variable(TRUE));

            ValidationResult result = TokenValidator.validate(tokens, policy);

            assertEquals(ParseError.EXPRESSION_TOO_LONG, result.getError());
            assertTrue(result.getErrorMessage().contains("CUSTOM_POLICY"));
        }

        @Test
        @DisplayName("Exactly at the limit is accepted")
        void testAtLimit() {
            EnginePolicy policy = EnginePolicy.builder().maxTokenCount(3).build();
            assertTrue(TokenValidator.validate(List.of(variable(A), operator(AND), variable(B)), policy).isValid());
        }

        @Test
        @DisplayName("Long nested input is handled without recursion")
        void testDeepNesting() {
            int depth = 400;
            List<Token> tokens = new ArrayList<>(Collections.nCopies(depth, LEFT_PAREN));
            tokens.add(variable(A));
            tokens.addAll(Collections.nCopies(depth, RIGHT_PAREN));

            assertTrue(TokenValidator.validate(tokens, EnginePolicy.defaults()).isValid());
        }
    }

    @Test
    @DisplayName("requireValid throws the failing kind")
    void testRequireValid() {
        ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class,
                () -> TokenValidator.requireValid(List.of(variable(A), variable(B)), EnginePolicy.defaults()));
        assertEquals(ParseError.MISSING_OPERATOR, e.getError());
    }

    @Test
    @DisplayName("Null arguments rejected")
    void testNulls() {
        assertThrows(NullPointerException.class, () -> TokenValidator.validate(null, EnginePolicy.defaults()));
        assertThrows(NullPointerException.class, () -> TokenValidator.validate(List.of(variable(A)), null));
    }
}
