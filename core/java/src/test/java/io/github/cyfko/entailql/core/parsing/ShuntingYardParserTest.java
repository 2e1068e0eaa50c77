package io.github.cyfko.entailql.core.parsing;

import io.github.cyfko.entailql.core.exception.PremiseSyntaxException;
import io.github.cyfko.entailql.core.exception.SyntaxErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link ShuntingYardParser}: postfix ordering and positioned syntax errors.
 */
@DisplayName("ShuntingYardParser Tests")
class ShuntingYardParserTest {

    private final Scanner scanner = new Scanner();

    private String postfix(String expression) {
        return ShuntingYardParser.toPostfix(scanner.scan(expression)).stream()
                .map(Token::text)
                .collect(Collectors.joining(" "));
    }

    private PremiseSyntaxException parseError(String expression) {
        return assertThrows(PremiseSyntaxException.class, () -> postfix(expression));
    }

    @Nested
    @DisplayName("Valid Expressions - Conversion Tests")
    class ValidConversionTests {

        @ParameterizedTest(name = "''{0}'' -> ''{1}''")
        @CsvSource(delimiter = '|', value = {
                "a                 | a",
                "a ^ b             | a b ^",
                "a v b ^ c         | a b c ^ v",
                "(a v b) ^ c       | a b v c ^",
                "a => b => c       | a b => c =>",
                "a ^ b ^ c         | a b ^ c ^",
                "a v b v c         | a b v c v",
                "~a ^ b            | a ~ b ^",
                "a ^ ~b            | a b ~ ^",
                "~(a ^ b)          | a b ^ ~",
                "a => b v c ^ ~d   | a b c d ~ ^ v =>",
                "a ^ b => c        | a b ^ c =>",
                "((a))             | a",
                "(a => b) => c     | a b => c =>",
                "a => (b => c)     | a b c => =>"
        })
        void testConversion(String expression, String expected) {
            assertEquals(expected, postfix(expression));
        }

        @Test
        @DisplayName("Double negation: ~~a")
        void testDoubleNegation() {
            assertEquals("a ~ ~", postfix("~~a"));
        }

        @Test
        @DisplayName("Negation directly after a binary operator: a v ~~(b ^ c)")
        void testNegationAfterOperator() {
            assertEquals("a b c ^ ~ ~ v", postfix("a v ~~(b ^ c)"));
        }

        @Test
        @DisplayName("Output tokens keep their source positions")
        void testPositionsPreserved() {
            List<Token> tokens = ShuntingYardParser.toPostfix(scanner.scan("a ^ b"));

            assertEquals(List.of(0, 4, 2), tokens.stream().map(Token::position).toList());
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrors {

        @Test
        @DisplayName("Empty parentheses are reported at the opening parenthesis")
        void testEmptyParentheses() {
            PremiseSyntaxException e = parseError("()");

            assertEquals(SyntaxErrorKind.EMPTY_PARENTHESES, e.getKind());
            assertEquals(0, e.getPosition());
        }

        @Test
        @DisplayName("Nested empty parentheses: a ^ (())")
        void testNestedEmptyParentheses() {
            PremiseSyntaxException e = parseError("a ^ (())");

            assertEquals(SyntaxErrorKind.EMPTY_PARENTHESES, e.getKind());
            assertEquals(5, e.getPosition());
        }

        @Test
        @DisplayName("Adjacent atomics: a b")
        void testAdjacentAtomics() {
            PremiseSyntaxException e = parseError("a b");

            assertEquals(SyntaxErrorKind.MISSING_OPERATOR, e.getKind());
            assertEquals(2, e.getPosition());
            assertEquals("missing operator between 'a' and 'b'", e.getMessage());
        }

        @ParameterizedTest(name = "''{0}'' -> missing operator at {1}")
        @CsvSource(delimiter = '|', value = {
                "a (b)      | 2",
                "(a) b      | 4",
                "(a)(b)     | 3",
                "a ~b       | 2",
                "(a) ~b     | 4"
        })
        void testMissingOperator(String expression, int position) {
            PremiseSyntaxException e = parseError(expression);

            assertEquals(SyntaxErrorKind.MISSING_OPERATOR, e.getKind());
            assertEquals(position, e.getPosition());
        }

        @Test
        @DisplayName("Trailing operator: a ^")
        void testTrailingOperator() {
            PremiseSyntaxException e = parseError("a ^");

            assertEquals(SyntaxErrorKind.MISSING_OPERAND, e.getKind());
            assertEquals(2, e.getPosition());
            assertEquals("^", e.getToken());
            assertEquals("missing operand for '^'", e.getMessage());
        }

        @ParameterizedTest(name = "''{0}'' -> missing operand for ''{2}'' at {1}")
        @CsvSource(delimiter = '|', value = {
                "(a ^)      | 3 | ^",
                "(^ a)      | 1 | ^",
                "a ^ v b    | 2 | ^",
                "a => => b  | 2 | =>",
                "a ^ ~      | 4 | ~",
                "~          | 0 | ~",
                "(~)        | 1 | ~",
                "~ ^ a      | 0 | ~",
                "a v        | 2 | v"
        })
        void testMissingOperand(String expression, int position, String operator) {
            PremiseSyntaxException e = parseError(expression);

            assertEquals(SyntaxErrorKind.MISSING_OPERAND, e.getKind());
            assertEquals(position, e.getPosition());
            assertEquals(operator, e.getToken());
        }

        @ParameterizedTest(name = "''{0}'' -> unpaired closing parenthesis at {1}")
        @CsvSource(delimiter = '|', value = {
                "a)         | 1",
                "(a))       | 3",
                "a ^ b)     | 5"
        })
        void testUnmatchedCloseParen(String expression, int position) {
            PremiseSyntaxException e = parseError(expression);

            assertEquals(SyntaxErrorKind.UNMATCHED_CLOSE_PAREN, e.getKind());
            assertEquals(position, e.getPosition());
        }

        @ParameterizedTest(name = "''{0}'' -> unpaired opening parenthesis at {1}")
        @CsvSource(delimiter = '|', value = {
                "(a         | 0",
                "((a)       | 0",
                "a ^ (b v c | 4",
                "(a ^ (b)   | 0"
        })
        void testUnmatchedOpenParen(String expression, int position) {
            PremiseSyntaxException e = parseError(expression);

            assertEquals(SyntaxErrorKind.UNMATCHED_OPEN_PAREN, e.getKind());
            assertEquals(position, e.getPosition());
        }

        @Test
        @DisplayName("Leading binary operator is left to the tree builder")
        void testLeadingBinaryOperator() {
            assertEquals("a ^", postfix("^ a"));
            assertEquals("a b ^ =>", postfix("=> a ^ b"));
        }

        @ParameterizedTest(name = "''{0}'' -> {1} at {2}")
        @CsvSource(delimiter = '|', value = {
                "^(         | UNMATCHED_OPEN_PAREN  | 1",
                "v a b      | MISSING_OPERATOR      | 4",
                "^ a )      | UNMATCHED_CLOSE_PAREN | 4",
                "=> (a      | UNMATCHED_OPEN_PAREN  | 3"
        })
        void testLeadingBinaryOperatorLaterError(String expression, SyntaxErrorKind kind, int position) {
            PremiseSyntaxException e = parseError(expression);

            assertEquals(kind, e.getKind());
            assertEquals(position, e.getPosition());
        }

        @Test
        @DisplayName("Whitespace-only formula is an empty expression")
        void testWhitespaceOnly() {
            PremiseSyntaxException e = parseError("   ");

            assertEquals(SyntaxErrorKind.EMPTY_EXPRESSION, e.getKind());
            assertEquals(0, e.getPosition());
        }

        @Test
        @DisplayName("The first error in formula order wins")
        void testFirstErrorWins() {
            // The missing operator at 2 precedes the invalid character at 4.
            PremiseSyntaxException e = parseError("a b &");

            assertEquals(SyntaxErrorKind.MISSING_OPERATOR, e.getKind());
            assertEquals(2, e.getPosition());
        }
    }
}
