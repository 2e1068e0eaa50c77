package io.github.cyfko.entailql.core.impl;

import io.github.cyfko.entailql.core.api.Assignment;
import io.github.cyfko.entailql.core.api.Atomic;
import io.github.cyfko.entailql.core.api.CompiledPremise;
import io.github.cyfko.entailql.core.config.CachePolicy;
import io.github.cyfko.entailql.core.config.ParserPolicy;
import io.github.cyfko.entailql.core.exception.PremiseSyntaxException;
import io.github.cyfko.entailql.core.exception.SyntaxErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link BasicPremiseCompiler}: the full scan, parse and build pipeline.
 */
@DisplayName("BasicPremiseCompiler Tests")
class BasicPremiseCompilerTest {

    private BasicPremiseCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new BasicPremiseCompiler();
    }

    private static boolean a(Assignment v) { return v.valueOf(Atomic.A); }
    private static boolean b(Assignment v) { return v.valueOf(Atomic.B); }
    private static boolean c(Assignment v) { return v.valueOf(Atomic.C); }
    private static boolean d(Assignment v) { return v.valueOf(Atomic.D); }

    static Stream<Arguments> formulasWithOracle() {
        return Stream.of(
                Arguments.of("a", (Predicate<Assignment>) v -> a(v)),
                Arguments.of("~a", (Predicate<Assignment>) v -> !a(v)),
                Arguments.of("~~a", (Predicate<Assignment>) v -> a(v)),
                Arguments.of("a ^ b", (Predicate<Assignment>) v -> a(v) && b(v)),
                Arguments.of("a v b", (Predicate<Assignment>) v -> a(v) || b(v)),
                Arguments.of("a => b", (Predicate<Assignment>) v -> !a(v) || b(v)),
                Arguments.of("a v b ^ c", (Predicate<Assignment>) v -> a(v) || (b(v) && c(v))),
                Arguments.of("(a v b) ^ c", (Predicate<Assignment>) v -> (a(v) || b(v)) && c(v)),
                Arguments.of("a => b => c", (Predicate<Assignment>) v -> !(!a(v) || b(v)) || c(v)),
                Arguments.of("a => (b => c)", (Predicate<Assignment>) v -> !a(v) || !b(v) || c(v)),
                Arguments.of("~a ^ b", (Predicate<Assignment>) v -> !a(v) && b(v)),
                Arguments.of("~(a ^ b)", (Predicate<Assignment>) v -> !(a(v) && b(v))),
                Arguments.of("a ^ b => c v ~d", (Predicate<Assignment>) v -> !(a(v) && b(v)) || c(v) || !d(v)),
                Arguments.of("A V B ^ ~C => D", (Predicate<Assignment>) v -> !(a(v) || (b(v) && !c(v))) || d(v))
        );
    }

    @Nested
    @DisplayName("Semantics")
    class Semantics {

        @ParameterizedTest(name = "{0}")
        @MethodSource("io.github.cyfko.entailql.core.impl.BasicPremiseCompilerTest#formulasWithOracle")
        @DisplayName("Compiled premise agrees with the direct evaluation on every assignment")
        void testAgainstOracle(String formula, Predicate<Assignment> oracle) {
            CompiledPremise premise = compiler.compile(formula);

            Assignment.all().forEach(assignment ->
                    assertEquals(oracle.test(assignment), premise.holdsUnder(assignment),
                            () -> formula + " under " + assignment));
        }

        @Test
        @DisplayName("Compiling twice yields equivalent trees")
        void testIdempotence() {
            BasicPremiseCompiler uncached = new BasicPremiseCompiler(ParserPolicy.defaults(), CachePolicy.none());

            CompiledPremise first = uncached.compile("(a => b) ^ ~c");
            CompiledPremise second = uncached.compile("(a => b) ^ ~c");

            assertNotSame(first, second);
            assertEquals(first.expression(), second.expression());
            assertEquals(first.expression().truthTable(), second.expression().truthTable());
        }

        @Test
        @DisplayName("Double negation evaluates like the atomic itself")
        void testDoubleNegation() {
            assertEquals(compiler.compile("a").expression().truthTable(),
                    compiler.compile("~~a").expression().truthTable());
        }

        @Test
        @DisplayName("Upper-case input is accepted")
        void testCaseInsensitive() {
            assertEquals(compiler.compile("a v b").expression(), compiler.compile("A V B").expression());
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Canonical form drops only the outermost parentheses")
        void testCanonicalForm() {
            CompiledPremise premise = compiler.compile("A^B=>~C");

            assertEquals("(a ^ b) => ~c", premise.canonicalForm());
            assertEquals("a b ^ c ~ =>", premise.postfixForm());
            assertEquals("A^B=>~C", premise.source());
        }

        @Test
        @DisplayName("Negated and atomic roots are rendered as is")
        void testUnparenthesisedRoots() {
            assertEquals("~(a v b)", compiler.compile("~(a v b)").canonicalForm());
            assertEquals("a", compiler.compile("((a))").canonicalForm());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Example: () is an empty pair of parentheses at 0")
        void testEmptyParentheses() {
            PremiseSyntaxException e = assertThrows(PremiseSyntaxException.class, () -> compiler.compile("()"));

            assertEquals(SyntaxErrorKind.EMPTY_PARENTHESES, e.getKind());
            assertEquals(0, e.getPosition());
        }

        @Test
        @DisplayName("Example: 'a b' misses an operator at 2")
        void testMissingOperator() {
            PremiseSyntaxException e = assertThrows(PremiseSyntaxException.class, () -> compiler.compile("a b"));

            assertEquals(SyntaxErrorKind.MISSING_OPERATOR, e.getKind());
            assertEquals(2, e.getPosition());
        }

        @Test
        @DisplayName("Example: 'a ^' misses an operand for ^ at 2")
        void testMissingOperand() {
            PremiseSyntaxException e = assertThrows(PremiseSyntaxException.class, () -> compiler.compile("a ^"));

            assertEquals(SyntaxErrorKind.MISSING_OPERAND, e.getKind());
            assertEquals(2, e.getPosition());
        }

        @ParameterizedTest(name = "''{0}'' -> {1} at {2}")
        @CsvSource(delimiter = '|', value = {
                "^ a        | MISSING_OPERAND       | 0",
                "=> a ^ b   | MISSING_OPERAND       | 0",
                "^(         | UNMATCHED_OPEN_PAREN  | 1",
                "v a b      | MISSING_OPERATOR      | 4",
                "^ a )      | UNMATCHED_CLOSE_PAREN | 4",
                "=> (a      | UNMATCHED_OPEN_PAREN  | 3"
        })
        @DisplayName("Leading binary operator")
        void testLeadingBinaryOperator(String formula, SyntaxErrorKind kind, int position) {
            PremiseSyntaxException e = assertThrows(PremiseSyntaxException.class, () -> compiler.compile(formula));

            assertEquals(kind, e.getKind());
            assertEquals(position, e.getPosition());
        }

        @Test
        @DisplayName("Empty formula")
        void testEmpty() {
            PremiseSyntaxException e = assertThrows(PremiseSyntaxException.class, () -> compiler.compile(""));

            assertEquals(SyntaxErrorKind.EMPTY_EXPRESSION, e.getKind());
        }

        @Test
        @DisplayName("Null formula")
        void testNull() {
            assertThrows(NullPointerException.class, () -> compiler.compile(null));
        }

        @Test
        @DisplayName("Formula longer than the policy allows")
        void testTooLong() {
            BasicPremiseCompiler strict = new BasicPremiseCompiler(
                    ParserPolicy.builder().maxExpressionLength(5).build());

            PremiseSyntaxException e = assertThrows(PremiseSyntaxException.class, () -> strict.compile("a ^ b ^ c"));

            assertEquals(SyntaxErrorKind.EXPRESSION_TOO_LONG, e.getKind());
            assertTrue(e.getMessage().contains("CUSTOM_POLICY"));
            assertDoesNotThrow(() -> strict.compile("a ^ b"));
        }

        @Test
        @DisplayName("compileAll reports the index of the failing premise")
        void testCompileAllIndex() {
            PremiseSyntaxException e = assertThrows(PremiseSyntaxException.class,
                    () -> compiler.compileAll(List.of("a", "b c", "(")));

            assertEquals(1, e.getPremiseIndex().orElseThrow());
            assertEquals(SyntaxErrorKind.MISSING_OPERATOR, e.getKind());
            assertEquals(2, e.getPosition());
        }

        @Test
        @DisplayName("Constructor rejects missing policies")
        void testMissingPolicies() {
            assertThrows(IllegalArgumentException.class, () -> new BasicPremiseCompiler(null));
            assertThrows(IllegalArgumentException.class,
                    () -> new BasicPremiseCompiler(ParserPolicy.defaults(), null));
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("Same formula returns the cached premise")
        void testCacheHit() {
            CompiledPremise first = compiler.compile("a => b");
            CompiledPremise second = compiler.compile("a => b");

            assertSame(first, second);
            assertEquals(Map.of("enabled", true, "size", 1, "maxSize", 256, "hits", 1L, "misses", 1L),
                    compiler.getCacheStats());
        }

        @Test
        @DisplayName("Failed compilations are not cached")
        void testErrorsNotCached() {
            assertThrows(PremiseSyntaxException.class, () -> compiler.compile("a b"));
            assertThrows(PremiseSyntaxException.class, () -> compiler.compile("a b"));

            assertEquals(0, compiler.getCacheStats().get("size"));
            assertEquals(2L, compiler.getCacheStats().get("misses"));
        }

        @Test
        @DisplayName("clearCache empties the cache")
        void testClearCache() {
            compiler.compile("a");
            compiler.compile("a");
            compiler.clearCache();

            Map<String, Object> stats = compiler.getCacheStats();
            assertEquals(0, stats.get("size"));
            assertEquals(0L, stats.get("hits"));
            assertEquals(0L, stats.get("misses"));
        }

        @Test
        @DisplayName("Disabled cache")
        void testCacheDisabled() {
            BasicPremiseCompiler uncached = new BasicPremiseCompiler(ParserPolicy.defaults(), CachePolicy.none());

            assertEquals(Map.of("enabled", false), uncached.getCacheStats());
            assertNotSame(uncached.compile("a"), uncached.compile("a"));
        }
    }
}
