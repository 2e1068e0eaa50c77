package io.github.cyfko.entailql.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Policy Tests")
class PolicyTest {

    @Nested
    @DisplayName("ParserPolicy")
    class ParserPolicyTests {

        @Test
        @DisplayName("Presets")
        void testPresets() {
            assertEquals(5000, ParserPolicy.defaults().maxExpressionLength());
            assertEquals(1000, ParserPolicy.strict().maxExpressionLength());
            assertEquals(10000, ParserPolicy.relaxed().maxExpressionLength());
            assertEquals("STRICT_POLICY", ParserPolicy.strict().policyName());
        }

        @Test
        @DisplayName("Builder starts from the defaults")
        void testBuilder() {
            ParserPolicy policy = ParserPolicy.builder().build();

            assertEquals("CUSTOM_POLICY", policy.policyName());
            assertEquals(5000, policy.maxExpressionLength());
            assertEquals(42, ParserPolicy.builder().maxExpressionLength(42).build().maxExpressionLength());
        }

        @Test
        @DisplayName("Invalid values are rejected")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new ParserPolicy("p", 0));
            assertThrows(IllegalArgumentException.class, () -> new ParserPolicy(" ", 10));
            assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().policyName(null).build());
        }
    }

    @Nested
    @DisplayName("CachePolicy")
    class CachePolicyTests {

        @Test
        @DisplayName("Presets")
        void testPresets() {
            assertTrue(CachePolicy.defaults().cacheEnabled());
            assertFalse(CachePolicy.none().cacheEnabled());
            assertEquals(32, CachePolicy.custom(32).cacheSize());
        }

        @Test
        @DisplayName("Size must be positive")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> CachePolicy.custom(0));
        }
    }

    @Test
    @DisplayName("EnumerationPolicy presets")
    void testEnumerationPolicy() {
        assertFalse(EnumerationPolicy.sequential().parallelEnabled());
        assertTrue(EnumerationPolicy.parallel().parallelEnabled());
    }
}
