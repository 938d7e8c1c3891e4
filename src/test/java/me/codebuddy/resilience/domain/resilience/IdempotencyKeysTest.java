package me.codebuddy.resilience.domain.resilience;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class IdempotencyKeysTest {

    @Test
    void shouldDeriveSameKeyForSameOperationAndArguments() {
        assertEquals(IdempotencyKeys.of("createPullRequest", "acme/api", 42),
                IdempotencyKeys.of("createPullRequest", "acme/api", 42));
    }

    @Test
    void shouldDistinguishArgumentBoundaries() {
        assertNotEquals(IdempotencyKeys.of("op", "ab", "c"), IdempotencyKeys.of("op", "a", "bc"));
    }

    @Test
    void shouldDistinguishOperationNames() {
        assertNotEquals(IdempotencyKeys.of("createPullRequest", 1), IdempotencyKeys.of("mergePullRequest", 1));
    }

    @Test
    void shouldProduceSha256Hex() {
        assertEquals(64, IdempotencyKeys.of("op").length());
        assertEquals("ca978112ca1bbdcafac231b39a23dc4da786eff8147c4e72b9807785afee48bb", IdempotencyKeys.of("a"));
    }
}
