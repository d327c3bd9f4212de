package io.dapprunner.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.dapprunner.provider.Offer;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class BlacklistOnFailureTest {
    private static Offer offer(String issuer) {
        return new Offer("offer-" + issuer, issuer, Map.of());
    }

    @Test
    void delegatesForHealthyProviders() {
        var scorer = new BlacklistOnFailure(offer -> 0.5d);
        assertEquals(0.5d, scorer.score(offer("provider-a")));
        assertFalse(scorer.isBlacklisted("provider-a"));
    }

    @Test
    void rejectsBlacklistedProviders() {
        var scorer = new BlacklistOnFailure(offer -> 0.5d);
        scorer.blacklist("provider-a");
        scorer.blacklist("provider-a");
        assertEquals(BlacklistOnFailure.BLACKLISTED_SCORE, scorer.score(offer("provider-a")));
        assertEquals(0.5d, scorer.score(offer("provider-b")));
        assertTrue(scorer.isBlacklisted("provider-a"));
        assertEquals(Set.of("provider-a"), scorer.blacklisted());
    }

    @Test
    void ignoresUnknownProvider() {
        var scorer = new BlacklistOnFailure(offer -> 1d);
        scorer.blacklist(null);
        assertTrue(scorer.blacklisted().isEmpty());
    }
}
