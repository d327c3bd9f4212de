package io.dapprunner.runner;

import io.dapprunner.provider.Offer;
import io.dapprunner.provider.OfferScorer;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offer scorer that rejects offers from providers whose instances already failed.
 */
public final class BlacklistOnFailure implements OfferScorer {
    public static final double BLACKLISTED_SCORE = -1.0d;

    private static final Logger LOG = LoggerFactory.getLogger(BlacklistOnFailure.class);

    private final OfferScorer base;
    private final Set<String> blacklist = ConcurrentHashMap.newKeySet();

    public BlacklistOnFailure(OfferScorer base) {
        this.base = base;
    }

    public void blacklist(String providerId) {
        if (providerId != null && blacklist.add(providerId)) {
            LOG.info("Blacklisting provider {}", providerId);
        }
    }

    public boolean isBlacklisted(String providerId) {
        return blacklist.contains(providerId);
    }

    public Set<String> blacklisted() {
        return Set.copyOf(blacklist);
    }

    @Override
    public double score(Offer offer) {
        if (blacklist.contains(offer.issuerId())) {
            LOG.debug("Rejecting offer {} from blacklisted provider {}", offer.id(), offer.issuerId());
            return BLACKLISTED_SCORE;
        }
        return base.score(offer);
    }
}
