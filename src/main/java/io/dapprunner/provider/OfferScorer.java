package io.dapprunner.provider;

/**
 * Scores marketplace offers. Negative scores reject the offer; among the rest the highest wins.
 */
@FunctionalInterface
public interface OfferScorer {
    double score(Offer offer);
}
