package udem.communities.model;

import udem.communities.errors.ValidationException;

/**
 * Planted partition model: every pair of nodes is linked with p_in inside a community and p_out
 * across. The search objective is {@code E_in / E - gamma * P_in / P}, with P the node pairs and
 * P_in the pairs sharing a community, so gamma = 1 weighs a pair exactly at the graph density.
 * <p>
 * Pair counts and probabilities are floored at {@link #PROBABILITY_FLOOR} before any logarithm.
 */
final class PpmModel implements QualityModel {
    static final double PROBABILITY_FLOOR = 1e-7;

    @Override
    public ModelKind kind() {
        return ModelKind.PPM;
    }

    @Override
    public double quality(CommunityStatistics stats, double gamma) {
        double e = stats.totalWeight();
        if (e <= 0.0) return 0.0;
        double pairs = stats.summary().pairCount();
        double penalty = pairs > 0.0 ? gamma * stats.internalPairs() / pairs : 0.0;
        return stats.internalWeight() / e - penalty;
    }

    @Override
    public double removeGain(CommunityView view, int node, double weightToOwn, double gamma) {
        double e = view.summary().totalWeight();
        if (e <= 0.0) return 0.0;
        double pairs = view.summary().pairCount();
        int s = view.nodeSize(node);
        int rest = view.communitySize(view.communityOf(node)) - s;
        double released = pairs > 0.0 ? rest * gamma * s / pairs : 0.0;
        return released - weightToOwn / e;
    }

    @Override
    public double insertGain(CommunityView view, int node, int community, double weightToCommunity, double gamma) {
        double e = view.summary().totalWeight();
        if (e <= 0.0) return 0.0;
        double pairs = view.summary().pairCount();
        int s = view.nodeSize(node);
        double added = pairs > 0.0 ? view.communitySize(community) * gamma * s / pairs : 0.0;
        return weightToCommunity / e - added;
    }

    /**
     * Profile log-likelihood: p_in and p_out at their maximum-likelihood values for the partition,
     * so gamma does not enter.
     */
    @Override
    public double totalLogLikelihood(CommunityStatistics stats, double gamma) {
        double e = stats.totalWeight();
        if (e <= 0.0) return 0.0;
        double ein = stats.internalWeight();
        double eout = stats.externalWeight();
        var p = probabilities(stats);
        double ll = -ein - eout;
        if (ein > 0.0) ll += ein * Math.log(p[0]);
        if (eout > 0.0) ll += eout * Math.log(p[1]);
        return ll;
    }

    @Override
    public ParameterEstimate estimateParameter(CommunityStatistics stats) {
        double e = stats.totalWeight();
        if (e <= 0.0) throw new ValidationException("ppm: gamma cannot be estimated on a graph without edges");
        var p = probabilities(stats);
        double gamma = stats.summary().pairCount() * LogMath.logMean(p[0], p[1]) / e;
        return ParameterEstimate.of(kind(), gamma);
    }

    /**
     * {p_in, p_out}; an empty side gets the floor instead of zero.
     */
    private static double[] probabilities(CommunityStatistics stats) {
        double pairs = stats.summary().pairCount();
        double inPairs = stats.internalPairs();
        double outPairs = Math.max(pairs - inPairs, PROBABILITY_FLOOR);
        inPairs = Math.max(inPairs, PROBABILITY_FLOOR);
        double pin = stats.internalWeight() > 0.0 ? stats.internalWeight() / inPairs : PROBABILITY_FLOOR;
        double pout = stats.externalWeight() > 0.0 ? stats.externalWeight() / outPairs : PROBABILITY_FLOOR;
        return new double[]{pin, pout};
    }
}
