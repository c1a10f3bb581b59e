package udem.communities.model;

import udem.communities.errors.ValidationException;

/**
 * Degree-corrected planted partition model. The expected weight between two nodes is proportional
 * to the product of their degrees, scaled by p_in or p_out. The search objective
 * {@code sum_c [L_c / E - gamma * (D_c / 2E)^2]} is Newman-Girvan modularity at resolution gamma.
 * <p>
 * p_in and p_out are floored at {@link #PROBABILITY_FLOOR} before any logarithm.
 */
final class DcppmModel implements QualityModel {
    static final double PROBABILITY_FLOOR = 1e-7;

    @Override
    public ModelKind kind() {
        return ModelKind.DCPPM;
    }

    @Override
    public double quality(CommunityStatistics stats, double gamma) {
        double e = stats.totalWeight();
        if (e <= 0.0) return 0.0;
        double q = 0.0;
        for (int c = 0; c < stats.communityCount(); c++) {
            double share = stats.degree(c) / (2.0 * e);
            q += stats.internal(c) / e - gamma * share * share;
        }
        return q;
    }

    @Override
    public double removeGain(CommunityView view, int node, double weightToOwn, double gamma) {
        double e = view.summary().totalWeight();
        if (e <= 0.0) return 0.0;
        double d = view.nodeDegree(node);
        double rest = view.communityDegree(view.communityOf(node)) - d;
        return (gamma * d * rest / (2.0 * e) - weightToOwn) / e;
    }

    @Override
    public double insertGain(CommunityView view, int node, int community, double weightToCommunity, double gamma) {
        double e = view.summary().totalWeight();
        if (e <= 0.0) return 0.0;
        double d = view.nodeDegree(node);
        return (weightToCommunity - gamma * d * view.communityDegree(community) / (2.0 * e)) / e;
    }

    /**
     * Profile log-likelihood with p_in, p_out at their maximum-likelihood values.
     */
    @Override
    public double totalLogLikelihood(CommunityStatistics stats, double gamma) {
        double e = stats.totalWeight();
        if (e <= 0.0) return 0.0;
        var p = probabilities(stats);
        double pin = p[0];
        double pout = p[1];
        double squared = stats.squaredDegreeSum();
        double ll = stats.internalWeight() * (Math.log(pin) - Math.log(pout));
        ll -= (pin - pout) * squared / (4.0 * e);
        ll += stats.summary().degreeEntropy();
        ll += e * Math.log(pout);
        ll -= e * pout;
        ll -= e * Math.log(2.0 * e);
        return ll;
    }

    @Override
    public ParameterEstimate estimateParameter(CommunityStatistics stats) {
        if (stats.totalWeight() <= 0.0) {
            throw new ValidationException("dcppm: gamma cannot be estimated on a graph without edges");
        }
        var p = probabilities(stats);
        return ParameterEstimate.of(kind(), LogMath.logMean(p[0], p[1]));
    }

    private static double[] probabilities(CommunityStatistics stats) {
        double e = stats.totalWeight();
        double squared = stats.squaredDegreeSum();
        double pin = 4.0 * stats.internalWeight() * e / squared;
        double outDen = 4.0 * e * e - squared;
        double pout = stats.externalWeight() > 0.0 && outDen > 0.0
                ? 4.0 * stats.externalWeight() * e / outDen
                : PROBABILITY_FLOOR;
        return new double[]{Math.max(pin, PROBABILITY_FLOOR), Math.max(pout, PROBABILITY_FLOOR)};
    }
}
