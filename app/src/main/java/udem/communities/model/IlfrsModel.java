package udem.communities.model;

import udem.communities.errors.ValidationException;

/**
 * Simplified independent LFR model. A fraction mu of every node's degree leaves its community;
 * the within-community edges follow the community's degree sequence. The maximum-likelihood mu
 * is the share of external weight, {@code E_out / E}.
 * <p>
 * mu is kept {@link ModelKind#DOMAIN_MARGIN} away from 0 and 1 before any logarithm.
 */
final class IlfrsModel implements QualityModel {

    @Override
    public ModelKind kind() {
        return ModelKind.ILFRS;
    }

    @Override
    public double quality(CommunityStatistics stats, double mu) {
        double e = stats.totalWeight();
        if (e <= 0.0) return 0.0;
        double m = kind().clamp(mu);
        double eout = stats.externalWeight();
        double q = eout * Math.log(m) + stats.internalWeight() * Math.log(1.0 - m) - eout * Math.log(2.0 * e);
        for (int c = 0; c < stats.communityCount(); c++) {
            q -= LogMath.xlogy(stats.internal(c), stats.degree(c));
        }
        return q - e + stats.summary().degreeEntropy();
    }

    @Override
    public double removeGain(CommunityView view, int node, double weightToOwn, double mu) {
        double e = view.summary().totalWeight();
        if (e <= 0.0) return 0.0;
        double m = kind().clamp(mu);
        int own = view.communityOf(node);
        double degree = view.communityDegree(own);
        double internal = view.communityInternal(own);
        double left = internal - view.nodeSelfLoop(node) - weightToOwn;
        double gain = weightToOwn * (Math.log(m / (1.0 - m)) - Math.log(2.0 * e));
        gain += LogMath.xlogy(internal, degree);
        gain -= LogMath.xlogy(left, degree - view.nodeDegree(node));
        return gain - LogMath.xlogy(view.nodeSelfLoop(node), view.nodeDegree(node));
    }

    @Override
    public double insertGain(CommunityView view, int node, int community, double weightToCommunity, double mu) {
        double e = view.summary().totalWeight();
        if (e <= 0.0) return 0.0;
        double m = kind().clamp(mu);
        double degree = view.communityDegree(community);
        double internal = view.communityInternal(community);
        double joined = internal + view.nodeSelfLoop(node) + weightToCommunity;
        double gain = weightToCommunity * Math.log(2.0 * e * (1.0 - m) / m);
        gain += LogMath.xlogy(internal, degree);
        gain -= LogMath.xlogy(joined, degree + view.nodeDegree(node));
        return gain + LogMath.xlogy(view.nodeSelfLoop(node), view.nodeDegree(node));
    }

    @Override
    public double totalLogLikelihood(CommunityStatistics stats, double mu) {
        return quality(stats, mu);
    }

    @Override
    public ParameterEstimate estimateParameter(CommunityStatistics stats) {
        if (stats.totalWeight() <= 0.0) {
            throw new ValidationException("ilfrs: mu cannot be estimated on a graph without edges");
        }
        return ParameterEstimate.of(kind(), stats.externalWeight() / stats.totalWeight());
    }
}
