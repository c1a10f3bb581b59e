package udem.communities.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.communities.errors.OptimizationException;
import udem.communities.errors.ValidationException;

/**
 * Independent LFR model. An edge endpoint stays inside its community with probability 1 - mu
 * and otherwise attaches anywhere in proportion to degree, so the expected internal weight of
 * community c is {@code L_c} times {@code (1 - mu) / D_c + mu / 2E}. There is no closed form
 * for the best mu; it is found by the {@link ScalarMinimizer} on the negated log-likelihood.
 * <p>
 * mu is kept {@link ModelKind#DOMAIN_MARGIN} away from 0 and 1 before any logarithm.
 */
final class IlfrModel implements QualityModel {
    private static final Logger log = LoggerFactory.getLogger(IlfrModel.class);

    private final ScalarMinimizer minimizer;

    IlfrModel(ScalarMinimizer minimizer) {
        this.minimizer = minimizer;
    }

    @Override
    public ModelKind kind() {
        return ModelKind.ILFR;
    }

    @Override
    public double quality(CommunityStatistics stats, double mu) {
        double e = stats.totalWeight();
        if (e <= 0.0) return 0.0;
        double m = kind().clamp(mu);
        double eout = stats.externalWeight();
        double ll = eout * Math.log(m) - eout * Math.log(2.0 * e) + stats.summary().degreeEntropy() - e;
        for (int c = 0; c < stats.communityCount(); c++) {
            double degree = stats.degree(c);
            if (degree > 0.0) ll += stats.internal(c) * Math.log(stay(m, degree, e));
        }
        return ll;
    }

    @Override
    public double removeGain(CommunityView view, int node, double weightToOwn, double mu) {
        double e = view.summary().totalWeight();
        if (e <= 0.0) return 0.0;
        double m = kind().clamp(mu);
        int own = view.communityOf(node);
        double degree = view.communityDegree(own);
        double internal = view.communityInternal(own);
        double restDegree = degree - view.nodeDegree(node);
        double gain = weightToOwn * (Math.log(m) - Math.log(2.0 * e));
        if (degree > 0.0) gain -= internal * Math.log(stay(m, degree, e));
        if (restDegree > 0.0) {
            gain += (internal - weightToOwn - view.nodeSelfLoop(node)) * Math.log(stay(m, restDegree, e));
        }
        return gain + singleton(view, node, m, e);
    }

    @Override
    public double insertGain(CommunityView view, int node, int community, double weightToCommunity, double mu) {
        double e = view.summary().totalWeight();
        if (e <= 0.0) return 0.0;
        double m = kind().clamp(mu);
        double degree = view.communityDegree(community);
        double internal = view.communityInternal(community);
        double joinedDegree = degree + view.nodeDegree(node);
        double gain = weightToCommunity * (Math.log(2.0 * e) - Math.log(m));
        if (degree > 0.0) gain -= internal * Math.log(stay(m, degree, e));
        if (joinedDegree > 0.0) {
            gain += (internal + weightToCommunity + view.nodeSelfLoop(node)) * Math.log(stay(m, joinedDegree, e));
        }
        return gain - singleton(view, node, m, e);
    }

    @Override
    public double totalLogLikelihood(CommunityStatistics stats, double mu) {
        return quality(stats, mu);
    }

    /**
     * Maximizes the log-likelihood over mu, reporting the share of external weight as the last
     * valid estimate when the minimizer fails.
     */
    @Override
    public ParameterEstimate estimateParameter(CommunityStatistics stats) {
        double e = stats.totalWeight();
        if (e <= 0.0) throw new ValidationException("ilfr: mu cannot be estimated on a graph without edges");
        double start = kind().clamp(stats.externalWeight() / e);
        double startValue = -quality(stats, start);

        double best;
        try {
            best = minimizer.minimize(mu -> -quality(stats, mu),
                    ModelKind.DOMAIN_MARGIN, 1.0 - ModelKind.DOMAIN_MARGIN);
        } catch (OptimizationException ex) {
            throw new OptimizationException("ilfr: minimizer failed: " + ex.getMessage(), start, ex);
        }
        double bestValue = Double.isFinite(best) ? -quality(stats, best) : Double.NaN;
        if (!Double.isFinite(bestValue)) {
            throw new OptimizationException("ilfr: minimizer returned a non-finite objective at mu=" + best, start);
        }
        if (bestValue > startValue + 1e-9 * Math.max(1.0, Math.abs(startValue))) {
            throw new OptimizationException("ilfr: minimizer result mu=" + best
                    + " is worse than the external-weight share mu=" + start, start);
        }
        log.debug("ilfr: mu={} (external share {}), log-likelihood {}", best, start, -bestValue);
        return ParameterEstimate.of(kind(), best);
    }

    /**
     * Term of the community made of {@code node} alone.
     */
    private static double singleton(CommunityView view, int node, double mu, double totalWeight) {
        double loop = view.nodeSelfLoop(node);
        double degree = view.nodeDegree(node);
        return loop > 0.0 && degree > 0.0 ? loop * Math.log(stay(mu, degree, totalWeight)) : 0.0;
    }

    private static double stay(double mu, double degree, double totalWeight) {
        return (1.0 - mu) / degree + mu / (2.0 * totalWeight);
    }
}
