package udem.communities.detection;

import udem.communities.errors.ConfigurationException;

/**
 * Run options.
 *
 * @param maxPasses          sweeps per local-search phase, -1 until a local optimum
 * @param maxOuterIterations cap on partition/parameter alternations
 * @param tolerance          smallest objective improvement that keeps a sweep or a level
 * @param parameterTolerance parameter change at or below which the alternation is converged
 * @param seed               seed of the sweep-order shuffle, null to sweep in node order
 * @param estimateCacheSize  parameter estimates remembered per run
 */
public record OptimizationOptions(
        int maxPasses,
        int maxOuterIterations,
        double tolerance,
        double parameterTolerance,
        Long seed,
        int estimateCacheSize
) {
    public static final int DEFAULT_MAX_PASSES = -1;
    public static final int DEFAULT_MAX_OUTER_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 1e-7;
    public static final double DEFAULT_PARAMETER_TOLERANCE = 1e-5;
    public static final int DEFAULT_ESTIMATE_CACHE_SIZE = 256;

    public OptimizationOptions {
        if (maxPasses == 0 || maxPasses < -1) {
            throw new ConfigurationException("maxPasses must be -1 or positive, got " + maxPasses);
        }
        if (maxOuterIterations < 1) {
            throw new ConfigurationException("maxOuterIterations must be positive, got " + maxOuterIterations);
        }
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new ConfigurationException("tolerance must be finite and >= 0, got " + tolerance);
        }
        if (!(parameterTolerance >= 0.0) || Double.isInfinite(parameterTolerance)) {
            throw new ConfigurationException("parameterTolerance must be finite and >= 0, got " + parameterTolerance);
        }
        if (estimateCacheSize < 0) {
            throw new ConfigurationException("estimateCacheSize must be >= 0, got " + estimateCacheSize);
        }
    }

    public static OptimizationOptions defaults() {
        return new OptimizationOptions(DEFAULT_MAX_PASSES, DEFAULT_MAX_OUTER_ITERATIONS, DEFAULT_TOLERANCE,
                DEFAULT_PARAMETER_TOLERANCE, null, DEFAULT_ESTIMATE_CACHE_SIZE);
    }

    public OptimizationOptions withMaxPasses(int v) {
        return new OptimizationOptions(v, maxOuterIterations, tolerance, parameterTolerance, seed, estimateCacheSize);
    }

    public OptimizationOptions withMaxOuterIterations(int v) {
        return new OptimizationOptions(maxPasses, v, tolerance, parameterTolerance, seed, estimateCacheSize);
    }

    public OptimizationOptions withTolerance(double v) {
        return new OptimizationOptions(maxPasses, maxOuterIterations, v, parameterTolerance, seed, estimateCacheSize);
    }

    public OptimizationOptions withParameterTolerance(double v) {
        return new OptimizationOptions(maxPasses, maxOuterIterations, tolerance, v, seed, estimateCacheSize);
    }

    public OptimizationOptions withSeed(Long v) {
        return new OptimizationOptions(maxPasses, maxOuterIterations, tolerance, parameterTolerance, v, estimateCacheSize);
    }

    public OptimizationOptions withEstimateCacheSize(int v) {
        return new OptimizationOptions(maxPasses, maxOuterIterations, tolerance, parameterTolerance, seed, v);
    }
}
