package udem.communities.model;

final class LogMath {

    private LogMath() {
    }

    /**
     * {@code x log x} with the continuous extension {@code 0 log 0 = 0}.
     */
    static double xlogx(double x) {
        return x > 0.0 ? x * Math.log(x) : 0.0;
    }

    /**
     * {@code x log y}, zero when {@code x} is zero or {@code y} is not positive (an empty
     * community, whose internal weight is zero up to rounding).
     */
    static double xlogy(double x, double y) {
        return x == 0.0 || y <= 0.0 ? 0.0 : x * Math.log(y);
    }

    /**
     * {@code (a - b) / (log a - log b)}, the logarithmic mean, with its limit {@code a} when a == b.
     */
    static double logMean(double a, double b) {
        double den = Math.log(a) - Math.log(b);
        if (Math.abs(den) < 1e-12) return a;
        return (a - b) / den;
    }
}
