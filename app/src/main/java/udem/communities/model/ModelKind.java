package udem.communities.model;

import udem.communities.errors.ConfigurationException;
import udem.communities.errors.ValidationException;

import java.util.Locale;

/**
 * The four generative models and the domain of their single parameter.
 */
public enum ModelKind {
    PPM("ppm", "gamma", 1.0),
    DCPPM("dcppm", "gamma", 1.0),
    ILFR("ilfr", "mu", 0.5),
    ILFRS("ilfrs", "mu", 0.5);

    /**
     * Distance kept from the open ends of a parameter domain when clamping.
     */
    public static final double DOMAIN_MARGIN = 1e-7;

    private final String modelName;
    private final String parameterName;
    private final double defaultValue;

    ModelKind(String modelName, String parameterName, double defaultValue) {
        this.modelName = modelName;
        this.parameterName = parameterName;
        this.defaultValue = defaultValue;
    }

    public static ModelKind fromName(String name) {
        if (name != null) {
            String n = name.trim().toLowerCase(Locale.ROOT);
            for (var k : values()) {
                if (k.modelName.equals(n)) return k;
            }
        }
        throw new ConfigurationException("Unknown model specified: " + name + " (expected ppm, dcppm, ilfr or ilfrs)");
    }

    public String modelName() {
        return modelName;
    }

    public String parameterName() {
        return parameterName;
    }

    public double defaultValue() {
        return defaultValue;
    }

    public boolean isResolutionModel() {
        return this == PPM || this == DCPPM;
    }

    public boolean inDomain(double value) {
        if (!Double.isFinite(value)) return false;
        return isResolutionModel() ? value > 0.0 : value > 0.0 && value < 1.0;
    }

    public void validate(double value) {
        if (!inDomain(value)) {
            String domain = isResolutionModel() ? "> 0" : "in (0, 1)";
            throw new ValidationException(modelName + ": " + parameterName + " must be " + domain + ", got " + value);
        }
    }

    /**
     * Nearest value inside the domain, at least {@link #DOMAIN_MARGIN} from an open end.
     */
    public double clamp(double value) {
        double v = Math.max(value, DOMAIN_MARGIN);
        return isResolutionModel() ? v : Math.min(v, 1.0 - DOMAIN_MARGIN);
    }
}
