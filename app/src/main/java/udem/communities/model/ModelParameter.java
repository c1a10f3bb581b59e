package udem.communities.model;

import udem.communities.errors.ValidationException;

import java.util.Map;

/**
 * Named scalar parameter of a model: {@code gamma} for PPM/DCPPM, {@code mu} for ILFR/ILFRs.
 * Never mutated, {@link #withValue(double)} returns a replacement.
 */
public record ModelParameter(ModelKind kind, double value) {

    public ModelParameter {
        if (kind == null) throw new ValidationException("parameter without a model");
        kind.validate(value);
    }

    public static ModelParameter defaultFor(ModelKind kind) {
        return new ModelParameter(kind, kind.defaultValue());
    }

    /**
     * Reads the model's parameter from a name -> value map; an empty or null map gives the default.
     */
    public static ModelParameter of(ModelKind kind, Map<String, Double> values) {
        if (values == null || values.isEmpty()) return defaultFor(kind);
        for (String key : values.keySet()) {
            if (!"gamma".equals(key) && !"mu".equals(key)) {
                throw new ValidationException("unknown parameter '" + key + "'");
            }
        }
        Double v = values.get(kind.parameterName());
        if (v == null) {
            throw new ValidationException(kind.modelName() + " expects parameter '" + kind.parameterName()
                    + "', got " + values.keySet());
        }
        return new ModelParameter(kind, v);
    }

    public String name() {
        return kind.parameterName();
    }

    public ModelParameter withValue(double newValue) {
        return new ModelParameter(kind, newValue);
    }

    public Map<String, Double> asMap() {
        return Map.of(name(), value);
    }

    @Override
    public String toString() {
        return name() + "=" + value;
    }
}
