package udem.communities.model;

public final class QualityModels {

    private QualityModels() {
    }

    public static QualityModel of(String name) {
        return of(ModelKind.fromName(name));
    }

    public static QualityModel of(ModelKind kind) {
        return of(kind, new BrentScalarMinimizer());
    }

    /**
     * @param minimizer used by ILFR only
     */
    public static QualityModel of(ModelKind kind, ScalarMinimizer minimizer) {
        return switch (kind) {
            case PPM -> new PpmModel();
            case DCPPM -> new DcppmModel();
            case ILFR -> new IlfrModel(minimizer);
            case ILFRS -> new IlfrsModel();
        };
    }
}
