package hydroio.domain.series;

/**
 * Agregaciones espaciales aplicadas antes de registrar series para escritura.
 * El resultado siempre tiene rango espacial 0 y no es reversible.
 */
public final class SeriesAggregator {

    public static final String MEAN = "mean";

    private SeriesAggregator() {
    }

    /**
     * Media espacial por paso temporal. Las series de rango 0 se devuelven tal cual,
     * etiquetadas igualmente como agregadas.
     */
    public static LoggedArray mean(TimeSeriesHandle handle) {
        SeriesArray series = handle.getSeries();
        int steps = series.getDim(0);
        int cells = handle.getCellCount();
        double[] source = series.toArray();
        double[] result = new double[steps];
        for (int t = 0; t < steps; t++) {
            double sum = 0.0;
            for (int c = 0; c < cells; c++) {
                sum += source[t * cells + c];
            }
            result[t] = sum / cells;
        }
        return LoggedArray.aggregated(SeriesArray.of(result), MEAN);
    }
}
