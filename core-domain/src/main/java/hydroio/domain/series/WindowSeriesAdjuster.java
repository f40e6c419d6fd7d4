package hydroio.domain.series;

import hydroio.domain.time.Timegrid;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Ajuste por ventanas: recorta del bloque leído los pasos que solapan con la ventana
 * del dispositivo.
 * <p>
 * En modo estricto (por defecto) la ventana de los datos debe cubrir por completo la del
 * dispositivo. En modo permisivo los pasos no cubiertos se rellenan con {@code NaN}.
 */
@Slf4j
public class WindowSeriesAdjuster implements SeriesAdjuster {

    private static final WindowSeriesAdjuster STRICT = new WindowSeriesAdjuster(true);
    private static final WindowSeriesAdjuster LENIENT = new WindowSeriesAdjuster(false);

    private final boolean strict;

    public WindowSeriesAdjuster(boolean strict) {
        this.strict = strict;
    }

    public static WindowSeriesAdjuster strict() {
        return STRICT;
    }

    public static WindowSeriesAdjuster lenient() {
        return LENIENT;
    }

    @Override
    public SeriesArray adjust(Timegrid targetWindow, Timegrid dataWindow, SeriesArray values) {
        if (!targetWindow.getStepSize().equals(dataWindow.getStepSize())) {
            throw new IllegalArgumentException(String.format(
                    "El paso de los datos (%s) no coincide con el de la serie (%s).",
                    dataWindow.getStepSize(), targetWindow.getStepSize()));
        }
        if (values.getDim(0) != dataWindow.length()) {
            throw new IllegalArgumentException(String.format(
                    "Los datos contienen %d pasos, pero su ventana %s define %d.",
                    values.getDim(0), dataWindow, dataWindow.length()));
        }
        boolean covered = dataWindow.covers(targetWindow);
        if (!covered && strict) {
            throw new IllegalArgumentException(String.format(
                    "La ventana de los datos %s no cubre la ventana de la serie %s.", dataWindow, targetWindow));
        }

        int[] shape = values.getShape();
        int steps = targetWindow.length();
        int cells = SeriesArray.sizeOf(Arrays.copyOfRange(shape, 1, shape.length));
        shape[0] = steps;
        double[] source = values.toArray();
        double[] result = new double[steps * cells];
        Arrays.fill(result, Double.NaN);

        // Desplazamiento del inicio de la serie respecto al inicio de los datos; falla si
        // la serie no está alineada con la rejilla de los datos
        long offset = dataWindow.indexOf(targetWindow.getFirstDate());
        int missing = 0;
        for (int t = 0; t < steps; t++) {
            long sourceStep = offset + t;
            if (sourceStep < 0 || sourceStep >= dataWindow.length()) {
                missing++;
                continue;
            }
            System.arraycopy(source, (int) sourceStep * cells, result, t * cells, cells);
        }
        if (missing > 0) {
            log.warn("La ventana de los datos {} no cubre {} de los {} pasos de la serie {}; se rellenan con NaN.",
                    dataWindow, missing, steps, targetWindow);
        }
        return new SeriesArray(shape, result);
    }
}
