package hydroio.domain.series;

import hydroio.domain.time.Timegrid;
import lombok.Builder;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Una magnitud con nombre de un único dispositivo y su serie temporal.
 * <p>
 * La serie tiene forma {@code (window.length(), extensiones espaciales...)}; el rango
 * espacial es el número de extensiones (0 para magnitudes escalares). La lectura de
 * ficheros sustituye la serie mediante {@link #setSeries(SeriesArray)}.
 */
public class TimeSeriesHandle {

    /** Identificador único del dispositivo propietario. */
    @Getter
    private final String deviceName;

    /** Nombre base de la magnitud, p. ej. {@code "flux_nkor"}. */
    @Getter
    private final String baseName;

    /** Discriminador de la categoría del dispositivo, p. ej. {@code "lland_v1"}. */
    @Getter
    private final String category;

    /** Si la magnitud pertenece a un nodo de la red y no a un elemento modelado. */
    @Getter
    private final boolean nodeAnchored;

    @Getter
    private final Timegrid window;

    @Getter
    private final SeriesAdjuster adjuster;

    private final int[] spatialShape;
    private SeriesArray series;

    /**
     * @param deviceName   Nombre del dispositivo.
     * @param baseName     Nombre base de la magnitud.
     * @param category     Categoría del dispositivo (ignorada para magnitudes de nodo).
     * @param nodeAnchored Si la magnitud pertenece a un nodo.
     * @param spatialShape Extensiones espaciales; nulo equivale a rango 0.
     * @param window       Ventana temporal de la serie.
     * @param adjuster     Ajuste para lecturas; nulo equivale al ajuste estricto.
     * @param series       Serie inicial; nula equivale a una serie de {@code NaN}.
     */
    @Builder
    public TimeSeriesHandle(String deviceName,
                            String baseName,
                            String category,
                            boolean nodeAnchored,
                            int[] spatialShape,
                            Timegrid window,
                            SeriesAdjuster adjuster,
                            SeriesArray series) {
        Objects.requireNonNull(deviceName, "El nombre del dispositivo no puede ser nulo.");
        Objects.requireNonNull(baseName, "El nombre de la magnitud no puede ser nulo.");
        Objects.requireNonNull(window, "La ventana temporal no puede ser nula.");
        if (!nodeAnchored && (category == null || category.isBlank())) {
            throw new IllegalArgumentException(
                    "La magnitud `" + baseName + "` del dispositivo `" + deviceName + "` requiere una categoría.");
        }
        this.deviceName = deviceName;
        this.baseName = baseName;
        this.category = category;
        this.nodeAnchored = nodeAnchored;
        this.spatialShape = spatialShape == null ? new int[0] : spatialShape.clone();
        for (int extent : this.spatialShape) {
            if (extent <= 0) {
                throw new IllegalArgumentException(
                        "Las extensiones espaciales deben ser positivas: " + Arrays.toString(this.spatialShape));
            }
        }
        this.window = window;
        this.adjuster = adjuster == null ? WindowSeriesAdjuster.strict() : adjuster;
        if (series == null) {
            this.series = SeriesArray.filled(getSeriesShape(), Double.NaN);
        } else {
            setSeries(series);
        }
    }

    public int[] getSpatialShape() {
        return spatialShape.clone();
    }

    public int getRank() {
        return spatialShape.length;
    }

    /**
     * Forma de la serie completa: {@code (pasos, extensiones...)}.
     */
    public int[] getSeriesShape() {
        int[] shape = new int[spatialShape.length + 1];
        shape[0] = window.length();
        System.arraycopy(spatialShape, 0, shape, 1, spatialShape.length);
        return shape;
    }

    /**
     * Número de series escalares que contiene (producto de extensiones; 1 en rango 0).
     */
    public int getCellCount() {
        return SeriesArray.sizeOf(spatialShape);
    }

    public SeriesArray getSeries() {
        return series.copy();
    }

    public void setSeries(SeriesArray series) {
        Objects.requireNonNull(series, "La serie no puede ser nula.");
        if (!Arrays.equals(series.getShape(), getSeriesShape())) {
            throw new IllegalArgumentException(String.format(
                    "La serie de `%s` del dispositivo `%s` requiere la forma %s, pero se recibió %s.",
                    baseName, deviceName, Arrays.toString(getSeriesShape()), Arrays.toString(series.getShape())));
        }
        this.series = series.copy();
    }

    /**
     * Realinea datos leídos de un fichero a la ventana de esta serie.
     */
    public SeriesArray adjustSeries(Timegrid dataWindow, SeriesArray values) {
        return adjuster.adjust(window, dataWindow, values);
    }

    @Override
    public String toString() {
        return "TimeSeriesHandle(" + deviceName + "." + baseName + ", shape=" + Arrays.toString(getSeriesShape()) + ")";
    }
}
