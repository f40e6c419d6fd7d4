package hydroio.io.netcdf;

import hydroio.domain.series.SeriesArray;
import hydroio.domain.series.TimeSeriesHandle;
import hydroio.domain.time.Timegrid;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Series de prueba compartidas por los tests del paquete.
 */
final class Fixtures {

    static final LocalDateTime START = LocalDateTime.of(2000, 1, 1, 0, 0);
    static final Timegrid WINDOW = hourly(0, 4);

    private Fixtures() {
    }

    static Timegrid hourly(int fromHour, int toHour) {
        return new Timegrid(START.plusHours(fromHour), START.plusHours(toHour), Duration.ofHours(1));
    }

    /**
     * Serie de rango 0 del dispositivo A sobre {@link #WINDOW}.
     */
    static TimeSeriesHandle deviceA(String baseName) {
        return TimeSeriesHandle.builder()
                .deviceName("A").baseName(baseName).category("hland")
                .window(WINDOW)
                .series(SeriesArray.of(1.0, 2.0, 3.0, 4.0))
                .build();
    }

    /**
     * Serie de rango 1 (extensión 2) del dispositivo B sobre {@link #WINDOW}.
     */
    static TimeSeriesHandle deviceB(String baseName) {
        return TimeSeriesHandle.builder()
                .deviceName("B").baseName(baseName).category("hland")
                .spatialShape(new int[]{2})
                .window(WINDOW)
                .series(SeriesArray.of(new double[][]{{10, 11}, {20, 21}, {30, 31}, {40, 41}}))
                .build();
    }

    /**
     * Serie vacía (NaN) con la misma forma que {@code source}, lista para recibir una lectura.
     */
    static TimeSeriesHandle emptyLike(TimeSeriesHandle source, Timegrid window) {
        return TimeSeriesHandle.builder()
                .deviceName(source.getDeviceName())
                .baseName(source.getBaseName())
                .category(source.getCategory())
                .nodeAnchored(source.isNodeAnchored())
                .spatialShape(source.getSpatialShape())
                .window(window)
                .build();
    }
}
