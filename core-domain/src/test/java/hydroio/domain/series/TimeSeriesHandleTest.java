package hydroio.domain.series;

import hydroio.domain.time.Timegrid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Pruebas unitarias para {@link TimeSeriesHandle}.
 */
@ExtendWith(MockitoExtension.class)
class TimeSeriesHandleTest {

    private static final LocalDateTime START = LocalDateTime.of(2000, 1, 1, 0, 0);
    private static final Timegrid WINDOW = new Timegrid(START, START.plusHours(3), Duration.ofHours(1));

    @Mock
    private SeriesAdjuster adjuster;

    @Test
    @DisplayName("La serie por defecto tiene forma (pasos, extensiones) y está llena de NaN")
    void builder_withoutSeries_shouldCreateNaNSeries() {
        TimeSeriesHandle handle = TimeSeriesHandle.builder()
                .deviceName("land_1").baseName("sm").category("hland")
                .spatialShape(new int[]{2, 2}).window(WINDOW)
                .build();

        assertThat(handle.getSeriesShape()).containsExactly(3, 2, 2);
        assertThat(handle.getCellCount()).isEqualTo(4);
        assertThat(handle.getRank()).isEqualTo(2);
        assertThat(handle.getSeries().toArray()).containsOnly(Double.NaN);
        assertThat(handle.getAdjuster()).isSameAs(WindowSeriesAdjuster.strict());
    }

    @Test
    @DisplayName("Las magnitudes que no son de nodo requieren categoría")
    void builder_withoutCategory_shouldThrowUnlessNodeAnchored() {
        assertThrows(IllegalArgumentException.class, () -> TimeSeriesHandle.builder()
                .deviceName("land_1").baseName("sm").window(WINDOW).build());

        TimeSeriesHandle node = TimeSeriesHandle.builder()
                .deviceName("dill").baseName("sim").nodeAnchored(true).window(WINDOW).build();
        assertThat(node.getRank()).isZero();
        assertThat(node.getCellCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("setSeries valida la forma y copia los valores")
    void setSeries_shouldValidateShape() {
        TimeSeriesHandle handle = TimeSeriesHandle.builder()
                .deviceName("dill").baseName("sim").nodeAnchored(true).window(WINDOW).build();
        SeriesArray values = SeriesArray.of(1, 2, 3);

        handle.setSeries(values);
        values.set(99.0, 0);

        assertThat(handle.getSeries().toArray()).containsExactly(1.0, 2.0, 3.0);
        assertThrows(IllegalArgumentException.class, () -> handle.setSeries(SeriesArray.of(1, 2)));
    }

    @Test
    @DisplayName("adjustSeries delega en el ajuste con la ventana propia como destino")
    void adjustSeries_shouldDelegateToAdjuster() {
        TimeSeriesHandle handle = TimeSeriesHandle.builder()
                .deviceName("dill").baseName("sim").nodeAnchored(true).window(WINDOW).adjuster(adjuster).build();
        Timegrid dataWindow = new Timegrid(START, START.plusHours(4), Duration.ofHours(1));
        SeriesArray raw = SeriesArray.of(1, 2, 3, 4);
        SeriesArray adjusted = SeriesArray.of(1, 2, 3);
        when(adjuster.adjust(WINDOW, dataWindow, raw)).thenReturn(adjusted);

        assertThat(handle.adjustSeries(dataWindow, raw)).isSameAs(adjusted);
        verify(adjuster).adjust(WINDOW, dataWindow, raw);
    }
}
