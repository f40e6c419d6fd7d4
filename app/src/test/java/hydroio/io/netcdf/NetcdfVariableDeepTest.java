package hydroio.io.netcdf;

import hydroio.config.NetcdfConfig;
import hydroio.domain.series.SeriesArray;
import hydroio.domain.series.TimeSeriesHandle;
import hydroio.io.dataset.Dataset;
import hydroio.io.dataset.JsonDatasetFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Pruebas para {@link NetcdfVariableDeep}.
 */
class NetcdfVariableDeepTest {

    private final NetcdfConfig config = NetcdfConfig.defaults();

    @TempDir
    Path tempDir;

    private NetcdfVariableDeep variable;

    @BeforeEach
    void setUp() {
        variable = new NetcdfVariableDeep("sm", false, config);
        variable.log(Fixtures.deviceA("sm"), null);
        variable.log(Fixtures.deviceB("sm"), null);
    }

    @Test
    @DisplayName("A (rango 0) y B (rango 1, extensión 2) en 4 pasos dan forma (2, 4, 2) con relleno")
    void getArray_shouldPadSmallerDevices() {
        // ACT
        SeriesArray array = variable.getArray();

        // ASSERT
        assertThat(variable.getShape()).containsExactly(2, 4, 2);
        assertThat(array.getShape()).containsExactly(2, 4, 2);
        assertThat(variable.getDimensions()).containsExactly("sm_stations", "time", "sm_axis3");
        assertThat(variable.getSubdeviceNames()).containsExactly("A", "B");
        assertThat(array.get(0, 2, 0)).isEqualTo(3.0);
        assertThat(array.get(0, 2, 1)).isEqualTo(-999.0);
        assertThat(array.get(1, 3, 1)).isEqualTo(41.0);
    }

    @Test
    @DisplayName("Aislada, las dimensiones adicionales no llevan prefijo")
    void isolated_shouldDropPrefix() {
        NetcdfVariableDeep isolated = new NetcdfVariableDeep("sm", true, config);
        isolated.log(Fixtures.deviceB("sm"), null);

        assertThat(isolated.getDimensions()).containsExactly("stations", "time", "axis3");
    }

    @Test
    @DisplayName("Escribir y leer restaura exactamente cada dispositivo, descartando el relleno")
    void write_thenRead_shouldRestoreValues() throws IOException {
        // ARRANGE
        Dataset dataset = new JsonDatasetFactory().create(tempDir.resolve("deep.json"));
        dataset.createDimension("time", 4);
        variable.write(dataset);

        TimeSeriesHandle a = Fixtures.emptyLike(Fixtures.deviceA("sm"), Fixtures.WINDOW);
        TimeSeriesHandle b = Fixtures.emptyLike(Fixtures.deviceB("sm"), Fixtures.WINDOW);
        NetcdfVariableDeep reader = new NetcdfVariableDeep("sm", false, config);
        reader.log(b, null);
        reader.log(a, null);

        // ACT
        reader.read(dataset, Fixtures.WINDOW);

        // ASSERT
        assertThat(dataset.findVariable("sm").read().get(0, 1, 1)).isEqualTo(-999.0);
        assertThat(a.getSeries()).isEqualTo(Fixtures.deviceA("sm").getSeries());
        assertThat(b.getSeries()).isEqualTo(Fixtures.deviceB("sm").getSeries());
    }

    @Test
    @DisplayName("Una serie más ancha que la variable del fichero produce INCONSISTENT_DATA")
    void read_withWiderDevice_shouldFail() throws IOException {
        Dataset dataset = new JsonDatasetFactory().create(tempDir.resolve("narrow.json"));
        dataset.createDimension("time", 4);
        variable.write(dataset);

        TimeSeriesHandle wide = TimeSeriesHandle.builder()
                .deviceName("B").baseName("sm").category("hland")
                .spatialShape(new int[]{3}).window(Fixtures.WINDOW).build();
        NetcdfVariableDeep reader = new NetcdfVariableDeep("sm", false, config);
        reader.log(wide, null);

        assertThatThrownBy(() -> reader.read(dataset, Fixtures.WINDOW))
                .isInstanceOf(NetcdfIoException.class)
                .extracting(e -> ((NetcdfIoException) e).getKind())
                .isEqualTo(ErrorKind.INCONSISTENT_DATA);
    }

    @Test
    @DisplayName("Sin la variable en el fichero, la lectura falla con MISSING_VARIABLE")
    void read_withoutVariable_shouldFail() throws IOException {
        Dataset dataset = new JsonDatasetFactory().create(tempDir.resolve("empty.json"));

        assertThatThrownBy(() -> variable.read(dataset, Fixtures.WINDOW))
                .isInstanceOf(NetcdfIoException.class)
                .extracting(e -> ((NetcdfIoException) e).getKind())
                .isEqualTo(ErrorKind.MISSING_VARIABLE);
    }
}
