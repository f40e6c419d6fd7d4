package hydroio.io.netcdf;

import hydroio.config.NetcdfConfig;
import hydroio.domain.series.SeriesAggregator;
import hydroio.domain.series.SeriesArray;
import hydroio.domain.series.TimeSeriesHandle;
import hydroio.domain.series.WindowSeriesAdjuster;
import hydroio.domain.simulation.TimegridsProvider;
import hydroio.domain.time.Timegrid;
import hydroio.domain.time.Timegrids;
import hydroio.io.dataset.Dataset;
import hydroio.io.dataset.JsonDatasetFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Pruebas de extremo a extremo de {@link NetcdfInterface}: reparto en ficheros, políticas
 * {@code flatten}/{@code isolate} y ciclos completos de escritura y lectura en disco.
 */
@ExtendWith(MockitoExtension.class)
class NetcdfInterfaceTest {

    @Mock
    private TimegridsProvider timegridsProvider;

    @TempDir
    Path tempDir;

    private NetcdfConfig config;

    @BeforeEach
    void setUp() {
        // Se lee de donde se escribe
        config = NetcdfConfig.under(tempDir).withInputPath(tempDir.resolve("output"));
        lenient().when(timegridsProvider.current()).thenReturn(Optional.of(Timegrids.of(Fixtures.WINDOW)));
    }

    private NetcdfInterface session(boolean flatten, boolean isolate) {
        return NetcdfInterface.builder()
                .flatten(flatten)
                .isolate(isolate)
                .config(config)
                .timegridsProvider(timegridsProvider)
                .build();
    }

    private Dataset openWritten(String fileKey) throws IOException {
        return new JsonDatasetFactory().open(tempDir.resolve("output").resolve(fileKey + ".json"));
    }

    // --- Claves de fichero ---

    @Test
    @DisplayName("La clave de fichero es la categoría, o 'node' para magnitudes de nodo")
    void log_withoutIsolate_shouldKeyByCategory() {
        NetcdfInterface session = session(false, false);
        TimeSeriesHandle node = TimeSeriesHandle.builder()
                .deviceName("dill").baseName("sim").nodeAnchored(true).window(Fixtures.WINDOW).build();

        session.log(Fixtures.deviceA("sm"));
        session.log(Fixtures.deviceB("uz"));
        session.log(node);

        assertThat(session.getFileNames()).containsExactly("hland", "node");
        assertThat(session.requireFile("hland").getVariableNames()).containsExactly("sm", "uz");
    }

    @Test
    @DisplayName("Con isolate la clave añade la magnitud y, si está agregada, la agregación")
    void log_withIsolate_shouldAppendBaseNameAndAggregation() {
        NetcdfInterface session = session(true, true);
        TimeSeriesHandle b = Fixtures.deviceB("sm");

        session.log(b);
        session.log(b, SeriesAggregator.mean(b));

        assertThat(session.getFileNames()).containsExactly("hland_sm", "hland_sm_mean");
        assertThat(session.requireFile("hland_sm_mean").getVariableNames()).containsExactly("sm_mean");
    }

    @Test
    @DisplayName("Un bloque agregado selecciona siempre la variante Agg, con o sin flatten")
    void log_aggregated_shouldAlwaysSelectAgg() {
        for (boolean flatten : new boolean[]{false, true}) {
            NetcdfInterface session = session(flatten, false);
            TimeSeriesHandle b = Fixtures.deviceB("sm");

            session.log(b, SeriesAggregator.mean(b));

            assertThat(session.requireFile("hland").requireVariable("sm_mean").getKind())
                    .isEqualTo(VariableKind.AGG);
        }
    }

    @Test
    @DisplayName("Un fichero no registrado se busca con Optional o con un error que lo indica")
    void requireFile_unknown_shouldSayNeverRegistered() {
        NetcdfInterface session = session(false, false);

        assertThat(session.getFile("hland")).isEmpty();
        assertThatThrownBy(() -> session.requireFile("hland"))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("nunca se registró");
    }

    // --- Escritura ---

    @Test
    @DisplayName("Una sesión vacía no escribe nada ni consulta la ventana global")
    void write_emptySession_shouldBeNoOp() throws IOException {
        session(false, false).write();

        verifyNoInteractions(timegridsProvider);
        assertThat(Files.exists(tempDir.resolve("output"))).isFalse();
    }

    @Test
    @DisplayName("Sin ventana global la escritura falla con NO_GLOBAL_WINDOW")
    void write_withoutGlobalWindow_shouldFail() {
        when(timegridsProvider.current()).thenReturn(Optional.empty());
        NetcdfInterface session = session(false, false);
        session.log(Fixtures.deviceA("sm"));

        assertThatThrownBy(session::write)
                .isInstanceOf(NetcdfIoException.class)
                .extracting(e -> ((NetcdfIoException) e).getKind())
                .isEqualTo(ErrorKind.NO_GLOBAL_WINDOW);
    }

    @Test
    @DisplayName("Deep: escribir y leer A (rango 0) y B (rango 1) restaura los valores; el relleno queda en disco")
    void deep_roundTrip_shouldRestoreValues() throws IOException {
        // ARRANGE
        NetcdfInterface writer = session(false, false);
        writer.log(Fixtures.deviceA("sm"));
        writer.log(Fixtures.deviceB("sm"));

        // ACT
        writer.write();

        TimeSeriesHandle a = Fixtures.emptyLike(Fixtures.deviceA("sm"), Fixtures.WINDOW);
        TimeSeriesHandle b = Fixtures.emptyLike(Fixtures.deviceB("sm"), Fixtures.WINDOW);
        NetcdfInterface reader = session(false, false);
        reader.log(a);
        reader.log(b);
        reader.read();

        // ASSERT
        assertThat(a.getSeries()).isEqualTo(Fixtures.deviceA("sm").getSeries());
        assertThat(b.getSeries()).isEqualTo(Fixtures.deviceB("sm").getSeries());
        try (Dataset dataset = openWritten("hland")) {
            SeriesArray stored = dataset.findVariable("sm").read();
            assertThat(stored.getShape()).containsExactly(2, 4, 2);
            for (int t = 0; t < 4; t++) {
                assertThat(stored.get(0, t, 1)).isEqualTo(-999.0);
            }
            assertThat(dataset.findVariable("time").getAttribute("units"))
                    .contains("hours since 2000-01-01 00:00:00");
        }
    }

    @Test
    @DisplayName("Flat: A y B ocupan las filas A, B_0 y B_1 con forma (3, 4) y se leen de vuelta")
    void flat_roundTrip_shouldUseOneRowPerCell() throws IOException {
        NetcdfInterface writer = session(true, false);
        writer.log(Fixtures.deviceA("sm"));
        writer.log(Fixtures.deviceB("sm"));
        writer.write();

        try (Dataset dataset = openWritten("hland")) {
            assertThat(dataset.findVariable("sm").getShape()).containsExactly(3, 4);
            assertThat(dataset.findVariable("sm_station_names").readStrings()).containsExactly("A", "B_0", "B_1");
        }

        TimeSeriesHandle b = Fixtures.emptyLike(Fixtures.deviceB("sm"), Fixtures.WINDOW);
        NetcdfInterface reader = session(true, false);
        reader.log(b);
        reader.read();
        assertThat(b.getSeries()).isEqualTo(Fixtures.deviceB("sm").getSeries());
    }

    @Test
    @DisplayName("Leer una magnitud agregada falla con NOT_INVERTIBLE")
    void read_aggregated_shouldFail() throws IOException {
        TimeSeriesHandle b = Fixtures.deviceB("sm");
        NetcdfInterface writer = session(false, false);
        writer.log(b, SeriesAggregator.mean(b));
        writer.write();

        NetcdfInterface reader = session(false, false);
        reader.log(b, SeriesAggregator.mean(b));

        assertThatThrownBy(reader::read)
                .isInstanceOf(NetcdfIoException.class)
                .hasMessageContaining("sm_mean")
                .extracting(e -> ((NetcdfIoException) e).getKind())
                .isEqualTo(ErrorKind.NOT_INVERTIBLE);
    }

    @Test
    @DisplayName("isolate=true: la magnitud 'temp' en su propio fichero no lleva prefijo en ningún nombre")
    void isolate_shouldDropPrefixes() throws IOException {
        NetcdfInterface writer = session(false, true);
        writer.log(Fixtures.deviceB("temp"));
        writer.write();

        try (Dataset dataset = openWritten("hland_temp")) {
            assertThat(dataset.getVariableNames()).containsExactlyInAnyOrder("time", "station_names", "temp");
            assertThat(dataset.getVariableNames()).noneMatch(name -> name.startsWith("temp_"));
            assertThat(dataset.getDimensionLength("stations")).hasValue(1);
            assertThat(dataset.getDimensionLength("axis3")).hasValue(2);
        }
    }

    @Test
    @DisplayName("isolate=false: 'temp' y 'flow' comparten fichero, cada una con su prefijo y sin colisiones")
    void shared_shouldPrefixEachVariable() throws IOException {
        // ARRANGE
        NetcdfInterface writer = session(false, false);
        writer.log(Fixtures.deviceA("temp"));
        writer.log(Fixtures.deviceB("temp"));
        writer.log(Fixtures.deviceB("flow"));

        // ACT
        writer.write();

        // ASSERT
        try (Dataset dataset = openWritten("hland")) {
            assertThat(dataset.getVariableNames()).containsExactly(
                    "time", "temp_station_names", "temp", "flow_station_names", "flow");
            assertThat(dataset.getDimensionLength("temp_stations")).hasValue(2);
            assertThat(dataset.getDimensionLength("flow_stations")).hasValue(1);
            assertThat(dataset.getDimensionLength("temp_axis3")).hasValue(2);
            assertThat(dataset.getDimensionLength("flow_axis3")).hasValue(2);
        }

        TimeSeriesHandle flow = Fixtures.emptyLike(Fixtures.deviceB("flow"), Fixtures.WINDOW);
        NetcdfInterface reader = session(false, false);
        reader.log(flow);
        reader.read();
        assertThat(flow.getSeries()).isEqualTo(Fixtures.deviceB("flow").getSeries());
    }

    @Test
    @DisplayName("Una magnitud llamada como la coordenada de otra del mismo fichero falla con NAME_COLLISION y no deja fichero")
    void shared_withClashingCoordinateName_shouldFailWithoutLeavingFile() {
        // ARRANGE: 'temp' crea la coordenada 'temp_station_names' en el fichero compartido
        NetcdfInterface writer = session(false, false);
        writer.log(Fixtures.deviceA("temp"));
        writer.log(Fixtures.deviceA("temp_station_names"));
        Path target = tempDir.resolve("output").resolve("hland.json");

        // ACT & ASSERT
        assertThatThrownBy(writer::write)
                .isInstanceOf(NetcdfIoException.class)
                .hasMessageContaining(target.toString())
                .hasMessageContaining("temp_station_names")
                .extracting(e -> ((NetcdfIoException) e).getKind())
                .isEqualTo(ErrorKind.NAME_COLLISION);
        assertThat(target).doesNotExist();
    }

    @Test
    @DisplayName("Una ventana de lectura con el paso del fichero pero desplazada media hora falla con INCONSISTENT_DATA")
    void read_withMisalignedWindow_shouldFail() throws IOException {
        NetcdfInterface writer = session(false, false);
        writer.log(Fixtures.deviceA("sm"));
        writer.write();

        // [00:30, 02:30) con paso horario cae entre los puntos del fichero
        Timegrid halfPast = new Timegrid(
                Fixtures.START.plusMinutes(30), Fixtures.START.plusMinutes(150), Duration.ofHours(1));
        TimeSeriesHandle a = Fixtures.emptyLike(Fixtures.deviceA("sm"), halfPast);
        NetcdfInterface reader = session(false, false);
        reader.log(a);

        assertThatThrownBy(reader::read)
                .isInstanceOf(NetcdfIoException.class)
                .hasMessageContaining("no está alineada")
                .extracting(e -> ((NetcdfIoException) e).getKind())
                .isEqualTo(ErrorKind.INCONSISTENT_DATA);
        assertThat(a.getSeries().toArray()).containsOnly(Double.NaN);
    }

    @Test
    @DisplayName("Leer con una subventana de 2 pasos devuelve solo los pasos que solapan, según la ventana del fichero")
    void read_withSubWindow_shouldUseWindowParsedFromFile() throws IOException {
        // ARRANGE: se escribe la ventana de 4 pasos
        NetcdfInterface writer = session(false, false);
        writer.log(Fixtures.deviceB("sm"));
        writer.write();

        // La lectura solo conoce la subventana [01:00, 03:00)
        TimeSeriesHandle b = Fixtures.emptyLike(Fixtures.deviceB("sm"), Fixtures.hourly(1, 3));
        NetcdfInterface reader = session(false, false);
        reader.log(b);

        // ACT
        reader.read();

        // ASSERT
        assertThat(b.getSeries()).isEqualTo(SeriesArray.of(new double[][]{{20, 21}, {30, 31}}));
    }

    @Test
    @DisplayName("Con ajuste permisivo, los pasos fuera del fichero se leen como NaN")
    void read_beyondFileWindow_withLenientAdjuster_shouldPadWithNaN() throws IOException {
        NetcdfInterface writer = session(false, false);
        writer.log(Fixtures.deviceA("sm"));
        writer.write();

        TimeSeriesHandle a = TimeSeriesHandle.builder()
                .deviceName("A").baseName("sm").category("hland")
                .window(Fixtures.hourly(2, 6))
                .adjuster(WindowSeriesAdjuster.lenient())
                .build();
        NetcdfInterface reader = session(false, false);
        reader.log(a);
        reader.read();

        assertThat(a.getSeries().toArray()).containsExactly(3.0, 4.0, Double.NaN, Double.NaN);
    }

    @Test
    @DisplayName("Un dispositivo ausente del fichero interrumpe la lectura con MISSING_DEVICE_DATA")
    void read_unknownDevice_shouldFail() throws IOException {
        NetcdfInterface writer = session(false, false);
        writer.log(Fixtures.deviceA("sm"));
        writer.write();

        TimeSeriesHandle other = TimeSeriesHandle.builder()
                .deviceName("C").baseName("sm").category("hland").window(Fixtures.WINDOW).build();
        NetcdfInterface reader = session(false, false);
        reader.log(other);

        assertThatThrownBy(reader::read)
                .isInstanceOf(NetcdfIoException.class)
                .hasMessageContaining("`C`")
                .extracting(e -> ((NetcdfIoException) e).getKind())
                .isEqualTo(ErrorKind.MISSING_DEVICE_DATA);
    }

    @Test
    @DisplayName("Las magnitudes de nodo se escriben en el directorio de nodos")
    void write_nodeQuantities_shouldUseNodePath() throws IOException {
        TimeSeriesHandle node = TimeSeriesHandle.builder()
                .deviceName("dill").baseName("sim").nodeAnchored(true).window(Fixtures.WINDOW)
                .series(SeriesArray.of(5, 6, 7, 8)).build();
        NetcdfInterface writer = session(false, true);
        writer.log(node);

        writer.write();

        assertThat(tempDir.resolve("nodes").resolve("node_sim.json")).exists();
        assertThat(writer.getFiles()).extracting(NetcdfFile::getName).containsExactly("node_sim");
    }
}
