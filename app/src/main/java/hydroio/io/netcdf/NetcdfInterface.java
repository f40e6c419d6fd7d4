package hydroio.io.netcdf;

import hydroio.config.NetcdfConfig;
import hydroio.domain.series.LoggedArray;
import hydroio.domain.series.TimeSeriesHandle;
import hydroio.domain.simulation.GlobalTimegrids;
import hydroio.domain.simulation.TimegridsProvider;
import hydroio.domain.time.CfTimeUnit;
import hydroio.domain.time.Timegrid;
import hydroio.domain.time.Timegrids;
import hydroio.io.dataset.DatasetFactory;
import hydroio.io.dataset.JsonDatasetFactory;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Sesión de lectura o escritura de series temporales en ficheros de arrays.
 * <p>
 * Se crea vacía, se rellena con llamadas a {@link #log(TimeSeriesHandle, LoggedArray)} y
 * se finaliza con una única llamada a {@link #read()} o {@link #write()}, que realiza toda
 * la E/S. Las series se reparten entre ficheros según la categoría de su dispositivo y las
 * políticas de la sesión:
 * <ul>
 *     <li>{@code flatten}: los ejes espaciales se despliegan en filas adicionales.</li>
 *     <li>{@code isolate}: cada magnitud va a su propio fichero.</li>
 * </ul>
 * Al leer hay que usar las mismas políticas que al escribir; no se deducen del fichero.
 */
@Slf4j
public class NetcdfInterface {

    @Getter
    private final boolean flatten;

    @Getter
    private final boolean isolate;

    @Getter
    private final NetcdfConfig config;

    private final TimegridsProvider timegridsProvider;
    private final DatasetFactory datasetFactory;
    private final Map<String, NetcdfFile> files = new LinkedHashMap<>();

    /**
     * @param flatten           Despliega los ejes espaciales en filas.
     * @param isolate           Un fichero por magnitud.
     * @param config            Nombres en disco, valor de relleno y directorios; nulo para
     *                          {@link NetcdfConfig#defaults()}.
     * @param timegridsProvider Origen de la ventana global de simulación; nulo para
     *                          {@link GlobalTimegrids}.
     * @param datasetFactory    Formato de los ficheros; nulo para {@link JsonDatasetFactory}.
     */
    @Builder
    public NetcdfInterface(boolean flatten,
                           boolean isolate,
                           NetcdfConfig config,
                           TimegridsProvider timegridsProvider,
                           DatasetFactory datasetFactory) {
        this.flatten = flatten;
        this.isolate = isolate;
        this.config = config == null ? NetcdfConfig.defaults() : config;
        this.timegridsProvider = timegridsProvider == null ? GlobalTimegrids.getInstance() : timegridsProvider;
        this.datasetFactory = datasetFactory == null ? new JsonDatasetFactory() : datasetFactory;
    }

    /**
     * Registra la serie de un dispositivo para la próxima lectura o escritura.
     *
     * @param handle Serie del dispositivo.
     * @param array  Bloque a escribir (p. ej. una agregación); nulo para usar la propia serie.
     */
    public void log(TimeSeriesHandle handle, LoggedArray array) {
        String key = fileKey(handle, array);
        NetcdfFile file = files.computeIfAbsent(key, k -> {
            log.debug("Creando fichero `{}` (flatten={}, isolate={})", k, flatten, isolate);
            return new NetcdfFile(k, flatten, isolate, config, datasetFactory);
        });
        file.log(handle, array);
    }

    public void log(TimeSeriesHandle handle) {
        log(handle, null);
    }

    /**
     * Clave de fichero: {@code "node"} para magnitudes de nodo o la categoría del dispositivo
     * en otro caso; con {@code isolate}, seguida de {@code "_<magnitud>"} y, si el bloque
     * está agregado, de {@code "_<agregación>"}.
     */
    String fileKey(TimeSeriesHandle handle, LoggedArray array) {
        StringBuilder key = new StringBuilder(handle.isNodeAnchored() ? "node" : handle.getCategory());
        if (isolate) {
            key.append('_').append(handle.getBaseName());
            if (array != null && array.isAggregated()) {
                key.append('_').append(array.aggregation());
            }
        }
        return key.toString();
    }

    /**
     * Lee todos los ficheros registrados, en orden de registro. El primer fallo interrumpe
     * la sesión.
     */
    public void read() throws NetcdfIoException {
        log.info("Iniciando lectura de {} ficheros", files.size());
        for (NetcdfFile file : files.values()) {
            file.read();
        }
    }

    /**
     * Escribe todos los ficheros registrados, en orden de registro, con un eje de tiempo
     * común derivado de la ventana de inicialización global. Una sesión vacía no hace nada.
     *
     * @throws NetcdfIoException con {@link ErrorKind#NO_GLOBAL_WINDOW} si no hay ventana
     *                           global configurada.
     */
    public void write() throws NetcdfIoException {
        if (files.isEmpty()) {
            log.debug("Sesión vacía: no hay nada que escribir");
            return;
        }
        Timegrids timegrids = timegridsProvider.current().orElseThrow(() -> new NetcdfIoException(
                ErrorKind.NO_GLOBAL_WINDOW,
                "No hay ventana temporal global de simulación; no se pueden escribir los ficheros " + files.keySet()));
        Timegrid init = timegrids.getInit();
        CfTimeUnit unit = config.getTimeUnit();
        String timeunit = init.toCfUnits(unit);
        double[] timepoints = init.toTimepoints(unit);
        log.info("Iniciando escritura de {} ficheros ({})", files.size(), timeunit);
        for (NetcdfFile file : files.values()) {
            file.write(timeunit, timepoints);
        }
    }

    public Optional<NetcdfFile> getFile(String key) {
        return Optional.ofNullable(files.get(key));
    }

    /**
     * @throws NoSuchElementException si el fichero nunca se registró en esta sesión.
     */
    public NetcdfFile requireFile(String key) {
        return getFile(key).orElseThrow(() -> new NoSuchElementException(String.format(
                "La sesión no gestiona ningún fichero llamado `%s`; nunca se registró. Ficheros registrados: %s",
                key, files.keySet())));
    }

    /**
     * Claves de los ficheros registrados, en orden de registro.
     */
    public List<String> getFileNames() {
        return List.copyOf(files.keySet());
    }

    public List<NetcdfFile> getFiles() {
        return List.copyOf(files.values());
    }
}
