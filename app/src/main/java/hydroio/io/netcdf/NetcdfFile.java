package hydroio.io.netcdf;

import hydroio.config.NetcdfConfig;
import hydroio.domain.series.LoggedArray;
import hydroio.domain.series.SeriesArray;
import hydroio.domain.series.TimeSeriesHandle;
import hydroio.domain.time.CfUnits;
import hydroio.domain.time.Timegrid;
import hydroio.io.dataset.DataType;
import hydroio.io.dataset.Dataset;
import hydroio.io.dataset.DatasetException;
import hydroio.io.dataset.DatasetFactory;
import hydroio.io.dataset.DatasetVariable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Un fichero de arrays: registro ordenado de {@link NetcdfVariable} que comparten el eje
 * de tiempo y un único descriptor abierto durante cada lectura o escritura.
 */
@Slf4j
public class NetcdfFile {

    @Getter
    private final String name;

    @Getter
    private final boolean flatten;

    @Getter
    private final boolean isolate;

    private final NetcdfConfig config;
    private final DatasetFactory datasetFactory;
    private final Map<String, NetcdfVariable> variables = new LinkedHashMap<>();

    public NetcdfFile(String name, boolean flatten, boolean isolate, NetcdfConfig config,
                      DatasetFactory datasetFactory) {
        this.name = name;
        this.flatten = flatten;
        this.isolate = isolate;
        this.config = config;
        this.datasetFactory = datasetFactory;
    }

    /**
     * Registra una serie en la variable que le corresponde, creándola si es la primera vez.
     * <p>
     * Clave: nombre base de la magnitud, más {@code "_<agregación>"} si el bloque está
     * agregado. Variante: agregada si el bloque está agregado; si no, aplanada o profunda
     * según la política de la sesión.
     *
     * @throws IllegalStateException si la clave ya existe con otra variante.
     */
    public void log(TimeSeriesHandle handle, LoggedArray array) {
        boolean aggregated = array != null && array.isAggregated();
        String key = aggregated ? handle.getBaseName() + "_" + array.aggregation() : handle.getBaseName();
        VariableKind kind = aggregated ? VariableKind.AGG : flatten ? VariableKind.FLAT : VariableKind.DEEP;
        NetcdfVariable variable = variables.computeIfAbsent(key, k -> newVariable(k, kind));
        if (variable.getKind() != kind) {
            throw new IllegalStateException(String.format(
                    "La variable `%s` del fichero `%s` ya existe como %s y no puede registrarse como %s.",
                    key, name, variable.getKind(), kind));
        }
        variable.log(handle, array);
    }

    private NetcdfVariable newVariable(String key, VariableKind kind) {
        log.debug("Creando variable `{}` ({}) en el fichero `{}`", key, kind, name);
        return switch (kind) {
            case DEEP -> new NetcdfVariableDeep(key, isolate, config);
            case AGG -> new NetcdfVariableAgg(key, isolate, config);
            case FLAT -> new NetcdfVariableFlat(key, isolate, config);
        };
    }

    public Optional<NetcdfVariable> getVariable(String key) {
        return Optional.ofNullable(variables.get(key));
    }

    /**
     * @throws NoSuchElementException si la variable nunca se registró en este fichero.
     */
    public NetcdfVariable requireVariable(String key) {
        return getVariable(key).orElseThrow(() -> new NoSuchElementException(String.format(
                "El fichero `%s` no gestiona ninguna variable llamada `%s`; nunca se registró. "
                        + "Variables registradas: %s", name, key, variables.keySet())));
    }

    /**
     * Claves de las variables registradas, en orden de registro.
     */
    public List<String> getVariableNames() {
        return List.copyOf(variables.keySet());
    }

    public List<NetcdfVariable> getVariables() {
        return List.copyOf(variables.values());
    }

    /**
     * Los ficheros cuya clave contiene "node" viven en el directorio de nodos; el resto,
     * en el directorio de entrada (lectura) o salida (escritura).
     */
    public Path getFilepathRead() {
        return resolve(config.getInputPath());
    }

    public Path getFilepathWrite() {
        return resolve(config.getOutputPath());
    }

    private Path resolve(Path directory) {
        Path base = name.contains("node") ? config.getNodePath() : directory;
        return base.resolve(name + "." + config.getFileExtension());
    }

    /**
     * Lee el eje de tiempo del fichero y después cada variable registrada, en orden.
     * Los datos se realinean a la ventana de cada serie a partir de la ventana que describe
     * el propio fichero.
     *
     * @throws NetcdfIoException con la ruta del fichero en el mensaje.
     */
    public void read() throws NetcdfIoException {
        Path path = getFilepathRead();
        log.info("Leyendo fichero `{}` ({} variables)", path, variables.size());
        try (Dataset dataset = datasetFactory.open(path)) {
            Timegrid window = queryTimegrid(dataset);
            log.debug("Ventana temporal del fichero `{}`: {}", path, window);
            for (NetcdfVariable variable : variables.values()) {
                variable.read(dataset, window);
            }
        } catch (NetcdfIoException e) {
            throw new NetcdfIoException(e.getKind(), withPath("leer", path, e), e);
        } catch (DatasetException e) {
            throw new NetcdfIoException(DatasetOperations.kindOf(e), withPath("leer", path, e), e);
        } catch (RuntimeException e) {
            throw new NetcdfIoException(ErrorKind.INCONSISTENT_DATA, withPath("leer", path, e), e);
        }
    }

    private Timegrid queryTimegrid(Dataset dataset) throws NetcdfIoException {
        DatasetVariable time = DatasetOperations.queryVariable(dataset, config.getTimeVariable());
        String units = time.getAttribute(config.getUnitsAttribute()).orElseThrow(() -> new NetcdfIoException(
                ErrorKind.INCONSISTENT_DATA, String.format(
                        "La variable `%s` del fichero `%s` no tiene el atributo `%s`.",
                        config.getTimeVariable(), dataset.getPath(), config.getUnitsAttribute())));
        double[] timepoints = DatasetOperations.readBlock(dataset, time).toArray();
        try {
            return Timegrid.fromTimepoints(timepoints, CfUnits.parse(units));
        } catch (IllegalArgumentException e) {
            throw new NetcdfIoException(ErrorKind.INCONSISTENT_DATA, String.format(
                    "No se pudo reconstruir la ventana temporal del fichero `%s` a partir de `%s`: %s",
                    dataset.getPath(), units, e.getMessage()), e);
        }
    }

    /**
     * Escribe el eje de tiempo y después cada variable registrada, en orden.
     * Si algo falla, el fichero se descarta y no llega a sustituir al existente.
     *
     * @param timeunit   Cadena de unidades CF del eje de tiempo.
     * @param timepoints Desplazamientos de cada punto temporal.
     * @throws NetcdfIoException con la ruta del fichero en el mensaje.
     */
    public void write(String timeunit, double[] timepoints) throws NetcdfIoException {
        Path path = getFilepathWrite();
        log.info("Escribiendo fichero `{}` ({} variables, {} puntos temporales)",
                path, variables.size(), timepoints.length);
        try (Dataset dataset = datasetFactory.create(path)) {
            try {
                insertTimepoints(dataset, timeunit, timepoints);
                for (NetcdfVariable variable : variables.values()) {
                    variable.write(dataset);
                }
            } catch (NetcdfIoException | RuntimeException e) {
                dataset.discard();
                throw e;
            }
        } catch (NetcdfIoException e) {
            throw new NetcdfIoException(e.getKind(), withPath("escribir", path, e), e);
        } catch (DatasetException e) {
            throw new NetcdfIoException(DatasetOperations.kindOf(e), withPath("escribir", path, e), e);
        } catch (RuntimeException e) {
            throw new NetcdfIoException(ErrorKind.INCONSISTENT_DATA, withPath("escribir", path, e), e);
        }
    }

    private void insertTimepoints(Dataset dataset, String timeunit, double[] timepoints) throws NetcdfIoException {
        DatasetOperations.createDimension(dataset, config.getTimeDimension(), timepoints.length);
        DatasetVariable time = DatasetOperations.createVariable(dataset, config.getTimeVariable(), DataType.DOUBLE,
                List.of(config.getTimeDimension()), config.getFillValue());
        try {
            time.setAttribute(config.getUnitsAttribute(), timeunit);
        } catch (DatasetException e) {
            throw new NetcdfIoException(DatasetOperations.kindOf(e), String.format(
                    "Al intentar anotar las unidades `%s` del eje de tiempo en el fichero `%s`, "
                            + "se produjo el siguiente error: %s", timeunit, dataset.getPath(), e.getMessage()), e);
        }
        DatasetOperations.writeBlock(dataset, time, SeriesArray.of(timepoints));
    }

    private static String withPath(String action, Path path, Exception e) {
        return String.format("Error al %s el fichero `%s`: %s", action, path, e.getMessage());
    }

    @Override
    public String toString() {
        return "NetcdfFile(" + name + ", " + getVariableNames() + ")";
    }
}
