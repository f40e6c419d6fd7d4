package hydroio.io.netcdf;

import hydroio.config.NetcdfConfig;
import hydroio.domain.series.LoggedArray;
import hydroio.domain.series.SeriesArray;
import hydroio.domain.series.TimeSeriesHandle;
import hydroio.domain.time.Timegrid;
import hydroio.io.dataset.DataType;
import hydroio.io.dataset.Dataset;
import hydroio.io.dataset.DatasetException;
import hydroio.io.dataset.DatasetVariable;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Relaciona las series de una misma magnitud, registradas por varios dispositivos, con
 * una única variable de un fichero de arrays.
 * <p>
 * Contrato común de las tres variantes ({@link NetcdfVariableDeep},
 * {@link NetcdfVariableAgg} y {@link NetcdfVariableFlat}): gestión de los dispositivos
 * registrados, prefijos de nombres y la variable de coordenadas con los nombres de fila.
 * Todos los dispositivos de una variable comparten rango espacial; sus extensiones pueden
 * diferir.
 */
public abstract class NetcdfVariable {

    /**
     * Clave de la variable, que es también su nombre en el fichero.
     */
    @Getter
    protected final String name;

    @Getter
    protected final boolean isolate;

    protected final NetcdfConfig config;

    private final Map<String, TimeSeriesHandle> sequences = new LinkedHashMap<>();
    private final Map<String, LoggedArray> arrays = new LinkedHashMap<>();

    protected NetcdfVariable(String name, boolean isolate, NetcdfConfig config) {
        this.name = name;
        this.isolate = isolate;
        this.config = config;
    }

    public abstract VariableKind getKind();

    /**
     * Registra la serie de un dispositivo, sustituyendo cualquier registro previo del
     * mismo dispositivo.
     *
     * @param handle Serie del dispositivo.
     * @param array  Bloque a escribir; nulo para usar la serie propia del dispositivo
     *               (y siempre al leer).
     */
    public void log(TimeSeriesHandle handle, LoggedArray array) {
        validate(handle, array);
        sequences.put(handle.getDeviceName(), handle);
        arrays.put(handle.getDeviceName(), array);
    }

    /**
     * Comprobaciones de compatibilidad propias de cada variante.
     */
    protected void validate(TimeSeriesHandle handle, LoggedArray array) {
        if (array == null) {
            return;
        }
        int[] shape = array.values().getShape();
        int[] extents = Arrays.copyOfRange(shape, 1, shape.length);
        if (!Arrays.equals(extents, handle.getSpatialShape())) {
            throw new IllegalArgumentException(String.format(
                    "El bloque registrado para `%s` del dispositivo `%s` tiene extensiones espaciales %s, "
                            + "pero la serie define %s.",
                    name, handle.getDeviceName(), Arrays.toString(extents),
                    Arrays.toString(handle.getSpatialShape())));
        }
    }

    /**
     * Nombres de los dispositivos registrados, en orden de registro.
     */
    public List<String> getDeviceNames() {
        return List.copyOf(sequences.keySet());
    }

    public Optional<TimeSeriesHandle> getHandle(String deviceName) {
        return Optional.ofNullable(sequences.get(deviceName));
    }

    /**
     * @throws NoSuchElementException si el dispositivo nunca se registró en esta variable.
     */
    public TimeSeriesHandle requireHandle(String deviceName) {
        return getHandle(deviceName).orElseThrow(() -> new NoSuchElementException(String.format(
                "La variable `%s` no gestiona ninguna serie del (sub)dispositivo `%s`; "
                        + "nunca se registró. Dispositivos registrados: %s",
                name, deviceName, sequences.keySet())));
    }

    /**
     * Bloque registrado para escritura, si se pasó uno explícitamente.
     */
    public Optional<LoggedArray> getLoggedArray(String deviceName) {
        return Optional.ofNullable(arrays.get(deviceName));
    }

    protected List<TimeSeriesHandle> handles() {
        return new ArrayList<>(sequences.values());
    }

    /**
     * Valores a escribir para un dispositivo: el bloque registrado o, en su defecto, la
     * serie del propio dispositivo.
     */
    protected SeriesArray valuesOf(TimeSeriesHandle handle) {
        LoggedArray array = arrays.get(handle.getDeviceName());
        return array != null ? array.values() : handle.getSeries();
    }

    /**
     * Prefijo de los nombres de dimensiones y variables auxiliares. Vacío cuando la
     * variable está aislada en su propio fichero; {@code "<nombre>_"} en otro caso, para
     * evitar colisiones entre variables de un fichero compartido.
     */
    public String getPrefix() {
        return isolate ? "" : name + "_";
    }

    /**
     * Nombres de fila ((sub)dispositivos), en el orden de las filas de {@link #getArray()}.
     */
    public abstract List<String> getSubdeviceNames();

    public abstract List<String> getDimensions();

    public abstract int[] getShape();

    /**
     * Bloque con los valores de todos los dispositivos registrados, tal y como se escribe.
     */
    public abstract SeriesArray getArray();

    /**
     * Lee los datos de esta variable y los asigna a las series registradas.
     *
     * @param dataset Fichero abierto para lectura.
     * @param window  Ventana temporal que cubren los datos del fichero.
     */
    public abstract void read(Dataset dataset, Timegrid window) throws NetcdfIoException;

    public abstract void write(Dataset dataset) throws NetcdfIoException;

    // --- Variable de coordenadas ---

    /**
     * Escribe los nombres de fila como variable de caracteres de anchura fija, con las
     * dimensiones {@code <prefijo>stations} y {@code <prefijo>char_leng_name}.
     */
    public void insertSubdeviceNames(Dataset dataset) throws NetcdfIoException {
        String prefix = getPrefix();
        String stations = prefix + config.getStationsDimension();
        String characters = prefix + config.getCharactersDimension();
        String variableName = prefix + config.getStationNamesVariable();
        List<String> names = getSubdeviceNames();
        int width = names.stream().mapToInt(String::length).max().orElse(0);
        DatasetOperations.createDimension(dataset, stations, names.size());
        DatasetOperations.createDimension(dataset, characters, width);
        DatasetVariable variable = DatasetOperations.createVariable(
                dataset, variableName, DataType.CHAR, List.of(stations, characters), config.getFillValue());
        try {
            variable.writeStrings(names);
        } catch (DatasetException e) {
            throw new NetcdfIoException(DatasetOperations.kindOf(e), String.format(
                    "Al intentar escribir los nombres de fila de la variable `%s` en el fichero `%s`, "
                            + "se produjo el siguiente error: %s", name, dataset.getPath(), e.getMessage()), e);
        }
    }

    /**
     * Lee los nombres de fila probando primero el nombre con prefijo y después el nombre
     * sin prefijo, de modo que una variable escrita aislada puede leerse en un contexto
     * compartido y viceversa.
     *
     * @throws NetcdfIoException con {@link ErrorKind#MISSING_COORDINATE} si no existe
     *                           ninguna de las dos variables.
     */
    public List<String> querySubdeviceNames(Dataset dataset) throws NetcdfIoException {
        List<String> candidates = List.of(
                name + "_" + config.getStationNamesVariable(),
                config.getStationNamesVariable());
        for (String candidate : candidates) {
            Optional<DatasetVariable> variable = dataset.lookupVariable(candidate);
            if (variable.isPresent()) {
                try {
                    return variable.get().readStrings();
                } catch (DatasetException e) {
                    throw new NetcdfIoException(DatasetOperations.kindOf(e), String.format(
                            "Al intentar leer los nombres de fila `%s` del fichero `%s`, "
                                    + "se produjo el siguiente error: %s",
                            candidate, dataset.getPath(), e.getMessage()), e);
                }
            }
        }
        throw new NetcdfIoException(ErrorKind.MISSING_COORDINATE, String.format(
                "El fichero `%s` no contiene ninguna variable llamada `%s` ni `%s` que defina "
                        + "las coordenadas de la variable `%s`.",
                dataset.getPath(), candidates.get(0), candidates.get(1), name));
    }

    /**
     * Construye la correspondencia nombre de fila → índice de fila.
     *
     * @throws NetcdfIoException con {@link ErrorKind#DUPLICATE_SUBDEVICE} si algún nombre se
     *                           repite; se informa del primero encontrado en el orden del fichero.
     */
    public Subdevice2Index querySubdevice2Index(Dataset dataset) throws NetcdfIoException {
        List<String> names = querySubdeviceNames(dataset);
        Optional<String> duplicate = firstDuplicate(names);
        if (duplicate.isPresent()) {
            throw new NetcdfIoException(ErrorKind.DUPLICATE_SUBDEVICE, String.format(
                    "El fichero `%s` contiene nombres de (sub)dispositivo duplicados para la variable `%s` "
                            + "(el primer duplicado encontrado es `%s`).",
                    dataset.getPath(), name, duplicate.get()));
        }
        Map<String, Integer> indices = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            indices.put(names.get(i), i);
        }
        return new Subdevice2Index(names, indices, name, dataset.getPath());
    }

    /**
     * Primer nombre (por posición) que vuelve a aparecer más adelante en la lista.
     */
    static Optional<String> firstDuplicate(List<String> names) {
        Set<String> seen = new HashSet<>();
        Set<String> repeated = new HashSet<>();
        for (String candidate : names) {
            if (!seen.add(candidate)) {
                repeated.add(candidate);
            }
        }
        return names.stream().filter(repeated::contains).findFirst();
    }

    /**
     * Realinea un bloque leído a la ventana de la serie y se lo asigna.
     */
    protected void assign(TimeSeriesHandle handle, Timegrid window, SeriesArray block) throws NetcdfIoException {
        try {
            handle.setSeries(handle.adjustSeries(window, block));
        } catch (IllegalArgumentException e) {
            throw new NetcdfIoException(ErrorKind.INCONSISTENT_DATA, String.format(
                    "Los datos de la variable `%s` para el dispositivo `%s` no encajan con su serie: %s",
                    name, handle.getDeviceName(), e.getMessage()), e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ", " + getDeviceNames() + ")";
    }
}
