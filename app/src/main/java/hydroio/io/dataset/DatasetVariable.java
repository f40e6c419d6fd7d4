package hydroio.io.dataset;

import hydroio.domain.series.SeriesArray;
import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Variable tipada de un {@link Dataset}.
 * <p>
 * Las variables {@link DataType#DOUBLE} guardan un bloque denso con la forma de sus
 * dimensiones. Las variables {@link DataType#CHAR} guardan cadenas de anchura fija: la
 * última dimensión es la anchura máxima y las anteriores indexan las cadenas.
 */
public class DatasetVariable {

    @Getter
    private final String name;
    @Getter
    private final DataType dataType;
    @Getter
    private final List<String> dimensions;
    private final int[] shape;
    private final Path path;
    private final boolean writable;
    private final Map<String, String> attributes = new LinkedHashMap<>();

    private double[] values;
    private List<String> strings;

    DatasetVariable(Path path, String name, DataType dataType, List<String> dimensions, int[] shape,
                    double fillValue, boolean writable) {
        this.path = path;
        this.name = name;
        this.dataType = dataType;
        this.dimensions = List.copyOf(dimensions);
        this.shape = shape.clone();
        this.writable = writable;
        if (dataType == DataType.DOUBLE) {
            this.values = new double[SeriesArray.sizeOf(shape)];
            Arrays.fill(this.values, fillValue);
        } else {
            this.strings = new ArrayList<>(Collections.nCopies(stringCount(), ""));
        }
    }

    public int[] getShape() {
        return shape.clone();
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Optional<String> getAttribute(String attributeName) {
        return Optional.ofNullable(attributes.get(attributeName));
    }

    public void setAttribute(String attributeName, String value) throws DatasetException {
        checkWritable();
        attributes.put(attributeName, value);
    }

    /**
     * Sustituye el bloque completo de valores.
     *
     * @throws DatasetException si la forma del bloque no coincide con la de la variable.
     */
    public void write(SeriesArray array) throws DatasetException {
        checkWritable();
        checkType(DataType.DOUBLE);
        if (!Arrays.equals(array.getShape(), shape)) {
            throw new DatasetException(DatasetException.Reason.SHAPE_MISMATCH, String.format(
                    "La variable `%s` del fichero `%s` tiene forma %s, pero se intentó escribir un bloque de forma %s.",
                    name, path, Arrays.toString(shape), Arrays.toString(array.getShape())));
        }
        this.values = array.toArray();
    }

    public SeriesArray read() throws DatasetException {
        checkType(DataType.DOUBLE);
        return new SeriesArray(shape, values);
    }

    /**
     * Sustituye todas las cadenas de una variable {@link DataType#CHAR}.
     *
     * @throws DatasetException si el número de cadenas no coincide o alguna supera la anchura.
     */
    public void writeStrings(List<String> rows) throws DatasetException {
        checkWritable();
        checkType(DataType.CHAR);
        if (rows.size() != stringCount()) {
            throw new DatasetException(DatasetException.Reason.SHAPE_MISMATCH, String.format(
                    "La variable `%s` del fichero `%s` admite %d cadenas, pero se intentó escribir %d.",
                    name, path, stringCount(), rows.size()));
        }
        int width = shape.length == 0 ? 0 : shape[shape.length - 1];
        for (String row : rows) {
            if (row.length() > width) {
                throw new DatasetException(DatasetException.Reason.SHAPE_MISMATCH, String.format(
                        "La cadena `%s` supera la anchura %d de la variable `%s` del fichero `%s`.",
                        row, width, name, path));
            }
        }
        this.strings = new ArrayList<>(rows);
    }

    public List<String> readStrings() throws DatasetException {
        checkType(DataType.CHAR);
        return List.copyOf(strings);
    }

    private int stringCount() {
        return shape.length == 0 ? 0 : SeriesArray.sizeOf(Arrays.copyOf(shape, shape.length - 1));
    }

    private void checkWritable() throws DatasetException {
        if (!writable) {
            throw new DatasetException(DatasetException.Reason.READ_ONLY,
                    "El fichero `" + path + "` está abierto en modo lectura.");
        }
    }

    private void checkType(DataType expected) throws DatasetException {
        if (dataType != expected) {
            throw new DatasetException(DatasetException.Reason.TYPE_MISMATCH, String.format(
                    "La variable `%s` del fichero `%s` es de tipo %s, no %s.", name, path, dataType, expected));
        }
    }

    // --- Acceso para la persistencia ---

    double[] rawValues() {
        return values;
    }

    List<String> rawStrings() {
        return strings;
    }

    void restore(double[] storedValues, List<String> storedStrings, Map<String, String> storedAttributes) {
        if (dataType == DataType.DOUBLE) {
            this.values = storedValues.clone();
        } else {
            this.strings = new ArrayList<>(storedStrings);
        }
        this.attributes.putAll(storedAttributes);
    }
}
