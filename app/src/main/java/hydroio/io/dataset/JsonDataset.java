package hydroio.io.dataset;

import hydroio.domain.series.SeriesArray;
import hydroio.io.JsonFileHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * {@link Dataset} persistido como documento JSON mediante {@link JsonFileHandler}.
 * <p>
 * El contenido completo se mantiene en memoria mientras el fichero está abierto. En modo
 * escritura nada llega a disco hasta {@link #close()}, y la sustitución del fichero es
 * atómica: un fichero descartado o una escritura fallida dejan intacto lo que hubiera.
 */
@Slf4j
public class JsonDataset implements Dataset {

    private final Path path;
    private final boolean writable;
    private final JsonFileHandler fileHandler;
    private final Map<String, Integer> dimensions = new LinkedHashMap<>();
    private final Map<String, DatasetVariable> variables = new LinkedHashMap<>();

    private boolean discarded;
    private boolean closed;

    private JsonDataset(Path path, boolean writable, JsonFileHandler fileHandler) {
        this.path = path;
        this.writable = writable;
        this.fileHandler = fileHandler;
    }

    static JsonDataset create(Path path, JsonFileHandler fileHandler) {
        log.debug("Creando fichero de arrays {}", path);
        return new JsonDataset(path, true, fileHandler);
    }

    static JsonDataset open(Path path, JsonFileHandler fileHandler) throws DatasetException {
        if (!Files.exists(path)) {
            throw new DatasetException(DatasetException.Reason.IO_ERROR,
                    "El fichero `" + path + "` no existe.");
        }
        DatasetDocument document;
        try {
            document = fileHandler.readFromFile(path, DatasetDocument.class);
        } catch (IOException e) {
            throw new DatasetException(DatasetException.Reason.CORRUPT_FILE,
                    "El fichero `" + path + "` no puede interpretarse: " + e.getMessage(), e);
        }
        if (!DatasetDocument.FORMAT.equals(document.getFormat())) {
            throw new DatasetException(DatasetException.Reason.CORRUPT_FILE, String.format(
                    "El fichero `%s` declara el formato `%s` en lugar de `%s`.",
                    path, document.getFormat(), DatasetDocument.FORMAT));
        }
        if (document.getDimensions() == null || document.getVariables() == null) {
            throw new DatasetException(DatasetException.Reason.CORRUPT_FILE,
                    "El fichero `" + path + "` no declara dimensiones o variables.");
        }
        JsonDataset dataset = new JsonDataset(path, false, fileHandler);
        dataset.dimensions.putAll(document.getDimensions());
        for (DatasetDocument.VariableEntry entry : document.getVariables()) {
            dataset.restoreVariable(entry);
        }
        log.debug("Abierto fichero de arrays {} ({} dimensiones, {} variables)",
                path, dataset.dimensions.size(), dataset.variables.size());
        return dataset;
    }

    private void restoreVariable(DatasetDocument.VariableEntry entry) throws DatasetException {
        if (entry.getName() == null || entry.getDataType() == null || entry.getDimensions() == null) {
            throw new DatasetException(DatasetException.Reason.CORRUPT_FILE,
                    "El fichero `" + path + "` contiene una variable sin nombre, tipo o dimensiones.");
        }
        int[] shape = resolveShape(entry.getName(), entry.getDimensions());
        DatasetVariable variable = new DatasetVariable(
                path, entry.getName(), entry.getDataType(), entry.getDimensions(), shape, 0.0, false);
        int expected = SeriesArray.sizeOf(shape);
        if (entry.getDataType() == DataType.DOUBLE
                && (entry.getValues() == null || entry.getValues().length != expected)) {
            throw new DatasetException(DatasetException.Reason.CORRUPT_FILE, String.format(
                    "La variable `%s` del fichero `%s` no contiene los %d valores que exige su forma.",
                    entry.getName(), path, expected));
        }
        if (entry.getDataType() == DataType.CHAR && entry.getStrings() == null) {
            throw new DatasetException(DatasetException.Reason.CORRUPT_FILE, String.format(
                    "La variable de caracteres `%s` del fichero `%s` no contiene cadenas.", entry.getName(), path));
        }
        variable.restore(entry.getValues(), entry.getStrings(),
                entry.getAttributes() == null ? Map.of() : entry.getAttributes());
        variables.put(entry.getName(), variable);
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public boolean isWritable() {
        return writable;
    }

    @Override
    public void createDimension(String name, int length) throws DatasetException {
        checkWritable();
        if (length < 0) {
            throw new DatasetException(DatasetException.Reason.SHAPE_MISMATCH,
                    "La dimensión `" + name + "` no puede tener longitud negativa (" + length + ").");
        }
        if (dimensions.containsKey(name)) {
            throw new DatasetException(DatasetException.Reason.NAME_IN_USE,
                    "El nombre de dimensión `" + name + "` ya está en uso.");
        }
        dimensions.put(name, length);
    }

    @Override
    public OptionalInt getDimensionLength(String name) {
        Integer length = dimensions.get(name);
        return length == null ? OptionalInt.empty() : OptionalInt.of(length);
    }

    @Override
    public DatasetVariable createVariable(String name, DataType dataType, List<String> dimensionNames,
                                          double fillValue) throws DatasetException {
        checkWritable();
        if (variables.containsKey(name)) {
            throw new DatasetException(DatasetException.Reason.NAME_IN_USE,
                    "El nombre de variable `" + name + "` ya está en uso.");
        }
        int[] shape = resolveShape(name, dimensionNames);
        DatasetVariable variable = new DatasetVariable(path, name, dataType, dimensionNames, shape, fillValue, true);
        variables.put(name, variable);
        return variable;
    }

    private int[] resolveShape(String variableName, List<String> dimensionNames) throws DatasetException {
        int[] shape = new int[dimensionNames.size()];
        for (int i = 0; i < shape.length; i++) {
            Integer length = dimensions.get(dimensionNames.get(i));
            if (length == null) {
                throw new DatasetException(DatasetException.Reason.UNKNOWN_DIMENSION, String.format(
                        "No existe la dimensión `%s` requerida por la variable `%s`.",
                        dimensionNames.get(i), variableName));
            }
            shape[i] = length;
        }
        return shape;
    }

    @Override
    public DatasetVariable findVariable(String name) throws DatasetException {
        DatasetVariable variable = variables.get(name);
        if (variable == null) {
            throw new DatasetException(DatasetException.Reason.UNKNOWN_VARIABLE,
                    "El fichero `" + path + "` no contiene la variable `" + name + "`.");
        }
        return variable;
    }

    @Override
    public Optional<DatasetVariable> lookupVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    @Override
    public List<String> getVariableNames() {
        return List.copyOf(variables.keySet());
    }

    @Override
    public void discard() {
        this.discarded = true;
    }

    @Override
    public void close() throws DatasetException {
        if (closed) {
            return;
        }
        closed = true;
        if (!writable) {
            return;
        }
        if (discarded) {
            log.debug("Fichero de arrays {} descartado; no se escribe en disco.", path);
            return;
        }
        try {
            fileHandler.writeToFile(toDocument(), path);
        } catch (IOException e) {
            throw new DatasetException(DatasetException.Reason.IO_ERROR,
                    "No se pudo escribir el fichero `" + path + "`: " + e.getMessage(), e);
        }
    }

    private DatasetDocument toDocument() {
        List<DatasetDocument.VariableEntry> entries = new ArrayList<>();
        for (DatasetVariable variable : variables.values()) {
            entries.add(new DatasetDocument.VariableEntry(
                    variable.getName(),
                    variable.getDataType(),
                    new ArrayList<>(variable.getDimensions()),
                    new LinkedHashMap<>(variable.getAttributes()),
                    variable.getDataType() == DataType.DOUBLE ? variable.rawValues() : null,
                    variable.getDataType() == DataType.CHAR ? new ArrayList<>(variable.rawStrings()) : null));
        }
        return new DatasetDocument(DatasetDocument.FORMAT, DatasetDocument.VERSION,
                new LinkedHashMap<>(dimensions), entries);
    }

    private void checkWritable() throws DatasetException {
        if (closed) {
            throw new DatasetException(DatasetException.Reason.IO_ERROR, "El fichero `" + path + "` ya está cerrado.");
        }
        if (!writable) {
            throw new DatasetException(DatasetException.Reason.READ_ONLY,
                    "El fichero `" + path + "` está abierto en modo lectura.");
        }
    }
}
