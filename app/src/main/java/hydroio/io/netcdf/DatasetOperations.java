package hydroio.io.netcdf;

import hydroio.domain.series.SeriesArray;
import hydroio.io.dataset.DataType;
import hydroio.io.dataset.Dataset;
import hydroio.io.dataset.DatasetException;
import hydroio.io.dataset.DatasetVariable;

import java.util.Arrays;
import java.util.List;

/**
 * Envoltorios de las operaciones elementales sobre un {@link Dataset} que añaden el
 * contexto de la operación (fichero, nombre, forma) a los mensajes de error.
 */
final class DatasetOperations {

    private DatasetOperations() {
    }

    static void createDimension(Dataset dataset, String name, int length) throws NetcdfIoException {
        try {
            dataset.createDimension(name, length);
        } catch (DatasetException e) {
            throw new NetcdfIoException(kindOf(e), String.format(
                    "Al intentar añadir la dimensión `%s` con longitud `%d` al fichero `%s`, "
                            + "se produjo el siguiente error: %s",
                    name, length, dataset.getPath(), e.getMessage()), e);
        }
    }

    static DatasetVariable createVariable(Dataset dataset, String name, DataType dataType,
                                          List<String> dimensions, double fillValue) throws NetcdfIoException {
        try {
            return dataset.createVariable(name, dataType, dimensions, fillValue);
        } catch (DatasetException e) {
            throw new NetcdfIoException(kindOf(e), String.format(
                    "Al intentar añadir la variable `%s` con tipo `%s` y dimensiones `%s` al fichero `%s`, "
                            + "se produjo el siguiente error: %s",
                    name, dataType, dimensions, dataset.getPath(), e.getMessage()), e);
        }
    }

    static DatasetVariable queryVariable(Dataset dataset, String name) throws NetcdfIoException {
        return dataset.lookupVariable(name).orElseThrow(() -> new NetcdfIoException(ErrorKind.MISSING_VARIABLE,
                String.format("El fichero `%s` no contiene la variable `%s`.", dataset.getPath(), name)));
    }

    static void writeBlock(Dataset dataset, DatasetVariable variable, SeriesArray array) throws NetcdfIoException {
        try {
            variable.write(array);
        } catch (DatasetException e) {
            throw new NetcdfIoException(kindOf(e), String.format(
                    "Al intentar escribir un bloque de forma %s en la variable `%s` del fichero `%s`, "
                            + "se produjo el siguiente error: %s",
                    Arrays.toString(array.getShape()), variable.getName(), dataset.getPath(), e.getMessage()), e);
        }
    }

    static SeriesArray readBlock(Dataset dataset, DatasetVariable variable) throws NetcdfIoException {
        try {
            return variable.read();
        } catch (DatasetException e) {
            throw new NetcdfIoException(kindOf(e), String.format(
                    "Al intentar leer la variable `%s` del fichero `%s`, se produjo el siguiente error: %s",
                    variable.getName(), dataset.getPath(), e.getMessage()), e);
        }
    }

    static ErrorKind kindOf(DatasetException e) {
        return switch (e.getReason()) {
            case NAME_IN_USE -> ErrorKind.NAME_COLLISION;
            case UNKNOWN_VARIABLE -> ErrorKind.MISSING_VARIABLE;
            default -> ErrorKind.DATASET_FAILURE;
        };
    }
}
