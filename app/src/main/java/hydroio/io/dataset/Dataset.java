package hydroio.io.dataset;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Fichero autodescriptivo de arrays multidimensionales abierto para lectura o escritura.
 * <p>
 * Modelo de datos al estilo NetCDF: dimensiones con nombre y longitud, y variables
 * tipadas definidas sobre esas dimensiones, con atributos de texto. El recurso se libera
 * con {@link #close()}; un fichero abierto para escritura se materializa en disco al
 * cerrarse, salvo que se haya descartado con {@link #discard()}.
 */
public interface Dataset extends AutoCloseable {

    Path getPath();

    boolean isWritable();

    /**
     * @throws DatasetException con {@link DatasetException.Reason#NAME_IN_USE} si ya existe
     *                          una dimensión con ese nombre.
     */
    void createDimension(String name, int length) throws DatasetException;

    OptionalInt getDimensionLength(String name);

    /**
     * Crea una variable. Las variables {@link DataType#DOUBLE} se inicializan con
     * {@code fillValue}.
     *
     * @throws DatasetException si el nombre ya está en uso o alguna dimensión no existe.
     */
    DatasetVariable createVariable(String name, DataType dataType, List<String> dimensions, double fillValue)
            throws DatasetException;

    /**
     * @throws DatasetException con {@link DatasetException.Reason#UNKNOWN_VARIABLE} si la
     *                          variable no existe.
     */
    DatasetVariable findVariable(String name) throws DatasetException;

    Optional<DatasetVariable> lookupVariable(String name);

    List<String> getVariableNames();

    /**
     * Marca el fichero para que {@link #close()} no escriba nada en disco.
     */
    void discard();

    @Override
    void close() throws DatasetException;
}
