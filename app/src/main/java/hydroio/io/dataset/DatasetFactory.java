package hydroio.io.dataset;

import java.nio.file.Path;

/**
 * Abre ficheros de arrays existentes o crea ficheros nuevos.
 */
public interface DatasetFactory {

    /**
     * @throws DatasetException si el fichero no existe o no puede interpretarse.
     */
    Dataset open(Path path) throws DatasetException;

    /**
     * Prepara un fichero nuevo en {@code path}. Un fichero previo en la misma ruta se
     * sustituye al cerrar el nuevo.
     */
    Dataset create(Path path) throws DatasetException;
}
