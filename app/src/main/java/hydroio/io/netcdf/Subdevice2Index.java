package hydroio.io.netcdf;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Correspondencia entre nombres de fila ((sub)dispositivos) y su posición en la
 * variable de coordenadas de un fichero.
 * <p>
 * Recuerda la variable y el fichero de procedencia únicamente para los mensajes de error.
 */
public class Subdevice2Index {

    private final Map<String, Integer> indices;
    private final List<String> names;
    private final String variableName;
    private final Path filePath;

    Subdevice2Index(List<String> names, Map<String, Integer> indices, String variableName, Path filePath) {
        this.names = List.copyOf(names);
        this.indices = Map.copyOf(indices);
        this.variableName = variableName;
        this.filePath = filePath;
    }

    /**
     * @return La fila del (sub)dispositivo.
     * @throws NetcdfIoException con {@link ErrorKind#MISSING_DEVICE_DATA} si el fichero no
     *                           contiene datos para ese nombre.
     */
    public int get(String subdeviceName) throws NetcdfIoException {
        Integer index = indices.get(subdeviceName);
        if (index == null) {
            throw new NetcdfIoException(ErrorKind.MISSING_DEVICE_DATA, String.format(
                    "No hay datos para la variable `%s` y el (sub)dispositivo `%s` en el fichero `%s`.",
                    variableName, subdeviceName, filePath));
        }
        return index;
    }

    public int size() {
        return names.size();
    }

    /**
     * Nombres de fila en el orden del fichero.
     */
    public List<String> names() {
        return names;
    }

    public String getVariableName() {
        return variableName;
    }

    public Path getFilePath() {
        return filePath;
    }
}
