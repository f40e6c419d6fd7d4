package hydroio.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Gestiona la serialización (escritura) y deserialización (lectura) de objetos
 * hacia y desde archivos JSON.
 * <p>
 * La escritura es atómica: el contenido se vuelca primero a un fichero temporal en el
 * mismo directorio y después se mueve a su ruta definitiva, de modo que un fallo nunca
 * deja un fichero a medio escribir.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es costoso de crear y thread-safe: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON en la ruta especificada.
     * Si el archivo ya existe, será sobrescrito.
     *
     * @param data     El objeto a serializar. No puede ser nulo.
     * @param filePath La ruta completa del archivo de destino.
     * @param <T>      El tipo del objeto a serializar.
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public <T> void writeToFile(T data, Path filePath) throws IOException {
        Path path = filePath.toAbsolutePath();
        log.debug("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path);

        Files.createDirectories(path.getParent());
        Path temporary = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temporary.toFile(), data);
            moveIntoPlace(temporary, path);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path, e);
            Files.deleteIfExists(temporary);
            throw e;
        }
    }

    private static void moveIntoPlace(Path temporary, Path target) throws IOException {
        try {
            Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("El sistema de ficheros no admite movimientos atómicos; se reemplaza {} directamente.", target);
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Deserializa un archivo JSON para reconstruir un objeto de un tipo específico.
     *
     * @param filePath   La ruta del archivo JSON a leer.
     * @param objectType El tipo de clase al que se debe convertir el JSON.
     * @param <T>        El tipo del objeto a deserializar.
     * @return Una nueva instancia del objeto reconstruido desde el JSON.
     * @throws IOException Si el archivo no se encuentra o hay un error de lectura o formato.
     */
    public <T> T readFromFile(Path filePath, Class<T> objectType) throws IOException {
        Path path = filePath.toAbsolutePath();
        log.debug("Deserializando archivo {} a un objeto de tipo {}", path, objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path, e);
            throw e;
        }
    }
}
