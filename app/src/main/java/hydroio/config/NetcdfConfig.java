package hydroio.config;

import hydroio.domain.time.CfTimeUnit;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuración de las sesiones de lectura/escritura de ficheros de arrays.
 * <p>
 * Agrupa las tablas de traducción de nombres lógicos a nombres en disco (dimensiones y
 * variables), el valor de relleno y la disposición de directorios. Se pasa explícitamente
 * a cada sesión; no existe estado global mutable.
 */
@Value
@Builder
@With
public class NetcdfConfig {

    // --- TABLA DE DIMENSIONES ---

    /**
     * Dimensión del eje de tiempo (número de puntos temporales).
     */
    @Builder.Default
    String timeDimension = "time";

    /**
     * Dimensión de las filas ("(sub)dispositivos" o estaciones).
     */
    @Builder.Default
    String stationsDimension = "stations";

    /**
     * Dimensión de la longitud máxima de los nombres de fila.
     */
    @Builder.Default
    String charactersDimension = "char_leng_name";

    // --- TABLA DE VARIABLES ---

    @Builder.Default
    String timeVariable = "time";

    /**
     * Variable de coordenadas con los nombres de fila.
     */
    @Builder.Default
    String stationNamesVariable = "station_names";

    /**
     * Atributo del eje de tiempo con la cadena de unidades CF.
     */
    @Builder.Default
    String unitsAttribute = "units";

    // --- VALORES ---

    /**
     * Valor de relleno de las celdas sin dato (p. ej. extensiones menores que el máximo).
     */
    @Builder.Default
    double fillValue = -999.0;

    /**
     * Unidad del eje de tiempo al escribir.
     */
    @Builder.Default
    CfTimeUnit timeUnit = CfTimeUnit.HOURS;

    // --- DIRECTORIOS ---

    /**
     * Directorio de los ficheros cuya clave contiene "node" (lectura y escritura).
     */
    @Builder.Default
    Path nodePath = Paths.get("data", "nodes");

    /**
     * Directorio de lectura del resto de ficheros.
     */
    @Builder.Default
    Path inputPath = Paths.get("data", "input");

    /**
     * Directorio de escritura del resto de ficheros.
     */
    @Builder.Default
    Path outputPath = Paths.get("data", "output");

    @Builder.Default
    String fileExtension = "json";

    public static NetcdfConfig defaults() {
        return NetcdfConfig.builder().build();
    }

    /**
     * Configuración con los tres directorios bajo una raíz común
     * ({@code nodes}, {@code input}, {@code output}).
     */
    public static NetcdfConfig under(Path root) {
        return NetcdfConfig.builder()
                .nodePath(root.resolve("nodes"))
                .inputPath(root.resolve("input"))
                .outputPath(root.resolve("output"))
                .build();
    }
}
