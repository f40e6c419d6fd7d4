package hydroio.domain.series;

import java.util.Objects;

/**
 * Bloque programado para escritura junto con la etiqueta que describe su origen.
 * <p>
 * La etiqueta {@value #UNMODIFIED} indica la serie original del dispositivo; cualquier
 * otra etiqueta ("mean", ...) identifica una agregación espacial previa. Los bloques
 * agregados solo se escriben: la lectura nunca reconstruye una etiqueta agregada.
 *
 * @param values      Valores del bloque.
 * @param aggregation Etiqueta de agregación.
 */
public record LoggedArray(SeriesArray values, String aggregation) {

    public static final String UNMODIFIED = "unmodified";

    public LoggedArray {
        Objects.requireNonNull(values, "Los valores registrados no pueden ser nulos.");
        Objects.requireNonNull(aggregation, "La etiqueta de agregación no puede ser nula.");
        if (aggregation.isBlank()) {
            throw new IllegalArgumentException("La etiqueta de agregación no puede estar vacía.");
        }
    }

    public static LoggedArray unmodified(SeriesArray values) {
        return new LoggedArray(values, UNMODIFIED);
    }

    public static LoggedArray aggregated(SeriesArray values, String aggregation) {
        return new LoggedArray(values, aggregation);
    }

    public boolean isAggregated() {
        return !UNMODIFIED.equals(aggregation);
    }
}
