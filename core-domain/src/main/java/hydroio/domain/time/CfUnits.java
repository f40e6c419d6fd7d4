package hydroio.domain.time;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Objects;

/**
 * Cadena de unidades temporales al estilo CF: {@code "hours since 2000-01-01 00:00:00"}.
 *
 * @param unit          Unidad de los desplazamientos almacenados en el eje de tiempo.
 * @param referenceDate Fecha a la que se refieren los desplazamientos.
 */
public record CfUnits(CfTimeUnit unit, LocalDateTime referenceDate) {

    private static final String SINCE = " since ";

    static final DateTimeFormatter WRITE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // Separador 'T' o espacio, segundos opcionales y desfase UTC opcional.
    private static final DateTimeFormatter READ_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendPattern("HH:mm")
            .optionalStart().appendPattern(":ss").optionalEnd()
            .optionalEnd()
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    public CfUnits {
        Objects.requireNonNull(unit, "La unidad temporal no puede ser nula.");
        Objects.requireNonNull(referenceDate, "La fecha de referencia no puede ser nula.");
    }

    /**
     * Interpreta una cadena {@code "<unidad> since <fecha>"}.
     * Las fechas sin desfase se toman como UTC; si la cadena trae desfase, la fecha de
     * referencia se convierte a UTC ({@code 06:30:00+01:00} pasa a {@code 05:30:00}).
     *
     * @throws IllegalArgumentException si la cadena no sigue el formato esperado.
     */
    public static CfUnits parse(String text) {
        Objects.requireNonNull(text, "La cadena de unidades no puede ser nula.");
        String trimmed = text.trim();
        int idx = trimmed.indexOf(SINCE);
        if (idx <= 0) {
            throw new IllegalArgumentException(
                    "La cadena de unidades `" + text + "` no sigue el formato `<unidad> since <fecha>`.");
        }
        CfTimeUnit unit = CfTimeUnit.fromCfName(trimmed.substring(0, idx));
        String date = trimmed.substring(idx + SINCE.length()).trim();
        try {
            TemporalAccessor parsed = READ_FORMAT.parse(date);
            LocalDateTime referenceDate = LocalDateTime.from(parsed);
            ZoneOffset offset = parsed.query(TemporalQueries.offset());
            if (offset != null) {
                referenceDate = referenceDate.minusSeconds(offset.getTotalSeconds());
            }
            return new CfUnits(unit, referenceDate);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException(
                    "La fecha de referencia `" + date + "` de la cadena de unidades `" + text + "` no es válida.", e);
        }
    }

    @Override
    public String toString() {
        return unit.getCfName() + SINCE + WRITE_FORMAT.format(referenceDate);
    }
}
