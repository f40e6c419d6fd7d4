package hydroio.domain.time;

import java.time.Duration;
import java.util.Locale;

/**
 * Unidades temporales admitidas en las cadenas de unidades CF
 * ({@code "<unidad> since <fecha>"}) del eje de tiempo de los ficheros.
 */
public enum CfTimeUnit {
    SECONDS("seconds", Duration.ofSeconds(1)),
    MINUTES("minutes", Duration.ofMinutes(1)),
    HOURS("hours", Duration.ofHours(1)),
    DAYS("days", Duration.ofDays(1));

    private final String cfName;
    private final Duration duration;

    CfTimeUnit(String cfName, Duration duration) {
        this.cfName = cfName;
        this.duration = duration;
    }

    public String getCfName() {
        return cfName;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Convierte un número (posiblemente fraccionario) de unidades en una duración,
     * redondeada al segundo.
     */
    public Duration toDuration(double amount) {
        return Duration.ofSeconds(Math.round(amount * duration.getSeconds()));
    }

    /**
     * Expresa una duración en esta unidad.
     */
    public double fromDuration(Duration value) {
        return (double) value.getSeconds() / duration.getSeconds();
    }

    /**
     * Interpreta el nombre CF de una unidad. Acepta también el singular
     * ("hour") y es insensible a mayúsculas.
     *
     * @throws IllegalArgumentException si la unidad no está soportada.
     */
    public static CfTimeUnit fromCfName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (CfTimeUnit unit : values()) {
            if (unit.cfName.equals(normalized) || unit.cfName.equals(normalized + "s")) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unidad temporal CF no soportada: `" + name + "`.");
    }
}
