package hydroio.domain.time;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Ventana temporal equiespaciada: {@code [firstDate, lastDate)} con paso {@code stepSize}.
 * <p>
 * Cada punto temporal identifica el <b>inicio</b> de un intervalo, de modo que una
 * ventana de 4 pasos horarios desde las 00:00 termina a las 04:00 y contiene los
 * puntos 00:00, 01:00, 02:00 y 03:00.
 */
@Value
public class Timegrid {

    LocalDateTime firstDate;
    LocalDateTime lastDate;
    Duration stepSize;

    @Builder
    public Timegrid(LocalDateTime firstDate, LocalDateTime lastDate, Duration stepSize) {
        Objects.requireNonNull(firstDate, "La fecha inicial no puede ser nula.");
        Objects.requireNonNull(lastDate, "La fecha final no puede ser nula.");
        Objects.requireNonNull(stepSize, "El paso temporal no puede ser nulo.");
        if (stepSize.isZero() || stepSize.isNegative()) {
            throw new IllegalArgumentException("El paso temporal debe ser positivo: " + stepSize);
        }
        // La rejilla se resuelve en segundos enteros
        if (stepSize.getSeconds() < 1 || stepSize.getNano() != 0) {
            throw new IllegalArgumentException("El paso temporal debe ser un número entero de segundos: " + stepSize);
        }
        if (!lastDate.isAfter(firstDate)) {
            throw new IllegalArgumentException(String.format(
                    "La fecha final (%s) debe ser posterior a la inicial (%s).", lastDate, firstDate));
        }
        Duration period = Duration.between(firstDate, lastDate);
        if (period.getSeconds() % stepSize.getSeconds() != 0) {
            throw new IllegalArgumentException(String.format(
                    "El periodo %s - %s no es múltiplo del paso %s.", firstDate, lastDate, stepSize));
        }
        this.firstDate = firstDate;
        this.lastDate = lastDate;
        this.stepSize = stepSize;
    }

    /**
     * Número de pasos de la ventana.
     */
    public int length() {
        return (int) (Duration.between(firstDate, lastDate).getSeconds() / stepSize.getSeconds());
    }

    /**
     * Fecha del punto temporal {@code index} (0 a length()).
     */
    public LocalDateTime dateAt(int index) {
        return firstDate.plus(stepSize.multipliedBy(index));
    }

    /**
     * Índice del punto temporal que comienza en {@code date} dentro de esta ventana.
     *
     * @throws IllegalArgumentException si la fecha no cae en la rejilla.
     */
    public int indexOf(LocalDateTime date) {
        long seconds = Duration.between(firstDate, date).getSeconds();
        if (seconds % stepSize.getSeconds() != 0) {
            throw new IllegalArgumentException(String.format(
                    "La fecha %s no está alineada con la rejilla que comienza en %s con paso %s.",
                    date, firstDate, stepSize));
        }
        return (int) (seconds / stepSize.getSeconds());
    }

    /**
     * Indica si esta ventana contiene por completo a {@code other}.
     */
    public boolean covers(Timegrid other) {
        return !other.firstDate.isBefore(firstDate) && !other.lastDate.isAfter(lastDate);
    }

    /**
     * Cadena de unidades CF referida a la fecha inicial, p. ej.
     * {@code "hours since 2000-01-01 00:00:00"}.
     */
    public String toCfUnits(CfTimeUnit unit) {
        return new CfUnits(unit, firstDate).toString();
    }

    /**
     * Desplazamientos (en {@code unit}) del inicio de cada paso respecto a la fecha inicial.
     */
    public double[] toTimepoints(CfTimeUnit unit) {
        int n = length();
        double step = unit.fromDuration(stepSize);
        double[] timepoints = new double[n];
        for (int i = 0; i < n; i++) {
            timepoints[i] = i * step;
        }
        return timepoints;
    }

    /**
     * Reconstruye una ventana a partir de los desplazamientos brutos de un eje de tiempo.
     * <p>
     * El paso es la diferencia entre los dos primeros puntos; con un único punto se
     * asume un paso de una unidad. La fecha final es el último punto más un paso.
     *
     * @throws IllegalArgumentException si no hay puntos temporales.
     */
    public static Timegrid fromTimepoints(double[] timepoints, LocalDateTime referenceDate, CfTimeUnit unit) {
        if (timepoints == null || timepoints.length == 0) {
            throw new IllegalArgumentException("No se puede reconstruir una ventana temporal sin puntos temporales.");
        }
        Duration step = (timepoints.length > 1)
                ? unit.toDuration(timepoints[1] - timepoints[0])
                : unit.getDuration();
        LocalDateTime first = referenceDate.plus(unit.toDuration(timepoints[0]));
        LocalDateTime last = referenceDate.plus(unit.toDuration(timepoints[timepoints.length - 1])).plus(step);
        return new Timegrid(first, last, step);
    }

    /**
     * Variante de {@link #fromTimepoints(double[], LocalDateTime, CfTimeUnit)} que toma la
     * fecha de referencia y la unidad de una cadena CF.
     */
    public static Timegrid fromTimepoints(double[] timepoints, CfUnits units) {
        return fromTimepoints(timepoints, units.referenceDate(), units.unit());
    }

    @Override
    public String toString() {
        return "Timegrid(" + firstDate + ", " + lastDate + ", " + stepSize + ")";
    }
}
