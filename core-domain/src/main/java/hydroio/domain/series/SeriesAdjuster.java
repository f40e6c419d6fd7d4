package hydroio.domain.series;

import hydroio.domain.time.Timegrid;

/**
 * Realinea un bloque leído de un fichero a la ventana que espera un dispositivo.
 */
@FunctionalInterface
public interface SeriesAdjuster {

    /**
     * @param targetWindow Ventana de la serie del dispositivo.
     * @param dataWindow   Ventana que cubren los datos leídos (la del fichero).
     * @param values       Datos leídos, forma {@code (dataWindow.length(), extensiones...)}.
     * @return Bloque de forma {@code (targetWindow.length(), extensiones...)}.
     * @throws IllegalArgumentException si ambas ventanas son incompatibles.
     */
    SeriesArray adjust(Timegrid targetWindow, Timegrid dataWindow, SeriesArray values);
}
