package hydroio.domain.simulation;

import hydroio.domain.time.Timegrids;

import java.util.Optional;

/**
 * Fuente de la ventana temporal global de la simulación en curso.
 */
@FunctionalInterface
public interface TimegridsProvider {

    /**
     * Ventanas vigentes, o vacío si todavía no se ha configurado ninguna simulación.
     */
    Optional<Timegrids> current();
}
