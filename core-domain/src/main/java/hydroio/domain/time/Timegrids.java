package hydroio.domain.time;

import lombok.Value;

import java.util.Objects;

/**
 * Par de ventanas de una simulación: el periodo de inicialización completo ({@code init})
 * y la subventana realmente simulada ({@code sim}).
 */
@Value
public class Timegrids {

    Timegrid init;
    Timegrid sim;

    public Timegrids(Timegrid init, Timegrid sim) {
        Objects.requireNonNull(init, "La ventana de inicialización no puede ser nula.");
        Objects.requireNonNull(sim, "La ventana de simulación no puede ser nula.");
        if (!init.getStepSize().equals(sim.getStepSize())) {
            throw new IllegalArgumentException(String.format(
                    "Las ventanas de inicialización (%s) y simulación (%s) deben compartir paso.",
                    init.getStepSize(), sim.getStepSize()));
        }
        if (!init.covers(sim)) {
            throw new IllegalArgumentException(
                    "La ventana de simulación " + sim + " debe estar contenida en " + init + ".");
        }
        this.init = init;
        this.sim = sim;
    }

    /**
     * Ventanas en las que la simulación abarca todo el periodo de inicialización.
     */
    public static Timegrids of(Timegrid init) {
        return new Timegrids(init, init);
    }
}
