package hydroio.domain.simulation;

import hydroio.domain.time.Timegrids;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Singleton con la ventana temporal global del proceso.
 * <p>
 * Se configura una vez antes de abrir sesiones de escritura; las sesiones la consultan
 * a través de {@link TimegridsProvider}.
 */
@Slf4j
public final class GlobalTimegrids implements TimegridsProvider {

    private static final GlobalTimegrids INSTANCE = new GlobalTimegrids();

    private volatile Timegrids timegrids;

    private GlobalTimegrids() {
    }

    public static GlobalTimegrids getInstance() {
        return INSTANCE;
    }

    public void set(Timegrids timegrids) {
        this.timegrids = Objects.requireNonNull(timegrids,
                "La ventana global no puede ser nula; use clear() para vaciarla.");
        log.info("Ventana global de simulación configurada: init={}, sim={}",
                timegrids.getInit(), timegrids.getSim());
    }

    public void clear() {
        this.timegrids = null;
    }

    @Override
    public Optional<Timegrids> current() {
        return Optional.ofNullable(timegrids);
    }
}
