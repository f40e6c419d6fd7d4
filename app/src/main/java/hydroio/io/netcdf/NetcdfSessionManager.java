package hydroio.io.netcdf;

import hydroio.config.NetcdfConfig;
import hydroio.domain.simulation.TimegridsProvider;
import hydroio.io.dataset.DatasetFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Mantiene como máximo una sesión de lectura y una de escritura abiertas a la vez.
 * <p>
 * Al cerrar una sesión se realiza su E/S y se descarta, tanto si la operación tiene éxito
 * como si falla.
 */
@Slf4j
public class NetcdfSessionManager {

    private final NetcdfConfig config;
    private final TimegridsProvider timegridsProvider;
    private final DatasetFactory datasetFactory;

    private NetcdfInterface reader;
    private NetcdfInterface writer;

    public NetcdfSessionManager(NetcdfConfig config, TimegridsProvider timegridsProvider,
                                DatasetFactory datasetFactory) {
        this.config = config;
        this.timegridsProvider = timegridsProvider;
        this.datasetFactory = datasetFactory;
    }

    public NetcdfSessionManager(NetcdfConfig config) {
        this(config, null, null);
    }

    /**
     * Abre una sesión de lectura nueva, sustituyendo la anterior si no se había cerrado.
     */
    public NetcdfInterface openNetcdfReader(boolean flatten, boolean isolate) {
        if (reader != null) {
            log.warn("Se descarta una sesión de lectura abierta y nunca cerrada ({} ficheros)",
                    reader.getFileNames().size());
        }
        reader = newSession(flatten, isolate);
        return reader;
    }

    public NetcdfInterface openNetcdfWriter(boolean flatten, boolean isolate) {
        if (writer != null) {
            log.warn("Se descarta una sesión de escritura abierta y nunca cerrada ({} ficheros)",
                    writer.getFileNames().size());
        }
        writer = newSession(flatten, isolate);
        return writer;
    }

    /**
     * @throws IllegalStateException si no hay sesión de lectura abierta.
     */
    public NetcdfInterface getNetcdfReader() {
        if (reader == null) {
            throw new IllegalStateException("No hay ninguna sesión de lectura abierta; use openNetcdfReader.");
        }
        return reader;
    }

    /**
     * @throws IllegalStateException si no hay sesión de escritura abierta.
     */
    public NetcdfInterface getNetcdfWriter() {
        if (writer == null) {
            throw new IllegalStateException("No hay ninguna sesión de escritura abierta; use openNetcdfWriter.");
        }
        return writer;
    }

    public boolean hasNetcdfReader() {
        return reader != null;
    }

    public boolean hasNetcdfWriter() {
        return writer != null;
    }

    /**
     * Lee todos los ficheros de la sesión de lectura y la descarta.
     */
    public void closeNetcdfReader() throws NetcdfIoException {
        NetcdfInterface session = getNetcdfReader();
        try {
            session.read();
        } finally {
            reader = null;
        }
    }

    /**
     * Escribe todos los ficheros de la sesión de escritura y la descarta.
     */
    public void closeNetcdfWriter() throws NetcdfIoException {
        NetcdfInterface session = getNetcdfWriter();
        try {
            session.write();
        } finally {
            writer = null;
        }
    }

    private NetcdfInterface newSession(boolean flatten, boolean isolate) {
        return NetcdfInterface.builder()
                .flatten(flatten)
                .isolate(isolate)
                .config(config)
                .timegridsProvider(timegridsProvider)
                .datasetFactory(datasetFactory)
                .build();
    }
}
