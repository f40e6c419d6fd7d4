package hydroio.io.dataset;

import lombok.Getter;

import java.io.IOException;

/**
 * Fallo del soporte de ficheros de arrays.
 */
@Getter
public class DatasetException extends IOException {

    /**
     * Motivo del fallo, para que las capas superiores puedan clasificarlo.
     */
    public enum Reason {
        NAME_IN_USE,
        UNKNOWN_DIMENSION,
        UNKNOWN_VARIABLE,
        SHAPE_MISMATCH,
        TYPE_MISMATCH,
        READ_ONLY,
        CORRUPT_FILE,
        IO_ERROR
    }

    private final Reason reason;

    public DatasetException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DatasetException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
