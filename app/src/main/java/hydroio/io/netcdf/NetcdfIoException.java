package hydroio.io.netcdf;

import lombok.Getter;

import java.io.IOException;

/**
 * Fallo de una sesión de lectura/escritura, con el contexto (fichero, variable, forma)
 * de la operación que lo provocó.
 */
@Getter
public class NetcdfIoException extends IOException {

    private final ErrorKind kind;

    public NetcdfIoException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public NetcdfIoException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
