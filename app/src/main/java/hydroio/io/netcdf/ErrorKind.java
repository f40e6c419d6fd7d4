package hydroio.io.netcdf;

/**
 * Clasificación de los fallos de las sesiones de lectura/escritura.
 */
public enum ErrorKind {
    /** Ya existe una dimensión o variable con el mismo nombre. */
    NAME_COLLISION,
    /** El fichero no contiene la variable buscada. */
    MISSING_VARIABLE,
    /** No existe la variable de nombres de fila, ni con prefijo ni sin él. */
    MISSING_COORDINATE,
    /** Nombres de fila repetidos: la correspondencia fila-dispositivo es ambigua. */
    DUPLICATE_SUBDEVICE,
    /** Un dispositivo registrado no tiene fila en el fichero. */
    MISSING_DEVICE_DATA,
    /** Lectura de una variable agregada. */
    NOT_INVERTIBLE,
    /** Escritura sin ventana temporal global configurada. */
    NO_GLOBAL_WINDOW,
    /** Cualquier otro fallo del soporte de ficheros. */
    DATASET_FAILURE,
    /** Los datos del fichero no encajan con las series registradas. */
    INCONSISTENT_DATA
}
