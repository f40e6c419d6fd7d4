package hydroio.io.dataset;

/**
 * Tipos de datos admitidos por las variables de un {@link Dataset}.
 */
public enum DataType {
    /** Números en coma flotante de 64 bits (equivalente a {@code f8}). */
    DOUBLE,
    /** Caracteres; el último eje es la longitud de cada cadena (equivalente a {@code S1}). */
    CHAR
}
