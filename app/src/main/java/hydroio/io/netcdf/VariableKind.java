package hydroio.io.netcdf;

/**
 * Variante de disposición de una {@link NetcdfVariable}. Se fija al crear la variable.
 */
public enum VariableKind {
    /** Una fila por dispositivo; los ejes espaciales se conservan como dimensiones. */
    DEEP(true),
    /** Series ya agregadas a rango 0; solo escritura. */
    AGG(false),
    /** Los ejes espaciales se despliegan en filas adicionales. */
    FLAT(true);

    private final boolean readable;

    VariableKind(boolean readable) {
        this.readable = readable;
    }

    public boolean isReadable() {
        return readable;
    }
}
