package hydroio.domain.series;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Bloque denso N-dimensional de valores {@code double} en orden de filas (row-major).
 * <p>
 * Es el formato común con el que las series de los dispositivos y las variables de los
 * ficheros intercambian datos. Las series de un dispositivo tienen forma
 * {@code (pasos, extensiones espaciales...)}.
 */
public final class SeriesArray {

    private final int[] shape;
    private final double[] values;

    /**
     * @param shape  Extensión de cada eje (todas >= 0).
     * @param values Valores en orden row-major; se copian.
     */
    public SeriesArray(int[] shape, double[] values) {
        Objects.requireNonNull(shape, "La forma no puede ser nula.");
        Objects.requireNonNull(values, "Los valores no pueden ser nulos.");
        int size = sizeOf(shape);
        if (values.length != size) {
            throw new IllegalArgumentException(String.format(
                    "La forma %s requiere %d valores, pero se recibieron %d.",
                    Arrays.toString(shape), size, values.length));
        }
        this.shape = shape.clone();
        this.values = values.clone();
    }

    /**
     * Crea un bloque de la forma dada relleno con {@code value}.
     */
    public static SeriesArray filled(int[] shape, double value) {
        double[] data = new double[sizeOf(shape)];
        Arrays.fill(data, value);
        return new SeriesArray(shape, data);
    }

    /**
     * Serie unidimensional (rango espacial 0).
     */
    public static SeriesArray of(double... values) {
        return new SeriesArray(new int[]{values.length}, values);
    }

    /**
     * Serie bidimensional a partir de filas {@code [paso][celda]}.
     */
    public static SeriesArray of(double[][] rows) {
        int cols = rows.length == 0 ? 0 : rows[0].length;
        double[] data = new double[rows.length * cols];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != cols) {
                throw new IllegalArgumentException("Todas las filas deben tener la misma longitud.");
            }
            System.arraycopy(rows[i], 0, data, i * cols, cols);
        }
        return new SeriesArray(new int[]{rows.length, cols}, data);
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    public int getDim(int axis) {
        return shape[axis];
    }

    public int size() {
        return values.length;
    }

    /**
     * Copia de los valores en orden row-major.
     */
    public double[] toArray() {
        return values.clone();
    }

    public double get(int... index) {
        return values[offset(index)];
    }

    public void set(double value, int... index) {
        values[offset(index)] = value;
    }

    public SeriesArray copy() {
        return new SeriesArray(shape, values);
    }

    /**
     * Extrae el bloque de la fila {@code row} (primer eje) restringido a las extensiones
     * dadas para los ejes a partir del tercero.
     * <p>
     * Para un bloque de forma {@code (filas, pasos, m1, ..., mK)} y extensiones
     * {@code (e1, ..., eR)} con {@code R <= K}, devuelve la forma {@code (pasos, e1, ..., eR)}.
     * Los ejes sobrantes ({@code R < K}) se fijan en el índice 0.
     */
    public SeriesArray extractRow(int row, int[] extents) {
        checkBlockExtents(extents);
        int steps = shape[1];
        int[] blockShape = blockShape(steps, extents);
        double[] data = new double[sizeOf(blockShape)];
        int[] target = new int[shape.length];
        target[0] = row;
        int pos = 0;
        for (int[] idx : indices(blockShape)) {
            System.arraycopy(idx, 0, target, 1, idx.length);
            data[pos++] = values[offset(target)];
        }
        return new SeriesArray(blockShape, data);
    }

    /**
     * Inverso de {@link #extractRow(int, int[])}: escribe {@code block} (forma
     * {@code (pasos, e1, ..., eR)}) en la esquina de origen de la fila {@code row}.
     * El resto de la fila conserva su valor (normalmente el valor de relleno).
     */
    public void placeRow(int row, SeriesArray block) {
        int[] extents = Arrays.copyOfRange(block.shape, 1, block.shape.length);
        checkBlockExtents(extents);
        if (block.shape[0] > shape[1]) {
            throw new IllegalArgumentException(String.format(
                    "El bloque tiene %d pasos, pero la fila solo admite %d.", block.shape[0], shape[1]));
        }
        int[] target = new int[shape.length];
        target[0] = row;
        int pos = 0;
        for (int[] idx : indices(block.shape)) {
            System.arraycopy(idx, 0, target, 1, idx.length);
            values[offset(target)] = block.values[pos++];
        }
    }

    private void checkBlockExtents(int[] extents) {
        if (shape.length < 2 || extents.length > shape.length - 2) {
            throw new IllegalArgumentException(String.format(
                    "Las extensiones %s no son compatibles con la forma %s.",
                    Arrays.toString(extents), Arrays.toString(shape)));
        }
        for (int i = 0; i < extents.length; i++) {
            if (extents[i] > shape[i + 2]) {
                throw new IllegalArgumentException(String.format(
                        "La extensión %d del eje %d supera el máximo %d.", extents[i], i + 2, shape[i + 2]));
            }
        }
    }

    private static int[] blockShape(int steps, int[] extents) {
        int[] result = new int[extents.length + 1];
        result[0] = steps;
        System.arraycopy(extents, 0, result, 1, extents.length);
        return result;
    }

    private int offset(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException(String.format(
                    "Se esperaban %d índices, pero se recibieron %d.", shape.length, index.length));
        }
        int result = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException(String.format(
                        "Índice %s fuera de la forma %s.", Arrays.toString(index), Arrays.toString(shape)));
            }
            result = result * shape[axis] + index[axis];
        }
        return result;
    }

    /**
     * Número de elementos de un bloque de la forma dada (1 para la forma vacía).
     */
    public static int sizeOf(int[] shape) {
        int size = 1;
        for (int length : shape) {
            if (length < 0) {
                throw new IllegalArgumentException("Extensión negativa en la forma " + Arrays.toString(shape));
            }
            size *= length;
        }
        return size;
    }

    /**
     * Todas las combinaciones de índices de una forma, en orden row-major.
     * La forma vacía produce una única combinación vacía.
     */
    public static List<int[]> indices(int[] shape) {
        List<int[]> result = new ArrayList<>(sizeOf(shape));
        if (sizeOf(shape) == 0) {
            return result;
        }
        int[] current = new int[shape.length];
        while (true) {
            result.add(current.clone());
            int axis = shape.length - 1;
            while (axis >= 0) {
                current[axis]++;
                if (current[axis] < shape[axis]) {
                    break;
                }
                current[axis] = 0;
                axis--;
            }
            if (axis < 0) {
                return result;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SeriesArray that = (SeriesArray) o;
        return Arrays.equals(shape, that.shape) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "SeriesArray(shape=" + Arrays.toString(shape) + ", values=" + Arrays.toString(values) + ")";
    }
}
