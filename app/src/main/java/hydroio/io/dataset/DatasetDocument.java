package hydroio.io.dataset;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Representación JSON de un {@link Dataset}: dimensiones en orden de creación y
 * variables con sus atributos y datos.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatasetDocument {

    public static final String FORMAT = "hydroio-dataset";
    public static final int VERSION = 1;

    private String format = FORMAT;
    private int version = VERSION;
    private LinkedHashMap<String, Integer> dimensions = new LinkedHashMap<>();
    private List<VariableEntry> variables = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VariableEntry {
        private String name;
        private DataType dataType;
        private List<String> dimensions = new ArrayList<>();
        private Map<String, String> attributes = new LinkedHashMap<>();
        /** Valores row-major de las variables DOUBLE. */
        private double[] values;
        /** Cadenas de las variables CHAR. */
        private List<String> strings;
    }
}
