package hydroio.io.netcdf;

import hydroio.domain.series.SeriesArray;
import hydroio.io.dataset.DataType;
import hydroio.io.dataset.Dataset;
import hydroio.io.dataset.DatasetVariable;

import java.util.List;

/**
 * Piezas de disposición compartidas entre variantes de {@link NetcdfVariable}.
 */
final class VariableLayouts {

    private VariableLayouts() {
    }

    /**
     * Dimensiones {@code (<prefijo>stations, time)} de las variantes bidimensionales
     * (agregada y aplanada).
     */
    static List<String> stationTimeDimensions(NetcdfVariable variable) {
        return List.of(
                variable.getPrefix() + variable.config.getStationsDimension(),
                variable.config.getTimeDimension());
    }

    /**
     * Escritura con una fila por dispositivo (variantes profunda y agregada): nombres de
     * fila, dimensiones espaciales extra a su extensión máxima y el bloque denso.
     */
    static void writeDeviceRows(NetcdfVariable variable, Dataset dataset) throws NetcdfIoException {
        variable.insertSubdeviceNames(dataset);
        List<String> dimensions = variable.getDimensions();
        SeriesArray array = variable.getArray();
        for (int axis = 2; axis < dimensions.size(); axis++) {
            DatasetOperations.createDimension(dataset, dimensions.get(axis), array.getDim(axis));
        }
        writeBlock(variable, dataset, dimensions, array);
    }

    static void writeBlock(NetcdfVariable variable, Dataset dataset, List<String> dimensions, SeriesArray array)
            throws NetcdfIoException {
        DatasetVariable target = DatasetOperations.createVariable(
                dataset, variable.getName(), DataType.DOUBLE, dimensions, variable.config.getFillValue());
        DatasetOperations.writeBlock(dataset, target, array);
    }
}
