package hydroio.io.netcdf;

import hydroio.config.NetcdfConfig;
import hydroio.domain.series.SeriesArray;
import hydroio.domain.series.TimeSeriesHandle;
import hydroio.domain.time.Timegrid;
import hydroio.io.dataset.Dataset;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Variante aplanada: cada celda espacial de cada dispositivo ocupa su propia fila.
 * <p>
 * Un dispositivo de rango 0 ocupa una fila con su propio nombre. Uno de rango R ocupa una
 * fila por combinación de índices (orden row-major), con etiqueta
 * {@code <dispositivo>_<i1>_..._<iR>}. Forma: {@code (celdas totales, pasos)}, sin relleno.
 */
@Slf4j
public class NetcdfVariableFlat extends NetcdfVariable {

    public NetcdfVariableFlat(String name, boolean isolate, NetcdfConfig config) {
        super(name, isolate, config);
    }

    @Override
    public VariableKind getKind() {
        return VariableKind.FLAT;
    }

    /**
     * Etiquetas de fila de un dispositivo, en el orden en que se escriben.
     */
    static List<String> rowLabels(TimeSeriesHandle handle) {
        if (handle.getRank() == 0) {
            return List.of(handle.getDeviceName());
        }
        List<String> labels = new ArrayList<>();
        for (int[] index : SeriesArray.indices(handle.getSpatialShape())) {
            labels.add(handle.getDeviceName() + "_" + Arrays.stream(index)
                    .mapToObj(Integer::toString)
                    .collect(Collectors.joining("_")));
        }
        return labels;
    }

    @Override
    public List<String> getSubdeviceNames() {
        List<String> names = new ArrayList<>();
        for (TimeSeriesHandle handle : handles()) {
            names.addAll(rowLabels(handle));
        }
        return names;
    }

    @Override
    public int[] getShape() {
        int rows = 0;
        int steps = 0;
        for (TimeSeriesHandle handle : handles()) {
            rows += handle.getCellCount();
            steps = Math.max(steps, valuesOf(handle).getDim(0));
        }
        return new int[]{rows, steps};
    }

    @Override
    public List<String> getDimensions() {
        return VariableLayouts.stationTimeDimensions(this);
    }

    @Override
    public SeriesArray getArray() {
        int[] shape = getShape();
        SeriesArray array = SeriesArray.filled(shape, config.getFillValue());
        int row = 0;
        for (TimeSeriesHandle handle : handles()) {
            SeriesArray values = valuesOf(handle);
            int steps = values.getDim(0);
            List<int[]> cells = SeriesArray.indices(handle.getSpatialShape());
            for (int[] cell : cells) {
                int[] source = new int[cell.length + 1];
                System.arraycopy(cell, 0, source, 1, cell.length);
                for (int step = 0; step < steps; step++) {
                    source[0] = step;
                    array.set(values.get(source), row, step);
                }
                row++;
            }
        }
        return array;
    }

    @Override
    public void write(Dataset dataset) throws NetcdfIoException {
        log.debug("Escribiendo variable aplanada `{}` con forma {}", name, Arrays.toString(getShape()));
        insertSubdeviceNames(dataset);
        VariableLayouts.writeBlock(this, dataset, getDimensions(), getArray());
    }

    @Override
    public void read(Dataset dataset, Timegrid window) throws NetcdfIoException {
        SeriesArray data = DatasetOperations.readBlock(dataset, DatasetOperations.queryVariable(dataset, name));
        if (data.getRank() != 2) {
            throw new NetcdfIoException(ErrorKind.INCONSISTENT_DATA, String.format(
                    "La variable aplanada `%s` del fichero `%s` debería tener rango 2, pero tiene forma %s.",
                    name, dataset.getPath(), Arrays.toString(data.getShape())));
        }
        Subdevice2Index index = querySubdevice2Index(dataset);
        int steps = data.getDim(1);
        for (TimeSeriesHandle handle : handles()) {
            int[] spatialShape = handle.getSpatialShape();
            int[] blockShape = new int[spatialShape.length + 1];
            blockShape[0] = steps;
            System.arraycopy(spatialShape, 0, blockShape, 1, spatialShape.length);
            SeriesArray block = SeriesArray.filled(blockShape, config.getFillValue());
            List<String> labels = rowLabels(handle);
            List<int[]> cells = SeriesArray.indices(spatialShape);
            for (int cell = 0; cell < cells.size(); cell++) {
                int row = index.get(labels.get(cell));
                int[] target = new int[blockShape.length];
                System.arraycopy(cells.get(cell), 0, target, 1, spatialShape.length);
                for (int step = 0; step < steps; step++) {
                    target[0] = step;
                    block.set(data.get(row, step), target);
                }
            }
            assign(handle, window, block);
        }
        log.debug("Leída variable aplanada `{}` ({} filas)", name, index.size());
    }
}
