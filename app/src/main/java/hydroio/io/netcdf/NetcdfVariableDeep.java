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

/**
 * Variante sin aplanado ni agregación: una fila por dispositivo, con independencia de su
 * rango espacial.
 * <p>
 * Forma: {@code (dispositivos, pasos, máx(e1), ..., máx(eR))}. Los dispositivos con
 * extensiones menores se rellenan con el valor de relleno, y un dispositivo de menor rango
 * ocupa el índice 0 de los ejes que le faltan. Dimensiones:
 * {@code (<prefijo>stations, time, <prefijo>axis3, <prefijo>axis4, ...)}.
 */
@Slf4j
public class NetcdfVariableDeep extends NetcdfVariable {

    public NetcdfVariableDeep(String name, boolean isolate, NetcdfConfig config) {
        super(name, isolate, config);
    }

    @Override
    public VariableKind getKind() {
        return VariableKind.DEEP;
    }

    @Override
    public List<String> getSubdeviceNames() {
        return getDeviceNames();
    }

    private int getRank() {
        return handles().stream().mapToInt(TimeSeriesHandle::getRank).max().orElse(0);
    }

    @Override
    public int[] getShape() {
        List<TimeSeriesHandle> handles = handles();
        int[] shape = new int[getRank() + 2];
        Arrays.fill(shape, 1);
        shape[0] = handles.size();
        shape[1] = 0;
        for (TimeSeriesHandle handle : handles) {
            int[] seriesShape = valuesOf(handle).getShape();
            shape[1] = Math.max(shape[1], seriesShape[0]);
            for (int axis = 1; axis < seriesShape.length; axis++) {
                shape[axis + 1] = Math.max(shape[axis + 1], seriesShape[axis]);
            }
        }
        return shape;
    }

    @Override
    public List<String> getDimensions() {
        List<String> dimensions = new ArrayList<>();
        dimensions.add(getPrefix() + config.getStationsDimension());
        dimensions.add(config.getTimeDimension());
        for (int axis = 0; axis < getRank(); axis++) {
            dimensions.add(getPrefix() + "axis" + (axis + 3));
        }
        return dimensions;
    }

    @Override
    public SeriesArray getArray() {
        SeriesArray array = SeriesArray.filled(getShape(), config.getFillValue());
        List<TimeSeriesHandle> handles = handles();
        for (int row = 0; row < handles.size(); row++) {
            array.placeRow(row, valuesOf(handles.get(row)));
        }
        return array;
    }

    @Override
    public void write(Dataset dataset) throws NetcdfIoException {
        log.debug("Escribiendo variable profunda `{}` con forma {}", name, Arrays.toString(getShape()));
        VariableLayouts.writeDeviceRows(this, dataset);
    }

    @Override
    public void read(Dataset dataset, Timegrid window) throws NetcdfIoException {
        SeriesArray data = DatasetOperations.readBlock(dataset, DatasetOperations.queryVariable(dataset, name));
        Subdevice2Index index = querySubdevice2Index(dataset);
        for (TimeSeriesHandle handle : handles()) {
            int row = index.get(handle.getDeviceName());
            SeriesArray block;
            try {
                block = data.extractRow(row, handle.getSpatialShape());
            } catch (IllegalArgumentException e) {
                throw new NetcdfIoException(ErrorKind.INCONSISTENT_DATA, String.format(
                        "La variable `%s` del fichero `%s` (forma %s) no puede contener la serie del dispositivo "
                                + "`%s` (extensiones %s): %s",
                        name, dataset.getPath(), Arrays.toString(data.getShape()), handle.getDeviceName(),
                        Arrays.toString(handle.getSpatialShape()), e.getMessage()), e);
            }
            assign(handle, window, block);
        }
        log.debug("Leída variable profunda `{}` para {} dispositivos", name, index.size());
    }
}
