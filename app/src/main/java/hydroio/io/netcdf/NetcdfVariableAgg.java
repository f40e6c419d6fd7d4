package hydroio.io.netcdf;

import hydroio.config.NetcdfConfig;
import hydroio.domain.series.LoggedArray;
import hydroio.domain.series.SeriesArray;
import hydroio.domain.series.TimeSeriesHandle;
import hydroio.domain.time.Timegrid;
import hydroio.io.dataset.Dataset;

import java.util.Arrays;
import java.util.List;

/**
 * Variante para series agregadas espacialmente (rango 0) antes de registrarse.
 * <p>
 * Comparte con {@link NetcdfVariableDeep} la disposición de una fila por dispositivo y con
 * {@link NetcdfVariableFlat} las dimensiones {@code (<prefijo>stations, time)}. Solo admite
 * escritura: la agregación no es invertible.
 */
public class NetcdfVariableAgg extends NetcdfVariable {

    public NetcdfVariableAgg(String name, boolean isolate, NetcdfConfig config) {
        super(name, isolate, config);
    }

    @Override
    public VariableKind getKind() {
        return VariableKind.AGG;
    }

    @Override
    protected void validate(TimeSeriesHandle handle, LoggedArray array) {
        if (array == null || !array.isAggregated() || array.values().getRank() != 1) {
            throw new IllegalArgumentException(String.format(
                    "La variable agregada `%s` requiere un bloque agregado de rango espacial 0 para el dispositivo `%s`.",
                    name, handle.getDeviceName()));
        }
    }

    @Override
    public List<String> getSubdeviceNames() {
        return getDeviceNames();
    }

    @Override
    public int[] getShape() {
        List<TimeSeriesHandle> handles = handles();
        int steps = handles.isEmpty() ? 0 : valuesOf(handles.get(0)).getDim(0);
        return new int[]{handles.size(), steps};
    }

    @Override
    public List<String> getDimensions() {
        return VariableLayouts.stationTimeDimensions(this);
    }

    @Override
    public SeriesArray getArray() {
        SeriesArray array = SeriesArray.filled(getShape(), config.getFillValue());
        List<TimeSeriesHandle> handles = handles();
        for (int row = 0; row < handles.size(); row++) {
            SeriesArray values = valuesOf(handles.get(row));
            if (values.getDim(0) != array.getDim(1)) {
                throw new IllegalStateException(String.format(
                        "Las series agregadas de `%s` deben tener %d pasos, pero `%s` tiene %s.",
                        name, array.getDim(1), handles.get(row).getDeviceName(),
                        Arrays.toString(values.getShape())));
            }
            array.placeRow(row, values);
        }
        return array;
    }

    @Override
    public void write(Dataset dataset) throws NetcdfIoException {
        VariableLayouts.writeDeviceRows(this, dataset);
    }

    /**
     * Siempre falla con {@link ErrorKind#NOT_INVERTIBLE}.
     */
    @Override
    public void read(Dataset dataset, Timegrid window) throws NetcdfIoException {
        throw new NetcdfIoException(ErrorKind.NOT_INVERTIBLE, String.format(
                "El proceso de agregar valores (de la variable `%s` y de otras también) no es invertible.", name));
    }
}
