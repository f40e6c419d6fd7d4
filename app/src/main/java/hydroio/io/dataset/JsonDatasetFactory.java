package hydroio.io.dataset;

import hydroio.io.JsonFileHandler;

import java.nio.file.Path;

/**
 * Factoría por defecto: ficheros de arrays persistidos como JSON.
 */
public class JsonDatasetFactory implements DatasetFactory {

    private final JsonFileHandler fileHandler;

    public JsonDatasetFactory() {
        this(new JsonFileHandler());
    }

    public JsonDatasetFactory(JsonFileHandler fileHandler) {
        this.fileHandler = fileHandler;
    }

    @Override
    public Dataset open(Path path) throws DatasetException {
        return JsonDataset.open(path, fileHandler);
    }

    @Override
    public Dataset create(Path path) {
        return JsonDataset.create(path, fileHandler);
    }
}
