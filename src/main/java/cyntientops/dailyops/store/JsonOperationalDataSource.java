package cyntientops.dailyops.store;

import cyntientops.dailyops.exception.SerializationException;
import cyntientops.dailyops.model.OperationalDataset;
import cyntientops.dailyops.repository.OperationalDataSource;
import cyntientops.dailyops.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the canonical operational dataset from a classpath JSON resource.
 * The document is parsed once and cached.
 */
public class JsonOperationalDataSource implements OperationalDataSource {

    private static final Logger log = LoggerFactory.getLogger(JsonOperationalDataSource.class);

    private final String resource;
    private volatile OperationalDataset cached;

    public JsonOperationalDataSource(String resource) {
        this.resource = resource;
    }

    @Override
    public OperationalDataset load() {
        OperationalDataset dataset = cached;
        if (dataset != null) {
            return dataset;
        }

        try (InputStream in = JsonOperationalDataSource.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new SerializationException("Operational dataset resource not found: " + resource, null);
            }
            dataset = Jsons.mapper().readValue(in, OperationalDataset.class);
        } catch (IOException e) {
            throw new SerializationException("Failed to read operational dataset: " + resource, e);
        }

        log.info("Loaded operational dataset {}: {} workers, {} buildings, {} assignments",
                dataset.version(), dataset.workers().size(), dataset.buildings().size(),
                dataset.assignments().size());
        cached = dataset;
        return dataset;
    }
}
