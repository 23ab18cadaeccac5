package cyntientops.dailyops.repository;

import cyntientops.dailyops.model.OperationalDataset;

/**
 * Supplies the canonical operational dataset that the one-time migration imports.
 */
@FunctionalInterface
public interface OperationalDataSource {

    OperationalDataset load();
}
