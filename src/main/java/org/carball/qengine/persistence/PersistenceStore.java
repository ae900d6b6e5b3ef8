package org.carball.qengine.persistence;

import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.util.Optional;

/**
 * Key-value snapshot store for engine state that outlives the process.
 */
public interface PersistenceStore {

    String OPTIMIZATION_HISTORY = "optimization-history";
    String ML_TRAINING_DATA = "ml-training-data";

    <T> Optional<T> load(String key, TypeReference<T> type) throws IOException;

    void save(String key, Object value) throws IOException;
}
