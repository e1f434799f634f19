package net.spookly.edgegate.environment;

import java.util.List;
import java.util.Optional;

/**
 * Durable key-value store for environment records.
 */
public interface EnvironmentStore {
    Optional<Environment> get(String id);

    void put(Environment environment);

    /**
     * @return true when a record was removed
     */
    boolean delete(String id);

    List<Environment> list();
}
