package net.spookly.edgegate.environment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store, seeded from the {@code environments} config section.
 */
public final class InMemoryEnvironmentStore implements EnvironmentStore {
    private final Map<String, Environment> records = new ConcurrentHashMap<>();

    @Override
    public Optional<Environment> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public void put(Environment environment) {
        Objects.requireNonNull(environment, "environment");
        records.put(environment.id(), environment);
    }

    @Override
    public boolean delete(String id) {
        return id != null && records.remove(id) != null;
    }

    @Override
    public List<Environment> list() {
        List<Environment> result = new ArrayList<>(records.values());
        result.sort(Comparator.comparing(Environment::id));
        return result;
    }
}
