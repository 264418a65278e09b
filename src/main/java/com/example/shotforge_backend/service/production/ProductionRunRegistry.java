package com.example.shotforge_backend.service.production;

import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.util.CancellationToken;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory table of active production runs, at most one per project.
 * <p>
 * While a run is registered its {@link ActiveRun#project()} is the live copy of the project:
 * the run thread mutates it under the run's monitor and readers take snapshots under the same
 * monitor instead of reloading a possibly stale row.
 */
@Component
public class ProductionRunRegistry {

    public static final class ActiveRun {
        private final Project project;
        private final CancellationToken token = new CancellationToken();

        ActiveRun(Project project) {
            this.project = project;
        }

        public Project project() {
            return project;
        }

        public CancellationToken token() {
            return token;
        }
    }

    private final ConcurrentMap<UUID, ActiveRun> runs = new ConcurrentHashMap<>();

    /**
     * Atomically claims the project for a new run.
     *
     * @return the new run, or empty when a run is already active
     */
    public Optional<ActiveRun> tryRegister(Project project) {
        ActiveRun candidate = new ActiveRun(project);
        ActiveRun existing = runs.putIfAbsent(project.getId(), candidate);
        return existing == null ? Optional.of(candidate) : Optional.empty();
    }

    public Optional<ActiveRun> find(UUID projectId) {
        return Optional.ofNullable(runs.get(projectId));
    }

    public boolean isActive(UUID projectId) {
        return runs.containsKey(projectId);
    }

    void remove(ActiveRun run) {
        runs.remove(run.project().getId(), run);
    }

    /**
     * Applies {@code reader} to the live project of an active run, or to the persisted one.
     */
    public <T> T read(UUID projectId, Supplier<Project> loader, Function<Project, T> reader) {
        ActiveRun run = runs.get(projectId);
        if (run == null) {
            return reader.apply(loader.get());
        }
        synchronized (run) {
            return reader.apply(run.project());
        }
    }
}
