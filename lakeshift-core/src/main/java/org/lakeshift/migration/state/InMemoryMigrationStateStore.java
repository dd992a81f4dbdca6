package org.lakeshift.migration.state;

import org.lakeshift.exception.MigrationStateConflictException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Process-local store for tests and dry runs.
 */
public class InMemoryMigrationStateStore implements MigrationStateStore {
    private final TreeMap<Integer, AppliedMigration> applied = new TreeMap<>();
    private final Clock clock;

    public InMemoryMigrationStateStore() {
        this(Clock.systemDefaultZone());
    }

    public InMemoryMigrationStateStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<AppliedMigration> listApplied() {
        return new ArrayList<>(applied.values());
    }

    @Override
    public Optional<AppliedMigration> getLastApplied() {
        return applied.isEmpty()
                ? Optional.empty()
                : Optional.of(applied.lastEntry().getValue());
    }

    @Override
    public boolean hasApplied(int version) {
        return applied.containsKey(version);
    }

    @Override
    public void recordApplied(int version, String name, String checksum, boolean success, String error) {
        AppliedMigration existing = applied.get(version);
        if (existing != null) {
            if (!existing.getChecksum().equals(checksum)) {
                throw new MigrationStateConflictException(version, existing.getChecksum(), checksum);
            }
            return;
        }
        applied.put(version, AppliedMigration.builder()
                .version(version)
                .name(name)
                .checksum(checksum)
                .appliedAt(LocalDateTime.now(clock))
                .success(success)
                .error(error)
                .build());
    }
}
