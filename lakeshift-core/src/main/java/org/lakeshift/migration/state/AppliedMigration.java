package org.lakeshift.migration.state;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A row of migration history. A failed attempt is still an applied migration.
 */
@Value
@Builder
public class AppliedMigration {
    int version;
    String name;
    String checksum;
    LocalDateTime appliedAt;
    boolean success;
    String error;
}
