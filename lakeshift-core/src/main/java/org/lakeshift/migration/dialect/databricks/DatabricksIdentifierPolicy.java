package org.lakeshift.migration.dialect.databricks;

import org.lakeshift.exception.ConfigException;
import org.lakeshift.migration.spi.dialect.IdentifierPolicy;

import java.util.regex.Pattern;

/**
 * Unquoted identifiers only: letters, digits and underscore, not starting with a digit.
 */
public class DatabricksIdentifierPolicy implements IdentifierPolicy {
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    @Override
    public boolean isValid(String raw) {
        return raw != null && IDENTIFIER.matcher(raw).matches();
    }

    @Override
    public String requireValid(String role, String raw) {
        if (!isValid(raw)) {
            throw new ConfigException("Invalid " + role + " identifier '" + raw
                    + "': only letters, digits and underscores are allowed, and it must not start with a digit");
        }
        return raw;
    }
}
