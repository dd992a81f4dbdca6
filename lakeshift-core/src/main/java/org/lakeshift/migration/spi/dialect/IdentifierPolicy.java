package org.lakeshift.migration.spi.dialect;

/**
 * Rules for identifiers that have to be interpolated into SQL text because the driver
 * cannot bind them as parameters.
 */
public interface IdentifierPolicy {
    boolean isValid(String raw);

    /**
     * @param role what the identifier names, used in the error message ("catalog", "table" ...)
     * @return {@code raw} unchanged when valid
     */
    String requireValid(String role, String raw);
}
