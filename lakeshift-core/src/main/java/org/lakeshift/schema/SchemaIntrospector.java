package org.lakeshift.schema;

import org.lakeshift.exception.IntrospectionException;
import org.lakeshift.model.SchemaModel;

/**
 * Reads the current state of a live schema.
 */
public interface SchemaIntrospector {

    /**
     * @throws IntrospectionException if the database could not be read
     */
    SchemaModel introspect();
}
