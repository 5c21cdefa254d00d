package com.secureapi.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents a single parameter for an {@link ApiOperation}: its name, location (path, query,
 * header) and whether it must be supplied.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiParameter {

    private String name;

    /**
     * The location of the parameter. Common values are "path", "query", or "header".
     */
    private String in;

    private boolean required;
}
