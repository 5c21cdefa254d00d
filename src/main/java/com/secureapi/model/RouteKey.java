package com.secureapi.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity of an operation inside a feature group: the declared path plus the upper-case
 * HTTP method.
 *
 * @param path   The path as declared in the OpenAPI document.
 * @param method The HTTP method, upper-cased on construction.
 */
public record RouteKey(String path, String method) {

    public RouteKey {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(method, "method");
        method = method.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
