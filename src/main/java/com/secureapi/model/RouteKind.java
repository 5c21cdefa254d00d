package com.secureapi.model;

/**
 * The admission decision for one operation.
 * <p>
 * {@link #EXCLUDED} and {@link #TOOL} are produced by the route policy; {@link #RESOURCE} and
 * {@link #RESOURCE_TEMPLATE} only ever appear when a caller passes them in as its default
 * classification for a method the policy does not handle.
 */
public enum RouteKind {
    TOOL,
    RESOURCE,
    RESOURCE_TEMPLATE,
    EXCLUDED
}
