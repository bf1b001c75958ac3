package io.keyserver.core.model;

/** HTTP methods a route binding can be registered for. */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}
