package io.keyserver.server.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.keyserver.core.binding.RouteTable;

/**
 * Liveness endpoint. Answers {@code 200 {"status":"UP","routes":N}}, where
 * {@code N} is the number of key server routes registered next to it. It never
 * calls the backend, so a failing backend does not fail the liveness check.
 */
public final class HealthHandler implements Handler {

    private final String body;

    public HealthHandler(RouteTable<?> routes) {
        this.body = "{\"status\":\"UP\",\"routes\":" + routes.size() + "}";
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(body);
    }
}
