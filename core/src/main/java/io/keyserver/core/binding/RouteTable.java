package io.keyserver.core.binding;

import io.keyserver.core.model.HttpMethod;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The routes served for one backend type. Built once at startup through
 * {@link #builder()} and read-only afterwards, so it can be shared by all
 * request threads without synchronization.
 *
 * <p>
 * Each {@code (path pattern, method)} pair is bound at most once.
 *
 * @param <B> backend type
 */
public final class RouteTable<B> {

    private final List<RouteBinding<B, ?, ?>> bindings;

    private RouteTable(List<RouteBinding<B, ?, ?>> bindings) {
        this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
    }

    public static <B> Builder<B> builder() {
        return new Builder<>();
    }

    /** Bindings in registration order. */
    public List<RouteBinding<B, ?, ?>> bindings() {
        return bindings;
    }

    /** The binding registered for {@code pathPattern} and {@code method}, if any. */
    public Optional<RouteBinding<B, ?, ?>> find(String pathPattern, HttpMethod method) {
        return bindings.stream()
                .filter(b -> b.method() == method && b.pathPattern().equals(pathPattern))
                .findFirst();
    }

    public int size() {
        return bindings.size();
    }

    /** Collects bindings and rejects duplicate routes. */
    public static final class Builder<B> {

        private final Map<String, RouteBinding<B, ?, ?>> byRoute = new LinkedHashMap<>();

        Builder() {}

        /**
         * @throws IllegalArgumentException if the route is already bound
         */
        public Builder<B> add(RouteBinding<B, ?, ?> binding) {
            String route = binding.method() + " " + binding.pathPattern();
            RouteBinding<B, ?, ?> existing = byRoute.putIfAbsent(route, binding);
            if (existing != null) {
                throw new IllegalArgumentException(
                        "Route " + route + " is already bound to " + existing.name() + ", cannot bind "
                                + binding.name());
            }
            return this;
        }

        public RouteTable<B> build() {
            return new RouteTable<>(new ArrayList<>(byRoute.values()));
        }
    }
}
