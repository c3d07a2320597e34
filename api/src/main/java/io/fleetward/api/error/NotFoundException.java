package io.fleetward.api.error;

import javax.annotation.Nonnull;

/**
 * Thrown when a named server, cluster, profile, task or alert does not exist.
 */
public class NotFoundException extends IllegalArgumentException {

    private final String kind;
    private final String name;

    public NotFoundException(@Nonnull String kind, @Nonnull String name) {
        super(capitalize(kind) + " not found: " + name);
        this.kind = kind;
        this.name = name;
    }

    /**
     * Get the kind of entity that was looked up, e.g. {@code server}.
     *
     * @return entity kind
     */
    @Nonnull
    public String getKind() {
        return kind;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
