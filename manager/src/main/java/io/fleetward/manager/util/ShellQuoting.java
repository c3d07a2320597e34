package io.fleetward.manager.util;

import javax.annotation.Nonnull;

/**
 * POSIX shell quoting for values interpolated into remote commands.
 */
public final class ShellQuoting {

    private ShellQuoting() {
    }

    /**
     * Wrap a value in single quotes so {@code sh} treats it as one literal word.
     *
     * @param value raw value
     * @return quoted value
     */
    @Nonnull
    public static String quote(@Nonnull String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
