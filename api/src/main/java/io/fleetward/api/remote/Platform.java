package io.fleetward.api.remote;

import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Operating system family of a remote server.
 */
public enum Platform {
    LINUX,
    DARWIN;

    /**
     * Map the output of {@code uname -s} to a platform. Anything other than
     * Darwin is treated as Linux.
     *
     * @param kernelName kernel name, may be null
     * @return the platform
     */
    public static Platform fromKernelName(@Nullable String kernelName) {
        if (kernelName != null && kernelName.trim().toLowerCase(Locale.ROOT).equals("darwin")) {
            return DARWIN;
        }
        return LINUX;
    }
}
