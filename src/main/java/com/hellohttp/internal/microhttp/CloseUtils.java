package com.hellohttp.internal.microhttp;

import java.io.Closeable;
import java.io.IOException;
import java.util.logging.Level;

class CloseUtils {

    private static final java.util.logging.Logger LOGGER = java.util.logging.Logger.getLogger(CloseUtils.class.getName());

    private CloseUtils() {
    }

    /**
     * Closes a channel or selector during teardown, where a failure to close leaves nothing to recover.
     */
    static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Unable to close " + closeable, e);
        }
    }

}
