package dev.devanks.energy.pipeline.service.io;

import java.io.IOException;
import java.io.OutputStream;

/**
 * A destination that is written in full first and only becomes visible on {@link #publish()}.
 */
public interface OutputTarget {

    String getLocation();

    OutputStream getOutputStream() throws IOException;

    /**
     * Makes the staged content visible at {@link #getLocation()}, replacing any previous file.
     */
    void publish() throws IOException;

    /**
     * Drops staged content that was never published. Safe to call more than once.
     */
    void discard();
}
