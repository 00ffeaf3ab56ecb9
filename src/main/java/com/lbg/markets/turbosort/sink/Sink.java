package com.lbg.markets.turbosort.sink;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

public interface Sink {

    /**
     * Write the stream to {@code target}, replacing any existing file, and stamp it
     * with the source modification time.
     *
     * @return bytes written
     */
    long write(Path target, InputStream in, long mtimeEpochMs) throws IOException;
}
