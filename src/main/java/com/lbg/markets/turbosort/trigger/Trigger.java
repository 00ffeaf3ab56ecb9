package com.lbg.markets.turbosort.trigger;

import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Decides which locations need another delivery pass and when.
 * All work is scheduled on the single-threaded loop passed to {@link #start}.
 */
public interface Trigger {

    void start(ScheduledExecutorService loop) throws IOException;

    void stop();
}
