package org.transitdisplay.interfaces;

import java.io.IOException;
import java.util.List;

/** Runs an external command and returns its standard output. */
@FunctionalInterface
public interface CommandRunner {

    /** @throws IOException if the command could not start or exited non-zero */
    String run(List<String> command) throws IOException, InterruptedException;
}
