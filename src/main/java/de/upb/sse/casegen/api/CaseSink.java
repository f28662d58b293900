package de.upb.sse.casegen.api;

import java.io.IOException;

/**
 * Receives the generated cases, typically to render them as a test suite. Non-erroring cases
 * of a callable are meant to become one test parameterized by input tuple, and each erroring
 * case a test asserting that the recorded error kind is raised.
 */
@FunctionalInterface
public interface CaseSink {
    void write(ModuleCases cases) throws IOException;
}
