package org.sensorflow.io.json;

import java.io.IOException;
import java.io.InputStream;

/**
 * Lets callers provide a file stream, a classpath resource or any other source.
 */
@FunctionalInterface
public interface InputStreamSupplier {
    InputStream open() throws IOException;
}
