package org.sensorflow.io.json;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sensorflow.config.DetectorConfig;
import org.sensorflow.scoring.FusionPolicy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DetectorConfigSourceTest {

    private final DetectorConfigSource source = new DetectorConfigSource();

    private static InputStreamSupplier json(String text) {
        return () -> new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void bundledDefaultsMatchCodeDefaults() {
        assertEquals(DetectorConfig.defaults(), source.loadDefaults());
    }

    @Test
    void overrideFileChangesOnlyGivenKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("machine-7.json");
        Files.writeString(file, """
                {
                  "classifier": { "warningDebounce": 5 },
                  "fusion": { "policy": "RECONSTRUCTION" }
                }
                """);

        DetectorConfig config = source.load(file);
        DetectorConfig defaults = DetectorConfig.defaults();

        assertEquals(5, config.classifier().warningDebounce());
        assertEquals(defaults.classifier().brokenDebounce(), config.classifier().brokenDebounce());
        assertEquals(FusionPolicy.RECONSTRUCTION, config.fusion().policy());
        assertEquals(0.5, config.fusion().reconstructionWeight());
        assertEquals(defaults.subspace(), config.subspace());
        assertEquals(defaults.business(), config.business());
    }

    @Test
    void unknownOrMalformedDocumentsFail() {
        assertThrows(UncheckedIOException.class, () -> source.load(json("{ \"classifier\": ")));
        assertThrows(UncheckedIOException.class, () -> source.load(json("{ \"classifer\": { \"warningDebounce\": 5 } }")));
        assertThrows(IllegalArgumentException.class, () -> source.load(json("[1, 2]")));
    }

    @Test
    void invalidValuesFailWhenConverted() {
        DetectorConfig config = source.load(json("{ \"classifier\": { \"brokenMultiple\": 0.5 } }"));
        assertThrows(IllegalArgumentException.class, () -> config.classifier().toSettings());
    }
}
