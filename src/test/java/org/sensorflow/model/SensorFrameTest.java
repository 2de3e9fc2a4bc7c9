package org.sensorflow.model;

import org.junit.jupiter.api.Test;
import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.error.InvalidInputException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SensorFrameTest {

    private static final Instant T0 = Instant.parse("2018-04-01T00:00:00Z");

    private static SensorSample at(int minute, double... values) {
        return SensorSample.of(T0.plusSeconds(60L * minute), values);
    }

    private static SensorFrame frameOf(int rows) {
        SensorSchema schema = SensorSchema.numbered(2);
        List<SensorSample> samples = new java.util.ArrayList<>();
        for (int i = 0; i < rows; i++) samples.add(at(i, i, 10.0 * i));
        return new SensorFrame(schema, samples);
    }

    @Test
    void numberedSchemaNamesSensors() {
        SensorSchema schema = SensorSchema.numbered(3);
        assertEquals(List.of("sensor_00", "sensor_01", "sensor_02"), schema.sensorNames());
        assertEquals(1, schema.indexOf("sensor_01"));
        assertEquals(-1, schema.indexOf("pump"));
    }

    @Test
    void schemaRejectsDuplicateNames() {
        assertThrows(IllegalArgumentException.class, () -> SensorSchema.of("a", "a"));
    }

    @Test
    void rejectsWidthMismatch() {
        assertThrows(DimensionMismatchException.class,
                () -> new SensorFrame(SensorSchema.numbered(2), List.of(at(0, 1, 2, 3))));
    }

    @Test
    void rejectsOutOfOrderAndDuplicateTimestamps() {
        SensorSchema schema = SensorSchema.numbered(1);
        assertThrows(InvalidInputException.class, () -> new SensorFrame(schema, List.of(at(1, 1), at(0, 2))));
        assertThrows(InvalidInputException.class, () -> new SensorFrame(schema, List.of(at(1, 1), at(1, 2))));
    }

    @Test
    void columnSliceAndTail() {
        SensorFrame frame = frameOf(5);
        assertArrayEquals(new double[]{0, 10, 20, 30, 40}, frame.column(1));
        assertEquals(2, frame.slice(1, 3).size());
        assertEquals(3.0, frame.tail(2).get(0).readings().get(0));
        assertEquals(5, frame.tail(50).size());
    }

    @Test
    void rowAndTimeRangesSelectBaselines() {
        SensorFrame frame = frameOf(10);
        assertEquals(4, RowRange.firstRows(4).select(frame).size());
        assertEquals(10, new RowRange(0, 100).select(frame).size());

        List<SensorSample> selected = new TimeRange(T0.plusSeconds(120), T0.plusSeconds(300)).select(frame);
        assertEquals(4, selected.size());
        assertEquals(2.0, selected.get(0).readings().get(0));
    }
}
