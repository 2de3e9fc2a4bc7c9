package org.sensorflow.preprocess;

import org.junit.jupiter.api.Test;
import org.sensorflow.error.InvalidInputException;
import org.sensorflow.model.SensorFrame;
import org.sensorflow.model.SensorSample;
import org.sensorflow.model.SensorSchema;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GapFillerTest {

    private static final Instant T0 = Instant.parse("2018-04-01T00:00:00Z");
    private static final double NaN = Double.NaN;

    private final GapFiller filler = new GapFiller();

    private static SensorFrame frame(double[]... rows) {
        List<SensorSample> samples = new java.util.ArrayList<>();
        for (int i = 0; i < rows.length; i++) {
            samples.add(SensorSample.of(T0.plusSeconds(60L * i), rows[i]));
        }
        return new SensorFrame(SensorSchema.numbered(rows[0].length), samples);
    }

    @Test
    void forwardFillsThenBackFillsLeadingGap() {
        SensorFrame filled = filler.fill(frame(
                new double[]{NaN, 1},
                new double[]{2, NaN},
                new double[]{NaN, NaN},
                new double[]{4, 5}));

        assertArrayEquals(new double[]{2, 2, 2, 4}, filled.column(0));
        assertArrayEquals(new double[]{1, 1, 1, 5}, filled.column(1));
    }

    @Test
    void frameWithoutGapsIsReturnedAsIs() {
        SensorFrame frame = frame(new double[]{1, 2}, new double[]{3, 4});
        assertSame(frame, filler.fill(frame));
    }

    @Test
    void infiniteReadingsAreNotFilled() {
        SensorFrame filled = filler.fill(frame(new double[]{1}, new double[]{Double.POSITIVE_INFINITY}, new double[]{NaN}));
        assertEquals(Double.POSITIVE_INFINITY, filled.column(0)[1]);
        assertEquals(1.0, filled.column(0)[2]);
    }

    @Test
    void sensorWithoutAnyReadingCannotBeFilled() {
        InvalidInputException ex = assertThrows(InvalidInputException.class,
                () -> filler.fill(frame(new double[]{1, NaN}, new double[]{2, NaN})));
        assertTrue(ex.getMessage().contains("sensor_01"));
    }
}
