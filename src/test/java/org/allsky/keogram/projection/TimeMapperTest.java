package org.allsky.keogram.projection;

import java.time.Duration;
import java.time.Instant;
import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class TimeMapperTest {

    private static final Instant START = Instant.parse("2024-01-01T20:00:00Z");

    @Test
    public void testMapping() {
        TimeMapper mapper = new TimeMapper(START, START.plusSeconds(3600), 605, 5);
        assertEquals(2.0, mapper.timeToPixel(START), 1e-9);
        assertEquals(602.0, mapper.timeToPixel(START.plusSeconds(3600)), 1e-9);
        assertEquals(302.0, mapper.timeToPixel(START.plusSeconds(1800)), 1e-9);
        assertEquals(START.plusSeconds(1800), mapper.pixelToTime(302.0));
        assertEquals(START.plusSeconds(6), mapper.pixelToTime(3.0));
        assertEquals(10.0, mapper.durationToPixels(Duration.ofMinutes(1)), 1e-9);
    }

    @Test
    public void testRoundTrip() {
        TimeMapper mapper = new TimeMapper(START, START.plusSeconds(1234), 377, 3);
        for (int pixel = 0; pixel < 377; pixel++) {
            assertEquals(pixel, mapper.timeToPixel(mapper.pixelToTime(pixel)), 1e-6);
        }
    }

    @Test
    public void testSeconds() {
        assertEquals(1.5, TimeMapper.seconds(Duration.ofMillis(1500)), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyRange() {
        new TimeMapper(START, START, 100, 5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTooNarrow() {
        new TimeMapper(START, START.plusSeconds(60), 5, 5);
    }
}
