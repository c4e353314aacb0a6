package work.lcod.forge.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesMinutesAndHours() {
        assertEquals(Duration.ofMinutes(10), DurationParser.parse("10m").orElseThrow());
        assertEquals(Duration.ofHours(1), DurationParser.parse("1h").orElseThrow());
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1500").orElseThrow());
        assertEquals(Duration.ofMillis(250), DurationParser.parse("250ms").orElseThrow());
    }

    @Test
    void blankMeansNoDuration() {
        assertTrue(DurationParser.parse(null).isEmpty());
        assertTrue(DurationParser.parse("  ").isEmpty());
    }

    @Test
    void rejectsGarbage() {
        var error = assertThrows(ConfigurationException.class, () -> DurationParser.parse("soon"));
        assertEquals("configuration_error", error.code());
    }

    @Test
    void formatsForReports() {
        assertEquals("850ms", DurationParser.format(Duration.ofMillis(850)));
        assertEquals("1.5s", DurationParser.format(Duration.ofMillis(1500)));
        assertEquals("3m04s", DurationParser.format(Duration.ofSeconds(184)));
    }
}
