package in.co.kundli.services;

import in.co.kundli.exceptions.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TimezoneUtils with Timeshape integration
 */
public class TimezoneUtilsTest {

    @Test
    public void testTimeshapeIntegration() {
        // Delhi, India
        Optional<ZoneId> delhiZoneId = TimezoneUtils.getZoneId(28.6139, 77.2090);
        assertTrue(delhiZoneId.isPresent(), "Delhi timezone should be found");
        assertTrue(delhiZoneId.get().getId().contains("Asia"), "Delhi should be in Asia timezone");

        // New York, USA
        Optional<ZoneId> nyZoneId = TimezoneUtils.getZoneId(40.7128, -74.0060);
        assertTrue(nyZoneId.isPresent(), "New York timezone should be found");
        assertTrue(nyZoneId.get().getId().contains("America"), "New York should be in America timezone");
    }

    @Test
    public void testHistoricalOffset() {
        // Nepal moved from +05:30 to +05:45 in 1986
        double kathmandu = TimezoneUtils.getTimezoneOffset(27.7172, 85.3240, LocalDateTime.of(1990, 5, 15, 14, 30));
        assertEquals(5.75, kathmandu, 1e-9);

        double delhi = TimezoneUtils.getTimezoneOffset(28.6139, 77.2090, LocalDateTime.of(2024, 1, 1, 12, 0));
        assertEquals(5.5, delhi, 1e-9, "Delhi should be UTC+5:30");
    }

    @Test
    public void testDaylightSavingOffset() {
        double winter = TimezoneUtils.getTimezoneOffset(51.5074, -0.1278, LocalDateTime.of(2024, 1, 15, 12, 0));
        double summer = TimezoneUtils.getTimezoneOffset(51.5074, -0.1278, LocalDateTime.of(2024, 7, 15, 12, 0));
        assertEquals(0.0, winter, 1e-9);
        assertEquals(1.0, summer, 1e-9);
    }

    @Test
    public void testTimezoneIdUsableForConversion() {
        String delhiTimezoneId = TimezoneUtils.getTimezoneId(28.6139, 77.2090);
        assertNotNull(delhiTimezoneId);
        assertDoesNotThrow(() -> ZoneId.of(delhiTimezoneId));
    }

    @Test
    public void testFallbackOffset() {
        assertEquals(5.5, TimezoneUtils.getFallbackTimezoneOffset(82.5), 1e-9);
        assertEquals(-5.5, TimezoneUtils.getFallbackTimezoneOffset(-82.5), 1e-9);
        assertEquals(0.0, TimezoneUtils.getFallbackTimezoneOffset(3.0), 1e-9);
        assertEquals(12.0, TimezoneUtils.getFallbackTimezoneOffset(180.0), 1e-9);

        assertEquals(ZoneOffset.ofHoursMinutes(5, 30), TimezoneUtils.getFallbackZoneOffset(82.5));
        assertEquals("-05:30", TimezoneUtils.getFallbackZoneOffset(-82.5).getId());
    }

    @Test
    public void testInvalidCoordinates() {
        assertThrows(ValidationException.class, () -> TimezoneUtils.getZoneId(91.0, 0.0));
        assertThrows(ValidationException.class, () -> TimezoneUtils.getZoneId(0.0, 181.0));
    }
}
