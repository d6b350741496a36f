package in.co.kundli.pojos;

import java.util.Locale;

/**
 * D° M' S" rendering shared by the plain-text chart views.
 */
public final class DegreeFormat {

    private DegreeFormat() {}

    public static String formatDegree(double degree) {
        double normalized = ((degree % 360.0) + 360.0) % 360.0;
        return format(normalized);
    }

    public static String formatDegreeInSign(double longitude) {
        double normalized = ((longitude % 360.0) + 360.0) % 360.0;
        return format(normalized - Math.floor(normalized / 30.0) * 30.0);
    }

    private static String format(double value) {
        int deg = (int) value;
        double minutes = (value - deg) * 60.0;
        int min = (int) minutes;
        int sec = (int) ((minutes - min) * 60.0);
        return String.format(Locale.ROOT, "%d° %d' %d\"", deg, min, sec);
    }
}
