package in.co.kundli.pojos;

import lombok.Data;

import java.util.List;

/**
 * Externally supplied engine settings, typically read from {@code kundli-settings.json}.
 * Names are matched case-insensitively against {@link AyanamsaType}, {@link HouseSystem}
 * and {@link Planet}; {@code null} means "use the default".
 */
@Data
public class EngineSettings {

    private String ayanamsa;
    private String houseSystem;
    private String ephemerisPath;
    private List<String> trackedBodies;

    public EngineSettings() {
    }
}
