package in.co.kundli.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.co.kundli.exceptions.InitializationException;
import in.co.kundli.pojos.AyanamsaType;
import in.co.kundli.pojos.EngineSettings;
import in.co.kundli.pojos.HouseSystem;
import in.co.kundli.pojos.Planet;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link EngineSettings} from a JSON file and resolves the names it contains.
 *
 * <pre>
 * {
 *   "ayanamsa": "LAHIRI",
 *   "houseSystem": "WHOLE_SIGN",
 *   "ephemerisPath": "/opt/ephe",
 *   "trackedBodies": ["SUN", "MOON", "RAHU", "KETU"]
 * }
 * </pre>
 *
 * A missing file means defaults; an unreadable or malformed one is an {@link InitializationException}.
 */
public class EngineSettingsLoader {

    private final ObjectMapper objectMapper;

    public EngineSettingsLoader() {
        this(new ObjectMapper());
    }

    public EngineSettingsLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EngineSettings load() {
        return load(new File(EngineConfig.SETTINGS_FILE));
    }

    public EngineSettings load(File file) {
        EngineSettings settings = new EngineSettings();
        if (file == null || !file.exists()) {
            LoggingService.info("engine_settings_defaults_used", Map.of(
                    "file", file == null ? "" : file.getPath()));
            return settings;
        }

        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(file);
        } catch (IOException e) {
            LoggingService.error("engine_settings_load_failed", e, Map.of("file", file.getPath()));
            throw new InitializationException("Failed to read engine settings from " + file.getPath(), e);
        }
        if (rootNode == null || !rootNode.isObject()) {
            throw new InitializationException("Engine settings must be a JSON object: " + file.getPath());
        }

        settings.setAyanamsa(textOrNull(rootNode, "ayanamsa"));
        settings.setHouseSystem(textOrNull(rootNode, "houseSystem"));
        settings.setEphemerisPath(textOrNull(rootNode, "ephemerisPath"));

        JsonNode bodies = rootNode.get("trackedBodies");
        if (bodies != null && !bodies.isNull()) {
            if (!bodies.isArray()) {
                throw new InitializationException("trackedBodies must be an array of body names");
            }
            List<String> names = new ArrayList<>();
            for (JsonNode body : bodies) {
                names.add(body.asText());
            }
            settings.setTrackedBodies(names);
        }

        LoggingService.info("engine_settings_loaded", Map.of("file", file.getPath()));
        return settings;
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }

    // =========================================================================
    // Name resolution
    // =========================================================================

    public static AyanamsaType resolveAyanamsa(EngineSettings settings) {
        if (settings == null || settings.getAyanamsa() == null) {
            return EngineConfig.DEFAULT_AYANAMSA;
        }
        AyanamsaType type = AyanamsaType.fromName(settings.getAyanamsa());
        if (type == null) {
            throw new InitializationException("Unknown ayanamsa: " + settings.getAyanamsa());
        }
        return type;
    }

    public static HouseSystem resolveHouseSystem(EngineSettings settings) {
        if (settings == null || settings.getHouseSystem() == null) {
            return EngineConfig.DEFAULT_HOUSE_SYSTEM;
        }
        String name = settings.getHouseSystem();
        HouseSystem system = HouseSystem.fromName(name);
        if (system == null) {
            throw new InitializationException("Unknown house system: " + name);
        }
        return system;
    }

    public static List<Planet> resolveTrackedBodies(EngineSettings settings) {
        if (settings == null || settings.getTrackedBodies() == null || settings.getTrackedBodies().isEmpty()) {
            return Planet.ALL_PLANETS;
        }
        List<Planet> planets = new ArrayList<>();
        for (String name : settings.getTrackedBodies()) {
            Planet planet = Planet.fromName(name);
            if (planet == null) {
                throw new InitializationException("Unknown body: " + name);
            }
            if (!planets.contains(planet)) {
                planets.add(planet);
            }
        }
        return List.copyOf(planets);
    }

    public static File resolveEphemerisDir(EngineSettings settings) {
        if (settings == null || settings.getEphemerisPath() == null) {
            return null;
        }
        return new File(settings.getEphemerisPath());
    }
}
