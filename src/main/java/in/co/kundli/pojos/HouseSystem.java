package in.co.kundli.pojos;

/**
 * House systems supported by the cusp calculation, keyed by their single-letter provider code.
 */
public enum HouseSystem {
    PLACIDUS('P', "Placidus"),
    KOCH('K', "Koch"),
    PORPHYRY('O', "Porphyry"),
    REGIOMONTANUS('R', "Regiomontanus"),
    CAMPANUS('C', "Campanus"),
    EQUAL('E', "Equal"),
    WHOLE_SIGN('W', "Whole Sign");

    public static final HouseSystem DEFAULT = PLACIDUS;

    private final char code;
    private final String displayName;

    HouseSystem(char code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public char getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return the matching system, or {@code null} if the code is not supported
     */
    public static HouseSystem fromCode(char code) {
        char upper = Character.toUpperCase(code);
        for (HouseSystem system : values()) {
            if (system.code == upper) {
                return system;
            }
        }
        return null;
    }

    /**
     * Accepts the enum name ("WHOLE_SIGN"), the display name ("Whole Sign") or the one-letter code.
     *
     * @return the matching system, or {@code null} if nothing matches
     */
    public static HouseSystem fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String trimmed = name.trim();
        if (trimmed.length() == 1) {
            return fromCode(trimmed.charAt(0));
        }
        for (HouseSystem system : values()) {
            if (system.name().equalsIgnoreCase(trimmed) || system.displayName.equalsIgnoreCase(trimmed)) {
                return system;
            }
        }
        return null;
    }
}
