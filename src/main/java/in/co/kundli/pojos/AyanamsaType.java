package in.co.kundli.pojos;

import in.co.kundli.provider.ProviderConstants;

/**
 * Sidereal correction systems the engine can be opened with.
 */
public enum AyanamsaType {
    LAHIRI(ProviderConstants.SIDM_LAHIRI, "Lahiri"),
    RAMAN(ProviderConstants.SIDM_RAMAN, "Raman"),
    KRISHNAMURTI(ProviderConstants.SIDM_KRISHNAMURTI, "Krishnamurti"),
    TRUE_CHITRAPAKSHA(ProviderConstants.SIDM_TRUE_CITRA, "True Chitrapaksha"),
    YUKTESHWAR(ProviderConstants.SIDM_YUKTESHWAR, "Yukteshwar"),
    FAGAN_BRADLEY(ProviderConstants.SIDM_FAGAN_BRADLEY, "Fagan-Bradley");

    private final int siderealMode;
    private final String displayName;

    AyanamsaType(int siderealMode, String displayName) {
        this.siderealMode = siderealMode;
        this.displayName = displayName;
    }

    public int getSiderealMode() {
        return siderealMode;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return the matching type, or {@code null} if nothing matches
     */
    public static AyanamsaType fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String trimmed = name.trim();
        for (AyanamsaType type : values()) {
            if (type.name().equalsIgnoreCase(trimmed) || type.displayName.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }
}
