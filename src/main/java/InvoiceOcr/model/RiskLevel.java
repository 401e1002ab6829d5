package InvoiceOcr.model;

import java.util.Locale;

/**
 * Risikostufe aus der Echtheitsprüfung einer Rechnung.
 *
 * Risk level reported by the authenticity check. {@link #UNKNOWN} marks a check that could not
 * be run or whose answer was unreadable.
 */
public enum RiskLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    UNKNOWN("unknown");

    private final String code;

    RiskLevel(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static RiskLevel fromCode(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RiskLevel level : values()) {
            if (level.code.equals(normalized)) {
                return level;
            }
        }
        // chinesische Antworten: 低/中/高
        if (normalized.startsWith("高")) {
            return HIGH;
        }
        if (normalized.startsWith("中")) {
            return MEDIUM;
        }
        if (normalized.startsWith("低")) {
            return LOW;
        }
        return UNKNOWN;
    }
}
