package InvoiceOcr.model;

import java.util.Locale;

/**
 * Extraktionstiefe: nur Betrag (SIMPLE) oder alle Felder (FULL).
 *
 * Extraction depth: amount only (SIMPLE) or every invoice field (FULL).
 */
public enum ExtractionMode {
    SIMPLE,
    FULL;

    public static ExtractionMode fromSetting(String value) {
        if (value == null || value.isBlank()) {
            return SIMPLE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("full")) {
            return FULL;
        }
        if (normalized.equals("simple")) {
            return SIMPLE;
        }
        throw new IllegalArgumentException("Unknown mode: " + value);
    }

    public String settingValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
