package InvoiceOcr.model;

import java.util.Objects;

/**
 * Ergebnis der optionalen Echtheitsprüfung.
 *
 * @param riskLevel    overall risk, never null
 * @param hasStamp     whether an official seal was seen
 * @param imageQuality {@code good}, {@code fair} or {@code poor}
 * @param riskNotes    free text from the model, may be empty
 */
public record Verification(RiskLevel riskLevel, boolean hasStamp, String imageQuality, String riskNotes) {

    public static final String QUALITY_GOOD = "good";

    public Verification {
        Objects.requireNonNull(riskLevel, "riskLevel");
        imageQuality = imageQuality == null || imageQuality.isBlank() ? QUALITY_GOOD : imageQuality.trim();
        riskNotes = riskNotes == null ? "" : riskNotes.trim();
    }

    /**
     * Prüfung nicht möglich (Providerfehler oder unlesbare Antwort).
     */
    public static Verification unavailable(String reason) {
        return new Verification(RiskLevel.UNKNOWN, false, QUALITY_GOOD, "verification failed: " + reason);
    }
}
