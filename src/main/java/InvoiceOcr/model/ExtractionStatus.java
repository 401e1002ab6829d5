package InvoiceOcr.model;

/**
 * Ergebnis der Extraktion für eine Datei.
 *
 * Outcome of extracting one source file.
 */
public enum ExtractionStatus {
    SUCCESS,
    PARTIAL_FAILURE,
    FAILED
}
