package InvoiceOcr.image;

/**
 * PDF konnte nicht gerastert werden (kaputte Datei, Passwort, pdftoppm fehlt, ...).
 */
public class PdfRenderException extends Exception {

    public PdfRenderException(String message) {
        super(message);
    }

    public PdfRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
