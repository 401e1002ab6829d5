package InvoiceOcr.image;

/**
 * Bildbytes plus MIME-Typ, bereit für den Provider.
 */
public record EncodedImage(byte[] bytes, String mimeType, boolean fromPdf) {
}
