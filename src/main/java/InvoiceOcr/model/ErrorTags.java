package InvoiceOcr.model;

/**
 * Fehler-Tags, die an einem {@link InvoiceRecord} hängen können.
 */
public final class ErrorTags {

    public static final String AMOUNT_NOT_FOUND = "amount_not_found";
    public static final String DATE_NOT_FOUND = "date_not_found";
    public static final String DATE_INVALID = "date_invalid";
    public static final String VENDOR_NOT_FOUND = "vendor_not_found";
    public static final String BUYER_NOT_FOUND = "buyer_not_found";
    public static final String INVOICE_NUMBER_NOT_FOUND = "invoice_number_not_found";
    public static final String NOT_AN_INVOICE = "not_an_invoice";
    public static final String PDF_RENDER_ERROR = "pdf_render_error";
    public static final String IO_ERROR = "io_error";

    private ErrorTags() {
    }

    public static String withDetail(String tag, String detail) {
        if (detail == null || detail.isBlank()) {
            return tag;
        }
        return tag + ": " + detail;
    }
}
