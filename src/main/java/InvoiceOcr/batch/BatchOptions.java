package InvoiceOcr.batch;

import InvoiceOcr.config.AppSettings;
import InvoiceOcr.image.PdfBoxRasterizer;

import java.util.List;

/**
 * Laufoptionen eines Batches, die nicht zum Provider gehören.
 *
 * @param validateInvoices run the "is this an invoice?" check before extraction
 * @param rasterizer       name of the PDF rasterizer ({@code pdfbox} or {@code pdftoppm})
 * @param skipKeywords     file name substrings that exclude a file
 * @param verifyInvoices   run the authenticity check on every record with an amount
 * @param classifyInvoices run the type and expense category check on every record with an amount
 */
public record BatchOptions(boolean validateInvoices, String rasterizer, List<String> skipKeywords,
                           boolean verifyInvoices, boolean classifyInvoices) {

    public BatchOptions {
        rasterizer = rasterizer == null || rasterizer.isBlank() ? PdfBoxRasterizer.NAME : rasterizer;
        skipKeywords = skipKeywords == null ? FileWalker.DEFAULT_SKIP_KEYWORDS : List.copyOf(skipKeywords);
    }

    public BatchOptions(boolean validateInvoices, String rasterizer, List<String> skipKeywords) {
        this(validateInvoices, rasterizer, skipKeywords, false, false);
    }

    public static BatchOptions defaults() {
        return new BatchOptions(false, PdfBoxRasterizer.NAME, FileWalker.DEFAULT_SKIP_KEYWORDS);
    }

    public static BatchOptions from(AppSettings settings) {
        return new BatchOptions(settings.isEnableValidate(), settings.getRasterizer(), settings.getSkipKeywords(),
                settings.isEnableVerify(), settings.isEnableClassify());
    }
}
