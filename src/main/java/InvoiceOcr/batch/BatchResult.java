package InvoiceOcr.batch;

import InvoiceOcr.model.InvoiceRecord;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ergebnis eines Laufs: Datensätze in Verarbeitungsreihenfolge und Zähler.
 */
public record BatchResult(
        List<InvoiceRecord> records,
        int processed,
        int success,
        int partial,
        int failed,
        BigDecimal totalAmount,
        boolean cancelled) {

    public BatchResult {
        records = List.copyOf(records);
    }
}
