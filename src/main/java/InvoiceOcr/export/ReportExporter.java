package InvoiceOcr.export;

import InvoiceOcr.model.Analysis;
import InvoiceOcr.model.InvoiceRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Schreibt einen Bericht über einen abgeschlossenen Lauf.
 */
public interface ReportExporter {

    /**
     * File name used when the caller only names a directory.
     */
    String defaultFileName();

    void export(List<InvoiceRecord> records, Analysis analysis, Path target) throws IOException;
}
