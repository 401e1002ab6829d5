package InvoiceOcr.export;

import InvoiceOcr.model.AmountBucket;
import InvoiceOcr.model.Analysis;
import InvoiceOcr.model.Analysis.BucketStats;
import InvoiceOcr.model.InvoiceRecord;
import InvoiceOcr.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Markdown-Zusammenfassung (invoice_summary.md): Übersicht, Gruppierungen, Detailtabelle.
 */
@Component
public class MarkdownExporter implements ReportExporter {

    private static final Logger log = LoggerFactory.getLogger(MarkdownExporter.class);

    @Override
    public String defaultFileName() {
        return "invoice_summary.md";
    }

    @Override
    public void export(List<InvoiceRecord> records, Analysis analysis, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(records, analysis), StandardCharsets.UTF_8);
        log.info("Markdown report written to {}", target);
    }

    String render(List<InvoiceRecord> records, Analysis analysis) {
        StringBuilder md = new StringBuilder();
        md.append("# Rechnungsübersicht\n\n");

        md.append("| Kennzahl | Wert |\n");
        md.append("|---|---:|\n");
        md.append("| Dateien gesamt | ").append(analysis.totalCount()).append(" |\n");
        md.append("| Gültig | ").append(analysis.validCount()).append(" |\n");
        md.append("| Fehlgeschlagen | ").append(analysis.failedCount()).append(" |\n");
        md.append("| Gesamtbetrag | ").append(analysis.totalAmount()).append(" |\n");
        md.append("| Durchschnitt | ").append(analysis.averageAmount()).append(" |\n\n");

        md.append("## Nach Monat\n\n");
        appendAmountTable(md, "Monat", analysis.byMonth());

        md.append("## Nach Verkäufer\n\n");
        appendAmountTable(md, "Verkäufer", analysis.byVendor());

        md.append("## Nach Betragsbereich\n\n");
        md.append("| Bereich | Anzahl | Summe |\n");
        md.append("|---|---:|---:|\n");
        for (Map.Entry<AmountBucket, BucketStats> entry : analysis.byBucket().entrySet()) {
            md.append("| ").append(escape(entry.getKey().getLabel()))
              .append(" | ").append(entry.getValue().count())
              .append(" | ").append(entry.getValue().subtotal())
              .append(" |\n");
        }
        md.append('\n');

        if (!analysis.byInvoiceType().isEmpty()) {
            md.append("## Nach Rechnungsart\n\n");
            appendStatsTable(md, "Rechnungsart", analysis.byInvoiceType());
        }
        if (!analysis.byExpenseCategory().isEmpty()) {
            md.append("## Nach Kostenart\n\n");
            appendStatsTable(md, "Kostenart", analysis.byExpenseCategory());
        }
        if (!analysis.byRiskLevel().isEmpty()) {
            md.append("## Nach Risiko\n\n");
            md.append("| Risiko | Anzahl |\n");
            md.append("|---|---:|\n");
            for (Map.Entry<RiskLevel, Integer> entry : analysis.byRiskLevel().entrySet()) {
                md.append("| ").append(entry.getKey().getCode()).append(" | ").append(entry.getValue()).append(" |\n");
            }
            md.append('\n');
            appendRiskNotes(md, records);
        }

        if (!analysis.duplicateInvoiceNumbers().isEmpty()) {
            md.append("## Doppelte Rechnungsnummern\n\n");
            for (String number : analysis.duplicateInvoiceNumbers()) {
                md.append("- ").append(number).append('\n');
            }
            md.append('\n');
        }
        if (!analysis.warnings().isEmpty()) {
            md.append("## Warnungen\n\n");
            for (String warning : analysis.warnings()) {
                md.append("- ").append(warning).append('\n');
            }
            md.append('\n');
        }

        md.append("## Details\n\n");
        md.append("| # | Datei | Rechnungsnummer | Datum | Verkäufer | Käufer | Betrag | Status | Fehler |\n");
        md.append("|---:|---|---|---|---|---|---:|---|---|\n");
        int index = 1;
        for (InvoiceRecord record : records) {
            md.append("| ").append(index++)
              .append(" | ").append(escape(record.fileName()))
              .append(" | ").append(escape(record.invoiceNumber()))
              .append(" | ").append(record.invoiceDate() != null
                      ? record.invoiceDate().format(DateTimeFormatter.ISO_LOCAL_DATE) : "")
              .append(" | ").append(escape(record.vendorName()))
              .append(" | ").append(escape(record.buyerName()))
              .append(" | ").append(record.amountTotal())
              .append(" | ").append(record.extractionStatus())
              .append(" | ").append(escape(record.firstError()))
              .append(" |\n");
        }
        return md.toString();
    }

    private static void appendAmountTable(StringBuilder md, String keyHeader, Map<String, BigDecimal> values) {
        md.append("| ").append(keyHeader).append(" | Summe |\n");
        md.append("|---|---:|\n");
        for (Map.Entry<String, BigDecimal> entry : values.entrySet()) {
            md.append("| ").append(escape(entry.getKey())).append(" | ").append(entry.getValue()).append(" |\n");
        }
        md.append('\n');
    }

    private static void appendStatsTable(StringBuilder md, String keyHeader, Map<String, BucketStats> stats) {
        md.append("| ").append(keyHeader).append(" | Anzahl | Summe |\n");
        md.append("|---|---:|---:|\n");
        for (Map.Entry<String, BucketStats> entry : stats.entrySet()) {
            md.append("| ").append(escape(entry.getKey()))
              .append(" | ").append(entry.getValue().count())
              .append(" | ").append(entry.getValue().subtotal())
              .append(" |\n");
        }
        md.append('\n');
    }

    // nur hohe Risiken einzeln auflisten
    private static void appendRiskNotes(StringBuilder md, List<InvoiceRecord> records) {
        boolean any = false;
        for (InvoiceRecord record : records) {
            if (record.verification() == null || record.verification().riskLevel() != RiskLevel.HIGH) {
                continue;
            }
            md.append("- ").append(escape(record.fileName())).append(": ")
              .append(escape(record.verification().riskNotes())).append('\n');
            any = true;
        }
        if (any) {
            md.append('\n');
        }
    }

    // Pipes und Zeilenumbrüche würden die Tabelle zerbrechen
    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("|", "\\|").replaceAll("\\R", " ");
    }
}
