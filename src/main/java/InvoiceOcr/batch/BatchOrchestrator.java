package InvoiceOcr.batch;

import InvoiceOcr.config.ProviderConfig;
import InvoiceOcr.image.EncodedImage;
import InvoiceOcr.image.ImageEncoder;
import InvoiceOcr.image.PdfRenderException;
import InvoiceOcr.llm.AttemptListener;
import InvoiceOcr.llm.ExtractionClient;
import InvoiceOcr.llm.ExtractionFailedException;
import InvoiceOcr.llm.ExtractionPrompts;
import InvoiceOcr.llm.ProviderErrorKind;
import InvoiceOcr.llm.ProviderException;
import InvoiceOcr.model.Classification;
import InvoiceOcr.model.ErrorTags;
import InvoiceOcr.model.ExtractionMode;
import InvoiceOcr.model.InvoiceRecord;
import InvoiceOcr.model.RiskLevel;
import InvoiceOcr.model.Verification;
import InvoiceOcr.parser.ResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/*

Steuert einen Batch-Lauf: Dateien finden, PDF rastern, optional Rechnung prüfen,
extrahieren, parsen, optional Echtheit prüfen und klassifizieren.
Dateien werden nacheinander verarbeitet.


Drives one batch run: walk, rasterize, optional invoice check, extract, parse,
optional verification and classification.
* Files are processed one after another on the caller's thread.

*/
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final ExtractionClient extractionClient;
    private final ResponseParser responseParser;
    private final ImageEncoder imageEncoder;

    public BatchOrchestrator(ExtractionClient extractionClient,
                             ResponseParser responseParser,
                             ImageEncoder imageEncoder) {
        this.extractionClient = extractionClient;
        this.responseParser = responseParser;
        this.imageEncoder = imageEncoder;
    }

    /**
     * Verarbeitet alle Rechnungen unter {@code root}.
     *
     * @param cancelled polled before every file; once true the run stops and returns what it has
     * @throws ProviderException     of kind CONFIG if the provider configuration is incomplete;
     *                               no file is touched in that case
     * @throws NotDirectoryException if {@code root} is not a directory
     */
    public BatchResult run(Path root, ProviderConfig config, ExtractionMode mode, BatchOptions options,
                           BatchListener listener, BooleanSupplier cancelled) throws ProviderException, IOException {
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        try {
            extractionClient.validate(config);
        } catch (ProviderException e) {
            listener.onEvent(new BatchEvent.Log(BatchEvent.Level.ERROR,
                    "Provider configuration invalid: " + e.getMessage(), null));
            throw e;
        }

        FileWalker walker = new FileWalker(root, options.skipKeywords());
        int total = walker.count();
        log.info("Starting batch over {} file(s) in {} ({}, mode {})", total, root, config.describe(), mode);
        listener.onEvent(BatchEvent.Log.info("Found " + total + " invoice file(s), provider " + config.describe()));

        List<InvoiceRecord> records = new ArrayList<>();
        int success = 0;
        int partial = 0;
        int failed = 0;
        BigDecimal totalAmount = InvoiceRecord.ZERO_AMOUNT;
        boolean wasCancelled = false;

        for (Path file : walker) {
            if (cancelled.getAsBoolean()) {
                wasCancelled = true;
                log.info("Batch cancelled after {} of {} file(s)", records.size(), total);
                listener.onEvent(BatchEvent.Log.info("Cancelled after " + records.size() + " of " + total + " file(s)"));
                break;
            }

            InvoiceRecord record = processFile(file, config, mode, options, listener);
            records.add(record);
            switch (record.extractionStatus()) {
                case SUCCESS:
                    success++;
                    break;
                case PARTIAL_FAILURE:
                    partial++;
                    break;
                default:
                    failed++;
                    break;
            }
            if (record.isValid()) {
                totalAmount = totalAmount.add(record.amountTotal());
            }

            listener.onEvent(new BatchEvent.Log(record.isValid() ? BatchEvent.Level.INFO : BatchEvent.Level.WARN,
                    String.format("[%03d] %s -> %s %s", records.size(), record.fileName(), record.amountTotal(),
                            statusText(record)), file));
            listener.onEvent(new BatchEvent.Progress(records.size(), total, record));
        }

        BatchResult result = new BatchResult(records, records.size(), success, partial, failed, totalAmount,
                wasCancelled);
        log.info("Batch finished: {} processed, {} ok, {} partial, {} failed, total {}",
                result.processed(), success, partial, failed, totalAmount);
        listener.onEvent(new BatchEvent.Done(result));
        return result;
    }

    /**
     * Verarbeitet eine einzelne Datei, blockierend. Fehler landen im Datensatz, nie als Exception.
     */
    public InvoiceRecord processFile(Path file, ProviderConfig config, ExtractionMode mode, BatchOptions options,
                                     BatchListener listener) {
        EncodedImage image;
        try {
            image = imageEncoder.encode(file, options.rasterizer());
        } catch (PdfRenderException e) {
            log.warn("PDF rendering failed for {}: {}", file, e.getMessage());
            return InvoiceRecord.failed(file, ErrorTags.withDetail(ErrorTags.PDF_RENDER_ERROR, e.getMessage()));
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return InvoiceRecord.failed(file, ErrorTags.withDetail(ErrorTags.IO_ERROR, e.getMessage()));
        } catch (RuntimeException e) {
            // z.B. defekte PDF-Struktur, die PDFBox nicht als IOException meldet
            log.error("Unexpected error while reading {}", file, e);
            String tag = ImageEncoder.isPdf(file) ? ErrorTags.PDF_RENDER_ERROR : ErrorTags.IO_ERROR;
            return InvoiceRecord.failed(file, ErrorTags.withDetail(tag, describe(e)));
        }

        if (options.validateInvoices() && !looksLikeInvoice(file, image, config)) {
            return InvoiceRecord.failed(file, ErrorTags.NOT_AN_INVOICE);
        }

        AttemptListener attemptListener = (attempt, maxAttempts, failure, nextDelay) -> {
            if (nextDelay != null) {
                listener.onEvent(BatchEvent.Log.warn(String.format("%s: attempt %d/%d failed (%s), retrying in %ds",
                        file.getFileName(), attempt, maxAttempts, failure.getKind(), nextDelay.toSeconds()), file));
            }
        };

        String rawText;
        try {
            rawText = extractionClient.extract(image.bytes(), image.mimeType(), ExtractionPrompts.forMode(mode),
                    config, attemptListener);
        } catch (ExtractionFailedException e) {
            return InvoiceRecord.failed(file, null,
                    List.of(ErrorTags.withDetail(e.getKind().errorTag(), e.getLastCause().getMessage())));
        } catch (RuntimeException e) {
            log.error("Unexpected error while extracting {}", file, e);
            return InvoiceRecord.failed(file, null,
                    List.of(ErrorTags.withDetail(ProviderErrorKind.EMPTY_RESPONSE.errorTag(), describe(e))));
        }

        InvoiceRecord record;
        try {
            record = responseParser.parse(file, rawText, mode);
        } catch (RuntimeException e) {
            log.error("Could not parse the model output for {}", file, e);
            return InvoiceRecord.failed(file, rawText,
                    List.of(ErrorTags.withDetail(ErrorTags.AMOUNT_NOT_FOUND, describe(e))));
        }

        // Zusatzprüfungen nur für Datensätze mit Betrag
        if (!record.isValid() || (!options.verifyInvoices() && !options.classifyInvoices())) {
            return record;
        }
        Verification verification = options.verifyInvoices() ? verify(file, image, config) : null;
        Classification classification = options.classifyInvoices() ? classify(file, image, config) : null;
        if (verification != null && verification.riskLevel() == RiskLevel.HIGH) {
            listener.onEvent(BatchEvent.Log.warn(String.format("%s: high risk (%s)", file.getFileName(),
                    verification.riskNotes()), file));
        }
        return record.withChecks(verification, classification);
    }

    /*
     * Echtheitsprüfung, ein Versuch. Fehler ergeben RiskLevel.UNKNOWN statt eines Fehlers im Datensatz.
     */
    private Verification verify(Path file, EncodedImage image, ProviderConfig config) {
        try {
            String answer = extractionClient.extractOnce(image.bytes(), image.mimeType(), ExtractionPrompts.VERIFY,
                    config);
            Optional<Verification> verification = responseParser.parseVerification(answer);
            if (verification.isEmpty()) {
                log.debug("Unreadable verification answer for {}", file.getFileName());
                return Verification.unavailable("unreadable answer");
            }
            return verification.get();
        } catch (ProviderException e) {
            log.warn("Verification failed for {}: {}", file.getFileName(), e.getMessage());
            return Verification.unavailable(ErrorTags.withDetail(e.getKind().errorTag(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error while verifying {}", file, e);
            return Verification.unavailable(describe(e));
        }
    }

    private Classification classify(Path file, EncodedImage image, ProviderConfig config) {
        try {
            String answer = extractionClient.extractOnce(image.bytes(), image.mimeType(), ExtractionPrompts.CLASSIFY,
                    config);
            return responseParser.parseClassification(answer).orElse(Classification.OTHER);
        } catch (ProviderException e) {
            log.warn("Classification failed for {}: {}", file.getFileName(), e.getMessage());
            return Classification.OTHER;
        } catch (RuntimeException e) {
            log.error("Unexpected error while classifying {}", file, e);
            return Classification.OTHER;
        }
    }

    /*
     * Einzelner Versuch; bei Fehlern oder unklarer Antwort wird die Datei als Rechnung behandelt.
     */
    private boolean looksLikeInvoice(Path file, EncodedImage image, ProviderConfig config) {
        try {
            String answer = extractionClient.extractOnce(image.bytes(), image.mimeType(), ExtractionPrompts.VALIDATE,
                    config);
            Optional<Boolean> isInvoice = responseParser.parseIsInvoice(answer);
            if (isInvoice.isPresent() && !isInvoice.get()) {
                log.info("{} is not an invoice, skipping", file.getFileName());
                return false;
            }
            return true;
        } catch (ProviderException e) {
            log.debug("Invoice check failed for {} ({}), treating it as an invoice", file.getFileName(), e.getKind());
            return true;
        } catch (RuntimeException e) {
            log.warn("Invoice check failed for {}, treating it as an invoice", file.getFileName(), e);
            return true;
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String statusText(InvoiceRecord record) {
        switch (record.extractionStatus()) {
            case SUCCESS:
                return "OK";
            case PARTIAL_FAILURE:
                return "PARTIAL " + record.errors();
            default:
                return "FAILED " + record.firstError();
        }
    }
}
