package InvoiceOcr;

import InvoiceOcr.batch.BatchEvent;
import InvoiceOcr.batch.BatchOptions;
import InvoiceOcr.batch.BatchOrchestrator;
import InvoiceOcr.batch.BatchResult;
import InvoiceOcr.config.AppSettings;
import InvoiceOcr.config.ProviderConfig;
import InvoiceOcr.config.SettingsStore;
import InvoiceOcr.export.ExcelExporter;
import InvoiceOcr.export.MarkdownExporter;
import InvoiceOcr.export.ReportExporter;
import InvoiceOcr.llm.ExtractionClient;
import InvoiceOcr.llm.ModelInfo;
import InvoiceOcr.llm.OpenRouterAdapter;
import InvoiceOcr.llm.ProviderException;
import InvoiceOcr.model.Analysis;
import InvoiceOcr.model.ExtractionMode;
import InvoiceOcr.model.InvoiceRecord;
import InvoiceOcr.model.RiskLevel;
import InvoiceOcr.rename.FileRenamer;
import InvoiceOcr.rename.RenameOutcome;
import InvoiceOcr.validation.InvoiceAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;


/* Kommandozeilen-Einstieg: ein Batch-Lauf pro Programmstart.
 * Einstellungen aus ~/.invoice_ocr_config.json, überschreibbar per Option:
 *
 *   --dir=<Ordner> --mode=simple|full --provider=ollama|volcengine|openrouter
 *   --max-retries=<n> --excel[=false] --markdown[=false] --rename[=false] --validate[=false]
 *   --verify[=false] --classify[=false] --save
 *
 * --list-models gibt nur die OpenRouter-Modellliste aus und startet keinen Batch.
 *
 * Command-line entry point: one batch run per start. --save writes the effective settings back.
 */
@Component
@ConditionalOnProperty(name = "invoice-ocr.runner.enabled", havingValue = "true", matchIfMissing = true)
public class BatchCommand implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);
    private static final Duration MODEL_LIST_TIMEOUT = Duration.ofSeconds(30);

    private final SettingsStore settingsStore;
    private final BatchOrchestrator orchestrator;
    private final ExtractionClient extractionClient;
    private final InvoiceAnalyzer analyzer;
    private final FileRenamer renamer;
    private final ExcelExporter excelExporter;
    private final MarkdownExporter markdownExporter;
    private final OpenRouterAdapter openRouterAdapter;

    public BatchCommand(SettingsStore settingsStore,
                        BatchOrchestrator orchestrator,
                        ExtractionClient extractionClient,
                        InvoiceAnalyzer analyzer,
                        FileRenamer renamer,
                        ExcelExporter excelExporter,
                        MarkdownExporter markdownExporter,
                        OpenRouterAdapter openRouterAdapter) {
        this.settingsStore = settingsStore;
        this.orchestrator = orchestrator;
        this.extractionClient = extractionClient;
        this.analyzer = analyzer;
        this.renamer = renamer;
        this.excelExporter = excelExporter;
        this.markdownExporter = markdownExporter;
        this.openRouterAdapter = openRouterAdapter;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        AppSettings settings = settingsStore.load();
        applyOverrides(settings, args);

        if (args.containsOption("save")) {
            settingsStore.save(settings);
        }

        if (args.containsOption("list-models")) {
            listModels(settings);
            return;
        }

        if (settings.getScanDirectory() == null || settings.getScanDirectory().isBlank()) {
            throw new IllegalArgumentException("No scan directory configured, use --dir=<folder>");
        }
        Path root = Path.of(settings.getScanDirectory());
        ProviderConfig config = settings.toProviderConfig();
        ExtractionMode mode = settings.extractionMode();

        if (!extractionClient.isReachable(config)) {
            log.warn("Provider not reachable ({}), trying anyway", config.describe());
        }

        BatchResult result;
        try {
            result = orchestrator.run(root, config, mode, BatchOptions.from(settings), this::onEvent,
                    () -> Thread.currentThread().isInterrupted());
        } catch (ProviderException e) {
            throw new IllegalStateException("Provider configuration invalid: " + e.getMessage(), e);
        }

        List<InvoiceRecord> records = result.records();
        if (settings.isEnableRename()) {
            records = renameAll(records);
        }

        Analysis analysis = analyzer.analyze(records);
        logSummary(analysis);

        if (settings.isEnableExcel()) {
            writeReport(excelExporter, records, analysis, root);
        }
        if (settings.isEnableMarkdown()) {
            writeReport(markdownExporter, records, analysis, root);
        }
    }

    static void applyOverrides(AppSettings settings, ApplicationArguments args) {
        optionValue(args, "dir").ifPresent(settings::setScanDirectory);
        optionValue(args, "mode").ifPresent(settings::setMode);
        optionValue(args, "provider").ifPresent(settings::setProvider);
        optionValue(args, "max-retries").ifPresent(value -> settings.setMaxRetries(Integer.parseInt(value)));
        optionFlag(args, "excel").ifPresent(settings::setEnableExcel);
        optionFlag(args, "markdown").ifPresent(settings::setEnableMarkdown);
        optionFlag(args, "rename").ifPresent(settings::setEnableRename);
        optionFlag(args, "validate").ifPresent(settings::setEnableValidate);
        optionFlag(args, "verify").ifPresent(settings::setEnableVerify);
        optionFlag(args, "classify").ifPresent(settings::setEnableClassify);
    }

    private void listModels(AppSettings settings) {
        ProviderConfig config = ProviderConfig.openRouter(settings.getOpenrouterApiKey(),
                settings.getOpenrouterModel(), settings.getMaxRetries(), MODEL_LIST_TIMEOUT);
        List<ModelInfo> models;
        try {
            models = openRouterAdapter.listModels(config);
        } catch (ProviderException e) {
            throw new IllegalStateException("Could not load the OpenRouter model list: " + e.getMessage(), e);
        }
        for (ModelInfo model : models) {
            log.info("{}  ({})", model.id(), model.name());
        }
    }

    private void onEvent(BatchEvent event) {
        if (event instanceof BatchEvent.Log) {
            BatchEvent.Log logEvent = (BatchEvent.Log) event;
            if (logEvent.level() == BatchEvent.Level.ERROR) {
                log.error(logEvent.message());
            } else if (logEvent.level() == BatchEvent.Level.WARN) {
                log.warn(logEvent.message());
            } else {
                log.info(logEvent.message());
            }
        } else if (event instanceof BatchEvent.Progress) {
            BatchEvent.Progress progress = (BatchEvent.Progress) event;
            log.debug("Progress {}/{}", progress.processed(), progress.total());
        } else if (event instanceof BatchEvent.Done) {
            BatchResult result = ((BatchEvent.Done) event).result();
            log.info("Done: {} ok, {} partial, {} failed{}", result.success(), result.partial(), result.failed(),
                    result.cancelled() ? " (cancelled)" : "");
        }
    }

    private List<InvoiceRecord> renameAll(List<InvoiceRecord> records) {
        List<RenameOutcome> outcomes = renamer.rename(records);
        List<InvoiceRecord> renamed = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            RenameOutcome outcome = outcomes.get(i);
            if (outcome.status() == RenameOutcome.Status.RENAMED) {
                renamed.add(records.get(i).withSourcePath(outcome.target()));
            } else {
                if (outcome.status() == RenameOutcome.Status.FAILED) {
                    log.warn("Rename failed for {}: {}", outcome.source().getFileName(), outcome.detail());
                }
                renamed.add(records.get(i));
            }
        }
        return renamed;
    }

    private void writeReport(ReportExporter exporter, List<InvoiceRecord> records, Analysis analysis, Path root) {
        Path target = root.resolve(exporter.defaultFileName());
        try {
            exporter.export(records, analysis, target);
        } catch (IOException e) {
            log.error("Could not write {}: {}", target, e.getMessage());
        }
    }

    private void logSummary(Analysis analysis) {
        log.info("Invoices: {} total, {} valid, {} failed, amount {} (avg {})", analysis.totalCount(),
                analysis.validCount(), analysis.failedCount(), analysis.totalAmount(), analysis.averageAmount());
        for (String number : analysis.duplicateInvoiceNumbers()) {
            log.warn("Duplicate invoice number: {}", number);
        }
        for (String warning : analysis.warnings()) {
            log.warn(warning);
        }
        int highRisk = analysis.byRiskLevel().getOrDefault(RiskLevel.HIGH, 0);
        if (highRisk > 0) {
            log.warn("{} invoice(s) with high risk, see the report", highRisk);
        }
    }

    private static Optional<String> optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(values.get(values.size() - 1).trim());
    }

    // "--rename" allein bedeutet true
    private static Optional<Boolean> optionFlag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return Optional.empty();
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(values.size() - 1).isBlank()) {
            return Optional.of(true);
        }
        return Optional.of(Boolean.parseBoolean(values.get(values.size() - 1).trim()));
    }
}
