package InvoiceOcr.batch;

import InvoiceOcr.model.InvoiceRecord;

import java.nio.file.Path;

/**
 * Meldungen des Orchestrators an die Oberfläche (CLI, Logs).
 */
public sealed interface BatchEvent permits BatchEvent.Log, BatchEvent.Progress, BatchEvent.Done {

    enum Level {
        INFO,
        WARN,
        ERROR
    }

    /**
     * Freitext-Meldung, optional zu einer Datei.
     */
    record Log(Level level, String message, Path file) implements BatchEvent {

        public static Log info(String message) {
            return new Log(Level.INFO, message, null);
        }

        public static Log warn(String message, Path file) {
            return new Log(Level.WARN, message, file);
        }
    }

    /**
     * Nach jeder Datei: verarbeitet / gesamt, plus der eben erzeugte Datensatz.
     */
    record Progress(int processed, int total, InvoiceRecord record) implements BatchEvent {
    }

    record Done(BatchResult result) implements BatchEvent {
    }
}
