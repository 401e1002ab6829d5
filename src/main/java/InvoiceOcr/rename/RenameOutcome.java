package InvoiceOcr.rename;

import java.nio.file.Path;

/**
 * Ergebnis einer Umbenennung (oder eines Vorschlags) für eine Datei.
 *
 * @param target null when the record was skipped or the rename failed before a name was found
 * @param detail reason for SKIPPED and FAILED, otherwise null
 */
public record RenameOutcome(Path source, Path target, Status status, String detail) {

    public enum Status {
        /** Umbenannt (bzw. beim Vorschlag: würde umbenannt). */
        RENAMED,
        /** Datei trägt bereits den Zielnamen. */
        UNCHANGED,
        /** Kein gültiger Datensatz oder kein Käufer. */
        SKIPPED,
        FAILED
    }

    public static RenameOutcome skipped(Path source, String reason) {
        return new RenameOutcome(source, null, Status.SKIPPED, reason);
    }
}
