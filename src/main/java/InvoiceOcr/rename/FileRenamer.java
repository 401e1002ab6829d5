package InvoiceOcr.rename;

import InvoiceOcr.model.InvoiceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
Benennt Rechnungsdateien nach dem Schema "<Betrag>-<Käufer>.<Endung>" um.
 * Kollisionen im selben Verzeichnis bekommen -1, -2, ... angehängt.
 * Bestehende Dateien werden nie überschrieben.

Renames invoice files to "<amount>-<buyer>.<ext>".
 * Collisions inside a directory get -1, -2, ... appended; existing files are never replaced.
*/
@Component
public class FileRenamer {

    private static final Logger log = LoggerFactory.getLogger(FileRenamer.class);

    public static final int MAX_BUYER_LENGTH = 30;

    /**
     * Berechnet die Umbenennungen, ohne die Festplatte zu verändern.
     */
    public List<RenameOutcome> propose(List<InvoiceRecord> records) {
        return process(records, false);
    }

    /**
     * Führt die Umbenennungen aus. Ein Fehler betrifft nur die eine Datei.
     *
     * @return one outcome per record, in input order
     */
    public List<RenameOutcome> rename(List<InvoiceRecord> records) {
        return process(records, true);
    }

    /**
     * Käufername ohne Leerraum und ohne im Dateisystem unzulässige Zeichen, maximal 30 Zeichen.
     */
    public static String sanitizeBuyer(String buyer) {
        if (buyer == null) {
            return "";
        }
        String cleaned = buyer
                .replaceAll("[\\s\\u3000]+", "")
                .replaceAll("[\\\\/:*?\"<>|]", "")
                .replaceAll("\\p{Cntrl}", "");
        if (cleaned.codePointCount(0, cleaned.length()) > MAX_BUYER_LENGTH) {
            cleaned = cleaned.substring(0, cleaned.offsetByCodePoints(0, MAX_BUYER_LENGTH));
        }
        return cleaned;
    }

    private List<RenameOutcome> process(List<InvoiceRecord> records, boolean execute) {
        List<RenameOutcome> outcomes = new ArrayList<>();
        // pro Verzeichnis: in diesem Lauf bereits vergebene Namen
        Map<Path, Set<String>> claimed = new HashMap<>();

        for (InvoiceRecord record : records) {
            Path source = record.sourcePath();
            if (!record.isValid()) {
                outcomes.add(RenameOutcome.skipped(source, "extraction failed"));
                continue;
            }
            String buyer = sanitizeBuyer(record.buyerName());
            if (buyer.isEmpty()) {
                outcomes.add(RenameOutcome.skipped(source, "no buyer name"));
                continue;
            }

            Path dir = source.toAbsolutePath().getParent();
            Set<String> claimedNames = claimed.computeIfAbsent(dir, d -> new HashSet<>());
            String base = record.amountTotal().toPlainString() + "-" + buyer;
            String extension = extension(source);
            String currentName = source.getFileName().toString();

            String targetName = resolveName(dir, base, extension, currentName, claimedNames);
            claimedNames.add(targetName);

            if (targetName.equals(currentName)) {
                outcomes.add(new RenameOutcome(source, source, RenameOutcome.Status.UNCHANGED, null));
                continue;
            }

            Path target = source.resolveSibling(targetName);
            if (!execute) {
                outcomes.add(new RenameOutcome(source, target, RenameOutcome.Status.RENAMED, null));
                continue;
            }
            outcomes.add(move(source, target));
        }
        return outcomes;
    }

    private static String resolveName(Path dir, String base, String extension, String currentName,
                                      Set<String> claimedNames) {
        int suffix = 0;
        while (true) {
            String candidate = suffix == 0 ? base + extension : base + "-" + suffix + extension;
            if (candidate.equals(currentName)) {
                return candidate;
            }
            if (!claimedNames.contains(candidate) && !Files.exists(dir.resolve(candidate))) {
                return candidate;
            }
            suffix++;
        }
    }

    private static RenameOutcome move(Path source, Path target) {
        try {
            // ohne REPLACE_EXISTING: ein vorhandenes Ziel führt zu FileAlreadyExistsException
            Files.move(source, target);
            log.info("Renamed {} -> {}", source.getFileName(), target.getFileName());
            return new RenameOutcome(source, target, RenameOutcome.Status.RENAMED, null);
        } catch (FileAlreadyExistsException e) {
            log.warn("Target already exists, not renaming {}: {}", source.getFileName(), target.getFileName());
            return new RenameOutcome(source, target, RenameOutcome.Status.FAILED, "target exists");
        } catch (IOException e) {
            log.warn("Could not rename {}: {}", source.getFileName(), e.getMessage());
            return new RenameOutcome(source, target, RenameOutcome.Status.FAILED, e.getMessage());
        }
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }
}
