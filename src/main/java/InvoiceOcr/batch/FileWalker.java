package InvoiceOcr.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;

/* Durchsucht ein Verzeichnis rekursiv nach Rechnungsdateien.
 * Tiefensuche, Einträge je Verzeichnis nach Namen sortiert; jeder Aufruf von iterator()
 * startet einen neuen Durchlauf ohne Zwischenspeicher.

 * Recursive, deterministic walk over eligible invoice files. Files whose name contains
 * one of the skip keywords (case-insensitive) are left out.
 */
public class FileWalker implements Iterable<Path> {

    private static final Logger log = LoggerFactory.getLogger(FileWalker.class);

    public static final Set<String> EXTENSIONS = Set.of("pdf", "png", "jpg", "jpeg", "webp", "bmp", "tif", "tiff");
    public static final List<String> DEFAULT_SKIP_KEYWORDS = List.of("itinerary", "行程单", "receipt");

    private static final Comparator<Path> BY_NAME = Comparator.comparing(p -> p.getFileName().toString());

    private final Path root;
    private final List<String> skipKeywords;

    public FileWalker(Path root, List<String> skipKeywords) {
        this.root = root;
        List<String> keywords = new ArrayList<>();
        for (String keyword : skipKeywords) {
            if (keyword != null && !keyword.isBlank()) {
                keywords.add(keyword.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.skipKeywords = Collections.unmodifiableList(keywords);
    }

    public FileWalker(Path root) {
        this(root, DEFAULT_SKIP_KEYWORDS);
    }

    @Override
    public Iterator<Path> iterator() {
        return new WalkIterator();
    }

    /**
     * Anzahl der Dateien (eigener Durchlauf).
     */
    public int count() {
        int count = 0;
        for (Path ignored : this) {
            count++;
        }
        return count;
    }

    public boolean isEligible(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || !EXTENSIONS.contains(name.substring(dot + 1))) {
            return false;
        }
        for (String keyword : skipKeywords) {
            if (name.contains(keyword)) {
                return false;
            }
        }
        return true;
    }

    private static Iterator<Path> list(Path dir) {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (IOException e) {
            log.warn("Skipping unreadable directory {}: {}", dir, e.getMessage());
        }
        entries.sort(BY_NAME);
        return entries.iterator();
    }

    private class WalkIterator implements Iterator<Path> {

        private final Deque<Iterator<Path>> stack = new ArrayDeque<>();
        private Path next;

        WalkIterator() {
            if (Files.isDirectory(root)) {
                stack.push(list(root));
            }
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Path next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Path result = next;
            next = null;
            return result;
        }

        private Path advance() {
            while (!stack.isEmpty()) {
                Iterator<Path> top = stack.peek();
                if (!top.hasNext()) {
                    stack.pop();
                    continue;
                }
                Path entry = top.next();
                // Symlinks auf Verzeichnisse werden nicht verfolgt
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    stack.push(list(entry));
                } else if (Files.isRegularFile(entry) && isEligible(entry)) {
                    return entry;
                }
            }
            return null;
        }
    }
}
