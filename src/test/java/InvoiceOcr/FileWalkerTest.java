package InvoiceOcr;

import InvoiceOcr.batch.FileWalker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileWalkerTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        // 5 gültige Dateien
        touch("b.pdf");
        touch("A.PNG");
        touch("sub/c.jpeg");
        touch("sub/deeper/d.tiff");
        touch("z/e.webp");

        // 4 ausgeschlossene Dateien (Schlüsselwort) + 2 falsche Endungen
        touch("Itinerary_2024.pdf");
        touch("sub/滴滴行程单.pdf");
        touch("sub/deeper/ITINERARY.png");
        touch("z/Taxi_Receipt.jpg");
        touch("notes.txt");
        touch("invoice_summary.xlsx");
    }

    @Test
    @DisplayName("Nur gültige Dateien, Schlüsselwörter ohne Beachtung der Groß-/Kleinschreibung")
    void testYieldsOnlyEligibleFiles() {
        FileWalker walker = new FileWalker(tempDir);

        List<String> names = names(walker);

        assertEquals(5, names.size());
        assertFalse(names.stream().anyMatch(n -> n.toLowerCase().contains("itinerary")));
        assertFalse(names.stream().anyMatch(n -> n.contains("行程单")));
        assertFalse(names.contains("Taxi_Receipt.jpg"));
        assertEquals(5, walker.count());
    }

    @Test
    @DisplayName("Tiefensuche, nach Namen sortiert, bei jedem Durchlauf gleich")
    void testOrderIsDeterministicAndRestartable() {
        FileWalker walker = new FileWalker(tempDir);

        List<String> first = names(walker);
        List<String> second = names(walker);

        assertEquals(List.of("A.PNG", "b.pdf", "c.jpeg", "d.tiff", "e.webp"), first);
        assertEquals(first, second);
    }

    @Test
    void testCustomKeywords() {
        FileWalker walker = new FileWalker(tempDir, List.of("B."));

        List<String> names = names(walker);

        assertFalse(names.contains("b.pdf"));
        assertTrue(names.contains("Itinerary_2024.pdf"));
    }

    @Test
    void testMissingRootYieldsNothing() {
        assertFalse(new FileWalker(tempDir.resolve("missing")).iterator().hasNext());
    }

    private void touch(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[] {1, 2, 3});
    }

    private static List<String> names(Iterable<Path> paths) {
        List<String> names = new ArrayList<>();
        for (Path path : paths) {
            names.add(path.getFileName().toString());
        }
        return names;
    }
}
