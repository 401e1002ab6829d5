package InvoiceOcr.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/* PDF-Rasterung über das externe Programm pdftoppm (poppler-utils).
 * Aufruf: pdftoppm -png -singlefile -f 1 -l 1 <pdf> <tmp>/page

 * Rasterizes through the external pdftoppm binary into a temporary directory
 * that is removed afterwards.
 */
@Component
public class PdftoppmRasterizer implements PdfRasterizer {

    public static final String NAME = "pdftoppm";

    private static final Logger log = LoggerFactory.getLogger(PdftoppmRasterizer.class);

    private final String executable;
    private final long timeoutSeconds;

    public PdftoppmRasterizer(@Value("${invoice-ocr.pdf.pdftoppm-path:pdftoppm}") String executable,
                              @Value("${invoice-ocr.pdf.pdftoppm-timeout-seconds:60}") long timeoutSeconds) {
        this.executable = executable;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] renderFirstPage(Path pdf) throws PdfRenderException {
        Path tmpDir = null;
        try {
            tmpDir = Files.createTempDirectory("invoice-ocr-");
            // kurzer Ausgabename, lange Dateinamen machen pdftoppm Probleme
            Path prefix = tmpDir.resolve("page");
            List<String> command = List.of(executable, "-png", "-singlefile", "-f", "1", "-l", "1",
                    pdf.toAbsolutePath().toString(), prefix.toString());

            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new PdfRenderException("pdftoppm timed out after " + timeoutSeconds + "s on " + pdf.getFileName());
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            Path png = tmpDir.resolve("page.png");
            if (process.exitValue() != 0 || !Files.isRegularFile(png)) {
                throw new PdfRenderException("pdftoppm failed on " + pdf.getFileName()
                        + " (exit " + process.exitValue() + "): " + output);
            }
            return Files.readAllBytes(png);
        } catch (IOException e) {
            throw new PdfRenderException("Could not run " + executable + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PdfRenderException("Interrupted while rendering " + pdf.getFileName(), e);
        } finally {
            deleteQuietly(tmpDir);
        }
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.debug("Could not delete temp file {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
