package InvoiceOcr.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/* Macht aus einer Quelldatei die Bytes, die an den Provider gehen.
 * PDFs werden gerastert (Seite 1), Bilder unverändert gelesen.
 * Der MIME-Typ kommt immer aus den Magic Numbers, nie aus der Dateiendung.
 */
@Service
public class ImageEncoder {

    private static final Logger log = LoggerFactory.getLogger(ImageEncoder.class);

    private final Map<String, PdfRasterizer> rasterizers = new LinkedHashMap<>();

    public ImageEncoder(List<PdfRasterizer> rasterizers) {
        for (PdfRasterizer rasterizer : rasterizers) {
            this.rasterizers.put(rasterizer.name(), rasterizer);
        }
    }

    public EncodedImage encode(Path file, String rasterizerName) throws IOException, PdfRenderException {
        if (isPdf(file)) {
            byte[] png = rasterizer(rasterizerName).renderFirstPage(file);
            return new EncodedImage(png, MimeTypeDetector.detect(png), true);
        }
        byte[] bytes = Files.readAllBytes(file);
        if (MimeTypeDetector.isPdf(bytes)) {
            // PDF mit Bild-Endung
            byte[] png = rasterizer(rasterizerName).renderFirstPage(file);
            return new EncodedImage(png, MimeTypeDetector.detect(png), true);
        }
        return new EncodedImage(bytes, MimeTypeDetector.detect(bytes), false);
    }

    public static boolean isPdf(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    PdfRasterizer rasterizer(String name) {
        String key = name == null ? PdfBoxRasterizer.NAME : name.trim().toLowerCase(Locale.ROOT);
        PdfRasterizer rasterizer = rasterizers.get(key);
        if (rasterizer == null) {
            rasterizer = rasterizers.get(PdfBoxRasterizer.NAME);
            if (rasterizer == null) {
                throw new IllegalStateException("No PDF rasterizer available");
            }
            log.warn("Unknown rasterizer '{}', falling back to {}", name, PdfBoxRasterizer.NAME);
        }
        return rasterizer;
    }
}
