package InvoiceOcr.image;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;

/* PDF-Rasterung im Prozess mit Apache PDFBox.
 * Standard-Rasterizer, benötigt keine externen Programme.
 */
@Component
public class PdfBoxRasterizer implements PdfRasterizer {

    public static final String NAME = "pdfbox";

    private final float dpi;

    public PdfBoxRasterizer(@Value("${invoice-ocr.pdf.dpi:150}") float dpi) {
        this.dpi = dpi;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] renderFirstPage(Path pdf) throws PdfRenderException {
        try (PDDocument doc = PDDocument.load(pdf.toFile())) {
            if (doc.getNumberOfPages() == 0) {
                throw new PdfRenderException("PDF has no pages: " + pdf.getFileName());
            }
            BufferedImage image = new PDFRenderer(doc).renderImageWithDPI(0, dpi, ImageType.RGB);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new PdfRenderException("Could not render " + pdf.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
