package InvoiceOcr.image;

import java.nio.file.Path;

/**
 * Rendert die erste Seite eines PDFs als PNG.
 */
public interface PdfRasterizer {

    /**
     * Name used in the settings file ({@code rasterizer}).
     */
    String name();

    /**
     * @return PNG bytes of page 1
     * @throws PdfRenderException if the document cannot be opened or rendered
     */
    byte[] renderFirstPage(Path pdf) throws PdfRenderException;
}
