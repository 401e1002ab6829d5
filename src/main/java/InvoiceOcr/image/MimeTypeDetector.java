package InvoiceOcr.image;

/**
 * Erkennt den MIME-Typ anhand der Magic Numbers am Dateianfang.
 *
 * Detects the MIME type of a byte stream from its leading magic numbers. Unknown or too short
 * input falls back to {@code image/jpeg}, which every provider accepts.
 */
public final class MimeTypeDetector {

    public static final String PNG = "image/png";
    public static final String JPEG = "image/jpeg";
    public static final String GIF = "image/gif";
    public static final String WEBP = "image/webp";
    public static final String BMP = "image/bmp";
    public static final String TIFF = "image/tiff";
    public static final String PDF = "application/pdf";

    private MimeTypeDetector() {
    }

    public static String detect(byte[] bytes) {
        if (bytes == null) {
            return JPEG;
        }
        if (startsWith(bytes, 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A)) {
            return PNG;
        }
        if (startsWith(bytes, 0xFF, 0xD8, 0xFF)) {
            return JPEG;
        }
        if (startsWith(bytes, 'G', 'I', 'F', '8')) {
            return GIF;
        }
        // RIFF....WEBP
        if (startsWith(bytes, 'R', 'I', 'F', 'F') && bytes.length >= 12
                && bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P') {
            return WEBP;
        }
        if (startsWith(bytes, 'B', 'M')) {
            return BMP;
        }
        if (startsWith(bytes, 'I', 'I', 0x2A, 0x00) || startsWith(bytes, 'M', 'M', 0x00, 0x2A)) {
            return TIFF;
        }
        if (startsWith(bytes, '%', 'P', 'D', 'F')) {
            return PDF;
        }
        return JPEG;
    }

    public static boolean isPdf(byte[] bytes) {
        return PDF.equals(detect(bytes));
    }

    private static boolean startsWith(byte[] bytes, int... magic) {
        if (bytes.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if ((bytes[i] & 0xFF) != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
