package InvoiceOcr.llm;

/**
 * Ein Modell aus der Modellliste eines Providers.
 *
 * @param id   identifier to put into the {@code model} setting, e.g. {@code google/gemini-2.0-flash-exp:free}
 * @param name display name, falls back to the id
 */
public record ModelInfo(String id, String name) {
}
