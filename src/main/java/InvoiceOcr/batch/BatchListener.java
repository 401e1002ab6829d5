package InvoiceOcr.batch;

/**
 * Empfängt die Ereignisse eines Laufs, synchron auf dem Thread des Orchestrators.
 */
@FunctionalInterface
public interface BatchListener {

    BatchListener NONE = event -> { };

    void onEvent(BatchEvent event);
}
