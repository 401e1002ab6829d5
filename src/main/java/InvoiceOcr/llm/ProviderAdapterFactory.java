package InvoiceOcr.llm;

import InvoiceOcr.config.ProviderKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wählt den Adapter passend zu {@link ProviderKind}. Jede Implementierung existiert genau einmal.
 */
@Component
public class ProviderAdapterFactory {

    private final Map<ProviderKind, ProviderAdapter> adapters = new EnumMap<>(ProviderKind.class);

    public ProviderAdapterFactory(List<ProviderAdapter> adapters) {
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = this.adapters.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.kind());
            }
        }
    }

    public ProviderAdapter forKind(ProviderKind kind) {
        ProviderAdapter adapter = adapters.get(kind);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter registered for " + kind);
        }
        return adapter;
    }
}
