package InvoiceOcr.config;

import java.util.Locale;

public enum ProviderKind {
    OLLAMA("ollama"),
    VOLCENGINE("volcengine"),
    OPENROUTER("openrouter");

    private final String settingValue;

    ProviderKind(String settingValue) {
        this.settingValue = settingValue;
    }

    public String settingValue() {
        return settingValue;
    }

    public static ProviderKind fromSetting(String value) {
        if (value == null || value.isBlank()) {
            return OLLAMA;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProviderKind kind : values()) {
            if (kind.settingValue.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported provider: " + value);
    }
}
