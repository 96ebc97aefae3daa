package ai.subtitle.translator.config;

import java.util.Optional;

/**
 * Holds sensitive credentials needed for external integrations.
 */
public record Secrets(Optional<String> geminiApiKey) {

    public Secrets {
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey;
    }

    public static Secrets none() {
        return new Secrets(Optional.empty());
    }

    @Override
    public String toString() {
        return "Secrets[geminiApiKey=" + (geminiApiKey.isPresent() ? "****" : "<unset>") + "]";
    }
}
