package ai.srt.translator.translate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides translation clients based on the desired execution mode. The production client is only
 * built when it is selected.
 */
public class TranslationClientFactory {

    private final Supplier<TranslationClient> productionClient;
    private final TranslationClient dryRunClient;
    private final TranslationClient mockClient;

    public TranslationClientFactory(Supplier<TranslationClient> productionClient,
                                    TranslationClient dryRunClient,
                                    TranslationClient mockClient) {
        this.productionClient = Objects.requireNonNull(productionClient, "productionClient");
        this.dryRunClient = Objects.requireNonNull(dryRunClient, "dryRunClient");
        this.mockClient = Objects.requireNonNull(mockClient, "mockClient");
    }

    public TranslationClient select(TranslationMode mode) {
        return switch (mode) {
            case PRODUCTION -> Objects.requireNonNull(productionClient.get(), "productionClient");
            case DRY_RUN -> dryRunClient;
            case MOCK -> mockClient;
        };
    }
}
