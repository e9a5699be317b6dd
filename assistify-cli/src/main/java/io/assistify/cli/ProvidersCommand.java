package io.assistify.cli;

import io.assistify.core.provider.ChatProvider;
import io.assistify.core.provider.ModelInfo;
import io.assistify.core.provider.ProviderInfo;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "providers", description = "List AI providers and their models")
public final class ProvidersCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--models", description = "Also list each provider's known models")
    boolean models;

    public ProvidersCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            String selected = context.providerFactory().selectedProviderId();
            for (ProviderInfo info : context.providerFactory().availableProviders()) {
                String marker = info.id().equals(selected) ? "*" : " ";
                String state = info.configured() ? "configured" : "no API key";
                System.out.printf("%s %-10s %-16s %s%n", marker, info.id(), info.displayName(), state);
                if (models) {
                    printModels(info.id());
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Providers command failed: " + e.getMessage());
            return 1;
        }
    }

    private void printModels(String providerId) throws Exception {
        ChatProvider provider = context.providerFactory()
            .create(providerId, context.providerFactory().credentialFor(providerId))
            .orElseThrow();
        String defaultModel = provider.config().defaultModel();
        for (Map.Entry<String, ModelInfo> model : provider.availableModels().entrySet()) {
            String suffix = model.getKey().equals(defaultModel) ? " (default)" : "";
            System.out.printf("    %-30s %,d tokens%s%n", model.getKey(), model.getValue().contextLength(), suffix);
        }
    }
}
