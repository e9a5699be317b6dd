package io.assistify.cli;

import io.assistify.core.provider.ChatProvider;
import io.assistify.core.settings.SettingsKeys;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "use", description = "Select the AI provider, and optionally the model, used for chat")
public final class UseCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Provider id, e.g. openai or anthropic")
    String provider;

    @Option(names = {"-m", "--model"}, description = "Model id; omit to use the provider default")
    String model;

    public UseCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (!context.providerFactory().selectProvider(provider)) {
                System.err.println("Unknown AI provider: " + provider
                    + ". Available: " + String.join(", ", context.providerFactory().providerIds()));
                return 1;
            }
            if (model == null || model.isBlank()) {
                context.settings().remove(SettingsKeys.SELECTED_MODEL);
            } else {
                context.settings().set(SettingsKeys.SELECTED_MODEL, model.trim());
            }

            ChatProvider selected = context.providerFactory().getConfiguredProvider().orElseThrow();
            System.out.println("Using " + selected.displayName() + " with model "
                + selected.config().resolveModel(model) + ".");
            if (!selected.configured()) {
                System.out.println("No API key stored yet. Run: assistify key " + selected.id() + " <api-key>");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Use command failed: " + e.getMessage());
            return 1;
        }
    }
}
