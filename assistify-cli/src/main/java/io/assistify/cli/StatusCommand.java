package io.assistify.cli;

import io.assistify.core.config.ConfigPaths;
import io.assistify.core.config.model.AssistifyConfig;
import io.assistify.core.provider.ProviderInfo;
import io.assistify.core.settings.SettingsKeys;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and provider status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            AssistifyConfig config = context.configService().load(context.configPath());
            String selected = context.providerFactory().selectedProviderId();
            String model = context.settings().get(SettingsKeys.SELECTED_MODEL, "");

            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Data directory: " + ConfigPaths.resolveDataDir(config.storage().dataDir()));
            System.out.println("Selected provider: " + selected);
            System.out.println("Selected model: " + (model.isBlank() ? "(provider default)" : model));
            System.out.println("Registered tools: " + context.toolRegistry().all().size());
            for (ProviderInfo provider : context.providerFactory().availableProviders()) {
                System.out.println(provider.displayName() + " configured: " + provider.configured());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
