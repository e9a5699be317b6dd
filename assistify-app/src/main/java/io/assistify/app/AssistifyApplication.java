package io.assistify.app;

import io.assistify.cli.AssistifyCliCommand;
import io.assistify.cli.AuditCommand;
import io.assistify.cli.ChatCommand;
import io.assistify.cli.CliContext;
import io.assistify.cli.KeyCommand;
import io.assistify.cli.OnboardCommand;
import io.assistify.cli.ProvidersCommand;
import io.assistify.cli.StatusCommand;
import io.assistify.cli.UsageCommand;
import io.assistify.cli.UseCommand;
import io.assistify.core.agent.ActionConfirmationService;
import io.assistify.core.agent.ToolInvocationLoop;
import io.assistify.core.config.ConfigPaths;
import io.assistify.core.config.ConfigService;
import io.assistify.core.config.model.AssistifyConfig;
import io.assistify.core.observability.AuditLog;
import io.assistify.core.observability.FileAuditStore;
import io.assistify.core.provider.CredentialObfuscator;
import io.assistify.core.provider.ProviderCache;
import io.assistify.core.provider.ProviderCatalog;
import io.assistify.core.provider.ProviderFactory;
import io.assistify.core.provider.ProviderHttp;
import io.assistify.core.settings.FileSettingsStore;
import io.assistify.core.settings.SettingsStore;
import io.assistify.core.tool.ToolRegistry;
import io.assistify.core.tool.impl.StoreSettingsTools;
import io.assistify.core.usage.FileUsageStore;
import io.assistify.core.usage.UsageLedger;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class AssistifyApplication {
    private static final Logger LOG = LoggerFactory.getLogger(AssistifyApplication.class);
    // used until onboard writes a per-install secret
    private static final String FALLBACK_SECRET = "assistify-local";

    private AssistifyApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        AssistifyConfig config = loadConfig(configService, configPath);

        Path dataDir = ConfigPaths.resolveDataDir(config.storage().dataDir());
        SettingsStore settings = new FileSettingsStore(ConfigPaths.settingsFile(dataDir));
        UsageLedger usageLedger = new UsageLedger(new FileUsageStore(ConfigPaths.usageFile(dataDir)), Clock.systemUTC());
        AuditLog auditLog = new AuditLog(new FileAuditStore(ConfigPaths.auditFile(dataDir)), Clock.systemUTC());

        String secret = config.security().hasSecret() ? config.security().credentialSecret() : FALLBACK_SECRET;
        ProviderFactory providerFactory = new ProviderFactory(
            new ProviderCache(),
            settings,
            new CredentialObfuscator(secret),
            config.assistant().provider()
        );
        ProviderCatalog.registerDefaults(providerFactory, new ProviderHttp(), usageLedger, config.baseUrlOverrides());

        ToolRegistry toolRegistry = new ToolRegistry(auditLog);
        new StoreSettingsTools(settings).registerAll(toolRegistry);

        CliContext context = new CliContext(
            configService,
            configPath,
            settings,
            providerFactory,
            toolRegistry,
            new ToolInvocationLoop(providerFactory, toolRegistry, auditLog),
            new ActionConfirmationService(toolRegistry, auditLog, Clock.systemUTC()),
            usageLedger,
            auditLog
        );

        CommandLine commandLine = new CommandLine(new AssistifyCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("providers", new ProvidersCommand(context));
        commandLine.addSubcommand("use", new UseCommand(context));
        commandLine.addSubcommand("key", new KeyCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("usage", new UsageCommand(context));
        commandLine.addSubcommand("audit", new AuditCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static AssistifyConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return AssistifyConfig.defaults();
        }
    }
}
