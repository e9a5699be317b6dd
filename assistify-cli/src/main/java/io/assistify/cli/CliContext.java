package io.assistify.cli;

import io.assistify.core.agent.ActionConfirmationService;
import io.assistify.core.agent.ToolInvocationLoop;
import io.assistify.core.config.ConfigService;
import io.assistify.core.observability.AuditLog;
import io.assistify.core.provider.ProviderFactory;
import io.assistify.core.settings.SettingsStore;
import io.assistify.core.tool.ToolRegistry;
import io.assistify.core.usage.UsageLedger;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    SettingsStore settings,
    ProviderFactory providerFactory,
    ToolRegistry toolRegistry,
    ToolInvocationLoop loop,
    ActionConfirmationService confirmations,
    UsageLedger usageLedger,
    AuditLog auditLog
) {
}
