package io.assistify.cli;

import io.assistify.core.agent.AgentSettings;
import io.assistify.core.agent.PendingConfirmation;
import io.assistify.core.agent.TurnResult;
import io.assistify.core.agent.TurnStatus;
import io.assistify.core.config.model.AssistantDefaults;
import io.assistify.core.config.model.AssistifyConfig;
import io.assistify.core.error.Outcome;
import io.assistify.core.model.ChatMessage;
import io.assistify.core.model.ChatOptions;
import io.assistify.core.model.ToolCall;
import io.assistify.core.model.ToolResult;
import io.assistify.core.settings.SettingsKeys;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Ask the store assistant to do something")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;
    private final BufferedReader reader;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-m", "--model"}, description = "Model override for this request")
    String model;

    @Option(names = {"-y", "--yes"}, description = "Allow destructive tools without asking")
    boolean yes;

    @Option(names = {"-v", "--verbose"}, description = "Print each tool result and token usage")
    boolean verbose;

    public ChatCommand(CliContext context) {
        this(context, System.in);
    }

    ChatCommand(CliContext context, InputStream input) {
        this.context = context;
        this.reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    @Override
    public Integer call() {
        try {
            AssistifyConfig config = context.configService().load(context.configPath());
            AgentSettings settings = settingsFor(config.assistant());

            TurnResult result = context.loop().run(List.of(ChatMessage.user(prompt)), settings);
            while (result.awaitingConfirmation()) {
                Optional<Outcome<List<ToolResult>>> answer = confirm(result.pendingCalls());
                if (answer.isEmpty()) {
                    return 0;
                }
                Outcome<List<ToolResult>> confirmed = answer.get();
                if (!confirmed.ok()) {
                    System.err.println(confirmed.error().message());
                    return 1;
                }
                result = context.loop().resume(result, confirmed.value(), settings);
            }
            if (result.status() == TurnStatus.FAILED) {
                System.err.println(result.content());
                return 1;
            }
            printTools(result.toolResults());
            System.out.println(result.content());
            if (verbose) {
                System.out.println("Tokens used: " + result.usage().totalTokens());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }

    private AgentSettings settingsFor(AssistantDefaults defaults) throws IOException {
        String selectedModel = model;
        if (selectedModel == null || selectedModel.isBlank()) {
            selectedModel = context.settings().get(SettingsKeys.SELECTED_MODEL, defaults.model());
        }
        ChatOptions options = new ChatOptions(
            selectedModel,
            defaults.temperature(),
            defaults.maxTokens(),
            defaults.systemPrompt(),
            defaults.timeoutSeconds()
        );
        AgentSettings settings = new AgentSettings(options, defaults.maxToolIterations(), false);
        return yes ? settings.authorizeDestructive() : settings;
    }

    private Optional<Outcome<List<ToolResult>>> confirm(List<ToolCall> calls) throws IOException {
        PendingConfirmation pending = context.confirmations().request(calls);
        System.out.println("The assistant wants to run:");
        for (ToolCall call : calls) {
            String marker = context.toolRegistry().isDestructive(call.name()) ? " (destructive)" : "";
            System.out.println("  - " + call.name() + " " + call.arguments() + marker);
        }
        System.out.print("Proceed? [y/N] ");
        System.out.flush();

        String answer = reader.readLine();
        if (answer == null || !answer.trim().toLowerCase(Locale.ROOT).startsWith("y")) {
            context.confirmations().cancel(pending.token());
            System.out.println("Cancelled. Nothing was changed.");
            return Optional.empty();
        }

        Outcome<List<ToolResult>> outcome = context.confirmations().confirm(pending.token());
        if (outcome.ok()) {
            for (ToolResult toolResult : outcome.value()) {
                System.out.println((toolResult.success() ? "ok   " : "fail ") + toolResult.toolName() + ": " + toolResult.content());
            }
        }
        return Optional.of(outcome);
    }

    private void printTools(List<ToolResult> toolResults) {
        if (!verbose) {
            return;
        }
        for (ToolResult toolResult : toolResults) {
            System.out.println("[tool " + toolResult.toolName() + "] " + toolResult.content());
        }
    }
}
