package io.assistify.cli;

import io.assistify.core.error.AssistifyError;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "key", description = "Store or clear the API key for a provider")
public final class KeyCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Provider id")
    String provider;

    @Parameters(index = "1", arity = "0..1", description = "API key; omit to clear the stored key")
    String apiKey;

    @Option(names = "--validate", description = "Send a minimal request to check the key before saving it")
    boolean validate;

    public KeyCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (!context.providerFactory().isRegistered(provider)) {
                System.err.println("Unknown AI provider: " + provider);
                return 1;
            }
            if (apiKey == null || apiKey.isBlank()) {
                context.providerFactory().saveCredential(provider, "");
                System.out.println("Removed API key for " + provider + ".");
                return 0;
            }
            if (validate) {
                Optional<AssistifyError> error = context.providerFactory().validateCredential(provider, apiKey);
                if (error.isPresent()) {
                    System.err.println("API key rejected: " + error.get().message());
                    return 1;
                }
                System.out.println("API key verified.");
            }
            context.providerFactory().saveCredential(provider, apiKey);
            System.out.println("Saved API key for " + provider + ".");
            return 0;
        } catch (Exception e) {
            System.err.println("Key command failed: " + e.getMessage());
            return 1;
        }
    }
}
