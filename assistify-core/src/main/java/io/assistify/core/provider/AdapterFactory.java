package io.assistify.core.provider;

@FunctionalInterface
public interface AdapterFactory {
    ChatProvider create(String credential);
}
