package io.assistify.core.usage;

import java.io.IOException;

public interface UsageStore {
    UsageState load() throws IOException;

    void save(UsageState state) throws IOException;
}
