package io.assistify.core.usage;

import io.assistify.core.model.Usage;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public final class UsageLedger {
    private final UsageStore store;
    private final Clock clock;

    public UsageLedger(UsageStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized UsageEntry record(String providerId, Usage usage) throws IOException {
        Objects.requireNonNull(providerId, "providerId must not be null");
        String day = today().toString();
        UsageState current = store.load();
        UsageEntry existing = current.days(providerId).getOrDefault(day, UsageEntry.EMPTY);
        UsageEntry updated = existing.plus(usage == null ? Usage.ZERO : usage);
        store.save(current.with(providerId, day, updated));
        return updated;
    }

    public synchronized UsageEntry entry(String providerId, LocalDate date) throws IOException {
        return store.load().days(providerId).getOrDefault(date.toString(), UsageEntry.EMPTY);
    }

    public synchronized UsageEntry today(String providerId) throws IOException {
        return entry(providerId, today());
    }

    public synchronized Map<LocalDate, UsageEntry> entries(String providerId) throws IOException {
        Map<LocalDate, UsageEntry> entries = new TreeMap<>();
        store.load().days(providerId).forEach((day, entry) -> entries.put(LocalDate.parse(day), entry));
        return entries;
    }

    public synchronized UsageEntry totals(String providerId) throws IOException {
        return store.load().days(providerId).values().stream()
            .reduce(UsageEntry.EMPTY, UsageEntry::plus);
    }

    public synchronized Map<String, UsageEntry> totalsByProvider() throws IOException {
        Map<String, UsageEntry> totals = new LinkedHashMap<>();
        UsageState state = store.load();
        for (String providerId : new TreeMap<>(state.providers()).keySet()) {
            totals.put(providerId, state.days(providerId).values().stream().reduce(UsageEntry.EMPTY, UsageEntry::plus));
        }
        return totals;
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
