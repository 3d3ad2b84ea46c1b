package io.harvestcore.scraper;

import io.harvestcore.model.CoordinationException;
import io.harvestcore.model.ErrorKind;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scrapers registered explicitly at startup. The map is fixed once built.
 */
public final class ScraperRegistry {
    private final Map<String, Scraper> scrapers;

    private ScraperRegistry(Map<String, Scraper> scrapers) {
        this.scrapers = Collections.unmodifiableMap(new LinkedHashMap<>(scrapers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ScraperRegistry empty() {
        return new ScraperRegistry(Map.of());
    }

    public Optional<Scraper> findByName(String name) {
        return Optional.ofNullable(scrapers.get(name));
    }

    public Scraper get(String name) {
        Scraper scraper = scrapers.get(name);
        if (scraper == null) {
            throw new CoordinationException(ErrorKind.FATAL, "Unknown scraper: " + name);
        }
        return scraper;
    }

    public Claimable claimable(String name) {
        Scraper scraper = get(name);
        if (!(scraper instanceof Claimable claimable)) {
            throw new CoordinationException(ErrorKind.FATAL, "Scraper is not claimable: " + name);
        }
        return claimable;
    }

    public Checkpointable checkpointable(String name) {
        Scraper scraper = get(name);
        if (!(scraper instanceof Checkpointable checkpointable)) {
            throw new CoordinationException(ErrorKind.FATAL, "Scraper has no pipeline: " + name);
        }
        return checkpointable;
    }

    public Collection<String> names() {
        return scrapers.keySet();
    }

    public static final class Builder {
        private final Map<String, Scraper> scrapers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(Scraper scraper) {
            String name = scraper.name();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("scraper name must not be blank");
            }
            if (scrapers.putIfAbsent(name, scraper) != null) {
                throw new IllegalArgumentException("Duplicate scraper: " + name);
            }
            return this;
        }

        public ScraperRegistry build() {
            return new ScraperRegistry(scrapers);
        }
    }
}
