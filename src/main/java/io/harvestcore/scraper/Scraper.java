package io.harvestcore.scraper;

public interface Scraper {
    String name();
}
