package io.harvestcore.scraper;

import io.harvestcore.runtime.ItemContext;

@FunctionalInterface
public interface ItemProcessor {
    ProcessingResult process(ItemContext context) throws Exception;
}
