package com.guno.salesintel.catalog;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.Set;

/**
 * If every condition source is already selected for one of the listed consumers, skip {@code skip}.
 */
@Value
@Builder
public class RedundancyRule {

    Set<SourceType> condition;
    SourceType skip;
    Set<ConsumerType> context;
    String reason;

    public boolean applies(SourceType candidate, ConsumerType consumer, Collection<SourceType> selected) {
        return candidate == skip && context.contains(consumer) && selected.containsAll(condition);
    }
}
