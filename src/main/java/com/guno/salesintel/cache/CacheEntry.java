package com.guno.salesintel.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.guno.salesintel.catalog.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cached payload of one source for one company. Timestamps are epoch milliseconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private JsonNode data;
    private Long timestamp;
    private SourceType source;
    private String companyName;
    private Long expiresAt;

    public boolean hasData() {
        return data != null && !data.isNull() && !data.isMissingNode();
    }
}
