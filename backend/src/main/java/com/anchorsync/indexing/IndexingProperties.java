package com.anchorsync.indexing;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "anchorsync.indexing")
@NoArgsConstructor
@Getter
@Setter
public class IndexingProperties {

    /** Serve queries for a model even while its historical sync is still running. */
    private boolean allowQueriesBeforeHistoricalSync = false;
}
