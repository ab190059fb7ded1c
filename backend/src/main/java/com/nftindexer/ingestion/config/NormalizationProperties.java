package com.nftindexer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Normalization engine settings. Documented in application.yml under nftindexer.ingestion.normalization.
 */
@ConfigurationProperties(prefix = "nftindexer.ingestion.normalization")
@NoArgsConstructor
@Getter
@Setter
public class NormalizationProperties {

    /** Upper bound for one attribution lookup; on expiry the decoded taker is kept. Default 2s. */
    private long attributionTimeoutMs = 2_000;

    /** Upper bound for one price lookup; on expiry the fill is dropped. Default 5s. */
    private long priceTimeoutMs = 5_000;

    /** Threads normalizing independent transactions of one batch. Default 4. */
    private int parallelism = 4;

    /** When false, batches are normalized on the calling thread. */
    private boolean parallelBatches = true;
}
