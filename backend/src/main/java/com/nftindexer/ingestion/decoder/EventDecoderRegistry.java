package com.nftindexer.ingestion.decoder;

import com.nftindexer.domain.EventKind;
import com.nftindexer.domain.EventLog;

/**
 * Maps an event kind to its decoding capability.
 */
public interface EventDecoderRegistry {

    /**
     * @throws DecodeException             malformed payload (skip the record)
     * @throws DecoderUnavailableException nothing registered for the kind (configuration error)
     */
    DecodedEvent decode(EventKind kind, EventLog log);
}
