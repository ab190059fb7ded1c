package com.nftindexer.ingestion.decoder;

import com.nftindexer.domain.EventKind;
import com.nftindexer.domain.EventLog;

import java.util.Set;

/**
 * Decodes the logs of one protocol into named fields.
 */
public interface EventDecoder {

    /** Event kinds this decoder understands. Each kind must be claimed by exactly one decoder. */
    Set<EventKind> supportedKinds();

    /**
     * @throws DecodeException when the log does not match the kind's layout
     */
    DecodedEvent decode(EventKind kind, EventLog log);
}
