package com.nftindexer.ingestion.decoder;

import com.nftindexer.domain.EventKind;
import com.nftindexer.domain.EventLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry built from every {@link EventDecoder} bean. Two decoders claiming the same kind fail startup.
 */
@Component
@Slf4j
public class DefaultEventDecoderRegistry implements EventDecoderRegistry {

    private final Map<EventKind, EventDecoder> decoders = new EnumMap<>(EventKind.class);

    public DefaultEventDecoderRegistry(List<EventDecoder> eventDecoders) {
        for (EventDecoder decoder : eventDecoders) {
            for (EventKind kind : decoder.supportedKinds()) {
                EventDecoder previous = decoders.putIfAbsent(kind, decoder);
                if (previous != null) {
                    throw new IllegalStateException("Event kind " + kind.getTag() + " claimed by both "
                            + previous.getClass().getSimpleName() + " and " + decoder.getClass().getSimpleName());
                }
            }
        }
        log.info("Event decoder registry: {} kind(s) registered", decoders.size());
    }

    @Override
    public DecodedEvent decode(EventKind kind, EventLog log) {
        EventDecoder decoder = decoders.get(kind);
        if (decoder == null) {
            throw new DecoderUnavailableException("No decoder registered for " + kind.getTag());
        }
        if (log == null) {
            throw new DecodeException("Missing log payload for " + kind.getTag());
        }
        return decoder.decode(kind, log);
    }
}
