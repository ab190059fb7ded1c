package com.nftindexer.ingestion.normalizer;

import com.nftindexer.domain.EventKind;
import com.nftindexer.domain.OnChainData;
import com.nftindexer.domain.RawEvent;
import com.nftindexer.ingestion.decoder.DecodeException;
import com.nftindexer.ingestion.decoder.DecodedEvent;
import com.nftindexer.ingestion.decoder.DecoderUnavailableException;
import com.nftindexer.ingestion.decoder.EventDecoderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns an ordered batch of raw marketplace logs into canonical records.
 * <p>
 * Events are processed one by one in input order: kind tag → handler table → decode → handler. Unknown kinds
 * are ignored. A malformed or failing event is logged and skipped without touching the accumulator; only a
 * missing decoder (a wiring problem) escapes to the caller. Safe to call from several threads as long as each
 * call gets its own accumulator.
 */
@Component
@Slf4j
public class EventNormalizationEngine {

    private final EventDecoderRegistry decoderRegistry;
    private final Map<EventKind, EventHandler> handlers = new EnumMap<>(EventKind.class);

    /**
     * @throws DecoderUnavailableException when no decoder registry is supplied
     */
    public EventNormalizationEngine(EventDecoderRegistry decoderRegistry, List<EventHandler> eventHandlers) {
        if (decoderRegistry == null) {
            throw new DecoderUnavailableException("Event decoder registry is not configured");
        }
        this.decoderRegistry = decoderRegistry;
        for (EventHandler handler : eventHandlers) {
            for (EventKind kind : handler.kinds()) {
                EventHandler previous = handlers.putIfAbsent(kind, handler);
                if (previous != null) {
                    throw new IllegalStateException("Event kind " + kind.getTag() + " handled by both "
                            + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
                }
            }
        }
    }

    /**
     * Normalize into a fresh accumulator, handed to the caller.
     */
    public OnChainData normalize(List<RawEvent> events) {
        OnChainData data = new OnChainData();
        normalize(events, data);
        return data;
    }

    /**
     * Normalize {@code events} in order, appending to {@code accumulator}.
     *
     * @throws DecoderUnavailableException when the decoder registry cannot serve a handled kind
     */
    public NormalizationStats normalize(List<RawEvent> events, OnChainData accumulator) {
        NormalizationStats stats = new NormalizationStats();
        TransactionLogCache txLogs = new TransactionLogCache();
        for (RawEvent event : events) {
            if (event == null || event.originParams() == null) {
                stats.ignored();
                continue;
            }
            stats.received();
            txLogs.observe(event);

            Optional<EventKind> kind = EventKind.fromTag(event.kind());
            EventHandler handler = kind.map(handlers::get).orElse(null);
            if (handler == null) {
                log.debug("No handler for kind {} (tx {}, log {}), ignoring",
                        event.kind(), event.txHash(), event.originParams().logIndex());
                stats.ignored();
                continue;
            }
            process(kind.get(), handler, event, txLogs, accumulator, stats);
        }
        if (stats.getReceived() > 0) {
            log.debug("Normalization pass complete: {}", stats);
        }
        return stats;
    }

    private void process(EventKind kind, EventHandler handler, RawEvent event, TransactionLogCache txLogs,
                         OnChainData accumulator, NormalizationStats stats) {
        try {
            DecodedEvent decoded = decoderRegistry.decode(kind, event.log());
            stats.outcome(handler.handle(event, decoded, txLogs, accumulator));
        } catch (DecoderUnavailableException e) {
            throw e;
        } catch (DecodeException e) {
            stats.decodeError();
            log.error("Skipping undecodable {} event in tx {} log {}: {}",
                    kind.getTag(), event.txHash(), event.originParams().logIndex(), e.getMessage());
        } catch (RuntimeException e) {
            stats.handlerError();
            log.error("Skipping {} event in tx {} log {} after handler failure",
                    kind.getTag(), event.txHash(), event.originParams().logIndex(), e);
        }
    }
}
