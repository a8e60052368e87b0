/*
 * Where: Notification NATS subscription
 * What: Consumes live transaction insert events from JetStream and hands them to ingestion
 * Why: The live path creates notifications within seconds; reconciliation covers what it misses
 */
package com.pimapos.notification.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.pimapos.common.TraceIds;
import com.pimapos.common.event.TransactionInsertedEvent;
import com.pimapos.notification.config.NotificationNatsProperties;
import com.pimapos.notification.model.IngestionOutcome;
import com.pimapos.notification.service.NotificationEventPermanentException;
import com.pimapos.notification.service.NotificationIngestionService;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class TransactionEventSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(TransactionEventSubscriber.class);
    private static final String MDC_TRACE_ID = "trace_id";
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    private final Connection connection;
    private final NotificationIngestionService ingestionService;
    private final NotificationNatsProperties properties;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean started;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The NATS Connection is a shared Spring-managed resource and cannot be copied")
    public TransactionEventSubscriber(Connection connection,
            NotificationIngestionService ingestionService,
            NotificationNatsProperties properties,
            ObjectMapper objectMapper) {
        this.connection = connection;
        this.ingestionService = ingestionService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ensureStream();
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            subscription = jetStream.subscribe(
                    properties.subject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    buildPushSubscribeOptions());
            logger.info("transaction event subscriber started subject={} stream={} durable={}"
                            + " redeliveryBudget={}",
                    properties.subject(),
                    properties.stream(),
                    properties.durable(),
                    properties.redeliveryBudget());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream subscription", ex);
        }
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
        started.set(false);
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        final TransactionInsertedEvent event;
        try {
            event = parse(message.getData());
        } catch (IOException ex) {
            // a corrupt payload will not parse on redelivery either
            logger.warn("failed to parse transaction event payload subject={}", message.getSubject(), ex);
            termSilently(message);
            return;
        }
        MDC.put(MDC_TRACE_ID, TraceIds.resolve(event.traceId()));
        try {
            IngestionOutcome outcome = ingestionService.onTransactionInserted(event);
            if (outcome == IngestionOutcome.FAILED) {
                // store was unavailable; let JetStream redeliver within max-deliver
                nakSilently(message);
                return;
            }
            message.ack();
        } catch (NotificationEventPermanentException ex) {
            logger.warn("permanent failure while handling transaction event feed={} transactionId={}",
                    event.feed(),
                    event.transactionId(),
                    ex);
            termSilently(message);
        } catch (RuntimeException ex) {
            logger.warn("failed to handle transaction event feed={} transactionId={}",
                    event.feed(),
                    event.transactionId(),
                    ex);
            nakSilently(message);
        } finally {
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private TransactionInsertedEvent parse(byte[] data) throws IOException {
        if (data == null || data.length == 0) {
            throw new IOException("empty transaction event payload");
        }
        TransactionInsertedEvent event = objectMapper.readValue(data, TransactionInsertedEvent.class);
        if (event == null) {
            throw new IOException("null transaction event payload");
        }
        return event;
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        // Nats-Msg-Id deduplication only works on a stream with a duplicate window
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(properties.stream())
                .subjects(properties.subject())
                .duplicateWindow(properties.duplicateWindow())
                .build();
        JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException ex) {
            if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
                    && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
                throw ex;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
        logger.info("transaction event stream ensured stream={} subject={} duplicateWindow={}",
                properties.stream(),
                properties.subject(),
                properties.duplicateWindow());
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .maxAckPending(properties.maxAckPending())
                .build();
        return PushSubscribeOptions.builder()
                .stream(properties.stream())
                .durable(properties.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nak transaction event", ex);
        }
    }

    private void termSilently(Message message) {
        try {
            message.term();
        } catch (IllegalStateException ex) {
            logger.warn("failed to term transaction event", ex);
        }
    }
}
