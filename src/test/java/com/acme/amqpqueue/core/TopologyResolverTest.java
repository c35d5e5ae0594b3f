package com.acme.amqpqueue.core;

import com.acme.amqpqueue.amqp.AmqpQueue;
import com.acme.amqpqueue.amqp.AmqpTopic;
import com.acme.amqpqueue.amqp.BrokerException;
import com.acme.amqpqueue.amqp.PreconditionFailedException;
import com.acme.amqpqueue.config.ExchangeOptions;
import com.acme.amqpqueue.config.QueueOptions;
import com.acme.amqpqueue.spi.QueueOptionsProvider;
import com.acme.amqpqueue.test.InMemoryAmqpContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TopologyResolverTest {

    private InMemoryAmqpContext context;
    private ExchangeOptions exchangeOptions;
    private QueueOptions queueOptions;

    @BeforeEach
    void setUp() {
        context = new InMemoryAmqpContext();
        exchangeOptions = new ExchangeOptions();
        queueOptions = new QueueOptions();
    }

    private TopologyResolver resolver(InMemoryAmqpContext ctx, QueueOptionsProvider overrides) {
        return new TopologyResolver(ctx, new TopologyCache(), "default", exchangeOptions, queueOptions, overrides);
    }

    @Test
    void testResolveDeclaresExchangeQueueAndBinding() throws Exception {
        var topology = resolver(context, QueueOptionsProvider.none()).resolve("jobs");

        assertEquals("jobs", topology.queue().getQueueName());
        assertEquals("jobs", topology.topic().getName());
        assertEquals(AmqpTopic.TYPE_DIRECT, topology.topic().getType());
        assertTrue(topology.topic().hasFlag(AmqpTopic.Flag.DURABLE));
        assertTrue(topology.queue().hasFlag(AmqpQueue.Flag.DURABLE));

        assertEquals(1, context.getExchangeDeclares());
        assertEquals(1, context.getQueueDeclares());
        assertEquals(1, context.broker().bindings.size());
        assertEquals("jobs", context.broker().bindings.get(0).routingKey());
    }

    @Test
    void testSecondResolveDoesNotDeclareAgain() throws Exception {
        TopologyResolver resolver = resolver(context, QueueOptionsProvider.none());

        resolver.resolve("jobs");
        resolver.resolve("jobs");

        assertEquals(1, context.getExchangeDeclares());
        assertEquals(1, context.getQueueDeclares());
        // bindings are idempotent on the broker and issued every time
        assertEquals(2, context.getBinds());
        assertEquals(1, context.broker().bindings.size());
    }

    @Test
    void testBlankNameFallsBackToDefaultQueue() throws Exception {
        TopologyResolver resolver = resolver(context, QueueOptionsProvider.none());

        assertEquals("default", resolver.resolve(null).queue().getQueueName());
        assertEquals("default", resolver.resolve("  ").queue().getQueueName());
        assertEquals("other", resolver.queueName("other"));
    }

    @Test
    void testConfiguredExchangeIsSharedByQueues() throws Exception {
        exchangeOptions.setName("app");
        exchangeOptions.setType(AmqpTopic.TYPE_TOPIC);
        TopologyResolver resolver = resolver(context, QueueOptionsProvider.none());

        var first = resolver.resolve("a");
        var second = resolver.resolve("b");

        assertEquals("app", first.topic().getName());
        assertEquals("app", second.topic().getName());
        assertEquals(1, context.getExchangeDeclares());
        assertEquals(2, context.getQueueDeclares());
        assertThat(context.broker().bindings)
            .extracting(b -> b.routingKey())
            .containsExactly("a", "b");
    }

    @Test
    void testDeclareDisabled() throws Exception {
        exchangeOptions.setDeclare(false);
        queueOptions.setDeclare(false);

        resolver(context, QueueOptionsProvider.none()).resolve("jobs");

        assertEquals(0, context.getExchangeDeclares());
        assertEquals(0, context.getQueueDeclares());
        assertEquals(1, context.getBinds());
    }

    @Test
    void testBindDisabled() throws Exception {
        queueOptions.setBind(false);

        resolver(context, QueueOptionsProvider.none()).resolve("jobs");

        assertEquals(0, context.getBinds());
        assertTrue(context.broker().bindings.isEmpty());
    }

    @Test
    void testPerQueueOverride() throws Exception {
        QueueOptions emails = new QueueOptions();
        emails.setDurable(false);
        emails.setBind(false);
        emails.setArguments(Map.of("x-max-priority", 10));
        QueueOptionsProvider overrides = name -> "emails".equals(name) ? Optional.of(emails) : Optional.empty();
        TopologyResolver resolver = resolver(context, overrides);

        var overridden = resolver.resolve("emails");
        var plain = resolver.resolve("jobs");

        assertFalse(overridden.queue().hasFlag(AmqpQueue.Flag.DURABLE));
        assertEquals(10, overridden.queue().getArguments().get("x-max-priority"));
        assertTrue(plain.queue().hasFlag(AmqpQueue.Flag.DURABLE));
        assertTrue(plain.queue().getArguments().isEmpty());
        assertThat(context.broker().bindings)
            .extracting(b -> b.queue().getQueueName())
            .containsExactly("jobs");
    }

    @Test
    void testPassiveQueueFlag() throws Exception {
        queueOptions.setPassive(true);
        context.broker().queues.put("jobs", new AmqpQueue("jobs"));

        var topology = resolver(context, QueueOptionsProvider.none()).resolve("jobs");

        assertTrue(topology.queue().hasFlag(AmqpQueue.Flag.PASSIVE));
    }

    @Test
    void testExchangeConflictAcrossConnections() throws Exception {
        InMemoryAmqpContext.Broker broker = new InMemoryAmqpContext.Broker();
        resolver(new InMemoryAmqpContext(broker), QueueOptionsProvider.none()).resolve("jobs");

        exchangeOptions = new ExchangeOptions();
        exchangeOptions.setDurable(false);
        TopologyResolver other = resolver(new InMemoryAmqpContext(broker), QueueOptionsProvider.none());

        TopologyConflictException e = assertThrows(TopologyConflictException.class, () -> other.resolve("jobs"));
        assertEquals("Exchange declared with different arguments.", e.getMessage());
        assertInstanceOf(PreconditionFailedException.class, e.getCause());
    }

    @Test
    void testQueueConflictAcrossConnections() throws Exception {
        InMemoryAmqpContext.Broker broker = new InMemoryAmqpContext.Broker();
        resolver(new InMemoryAmqpContext(broker), QueueOptionsProvider.none()).resolve("jobs");

        queueOptions = new QueueOptions();
        queueOptions.setArguments(Map.of("x-max-length", 100));
        TopologyResolver other = resolver(new InMemoryAmqpContext(broker), QueueOptionsProvider.none());

        TopologyConflictException e = assertThrows(TopologyConflictException.class, () -> other.resolve("jobs"));
        assertEquals("Queue declared with different arguments.", e.getMessage());
    }

    @Test
    void testChangedOptionsAreNotRedeclaredOnSameConnection() throws Exception {
        TopologyResolver resolver = resolver(context, QueueOptionsProvider.none());
        resolver.resolve("jobs");

        queueOptions.setArguments(Map.of("x-max-length", 100));
        resolver.resolve("jobs");

        assertEquals(1, context.getQueueDeclares());
        assertTrue(context.broker().queues.get("jobs").getArguments().isEmpty());
    }

    @Test
    void testFailedDeclareIsNotCached() throws Exception {
        TopologyResolver resolver = resolver(context, QueueOptionsProvider.none());
        context.failWith(new BrokerException("connection reset"));

        assertThrows(BrokerException.class, () -> resolver.resolve("jobs"));

        context.recover();
        resolver.resolve("jobs");
        assertEquals(1, context.getExchangeDeclares());
        assertEquals(1, context.getQueueDeclares());
    }

    @Test
    void testReconnectClearsCache() throws Exception {
        TopologyResolver resolver = resolver(context, QueueOptionsProvider.none());
        resolver.resolve("jobs");

        context.simulateReconnect();
        resolver.resolve("jobs");

        assertEquals(2, context.getExchangeDeclares());
        assertEquals(2, context.getQueueDeclares());
    }
}
