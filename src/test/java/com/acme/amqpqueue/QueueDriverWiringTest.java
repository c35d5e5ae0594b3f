package com.acme.amqpqueue;

import com.acme.amqpqueue.amqp.AmqpContext;
import com.acme.amqpqueue.amqp.AmqpQueue;
import com.acme.amqpqueue.amqp.BrokerException;
import com.acme.amqpqueue.config.QueueConnectionConfig;
import com.acme.amqpqueue.core.AmqpQueueDriver;
import com.acme.amqpqueue.core.QueueConnectionException;
import com.acme.amqpqueue.spi.Job;
import com.acme.amqpqueue.spi.QueueDriver;
import com.acme.amqpqueue.spi.QueueOptionsProvider;
import com.acme.amqpqueue.test.InMemoryAmqpContext;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@MicronautTest
class QueueDriverWiringTest {

    @Inject
    QueueDriver driver;

    @Inject
    AmqpContext context;

    @Inject
    QueueConnectionConfig config;

    @Inject
    QueueOptionsProvider overrides;

    @AfterEach
    void tearDown() {
        ((InMemoryAmqpContext) context).recover();
    }

    @Test
    void testConfiguration() {
        assertEquals("jobs", config.getDefaultQueue());
        assertTrue(config.getErrorBackoff().isEscalate());
        assertEquals(QueueConnectionConfig.DEFAULT_FACTORY_CLASS, config.getFactoryClass());
        assertTrue(config.getQueue().isDurable());
        assertEquals("direct", config.getExchange().getType());
    }

    @Test
    void testDriverUsesTestBroker() {
        assertInstanceOf(AmqpQueueDriver.class, driver);
        assertInstanceOf(InMemoryAmqpContext.class, context);
        assertSame(context, ((AmqpQueueDriver) driver).getContext());
    }

    @Test
    void testDefaultQueueRoundTrip() {
        driver.push("SendMail", "hello", null);

        Job job = driver.pop().orElseThrow();
        assertEquals("SendMail", job.getName());
        assertEquals("jobs", job.getQueue());
        job.delete();
        assertTrue(job.isDeleted());
    }

    @Test
    void testQueueOverrideFromConfiguration() {
        assertFalse(overrides.queueOptions("emails").orElseThrow().isDurable());
        assertTrue(overrides.queueOptions("jobs").isEmpty());

        driver.size("emails");

        AmqpQueue declared = ((InMemoryAmqpContext) context).broker().queues.get("emails");
        assertFalse(declared.hasFlag(AmqpQueue.Flag.DURABLE));
        assertEquals("10", String.valueOf(declared.getArguments().get("x-max-priority")));
        assertTrue(((InMemoryAmqpContext) context).broker().bindings.stream()
            .noneMatch(b -> b.queue().getQueueName().equals("emails")));
    }

    @Test
    void testEscalatesConfiguredErrors() {
        ((InMemoryAmqpContext) context).failWith(new BrokerException("connection reset"));

        assertThrows(QueueConnectionException.class, () -> driver.size("reports"));
    }
}
