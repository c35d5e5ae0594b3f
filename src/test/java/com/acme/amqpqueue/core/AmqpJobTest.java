package com.acme.amqpqueue.core;

import com.acme.amqpqueue.amqp.AmqpConsumer;
import com.acme.amqpqueue.amqp.AmqpMessage;
import com.acme.amqpqueue.amqp.BrokerException;
import com.acme.amqpqueue.spi.DeliveryOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AmqpJobTest {

    private static final String BODY = "{\"displayName\":\"SendMail\",\"job\":\"SendMail@handle\",\"data\":{\"to\":\"a@b.c\"},\"id\":\"abc\"}";

    private AmqpQueueDriver driver;
    private AmqpConsumer consumer;
    private AmqpMessage message;
    private AmqpJob job;

    @BeforeEach
    void setUp() {
        driver = mock(AmqpQueueDriver.class);
        consumer = mock(AmqpConsumer.class);
        message = new AmqpMessage(BODY.getBytes(StandardCharsets.UTF_8));
        message.setCorrelationId("corr-1");
        message.setDeliveryTag(7L);
        job = new AmqpJob(driver, consumer, message, "emails");
    }

    @Test
    void testAccessors() {
        assertEquals("corr-1", job.getJobId());
        assertEquals(BODY, job.getRawBody());
        assertEquals("SendMail@handle", job.getName());
        assertEquals("emails", job.getQueue());
        assertEquals("abc", job.payload().get("id"));
        assertSame(message, job.getMessage());
    }

    @Test
    void testAttemptsFromHeader() {
        assertEquals(1, job.attempts());

        message.setProperty(MessageBuilder.ATTEMPT_COUNT_HEADER, 2);
        assertEquals(3, job.attempts());

        // header values read back from the wire may be strings or longs
        message.setProperty(MessageBuilder.ATTEMPT_COUNT_HEADER, "4");
        assertEquals(5, job.attempts());
        message.setProperty(MessageBuilder.ATTEMPT_COUNT_HEADER, 6L);
        assertEquals(7, job.attempts());
    }

    @Test
    void testDeleteAcknowledges() throws Exception {
        job.delete();

        verify(consumer).acknowledge(message);
        assertTrue(job.isDeleted());
        assertFalse(job.isReleased());
    }

    @Test
    void testDeleteFailureIsReported() throws Exception {
        BrokerException failure = new BrokerException("channel closed");
        doThrow(failure).when(consumer).acknowledge(message);

        job.delete();

        verify(driver).reportConnectionError("delete", failure);
        assertFalse(job.isDeleted());
    }

    @Test
    void testReleaseRepublishesThenAcknowledges() throws Exception {
        message.setProperty(MessageBuilder.ATTEMPT_COUNT_HEADER, 1);
        when(driver.pushRaw(eq(BODY), eq("emails"), any(DeliveryOptions.class))).thenReturn(Optional.of("corr-2"));

        job.release(30);

        ArgumentCaptor<DeliveryOptions> options = ArgumentCaptor.forClass(DeliveryOptions.class);
        var order = inOrder(driver, consumer);
        order.verify(driver).pushRaw(eq(BODY), eq("emails"), options.capture());
        order.verify(consumer).acknowledge(message);
        assertEquals(30L, options.getValue().delay());
        assertEquals(2, options.getValue().attempts());
        assertTrue(job.isReleased());
        assertTrue(job.isDeleted());
    }

    @Test
    void testReleaseKeepsDeliveryWhenRepublishFails() throws Exception {
        when(driver.pushRaw(any(), any(), any())).thenReturn(Optional.empty());

        job.release(0);

        verify(consumer, never()).acknowledge(any());
        assertFalse(job.isReleased());
        assertFalse(job.isDeleted());
    }

    @Test
    void testFailRejectsWithoutRequeue() throws Exception {
        job.fail();

        verify(consumer).reject(message, false);
        assertTrue(job.isDeleted());
    }

    @Test
    void testFailFailureIsReported() throws Exception {
        BrokerException failure = new BrokerException("channel closed");
        doThrow(failure).when(consumer).reject(message, false);

        job.fail();

        verify(driver).reportConnectionError("fail", failure);
        assertFalse(job.isDeleted());
    }
}
