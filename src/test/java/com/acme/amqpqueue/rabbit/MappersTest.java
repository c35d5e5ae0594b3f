package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpMessage;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.impl.LongStringHelper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MappersTest {

    @Test
    void testToBasicProperties() {
        AmqpMessage message = new AmqpMessage("{}".getBytes(StandardCharsets.UTF_8));
        message.setCorrelationId("corr-1");
        message.setContentType("application/json");
        message.setDeliveryMode(AmqpMessage.DELIVERY_MODE_PERSISTENT);
        message.setPriority(5);
        message.setExpiration("60000");
        message.setHeaders(Map.of("reply_to", "answers", "app_id", "billing", "timestamp", 1_700_000_000L, "x-trace", "t-1"));
        message.setProperty("attempts_count", 2);

        AMQP.BasicProperties props = Mappers.toBasicProperties(message);

        assertEquals("corr-1", props.getCorrelationId());
        assertEquals("application/json", props.getContentType());
        assertEquals(2, props.getDeliveryMode());
        assertEquals(5, props.getPriority());
        assertEquals("60000", props.getExpiration());
        assertEquals("answers", props.getReplyTo());
        assertEquals("billing", props.getAppId());
        assertEquals(new Date(1_700_000_000_000L), props.getTimestamp());
        assertThat(props.getHeaders())
            .containsEntry("attempts_count", 2)
            .containsEntry("x-trace", "t-1")
            .doesNotContainKey("reply_to");
    }

    @Test
    void testNoHeaderTableWhenEmpty() {
        AMQP.BasicProperties props = Mappers.toBasicProperties(new AmqpMessage(new byte[0]));

        assertNull(props.getHeaders());
        assertNull(props.getCorrelationId());
    }

    @Test
    void testToMessage() {
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
            .correlationId("corr-1")
            .contentType("application/json")
            .deliveryMode(2)
            .messageId("m-1")
            .headers(Map.of(
                "attempts_count", 3,
                "origin", LongStringHelper.asLongString("api"),
                "tags", List.of(LongStringHelper.asLongString("a"), LongStringHelper.asLongString("b"))))
            .build();
        Envelope envelope = new Envelope(11L, true, "jobs", "jobs");

        AmqpMessage message = Mappers.toMessage(new GetResponse(envelope, props, "{}".getBytes(StandardCharsets.UTF_8), 0));

        assertEquals(11L, message.getDeliveryTag());
        assertEquals("jobs", message.getRoutingKey());
        assertTrue(message.isRedelivered());
        assertEquals("corr-1", message.getCorrelationId());
        assertTrue(message.isPersistent());
        assertEquals("m-1", message.getHeaders().get("message_id"));
        assertEquals(3, message.getProperty("attempts_count", null));
        assertEquals("api", message.getProperty("origin", null));
        assertEquals(List.of("a", "b"), message.getProperty("tags", null));
        assertEquals("{}", message.getBodyAsString());
    }

    @Test
    void testNullValuesLeavePropertiesUnset() {
        AmqpMessage message = new AmqpMessage("{}".getBytes(StandardCharsets.UTF_8));
        Map<String, Object> headers = new HashMap<>();
        headers.put("reply_to", null);
        headers.put("timestamp", null);
        headers.put("x-trace", null);
        message.setHeaders(headers);

        AMQP.BasicProperties props = Mappers.toBasicProperties(message);

        assertNull(props.getReplyTo());
        assertNull(props.getTimestamp());
        assertThat(props.getHeaders()).containsEntry("x-trace", null);
    }
}
