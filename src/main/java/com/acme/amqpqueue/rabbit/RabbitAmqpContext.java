package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpBind;
import com.acme.amqpqueue.amqp.AmqpConsumer;
import com.acme.amqpqueue.amqp.AmqpContext;
import com.acme.amqpqueue.amqp.AmqpMessage;
import com.acme.amqpqueue.amqp.AmqpProducer;
import com.acme.amqpqueue.amqp.AmqpQueue;
import com.acme.amqpqueue.amqp.AmqpTopic;
import com.acme.amqpqueue.amqp.BrokerException;
import com.acme.amqpqueue.amqp.ConnectionListener;
import com.acme.amqpqueue.amqp.PreconditionFailedException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AmqpContext} over one RabbitMQ connection and channel, both opened on first use.
 *
 * <p>A closed channel is reopened on the next call. A closed connection is replaced, and the
 * registered {@link ConnectionListener}s are told so they can drop per-connection state.</p>
 */
public class RabbitAmqpContext implements AmqpContext {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitAmqpContext.class);
    static final String CONNECTION_NAME = "amqp-queue-driver";

    private final ConnectionFactory factory;
    private final DelayStrategy delayStrategy;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private Connection connection;
    private Channel channel;

    public RabbitAmqpContext(ConnectionFactory factory, DelayStrategy delayStrategy) {
        this.factory = factory;
        this.delayStrategy = delayStrategy;
        listeners.add(delayStrategy);
    }

    @Override
    public AmqpTopic createTopic(String name) {
        return new AmqpTopic(name);
    }

    @Override
    public AmqpQueue createQueue(String name) {
        return new AmqpQueue(name);
    }

    @Override
    public AmqpMessage createMessage(byte[] body) {
        return new AmqpMessage(body);
    }

    @Override
    public void declareTopic(AmqpTopic topic) throws BrokerException {
        Channel ch = channel();
        try {
            if (topic.hasFlag(AmqpTopic.Flag.PASSIVE)) {
                ch.exchangeDeclarePassive(topic.getName());
            } else {
                ch.exchangeDeclare(
                    topic.getName(),
                    topic.getType(),
                    topic.hasFlag(AmqpTopic.Flag.DURABLE),
                    topic.hasFlag(AmqpTopic.Flag.AUTO_DELETE),
                    false,
                    topic.getArguments());
            }
        } catch (IOException | RuntimeException e) {
            throw translate("declare exchange " + topic.getName(), e);
        }
    }

    @Override
    public int declareQueue(AmqpQueue queue) throws BrokerException {
        Channel ch = channel();
        try {
            AMQP.Queue.DeclareOk ok;
            if (queue.hasFlag(AmqpQueue.Flag.PASSIVE)) {
                ok = ch.queueDeclarePassive(queue.getQueueName());
            } else {
                ok = ch.queueDeclare(
                    queue.getQueueName(),
                    queue.hasFlag(AmqpQueue.Flag.DURABLE),
                    queue.hasFlag(AmqpQueue.Flag.EXCLUSIVE),
                    queue.hasFlag(AmqpQueue.Flag.AUTO_DELETE),
                    queue.getArguments());
            }
            return ok.getMessageCount();
        } catch (IOException | RuntimeException e) {
            throw translate("declare queue " + queue.getQueueName(), e);
        }
    }

    @Override
    public void bind(AmqpBind bind) throws BrokerException {
        Channel ch = channel();
        try {
            ch.queueBind(bind.queue().getQueueName(), bind.topic().getName(), bind.routingKey());
        } catch (IOException | RuntimeException e) {
            throw translate("bind " + bind.queue().getQueueName() + " to " + bind.topic().getName(), e);
        }
    }

    @Override
    public AmqpProducer createProducer() {
        return new RabbitProducer(this, delayStrategy);
    }

    @Override
    public AmqpConsumer createConsumer(AmqpQueue queue) {
        return new RabbitConsumer(this, queue);
    }

    @Override
    public void addConnectionListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    /**
     * Publishes the message. Its properties are mapped here so that a malformed option value fails
     * like any other broker error.
     */
    void publish(String exchange, String routingKey, AmqpMessage message) throws BrokerException {
        Channel ch = channel();
        try {
            ch.basicPublish(exchange, routingKey, Mappers.toBasicProperties(message), message.getBody());
        } catch (IOException | RuntimeException e) {
            throw translate("publish to " + (exchange.isEmpty() ? routingKey : exchange), e);
        }
    }

    Optional<AmqpMessage> get(String queue) throws BrokerException {
        Channel ch = channel();
        try {
            GetResponse response = ch.basicGet(queue, false);
            return response == null ? Optional.empty() : Optional.of(Mappers.toMessage(response));
        } catch (IOException | RuntimeException e) {
            throw translate("receive from " + queue, e);
        }
    }

    void ack(long deliveryTag) throws BrokerException {
        Channel ch = channel();
        try {
            ch.basicAck(deliveryTag, false);
        } catch (IOException | RuntimeException e) {
            throw translate("acknowledge delivery " + deliveryTag, e);
        }
    }

    void reject(long deliveryTag, boolean requeue) throws BrokerException {
        Channel ch = channel();
        try {
            ch.basicReject(deliveryTag, requeue);
        } catch (IOException | RuntimeException e) {
            throw translate("reject delivery " + deliveryTag, e);
        }
    }

    synchronized Channel channel() throws BrokerException {
        try {
            if (connection == null || !connection.isOpen()) {
                boolean replacing = connection != null;
                channel = null;
                connection = factory.newConnection(CONNECTION_NAME);
                LOG.info("AMQP connection opened to {}:{}{}", factory.getHost(), factory.getPort(), factory.getVirtualHost());
                if (replacing) {
                    listeners.forEach(ConnectionListener::connectionRecreated);
                }
            }
            if (channel == null || !channel.isOpen()) {
                channel = connection.createChannel();
            }
            return channel;
        } catch (IOException | TimeoutException e) {
            throw new BrokerException("Failed to open AMQP channel: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (connection != null && connection.isOpen()) {
                connection.close();
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Error closing AMQP connection", e);
        } finally {
            connection = null;
            channel = null;
        }
    }

    static BrokerException translate(String action, Exception e) {
        ShutdownSignalException shutdown = shutdownSignal(e);
        if (shutdown != null && !shutdown.isHardError() && shutdown.getReason() instanceof AMQP.Channel.Close) {
            AMQP.Channel.Close close = (AMQP.Channel.Close) shutdown.getReason();
            if (close.getReplyCode() == AMQP.PRECONDITION_FAILED) {
                return new PreconditionFailedException("Failed to " + action + ": " + close.getReplyText(), e);
            }
        }
        return new BrokerException("Failed to " + action + ": " + e.getMessage(), e);
    }

    private static ShutdownSignalException shutdownSignal(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ShutdownSignalException) {
                return (ShutdownSignalException) t;
            }
        }
        return null;
    }
}
