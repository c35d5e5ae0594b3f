package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpConnectionFactory;
import com.acme.amqpqueue.amqp.AmqpContext;
import com.acme.amqpqueue.config.QueueConnectionConfig;
import com.acme.amqpqueue.core.InvalidConnectionFactoryException;
import jakarta.inject.Singleton;
import java.lang.reflect.InvocationTargetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the AMQP context from configuration. The configured factory class is checked up front:
 * it must exist and implement {@link AmqpConnectionFactory}.
 */
@Singleton
public class RabbitMqConnector {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitMqConnector.class);

    public AmqpContext connect(QueueConnectionConfig config) {
        AmqpConnectionFactory factory = createFactory(config.getFactoryClass(), ConnectionSettings.from(config));
        LOG.info("Using AMQP connection factory {}", factory.getClass().getName());
        return factory.createContext();
    }

    static AmqpConnectionFactory createFactory(String className, ConnectionSettings settings) {
        Class<?> type;
        try {
            type = Class.forName(className);
        } catch (ClassNotFoundException | LinkageError e) {
            throw invalid(className, e);
        }
        if (!AmqpConnectionFactory.class.isAssignableFrom(type)) {
            throw invalid(className, null);
        }
        try {
            return (AmqpConnectionFactory) type.getConstructor(ConnectionSettings.class).newInstance(settings);
        } catch (InvocationTargetException e) {
            throw invalid(className, e.getCause());
        } catch (ReflectiveOperationException e) {
            throw invalid(className, e);
        }
    }

    private static InvalidConnectionFactoryException invalid(String className, Throwable cause) {
        String message = String.format("The factory-class option has to be a valid class that implements \"%s\", got \"%s\"",
            AmqpConnectionFactory.class.getName(), className);
        return cause == null ? new InvalidConnectionFactoryException(message)
            : new InvalidConnectionFactoryException(message, cause);
    }
}
