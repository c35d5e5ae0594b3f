package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.config.QueueConnectionConfig;

/**
 * Everything a connection factory needs to reach the broker. A non-blank {@code dsn} wins over the
 * individual host settings.
 */
public record ConnectionSettings(
    String dsn,
    String host,
    int port,
    String user,
    String password,
    String vhost,
    boolean sslOn,
    boolean sslVerify,
    String sslCafile,
    String sslLocalCert,
    String sslPassphrase,
    String delayStrategy
) {
    public static ConnectionSettings from(QueueConnectionConfig config) {
        var ssl = config.getSsl();
        return new ConnectionSettings(
            config.getDsn(),
            config.getHost(),
            config.getPort(),
            config.getLogin(),
            config.getPassword(),
            config.getVhost(),
            ssl.isEnabled(),
            ssl.isVerifyPeer(),
            ssl.getCafile(),
            ssl.getLocalCert(),
            ssl.getPassphrase(),
            config.getDelayStrategy()
        );
    }

    public boolean hasDsn() {
        return dsn != null && !dsn.isBlank();
    }
}
