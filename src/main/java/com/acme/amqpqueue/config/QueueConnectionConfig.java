package com.acme.amqpqueue.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Connection, topology and error-handling settings for the RabbitMQ queue driver.
 */
@ConfigurationProperties("rabbitmq")
public class QueueConnectionConfig {

    public static final String DEFAULT_FACTORY_CLASS = "com.acme.amqpqueue.rabbit.RabbitAmqpConnectionFactory";

    private String defaultQueue = "default";
    private String factoryClass = DEFAULT_FACTORY_CLASS;
    private String dsn;
    private String host = "127.0.0.1";
    private int port = 5672;
    private String login = "guest";
    private String password = "guest";
    private String vhost = "/";
    private String sleepOnError = "5";
    private String delayStrategy = "dlx";
    private Ssl ssl = new Ssl();
    private Exchange exchange = new Exchange();
    private Queue queue = new Queue();

    public String getDefaultQueue() {
        return defaultQueue;
    }

    public void setDefaultQueue(String defaultQueue) {
        this.defaultQueue = defaultQueue;
    }

    public String getFactoryClass() {
        return factoryClass;
    }

    public void setFactoryClass(String factoryClass) {
        this.factoryClass = factoryClass;
    }

    public String getDsn() {
        return dsn;
    }

    public void setDsn(String dsn) {
        this.dsn = dsn;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getLogin() {
        return login;
    }

    public void setLogin(String login) {
        this.login = login;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getVhost() {
        return vhost;
    }

    public void setVhost(String vhost) {
        this.vhost = vhost;
    }

    public String getSleepOnError() {
        return sleepOnError;
    }

    public void setSleepOnError(String sleepOnError) {
        this.sleepOnError = sleepOnError;
    }

    public ErrorBackoff getErrorBackoff() {
        return ErrorBackoff.parse(sleepOnError);
    }

    public String getDelayStrategy() {
        return delayStrategy;
    }

    public void setDelayStrategy(String delayStrategy) {
        this.delayStrategy = delayStrategy;
    }

    public Ssl getSsl() {
        return ssl;
    }

    public void setSsl(Ssl ssl) {
        this.ssl = ssl;
    }

    public Exchange getExchange() {
        return exchange;
    }

    public void setExchange(Exchange exchange) {
        this.exchange = exchange;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    @ConfigurationProperties("exchange")
    public static class Exchange extends ExchangeOptions {
    }

    @ConfigurationProperties("queue")
    public static class Queue extends QueueOptions {
    }

    /**
     * TLS settings. {@code localCert} is a PKCS#12 bundle holding the client certificate and key.
     */
    @ConfigurationProperties("ssl")
    public static class Ssl {
        private boolean enabled = false;
        private boolean verifyPeer = true;
        private String cafile;
        private String localCert;
        private String passphrase;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isVerifyPeer() {
            return verifyPeer;
        }

        public void setVerifyPeer(boolean verifyPeer) {
            this.verifyPeer = verifyPeer;
        }

        public String getCafile() {
            return cafile;
        }

        public void setCafile(String cafile) {
            this.cafile = cafile;
        }

        public String getLocalCert() {
            return localCert;
        }

        public void setLocalCert(String localCert) {
            this.localCert = localCert;
        }

        public String getPassphrase() {
            return passphrase;
        }

        public void setPassphrase(String passphrase) {
            this.passphrase = passphrase;
        }
    }
}
