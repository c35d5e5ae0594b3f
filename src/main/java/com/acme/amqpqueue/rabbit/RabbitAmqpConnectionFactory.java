package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpConnectionFactory;
import com.acme.amqpqueue.amqp.AmqpContext;
import com.rabbitmq.client.ConnectionFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;

/**
 * Default {@link AmqpConnectionFactory}, backed by the RabbitMQ Java client.
 */
public class RabbitAmqpConnectionFactory implements AmqpConnectionFactory {

    private final ConnectionSettings settings;

    public RabbitAmqpConnectionFactory(ConnectionSettings settings) {
        this.settings = settings;
    }

    @Override
    public AmqpContext createContext() {
        return new RabbitAmqpContext(connectionFactory(), DelayStrategy.named(settings.delayStrategy()));
    }

    ConnectionFactory connectionFactory() {
        var cf = new ConnectionFactory();
        if (settings.hasDsn()) {
            try {
                cf.setUri(settings.dsn());
            } catch (URISyntaxException | GeneralSecurityException e) {
                throw new IllegalArgumentException("Invalid rabbitmq.dsn: " + e.getMessage(), e);
            }
        } else {
            cf.setHost(settings.host());
            cf.setPort(settings.port());
            cf.setUsername(settings.user());
            cf.setPassword(settings.password());
            cf.setVirtualHost(settings.vhost());
        }

        if (settings.sslOn()) {
            try {
                if (settings.sslVerify()) {
                    cf.useSslProtocol(sslContext());
                    cf.enableHostnameVerification();
                } else {
                    // trusts every certificate
                    cf.useSslProtocol();
                }
            } catch (GeneralSecurityException | IOException e) {
                throw new IllegalStateException("Failed to set up TLS for RabbitMQ: " + e.getMessage(), e);
            }
        }

        // recovery is handled by RabbitAmqpContext so that topology caches are reset
        cf.setAutomaticRecoveryEnabled(false);
        return cf;
    }

    private SSLContext sslContext() throws GeneralSecurityException, IOException {
        var tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        if (settings.sslCafile() != null && !settings.sslCafile().isBlank()) {
            KeyStore trust = KeyStore.getInstance(KeyStore.getDefaultType());
            trust.load(null, null);
            try (InputStream in = Files.newInputStream(Path.of(settings.sslCafile()))) {
                int i = 0;
                for (Certificate cert : CertificateFactory.getInstance("X.509").generateCertificates(in)) {
                    trust.setCertificateEntry("ca-" + i++, cert);
                }
            }
            tmf.init(trust);
        } else {
            tmf.init((KeyStore) null);
        }

        KeyManagerFactory kmf = null;
        if (settings.sslLocalCert() != null && !settings.sslLocalCert().isBlank()) {
            char[] pass = settings.sslPassphrase() == null ? new char[0] : settings.sslPassphrase().toCharArray();
            KeyStore keys = KeyStore.getInstance("PKCS12");
            try (InputStream in = Files.newInputStream(Path.of(settings.sslLocalCert()))) {
                keys.load(in, pass);
            }
            kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(keys, pass);
        }

        SSLContext ctx = SSLContext.getInstance("TLS");
        ctx.init(kmf == null ? null : kmf.getKeyManagers(), tmf.getTrustManagers(), null);
        return ctx;
    }

    public ConnectionSettings getSettings() {
        return settings;
    }
}
