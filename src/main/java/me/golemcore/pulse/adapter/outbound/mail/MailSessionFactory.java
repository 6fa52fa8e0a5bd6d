package me.golemcore.pulse.adapter.outbound.mail;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.mail.Authenticator;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;

import java.util.Locale;
import java.util.Properties;

/**
 * Creates Jakarta Mail sessions for the mailbox poller and the SMTP sender.
 */
final class MailSessionFactory {

    private static final String MAIL_PREFIX = "mail.";
    private static final String TRUE_VALUE = "true";

    /**
     * Transport security of a mail connection. {@code SSL} switches the
     * protocol to its implicit-TLS variant ({@code imaps}, {@code smtps}).
     */
    enum Security {
        SSL,
        STARTTLS,
        NONE;

        /**
         * Accepts {@code ssl}/{@code tls}, {@code starttls} and
         * {@code none}/{@code plain}; blank means SSL.
         */
        static Security parse(String value) {
            if (value == null || value.isBlank()) {
                return SSL;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ssl", "tls" -> SSL;
            case "starttls" -> STARTTLS;
            case "none", "plain" -> NONE;
            default -> throw new IllegalArgumentException("Unknown mail security mode: " + value);
            };
        }

        String protocol(String base) {
            return this == SSL ? base + "s" : base;
        }

        private void applyTo(Properties props, String prefix) {
            if (this == SSL) {
                props.put(prefix + "ssl.enable", TRUE_VALUE);
            } else if (this == STARTTLS) {
                props.put(prefix + "starttls.enable", TRUE_VALUE);
                props.put(prefix + "starttls.required", TRUE_VALUE);
            }
        }
    }

    private MailSessionFactory() {
    }

    static Session createImapSession(String host, int port, String username, String password,
            Security security, int connectTimeout, int readTimeout) {
        Properties props = baseProperties("imap", host, port, security, connectTimeout, readTimeout);
        props.put("mail.store.protocol", security.protocol("imap"));
        return Session.getInstance(props, createAuthenticator(username, password));
    }

    static Session createSmtpSession(String host, int port, String username, String password,
            Security security, int connectTimeout, int readTimeout) {
        Properties props = baseProperties("smtp", host, port, security, connectTimeout, readTimeout);
        props.put("mail.transport.protocol", security.protocol("smtp"));
        props.put(MAIL_PREFIX + security.protocol("smtp") + ".auth", TRUE_VALUE);
        return Session.getInstance(props, createAuthenticator(username, password));
    }

    private static Properties baseProperties(String base, String host, int port, Security security,
            int connectTimeout, int readTimeout) {
        Properties props = new Properties();
        String prefix = MAIL_PREFIX + security.protocol(base) + ".";
        props.put(prefix + "host", host);
        props.put(prefix + "port", String.valueOf(port));
        props.put(prefix + "connectiontimeout", String.valueOf(connectTimeout));
        props.put(prefix + "timeout", String.valueOf(readTimeout));
        security.applyTo(props, prefix);
        return props;
    }

    private static Authenticator createAuthenticator(String username, String password) {
        return new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        };
    }
}
