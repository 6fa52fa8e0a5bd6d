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

import me.golemcore.pulse.domain.exception.TransientExternalException;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.MailSenderPort;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Date;

/**
 * Sends plain-text mail over SMTP with the configured account.
 */
@Component
@Slf4j
@SuppressWarnings("PMD.ReplaceJavaUtilDate") // MimeMessage.setSentDate requires java.util.Date
public class SmtpMailSenderAdapter implements MailSenderPort {

    private final PulseProperties.SmtpProperties config;

    public SmtpMailSenderAdapter(PulseProperties properties) {
        this.config = properties.getMail().getSmtp();
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled()
                && config.getHost() != null && !config.getHost().isBlank()
                && config.getUsername() != null && !config.getUsername().isBlank();
    }

    @Override
    public void send(String to, String cc, String subject, String body) {
        if (!isAvailable()) {
            throw new TransientExternalException("SMTP is not configured");
        }
        try {
            Session session = MailSessionFactory.createSmtpSession(
                    config.getHost(), config.getPort(),
                    config.getUsername(), config.getPassword(),
                    MailSessionFactory.Security.parse(config.getSecurity()),
                    config.getConnectTimeout(), config.getReadTimeout());

            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(config.getUsername()));
            message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to));
            if (cc != null && !cc.isBlank()) {
                message.setRecipients(Message.RecipientType.CC, InternetAddress.parse(cc));
            }
            message.setSubject(subject, "UTF-8");
            message.setText(body != null ? body : "", "UTF-8");
            message.setSentDate(new Date());

            deliver(message);
            log.info("[SMTP] Email sent to: {}", to);
        } catch (MessagingException e) {
            throw new TransientExternalException("Failed to send email: " + sanitizeError(e.getMessage()), e);
        }
    }

    String sanitizeError(String message) {
        if (message == null) {
            return "Unknown error";
        }
        String sanitized = message;
        if (config.getUsername() != null && !config.getUsername().isBlank()) {
            sanitized = sanitized.replace(config.getUsername(), "***");
        }
        if (config.getPassword() != null && !config.getPassword().isBlank()) {
            sanitized = sanitized.replace(config.getPassword(), "***");
        }
        return sanitized;
    }

    protected void deliver(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }
}
