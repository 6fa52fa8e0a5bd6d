package me.golemcore.pulse.adapter.outbound.mail;

import me.golemcore.pulse.domain.exception.TransientExternalException;
import me.golemcore.pulse.domain.model.ExternalEvent;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import jakarta.mail.Address;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.SearchTerm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ImapInboxEventSourceTest {

    private PulseProperties properties;
    private Store store;
    private Folder folder;
    private ImapInboxEventSource source;

    @BeforeEach
    void setUp() throws MessagingException {
        properties = new PulseProperties();
        PulseProperties.ImapProperties imap = properties.getMail().getImap();
        imap.setEnabled(true);
        imap.setHost("imap.example.com");
        imap.setUsername("me@example.com");
        imap.setMaxMessages(2);

        store = mock(Store.class);
        folder = mock(Folder.class);
        when(store.getFolder("INBOX")).thenReturn(folder);
        when(folder.exists()).thenReturn(true);

        source = new ImapInboxEventSource(properties, Clock.fixed(Instant.parse("2026-02-01T10:00:00Z"),
                ZoneOffset.UTC)) {
            @Override
            Store connectStore() {
                return store;
            }
        };
    }

    @Test
    void shouldClassifyBySubjectKeywords() {
        assertEquals(NotificationPriority.URGENT, ImapInboxEventSource.classify("ACTION REQUIRED: renew cert"));
        assertEquals(NotificationPriority.IMPORTANT, ImapInboxEventSource.classify("Re: lunch"));
        assertEquals(NotificationPriority.IMPORTANT, ImapInboxEventSource.classify("Meeting notes"));
        assertEquals(NotificationPriority.INFO, ImapInboxEventSource.classify("Newsletter"));
        assertEquals(NotificationPriority.INFO, ImapInboxEventSource.classify(null));
    }

    @Test
    void shouldBuildEventTitleFromPriority() {
        ExternalEvent urgent = ImapInboxEventSource.toEvent("<m1>", "Server down - urgent", "ops@example.com",
                "Disk is full");
        ExternalEvent regular = ImapInboxEventSource.toEvent("<m2>", "Hello", "bob@example.com", "");

        assertEquals("[URGENT] Server down - urgent", urgent.getTitle());
        assertEquals("From: ops@example.com\nDisk is full", urgent.getBody());
        assertEquals("[Email] Hello", regular.getTitle());
        assertEquals("From: bob@example.com", regular.getBody());
    }

    @Test
    void shouldIgnoreOwnMessages() {
        assertTrue(source.isOwnMessage("Pulse digest"));
        assertTrue(source.isOwnMessage("Security alert: alice/site"));
        assertFalse(source.isOwnMessage("Quarterly numbers"));
    }

    @Test
    void shouldReturnNewestUnreadMessages() throws Exception {
        Message oldest = message("<1@example.com>", "First", "a@example.com");
        Message middle = message("<2@example.com>", "Urgent: call back", "b@example.com");
        Message newest = message("<3@example.com>", "Pulse digest", "me@example.com");
        when(folder.search(any(SearchTerm.class))).thenReturn(new Message[] { oldest, middle, newest });

        List<ExternalEvent> events = source.poll("system");

        assertEquals(1, events.size());
        assertEquals("<2@example.com>", events.get(0).getSourceEventId());
        assertEquals(NotificationPriority.URGENT, events.get(0).getPriority());
        verify(folder).open(Folder.READ_ONLY);
        verify(folder).close(false);
        verify(store).close();
    }

    @Test
    void shouldFailWhenFolderMissing() throws Exception {
        when(folder.exists()).thenReturn(false);

        assertThrows(TransientExternalException.class, () -> source.poll("system"));
    }

    @Test
    void shouldWrapMessagingErrors() throws Exception {
        when(folder.search(any(SearchTerm.class))).thenThrow(new MessagingException("connection reset"));

        TransientExternalException error = assertThrows(TransientExternalException.class,
                () -> source.poll("system"));

        assertTrue(error.getMessage().contains("connection reset"));
    }

    @Test
    void shouldBeDisabledWithoutCredentials() {
        properties.getMail().getImap().setUsername("");

        assertFalse(source.isEnabled());
    }

    private static Message message(String id, String subject, String from) throws Exception {
        Message message = mock(Message.class);
        when(message.getHeader("Message-ID")).thenReturn(new String[] { id });
        when(message.getSubject()).thenReturn(subject);
        when(message.getFrom()).thenReturn(new Address[] { new InternetAddress(from) });
        when(message.getContent()).thenReturn("Please   call\nback");
        return message;
    }
}
