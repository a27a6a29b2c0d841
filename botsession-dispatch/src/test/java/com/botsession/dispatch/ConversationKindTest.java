package com.botsession.dispatch;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ConversationKindTest {

    @Test
    void normalize_acceptsAliasesCaseInsensitively() {
        assertEquals(ConversationKind.DIRECT, ConversationKind.normalize(" C2C "));
        assertEquals(ConversationKind.DIRECT, ConversationKind.normalize("dm"));
        assertEquals(ConversationKind.GROUP, ConversationKind.normalize("Group"));
        assertEquals(ConversationKind.CHANNEL, ConversationKind.normalize("channel"));
        assertNull(ConversationKind.normalize("guild"));
        assertNull(ConversationKind.normalize(null));
    }

    @Test
    void normalize_turkishDefaultLocale_stillMatchesDirect() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));

            assertEquals(ConversationKind.DIRECT, ConversationKind.normalize("DIRECT"));
            assertEquals(ConversationKind.DIRECT, Session.parseLimitation(List.of("DIRECT"))
                    .iterator().next());
        } finally {
            Locale.setDefault(saved);
        }
    }
}
