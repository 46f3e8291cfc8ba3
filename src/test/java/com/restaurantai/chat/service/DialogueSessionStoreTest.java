package com.restaurantai.chat.service;

import com.restaurantai.chat.model.DialogueSession;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DialogueSessionStoreTest {

    private final DialogueSessionStore store = new DialogueSessionStore(60, 1000);

    @Test
    void sameThreadGetsSameSession() {
        UUID restaurant = UUID.randomUUID();

        DialogueSession first = store.sessionFor(restaurant, "s1");
        first.markGreeted();

        assertThat(store.sessionFor(restaurant, "s1")).isSameAs(first);
        assertThat(store.sessionFor(restaurant, "s1").isGreetingUsed()).isTrue();
    }

    @Test
    void sessionsAreScopedByRestaurantAndSessionId() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        store.sessionFor(a, "s1").markGreeted();

        assertThat(store.sessionFor(a, "s2").isGreetingUsed()).isFalse();
        assertThat(store.sessionFor(b, "s1").isGreetingUsed()).isFalse();
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    void markGreetedReportsOnlyTheFirstCall() {
        DialogueSession session = store.sessionFor(UUID.randomUUID(), "s1");

        assertThat(session.markGreeted()).isTrue();
        assertThat(session.markGreeted()).isFalse();
    }
}
