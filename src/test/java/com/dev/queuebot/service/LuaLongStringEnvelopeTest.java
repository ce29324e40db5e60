package com.dev.queuebot.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LuaLongStringEnvelopeTest {

    private final LuaLongStringEnvelope envelope = new LuaLongStringEnvelope();

    @Test
    @DisplayName("plain payload uses the level-0 long string")
    void wrapPlain() {
        assertThat(envelope.wrap("{\"q\":[]}")).isEqualTo("return [[{\"q\":[]}]]");
    }

    @Test
    @DisplayName("payload containing the closing bracket raises the level")
    void wrapWithClosingBracket() {
        String payload = "{\"q\":[{\"title\":\"a]]b\"}]}";

        String wrapped = envelope.wrap(payload);

        assertThat(wrapped).isEqualTo("return [=[" + payload + "]=]");
        assertThat(envelope.strip(wrapped)).contains(payload);
    }

    @Test
    @DisplayName("payload ending in a bracket does not close the string early")
    void wrapTrailingBracket() {
        String payload = "[1,[2]]";

        String wrapped = envelope.wrap(payload);

        assertThat(wrapped).doesNotStartWith("return [[");
        assertThat(envelope.strip(wrapped)).contains(payload);
    }

    @Test
    @DisplayName("strip returns the payload of a wrapped value")
    void stripWrapped() {
        assertThat(envelope.strip("return [[{\"q\":[]}]]")).contains("{\"q\":[]}");
        assertThat(envelope.strip("  return [==[x]==]\n")).contains("x");
    }

    @Test
    @DisplayName("unwrapped and mismatched values are not stripped")
    void stripUnwrapped() {
        assertThat(envelope.strip("{\"q\":[]}")).isEmpty();
        assertThat(envelope.strip("[]")).isEmpty();
        assertThat(envelope.strip("return [=[x]]")).isEmpty();
        assertThat(envelope.strip("return 42")).isEmpty();
        assertThat(envelope.strip(null)).isEmpty();
    }

    @Test
    @DisplayName("strip undoes wrap for awkward payloads")
    void roundTrip() {
        for (String payload : new String[]{"", "]", "]]", "]=]", "a]]b]=]c]==]", "{\"q\":[]}"}) {
            assertThat(envelope.strip(envelope.wrap(payload))).as(payload).contains(payload);
        }
    }
}
