package com.skillbox.runtime.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TerminalMessageParserTest {

    static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");

    final TerminalMessageParser parser = new TerminalMessageParser(new ObjectMapper());

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    @Test
    void parse_ordinaryOutput_isIgnored() {
        assertThat(parser.parse("Downloading 3 files...", "sess", "s1", AT)).isEmpty();
        assertThat(parser.parse("{not json}", "sess", "s1", AT)).isEmpty();
        assertThat(parser.parse("{\"progress\": 0.5}", "sess", "s1", AT)).isEmpty();
        assertThat(parser.parse(null, "sess", "s1", AT)).isEmpty();
    }

    @Test
    void parse_successLine_carriesResult() {
        TerminalResult result = parser.parse(
                "  {\"success\": true, \"result\": {\"rows\": 3}, \"session_id\": \"sess\"}  ", "sess", "s1", AT)
                .orElseThrow();

        assertThat(result.success()).isTrue();
        assertThat(result.result()).isEqualTo(Map.of("rows", 3));
        assertThat(result.sessionId()).isEqualTo("sess");
        assertThat(result.skillId()).isEqualTo("s1");
    }

    @Test
    void parse_failureLine_carriesErrorOrGenericMessage() {
        assertThat(parser.parse("{\"success\": false, \"error\": \"bad input\"}", "sess", "s1", AT))
                .get().extracting(TerminalResult::error).isEqualTo("bad input");
        assertThat(parser.parse("{\"success\": \"yes\"}", "sess", "s1", AT))
                .get().extracting(TerminalResult::error).isEqualTo("skill reported failure");
    }

    @Test
    void parse_foreignSessionId_isDiscarded() {
        assertThat(parser.parse("{\"success\": true, \"session_id\": \"other\"}", "sess", "s1", AT)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Channel
    // ------------------------------------------------------------------

    @Test
    void resultChannel_acceptsOnlyFirstOffer() throws Exception {
        ResultChannel channel = new ResultChannel();

        assertThat(channel.offer(TerminalResult.success("sess", "s1", "first", AT))).isTrue();
        assertThat(channel.offer(TerminalResult.success("sess", "s1", "second", AT))).isFalse();

        assertThat(channel.poll(Duration.ofMillis(10)).result()).isEqualTo("first");
        assertThat(channel.pollNow()).isNull();
        assertThat(channel.hasDelivered()).isTrue();
    }

    @Test
    void resultChannel_closed_rejectsOffers() throws Exception {
        ResultChannel channel = new ResultChannel();
        channel.close();

        assertThat(channel.offer(TerminalResult.failure("sess", "s1", "late", AT))).isFalse();
        assertThat(channel.poll(Duration.ofMillis(10))).isNull();
        assertThat(channel.isClosed()).isTrue();
    }
}
