package com.example.dubbing_backend.engine;

import com.example.dubbing_backend.engine.Interfaces.Transcriber;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WhisperCliTranscriberTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parsesSegmentsAndLanguage() throws Exception {
        Transcriber.Result result = WhisperCliTranscriber.parse(mapper.readTree("""
                {"text":" 你好 世界 ","language":"zh",
                 "segments":[{"id":0,"start":0.0,"end":1.5,"text":" 你好"},
                             {"id":1,"start":1.5,"end":3.25,"text":" 世界"}]}
                """), "en");

        assertThat(result.text()).isEqualTo("你好 世界");
        assertThat(result.language()).isEqualTo("zh");
        assertThat(result.durationSec()).isEqualTo(3.25);
        assertThat(result.segments()).extracting(Transcriber.Segment::text).containsExactly("你好", "世界");
        assertThat(result.segments().get(1).start()).isEqualTo(1.5);
    }

    @Test
    void missingFieldsFallBack() throws Exception {
        Transcriber.Result result = WhisperCliTranscriber.parse(mapper.readTree("{\"segments\":[{\"text\":\"hi\"}]}"), "zh");

        assertThat(result.text()).isEmpty();
        assertThat(result.language()).isEqualTo("zh");
        assertThat(result.segments()).singleElement().satisfies(s -> {
            assertThat(s.id()).isZero();
            assertThat(s.end()).isZero();
        });
    }
}
