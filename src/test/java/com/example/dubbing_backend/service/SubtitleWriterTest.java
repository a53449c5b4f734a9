package com.example.dubbing_backend.service;

import com.example.dubbing_backend.engine.Interfaces.Transcriber;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class SubtitleWriterTest {

    private final SubtitleWriter writer = new SubtitleWriter();

    @Test
    void wordsFollowSegmentDurations() {
        List<Transcriber.Segment> segments = List.of(
                new Transcriber.Segment(0, 0.0, 3.0, "一"),
                new Transcriber.Segment(1, 3.0, 4.0, "二"));

        List<SubtitleWriter.Cue> cues = SubtitleWriter.cues(segments, "một hai ba bốn", 4.0);

        assertThat(cues).containsExactly(
                new SubtitleWriter.Cue(0, 3000, "một hai ba"),
                new SubtitleWriter.Cue(3000, 4000, "bốn"));
    }

    @Test
    void untimedTranscriptGetsOneCueOverTheWholeVideo() {
        List<SubtitleWriter.Cue> cues = SubtitleWriter.cues(List.of(new Transcriber.Segment(0, 0, 0, "x")), "xin chào", 12.5);

        assertThat(cues).containsExactly(new SubtitleWriter.Cue(0, 12500, "xin chào"));
        assertThat(SubtitleWriter.cues(null, "xin chào", 0)).containsExactly(new SubtitleWriter.Cue(0, 1000, "xin chào"));
    }

    @Test
    void renderProducesWebVtt() {
        String vtt = writer.render(List.of(new Transcriber.Segment(0, 1.5, 3723.456, "")), "xin chào", 0);

        assertThat(vtt).isEqualTo("WEBVTT\n\n00:00:01.500 --> 01:02:03.456\nxin chào\n\n");
        assertThat(writer.render(List.of(), "   ", 10)).isEqualTo("WEBVTT\n\n");
    }

    @Test
    void longCuesAreWrappedOnTwoLines() {
        String text = "đây là một câu phụ đề rất dài cần được chia thành hai dòng";

        String vtt = writer.render(List.of(), text, 5);

        String body = vtt.substring(vtt.indexOf('\n', "WEBVTT\n\n".length()) + 1).trim();
        assertThat(body.split("\n")).hasSize(2);
        assertThat(body.replace('\n', ' ')).isEqualTo(text);
    }

    @Test
    void writeCreatesTheFile(@TempDir Path tmp) throws Exception {
        Path out = writer.write(List.of(), "xin chào", 2, tmp.resolve("sub/out.vtt"));

        assertThat(out).exists();
        assertThat(out).content().startsWith("WEBVTT");
    }

    @Test
    void formatsTimestamps() {
        assertThat(SubtitleWriter.formatVttTime(0)).isEqualTo("00:00:00.000");
        assertThat(SubtitleWriter.formatVttTime(3_723_456)).isEqualTo("01:02:03.456");
        assertThat(SubtitleWriter.formatVttTime(-5)).isEqualTo("00:00:00.000");
    }

    @Test
    void timestampsStayAsciiUnderNativeDigitLocales() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
        try {
            assertThat(SubtitleWriter.formatVttTime(3_723_456)).isEqualTo("01:02:03.456");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
