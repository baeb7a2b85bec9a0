package com.crossbot.codec.editor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RichTextExtractorTest {

    @Test
    void reducesMarkupToPlainText() {
        RichTextExtractor.Extracted out = RichTextExtractor.extract("<p>Hello<br/>world</p><p><b>Bye</b></p>");
        assertEquals("Hello\nworld\nBye", out.text());
        assertTrue(out.imageUrls().isEmpty());
    }

    @Test
    void collectsImgAndBackgroundImages() {
        String html = """
                <p>See below</p><img class="x" src="https://cdn.example.com/a.png" alt="a">\
                <div style="width:10px; background-image: url('https://cdn.example.com/b.png'); height:4px">caption</div>\
                <span class="inline-image">[img]</span>""";
        RichTextExtractor.Extracted out = RichTextExtractor.extract(html);
        assertEquals(List.of("https://cdn.example.com/a.png", "https://cdn.example.com/b.png"), out.imageUrls());
        assertEquals("See below", out.text());
    }

    @Test
    void nullAndEmptyGiveEmptyText() {
        assertEquals("", RichTextExtractor.extract(null).text());
        assertEquals("", RichTextExtractor.extract("").text());
    }
}
