package com.crossbot.codec.editor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits authored rich text into plain text and the image URLs it embeds ({@code <img src>} and
 * inline {@code background-image:url()} styles).
 */
final class RichTextExtractor {

    private static final Pattern IMG_SRC = Pattern.compile("<img[^>]+src=[\"']([^\"']+)[\"'][^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BACKGROUND_URL = Pattern.compile(
            "style=[\"'][^\"']*background-image:\\s*url\\(['\"]?([^'\")]+)['\"]?\\)[^\"']*[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMG_TAG = Pattern.compile("<img[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BACKGROUND_ELEMENT = Pattern.compile(
            "<[^>]+style=[\"'][^\"']*background-image:[^\"']*[\"'][^>]*>(.*?)</[^>]+>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern IMAGE_SPAN = Pattern.compile(
            "<span[^>]*class=[\"'][^\"']*image[^\"']*[\"'][^>]*>.*?</span>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern LINE_BREAK = Pattern.compile("<br\\s*/?>|</p>", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]+>");

    private RichTextExtractor() {
    }

    record Extracted(String text, List<String> imageUrls) {
    }

    static Extracted extract(String html) {
        if (html == null || html.isEmpty()) return new Extracted("", List.of());
        List<String> urls = new ArrayList<>();
        collect(IMG_SRC, html, urls);
        collect(BACKGROUND_URL, html, urls);

        String text = IMG_TAG.matcher(html).replaceAll("");
        text = BACKGROUND_ELEMENT.matcher(text).replaceAll("");
        text = IMAGE_SPAN.matcher(text).replaceAll("");
        text = LINE_BREAK.matcher(text).replaceAll("\n");
        text = ANY_TAG.matcher(text).replaceAll("");
        return new Extracted(text.trim(), List.copyOf(urls));
    }

    private static void collect(Pattern pattern, String html, List<String> into) {
        Matcher m = pattern.matcher(html);
        while (m.find()) {
            String url = m.group(1).trim();
            if (!url.isEmpty() && !into.contains(url)) into.add(url);
        }
    }
}
