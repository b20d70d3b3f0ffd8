package com.adlanda.knowledgesync.service;

import com.adlanda.knowledgesync.exception.UnsupportedContentException;
import com.adlanda.knowledgesync.model.RawContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns raw document bytes into normalized plain text.
 *
 * Supports plain text, markdown, CSV, JSON and HTML. Anything else is rejected
 * with {@link UnsupportedContentException}.
 */
@Component
public class ContentExtractor {

    private static final Logger log = LoggerFactory.getLogger(ContentExtractor.class);

    private static final Set<String> TEXT_TYPES = Set.of(
            "text/plain", "text/markdown", "text/x-markdown", "text/csv", "application/json");

    private static final Set<String> HTML_TYPES = Set.of("text/html", "application/xhtml+xml");

    private static final Pattern SCRIPT_OR_STYLE = Pattern.compile("(?is)<(script|style)[^>]*>.*?</\\1>");
    private static final Pattern BLOCK_TAG = Pattern.compile("(?i)</?(p|div|br|li|tr|h[1-6])[^>]*>");
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern BLANK_LINES = Pattern.compile("\n{3,}");

    public boolean supports(String mimeType) {
        String type = baseType(mimeType);
        return TEXT_TYPES.contains(type) || HTML_TYPES.contains(type);
    }

    /**
     * Extracts text from the given content.
     *
     * @throws UnsupportedContentException if the content type has no text representation here
     */
    public String extract(String itemId, RawContent raw) throws UnsupportedContentException {
        String type = baseType(raw.mimeType());
        if (!supports(type)) {
            throw new UnsupportedContentException(itemId, raw.mimeType());
        }

        String text = decode(itemId, raw.bytes());
        if (HTML_TYPES.contains(type)) {
            text = stripHtml(text);
        }
        return normalize(text);
    }

    private String decode(String itemId, byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("{} is not valid UTF-8, decoding as ISO-8859-1", itemId);
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    static String stripHtml(String html) {
        String text = SCRIPT_OR_STYLE.matcher(html).replaceAll("");
        text = BLOCK_TAG.matcher(text).replaceAll("\n\n");
        text = ANY_TAG.matcher(text).replaceAll("");
        return text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
    }

    static String normalize(String text) {
        String normalized = text;
        if (normalized.startsWith("\uFEFF")) {
            normalized = normalized.substring(1);
        }
        normalized = normalized.replace("\r\n", "\n").replace('\r', '\n');
        normalized = normalized.lines()
                .map(String::stripTrailing)
                .collect(Collectors.joining("\n"));
        return BLANK_LINES.matcher(normalized).replaceAll("\n\n").strip();
    }

    private static String baseType(String mimeType) {
        if (mimeType == null) {
            return "";
        }
        int semicolon = mimeType.indexOf(';');
        String base = semicolon >= 0 ? mimeType.substring(0, semicolon) : mimeType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
