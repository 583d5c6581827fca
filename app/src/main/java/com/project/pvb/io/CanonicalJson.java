package com.project.pvb.io;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.project.pvb.core.model.DataHash;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Canonical JSON encoding: object keys sorted at every depth, no insignificant whitespace, UTF-8.
 * Two documents with the same content always produce the same bytes and therefore the same hash.
 *
 * <p>Values without a native JSON form are written the way the anchoring backend writes them, so a
 * hash computed here can be recomputed there:
 * <ul>
 *   <li>instants and offset/zoned date-times in UTC as {@code 2025-01-01T00:00:00+00:00}, with
 *       microseconds only when they are non-zero</li>
 *   <li>{@code byte[]} as lower-case hex without a prefix</li>
 *   <li>non-ASCII text unescaped; control characters without a short escape as unicode escapes
 *       with lower-case hex digits</li>
 * </ul>
 * Keys are ordered by Unicode code point.
 */
public final class CanonicalJson {

    public static final String CANONICALIZATION = "json:sorted_keys";
    public static final String HASH_ALGORITHM = "sha256";

    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper MAPPER = JsonMapper.builder(
                    new JsonFactoryBuilder().characterEscapes(new LowerCaseControlEscapes()).build())
            .addModule(new JavaTimeModule())
            .addModule(new SimpleModule("canonical-values")
                    .addSerializer(Instant.class, new UtcSerializer<Instant>(instant -> instant))
                    .addSerializer(OffsetDateTime.class, new UtcSerializer<OffsetDateTime>(OffsetDateTime::toInstant))
                    .addSerializer(ZonedDateTime.class, new UtcSerializer<ZonedDateTime>(ZonedDateTime::toInstant))
                    .addSerializer(byte[].class, new HexBytesSerializer()))
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private CanonicalJson() {
    }

    public static byte[] canonicalize(Object document) {
        JsonNode tree = MAPPER.valueToTree(document);
        try {
            return MAPPER.writeValueAsString(sorted(tree)).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document is not JSON serializable", e);
        }
    }

    public static String canonicalString(Object document) {
        return new String(canonicalize(document), StandardCharsets.UTF_8);
    }

    public static DataHash hash(Object document) {
        return DataHash.digest(canonicalize(document));
    }

    /**
     * UTC ISO-8601 with an explicit {@code +00:00} offset, truncated to microseconds.
     */
    static String isoUtc(Instant instant) {
        LocalDateTime utc = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        int micros = utc.getNano() / 1_000;
        String seconds = SECONDS.format(utc);
        return micros == 0
                ? seconds + "+00:00"
                : seconds + String.format(Locale.ROOT, ".%06d", micros) + "+00:00";
    }

    private static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    private static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) {
                names.add(it.next());
            }
            names.sort(CanonicalJson::compareCodePoints);
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                result.set(name, sorted(node.get(name)));
            }
            return result;
        }
        if (node.isArray()) {
            var result = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> result.add(sorted(element)));
            return result;
        }
        return node;
    }

    private static final class UtcSerializer<T> extends JsonSerializer<T> {
        private final Function<T, Instant> toInstant;

        UtcSerializer(Function<T, Instant> toInstant) {
            this.toInstant = toInstant;
        }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(isoUtc(toInstant.apply(value)));
        }
    }

    private static final class HexBytesSerializer extends JsonSerializer<byte[]> {
        @Override
        public void serialize(byte[] value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(HexFormat.of().formatHex(value));
        }
    }

    /**
     * Emits unicode escapes for control characters with lower-case hex digits. Quote, backslash and the
     * short escapes ({@code \b \t \n \f \r}) stay standard.
     */
    private static final class LowerCaseControlEscapes extends CharacterEscapes {
        private final int[] escapes;

        LowerCaseControlEscapes() {
            escapes = standardAsciiEscapesForJSON();
            for (int c = 0; c < 0x20; c++) {
                if (escapes[c] == ESCAPE_STANDARD) {
                    escapes[c] = ESCAPE_CUSTOM;
                }
            }
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return escapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return ch < 0x20 ? new SerializedString(String.format(Locale.ROOT, "\\u%04x", ch)) : null;
        }
    }
}
