package io.keyserver.core.json;

import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;

import io.keyserver.core.error.TimestampRewriteException;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites RFC3339 timestamp strings inside raw JSON text into the structured
 * {@code {"seconds": S, "nanos": N}} form the request messages decode.
 *
 * <p>
 * This is a lexical scanner, not a JSON parser. It walks the body once, left to
 * right, looking for literal occurrences of the field name (quoted or bare) and
 * handles each occurrence as follows:
 * <ul>
 * <li>value not opened by {@code "} after the optional colon → occurrence left
 * untouched, scanning continues</li>
 * <li>value opened but never closed → occurrence left untouched, scanning
 * stops, no error</li>
 * <li>quoted value parses as RFC3339 → the quoted span, quotes included, is
 * replaced by the structured object</li>
 * <li>quoted value does not parse (empty included) →
 * {@link TimestampRewriteException}; nothing is rewritten, including
 * occurrences that parsed earlier in the same pass</li>
 * </ul>
 *
 * <p>
 * Bytes outside the replaced spans are copied unchanged and in order.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class TimestampRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(TimestampRewriter.class);

    /** {@code YYYY-MM-DDTHH:MM:SS[.fraction](Z|±HH:MM)}, seconds mandatory. */
    static final DateTimeFormatter RFC3339 = new DateTimeFormatterBuilder()
            .parseCaseSensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendValue(HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(MINUTE_OF_HOUR, 2)
            .appendLiteral(':')
            .appendValue(SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendOffset("+HH:MM", "Z")
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private static final byte QUOTE = '"';
    private static final byte COLON = ':';

    private TimestampRewriter() {
        // utility class
    }

    /**
     * Rewrites every quoted RFC3339 value of {@code field} in {@code body}.
     *
     * @param body  the raw request body; empty or {@code null} is returned as an
     *              empty body
     * @param field the bare field name, e.g. {@code creation_time}
     * @return a new array holding the rewritten body, or {@code body} itself when
     *         nothing was rewritten
     * @throws TimestampRewriteException if a quoted value of {@code field} is not
     *                                   an RFC3339 timestamp
     */
    public static byte[] rewrite(byte[] body, String field) {
        return rewrite(body, field, body);
    }

    /**
     * Applies {@link #rewrite(byte[], String)} for each field in order. A failure
     * on any field discards the rewrites of all fields.
     *
     * @param body   the raw request body
     * @param fields the timestamp-bearing field names
     * @return the rewritten body
     * @throws TimestampRewriteException carrying the body as received
     */
    public static byte[] rewriteAll(byte[] body, List<String> fields) {
        byte[] current = body;
        for (String field : fields) {
            current = rewrite(current, field, body);
        }
        return current;
    }

    /**
     * Parses an RFC3339 timestamp.
     *
     * @throws DateTimeParseException if {@code text} is not RFC3339
     */
    public static Instant parseRfc3339(String text) {
        return OffsetDateTime.parse(text, RFC3339).toInstant();
    }

    /** Renders an instant as the structured JSON object that replaces the quoted value. */
    static String structured(Instant instant) {
        return "{\"seconds\": " + instant.getEpochSecond() + ", \"nanos\": " + instant.getNano() + "}";
    }

    private static byte[] rewrite(byte[] body, String field, byte[] original) {
        Objects.requireNonNull(field, "field must not be null");
        if (field.isEmpty()) {
            throw new IllegalArgumentException("field must not be empty");
        }
        if (body == null || body.length == 0) {
            return body == null ? new byte[0] : body;
        }

        byte[] key = field.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = null;
        int copied = 0;
        int cursor = 0;
        int rewritten = 0;

        while (cursor < body.length) {
            int match = indexOf(body, key, cursor);
            if (match < 0) {
                break;
            }
            int afterKey = match + key.length;
            int pos = afterKey;
            // a quote right after the key closes the key, even when the key ends a longer string
            if (pos < body.length && body[pos] == QUOTE) {
                pos++;
            }
            pos = skipWhitespace(body, pos);
            if (pos < body.length && body[pos] == COLON) {
                pos = skipWhitespace(body, pos + 1);
            }
            if (pos >= body.length || body[pos] != QUOTE) {
                cursor = afterKey;
                continue;
            }

            int open = pos;
            int close = indexOf(body, QUOTE, open + 1);
            if (close < 0) {
                LOG.debug("Unterminated value for '{}' at offset {}; left as is", field, open);
                break;
            }

            String text = new String(body, open + 1, close - open - 1, StandardCharsets.UTF_8);
            Instant instant;
            try {
                instant = parseRfc3339(text);
            } catch (DateTimeParseException e) {
                throw new TimestampRewriteException(field, text, original, e);
            }

            if (out == null) {
                out = new ByteArrayOutputStream(body.length + 32);
            }
            out.write(body, copied, open - copied);
            byte[] replacement = structured(instant).getBytes(StandardCharsets.US_ASCII);
            out.write(replacement, 0, replacement.length);
            copied = close + 1;
            cursor = close + 1;
            rewritten++;
        }

        if (out == null) {
            return body;
        }
        out.write(body, copied, body.length - copied);
        LOG.debug("Rewrote {} timestamp value(s) of '{}'", rewritten, field);
        return out.toByteArray();
    }

    private static int skipWhitespace(byte[] body, int from) {
        int pos = from;
        while (pos < body.length && isWhitespace(body[pos])) {
            pos++;
        }
        return pos;
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r';
    }

    private static int indexOf(byte[] haystack, byte needle, int from) {
        for (int i = from; i < haystack.length; i++) {
            if (haystack[i] == needle) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOf(byte[] haystack, byte[] needle, int from) {
        int last = haystack.length - needle.length;
        for (int i = from; i <= last; i++) {
            if (regionMatches(haystack, i, needle)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean regionMatches(byte[] haystack, int offset, byte[] needle) {
        for (int j = 0; j < needle.length; j++) {
            if (haystack[offset + j] != needle[j]) {
                return false;
            }
        }
        return true;
    }
}
