package im.arun.tiki.parser;

import im.arun.tiki.model.MetadataValue;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts and parses bracketed inline metadata such as
 * {@code [priority: high, mastery: 85%, blocked]}.
 */
public class MetadataParser {

    private static final Pattern ANNOTATION = Pattern.compile("\\[([^\\]]+)\\]");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off");

    /**
     * Title text with every annotation removed, plus the merged metadata of all annotations.
     */
    @Value
    public static class Extraction {
        String title;
        Map<String, MetadataValue> metadata;
    }

    public Extraction extract(String titleWithMetadata) {
        Map<String, MetadataValue> metadata = new LinkedHashMap<>();
        Matcher matcher = ANNOTATION.matcher(titleWithMetadata);
        StringBuilder title = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            appendSegment(title, titleWithMetadata.substring(last, matcher.start()));
            metadata.putAll(parse(matcher.group(1)));
            last = matcher.end();
        }
        appendSegment(title, titleWithMetadata.substring(last));
        return new Extraction(title.toString().strip(), metadata);
    }

    /**
     * Joins the text around a removed annotation with a single space, leaving other spacing alone.
     */
    private static void appendSegment(StringBuilder title, String segment) {
        if (title.length() > 0 && Character.isWhitespace(title.charAt(title.length() - 1))) {
            title.append(segment.stripLeading());
        } else {
            title.append(segment);
        }
    }

    /**
     * Parses the body of one annotation (without brackets). Later keys overwrite earlier ones.
     */
    public Map<String, MetadataValue> parse(String body) {
        Map<String, MetadataValue> metadata = new LinkedHashMap<>();
        for (String rawPair : body.split(",")) {
            String pair = rawPair.strip();
            if (pair.isEmpty()) {
                continue;
            }

            int colon = pair.indexOf(':');
            int equals = pair.indexOf('=');
            String key;
            MetadataValue value;
            if (colon >= 0) {
                key = pair.substring(0, colon).strip();
                value = parseValue(pair.substring(colon + 1).strip());
            } else if (equals >= 0) {
                key = pair.substring(0, equals).strip();
                value = parseValue(pair.substring(equals + 1).strip());
            } else {
                // Bare flag
                key = pair;
                value = MetadataValue.ofBoolean(true);
            }

            if (!key.isEmpty()) {
                metadata.put(key, value);
            }
        }
        return metadata;
    }

    /**
     * Infers the type of a literal: percentage, integer, decimal, boolean word, reference, string.
     */
    public MetadataValue parseValue(String value) {
        if (value.endsWith("%")) {
            String number = value.substring(0, value.length() - 1).strip();
            if (INTEGER.matcher(number).matches() || DECIMAL.matcher(number).matches()) {
                return finiteFloat(Double.parseDouble(number) / 100.0, value);
            }
        }

        if (INTEGER.matcher(value).matches()) {
            try {
                return MetadataValue.ofInteger(Long.parseLong(value));
            } catch (NumberFormatException e) {
                // Outside the long range: keep every digit
                return MetadataValue.ofString(value);
            }
        }
        if (DECIMAL.matcher(value).matches()) {
            return finiteFloat(Double.parseDouble(value), value);
        }

        String lower = value.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(lower)) {
            return MetadataValue.ofBoolean(true);
        }
        if (FALSE_WORDS.contains(lower)) {
            return MetadataValue.ofBoolean(false);
        }

        if (value.startsWith("*")) {
            return MetadataValue.ofReference(value);
        }
        return MetadataValue.ofString(value);
    }

    private static MetadataValue finiteFloat(double number, String literal) {
        // JSON has no Infinity
        return Double.isFinite(number) ? MetadataValue.ofFloat(number) : MetadataValue.ofString(literal);
    }
}
