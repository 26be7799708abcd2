package de.jwiegmann.archive.control.upload;

import de.jwiegmann.archive.control.UploadErrorFactory;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Content-Range eines Chunks: {@code bytes start-end/total} oder {@code bytes * /total} (Status-Probe).
 */
@Getter
@ToString
@AllArgsConstructor
public class ContentRange {

    private static final Pattern RANGE = Pattern.compile("^bytes (\\d+)-(\\d+)/(\\d+)$");
    private static final Pattern PROBE = Pattern.compile("^bytes \\*/(\\d+)$");

    private final long start;
    private final long end;          // inklusiv
    private final long total;
    private final boolean probe;

    public static ContentRange parse(String header) {
        if (header == null || header.isBlank()) {
            throw UploadErrorFactory.invalidContentRange(header, "missing header");
        }
        String value = header.trim();
        try {
            Matcher probe = PROBE.matcher(value);
            if (probe.matches()) {
                return new ContentRange(-1, -1, Long.parseLong(probe.group(1)), true);
            }
            Matcher m = RANGE.matcher(value);
            if (!m.matches()) {
                throw UploadErrorFactory.invalidContentRange(header, "expected 'bytes start-end/total'");
            }
            long start = Long.parseLong(m.group(1));
            long end = Long.parseLong(m.group(2));
            long total = Long.parseLong(m.group(3));
            if (end < start || end >= total) {
                throw UploadErrorFactory.invalidContentRange(header, "range outside of 0.." + (total - 1));
            }
            return new ContentRange(start, end, total, false);
        } catch (NumberFormatException e) {
            throw UploadErrorFactory.invalidContentRange(header, "number out of range");
        }
    }

    public long length() {
        return probe ? 0 : end - start + 1;
    }
}
