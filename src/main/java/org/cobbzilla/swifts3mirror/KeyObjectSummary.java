package org.cobbzilla.swifts3mirror;

import com.amazonaws.services.s3.model.S3ObjectSummary;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

import java.io.Serializable;
import java.util.Date;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One entry of a container or bucket listing. The last-modified date is informational only;
 * transfer decisions are made on content digests.
 */
@Slf4j
public class KeyObjectSummary implements Serializable {

    public static final String DIRECTORY_MARKER_SUFFIX = "/";

    private static final DateTimeFormatter SWIFT_LAST_MODIFIED = ISODateTimeFormat.localDateOptionalTimeParser().withZoneUTC();

    @Getter @Setter private String key;
    @Getter @Setter private String eTag;
    @Getter @Setter private long size;
    @Getter @Setter private Date lastModified;

    public KeyObjectSummary() {}

    public KeyObjectSummary(String key, String eTag, long size) {
        this.key = key;
        this.eTag = eTag;
        this.size = size;
    }

    public boolean isDirectoryMarker() {
        return key != null && key.endsWith(DIRECTORY_MARKER_SUFFIX);
    }

    private static Function<S3ObjectSummary, KeyObjectSummary> S3ObjectSummaryToKeyObjectSummaryFunction
            = new Function<S3ObjectSummary, KeyObjectSummary>() {

        public KeyObjectSummary apply(S3ObjectSummary input) {
            KeyObjectSummary output = new KeyObjectSummary();

            output.setKey(input.getKey());
            output.setETag(input.getETag());
            output.setSize(input.getSize());
            output.setLastModified(input.getLastModified());

            return output;
        }
    };

    private static Function<SwiftObject, KeyObjectSummary> SwiftObjectToKeyObjectSummaryFunction
            = new Function<SwiftObject, KeyObjectSummary>() {

        public KeyObjectSummary apply(SwiftObject input) {
            KeyObjectSummary output = new KeyObjectSummary();

            output.setKey(input.getName());
            output.setETag(input.getHash());
            output.setSize(input.getBytes());
            output.setLastModified(parseSwiftDate(input.getLastModified()));

            return output;
        }
    };

    public static List<KeyObjectSummary> S3ObjectSummaryToKeyObject(List<S3ObjectSummary> input) {
        return input.stream().map(S3ObjectSummaryToKeyObjectSummaryFunction).collect(Collectors.<KeyObjectSummary>toList());
    }

    public static List<KeyObjectSummary> SwiftObjectToKeyObject(List<SwiftObject> input) {
        return input.stream().map(SwiftObjectToKeyObjectSummaryFunction).collect(Collectors.<KeyObjectSummary>toList());
    }

    // Swift reports UTC timestamps without a zone, e.g. 2024-03-01T09:15:02.123450
    static Date parseSwiftDate(String lastModified) {
        if (lastModified == null) return null;
        try {
            return SWIFT_LAST_MODIFIED.parseDateTime(lastModified).toDate();
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable last_modified value {}.", lastModified);
            return null;
        }
    }

    @Override
    public String toString() {
        return "KeyObjectSummary{" +
                "key='" + key + '\'' +
                ", eTag='" + eTag + '\'' +
                ", size=" + size +
                ", lastModified=" + lastModified +
                '}';
    }
}
