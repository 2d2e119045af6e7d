package org.cobbzilla.swifts3mirror;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

/**
 * An entry of a Swift container listing ({@code ?format=json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SwiftObject {

    @Getter @Setter private String name;
    @Getter @Setter private long bytes;
    @Getter @Setter private String hash;

    @JsonProperty("last_modified")
    @Getter @Setter private String lastModified;
}
