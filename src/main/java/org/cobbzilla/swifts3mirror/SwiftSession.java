package org.cobbzilla.swifts3mirror;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
public class SwiftSession {

    @Getter private final String storageUrl;
    @Getter private final String token;

    @Override
    public String toString() { return "SwiftSession{storageUrl='" + storageUrl + "'}"; }
}
