package org.cobbzilla.swifts3mirror;

import lombok.Getter;

public class ObjectNotFoundException extends Exception {

    @Getter private final String bucket;
    @Getter private final String key;

    public ObjectNotFoundException(String bucket, String key) {
        super("Key " + key + " not found in " + bucket);
        this.bucket = bucket;
        this.key = key;
    }
}
