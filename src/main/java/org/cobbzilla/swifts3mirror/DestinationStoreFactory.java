package org.cobbzilla.swifts3mirror;

public interface DestinationStoreFactory {
    DestinationStore create(MirrorCredentials credentials);
}
