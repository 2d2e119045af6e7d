package org.cobbzilla.swifts3mirror;

public interface DestinationCall<T, E extends Exception> {
    T call(DestinationStore store) throws E;
}
