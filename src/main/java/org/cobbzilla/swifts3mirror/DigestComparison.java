package org.cobbzilla.swifts3mirror;

public enum DigestComparison {
    UP_TO_DATE, NEEDS_UPLOAD
}
