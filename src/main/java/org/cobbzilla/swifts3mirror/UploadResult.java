package org.cobbzilla.swifts3mirror;

public enum UploadResult {
    SUCCESS, EXHAUSTED
}
