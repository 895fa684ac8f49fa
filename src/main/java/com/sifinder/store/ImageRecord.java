package com.sifinder.store;

import com.sifinder.fingerprint.Fingerprint;

/**
 * One indexed file. {@code modifiedTime} is the file's last-modified time in epoch microseconds
 * when the fingerprint was computed.
 */
public record ImageRecord(String path, Fingerprint fingerprint, long modifiedTime) {
}
