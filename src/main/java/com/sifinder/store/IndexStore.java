package com.sifinder.store;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Stream;

import com.sifinder.fingerprint.Fingerprint;

public interface IndexStore extends AutoCloseable {
    String SOURCE_PATH_KEY = "source_path";

    String name();

    void upsert(String path, Fingerprint fingerprint, long modifiedTime);

    OptionalLong modifiedTime(String path);

    /**
     * Lazily streams every record from one consistent snapshot. The stream holds a database
     * connection and must be closed by the caller.
     */
    Stream<ImageRecord> scanAll();

    boolean removeRecord(String path);

    long recordCount();

    void setMeta(String key, String value);

    Optional<String> meta(String key);

    @Override
    void close();
}
