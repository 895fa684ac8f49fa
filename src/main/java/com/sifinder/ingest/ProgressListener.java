package com.sifinder.ingest;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = progress -> {
    };

    void onProgress(IndexProgress progress);
}
