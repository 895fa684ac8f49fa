package com.sifinder.ingest;

public record IndexProgress(int processed, int total) {
    public boolean complete() {
        return processed >= total;
    }
}
