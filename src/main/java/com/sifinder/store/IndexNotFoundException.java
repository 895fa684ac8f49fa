package com.sifinder.store;

public class IndexNotFoundException extends RuntimeException {
    private final String indexName;

    public IndexNotFoundException(String indexName) {
        super("No index named " + indexName);
        this.indexName = indexName;
    }

    public String indexName() {
        return indexName;
    }
}
