package com.sifinder.store;

public class IndexBusyException extends StoreException {
    public IndexBusyException(String indexName) {
        super("Index " + indexName + " is already being written by another indexing pass");
    }
}
