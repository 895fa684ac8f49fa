package com.sifinder.store;

public record IndexSummary(String name, String sourcePath) {
}
