package com.taggernews.ingest.model;

public record TagCandidate(String name, int level) {
}
