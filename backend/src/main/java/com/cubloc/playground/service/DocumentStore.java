package com.cubloc.playground.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known text of every open document, keyed by document uri.
 */
@Component
public class DocumentStore {

    private final Map<String, String> documents = new ConcurrentHashMap<>();

    public void put(String uri, String text) {
        documents.put(uri, text);
    }

    public Optional<String> get(String uri) {
        return Optional.ofNullable(documents.get(uri));
    }

    public boolean remove(String uri) {
        return documents.remove(uri) != null;
    }

    public int size() {
        return documents.size();
    }
}
