package com.example.dubbing_backend.service.Interfaces;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

public interface ObjectStore {
    /** Uploads a file under {@code key}, overwriting what is there, and returns its public URL. */
    String put(String key, Path file, String contentType, Map<String, String> headers);

    /** Removing a missing key is not an error. */
    void delete(String key);

    /** Removes every object whose key starts with {@code prefix}; returns how many went. */
    int deletePrefix(String prefix);

    boolean exists(String key);

    /** Inverse of the URL returned by {@link #put}; empty for URLs this store did not issue. */
    Optional<String> keyFromUrl(String url);
}
