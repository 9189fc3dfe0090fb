package com.example.tripstate.imagery;

/**
 * Remote destination photo search.
 */
public interface ImageryClient {

    /**
     * @param query free-text search, e.g. a city name
     * @return URL of the best matching photo, or {@code null} when nothing matched
     */
    String findImageUrl(String query);
}
