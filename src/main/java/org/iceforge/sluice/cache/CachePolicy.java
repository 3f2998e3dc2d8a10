package org.iceforge.sluice.cache;

/**
 * How a response may be cached.
 *
 * @param maxAgeSeconds TTL; 0 disables caching
 * @param urlForm       whether the response was addressed through a content-hashed URL
 */
public record CachePolicy(long maxAgeSeconds, UrlForm urlForm) {

    public enum UrlForm {
        HASHED,
        PLAIN
    }

    /** The {@code Cache-Control} header value. */
    public String cacheControl() {
        return maxAgeSeconds == 0 ? "no-cache" : "max-age=" + maxAgeSeconds;
    }
}
