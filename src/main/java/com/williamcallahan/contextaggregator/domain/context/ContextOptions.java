package com.williamcallahan.contextaggregator.domain.context;

/**
 * Per-request processing switches. A null field means "use the configured default".
 *
 * @param deduplicate run the deduplication passes (default true)
 * @param compress allow truncating an oversized first chunk (default from configuration)
 * @param summarize strip comment-only lines and collapse blank runs before counting
 * @param includeMetadata render relevance scores into the payload
 * @param includeEmbeddings keep embedding vectors on the returned chunks
 * @param diversify rank with maximal marginal relevance instead of plain relevance order
 * @param format payload rendering (default XML)
 * @param cacheKey caller-supplied cache key overriding the request fingerprint
 * @param skipCache bypass the response cache for both lookup and store
 * @param timeoutMs per-request timeout in milliseconds
 */
public record ContextOptions(
        Boolean deduplicate,
        Boolean compress,
        Boolean summarize,
        Boolean includeMetadata,
        Boolean includeEmbeddings,
        Boolean diversify,
        ContextFormat format,
        String cacheKey,
        Boolean skipCache,
        Long timeoutMs) {

    public static ContextOptions defaults() {
        return new ContextOptions(null, null, null, null, null, null, null, null, null, null);
    }

    public boolean resolveDeduplicate() {
        return !Boolean.FALSE.equals(deduplicate);
    }

    public boolean resolveCompress(boolean configuredDefault) {
        return compress == null ? configuredDefault : compress;
    }

    public boolean resolveSummarize() {
        return Boolean.TRUE.equals(summarize);
    }

    public boolean resolveIncludeMetadata() {
        return Boolean.TRUE.equals(includeMetadata);
    }

    public boolean resolveIncludeEmbeddings() {
        return Boolean.TRUE.equals(includeEmbeddings);
    }

    public boolean resolveDiversify(boolean configuredDefault) {
        return diversify == null ? configuredDefault : diversify;
    }

    public ContextFormat resolveFormat() {
        return format == null ? ContextFormat.XML : format;
    }

    public boolean resolveSkipCache() {
        return Boolean.TRUE.equals(skipCache);
    }

    /**
     * Returns the caller-supplied cache key when it is non-blank.
     *
     * @return custom cache key or null
     */
    public String customCacheKey() {
        return cacheKey == null || cacheKey.isBlank() ? null : cacheKey;
    }
}
