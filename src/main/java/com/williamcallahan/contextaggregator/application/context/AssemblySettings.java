package com.williamcallahan.contextaggregator.application.context;

import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig;
import com.williamcallahan.contextaggregator.domain.context.ContextFormat;
import com.williamcallahan.contextaggregator.domain.context.ContextOptions;
import java.util.Objects;

/**
 * Resolved assembly switches for one request: request options layered over the configuration snapshot.
 *
 * @param format payload rendering
 * @param compress allow truncating an oversized first chunk
 * @param summarize strip comment-only lines before counting
 * @param includeMetadata render relevance scores
 * @param includeEmbeddings keep embedding vectors on included chunks
 * @param smartTruncation cut at line boundaries
 * @param preserveStructure append a truncation marker
 * @param minTruncationTokens smallest remaining budget worth truncating into
 * @param tokenCounter counter used for every count in the request
 */
public record AssemblySettings(
        ContextFormat format,
        boolean compress,
        boolean summarize,
        boolean includeMetadata,
        boolean includeEmbeddings,
        boolean smartTruncation,
        boolean preserveStructure,
        int minTruncationTokens,
        TokenCounter tokenCounter) {

    public AssemblySettings {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(tokenCounter, "tokenCounter");
    }

    /**
     * Layers request options over configured defaults.
     *
     * @param options request options
     * @param config configuration snapshot
     * @param tokenCounter counter for the request
     * @return resolved settings
     */
    public static AssemblySettings resolve(ContextOptions options, AggregatorConfig config, TokenCounter tokenCounter) {
        AggregatorConfig.OptimizationSettings optimization = config.optimization();
        boolean summarize = options.summarize() == null ? optimization.summarizeContent() : options.resolveSummarize();
        return new AssemblySettings(
                options.resolveFormat(),
                options.resolveCompress(optimization.compressLargeChunks()),
                summarize,
                options.resolveIncludeMetadata(),
                options.resolveIncludeEmbeddings(),
                optimization.smartTruncation(),
                optimization.preserveStructure(),
                config.budget().minChunkTokens(),
                tokenCounter);
    }
}
