package com.williamcallahan.contextaggregator.application.context;

import com.williamcallahan.contextaggregator.domain.context.ChunkMetadata;
import com.williamcallahan.contextaggregator.domain.context.ContextChunk;
import com.williamcallahan.contextaggregator.domain.context.ContextFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Renders selected chunks into the payload text for a given format.
 */
@Component
public class ContextRenderer {

    /**
     * Renders chunks in order.
     *
     * @param chunks selected chunks
     * @param format target rendering
     * @param includeMetadata add relevance scores
     * @return rendered text; empty for no chunks
     */
    public String render(List<ContextChunk> chunks, ContextFormat format, boolean includeMetadata) {
        if (chunks.isEmpty()) {
            return "";
        }
        return switch (format) {
            case XML -> renderXml(chunks, includeMetadata);
            case MARKDOWN -> renderMarkdown(chunks, includeMetadata);
            case PLAIN -> renderPlain(chunks, includeMetadata);
        };
    }

    private String renderXml(List<ContextChunk> chunks, boolean includeMetadata) {
        List<String> lines = new ArrayList<>();
        lines.add("<retrieved_context>");
        for (ContextChunk chunk : chunks) {
            String attributes = includeMetadata
                    ? " source=\"" + chunk.source().wireId() + "\" relevance=\"" + score(chunk, 3) + "\""
                    : " source=\"" + chunk.source().wireId() + "\"";
            lines.add("  <chunk" + attributes + ">");
            lines.add("    <location>" + escapeXml(location(chunk)) + "</location>");
            lines.add("    <content>");
            lines.add(escapeXml(chunk.content()));
            lines.add("    </content>");
            lines.add("  </chunk>");
        }
        lines.add("</retrieved_context>");
        return String.join("\n", lines);
    }

    private String renderMarkdown(List<ContextChunk> chunks, boolean includeMetadata) {
        List<String> lines = new ArrayList<>();
        for (int index = 0; index < chunks.size(); index++) {
            ContextChunk chunk = chunks.get(index);
            String relevance = includeMetadata ? " (relevance: " + score(chunk, 2) + ")" : "";
            String language = chunk.metadata().language() == null ? "" : chunk.metadata().language();
            lines.add("### " + location(chunk) + relevance);
            lines.add("");
            lines.add("```" + language);
            lines.add(chunk.content());
            lines.add("```");
            if (index < chunks.size() - 1) {
                lines.add("");
                lines.add("---");
                lines.add("");
            }
        }
        return String.join("\n", lines);
    }

    private String renderPlain(List<ContextChunk> chunks, boolean includeMetadata) {
        List<String> lines = new ArrayList<>();
        for (int index = 0; index < chunks.size(); index++) {
            ContextChunk chunk = chunks.get(index);
            String relevance = includeMetadata ? " [score: " + score(chunk, 2) + "]" : "";
            lines.add("// " + location(chunk) + relevance);
            lines.add(chunk.content());
            if (index < chunks.size() - 1) {
                lines.add("");
                lines.add("---");
                lines.add("");
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Describes where a chunk came from: file and line range, then URL and title, then source and id.
     *
     * @param chunk chunk to locate
     * @return location label
     */
    public String location(ContextChunk chunk) {
        ChunkMetadata metadata = chunk.metadata();
        String filePath = metadata.filePath();
        if (filePath != null && !filePath.isBlank()) {
            if (metadata.startLine() != null && metadata.endLine() != null) {
                return filePath + ":" + metadata.startLine() + "-" + metadata.endLine();
            }
            if (metadata.startLine() != null) {
                return filePath + ":" + metadata.startLine();
            }
            return filePath;
        }
        boolean hasTitle = metadata.title() != null && !metadata.title().isBlank();
        if (metadata.url() != null && !metadata.url().isBlank()) {
            return hasTitle ? metadata.title() + " (" + metadata.url() + ")" : metadata.url();
        }
        if (hasTitle) {
            return metadata.title();
        }
        return chunk.source().wireId() + ":" + chunk.id();
    }

    private static String score(ContextChunk chunk, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", chunk.relevance());
    }

    static String escapeXml(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
