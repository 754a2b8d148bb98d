package com.williamcallahan.contextaggregator.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.williamcallahan.contextaggregator.domain.context.ChunkMetadata;
import com.williamcallahan.contextaggregator.domain.context.SymbolType;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies mapping of camelCase and snake_case backend metadata.
 */
class ChunkMetadataMapperTest {

    @Test
    void mapsSnakeCaseKeys() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("file_path", "src/main/App.java");
        raw.put("start_line", 10);
        raw.put("end_line", "24");
        raw.put("symbol_name", "main");
        raw.put("symbol_type", "function");
        raw.put("last_modified", "2024-05-01T10:15:30Z");

        ChunkMetadata metadata = ChunkMetadataMapper.fromMap(raw);

        assertEquals("src/main/App.java", metadata.filePath());
        assertEquals(10, metadata.startLine());
        assertEquals(24, metadata.endLine());
        assertEquals("main", metadata.symbolName());
        assertEquals(SymbolType.FUNCTION, metadata.symbolType());
        assertEquals(Instant.parse("2024-05-01T10:15:30Z"), metadata.date());
    }

    @Test
    void prefersCamelCaseAndIgnoresMalformedValues() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("url", "https://docs.example.com");
        raw.put("source_url", "https://ignored.example.com");
        raw.put("startLine", "ten");
        raw.put("symbolType", "lambda");
        raw.put("date", "yesterday");

        ChunkMetadata metadata = ChunkMetadataMapper.fromMap(raw);

        assertEquals("https://docs.example.com", metadata.url());
        assertNull(metadata.startLine());
        assertNull(metadata.symbolType());
        assertNull(metadata.date());
    }

    @Test
    void emptyInputMapsToEmptyMetadata() {
        assertSame(ChunkMetadata.empty(), ChunkMetadataMapper.fromMap(null));
        assertSame(ChunkMetadata.empty(), ChunkMetadataMapper.fromMap(Map.of()));
    }
}
