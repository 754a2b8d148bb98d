package com.williamcallahan.contextaggregator.application.context;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.williamcallahan.contextaggregator.domain.context.TokenCounterType;

/**
 * Exact token counts using the {@code cl100k_base} byte-pair encoding.
 */
public class Cl100kTokenCounter implements TokenCounter {
    private final Encoding encoding;

    public Cl100kTokenCounter() {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(EncodingType.CL100K_BASE);
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }

    @Override
    public TokenCounterType type() {
        return TokenCounterType.CL100K;
    }
}
