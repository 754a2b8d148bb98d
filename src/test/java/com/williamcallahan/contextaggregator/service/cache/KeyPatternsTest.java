package com.williamcallahan.contextaggregator.service.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

/**
 * Verifies both cache providers treat only {@code *} as a wildcard in invalidation patterns.
 */
class KeyPatternsTest {

    @Test
    void memoryGlobTreatsQuestionMarkAndBracketsLiterally() {
        Pattern pattern = KeyPatterns.compile("ctx:a?[1]*");

        assertTrue(pattern.matcher("ctx:a?[1]").matches());
        assertTrue(pattern.matcher("ctx:a?[1]-tail").matches());
        assertFalse(pattern.matcher("ctx:ab1").matches());
        assertFalse(pattern.matcher("ctx:ax[1]").matches());
    }

    @Test
    void redisMatchEscapesEverySpecialCharacterExceptStar() {
        assertEquals("app:ctx:a\\?\\[1\\]*", KeyPatterns.toRedisMatch("app:ctx:a?[1]*"));
        assertEquals("app:dir\\\\name*", KeyPatterns.toRedisMatch("app:dir\\name*"));
        assertEquals("app:ctx:*", KeyPatterns.toRedisMatch("app:ctx:*"));
    }

    @Test
    void memoryCacheClearDoesNotExpandQuestionMark() {
        CaffeineContextCache cache = new CaffeineContextCache(10);
        cache.set("ctx:a?", CaffeineContextCacheTest.response("req-1"), Duration.ofSeconds(60));
        cache.set("ctx:ab", CaffeineContextCacheTest.response("req-2"), Duration.ofSeconds(60));

        assertEquals(1, cache.clear("ctx:a?"));
        assertTrue(cache.get("ctx:ab").isPresent());
    }
}
