package com.boardsync.crawl.jobs;

import com.boardsync.crawl.model.AiParseResult;
import com.boardsync.crawl.model.AtsType;

/**
 * Structured extraction from raw page text. Implementations throw {@link AiExtractionException} when the call
 * fails or the result is structurally unusable.
 */
public interface AiJobParser {
    boolean isEnabled();

    AiParseResult parse(String content, String url, AtsType platformHint);
}
