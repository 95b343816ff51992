package com.boardsync.crawl.model;

import java.util.List;

public record PipelineSubmitRequest(List<PipelineJobPayload> jobs, String source) {
}
