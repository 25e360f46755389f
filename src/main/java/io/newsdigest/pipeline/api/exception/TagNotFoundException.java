package io.newsdigest.pipeline.api.exception;

import java.util.Map;

public class TagNotFoundException extends PipelineException {

    public TagNotFoundException(long tagId) {
        super("Tag with ID " + tagId + " not found", "TAG_NOT_FOUND", Map.of("tag_id", tagId), null);
    }
}
