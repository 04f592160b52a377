package com.gatediscovery.engine.exception;

public class MergeSuggestionNotFoundException extends BusinessException {

    public MergeSuggestionNotFoundException(Long suggestionId) {
        super(ErrorCode.MERGE_SUGGESTION_NOT_FOUND, "Merge suggestion not found: " + suggestionId);
    }
}
