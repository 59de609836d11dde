package com.ekslens.leadmaster.lead.augment;

public class TextAugmentationException extends RuntimeException {
    public TextAugmentationException(String message) {
        super(message);
    }

    public TextAugmentationException(String message, Throwable cause) {
        super(message, cause);
    }
}
