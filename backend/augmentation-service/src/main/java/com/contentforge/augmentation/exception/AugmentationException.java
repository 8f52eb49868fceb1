package com.contentforge.augmentation.exception;

/**
 * 인용/팩트체크 처리 중 발생하는 예외 기본 클래스
 */
public class AugmentationException extends RuntimeException {

    public static final String INVALID_RESEARCH_DATA = "INVALID_RESEARCH_DATA";

    private final String errorCode;

    public AugmentationException(String message) {
        super(message);
        this.errorCode = "AUGMENTATION_ERROR";
    }

    public AugmentationException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "AUGMENTATION_ERROR";
    }

    public AugmentationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
