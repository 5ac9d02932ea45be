package com.contentforge.types.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Application exception carrying a {@link com.contentforge.types.enums.ResponseCode} code.
 * <p>
 * Configuration errors, quality gate failures promoted by strict mode and wrapped producer
 * errors are all raised through this type so callers can branch on {@link #getCode()}.
 * </p>
 *
 * @author contentforge
 * @since 2025-03-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** Error code */
    private String code;

    /** Error description */
    private String info;

    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    public AppException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "com.contentforge.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
