package org.nowstart.copytrade.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class CopyTradeApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public CopyTradeApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}
