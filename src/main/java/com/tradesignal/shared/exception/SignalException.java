package com.tradesignal.shared.exception;

import com.tradesignal.shared.model.ErrorKind;
import lombok.Getter;

/**
 * 計算階段的錯誤，由 SignalPipelineService 轉成 SignalError 回傳
 */
@Getter
public class SignalException extends RuntimeException {

    private final ErrorKind kind;

    public SignalException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
