package com.tradesignal.shared.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 解析結果：成功時只有 signal，失敗時只有 error，不會同時存在
 */
public final class ParseResult {

    private final ParsedSignal signal;
    private final SignalError error;

    private ParseResult(ParsedSignal signal, SignalError error) {
        this.signal = signal;
        this.error = error;
    }

    public static ParseResult success(ParsedSignal signal) {
        return new ParseResult(Objects.requireNonNull(signal, "signal"), null);
    }

    public static ParseResult failure(ErrorKind kind, String message) {
        return new ParseResult(null, new SignalError(kind, message));
    }

    public boolean isSuccess() {
        return signal != null;
    }

    public Optional<ParsedSignal> getSignal() {
        return Optional.ofNullable(signal);
    }

    public Optional<SignalError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[" + signal + "]" : "ParseResult[" + error + "]";
    }
}
