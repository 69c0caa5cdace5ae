package com.ryuqq.probe.core.outcome;

import com.ryuqq.probe.core.model.ProbeResponse;

/**
 * 한 번의 시도에서 얻은 원시 결과.
 *
 * <p>상태 코드 또는 발생한 예외 중 정확히 하나를 가집니다.</p>
 *
 * @author Probe Team
 * @since 1.0.0
 */
public final class AttemptResult {

    private final Integer statusCode;
    private final Exception error;

    private AttemptResult(Integer statusCode, Exception error) {
        this.statusCode = statusCode;
        this.error = error;
    }

    /**
     * 응답을 받은 시도.
     *
     * @param response 응답
     * @return AttemptResult
     * @throws IllegalArgumentException response가 null인 경우
     */
    public static AttemptResult responded(ProbeResponse response) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        return new AttemptResult(response.statusCode(), null);
    }

    /**
     * 예외로 끝난 시도.
     *
     * @param error 발생한 예외
     * @return AttemptResult
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static AttemptResult threw(Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new AttemptResult(null, error);
    }

    public boolean hasStatus() {
        return statusCode != null;
    }

    /**
     * @return 상태 코드
     * @throws IllegalStateException 예외로 끝난 시도인 경우
     */
    public int statusCode() {
        if (statusCode == null) {
            throw new IllegalStateException("Attempt threw an error and has no status code");
        }
        return statusCode;
    }

    /**
     * @return 발생한 예외
     * @throws IllegalStateException 응답을 받은 시도인 경우
     */
    public Exception error() {
        if (error == null) {
            throw new IllegalStateException("Attempt responded with status " + statusCode + " and has no error");
        }
        return error;
    }

    @Override
    public String toString() {
        return hasStatus() ? "AttemptResult{status=" + statusCode + '}' : "AttemptResult{error=" + error + '}';
    }
}
