package com.nutritioninsights.dietanalysis.application.common.error;

import org.springframework.boot.ExitCodeGenerator;

/**
 * 리포트 실행 전체를 중단시키는(run-level) 예외의 공통 부모.
 *
 * <p>에러 구분을 위한 code 값을 함께 보관하며,
 * {@link ExitCodeGenerator}를 구현해 프로세스 종료 코드로 이어지게 한다.</p>
 */
public abstract class DietAnalysisException extends RuntimeException implements ExitCodeGenerator {
    private final String code;

    protected DietAnalysisException(String message, String code) {
        super(message);
        this.code = code;
    }

    protected DietAnalysisException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * 에러 코드를 반환한다.
     *
     * @return 에러 코드
     */
    public String code() {
        return code;
    }
}
