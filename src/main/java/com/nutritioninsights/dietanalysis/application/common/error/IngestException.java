package com.nutritioninsights.dietanalysis.application.common.error;

/**
 * 입력 파일을 읽을 수 없을 때 발생하는 예외.
 *
 * <p>파일 없음, 읽기 실패, 헤더 누락/필수 컬럼 누락이 해당된다.</p>
 */
public class IngestException extends DietAnalysisException {

    /** 종료 코드 */
    public static final int EXIT_CODE = 2;

    public IngestException(String message, String code) {
        super(message, code);
    }

    public IngestException(String message, String code, Throwable cause) {
        super(message, code, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
