package com.nutritioninsights.dietanalysis.application.common.error;

/**
 * 출력 디렉터리를 만들 수 없거나 산출물 파일을 쓸 수 없을 때 발생하는 예외.
 */
public class ExportException extends DietAnalysisException {

    /** 종료 코드 */
    public static final int EXIT_CODE = 3;

    public ExportException(String message, String code) {
        super(message, code);
    }

    public ExportException(String message, String code, Throwable cause) {
        super(message, code, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
