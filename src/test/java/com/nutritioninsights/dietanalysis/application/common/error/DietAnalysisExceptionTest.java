package com.nutritioninsights.dietanalysis.application.common.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ExitCodeGenerator;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("실행 예외 종료 코드 테스트")
class DietAnalysisExceptionTest {

    @DisplayName("입력 예외는 종료 코드 2, 에러 코드와 원인을 보관하는지 검증")
    @Test
    void ingestException_exitCode2() {
        IOException cause = new IOException("disk");
        IngestException e = new IngestException("Input file unreadable: a.csv", "INPUT_UNREADABLE", cause);

        assertEquals(2, e.getExitCode());
        assertEquals("INPUT_UNREADABLE", e.code());
        assertSame(cause, e.getCause());
    }

    @DisplayName("출력 예외는 종료 코드 3인지 검증")
    @Test
    void exportException_exitCode3() {
        ExitCodeGenerator e = new ExportException("Output directory is not writable: out", "OUTPUT_DIR_UNAVAILABLE");

        assertEquals(3, e.getExitCode());
    }
}
