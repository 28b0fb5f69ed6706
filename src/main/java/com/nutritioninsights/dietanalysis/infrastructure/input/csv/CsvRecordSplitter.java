package com.nutritioninsights.dietanalysis.infrastructure.input.csv;

import com.nutritioninsights.dietanalysis.application.common.error.IngestException;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * CSV 입력을 레코드(행) 단위 원문으로 자른다.
 * <p>
 * 따옴표로 감싼 셀 안의 줄바꿈은 같은 레코드로 이어 붙인다.
 * 따옴표는 셀 시작에서만 열리고, 따옴표 안의 {@code ""}는 이스케이프로 본다.
 * 공백뿐인 줄은 건너뛴다.
 */
final class CsvRecordSplitter implements Closeable {

    private final Path path;
    private final BufferedReader reader;

    CsvRecordSplitter(Path path, BufferedReader reader) {
        this.path = path;
        this.reader = reader;
    }

    /**
     * 다음 레코드 원문을 읽는다.
     *
     * @return 레코드 원문(줄바꿈 문자 제외), 입력 끝이면 null
     * @throws IOException     입력을 읽지 못한 경우
     * @throws IngestException 따옴표가 닫히지 않은 채 입력이 끝난 경우
     */
    String next() throws IOException {
        String line;
        do {
            line = reader.readLine();
            if (line == null) {
                return null;
            }
        } while (line.isBlank());

        StringBuilder record = new StringBuilder(line);
        boolean quoted = endsInsideQuotes(line, false);
        while (quoted) {
            String more = reader.readLine();
            if (more == null) {
                throw new IngestException("Unterminated quoted field at end of input: " + path, "INPUT_UNREADABLE");
            }
            record.append('\n').append(more);
            quoted = endsInsideQuotes(more, true);
        }
        return record.toString();
    }

    /**
     * 한 줄을 훑은 뒤 따옴표 안에 머물러 있는지 판단한다.
     *
     * @param line   물리적 한 줄
     * @param quoted 줄 시작 시점에 따옴표 안인지
     */
    static boolean endsInsideQuotes(String line, boolean quoted) {
        boolean fieldStart = !quoted;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        quoted = false;
                    }
                }
                fieldStart = false;
            } else {
                if (c == '"' && fieldStart) {
                    quoted = true;
                }
                fieldStart = c == ',';
            }
        }
        return quoted;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
