package com.nutritioninsights.dietanalysis.infrastructure.input.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.nutritioninsights.dietanalysis.application.common.error.IngestException;
import com.nutritioninsights.dietanalysis.config.DietAnalysisProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.StreamSupport;

/**
 * 레시피 CSV 파일을 "한 행씩" 읽기 위한 리더입니다.
 * <p>
 * 헤더를 먼저 읽어 {@link ColumnMapping}의 필수 컬럼이 모두 있는지 확인하고,
 * 이후 데이터 행을 {@link RawRow}로 감싸 lazy하게 방출합니다. 값의 해석/검증은 하지 않습니다.
 * 한 행의 CSV 문법 오류(닫는 따옴표 뒤의 문자 등)는 그 행만 malformed로 표시하고 계속 읽습니다.
 * <p>
 * 리소스 생성/사용/해제는 {@link Flux#using}으로 관리하므로
 * 완료/에러/취소 어느 경우에도 파일 핸들이 닫힙니다.
 */
@Component
public class CsvRowReader {

    private static final Logger log = LoggerFactory.getLogger(CsvRowReader.class);

    private static final char BOM = '\uFEFF';

    private final ObjectReader rowReader;

    private final ColumnMapping columns;

    /**
     * @param csvMapper  CSV 파서
     * @param properties 컬럼 매핑을 포함한 설정
     */
    public CsvRowReader(CsvMapper csvMapper, DietAnalysisProperties properties) {
        this.rowReader = csvMapper.readerFor(String[].class);
        this.columns = properties.columns();
    }

    /**
     * CSV 파일의 데이터 행을 순서대로 {@link Flux}로 반환합니다.
     * <p>
     * 파일은 구독 시점에 열립니다. 파일이 없거나, 읽을 수 없거나, 헤더에 필수 컬럼이 없으면
     * {@link IngestException} 에러 시그널을 방출합니다. 따옴표가 닫히지 않은 채 파일이 끝나도 같습니다.
     * 빈 줄은 행으로 치지 않습니다.
     *
     * @param path 입력 CSV 경로
     * @return 데이터 행을 순차적으로 방출하는 Flux
     */
    public Flux<RawRow> readRows(Path path) {
        return Flux.using(
                () -> open(path),
                cursor -> Flux.fromStream(StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED | Spliterator.NONNULL),
                        false
                )),
                RowCursor::closeQuietly
        );
    }

    private RowCursor open(Path path) {
        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new IngestException("Input file not found: " + path, "INPUT_NOT_FOUND", e);
        } catch (IOException e) {
            throw new IngestException("Input file unreadable: " + path, "INPUT_UNREADABLE", e);
        }

        CsvRecordSplitter records = new CsvRecordSplitter(path, reader);
        RowCursor cursor = null;
        try {
            cursor = new RowCursor(path, records, rowReader, resolveHeader(path, records));
            return cursor;
        } catch (IOException e) {
            throw new IngestException("Input file unreadable: " + path, "INPUT_UNREADABLE", e);
        } finally {
            if (cursor == null) {
                closeAfterFailure(records);
            }
        }
    }

    /**
     * 첫 레코드(헤더)를 읽어 필드별 컬럼 위치를 계산한다.
     */
    private Map<SemanticField, Integer> resolveHeader(Path path, CsvRecordSplitter records) throws IOException {
        String first = records.next();
        if (first == null) {
            throw new IngestException("Input file has no header row: " + path, "HEADER_MISSING");
        }
        String[] header = rowReader.readValue(first);

        Map<String, Integer> indexByName = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i];
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            indexByName.putIfAbsent(name.trim(), i);
        }

        Map<SemanticField, Integer> positions = new EnumMap<>(SemanticField.class);
        List<String> missing = new ArrayList<>();
        columns.byField().forEach((field, column) -> {
            Integer idx = indexByName.get(column);
            if (idx == null) {
                missing.add(column);
            } else {
                positions.put(field, idx);
            }
        });

        if (!missing.isEmpty()) {
            throw new IngestException(
                    "Input header is missing required columns " + missing + ": " + path,
                    "HEADER_MISSING_COLUMNS"
            );
        }
        log.debug("Header of {} resolved: {}", path, positions);
        return positions;
    }

    private static void closeAfterFailure(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.warn("Failed to close input after open failure: {}", e.getMessage());
        }
    }

    /**
     * 헤더 이후 레코드를 하나씩 파싱해 {@link RawRow}로 변환하며 순회하는 커서.
     * <p>
     * 파싱할 수 없는 레코드는 순번만 가진 malformed 행으로 내보내고 다음 레코드로 넘어간다.
     */
    private static final class RowCursor implements Iterator<RawRow> {

        private final Path path;
        private final CsvRecordSplitter records;
        private final ObjectReader rowReader;
        private final Map<SemanticField, Integer> positions;
        private long rowNumber;
        private RawRow pending;

        private RowCursor(
                Path path,
                CsvRecordSplitter records,
                ObjectReader rowReader,
                Map<SemanticField, Integer> positions
        ) {
            this.path = path;
            this.records = records;
            this.rowReader = rowReader;
            this.positions = positions;
        }

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = advance();
            }
            return pending != null;
        }

        @Override
        public RawRow next() {
            if (!hasNext()) throw new NoSuchElementException();
            RawRow row = pending;
            pending = null;
            return row;
        }

        private RawRow advance() {
            String record;
            try {
                record = records.next();
            } catch (IOException e) {
                throw new IngestException("Input file unreadable: " + path, "INPUT_UNREADABLE", e);
            }
            if (record == null) {
                return null;
            }

            long number = ++rowNumber;
            String[] cells;
            try {
                cells = rowReader.readValue(record);
            } catch (JsonProcessingException e) {
                log.debug("Data row {} of {} is malformed: {}", number, path, e.getOriginalMessage());
                return RawRow.malformedRow(number);
            }
            if (cells == null) {
                return RawRow.malformedRow(number);
            }

            Map<SemanticField, String> values = new EnumMap<>(SemanticField.class);
            positions.forEach((field, idx) -> values.put(field, idx < cells.length ? cells[idx] : null));
            return new RawRow(number, values);
        }

        void closeQuietly() {
            try {
                records.close();
            } catch (IOException e) {
                log.warn("Failed to close input {}: {}", path, e.getMessage());
            }
        }
    }
}
