package com.edge.astrometry.repository;

import com.edge.astrometry.model.CalibrationRecord;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 标定历史，按日期分文件存储：calibrations/2024-01-15.jsonl
 */
@Repository
public class CalibrationRepository {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationRepository.class);
    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final Gson gson = new GsonBuilder()
            .registerTypeAdapter(LocalDateTime.class, (JsonSerializer<LocalDateTime>) (src, type, context) ->
                    new JsonPrimitive(src.format(ISO_FORMATTER)))
            .registerTypeAdapter(LocalDateTime.class, (JsonDeserializer<LocalDateTime>) (json, type, context) ->
                    LocalDateTime.parse(json.getAsString(), ISO_FORMATTER))
            .serializeSpecialFloatingPointValues()
            .create();

    private final boolean saveLocal;
    private final Path dataDir;
    private Path recordsDir;
    private Path idIndexFile;     // ID -> 日期映射索引 (格式: id,日期)

    public CalibrationRepository(@Value("${edge-astrometry.system.save-local:true}") boolean saveLocal,
                                 @Value("${edge-astrometry.system.data-dir:data}") String dataDir) {
        this.saveLocal = saveLocal;
        this.dataDir = Paths.get(dataDir);
    }

    @PostConstruct
    public void init() {
        if (saveLocal) {
            recordsDir = dataDir.resolve("calibrations");
            idIndexFile = dataDir.resolve("calibration_index.txt");
            try {
                Files.createDirectories(recordsDir);
                if (!Files.exists(idIndexFile)) {
                    Files.createFile(idIndexFile);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed to initialize calibration store at " + dataDir, e);
            }
        }
    }

    public boolean isSaveLocal() {
        return saveLocal;
    }

    private Path getRecordsFileForDate(LocalDate date) {
        return recordsDir.resolve(date.toString() + ".jsonl");
    }

    /**
     * 追加一条记录（没有 id 时生成）
     */
    public CalibrationRecord insert(CalibrationRecord record) {
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        if (record.getTimestamp() == null) {
            record.setTimestamp(LocalDateTime.now());
        }
        if (!saveLocal) {
            return record;
        }

        LocalDate date = record.getTimestamp().toLocalDate();
        try (BufferedWriter writer = Files.newBufferedWriter(getRecordsFileForDate(date),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(gson.toJson(record));
            writer.newLine();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write calibration record", e);
        }

        try {
            Files.writeString(idIndexFile, record.getId() + "," + date + "\n",
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            // 索引更新失败不影响主流程，findById 会退回到全量扫描
            logger.warn("Failed to update calibration index: {}", e.getMessage());
        }
        return record;
    }

    /**
     * 根据 ID 查找（优先用索引定位日期文件）
     */
    public Optional<CalibrationRecord> findById(String id) {
        if (!saveLocal) {
            return Optional.empty();
        }
        Optional<LocalDate> date = findDateById(id);
        if (date.isPresent()) {
            Optional<CalibrationRecord> found = readFile(getRecordsFileForDate(date.get())).stream()
                    .filter(r -> id.equals(r.getId()))
                    .findFirst();
            if (found.isPresent()) {
                return found;
            }
        }
        return findRecent(Integer.MAX_VALUE).stream()
                .filter(r -> id.equals(r.getId()))
                .findFirst();
    }

    private Optional<LocalDate> findDateById(String id) {
        if (!Files.exists(idIndexFile)) {
            return Optional.empty();
        }
        try (Stream<String> lines = Files.lines(idIndexFile)) {
            return lines
                    .filter(line -> !line.trim().isEmpty())
                    .map(line -> line.split(","))
                    .filter(parts -> parts.length == 2 && id.equals(parts[0]))
                    .map(parts -> LocalDate.parse(parts[1]))
                    .findFirst();
        } catch (IOException e) {
            logger.warn("Failed to read calibration index: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 最近的 limit 条记录，最新的在前
     */
    public List<CalibrationRecord> findRecent(int limit) {
        if (!saveLocal || !Files.exists(recordsDir) || limit <= 0) {
            return Collections.emptyList();
        }

        List<Path> dateFiles;
        try (Stream<Path> files = Files.list(recordsDir)) {
            dateFiles = files
                    .filter(p -> p.toString().endsWith(".jsonl"))
                    .sorted(Comparator.reverseOrder())  // 文件名本身就是日期
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Failed to list calibration records: {}", e.getMessage());
            return Collections.emptyList();
        }

        List<CalibrationRecord> results = new ArrayList<>();
        for (Path file : dateFiles) {
            if (results.size() >= limit) {
                break;
            }
            List<CalibrationRecord> batch = readFile(file);
            Collections.reverse(batch);   // 文件末尾是最新
            int needed = limit - results.size();
            results.addAll(batch.size() <= needed ? batch : batch.subList(0, needed));
        }
        return results;
    }

    public long count() {
        if (!saveLocal || !Files.exists(recordsDir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(recordsDir)) {
            return files
                    .filter(p -> p.toString().endsWith(".jsonl"))
                    .mapToLong(file -> readFile(file).size())
                    .sum();
        } catch (IOException e) {
            logger.warn("Failed to count calibration records: {}", e.getMessage());
            return 0;
        }
    }

    private List<CalibrationRecord> readFile(Path file) {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try (Stream<String> lines = Files.lines(file)) {
            return lines
                    .filter(line -> !line.trim().isEmpty())
                    .map(this::parse)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    private CalibrationRecord parse(String line) {
        try {
            return gson.fromJson(line, CalibrationRecord.class);
        } catch (RuntimeException e) {
            logger.warn("Skipping malformed calibration record: {}", e.getMessage());
            return null;
        }
    }
}
