package com.edge.astrometry.model;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
public class CalibrationRecord {
    private String id;
    private String deviceId;
    private LocalDateTime timestamp;
    private long durationMs;

    private String mode;
    private boolean validSolution;
    private String reason;

    // 全局改正
    private Double angleDeg;
    private Double shiftRaArcsec;
    private Double shiftDecArcsec;
    private double contrast;
    private double backgroundMatches;

    private int sourceCount;
    private int referenceCount;
    private int matchedCount;

    private Map<String, Double> quality;
    private List<String> stages;
}
