package com.edge.astrometry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-astrometry")
public class AstrometryConfig {
    private SystemConfig system = new SystemConfig();
    private PreprocessConfig preprocess = new PreprocessConfig();
    private ReferenceConfig reference = new ReferenceConfig();
    private SearchConfig search = new SearchConfig();
    private RefineConfig refine = new RefineConfig();

    @Data
    public static class SystemConfig {
        private String deviceId = "edge-astrometry";
        private int workerThreads = 0;   // 0 = CPU 核数
        private boolean parallel = true;
        private boolean saveLocal = true;
        private String dataDir = "data";
    }

    @Data
    public static class PreprocessConfig {
        private double minFwhmArcsec = 0.3;
        private double maxMagError = 0.3;
        private double isolationRadiusArcsec = 10;
        private int maxSources = 1500;
    }

    @Data
    public static class ReferenceConfig {
        private int maxSources = 2000;
        private double isolationStartArcsec = 8;
        private double isolationMinArcsec = 10;
        private double isolationStepArcsec = 2;
        // 参考星表检索半径 = extraRadiusDeg + 最大指向误差
        private double extraRadiusDeg = 0.8;
    }

    @Data
    public static class SearchConfig {
        private List<Double> pointingErrorsArcmin = new ArrayList<>(Arrays.asList(3.0, 5.0, 7.0));
        private double rotatorMinDeg = -3.0;
        private double rotatorMaxDeg = 3.5;
        private double angleStepArcmin = 20;
        private double votingRadiusArcsec = 5;
        private double minContrast = 3.0;
    }

    @Data
    public static class RefineConfig {
        private double globalMatchRadiusArcsec = 5;
        private int globalMinMatches = 4;
        private double tileShiftRadiusArcsec = 3;
        private int tileShiftMinSample = 4;
        private double tileShearRadiusArcsec = 3;
        private int tileShearMinSample = 9;
        private double distortionRadiusArcsec = 2;
        private int distortionMinSample = 14;
        private double finalMatchRadiusArcsec = 2;
        private int maxIterations = 500;
        private int maxEvaluations = 2000;
    }
}
