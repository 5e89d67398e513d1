package com.edge.astrometry.controller;

import com.edge.astrometry.dto.CalibrationRequest;
import com.edge.astrometry.dto.CalibrationResponse;
import com.edge.astrometry.model.CalibrationRecord;
import com.edge.astrometry.service.CalibrationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * 天体测量标定控制器
 */
@RestController
@RequestMapping("/api/calibration")
@Tag(name = "天体测量标定", description = "源星表与参考星表交叉匹配，求解指向偏移、旋转及各 tile 的 WCS 修正")
public class CalibrationController {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationController.class);

    @Autowired
    private CalibrationService calibrationService;

    /**
     * 执行一次标定
     */
    @PostMapping("/solve")
    @Operation(
            summary = "执行标定",
            description = """
                    提交源星表（可附带参考星表和 tile WCS），按指定模式求解。

                    **模式**：
                    | 模式 | 说明 |
                    |------|------|
                    | shift | 只求整体平移 |
                    | rotation | 平移 + 旋转 |
                    | otashift | 再逐 tile 修正中心 |
                    | otashear | 再逐 tile 修正中心与线性项（默认）|
                    | distortion | 再逐 tile 拟合畸变低阶项 |

                    没有找到可信解时 `validSolution` 为 false，`reason` 给出原因，HTTP 状态仍为 200。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "标定完成",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "id": "6f1c...",
                                                "validSolution": true,
                                                "mode": "otashear",
                                                "finalStage": "DONE",
                                                "angleDeg": 1.502,
                                                "shiftRaArcsec": 3.1,
                                                "shiftDecArcsec": -1.9,
                                                "votes": 471,
                                                "contrast": 117.75,
                                                "quality": {"RMS": 0.21, "STARCOUNT": 468}
                                              }
                                            }
                                            """
                            )
                    )
            ),
            @ApiResponse(responseCode = "400", description = "请求参数错误（缺少源星表、未知模式等）")
    })
    public ResponseEntity<Map<String, Object>> solve(@RequestBody CalibrationRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            CalibrationResponse result = calibrationService.calibrate(request);
            response.put("status", "success");
            response.put("data", result);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            logger.warn("标定请求无效: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Calibration failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    @GetMapping("/config")
    @Operation(summary = "获取当前标定配置", description = "返回 application.yml 中 edge-astrometry 下的生效配置。")
    public ResponseEntity<Map<String, Object>> getConfig() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", calibrationService.getEffectiveSettings());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/history")
    @Operation(summary = "标定历史", description = "按时间倒序返回最近的标定记录。")
    public ResponseEntity<Map<String, Object>> getHistory(
            @Parameter(description = "返回条数上限", example = "20")
            @RequestParam(defaultValue = "20") int limit) {
        Map<String, Object> response = new HashMap<>();
        try {
            List<CalibrationRecord> records = calibrationService.history(limit);
            response.put("status", "success");
            response.put("data", records);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to load calibration history", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    @GetMapping("/history/{id}")
    @Operation(summary = "查询单条标定记录")
    public ResponseEntity<Map<String, Object>> getRecord(
            @Parameter(description = "标定记录 ID") @PathVariable String id) {
        Map<String, Object> response = new HashMap<>();
        Optional<CalibrationRecord> record = calibrationService.findById(id);
        if (record.isEmpty()) {
            response.put("status", "error");
            response.put("message", "Calibration record not found: " + id);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        response.put("status", "success");
        response.put("data", record.get());
        return ResponseEntity.ok(response);
    }
}
