package com.edge.astrometry.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI edgeAstrometryOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge Astrometry API")
                        .description("""
                                天体测量标定服务 API 文档

                                ## 功能概述

                                输入探测器源星表和参考星表，求解全局旋转/平移、逐 tile 的中心与 CD 矩阵改正，
                                以及可选的低阶畸变，并给出匹配质量指标。

                                ### 标定模式
                                | 模式 | 执行到的阶段 |
                                |------|------|
                                | `shift` | 只求整体平移 |
                                | `rotation` | 旋转网格搜索 + 全局精修 |
                                | `otashift` | + 逐 tile 中心改正 |
                                | `otashear` | + 逐 tile CD 矩阵（推荐） |
                                | `distortion` | + 逐 tile 畸变系数 |

                                ### API 响应格式
                                所有接口返回统一的 JSON 格式：
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                标定失败（无重叠、显著性不足）仍返回 success，`data.validSolution = false`。
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Edge Astrometry Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有接口添加统一的响应示例
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> {
            if (openApi.getPaths() == null) {
                return;
            }
            openApi.getPaths().forEach((path, pathItem) -> {
                if (pathItem.getGet() != null) {
                    pathItem.getGet().getResponses().addApiResponse("200", createSuccessResponse());
                }
                if (pathItem.getPost() != null) {
                    pathItem.getPost().getResponses().addApiResponse("200", createSuccessResponse());
                    pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
                }
            });
        };
    }

    private ApiResponse createSuccessResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态: success/error").example("success"),
                "data", new Schema<>().type("object").description("响应数据"),
                "message", new Schema<>().type("string").description("消息（可选）")
        ));

        return new ApiResponse()
                .description("成功")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("Source catalog is required")
        ));

        return new ApiResponse()
                .description("请求错误")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
