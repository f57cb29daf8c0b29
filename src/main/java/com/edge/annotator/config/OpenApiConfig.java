package com.edge.annotator.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
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
    public OpenAPI edgeAnnotatorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge Box Annotator API")
                        .description("""
                                边界框标注编辑 API 文档

                                ### 核心功能
                                - **图片目录**：打开目录、前后切换图片，切换时按配置自动保存
                                - **指针手势**：按下 / 拖动 / 松开，完成新建、移动、缩放
                                - **编辑命令**：选择、删除、复制、设置类别、撤销
                                - **类别管理**：添加类别、设置新建框使用的当前类别

                                ### 坐标约定
                                | 字段 | 坐标系 |
                                |------|--------|
                                | 请求中的 `x` / `y` | 屏幕像素，配合 `viewport{zoom, panX, panY}` 换算 |
                                | 响应中的 `cx` / `cy` / `w` / `h` | 归一化图片坐标 (0.0 - 1.0) |

                                ### 错误码
                                | 错误码 | HTTP | 说明 |
                                |--------|------|------|
                                | `INVALID_REQUEST` | 400 | 参数非法 |
                                | `INVALID_STATE` | 409 | 未打开目录或没有活动图片 |
                                | `SAVE_PERMISSION_DENIED` | 409 | 标注或类别文件无写权限 |
                                | `SAVE_FAILED` | 500 | 其他写文件错误 |
                                """)
                        .version("1.0.0"));
    }

    /**
     * 为所有 POST / PUT 接口添加统一的错误响应示例
     */
    @Bean
    public OpenApiCustomizer errorResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("400", createErrorResponse("请求错误", "INVALID_REQUEST"));
                pathItem.getPost().getResponses().addApiResponse("409", createErrorResponse("状态冲突", "INVALID_STATE"));
            }
            if (pathItem.getPut() != null) {
                pathItem.getPut().getResponses().addApiResponse("400", createErrorResponse("请求错误", "INVALID_REQUEST"));
            }
        });
    }

    private ApiResponse createErrorResponse(String description, String code) {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "success", new Schema<>().type("boolean").example(false),
                "error", new Schema<>().type("string").description("错误码").example(code),
                "message", new Schema<>().type("string").description("错误信息")
        ));

        return new ApiResponse()
                .description(description)
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
