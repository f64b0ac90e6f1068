package com.imperium.riskguide.model.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对话请求：POST /api/chat。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatRequest {

    /** 可选，为空时服务端生成新会话 */
    @Size(max = 100, message = "session_id length must be at most 100")
    private String sessionId;

    @NotBlank(message = "message is required")
    @Size(max = 8000, message = "message length must be 1~8000")
    private String message;
}
