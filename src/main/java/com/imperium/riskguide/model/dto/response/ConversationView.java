package com.imperium.riskguide.model.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConversationView {

    private String conversationId;
    /** 该对话中最晚的事件时间 */
    private LocalDateTime lastInteraction;
    @Builder.Default
    private List<SessionMessageDto> messages = new ArrayList<>();
}
