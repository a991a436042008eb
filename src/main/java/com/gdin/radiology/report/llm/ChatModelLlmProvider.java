package com.gdin.radiology.report.llm;

import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.exception.ProviderException;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

/**
 * 基于 langchain4j ChatModel 的供应商适配器，各家 SDK 的差异由 ChatModel 屏蔽
 */
public class ChatModelLlmProvider implements LlmProvider {
    private final String name;
    private final ChatModel chatModel;

    public ChatModelLlmProvider(String name, ChatModel chatModel) {
        this.name = name;
        this.chatModel = chatModel;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String complete(String systemInstruction, String userPrompt) {
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(SystemMessage.from(systemInstruction), UserMessage.from(userPrompt))
                .build();
        ChatResponse chatResponse;
        try {
            chatResponse = chatModel.chat(chatRequest);
        } catch (RuntimeException e) {
            ProviderErrorType errorType = ProviderErrorClassifier.classify(e);
            throw new ProviderException(name, errorType, StrUtil.blankToDefault(e.getMessage(), e.getClass().getSimpleName()), e);
        }
        if (chatResponse == null || chatResponse.aiMessage() == null) return "";
        return StrUtil.trimToEmpty(chatResponse.aiMessage().text());
    }
}
