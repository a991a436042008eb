package com.gdin.radiology.report.llm;

import com.gdin.radiology.report.exception.ProviderException;

/**
 * 单个大模型供应商的最小调用接口
 */
public interface LlmProvider {

    /**
     * 供应商标识，如 gemini / openai / anthropic / qwen
     */
    String getName();

    /**
     * 单轮补全，返回去除首尾空白的文本
     *
     * @throws ProviderException 调用失败，errorType 已完成分类
     */
    String complete(String systemInstruction, String userPrompt) throws ProviderException;
}
