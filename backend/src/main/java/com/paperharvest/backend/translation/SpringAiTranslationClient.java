package com.paperharvest.backend.translation;

import com.paperharvest.backend.config.TranslationConfig;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

/**
 * Translates through an OpenAI-compatible chat model
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiTranslationClient implements TranslationClient {

    private static final String SYSTEM_PROMPT = "你是学术翻译助手，输出{targetLanguage}，忠实准确，风格正式。";

    private static final String USER_PROMPT = """
            请将下面英文摘要翻译为{targetLanguage}。
            规则：
            1) 以下术语在本摘要中首次出现时采用：英文术语（中文翻译），之后只保留英文术语，不再重复括号中文：{bilingualTerms}
            2) 以下术语只保留英文术语，不要添加括号中文：{monolingualTerms}
            3) 模型名/方法名/数据集名/缩写：保留英文。
            4) 不要添加原文没有的信息，不要扩写。只输出译文。

            英文摘要：
            """;

    private final ChatModel chatModel;
    private final TranslationConfig translationConfig;

    @Override
    public String translate(String text, TranslationContext context) {
        String system = new PromptTemplate(SYSTEM_PROMPT)
                .render(Map.of("targetLanguage", context.getTargetLanguage()));
        String user = new PromptTemplate(USER_PROMPT).render(Map.of(
                "targetLanguage", context.getTargetLanguage(),
                "bilingualTerms", termList(context.getBilingualTerms()),
                "monolingualTerms", termList(context.getMonolingualTerms()))).stripTrailing()
                // appended after rendering, abstracts may contain template braces
                + "\n" + text;

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(context.getModel())
                .temperature(translationConfig.getTemperature())
                .build();
        Prompt prompt = new Prompt(List.of(new SystemMessage(system), new UserMessage(user)), options);

        try {
            ChatResponse response = chatModel.call(prompt);
            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                throw TranslationException.permanent("Model returned no output", null);
            }
            String output = response.getResult().getOutput().getText();
            return output != null ? output.trim() : "";
        } catch (TransientAiException | ResourceAccessException e) {
            throw TranslationException.transientFailure("Translation call failed: " + e.getMessage(), e);
        } catch (NonTransientAiException e) {
            throw TranslationException.permanent("Translation rejected: " + e.getMessage(), e);
        }
    }

    private static String termList(List<String> terms) {
        return terms == null || terms.isEmpty() ? "（无）" : String.join("; ", terms);
    }
}
