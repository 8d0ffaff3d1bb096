package com.oracle.optmcts.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

@Configuration
@Slf4j
public class ChatModelConfig {

    /**
     * The one ChatClient.Builder every model call goes through. With optmcts.provider=auto the
     * first configured provider wins: OpenAI, then Anthropic, then Google. Fails fast when the
     * requested provider (or any provider, for auto) has no ChatModel bean, e.g. a missing API key
     * or a spring.ai.model.chat setting that left its auto-configuration off.
     */
    @Bean
    @Primary
    public ChatClient.Builder chatClientBuilder(
            OptMctsConfig config,
            ObjectProvider<OpenAiChatModel> openAiProvider,
            ObjectProvider<AnthropicChatModel> anthropicProvider,
            ObjectProvider<GoogleGenAiChatModel> googleProvider) {

        Map<String, Supplier<ChatModel>> providers = new LinkedHashMap<>();
        providers.put("openai", openAiProvider::getIfAvailable);
        providers.put("anthropic", anthropicProvider::getIfAvailable);
        providers.put("google", googleProvider::getIfAvailable);

        String requested = providerKey(config.getProvider());
        ChatModel model = null;
        String chosen = null;
        if ("auto".equals(requested)) {
            for (Map.Entry<String, Supplier<ChatModel>> entry : providers.entrySet()) {
                model = entry.getValue().get();
                if (model != null) {
                    chosen = entry.getKey();
                    break;
                }
            }
        } else if (providers.containsKey(requested)) {
            model = providers.get(requested).get();
            chosen = requested;
        } else {
            throw new IllegalStateException("Unknown optmcts.provider '" + config.getProvider()
                    + "' (expected auto, openai, anthropic or google)");
        }

        if (model == null) {
            throw new IllegalStateException(
                "No ChatModel bean available for provider '" + requested + "'. Ensure the provider is configured "
                + "(e.g., set spring.ai.openai.api-key/OPENAI_API_KEY or the relevant provider settings) "
                + "and that spring.ai.model.chat names it."
            );
        }

        log.info("Formulation search uses the {} chat model", chosen);
        return ChatClient.builder(model);
    }

    /**
     * Normalizes optmcts.provider, mapping Spring AI's model names onto ours.
     */
    static String providerKey(String configured) {
        if (StringUtils.isBlank(configured)) {
            return "auto";
        }
        String key = configured.trim().toLowerCase(Locale.ROOT);
        return "google-genai".equals(key) ? "google" : key;
    }
}
