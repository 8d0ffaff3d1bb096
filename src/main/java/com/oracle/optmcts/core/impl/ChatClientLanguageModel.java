package com.oracle.optmcts.core.impl;

import com.oracle.optmcts.core.LanguageModelClient;
import com.oracle.optmcts.core.ModelOutputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ChatClientLanguageModel implements LanguageModelClient {

    private final ChatClient.Builder chatClientBuilder;
    private volatile ChatClient chatClient;

    @Override
    public String complete(String prompt, double temperature) {
        if (this.chatClient == null) {
            synchronized (this) {
                if (this.chatClient == null) {
                    this.chatClient = chatClientBuilder.build();
                }
            }
        }

        log.debug("Model call (temperature {}): {} chars", temperature, prompt.length());

        ChatOptions options = ChatOptions.builder()
                .temperature(temperature)
                .build();

        String response = chatClient.prompt()
                .user(prompt)
                .options(options)
                .call()
                .content();

        if (response == null) {
            throw new ModelOutputException("Model returned no content");
        }
        return response;
    }
}
