package com.oracle.optmcts.config;

import org.junit.jupiter.api.Test;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChatModelConfigTest {

    private final StaticListableBeanFactory noModels = new StaticListableBeanFactory();

    private IllegalStateException failureFor(String provider) {
        OptMctsConfig config = new OptMctsConfig();
        config.setProvider(provider);
        return assertThrows(IllegalStateException.class, () -> new ChatModelConfig().chatClientBuilder(config,
                noModels.getBeanProvider(OpenAiChatModel.class),
                noModels.getBeanProvider(AnthropicChatModel.class),
                noModels.getBeanProvider(GoogleGenAiChatModel.class)));
    }

    @Test
    void springAiModelNamesAreAccepted() {
        assertEquals("google", ChatModelConfig.providerKey("google-genai"));
        assertEquals("anthropic", ChatModelConfig.providerKey(" Anthropic "));
        assertEquals("auto", ChatModelConfig.providerKey(null));
        assertEquals("auto", ChatModelConfig.providerKey(""));
    }

    @Test
    void missingModelNamesTheProvider() {
        IllegalStateException e = failureFor("google-genai");

        assertTrue(e.getMessage().contains("provider 'google'"));
        assertTrue(e.getMessage().contains("spring.ai.model.chat"));
    }

    @Test
    void unknownProviderIsRejected() {
        assertTrue(failureFor("mistral").getMessage().startsWith("Unknown optmcts.provider"));
    }

    @Test
    void providerFollowsTheAutoConfiguredChatModel() throws Exception {
        StandardEnvironment environment = new StandardEnvironment();
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        sources.forEach(environment.getPropertySources()::addLast);

        String chatModel = environment.getProperty("spring.ai.model.chat");

        assertNotNull(chatModel);
        assertEquals(chatModel, environment.getProperty("optmcts.provider"));
        assertTrue(Set.of("openai", "anthropic", "google").contains(ChatModelConfig.providerKey(chatModel)));
    }
}
