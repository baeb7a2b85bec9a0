package com.crossbot.service;

import com.crossbot.config.CrossbotConfig;
import com.crossbot.runtime.ReplyOption;
import com.crossbot.runtime.RuntimeMessages;
import com.crossbot.runtime.ScenarioReply;
import com.crossbot.runtime.session.AutoResponseTimers;
import com.crossbot.scenario.compile.ClassifierVocabulary;
import com.crossbot.scenario.store.InMemoryScenarioStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScenarioBootstrapTest {

    private static final String TWO_ROOTS = """
            Level1,Level2
            Orders,Status
            Support,Hours
            """;

    private static final SessionStateSetter NO_SESSIONS = (sessionId, definitionId, nodeId) -> { };
    private static final NotificationTrigger NO_NOTIFICATIONS = (definitionId, sessionId, action, config) -> { };

    @Test
    void memoryStoreIsTheDefault() {
        try (ScenarioServiceContext ctx = ScenarioBootstrap.initialize(CrossbotConfig.builder().build(),
                NO_SESSIONS, NO_NOTIFICATIONS)) {
            assertInstanceOf(InMemoryScenarioStore.class, ctx.getStore());
            assertTrue(ctx.getService().listDefinitionIds().isEmpty());
        }
    }

    @Test
    void configuredMessagesReachTheRuntime() {
        CrossbotConfig config = CrossbotConfig.builder()
                .welcomeMessage("Pick a topic")
                .restartLabel("Back to menu")
                .build();
        try (ScenarioServiceContext ctx = ScenarioBootstrap.initialize(config, NO_SESSIONS, NO_NOTIFICATIONS)) {
            ScenarioService service = ctx.getService();
            String id = service.importTabular("topics", TWO_ROOTS).getDefinitionId();

            ScenarioReply welcome = service.initialOptions(id);
            assertEquals("Pick a topic", welcome.getMessages().get(0).getContent());

            ScenarioReply leaf = service.select(id, "s1", "1");
            assertEquals(List.of(ReplyOption.restart("Back to menu")), leaf.getOptions());
        }
    }

    @Test
    void defaultMessagesWhenNothingConfigured() {
        RuntimeMessages messages = ScenarioBootstrap.runtimeMessages(CrossbotConfig.builder().build(),
                ClassifierVocabulary.defaults());
        assertEquals(RuntimeMessages.DEFAULT_WELCOME, messages.getWelcomeMessage());
        assertEquals(RuntimeMessages.DEFAULT_RETURN_LABEL, messages.getReturnLabel());
    }

    @Test
    void timersFollowTheConfiguredThreadCount() {
        CrossbotConfig config = CrossbotConfig.builder().autoResponseThreads(1).build();
        try (ScenarioServiceContext ctx = ScenarioBootstrap.initialize(config, NO_SESSIONS, NO_NOTIFICATIONS);
             AutoResponseTimers timers = ctx.newAutoResponseTimers(sessionId -> sessionId.equals("waiting"))) {
            assertTrue(timers.schedule("waiting", Duration.ofMinutes(5), () -> { }));
            assertEquals(1, timers.pending("waiting"));
            assertEquals(1, timers.onActivity("waiting"));
        }
    }
}
